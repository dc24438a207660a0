package tech.entragov.analyzer.review;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.entragov.analyzer.config.AnalysisSettings;
import tech.entragov.analyzer.exception.AnalysisException;
import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.Violation;
import tech.entragov.analyzer.model.ViolationKind;
import tech.entragov.sdk.dto.ReviewDecision;
import tech.entragov.sdk.dto.ReviewInstance;
import tech.entragov.sdk.enums.ReviewStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Tracks access review completion, overdue instances and reviewer participation.
 */
@ApplicationScoped
public class AccessReviewAnalyzer {

    private static final Logger LOG = Logger.getLogger(AccessReviewAnalyzer.class);

    private final AnalysisSettings settings;

    @Inject
    public AccessReviewAnalyzer(AnalysisSettings settings) {
        this.settings = settings;
    }

    public ReviewReport analyze(List<ReviewInstance> instances, Instant now) {
        instances.forEach(AccessReviewAnalyzer::validate);

        List<ReviewInstance> ordered = instances.stream()
            .sorted(Comparator.comparing(ReviewInstance::id))
            .toList();

        List<InstanceCompletion> completions = new ArrayList<>();
        List<Violation> violations = new ArrayList<>();
        List<String> pending = new ArrayList<>();
        Map<ReviewStatus, Integer> byStatus = new EnumMap<>(ReviewStatus.class);
        for (ReviewStatus status : ReviewStatus.values()) {
            byStatus.put(status, 0);
        }
        long required = 0;
        long completed = 0;

        for (ReviewInstance instance : ordered) {
            completions.add(new InstanceCompletion(instance.id(), instance.displayName(), instance.status(),
                instance.end(), instance.decisionsRequired(), instance.decisionsCompleted(),
                completionRate(instance.decisionsCompleted(), instance.decisionsRequired())));
            required += instance.decisionsRequired();
            completed += instance.decisionsCompleted();
            byStatus.merge(instance.status(), 1, Integer::sum);

            if (instance.status() == ReviewStatus.IN_PROGRESS && instance.decisionsPending() > 0) {
                pending.add(instance.id());
            }
            if (instance.status() != ReviewStatus.COMPLETED && now.isAfter(instance.end())) {
                violations.add(overdue(instance, Duration.between(instance.end(), now)));
            }
        }

        List<ReviewerParticipation> reviewers = participation(ordered);
        for (ReviewerParticipation reviewer : reviewers) {
            if (reviewer.rate() < settings.participationThreshold()) {
                violations.add(new Violation(ViolationKind.LOW_REVIEWER_PARTICIPATION, Severity.LOW,
                    "reviewer:" + reviewer.reviewerId(),
                    String.format("Decided %d of %d assigned items (%.0f%%)",
                        reviewer.decided(), reviewer.assigned(), reviewer.rate() * 100),
                    "Send a reminder and set up escalation to a fallback reviewer"));
            }
        }

        double overall = completionRate(completed, required);
        LOG.debugf("Reviews: %d instances, overall completion %.2f, %d violations",
            (Object) ordered.size(), overall, violations.size());

        return new ReviewReport(
            overall,
            List.copyOf(completions),
            reviewers,
            Collections.unmodifiableMap(byStatus),
            List.copyOf(pending),
            List.copyOf(violations));
    }

    private Violation overdue(ReviewInstance instance, Duration overdueBy) {
        Severity severity = overdueBy.compareTo(settings.overdueEscalation()) > 0 ? Severity.HIGH : Severity.MEDIUM;
        return new Violation(ViolationKind.OVERDUE_REVIEW, severity,
            "review:" + instance.id(),
            "Review '" + instance.displayName() + "' ended " + instance.end() + " with "
                + instance.decisionsPending() + " of " + instance.decisionsRequired() + " decisions pending",
            "Escalate to the review owner and complete or auto-apply the outstanding decisions");
    }

    /**
     * A decided item counts for the reviewer who decided it. An undecided item counts for
     * its named reviewer, or else for every reviewer contacted for the instance.
     */
    private static List<ReviewerParticipation> participation(List<ReviewInstance> instances) {
        Map<String, int[]> byReviewer = new TreeMap<>();
        for (ReviewInstance instance : instances) {
            for (ReviewDecision decision : instance.decisions().values()) {
                boolean decided = decision.outcome() != null && decision.outcome().isDecided();
                if (decision.reviewerId() != null) {
                    count(byReviewer, decision.reviewerId(), decided);
                } else if (!decided) {
                    instance.reviewerIds().forEach(reviewer -> count(byReviewer, reviewer, false));
                }
            }
        }
        return byReviewer.entrySet().stream()
            .map(e -> new ReviewerParticipation(e.getKey(), e.getValue()[0], e.getValue()[1],
                completionRate(e.getValue()[1], e.getValue()[0])))
            .toList();
    }

    private static void count(Map<String, int[]> byReviewer, String reviewer, boolean decided) {
        int[] counts = byReviewer.computeIfAbsent(reviewer, k -> new int[2]);
        counts[0]++;
        if (decided) {
            counts[1]++;
        }
    }

    private static double completionRate(long completed, long required) {
        return required == 0 ? 1.0 : (double) completed / required;
    }

    private static void validate(ReviewInstance instance) {
        if (instance.id() == null) {
            throw AnalysisException.missingField("review instance", "id", instance.displayName());
        }
        if (instance.end() == null) {
            throw AnalysisException.missingField("review instance", "end date", instance.id());
        }
        if (instance.status() == null) {
            throw AnalysisException.missingField("review instance", "status", instance.id());
        }
    }
}
