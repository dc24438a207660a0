package tech.entragov.analyzer.review;

import org.junit.jupiter.api.Test;
import tech.entragov.analyzer.config.AnalysisSettings;
import tech.entragov.analyzer.exception.AnalysisException;
import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.Violation;
import tech.entragov.analyzer.model.ViolationKind;
import tech.entragov.sdk.dto.ReviewDecision;
import tech.entragov.sdk.dto.ReviewInstance;
import tech.entragov.sdk.enums.DecisionOutcome;
import tech.entragov.sdk.enums.ReviewStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class AccessReviewAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final AccessReviewAnalyzer analyzer = new AccessReviewAnalyzer(AnalysisSettings.defaults());

    private static ReviewInstance instance(String id, ReviewStatus status, Instant end, ReviewDecision... decisions) {
        return instance(id, status, end, Set.of(), decisions);
    }

    private static ReviewInstance instance(String id, ReviewStatus status, Instant end, Set<String> reviewers,
                                           ReviewDecision... decisions) {
        Map<String, ReviewDecision> byId = new LinkedHashMap<>();
        for (ReviewDecision decision : decisions) {
            byId.put(decision.id(), decision);
        }
        int completed = (int) byId.values().stream().filter(d -> d.outcome().isDecided()).count();
        return new ReviewInstance(id, "def-" + id, "Review " + id, status, end.minus(Duration.ofDays(14)), end,
            byId.size(), completed, byId, reviewers);
    }

    private static ReviewDecision decision(String id, String reviewer, DecisionOutcome outcome) {
        return new ReviewDecision(id, "principal-" + id, reviewer, outcome);
    }

    @Test
    void shouldComputeOverallCompletionAcrossInstances() {
        ReviewInstance done = instance("i1", ReviewStatus.COMPLETED, NOW.minus(Duration.ofDays(30)),
            decision("d1", "rev1", DecisionOutcome.APPROVE),
            decision("d2", "rev1", DecisionOutcome.DENY));
        ReviewInstance running = instance("i2", ReviewStatus.IN_PROGRESS, NOW.plus(Duration.ofDays(5)),
            decision("d3", "rev2", DecisionOutcome.DONT_KNOW),
            decision("d4", "rev2", DecisionOutcome.NONE));

        ReviewReport report = analyzer.analyze(List.of(running, done), NOW);

        assertThat(report.overallCompletionRate()).isCloseTo(0.75, within(1e-9));
        assertThat(report.instances()).extracting(InstanceCompletion::instanceId).containsExactly("i1", "i2");
        assertThat(report.instances().get(1).completionRate()).isEqualTo(0.5);
        assertThat(report.pendingInstanceIds()).containsExactly("i2");
        assertThat(report.instancesByStatus())
            .containsEntry(ReviewStatus.COMPLETED, 1)
            .containsEntry(ReviewStatus.IN_PROGRESS, 1)
            .containsEntry(ReviewStatus.NOT_STARTED, 0);
    }

    @Test
    void shouldTreatInstanceWithoutDecisionsAsComplete() {
        ReviewReport report = analyzer.analyze(
            List.of(instance("i1", ReviewStatus.IN_PROGRESS, NOW.plus(Duration.ofDays(1)))), NOW);

        assertThat(report.overallCompletionRate()).isEqualTo(1.0);
        assertThat(report.pendingInstanceIds()).isEmpty();
    }

    @Test
    void shouldEscalateOverdueReviewsPastTheWindow() {
        ReviewInstance slightlyLate = instance("i1", ReviewStatus.IN_PROGRESS, NOW.minus(Duration.ofDays(2)),
            decision("d1", "rev1", DecisionOutcome.APPROVE));
        ReviewInstance veryLate = instance("i2", ReviewStatus.NOT_STARTED, NOW.minus(Duration.ofDays(20)),
            decision("d2", "rev1", DecisionOutcome.APPROVE));
        ReviewInstance finished = instance("i3", ReviewStatus.COMPLETED, NOW.minus(Duration.ofDays(20)),
            decision("d3", "rev1", DecisionOutcome.APPROVE));

        List<Violation> overdue = analyzer.analyze(List.of(slightlyLate, veryLate, finished), NOW).violations()
            .stream()
            .filter(v -> v.kind() == ViolationKind.OVERDUE_REVIEW)
            .toList();

        assertThat(overdue).extracting(Violation::subjectRef).containsExactly("review:i1", "review:i2");
        assertThat(overdue).extracting(Violation::severity).containsExactly(Severity.MEDIUM, Severity.HIGH);
    }

    @Test
    void shouldFlagReviewersBelowParticipationThreshold() {
        ReviewInstance review = instance("i1", ReviewStatus.IN_PROGRESS, NOW.plus(Duration.ofDays(3)),
            decision("d1", "rev-busy", DecisionOutcome.APPROVE),
            decision("d2", "rev-busy", DecisionOutcome.APPROVE),
            decision("d3", "rev-idle", DecisionOutcome.APPROVE),
            decision("d4", "rev-idle", DecisionOutcome.NONE),
            decision("d5", null, DecisionOutcome.NONE));

        ReviewReport report = analyzer.analyze(List.of(review), NOW);

        assertThat(report.reviewers()).extracting(ReviewerParticipation::reviewerId)
            .containsExactly("rev-busy", "rev-idle");
        assertThat(report.violations()).singleElement().satisfies(v -> {
            assertThat(v.kind()).isEqualTo(ViolationKind.LOW_REVIEWER_PARTICIPATION);
            assertThat(v.subjectRef()).isEqualTo("reviewer:rev-idle");
            assertThat(v.evidence()).contains("1 of 2");
        });
    }

    @Test
    void shouldAssignUndecidedItemsToContactedReviewers() {
        ReviewInstance review = instance("i1", ReviewStatus.IN_PROGRESS, NOW.plus(Duration.ofDays(3)),
            Set.of("rev1"),
            decision("d1", "rev1", DecisionOutcome.APPROVE),
            decision("d2", null, DecisionOutcome.NONE),
            decision("d3", null, DecisionOutcome.NONE),
            decision("d4", null, DecisionOutcome.NONE),
            decision("d5", null, DecisionOutcome.NONE));

        ReviewReport report = analyzer.analyze(List.of(review), NOW);

        assertThat(report.reviewers()).singleElement().satisfies(reviewer -> {
            assertThat(reviewer.reviewerId()).isEqualTo("rev1");
            assertThat(reviewer.assigned()).isEqualTo(5);
            assertThat(reviewer.decided()).isEqualTo(1);
            assertThat(reviewer.rate()).isCloseTo(0.2, within(1e-9));
        });
        assertThat(report.violations()).extracting(Violation::subjectRef).containsExactly("reviewer:rev1");
    }

    @Test
    void shouldNotChargeContactedReviewersForItemsOthersDecided() {
        ReviewInstance review = instance("i1", ReviewStatus.IN_PROGRESS, NOW.plus(Duration.ofDays(3)),
            Set.of("rev1", "rev2"),
            decision("d1", "rev1", DecisionOutcome.APPROVE),
            decision("d2", "rev1", DecisionOutcome.DENY),
            decision("d3", null, DecisionOutcome.NONE));

        ReviewReport report = analyzer.analyze(List.of(review), NOW);

        assertThat(report.reviewers()).extracting(ReviewerParticipation::reviewerId, ReviewerParticipation::assigned,
                ReviewerParticipation::decided)
            .containsExactly(tuple("rev1", 3, 2), tuple("rev2", 1, 0));
    }

    @Test
    void shouldRejectInstanceWithoutEndDate() {
        ReviewInstance broken = new ReviewInstance("i1", "d", "x", ReviewStatus.IN_PROGRESS, NOW, null, 0, 0, Map.of(), Set.of());

        assertThatThrownBy(() -> analyzer.analyze(List.of(broken), NOW))
            .isInstanceOf(AnalysisException.class)
            .hasMessageContaining("end date");
    }
}
