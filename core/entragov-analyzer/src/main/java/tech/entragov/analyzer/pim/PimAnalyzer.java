package tech.entragov.analyzer.pim;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.entragov.analyzer.config.AnalysisSettings;
import tech.entragov.analyzer.exception.AnalysisException;
import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.Violation;
import tech.entragov.analyzer.model.ViolationKind;
import tech.entragov.sdk.dto.RoleActivation;
import tech.entragov.sdk.dto.RoleAssignment;
import tech.entragov.sdk.enums.AssignmentType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Detects privileged access that bypasses just-in-time activation.
 *
 * <ul>
 *   <li>standing access: an active privileged assignment that never ends or ends beyond
 *       the standing-access horizon</li>
 *   <li>excessive roles: a principal holding at least the threshold of distinct
 *       privileged roles in effect, HIGH at twice the threshold</li>
 *   <li>dormant eligibility: an eligible assignment not activated within the lookback
 *       window; assignments that started inside the window are exempt</li>
 * </ul>
 */
@ApplicationScoped
public class PimAnalyzer {

    private static final Logger LOG = Logger.getLogger(PimAnalyzer.class);

    private final AnalysisSettings settings;

    @Inject
    public PimAnalyzer(AnalysisSettings settings) {
        this.settings = settings;
    }

    public PimReport analyze(List<RoleAssignment> assignments, List<RoleActivation> activations, Instant now) {
        validate(assignments);

        List<Violation> violations = new ArrayList<>();
        violations.addAll(standingAccess(assignments, now));
        violations.addAll(excessiveAssignments(assignments, now));
        violations.addAll(dormantEligibility(assignments, activations, now));
        violations.sort(Violation.REPORT_ORDER);

        int eligible = count(assignments, AssignmentType.ELIGIBLE);
        int active = count(assignments, AssignmentType.ACTIVE);
        List<RoleUsage> usage = privilegedRoleUsage(assignments);
        int score = complianceScore(violations);

        LOG.debugf("PIM: %d eligible, %d active, %d violations, compliance %d",
            eligible, active, violations.size(), score);

        return new PimReport(
            score,
            eligible,
            active,
            activations.size(),
            usage,
            activationsByRole(assignments, activations),
            List.copyOf(violations),
            recommendations(violations, eligible, active));
    }

    /**
     * {@code 100 - sum(kindWeight * severityWeight)}, rounded and clamped to 0-100.
     */
    public int complianceScore(List<Violation> violations) {
        double penalty = violations.stream()
            .mapToDouble(v -> settings.kindWeight(v.kind()) * settings.severityWeight(v.severity()))
            .sum();
        return (int) Math.max(0, Math.min(100, Math.round(100 - penalty)));
    }

    private List<Violation> standingAccess(List<RoleAssignment> assignments, Instant now) {
        Instant horizon = now.plus(settings.standingAccessHorizon());
        List<Violation> violations = new ArrayList<>();
        for (RoleAssignment assignment : assignments) {
            if (assignment.assignmentType() != AssignmentType.ACTIVE || !isPrivileged(assignment)) {
                continue;
            }
            if (assignment.end() == null || assignment.end().isAfter(horizon)) {
                String until = assignment.end() == null ? "permanently" : "until " + assignment.end();
                violations.add(new Violation(ViolationKind.STANDING_ADMIN_ACCESS, Severity.HIGH,
                    "assignment:" + assignment.id(),
                    "Principal " + assignment.principalId() + " holds " + roleLabel(assignment)
                        + " actively " + until,
                    "Convert to an eligible assignment with just-in-time activation"));
            }
        }
        return violations;
    }

    private List<Violation> excessiveAssignments(List<RoleAssignment> assignments, Instant now) {
        Map<String, Set<String>> rolesByPrincipal = new TreeMap<>();
        for (RoleAssignment assignment : assignments) {
            if (assignment.principalId() != null && isPrivileged(assignment) && assignment.isInEffectAt(now)) {
                rolesByPrincipal.computeIfAbsent(assignment.principalId(), k -> new TreeSet<>())
                    .add(roleLabel(assignment));
            }
        }

        int threshold = settings.excessiveRoleThreshold();
        List<Violation> violations = new ArrayList<>();
        rolesByPrincipal.forEach((principal, roles) -> {
            if (roles.size() >= threshold) {
                Severity severity = roles.size() >= threshold * 2 ? Severity.HIGH : Severity.MEDIUM;
                violations.add(new Violation(ViolationKind.EXCESSIVE_ROLE_ASSIGNMENTS, severity,
                    "principal:" + principal,
                    roles.size() + " privileged roles in effect: " + String.join(", ", roles),
                    "Review whether every role is needed and apply least privilege"));
            }
        });
        return violations;
    }

    private List<Violation> dormantEligibility(List<RoleAssignment> assignments,
                                               List<RoleActivation> activations, Instant now) {
        Duration lookback = settings.dormancyLookback();
        Instant windowStart = now.minus(lookback);

        Set<String> activated = new HashSet<>();
        for (RoleActivation activation : activations) {
            Instant at = activation.createdAt();
            if (at != null && !at.isBefore(windowStart) && !at.isAfter(now)) {
                activated.add(activation.principalId() + "|" + activation.roleId());
            }
        }

        List<Violation> violations = new ArrayList<>();
        for (RoleAssignment assignment : assignments) {
            if (assignment.assignmentType() != AssignmentType.ELIGIBLE) {
                continue;
            }
            boolean startedInWindow = assignment.start() != null && assignment.start().isAfter(windowStart);
            if (startedInWindow || activated.contains(assignment.principalId() + "|" + assignment.roleId())) {
                continue;
            }
            violations.add(new Violation(ViolationKind.DORMANT_ELIGIBILITY, Severity.LOW,
                "assignment:" + assignment.id(),
                "Principal " + assignment.principalId() + " has not activated " + roleLabel(assignment)
                    + " in the last " + lookback.toDays() + " days",
                "Remove the eligibility if the role is no longer needed"));
        }
        return violations;
    }

    private List<RoleUsage> privilegedRoleUsage(List<RoleAssignment> assignments) {
        Map<String, int[]> counts = new TreeMap<>();
        for (RoleAssignment assignment : assignments) {
            if (!isPrivileged(assignment)) {
                continue;
            }
            int[] pair = counts.computeIfAbsent(roleLabel(assignment), k -> new int[2]);
            pair[assignment.assignmentType() == AssignmentType.ELIGIBLE ? 0 : 1]++;
        }
        return counts.entrySet().stream()
            .map(e -> new RoleUsage(e.getKey(), e.getValue()[0], e.getValue()[1], e.getValue()[0] > 0))
            .toList();
    }

    private Map<String, Integer> activationsByRole(List<RoleAssignment> assignments,
                                                   List<RoleActivation> activations) {
        Map<String, String> names = new HashMap<>();
        assignments.stream()
            .filter(a -> a.roleId() != null && a.roleName() != null)
            .forEach(a -> names.putIfAbsent(a.roleId(), a.roleName()));

        Map<String, Integer> byRole = new TreeMap<>();
        for (RoleActivation activation : activations) {
            String role = names.getOrDefault(activation.roleId(), activation.roleId());
            if (role != null) {
                byRole.merge(role, 1, Integer::sum);
            }
        }
        return byRole;
    }

    private List<String> recommendations(List<Violation> violations, int eligible, int active) {
        List<String> recommendations = new ArrayList<>();
        long standing = violations.stream().filter(v -> v.kind() == ViolationKind.STANDING_ADMIN_ACCESS).count();
        if (standing > 0) {
            recommendations.add(standing + " standing admin assignments. Convert them to eligible assignments.");
        }
        if (eligible == 0) {
            recommendations.add("No eligible assignments. Use PIM for just-in-time privileged access.");
        } else if (eligible < active) {
            recommendations.add("More active (" + active + ") than eligible (" + eligible
                + ") assignments. Move more roles to eligible assignments.");
        }
        long excessive = violations.stream()
            .filter(v -> v.kind() == ViolationKind.EXCESSIVE_ROLE_ASSIGNMENTS)
            .count();
        if (excessive > 0) {
            recommendations.add(excessive + " principals hold " + settings.excessiveRoleThreshold()
                + "+ privileged roles. Review for least privilege.");
        }
        return List.copyOf(recommendations);
    }

    private boolean isPrivileged(RoleAssignment assignment) {
        return settings.isPrivileged(assignment.roleId(), assignment.roleName());
    }

    private static String roleLabel(RoleAssignment assignment) {
        return assignment.roleName() != null ? assignment.roleName() : assignment.roleId();
    }

    private static int count(List<RoleAssignment> assignments, AssignmentType type) {
        return (int) assignments.stream().filter(a -> a.assignmentType() == type).count();
    }

    private static void validate(List<RoleAssignment> assignments) {
        for (RoleAssignment assignment : assignments) {
            if (assignment.id() == null) {
                throw AnalysisException.missingField("role assignment", "id", assignment.principalId());
            }
            if (assignment.roleId() == null) {
                throw AnalysisException.missingField("role assignment", "role id", assignment.id());
            }
            if (assignment.assignmentType() == null) {
                throw AnalysisException.missingField("role assignment", "assignment type", assignment.id());
            }
        }
    }
}
