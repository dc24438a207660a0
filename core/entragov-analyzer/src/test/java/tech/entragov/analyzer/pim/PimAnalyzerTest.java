package tech.entragov.analyzer.pim;

import org.junit.jupiter.api.Test;
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
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PimAnalyzerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
    private static final String GLOBAL_ADMIN = "Global Administrator";

    private final PimAnalyzer analyzer = new PimAnalyzer(AnalysisSettings.defaults());

    private static RoleAssignment active(String id, String principal, String role, Instant end) {
        return new RoleAssignment(id, principal, "id-" + role, role, AssignmentType.ACTIVE,
            NOW.minus(Duration.ofDays(400)), end);
    }

    private static RoleAssignment eligible(String id, String principal, String role, Instant start) {
        return new RoleAssignment(id, principal, "id-" + role, role, AssignmentType.ELIGIBLE, start, null);
    }

    private List<Violation> violationsOf(List<RoleAssignment> assignments, List<RoleActivation> activations,
                                         ViolationKind kind) {
        return analyzer.analyze(assignments, activations, NOW).violations().stream()
            .filter(v -> v.kind() == kind)
            .toList();
    }

    @Test
    void shouldFlagPermanentActivePrivilegedAssignment() {
        List<Violation> standing = violationsOf(List.of(active("a1", "u1", GLOBAL_ADMIN, null)), List.of(),
            ViolationKind.STANDING_ADMIN_ACCESS);

        assertThat(standing).singleElement().satisfies(v -> {
            assertThat(v.severity()).isEqualTo(Severity.HIGH);
            assertThat(v.subjectRef()).isEqualTo("assignment:a1");
            assertThat(v.evidence()).contains("permanently");
        });
    }

    @Test
    void shouldAcceptTimeBoundActiveAssignment() {
        assertThat(violationsOf(List.of(active("a1", "u1", GLOBAL_ADMIN, NOW.plus(Duration.ofDays(30)))),
            List.of(), ViolationKind.STANDING_ADMIN_ACCESS)).isEmpty();
    }

    @Test
    void shouldFlagAssignmentEndingBeyondHorizon() {
        assertThat(violationsOf(List.of(active("a1", "u1", GLOBAL_ADMIN, NOW.plus(Duration.ofDays(400)))),
            List.of(), ViolationKind.STANDING_ADMIN_ACCESS)).hasSize(1);
    }

    @Test
    void shouldIgnoreNonPrivilegedRoles() {
        assertThat(violationsOf(List.of(active("a1", "u1", "Reports Reader", null)),
            List.of(), ViolationKind.STANDING_ADMIN_ACCESS)).isEmpty();
    }

    @Test
    void shouldDeductWeightedPenaltyFromCompliance() {
        List<RoleAssignment> assignments = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            assignments.add(active("a" + i, "u" + i, GLOBAL_ADMIN, null));
        }

        PimReport report = analyzer.analyze(assignments, List.of(), NOW);

        // 10 x (2.0 kind weight x 3 for HIGH)
        assertThat(report.complianceScore()).isEqualTo(40);
        assertThat(report.activeAssignments()).isEqualTo(10);
    }

    @Test
    void shouldNeverScoreBelowZero() {
        List<RoleAssignment> assignments = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            assignments.add(active("a" + i, "u" + i, GLOBAL_ADMIN, null));
        }

        assertThat(analyzer.analyze(assignments, List.of(), NOW).complianceScore()).isZero();
    }

    @Test
    void shouldFlagPrincipalsHoldingManyPrivilegedRoles() {
        Instant end = NOW.plus(Duration.ofDays(10));
        List<RoleAssignment> assignments = List.of(
            active("a1", "u1", GLOBAL_ADMIN, end),
            active("a2", "u1", "Security Administrator", end),
            active("a3", "u1", "User Administrator", end),
            active("a4", "u2", GLOBAL_ADMIN, end),
            active("a5", "u2", "Security Administrator", end));

        List<Violation> excessive = violationsOf(assignments, List.of(), ViolationKind.EXCESSIVE_ROLE_ASSIGNMENTS);

        assertThat(excessive).singleElement().satisfies(v -> {
            assertThat(v.subjectRef()).isEqualTo("principal:u1");
            assertThat(v.severity()).isEqualTo(Severity.MEDIUM);
        });
    }

    @Test
    void shouldFlagEligibilityNotActivatedWithinLookback() {
        RoleAssignment old = eligible("e1", "u1", GLOBAL_ADMIN, NOW.minus(Duration.ofDays(200)));
        RoleAssignment used = eligible("e2", "u2", GLOBAL_ADMIN, NOW.minus(Duration.ofDays(200)));
        RoleAssignment recent = eligible("e3", "u3", GLOBAL_ADMIN, NOW.minus(Duration.ofDays(10)));
        RoleAssignment undated = eligible("e4", "u4", GLOBAL_ADMIN, null);
        List<RoleActivation> activations = List.of(
            new RoleActivation("r1", "u2", "id-" + GLOBAL_ADMIN, "selfActivate", NOW.minus(Duration.ofDays(5))),
            new RoleActivation("r2", "u1", "id-" + GLOBAL_ADMIN, "selfActivate", NOW.minus(Duration.ofDays(120))));

        List<Violation> dormant = violationsOf(List.of(old, used, recent, undated), activations,
            ViolationKind.DORMANT_ELIGIBILITY);

        assertThat(dormant).extracting(Violation::subjectRef)
            .containsExactly("assignment:e1", "assignment:e4");
        assertThat(dormant).allMatch(v -> v.severity() == Severity.LOW);
    }

    @Test
    void shouldSummarizeRoleUsageAndActivations() {
        List<RoleAssignment> assignments = List.of(
            active("a1", "u1", GLOBAL_ADMIN, NOW.plus(Duration.ofDays(1))),
            eligible("e1", "u2", GLOBAL_ADMIN, NOW.minus(Duration.ofDays(1))),
            eligible("e2", "u3", "Security Administrator", NOW.minus(Duration.ofDays(1))));
        List<RoleActivation> activations = List.of(
            new RoleActivation("r1", "u2", "id-" + GLOBAL_ADMIN, "selfActivate", NOW.minus(Duration.ofDays(1))));

        PimReport report = analyzer.analyze(assignments, activations, NOW);

        assertThat(report.eligibleAssignments()).isEqualTo(2);
        assertThat(report.activations()).isEqualTo(1);
        assertThat(report.privilegedRoleUsage()).extracting(RoleUsage::role)
            .containsExactly(GLOBAL_ADMIN, "Security Administrator");
        assertThat(report.activationsByRole()).containsEntry(GLOBAL_ADMIN, 1);
    }

    @Test
    void shouldRejectAssignmentWithoutRole() {
        RoleAssignment broken = new RoleAssignment("a1", "u1", null, null, AssignmentType.ACTIVE, null, null);

        assertThatThrownBy(() -> analyzer.analyze(List.of(broken), List.of(), NOW))
            .isInstanceOf(AnalysisException.class)
            .hasMessageContaining("role id");
    }
}
