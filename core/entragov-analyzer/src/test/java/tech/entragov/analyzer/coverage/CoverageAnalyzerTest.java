package tech.entragov.analyzer.coverage;

import org.junit.jupiter.api.Test;
import tech.entragov.analyzer.config.AnalysisSettings;
import tech.entragov.analyzer.exception.AnalysisException;
import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.TenantInventory;
import tech.entragov.analyzer.model.Violation;
import tech.entragov.analyzer.model.ViolationKind;
import tech.entragov.sdk.dto.DirectoryUser;
import tech.entragov.sdk.dto.Policy;
import tech.entragov.sdk.dto.UserScope;
import tech.entragov.sdk.enums.GrantOperator;
import tech.entragov.sdk.enums.PolicyState;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tech.entragov.analyzer.PolicyFixtures.policy;

class CoverageAnalyzerTest {

    private final CoverageAnalyzer analyzer = new CoverageAnalyzer(AnalysisSettings.defaults());

    private static final TenantInventory INVENTORY = new TenantInventory(
        List.of(
            new DirectoryUser("u1", Set.of("g-staff")),
            new DirectoryUser("u2", Set.of("g-staff")),
            new DirectoryUser("u3", Set.of()),
            new DirectoryUser("u4", Set.of())),
        Set.of("app-1", "app-2"),
        Map.of("u4", Set.of("role-ga")));

    @Test
    void shouldScoreFullMarksForStrictAllCoveringPolicy() {
        Policy strict = policy("p1")
            .grant(GrantOperator.AND, "mfa", "compliantDevice")
            .locations("All")
            .session("signInFrequency")
            .build();

        CoverageReport report = analyzer.analyze(List.of(strict), INVENTORY);

        assertThat(report.score()).isEqualTo(100);
        assertThat(report.userCoveragePct()).isEqualTo(100.0);
        assertThat(report.appCoveragePct()).isEqualTo(100.0);
        assertThat(report.coveredUsers()).isEqualTo(4);
        assertThat(report.violations()).isEmpty();
    }

    @Test
    void shouldScoreZeroWithoutEnabledPolicies() {
        Policy disabled = policy("p1").state(PolicyState.DISABLED).build();

        CoverageReport report = analyzer.analyze(List.of(disabled), INVENTORY);

        assertThat(report.score()).isZero();
        assertThat(report.coverageScore()).isZero();
        assertThat(report.policiesByState()).containsEntry(PolicyState.DISABLED, 1).containsEntry(PolicyState.ENABLED, 0);
        assertThat(report.violations())
            .filteredOn(v -> v.kind() == ViolationKind.COVERAGE_GAP)
            .extracting(Violation::subjectRef)
            .containsExactly("users", "application:app-1", "application:app-2");
        assertThat(report.recommendations()).anyMatch(r -> r.contains("Require MFA for all users"));
    }

    @Test
    void shouldCountUsersTargetedThroughGroupsAndRoles() {
        Policy byGroup = policy("p1")
            .users(new UserScope(Set.of(), Set.of(), Set.of("g-staff"), Set.of(), Set.of("role-ga"), Set.of()))
            .build();

        CoverageReport report = analyzer.analyze(List.of(byGroup), INVENTORY);

        assertThat(report.coveredUsers()).isEqualTo(3);
        assertThat(report.userCoveragePct()).isEqualTo(75.0);
        assertThat(report.violations()).anySatisfy(v -> {
            assertThat(v.kind()).isEqualTo(ViolationKind.COVERAGE_GAP);
            assertThat(v.severity()).isEqualTo(Severity.HIGH);
            assertThat(v.subjectRef()).isEqualTo("users");
            assertThat(v.evidence()).startsWith("1 of 4 users");
        });
    }

    @Test
    void shouldReportGapsCoveredOnlyByReportOnlyPolicies() {
        Policy enforced = policy("p1").includeUsers("u1").applications("app-1").build();
        Policy pilot = policy("p2").state(PolicyState.REPORT_ONLY).build();

        CoverageReport report = analyzer.analyze(List.of(enforced, pilot), INVENTORY);

        assertThat(report.violations())
            .filteredOn(v -> v.kind() == ViolationKind.REPORT_ONLY_COVERAGE)
            .extracting(Violation::subjectRef)
            .containsExactlyInAnyOrder("users", "application:app-2");
        assertThat(report.violations())
            .noneMatch(v -> v.kind() == ViolationKind.COVERAGE_GAP);
    }

    @Test
    void shouldTreatEmptyPopulationAsCoveredOnceMfaIsEnforced() {
        TenantInventory empty = TenantInventory.of(List.of(), Set.of());

        CoverageReport enforced = analyzer.analyze(List.of(policy("p1").build()), empty);
        CoverageReport unenforced = analyzer.analyze(List.of(policy("p1").grant(GrantOperator.OR, "compliantDevice").build()), empty);

        assertThat(enforced.userCoveragePct()).isEqualTo(100.0);
        assertThat(unenforced.userCoveragePct()).isZero();
    }

    @Test
    void shouldRateMfaStrictnessByOperator() {
        assertThat(CoverageAnalyzer.mfaStrictness(policy("a").grant(GrantOperator.AND, "mfa", "compliantDevice").build()))
            .isEqualTo(100);
        assertThat(CoverageAnalyzer.mfaStrictness(policy("b").grant(GrantOperator.OR, "mfa").build()))
            .isEqualTo(100);
        assertThat(CoverageAnalyzer.mfaStrictness(policy("c").grant(GrantOperator.OR, "mfa", "compliantDevice").build()))
            .isEqualTo(50);
        assertThat(CoverageAnalyzer.mfaStrictness(policy("d").grant(GrantOperator.AND, "compliantDevice").build()))
            .isZero();
    }

    @Test
    void shouldPenalizeEachExclusion() {
        Policy excluding = policy("p1")
            .users(new UserScope(Set.of(UserScope.ALL), Set.of("breakglass-1", "breakglass-2"),
                Set.of(), Set.of("g-contractors"), Set.of(), Set.of()))
            .build();

        assertThat(CoverageAnalyzer.exclusionMinimality(excluding)).isEqualTo(70.0);
    }

    @Test
    void shouldFlagEnabledPoliciesWithoutSessionControls() {
        CoverageReport report = analyzer.analyze(List.of(policy("p1").build()), INVENTORY);

        assertThat(report.violations()).anySatisfy(v -> {
            assertThat(v.kind()).isEqualTo(ViolationKind.MISSING_SESSION_CONTROLS);
            assertThat(v.severity()).isEqualTo(Severity.LOW);
            assertThat(v.subjectRef()).isEqualTo("policy:p1");
        });
    }

    @Test
    void shouldRankPolicyStrengths() {
        Policy strong = policy("strong").grant(GrantOperator.AND, "mfa", "compliantDevice", "approvedApplication")
            .locations("All").session("signInFrequency").build();
        Policy weak = policy("weak").grant(GrantOperator.OR, "compliantDevice").clientApps("other").build();

        CoverageReport report = analyzer.analyze(List.of(weak, strong), INVENTORY);

        assertThat(report.policyScores()).extracting(PolicyScore::policyId).containsExactly("strong", "weak");
        assertThat(report.policyScores().get(0).score()).isEqualTo(100);
    }

    @Test
    void shouldRejectPolicyWithoutId() {
        Policy broken = policy(null).build();

        assertThatThrownBy(() -> analyzer.analyze(List.of(broken), INVENTORY))
            .isInstanceOf(AnalysisException.class)
            .hasMessageContaining("id");
    }
}
