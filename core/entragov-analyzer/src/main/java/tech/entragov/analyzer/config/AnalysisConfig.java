package tech.entragov.analyzer.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;

/**
 * Thresholds and weights of the governance analyzers.
 *
 * <p>Configure in application.properties:
 * <pre>
 * entragov.analysis.privileged-roles=Global Administrator,Security Administrator
 * entragov.analysis.pim.excessive-role-threshold=4
 * entragov.analysis.reviews.participation-threshold=0.9
 * </pre>
 */
@ConfigMapping(prefix = "entragov.analysis")
public interface AnalysisConfig {

    /**
     * Privileged roles, by display name (case-insensitive) or role definition id.
     */
    @WithName("privileged-roles")
    @WithDefault("Global Administrator,Privileged Role Administrator,Security Administrator,"
        + "Exchange Administrator,SharePoint Administrator,User Administrator,"
        + "Application Administrator,Cloud Application Administrator")
    List<String> privilegedRoles();

    CoverageConfig coverage();

    PimConfig pim();

    ReviewConfig reviews();

    EntitlementConfig entitlements();

    PostureConfig posture();

    WeightConfig weights();

    interface CoverageConfig {
        @WithName("coverage-weight")
        @WithDefault("0.40")
        double coverageWeight();

        @WithName("mfa-strictness-weight")
        @WithDefault("0.30")
        double mfaStrictnessWeight();

        @WithName("location-session-weight")
        @WithDefault("0.15")
        double locationSessionWeight();

        @WithName("exclusion-weight")
        @WithDefault("0.15")
        double exclusionWeight();

        /**
         * Fewer enabled policies than this triggers a recommendation.
         */
        @WithName("minimum-enabled-policies")
        @WithDefault("3")
        int minimumEnabledPolicies();
    }

    interface PimConfig {
        /**
         * Distinct privileged roles per principal that count as excessive. Twice this is HIGH.
         */
        @WithName("excessive-role-threshold")
        @WithDefault("3")
        int excessiveRoleThreshold();

        /**
         * Active assignments ending further out than this count as standing access.
         */
        @WithName("standing-access-horizon")
        @WithDefault("P365D")
        Duration standingAccessHorizon();

        @WithName("dormancy-lookback")
        @WithDefault("P90D")
        Duration dormancyLookback();
    }

    interface ReviewConfig {
        /**
         * Reviews overdue by more than this are HIGH severity.
         */
        @WithName("overdue-escalation")
        @WithDefault("P7D")
        Duration overdueEscalation();

        @WithName("participation-threshold")
        @WithDefault("0.8")
        double participationThreshold();
    }

    interface EntitlementConfig {
        /**
         * Packages with more assignments than this must require approval and expiration.
         */
        @WithName("ungoverned-assignment-threshold")
        @WithDefault("10")
        int ungovernedAssignmentThreshold();

        @WithName("expiry-warning-window")
        @WithDefault("P30D")
        Duration expiryWarningWindow();
    }

    interface PostureConfig {
        @WithName("coverage-weight")
        @WithDefault("0.5")
        double coverageWeight();

        @WithName("pim-weight")
        @WithDefault("0.5")
        double pimWeight();
    }

    interface WeightConfig {
        @WithName("severity-low")
        @WithDefault("1")
        int severityLow();

        @WithName("severity-medium")
        @WithDefault("2")
        int severityMedium();

        @WithName("severity-high")
        @WithDefault("3")
        int severityHigh();

        @WithName("severity-critical")
        @WithDefault("5")
        int severityCritical();

        @WithName("standing-admin-access")
        @WithDefault("2.0")
        double standingAdminAccess();

        @WithName("excessive-role-assignments")
        @WithDefault("1.5")
        double excessiveRoleAssignments();

        @WithName("dormant-eligibility")
        @WithDefault("1.0")
        double dormantEligibility();
    }
}
