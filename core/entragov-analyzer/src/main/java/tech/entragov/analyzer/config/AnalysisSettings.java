package tech.entragov.analyzer.config;

import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.ViolationKind;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable analyzer settings, produced from {@link AnalysisConfig}.
 *
 * <p>{@link #defaults()} gives the same values as the configuration defaults, for use
 * without a CDI container.
 */
public record AnalysisSettings(
    Set<String> privilegedRoles,
    CoverageWeights coverageWeights,
    int minimumEnabledPolicies,
    int excessiveRoleThreshold,
    Duration standingAccessHorizon,
    Duration dormancyLookback,
    Duration overdueEscalation,
    double participationThreshold,
    int ungovernedAssignmentThreshold,
    Duration expiryWarningWindow,
    double postureCoverageWeight,
    double posturePimWeight,
    Map<Severity, Integer> severityWeights,
    Map<ViolationKind, Double> kindWeights
) {
    public static final List<String> DEFAULT_PRIVILEGED_ROLES = List.of(
        "Global Administrator",
        "Privileged Role Administrator",
        "Security Administrator",
        "Exchange Administrator",
        "SharePoint Administrator",
        "User Administrator",
        "Application Administrator",
        "Cloud Application Administrator");

    public AnalysisSettings {
        privilegedRoles = privilegedRoles.stream()
            .map(role -> role.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        severityWeights = Collections.unmodifiableMap(new EnumMap<>(severityWeights));
        kindWeights = kindWeights.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(kindWeights));
    }

    /**
     * Weights of the coverage score components; expected to sum to 1.
     */
    public record CoverageWeights(
        double coverage,
        double mfaStrictness,
        double locationSession,
        double exclusions
    ) {}

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(
            Set.copyOf(DEFAULT_PRIVILEGED_ROLES),
            new CoverageWeights(0.40, 0.30, 0.15, 0.15),
            3,
            3,
            Duration.ofDays(365),
            Duration.ofDays(90),
            Duration.ofDays(7),
            0.8,
            10,
            Duration.ofDays(30),
            0.5,
            0.5,
            Map.of(Severity.LOW, 1, Severity.MEDIUM, 2, Severity.HIGH, 3, Severity.CRITICAL, 5),
            Map.of(ViolationKind.STANDING_ADMIN_ACCESS, 2.0,
                ViolationKind.EXCESSIVE_ROLE_ASSIGNMENTS, 1.5,
                ViolationKind.DORMANT_ELIGIBILITY, 1.0));
    }

    public static AnalysisSettings from(AnalysisConfig config) {
        AnalysisConfig.CoverageConfig coverage = config.coverage();
        AnalysisConfig.WeightConfig weights = config.weights();
        return new AnalysisSettings(
            Set.copyOf(config.privilegedRoles()),
            new CoverageWeights(coverage.coverageWeight(), coverage.mfaStrictnessWeight(),
                coverage.locationSessionWeight(), coverage.exclusionWeight()),
            coverage.minimumEnabledPolicies(),
            config.pim().excessiveRoleThreshold(),
            config.pim().standingAccessHorizon(),
            config.pim().dormancyLookback(),
            config.reviews().overdueEscalation(),
            config.reviews().participationThreshold(),
            config.entitlements().ungovernedAssignmentThreshold(),
            config.entitlements().expiryWarningWindow(),
            config.posture().coverageWeight(),
            config.posture().pimWeight(),
            Map.of(Severity.LOW, weights.severityLow(),
                Severity.MEDIUM, weights.severityMedium(),
                Severity.HIGH, weights.severityHigh(),
                Severity.CRITICAL, weights.severityCritical()),
            Map.of(ViolationKind.STANDING_ADMIN_ACCESS, weights.standingAdminAccess(),
                ViolationKind.EXCESSIVE_ROLE_ASSIGNMENTS, weights.excessiveRoleAssignments(),
                ViolationKind.DORMANT_ELIGIBILITY, weights.dormantEligibility()));
    }

    /**
     * Whether a role, identified by definition id or display name, is privileged.
     */
    public boolean isPrivileged(String roleId, String roleName) {
        return (roleId != null && privilegedRoles.contains(roleId.toLowerCase(Locale.ROOT)))
            || (roleName != null && privilegedRoles.contains(roleName.trim().toLowerCase(Locale.ROOT)));
    }

    public int severityWeight(Severity severity) {
        return severityWeights.getOrDefault(severity, 0);
    }

    /**
     * Kinds without a configured weight count 1.0.
     */
    public double kindWeight(ViolationKind kind) {
        return kindWeights.getOrDefault(kind, 1.0);
    }
}
