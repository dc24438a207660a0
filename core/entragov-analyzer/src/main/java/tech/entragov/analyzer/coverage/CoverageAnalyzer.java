package tech.entragov.analyzer.coverage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.entragov.analyzer.config.AnalysisSettings;
import tech.entragov.analyzer.exception.AnalysisException;
import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.TenantInventory;
import tech.entragov.analyzer.model.Violation;
import tech.entragov.analyzer.model.ViolationKind;
import tech.entragov.sdk.dto.DirectoryUser;
import tech.entragov.sdk.dto.GrantControls;
import tech.entragov.sdk.dto.Policy;
import tech.entragov.sdk.enums.GrantOperator;
import tech.entragov.sdk.enums.PolicyState;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Measures how much of the tenant Conditional Access protects with MFA and scores the
 * policy set.
 *
 * <p>A user or application is covered when an enabled policy that requires an
 * MFA-equivalent control (MFA, third-party MFA or an authentication strength) targets it.
 * The overall score weighs four components:
 * <ol>
 *   <li>coverage: mean of the user and application coverage percentages</li>
 *   <li>MFA strictness: per grant policy, 100 when MFA is mandatory (AND, or the only
 *       control), 50 when it is one OR alternative, 0 otherwise</li>
 *   <li>location/session: 50 each for location conditions and session controls</li>
 *   <li>exclusion minimality: 100 less 10 per excluded user, group, role or application</li>
 * </ol>
 * Every component is 0 when no policy is enabled.
 */
@ApplicationScoped
public class CoverageAnalyzer {

    private static final Logger LOG = Logger.getLogger(CoverageAnalyzer.class);

    static final double EXCLUSION_PENALTY = 10.0;

    private final AnalysisSettings settings;

    @Inject
    public CoverageAnalyzer(AnalysisSettings settings) {
        this.settings = settings;
    }

    public CoverageReport analyze(List<Policy> policies, TenantInventory inventory) {
        validate(policies);

        List<Policy> enabled = policies.stream().filter(Policy::isEnabled).toList();
        List<Policy> enforcing = enabled.stream().filter(p -> p.grantControls().requiresMfa()).toList();
        List<Policy> reportOnly = policies.stream()
            .filter(p -> p.state() == PolicyState.REPORT_ONLY && p.grantControls().requiresMfa())
            .toList();

        List<Violation> violations = new ArrayList<>();

        // Users
        int coveredUsers = 0;
        int reportOnlyUsers = 0;
        for (DirectoryUser user : inventory.users()) {
            if (anyTargets(enforcing, user, inventory)) {
                coveredUsers++;
            } else if (anyTargets(reportOnly, user, inventory)) {
                reportOnlyUsers++;
            }
        }
        int totalUsers = inventory.users().size();
        int uncoveredUsers = totalUsers - coveredUsers - reportOnlyUsers;
        if (uncoveredUsers > 0) {
            violations.add(new Violation(ViolationKind.COVERAGE_GAP, Severity.HIGH, "users",
                uncoveredUsers + " of " + totalUsers + " users are not targeted by any enabled MFA policy",
                "Extend an MFA policy to all users, keeping exclusions to break-glass accounts"));
        }
        if (reportOnlyUsers > 0) {
            violations.add(new Violation(ViolationKind.REPORT_ONLY_COVERAGE, Severity.MEDIUM, "users",
                reportOnlyUsers + " users are only covered by report-only MFA policies",
                "Review sign-in impact and switch the report-only policies to enabled"));
        }

        // Applications
        int coveredApps = 0;
        for (String appId : inventory.applicationIds().stream().sorted().toList()) {
            if (enforcing.stream().anyMatch(p -> p.conditions().applications().matches(appId))) {
                coveredApps++;
            } else if (reportOnly.stream().anyMatch(p -> p.conditions().applications().matches(appId))) {
                violations.add(new Violation(ViolationKind.REPORT_ONLY_COVERAGE, Severity.MEDIUM,
                    "application:" + appId,
                    "Only report-only policies would require MFA for this application",
                    "Enable the report-only policy once its impact is reviewed"));
            } else {
                violations.add(new Violation(ViolationKind.COVERAGE_GAP, Severity.HIGH,
                    "application:" + appId,
                    "No enabled policy requires MFA for this application",
                    "Target the application with an MFA policy or include it in an all-apps policy"));
            }
        }
        int totalApps = inventory.applicationIds().size();

        for (Policy policy : enabled) {
            if (!policy.hasSessionControls()) {
                violations.add(new Violation(ViolationKind.MISSING_SESSION_CONTROLS, Severity.LOW,
                    "policy:" + policy.id(),
                    "Policy '" + policy.displayName() + "' configures no session controls",
                    "Consider sign-in frequency or persistent browser session limits"));
            }
        }

        double userPct = percentage(coveredUsers, totalUsers, !enforcing.isEmpty());
        double appPct = percentage(coveredApps, totalApps, !enforcing.isEmpty());
        double coverageScore = enabled.isEmpty() ? 0.0 : (userPct + appPct) / 2;
        double strictness = mean(enabled.stream().filter(p -> !p.grantControls().blocks()).toList(),
            CoverageAnalyzer::mfaStrictness);
        double locationSession = mean(enabled, CoverageAnalyzer::locationSession);
        double exclusions = mean(enabled, CoverageAnalyzer::exclusionMinimality);

        AnalysisSettings.CoverageWeights weights = settings.coverageWeights();
        double weighted = weights.coverage() * coverageScore
            + weights.mfaStrictness() * strictness
            + weights.locationSession() * locationSession
            + weights.exclusions() * exclusions;
        int score = (int) Math.max(0, Math.min(100, Math.round(weighted)));

        List<PolicyScore> policyScores = enabled.stream()
            .map(PolicyStrength::score)
            .sorted(Comparator.comparingInt(PolicyScore::score).reversed().thenComparing(PolicyScore::policyId))
            .toList();

        LOG.debugf("Coverage: %d/%d users, %d/%d apps, score %d", coveredUsers, totalUsers,
            coveredApps, totalApps, score);

        return new CoverageReport(
            score,
            coverageScore,
            userPct,
            appPct,
            strictness,
            locationSession,
            exclusions,
            coveredUsers,
            totalUsers,
            coveredApps,
            totalApps,
            countByState(policies),
            policyScores,
            List.copyOf(violations),
            recommendations(policies, enabled));
    }

    private void validate(List<Policy> policies) {
        for (Policy policy : policies) {
            if (policy.id() == null) {
                throw AnalysisException.missingField("policy", "id", policy.displayName());
            }
            if (policy.conditions() == null || policy.grantControls() == null) {
                throw AnalysisException.missingField("policy", "conditions or grant controls", policy.id());
            }
        }
    }

    private static boolean anyTargets(List<Policy> candidates, DirectoryUser user, TenantInventory inventory) {
        return candidates.stream().anyMatch(p -> p.conditions().users()
            .matches(user.id(), user.groupIds(), inventory.rolesOf(user.id())));
    }

    /**
     * An empty population counts as fully covered once an enforcing policy exists.
     */
    private static double percentage(int covered, int total, boolean anyEnforcing) {
        if (total == 0) {
            return anyEnforcing ? 100.0 : 0.0;
        }
        return covered * 100.0 / total;
    }

    private static double mean(List<Policy> policies, ToDoubleFunction<Policy> component) {
        return policies.stream().mapToDouble(component).average().orElse(0.0);
    }

    static double mfaStrictness(Policy policy) {
        GrantControls grant = policy.grantControls();
        if (!grant.requiresMfa()) {
            return 0;
        }
        boolean mandatory = grant.operator() == GrantOperator.AND || grant.requirements().size() == 1;
        return mandatory ? 100 : 50;
    }

    static double locationSession(Policy policy) {
        return (policy.conditions().hasLocationConditions() ? 50 : 0)
            + (policy.hasSessionControls() ? 50 : 0);
    }

    static double exclusionMinimality(Policy policy) {
        int exclusions = policy.conditions().users().exclusionCount()
            + policy.conditions().applications().excludeApplications().size();
        return Math.max(0, 100 - EXCLUSION_PENALTY * exclusions);
    }

    private static Map<PolicyState, Integer> countByState(List<Policy> policies) {
        Map<PolicyState, Integer> counts = new EnumMap<>(PolicyState.class);
        for (PolicyState state : PolicyState.values()) {
            counts.put(state, 0);
        }
        policies.forEach(p -> counts.merge(p.state(), 1, Integer::sum));
        return Collections.unmodifiableMap(counts);
    }

    private List<String> recommendations(List<Policy> policies, List<Policy> enabled) {
        List<String> recommendations = new ArrayList<>();
        if (enabled.stream().noneMatch(p -> p.grantControls().requiresMfa())) {
            recommendations.add("No enabled policy requires MFA. Require MFA for all users.");
        }
        Predicate<Policy> blocksLegacy = p -> p.conditions().targetsLegacyClients() && p.grantControls().blocks();
        if (enabled.stream().noneMatch(blocksLegacy)) {
            recommendations.add("Legacy authentication is not blocked. Add a policy blocking legacy clients.");
        }
        if (enabled.stream().noneMatch(p -> p.grantControls().requiresCompliantDevice())) {
            recommendations.add("No policy checks device compliance. Consider requiring compliant devices.");
        }
        if (enabled.size() < settings.minimumEnabledPolicies()) {
            recommendations.add("Only " + enabled.size() + " policies are enabled. "
                + "Consider more granular controls.");
        }
        long reportOnly = policies.stream().filter(p -> p.state() == PolicyState.REPORT_ONLY).count();
        if (reportOnly > 0) {
            recommendations.add(reportOnly + " policies are in report-only mode. Review them for enforcement.");
        }
        return List.copyOf(recommendations);
    }
}
