package tech.entragov.analyzer.entitlement;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.entragov.analyzer.config.AnalysisSettings;
import tech.entragov.analyzer.exception.AnalysisException;
import tech.entragov.analyzer.model.Severity;
import tech.entragov.analyzer.model.Violation;
import tech.entragov.analyzer.model.ViolationKind;
import tech.entragov.sdk.dto.AccessPackage;
import tech.entragov.sdk.dto.AccessPackageAssignment;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Flags widely assigned access packages without approval or expiration, and lists
 * assignments due for renewal.
 */
@ApplicationScoped
public class EntitlementAnalyzer {

    private static final Logger LOG = Logger.getLogger(EntitlementAnalyzer.class);

    private final AnalysisSettings settings;

    @Inject
    public EntitlementAnalyzer(AnalysisSettings settings) {
        this.settings = settings;
    }

    public EntitlementReport analyze(List<AccessPackage> packages, List<AccessPackageAssignment> assignments,
                                     Instant now) {
        List<Violation> violations = new ArrayList<>();
        for (AccessPackage accessPackage : packages) {
            if (accessPackage.id() == null) {
                throw AnalysisException.missingField("access package", "id", accessPackage.displayName());
            }
            if (accessPackage.assignmentCount() <= settings.ungovernedAssignmentThreshold()
                || (accessPackage.requiresApproval() && accessPackage.hasExpiration())) {
                continue;
            }
            boolean neither = !accessPackage.requiresApproval() && !accessPackage.hasExpiration();
            String missing = neither ? "approval or expiration"
                : accessPackage.requiresApproval() ? "expiration" : "approval";
            violations.add(new Violation(ViolationKind.UNGOVERNED_ACCESS_PACKAGE,
                neither ? Severity.HIGH : Severity.MEDIUM,
                "accessPackage:" + accessPackage.id(),
                "Package '" + accessPackage.displayName() + "' has " + accessPackage.assignmentCount()
                    + " assignments and no " + missing,
                "Require approval and set an assignment expiration on its policies"));
        }
        violations.sort(Violation.REPORT_ORDER);

        Instant horizon = now.plus(settings.expiryWarningWindow());
        List<ExpiringAssignment> expiring = assignments.stream()
            .filter(a -> a.expiresAt() != null && !a.expiresAt().isBefore(now) && !a.expiresAt().isAfter(horizon))
            .map(a -> new ExpiringAssignment(a.id(), a.accessPackageId(), a.targetId(), a.expiresAt(),
                Duration.between(now, a.expiresAt()).toDays()))
            .sorted(Comparator.comparing(ExpiringAssignment::expiresAt)
                .thenComparing(ExpiringAssignment::assignmentId, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();

        LOG.debugf("Entitlements: %d packages, %d expiring assignments", packages.size(), expiring.size());
        return new EntitlementReport(packages.size(), assignments.size(), expiring, List.copyOf(violations));
    }
}
