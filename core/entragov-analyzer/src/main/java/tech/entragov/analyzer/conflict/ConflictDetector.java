package tech.entragov.analyzer.conflict;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.entragov.analyzer.exception.AnalysisException;
import tech.entragov.analyzer.model.Violation;
import tech.entragov.sdk.dto.ApplicationScope;
import tech.entragov.sdk.dto.GrantControls;
import tech.entragov.sdk.dto.Policy;
import tech.entragov.sdk.dto.UserScope;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds pairs of enabled Conditional Access policies that interfere with each other.
 *
 * <p>Only pairs whose user and application scopes overlap are compared.
 * {@link #classify(Policy, Policy)} is symmetric in its arguments.
 */
@ApplicationScoped
public class ConflictDetector {

    private static final Logger LOG = Logger.getLogger(ConflictDetector.class);

    public ConflictReport detect(List<Policy> policies) {
        policies.forEach(ConflictDetector::validate);
        List<Policy> enabled = policies.stream()
            .filter(Policy::isEnabled)
            .sorted(Comparator.comparing(Policy::id))
            .toList();

        List<PolicyConflict> conflicts = new ArrayList<>();
        List<Violation> violations = new ArrayList<>();
        for (int i = 0; i < enabled.size(); i++) {
            for (int j = i + 1; j < enabled.size(); j++) {
                Policy first = enabled.get(i);
                Policy second = enabled.get(j);
                classify(first, second).ifPresent(type -> {
                    conflicts.add(new PolicyConflict(type, first.id(), first.displayName(),
                        second.id(), second.displayName()));
                    violations.add(toViolation(type, first, second));
                });
            }
        }

        LOG.debugf("Compared %d enabled policies, %d conflicts", enabled.size(), conflicts.size());
        return new ConflictReport(enabled.size(), List.copyOf(conflicts), List.copyOf(violations));
    }

    /**
     * Classify a pair of policies.
     *
     * @return the conflict, or empty when the policies do not interfere
     */
    public Optional<ConflictType> classify(Policy a, Policy b) {
        if (!usersOverlap(a.conditions().users(), b.conditions().users())
            || !appsOverlap(a.conditions().applications(), b.conditions().applications())) {
            return Optional.empty();
        }

        GrantControls ga = a.grantControls();
        GrantControls gb = b.grantControls();
        if ((ga.blocks() && gb.grants()) || (gb.blocks() && ga.grants())) {
            return Optional.of(ConflictType.CONTRADICTORY);
        }

        if (ga.blocks() || gb.blocks() || !a.conditions().equals(b.conditions())) {
            return Optional.empty();
        }
        if (ga.operator() != gb.operator()) {
            return Optional.of(ConflictType.OPERATOR_MISMATCH);
        }
        Set<String> ra = ga.requirements();
        Set<String> rb = gb.requirements();
        if (ra.containsAll(rb) || rb.containsAll(ra)) {
            return Optional.of(ConflictType.REDUNDANT);
        }
        return Optional.empty();
    }

    private static boolean usersOverlap(UserScope a, UserScope b) {
        return a.includesAll() || b.includesAll()
            || intersects(a.includeUsers(), b.includeUsers())
            || intersects(a.includeGroups(), b.includeGroups())
            || intersects(a.includeRoles(), b.includeRoles());
    }

    private static boolean appsOverlap(ApplicationScope a, ApplicationScope b) {
        return a.includesAll() || b.includesAll()
            || intersects(a.includeApplications(), b.includeApplications());
    }

    private static boolean intersects(Set<String> a, Set<String> b) {
        return !Collections.disjoint(a, b);
    }

    private static Violation toViolation(ConflictType type, Policy first, Policy second) {
        String subject = "policy:" + first.id() + "+policy:" + second.id();
        String names = "'" + first.displayName() + "' and '" + second.displayName() + "'";
        return switch (type) {
            case CONTRADICTORY -> new Violation(type.kind(), type.severity(), subject,
                names + " target overlapping users and applications; one blocks access the other grants",
                "Narrow the scope of one policy or exclude the overlap explicitly");
            case REDUNDANT -> new Violation(type.kind(), type.severity(), subject,
                names + " have identical conditions and one requirement set contains the other",
                "Consolidate the policies into one");
            case OPERATOR_MISMATCH -> new Violation(type.kind(), type.severity(), subject,
                names + " have identical conditions but combine grant controls with different operators (AND vs OR)",
                "Align the grant operators or merge the policies");
        };
    }

    private static void validate(Policy policy) {
        if (policy.id() == null) {
            throw AnalysisException.missingField("policy", "id", policy.displayName());
        }
    }
}
