package tech.entragov.sdk.client.resources;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import tech.entragov.sdk.client.GraphClient;
import tech.entragov.sdk.dto.ApplicationScope;
import tech.entragov.sdk.dto.GrantControls;
import tech.entragov.sdk.dto.Policy;
import tech.entragov.sdk.dto.PolicyConditions;
import tech.entragov.sdk.dto.UserScope;
import tech.entragov.sdk.enums.GrantOperator;
import tech.entragov.sdk.enums.PolicyState;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static tech.entragov.sdk.support.GraphJson.instant;
import static tech.entragov.sdk.support.GraphJson.stringSet;
import static tech.entragov.sdk.support.GraphJson.text;

/**
 * Resource for Conditional Access policies.
 */
public class Policies {

    private static final Logger LOG = Logger.getLogger(Policies.class);

    static final String PATH = "identity/conditionalAccess/policies";

    private final GraphClient client;

    public Policies(GraphClient client) {
        this.client = client;
    }

    /**
     * List every Conditional Access policy in the tenant.
     */
    public List<Policy> list() {
        List<Policy> policies = client.getAllPages(PATH)
            .map(this::mapPolicy)
            .toList();
        LOG.infof("Fetched %d conditional access policies", policies.size());
        return policies;
    }

    /**
     * Get a policy by ID.
     */
    public Policy get(String id) {
        return mapPolicy(client.get(PATH + "/" + id));
    }

    private Policy mapPolicy(JsonNode data) {
        JsonNode conditions = data.path("conditions");
        JsonNode users = conditions.path("users");
        JsonNode applications = conditions.path("applications");
        JsonNode locations = conditions.path("locations");

        PolicyConditions mapped = new PolicyConditions(
            new UserScope(
                stringSet(users, "includeUsers"),
                stringSet(users, "excludeUsers"),
                stringSet(users, "includeGroups"),
                stringSet(users, "excludeGroups"),
                stringSet(users, "includeRoles"),
                stringSet(users, "excludeRoles")),
            new ApplicationScope(
                stringSet(applications, "includeApplications"),
                stringSet(applications, "excludeApplications")),
            stringSet(locations, "includeLocations"),
            stringSet(locations, "excludeLocations"),
            stringSet(conditions, "clientAppTypes"),
            stringSet(conditions, "userRiskLevels"),
            stringSet(conditions, "signInRiskLevels"));

        return new Policy(
            text(data, "id"),
            text(data, "displayName"),
            PolicyState.fromGraph(text(data, "state")),
            mapped,
            mapGrantControls(data.path("grantControls")),
            sessionControlNames(data.path("sessionControls")),
            instant(data, "modifiedDateTime"));
    }

    private GrantControls mapGrantControls(JsonNode grant) {
        if (!grant.isObject()) {
            return GrantControls.none();
        }
        return new GrantControls(
            GrantOperator.fromGraph(text(grant, "operator")),
            stringSet(grant, "builtInControls"),
            text(grant.path("authenticationStrength"), "id"));
    }

    /**
     * Names of the session controls that are configured. Each control is an object
     * (optionally with {@code isEnabled}) except {@code disableResilienceDefaults},
     * which is a boolean.
     */
    private Set<String> sessionControlNames(JsonNode session) {
        Set<String> names = new LinkedHashSet<>();
        session.fields().forEachRemaining(field -> {
            JsonNode value = field.getValue();
            boolean configured = value.isObject()
                ? value.path("isEnabled").asBoolean(true)
                : value.asBoolean(false);
            if (configured) {
                names.add(field.getKey());
            }
        });
        return Set.copyOf(names);
    }
}
