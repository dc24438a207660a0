package tech.entragov.sdk.client.resources;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import tech.entragov.sdk.client.GraphClient;
import tech.entragov.sdk.dto.RoleActivation;
import tech.entragov.sdk.dto.RoleAssignment;
import tech.entragov.sdk.dto.RoleDefinition;
import tech.entragov.sdk.enums.AssignmentType;
import tech.entragov.sdk.exception.NotFoundException;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static tech.entragov.sdk.support.GraphJson.bool;
import static tech.entragov.sdk.support.GraphJson.instant;
import static tech.entragov.sdk.support.GraphJson.text;

/**
 * Resource for directory role definitions and PIM assignments.
 */
public class RoleManagement {

    private static final Logger LOG = Logger.getLogger(RoleManagement.class);

    static final String BASE = "roleManagement/directory";
    static final String DEFINITIONS = BASE + "/roleDefinitions";
    static final String ACTIVE_INSTANCES = BASE + "/roleAssignmentScheduleInstances";
    static final String ELIGIBLE_INSTANCES = BASE + "/roleEligibilityScheduleInstances";
    static final String ASSIGNMENT_REQUESTS = BASE + "/roleAssignmentScheduleRequests";

    private final GraphClient client;

    public RoleManagement(GraphClient client) {
        this.client = client;
    }

    /**
     * List every role definition.
     *
     * @throws NotFoundException if the tenant returns none
     */
    public List<RoleDefinition> definitions() {
        List<RoleDefinition> definitions = client
            .getAllPages(DEFINITIONS, Map.of("$select", "id,displayName,isBuiltIn"))
            .map(data -> new RoleDefinition(text(data, "id"), text(data, "displayName"), bool(data, "isBuiltIn")))
            .toList();
        if (definitions.isEmpty()) {
            throw NotFoundException.noRoleDefinitions();
        }
        return definitions;
    }

    /**
     * Active (assigned or activated) role assignments, role names unresolved.
     */
    public List<RoleAssignment> activeAssignments() {
        return client.getAllPages(ACTIVE_INSTANCES)
            .map(data -> mapAssignment(data, AssignmentType.ACTIVE))
            .toList();
    }

    /**
     * Eligible role assignments, role names unresolved.
     */
    public List<RoleAssignment> eligibleAssignments() {
        return client.getAllPages(ELIGIBLE_INSTANCES)
            .map(data -> mapAssignment(data, AssignmentType.ELIGIBLE))
            .toList();
    }

    /**
     * Active and eligible assignments with role names resolved from one definition lookup.
     */
    public List<RoleAssignment> assignments() {
        Map<String, String> names = definitions().stream()
            .filter(definition -> definition.id() != null && definition.displayName() != null)
            .collect(Collectors.toMap(RoleDefinition::id, RoleDefinition::displayName, (a, b) -> a));
        Function<RoleAssignment, RoleAssignment> resolve =
            assignment -> assignment.withRoleName(names.get(assignment.roleId()));

        List<RoleAssignment> assignments = new ArrayList<>();
        activeAssignments().stream().map(resolve).forEach(assignments::add);
        eligibleAssignments().stream().map(resolve).forEach(assignments::add);
        LOG.infof("Fetched %d role assignments across %d role definitions", assignments.size(), names.size());
        return assignments;
    }

    /**
     * Role activations requested in the last {@code lookback}.
     */
    public List<RoleActivation> activations(Duration lookback) {
        return activations(Instant.now().minus(lookback));
    }

    /**
     * Role activations ({@code selfActivate} requests) created at or after {@code since}.
     */
    public List<RoleActivation> activations(Instant since) {
        String filter = "action eq 'selfActivate' and createdDateTime ge "
            + DateTimeFormatter.ISO_INSTANT.format(since.truncatedTo(ChronoUnit.SECONDS));
        return client.getAllPages(ASSIGNMENT_REQUESTS, Map.of("$filter", filter))
            .map(data -> new RoleActivation(
                text(data, "id"),
                text(data, "principalId"),
                text(data, "roleDefinitionId"),
                text(data, "action"),
                instant(data, "createdDateTime")))
            .toList();
    }

    private RoleAssignment mapAssignment(JsonNode data, AssignmentType type) {
        return new RoleAssignment(
            text(data, "id"),
            text(data, "principalId"),
            text(data, "roleDefinitionId"),
            null,
            type,
            instant(data, "startDateTime"),
            instant(data, "endDateTime"));
    }
}
