package tech.entragov.sdk.client.resources;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import tech.entragov.sdk.client.GraphClient;
import tech.entragov.sdk.client.batch.BatchRequest;
import tech.entragov.sdk.client.batch.BatchResult;
import tech.entragov.sdk.dto.AccessPackage;
import tech.entragov.sdk.dto.AccessPackageAssignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static tech.entragov.sdk.support.GraphJson.bool;
import static tech.entragov.sdk.support.GraphJson.instant;
import static tech.entragov.sdk.support.GraphJson.nestedText;
import static tech.entragov.sdk.support.GraphJson.text;

/**
 * Resource for entitlement management access packages and their assignments.
 */
public class Entitlements {

    private static final Logger LOG = Logger.getLogger(Entitlements.class);

    static final String BASE = "identityGovernance/entitlementManagement";

    private final GraphClient client;

    public Entitlements(GraphClient client) {
        this.client = client;
    }

    /**
     * Every access package, summarized with its assignment policies and assignment count.
     */
    public List<AccessPackage> accessPackages() {
        List<JsonNode> packages = client.getAllPages(BASE + "/accessPackages").toList();
        Map<String, Long> assignmentCounts = assignments().stream()
            .filter(assignment -> assignment.accessPackageId() != null)
            .collect(Collectors.groupingBy(AccessPackageAssignment::accessPackageId, Collectors.counting()));

        List<String> policyPaths = packages.stream()
            .map(data -> BASE + "/accessPackages/" + text(data, "id") + "/assignmentPolicies")
            .toList();
        List<BatchResult> policyPages = client.batch(policyPaths.stream().map(BatchRequest::get).toList());

        List<AccessPackage> result = new ArrayList<>(packages.size());
        for (int i = 0; i < packages.size(); i++) {
            JsonNode data = packages.get(i);
            List<JsonNode> policies = client
                .continuePages(policyPaths.get(i), Map.of(), policyPages.get(i).bodyOrThrow())
                .toList();
            String id = text(data, "id");
            result.add(new AccessPackage(
                id,
                text(data, "displayName"),
                catalogId(data),
                bool(data, "isHidden"),
                policies.stream().anyMatch(Entitlements::requiresApproval),
                policies.stream().anyMatch(Entitlements::hasExpiration),
                assignmentCounts.getOrDefault(id, 0L).intValue()));
        }
        LOG.infof("Fetched %d access packages", result.size());
        return result;
    }

    /**
     * Every access package assignment.
     */
    public List<AccessPackageAssignment> assignments() {
        return client.getAllPages(BASE + "/assignments", Map.of("$expand", "target,accessPackage"))
            .map(data -> new AccessPackageAssignment(
                text(data, "id"),
                text(data, "accessPackageId") != null
                    ? text(data, "accessPackageId")
                    : nestedText(data, "accessPackage", "id"),
                nestedText(data, "target", "id"),
                text(data, "state"),
                instant(data.path("schedule").path("expiration"), "endDateTime")))
            .toList();
    }

    private static String catalogId(JsonNode data) {
        String catalogId = text(data, "catalogId");
        return catalogId != null ? catalogId : nestedText(data, "catalog", "id");
    }

    // v1.0 uses isApprovalRequiredForAdd, beta uses isApprovalRequired
    private static boolean requiresApproval(JsonNode policy) {
        JsonNode approval = policy.path("requestApprovalSettings");
        return bool(approval, "isApprovalRequiredForAdd") || bool(approval, "isApprovalRequired");
    }

    private static boolean hasExpiration(JsonNode policy) {
        JsonNode expiration = policy.path("expiration");
        if (expiration.isObject()) {
            String type = text(expiration, "type");
            return type != null && !"noExpiration".equals(type);
        }
        return text(policy.path("requestorSettings").path("expirationSettings"), "expirationDuration") != null;
    }
}
