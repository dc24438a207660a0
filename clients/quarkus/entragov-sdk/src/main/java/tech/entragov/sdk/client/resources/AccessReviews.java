package tech.entragov.sdk.client.resources;

import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;
import tech.entragov.sdk.client.GraphClient;
import tech.entragov.sdk.client.batch.BatchRequest;
import tech.entragov.sdk.client.batch.BatchResult;
import tech.entragov.sdk.dto.AccessReviewDefinition;
import tech.entragov.sdk.dto.ReviewDecision;
import tech.entragov.sdk.dto.ReviewInstance;
import tech.entragov.sdk.enums.DecisionOutcome;
import tech.entragov.sdk.enums.ReviewStatus;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static tech.entragov.sdk.support.GraphJson.instant;
import static tech.entragov.sdk.support.GraphJson.nestedText;
import static tech.entragov.sdk.support.GraphJson.text;

/**
 * Resource for access review definitions, instances and decisions.
 *
 * <p>Instances, decisions and contacted reviewers are fetched through $batch, one
 * sub-request per parent, with any further pages of a batched list followed individually.
 */
public class AccessReviews {

    private static final Logger LOG = Logger.getLogger(AccessReviews.class);

    static final String DEFINITIONS = "identityGovernance/accessReviews/definitions";

    /** Placeholder Graph uses in {@code reviewedBy} for undecided items. */
    private static final String EMPTY_PRINCIPAL = "00000000-0000-0000-0000-000000000000";

    private final GraphClient client;

    public AccessReviews(GraphClient client) {
        this.client = client;
    }

    /**
     * List access review definitions.
     */
    public List<AccessReviewDefinition> definitions() {
        return client.getAllPages(DEFINITIONS, Map.of("$select", "id,displayName,status"))
            .map(data -> new AccessReviewDefinition(
                text(data, "id"), text(data, "displayName"), text(data, "status")))
            .toList();
    }

    /**
     * Every review instance of every definition, with its decisions and contacted reviewers.
     */
    public List<ReviewInstance> instances() {
        List<AccessReviewDefinition> definitions = definitions();

        List<String> instancePaths = definitions.stream()
            .map(definition -> instancesPath(definition.id()))
            .toList();
        List<List<JsonNode>> instancesPerDefinition = fetchLists(instancePaths);

        List<InstanceRef> refs = new ArrayList<>();
        for (int i = 0; i < definitions.size(); i++) {
            AccessReviewDefinition definition = definitions.get(i);
            for (JsonNode instance : instancesPerDefinition.get(i)) {
                refs.add(new InstanceRef(definition, instance));
            }
        }

        // Decisions of every instance first, then their contacted reviewers, in one batch
        List<String> detailPaths = new ArrayList<>(refs.size() * 2);
        for (InstanceRef ref : refs) {
            detailPaths.add(decisionsPath(ref.definition.id(), text(ref.instance, "id")));
        }
        for (InstanceRef ref : refs) {
            detailPaths.add(reviewersPath(ref.definition.id(), text(ref.instance, "id")));
        }
        List<List<JsonNode>> details = fetchLists(detailPaths);

        List<ReviewInstance> instances = new ArrayList<>(refs.size());
        for (int i = 0; i < refs.size(); i++) {
            instances.add(mapInstance(refs.get(i), details.get(i), details.get(refs.size() + i)));
        }
        LOG.infof("Fetched %d review instances across %d definitions", instances.size(), definitions.size());
        return instances;
    }

    /**
     * Record a reviewer decision. The PATCH is not retried once Graph has responded.
     */
    public void recordDecision(String definitionId, String instanceId, String decisionId,
                               DecisionOutcome outcome, String justification) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("decision", outcome.graphValue());
        if (justification != null) {
            body.put("justification", justification);
        }
        client.request("PATCH", decisionsPath(definitionId, instanceId) + "/" + decisionId, Map.of(), body);
        LOG.infof("Recorded %s decision %s on review instance %s", outcome, decisionId, instanceId);
    }

    /**
     * Fetch the first page of every list through $batch, then follow continuations.
     */
    private List<List<JsonNode>> fetchLists(List<String> paths) {
        List<BatchResult> firstPages = client.batch(paths.stream().map(BatchRequest::get).toList());
        List<List<JsonNode>> lists = new ArrayList<>(paths.size());
        for (int i = 0; i < paths.size(); i++) {
            JsonNode firstPage = firstPages.get(i).bodyOrThrow();
            lists.add(client.continuePages(paths.get(i), Map.of(), firstPage).toList());
        }
        return lists;
    }

    private ReviewInstance mapInstance(InstanceRef ref, List<JsonNode> decisionNodes, List<JsonNode> reviewerNodes) {
        Map<String, ReviewDecision> decisions = new LinkedHashMap<>();
        for (JsonNode node : decisionNodes) {
            String reviewer = nestedText(node, "reviewedBy", "id");
            ReviewDecision decision = new ReviewDecision(
                text(node, "id"),
                nestedText(node, "principal", "id"),
                EMPTY_PRINCIPAL.equals(reviewer) ? null : reviewer,
                DecisionOutcome.fromGraph(text(node, "decision")));
            if (decision.id() != null) {
                decisions.put(decision.id(), decision);
            }
        }
        int completed = (int) decisions.values().stream().filter(d -> d.outcome().isDecided()).count();

        Set<String> reviewers = new LinkedHashSet<>();
        for (JsonNode node : reviewerNodes) {
            String reviewer = text(node, "id");
            if (reviewer != null && !EMPTY_PRINCIPAL.equals(reviewer)) {
                reviewers.add(reviewer);
            }
        }

        JsonNode instance = ref.instance;
        return new ReviewInstance(
            text(instance, "id"),
            ref.definition.id(),
            ref.definition.displayName(),
            ReviewStatus.fromGraph(text(instance, "status")),
            instant(instance, "startDateTime"),
            instant(instance, "endDateTime"),
            decisions.size(),
            completed,
            Map.copyOf(decisions),
            reviewers);
    }

    private static String instancesPath(String definitionId) {
        return DEFINITIONS + "/" + definitionId + "/instances";
    }

    private static String decisionsPath(String definitionId, String instanceId) {
        return instancesPath(definitionId) + "/" + instanceId + "/decisions";
    }

    private static String reviewersPath(String definitionId, String instanceId) {
        return instancesPath(definitionId) + "/" + instanceId + "/contactedReviewers";
    }

    private record InstanceRef(AccessReviewDefinition definition, JsonNode instance) {}
}
