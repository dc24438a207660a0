package tech.entragov.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.entragov.sdk.client.auth.Credential;
import tech.entragov.sdk.client.auth.TokenManager;
import tech.entragov.sdk.client.batch.BatchRequest;
import tech.entragov.sdk.client.batch.BatchResult;
import tech.entragov.sdk.client.paging.Page;
import tech.entragov.sdk.client.paging.PageSource;
import tech.entragov.sdk.client.paging.PagedSequence;
import tech.entragov.sdk.client.resources.AccessReviews;
import tech.entragov.sdk.client.resources.Directory;
import tech.entragov.sdk.client.resources.Entitlements;
import tech.entragov.sdk.client.resources.Policies;
import tech.entragov.sdk.client.resources.RoleManagement;
import tech.entragov.sdk.config.GraphConfig;
import tech.entragov.sdk.exception.AuthenticationException;
import tech.entragov.sdk.exception.GraphException;
import tech.entragov.sdk.exception.NetworkException;
import tech.entragov.sdk.exception.RateLimitExceededException;
import tech.entragov.sdk.exception.RequestException;
import tech.entragov.sdk.exception.RequestTimeoutException;
import tech.entragov.sdk.exception.TransientServerException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Main client for the Microsoft Graph API.
 *
 * <p>Handles bearer authentication, retry with backoff, pagination and $batch, and gives
 * access to the typed governance resources.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * GraphClient client;
 *
 * // All conditional access policies
 * List<Policy> policies = client.policies().list();
 *
 * // Raw paged access to any list endpoint
 * for (JsonNode user : client.getAllPages("users", Map.of("$select", "id"))) {
 *     ...
 * }
 * }</pre>
 *
 * <p>Retry state lives in the call frame; concurrent callers share only the
 * {@link TokenManager} cache.
 */
@ApplicationScoped
public class GraphClient {

    private static final Logger LOG = Logger.getLogger(GraphClient.class);

    /** Graph rejects $batch payloads with more sub-requests than this. */
    public static final int MAX_BATCH_SIZE = 20;

    private static final Set<String> SAFE_METHODS = Set.of("GET", "HEAD", "OPTIONS");
    private static final String NEXT_CURSOR_HEADER = "X-Next-Cursor";

    private final GraphConfig config;
    private final TokenManager tokenManager;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Backoff backoff;
    private final Sleeper sleeper;
    private final Clock clock;
    private final String baseUrl;

    private Policies policies;
    private RoleManagement roleManagement;
    private AccessReviews accessReviews;
    private Directory directory;
    private Entitlements entitlements;

    @Inject
    public GraphClient(GraphConfig config, TokenManager tokenManager) {
        this(config, tokenManager,
            HttpClient.newBuilder()
                .connectTimeout(config.http().connectTimeout())
                .build(),
            new Backoff(config.retry().backoffBase(), config.retry().backoffMax()),
            Sleeper.THREAD,
            Clock.systemUTC());
    }

    public GraphClient(GraphConfig config, TokenManager tokenManager, HttpClient httpClient,
                       Backoff backoff, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.tokenManager = tokenManager;
        this.httpClient = httpClient;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.clock = clock;
        this.baseUrl = config.baseUrl().replaceAll("/+$", "");
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    /**
     * Get the Conditional Access policies resource.
     */
    public Policies policies() {
        if (policies == null) {
            policies = new Policies(this);
        }
        return policies;
    }

    /**
     * Get the role management (PIM) resource.
     */
    public RoleManagement roleManagement() {
        if (roleManagement == null) {
            roleManagement = new RoleManagement(this);
        }
        return roleManagement;
    }

    /**
     * Get the Access Reviews resource.
     */
    public AccessReviews accessReviews() {
        if (accessReviews == null) {
            accessReviews = new AccessReviews(this);
        }
        return accessReviews;
    }

    /**
     * Get the directory inventory resource.
     */
    public Directory directory() {
        if (directory == null) {
            directory = new Directory(this);
        }
        return directory;
    }

    /**
     * Get the entitlement management resource.
     */
    public Entitlements entitlements() {
        if (entitlements == null) {
            entitlements = new Entitlements(this);
        }
        return entitlements;
    }

    public JsonNode get(String path) {
        return request("GET", path, Map.of(), null);
    }

    public JsonNode get(String path, Map<String, String> params) {
        return request("GET", path, params, null);
    }

    /**
     * Make an authenticated API request.
     *
     * <p>Reads are retried on rate limiting, 5xx and network failures within their
     * budgets. Writes are retried only when no response was received at all.
     *
     * @param path   path relative to the base URL, or an absolute URL
     * @param params query parameters, may be empty
     * @param body   request body serialized as JSON, null for none
     * @return the parsed response body, {@link NullNode} when the response has none
     */
    public JsonNode request(String method, String path, Map<String, String> params, Object body) {
        String verb = method.toUpperCase(Locale.ROOT);
        URI uri = resolve(path, params);
        String json = body != null ? writeJson(body) : null;
        return readJson(execute(verb, uri, json, SAFE_METHODS.contains(verb)).response());
    }

    /**
     * Lazily iterate every item of a list endpoint, following continuations.
     */
    public PagedSequence<JsonNode> getAllPages(String path) {
        return getAllPages(path, Map.of());
    }

    public PagedSequence<JsonNode> getAllPages(String path, Map<String, String> params) {
        return PagedSequence.of(path, new EndpointPages(path, params, null),
            config.paging().maxPages(), config.paging().maxItems());
    }

    /**
     * Iterate a list endpoint whose first page was already fetched (typically through
     * {@link #batch(List)}), fetching only the continuation pages.
     */
    public PagedSequence<JsonNode> continuePages(String path, Map<String, String> params, JsonNode firstPage) {
        return PagedSequence.of(path, new EndpointPages(path, params, Page.from(firstPage, null)),
            config.paging().maxPages(), config.paging().maxItems());
    }

    /**
     * Execute requests through the $batch endpoint.
     *
     * <p>Requests are sent in chunks of the configured batch size. The result list has
     * one entry per request, in submission order. Retryable GET sub-requests are re-sent
     * in follow-up rounds within their own budgets; every other failure is returned in
     * its {@link BatchResult} without affecting siblings.
     *
     * @throws AuthenticationException if the $batch call itself is rejected
     */
    public List<BatchResult> batch(List<BatchRequest> requests) {
        int size = Math.max(1, Math.min(config.batch().size(), MAX_BATCH_SIZE));
        List<BatchResult> results = new ArrayList<>(requests.size());
        for (int start = 0; start < requests.size(); start += size) {
            results.addAll(executeBatch(requests.subList(start, Math.min(start + size, requests.size()))));
        }
        return results;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    // Request execution

    private Sent execute(String method, URI uri, String body, boolean idempotent) {
        String path = uri.getPath();
        GraphConfig.RetryConfig retry = config.retry();

        int rateLimitRetries = 0;
        int serverErrorRetries = 0;
        int networkRetries = 0;
        boolean tokenRefreshed = false;
        Duration lastBackoff = Duration.ZERO;

        while (true) {
            Credential credential = tokenManager.getToken();
            ResponseOutcome outcome = send(method, uri, body, credential);

            if (outcome instanceof ResponseOutcome.Success success) {
                return new Sent(success.response(), credential);
            }

            if (outcome instanceof ResponseOutcome.AuthExpired) {
                tokenManager.invalidate(credential);
                if (!idempotent) {
                    throw AuthenticationException.writeUnauthorized(path);
                }
                if (tokenRefreshed) {
                    throw AuthenticationException.tokenRejected(path);
                }
                tokenRefreshed = true;
                LOG.infof("Access token rejected for %s %s, retrying with a fresh token", method, path);
                continue;
            }

            if (outcome instanceof ResponseOutcome.ClientError error) {
                throw new RequestException(method, path, error.statusCode(), error.body());
            }

            Duration delay;
            if (outcome instanceof ResponseOutcome.RateLimited limited) {
                if (!idempotent || rateLimitRetries >= retry.maxRateLimitRetries()) {
                    throw new RateLimitExceededException(path, limited.statusCode(), rateLimitRetries);
                }
                if (limited.retryAfter() != null) {
                    delay = limited.retryAfter();
                } else {
                    delay = backoff.delay(rateLimitRetries, lastBackoff);
                    lastBackoff = delay;
                }
                rateLimitRetries++;
                LOG.warnf("%s %s rate limited (%d), retry %d/%d in %d ms", method, path,
                    limited.statusCode(), rateLimitRetries, retry.maxRateLimitRetries(), delay.toMillis());
            } else if (outcome instanceof ResponseOutcome.TransientError error) {
                if (!idempotent || serverErrorRetries >= retry.maxServerErrorRetries()) {
                    throw new TransientServerException(path, error.statusCode(), error.body(), serverErrorRetries);
                }
                delay = backoff.delay(serverErrorRetries, lastBackoff);
                lastBackoff = delay;
                serverErrorRetries++;
                LOG.warnf("%s %s failed with %d, retry %d/%d in %d ms", method, path,
                    error.statusCode(), serverErrorRetries, retry.maxServerErrorRetries(), delay.toMillis());
            } else {
                ResponseOutcome.NetworkFailure failure = (ResponseOutcome.NetworkFailure) outcome;
                if (networkRetries >= retry.maxNetworkRetries()) {
                    if (failure.timeout()) {
                        throw new RequestTimeoutException(path, config.http().requestTimeout(), failure.cause());
                    }
                    throw new NetworkException("Network failure calling " + method + " " + path, failure.cause());
                }
                delay = backoff.delay(networkRetries, lastBackoff);
                lastBackoff = delay;
                networkRetries++;
                LOG.warnf("%s %s %s, retry %d/%d in %d ms", method, path,
                    failure.timeout() ? "timed out" : "could not connect",
                    networkRetries, retry.maxNetworkRetries(), delay.toMillis());
            }

            pause(delay, path);
        }
    }

    private ResponseOutcome send(String method, URI uri, String body, Credential credential) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .header("Authorization", "Bearer " + credential.accessToken())
            .header("Accept", "application/json")
            .timeout(config.http().requestTimeout());

        if (body != null) {
            builder.header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(body));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        LOG.debugf("%s %s", method, uri);
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            ApiResponse apiResponse = new ApiResponse(response.statusCode(), response.headers(), response.body());
            return ResponseOutcome.classify(apiResponse, clock.instant());
        } catch (HttpTimeoutException e) {
            return new ResponseOutcome.NetworkFailure(e, true);
        } catch (IOException e) {
            return new ResponseOutcome.NetworkFailure(e, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw NetworkException.interrupted(uri.getPath(), e);
        }
    }

    private void pause(Duration delay, String path) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw NetworkException.interrupted(path, e);
        }
    }

    // $batch

    private List<BatchResult> executeBatch(List<BatchRequest> chunk) {
        BatchResult[] results = new BatchResult[chunk.size()];
        Map<String, PendingRequest> pending = new LinkedHashMap<>();
        for (int i = 0; i < chunk.size(); i++) {
            pending.put(String.valueOf(i + 1), new PendingRequest(i, chunk.get(i)));
        }

        URI batchUri = resolve("$batch", Map.of());
        Duration lastBackoff = Duration.ZERO;
        int round = 0;

        while (!pending.isEmpty()) {
            boolean allReads = pending.values().stream().allMatch(p -> p.request.isRead());
            Sent sent;
            try {
                sent = execute("POST", batchUri, writeJson(batchEnvelope(pending)), allReads);
            } catch (AuthenticationException e) {
                throw e;
            } catch (GraphException e) {
                LOG.warnf("$batch call failed, failing %d sub-requests: %s", pending.size(), e.getMessage());
                pending.values().forEach(p -> results[p.index] = BatchResult.failure(e));
                break;
            }

            Map<String, JsonNode> responses = new HashMap<>();
            for (JsonNode response : readJson(sent.response()).path("responses")) {
                responses.put(response.path("id").asText(), response);
            }

            boolean refreshToken = false;
            boolean needsBackoff = false;
            Duration serverWait = null;

            Iterator<Map.Entry<String, PendingRequest>> it = pending.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, PendingRequest> entry = it.next();
                PendingRequest sub = entry.getValue();
                JsonNode response = responses.get(entry.getKey());
                if (response == null) {
                    results[sub.index] = BatchResult.failure(new GraphException(
                        "No $batch response for " + sub.request.method() + " " + sub.request.path()));
                    it.remove();
                    continue;
                }

                ResponseOutcome outcome = ResponseOutcome.classify(toApiResponse(response), clock.instant());
                if (outcome instanceof ResponseOutcome.AuthExpired) {
                    refreshToken = true;
                }
                BatchResult settled = settle(sub, outcome);
                if (settled != null) {
                    results[sub.index] = settled;
                    it.remove();
                } else if (!(outcome instanceof ResponseOutcome.AuthExpired)) {
                    needsBackoff = true;
                    if (outcome instanceof ResponseOutcome.RateLimited limited && limited.retryAfter() != null) {
                        serverWait = serverWait == null || limited.retryAfter().compareTo(serverWait) > 0
                            ? limited.retryAfter()
                            : serverWait;
                    }
                }
            }

            if (refreshToken) {
                tokenManager.invalidate(sent.credential());
            }
            if (pending.isEmpty()) {
                break;
            }
            Duration delay = Duration.ZERO;
            if (serverWait != null) {
                delay = serverWait;
            } else if (needsBackoff) {
                delay = backoff.delay(round, lastBackoff);
                lastBackoff = delay;
            }
            round++;
            LOG.warnf("Re-sending %d $batch sub-requests (round %d) in %d ms", pending.size(), round, delay.toMillis());
            pause(delay, batchUri.getPath());
        }

        return Arrays.asList(results);
    }

    /**
     * @return the final result for the sub-request, or null if it should be re-sent
     */
    private BatchResult settle(PendingRequest sub, ResponseOutcome outcome) {
        BatchRequest request = sub.request;
        String path = request.path();
        GraphConfig.RetryConfig retry = config.retry();

        if (outcome instanceof ResponseOutcome.Success success) {
            return BatchResult.success(success.response().statusCode(), readJson(success.response()));
        }
        if (outcome instanceof ResponseOutcome.AuthExpired) {
            if (!request.isRead()) {
                return BatchResult.failure(AuthenticationException.writeUnauthorized(path));
            }
            if (sub.authRetried) {
                return BatchResult.failure(AuthenticationException.tokenRejected(path));
            }
            sub.authRetried = true;
            return null;
        }
        if (outcome instanceof ResponseOutcome.RateLimited limited) {
            if (!request.isRead() || sub.rateLimitRetries >= retry.maxRateLimitRetries()) {
                return BatchResult.failure(
                    new RateLimitExceededException(path, limited.statusCode(), sub.rateLimitRetries));
            }
            sub.rateLimitRetries++;
            return null;
        }
        if (outcome instanceof ResponseOutcome.TransientError error) {
            if (!request.isRead() || sub.serverErrorRetries >= retry.maxServerErrorRetries()) {
                return BatchResult.failure(
                    new TransientServerException(path, error.statusCode(), error.body(), sub.serverErrorRetries));
            }
            sub.serverErrorRetries++;
            return null;
        }
        if (outcome instanceof ResponseOutcome.ClientError error) {
            return BatchResult.failure(new RequestException(request.method(), path, error.statusCode(), error.body()));
        }
        return BatchResult.failure(new GraphException("Unexpected $batch outcome for " + path + ": " + outcome));
    }

    private ObjectNode batchEnvelope(Map<String, PendingRequest> pending) {
        ObjectNode envelope = objectMapper.createObjectNode();
        ArrayNode requests = envelope.putArray("requests");
        pending.forEach((id, sub) -> {
            ObjectNode node = requests.addObject();
            node.put("id", id);
            node.put("method", sub.request.method().toUpperCase(Locale.ROOT));
            node.put("url", "/" + stripLeadingSlash(sub.request.path()) + queryPart(sub.request.params(), "?"));
            if (sub.request.body() != null) {
                node.set("body", objectMapper.valueToTree(sub.request.body()));
                node.putObject("headers").put("Content-Type", "application/json");
            }
        });
        return envelope;
    }

    private ApiResponse toApiResponse(JsonNode response) {
        Map<String, List<String>> headers = new HashMap<>();
        response.path("headers").fields()
            .forEachRemaining(header -> headers.put(header.getKey(), List.of(header.getValue().asText())));

        JsonNode body = response.get("body");
        String rawBody = body == null || body.isNull() ? null : body.isTextual() ? body.asText() : body.toString();
        return ApiResponse.of(response.path("status").asInt(), headers, rawBody);
    }

    // URLs and JSON

    private URI resolve(String path, Map<String, String> params) {
        String url = isAbsolute(path) ? path : baseUrl + "/" + stripLeadingSlash(path);
        return URI.create(url + queryPart(params, url.contains("?") ? "&" : "?"));
    }

    private static String queryPart(Map<String, String> params, String separator) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        return params.entrySet().stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&", separator, ""));
    }

    private static String encode(String value) {
        // OData system query options keep their literal '$'
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
            .replace("+", "%20")
            .replace("%24", "$");
    }

    private static boolean isAbsolute(String path) {
        return path.startsWith("https://") || path.startsWith("http://");
    }

    private static String stripLeadingSlash(String path) {
        return path.startsWith("/") ? path.substring(1) : path;
    }

    private String writeJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new GraphException("Failed to serialize request body: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode readJson(ApiResponse response) {
        if (!response.hasBody()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new GraphException("Unreadable response body: " + e.getOriginalMessage(),
                response.statusCode(), e, Map.of());
        }
    }

    /**
     * Pages of one endpoint; a preset first page is served without a request.
     */
    private final class EndpointPages implements PageSource {

        private final String path;
        private final Map<String, String> params;
        private final Page firstPage;

        EndpointPages(String path, Map<String, String> params, Page firstPage) {
            this.path = path;
            this.params = params != null ? params : Map.of();
            this.firstPage = firstPage;
        }

        @Override
        public Page first() {
            return firstPage != null ? firstPage : fetch(resolve(path, params));
        }

        @Override
        public Page next(String cursor) {
            if (isAbsolute(cursor)) {
                return fetch(URI.create(cursor));
            }
            Map<String, String> continued = new LinkedHashMap<>(params);
            continued.put(config.paging().continuationParam(), cursor);
            return fetch(resolve(path, continued));
        }

        private Page fetch(URI uri) {
            ApiResponse response = execute("GET", uri, null, true).response();
            return Page.from(readJson(response), response.headers().firstValue(NEXT_CURSOR_HEADER).orElse(null));
        }
    }

    private static final class PendingRequest {
        private final int index;
        private final BatchRequest request;
        private boolean authRetried;
        private int rateLimitRetries;
        private int serverErrorRetries;

        PendingRequest(int index, BatchRequest request) {
            this.index = index;
            this.request = request;
        }
    }

    private record Sent(ApiResponse response, Credential credential) {}
}
