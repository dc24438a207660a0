package tech.entragov.sdk.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.entragov.sdk.exception.AuthenticationException;
import tech.entragov.sdk.exception.NetworkException;
import tech.entragov.sdk.exception.RateLimitExceededException;
import tech.entragov.sdk.exception.RequestException;
import tech.entragov.sdk.exception.RequestTimeoutException;
import tech.entragov.sdk.exception.TransientServerException;

import java.time.Duration;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.patch;
import static com.github.tomakehurst.wiremock.client.WireMock.patchRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphClientTest {

    private GraphTestServer graph;
    private WireMockServer server;
    private GraphClient client;

    @BeforeEach
    void setUp() {
        graph = new GraphTestServer().start();
        server = graph.server();
        client = graph.client();
    }

    @AfterEach
    void tearDown() {
        graph.stop();
    }

    @Test
    void shouldSendBearerTokenAndEncodedQuery() {
        // Given
        server.stubFor(get(urlPathEqualTo("/v1.0/users"))
            .willReturn(okJson("{\"value\":[]}")));

        // When
        JsonNode body = client.get("users", Map.of("$select", "id,displayName", "$filter", "accountEnabled eq true"));

        // Then
        assertThat(body.path("value").isArray()).isTrue();
        server.verify(getRequestedFor(urlPathEqualTo("/v1.0/users"))
            .withHeader("Authorization", equalTo("Bearer token-1"))
            .withQueryParam("$select", equalTo("id,displayName"))
            .withQueryParam("$filter", equalTo("accountEnabled eq true")));
    }

    @Test
    void shouldReturnNullNodeForEmptyBody() {
        server.stubFor(patch(urlPathEqualTo("/v1.0/things/1"))
            .willReturn(aResponse().withStatus(204)));

        JsonNode body = client.request("PATCH", "things/1", Map.of(), Map.of("name", "x"));

        assertThat(body.isNull()).isTrue();
        server.verify(patchRequestedFor(urlPathEqualTo("/v1.0/things/1"))
            .withHeader("Content-Type", equalTo("application/json"))
            .withRequestBody(equalToJson("{\"name\":\"x\"}")));
    }

    @Test
    void shouldHonorRetryAfterOnRateLimit() {
        // Given
        server.stubFor(get(urlPathEqualTo("/v1.0/users")).inScenario("throttle")
            .whenScenarioStateIs(STARTED)
            .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "2"))
            .willSetStateTo("cleared"));
        server.stubFor(get(urlPathEqualTo("/v1.0/users")).inScenario("throttle")
            .whenScenarioStateIs("cleared")
            .willReturn(okJson("{\"value\":[{\"id\":\"u1\"}]}")));

        // When
        JsonNode body = client.get("users");

        // Then
        assertThat(body.path("value").get(0).path("id").asText()).isEqualTo("u1");
        assertThat(graph.sleeps()).containsExactly(Duration.ofSeconds(2));
    }

    @Test
    void shouldFailAfterRateLimitBudget() {
        GraphClient limited = graph.client(Map.of("entragov.graph.retry.max-rate-limit-retries", "2"));
        server.stubFor(get(urlPathEqualTo("/v1.0/users"))
            .willReturn(aResponse().withStatus(429)));

        assertThatThrownBy(() -> limited.get("users"))
            .isInstanceOf(RateLimitExceededException.class);
        server.verify(3, getRequestedFor(urlPathEqualTo("/v1.0/users")));
        assertThat(graph.sleeps()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
    }

    @Test
    void shouldBackOffExponentiallyUntilServerErrorBudgetIsExhausted() {
        // Given
        server.stubFor(get(urlPathEqualTo("/v1.0/users"))
            .willReturn(aResponse().withStatus(502).withBody("bad gateway")));

        // When / Then
        assertThatThrownBy(() -> client.get("users"))
            .isInstanceOf(TransientServerException.class)
            .extracting(e -> ((TransientServerException) e).getStatusCode())
            .isEqualTo(502);
        server.verify(4, getRequestedFor(urlPathEqualTo("/v1.0/users")));
        assertThat(graph.sleeps())
            .containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
    }

    @Test
    void shouldRefreshTokenOnceAfter401() {
        // Given
        server.stubFor(get(urlPathEqualTo("/v1.0/users")).inScenario("auth")
            .whenScenarioStateIs(STARTED)
            .willReturn(aResponse().withStatus(401))
            .willSetStateTo("refreshed"));
        server.stubFor(get(urlPathEqualTo("/v1.0/users")).inScenario("auth")
            .whenScenarioStateIs("refreshed")
            .willReturn(okJson("{\"value\":[]}")));

        // When
        client.get("users");

        // Then
        assertThat(graph.exchanges()).isEqualTo(2);
        server.verify(getRequestedFor(urlPathEqualTo("/v1.0/users"))
            .withHeader("Authorization", equalTo("Bearer token-2")));
        assertThat(graph.sleeps()).isEmpty();
    }

    @Test
    void shouldFailWhenFreshTokenIsAlsoRejected() {
        server.stubFor(get(urlPathEqualTo("/v1.0/users"))
            .willReturn(aResponse().withStatus(401)));

        assertThatThrownBy(() -> client.get("users"))
            .isInstanceOf(AuthenticationException.class);
        server.verify(2, getRequestedFor(urlPathEqualTo("/v1.0/users")));
    }

    @Test
    void shouldNotRetryWriteOnServerError() {
        server.stubFor(post(urlPathEqualTo("/v1.0/things"))
            .willReturn(aResponse().withStatus(503)));

        assertThatThrownBy(() -> client.request("POST", "things", Map.of(), Map.of("a", 1)))
            .isInstanceOf(TransientServerException.class);
        server.verify(1, postRequestedFor(urlPathEqualTo("/v1.0/things")));
        assertThat(graph.sleeps()).isEmpty();
    }

    @Test
    void shouldNotRetryWriteOn401() {
        server.stubFor(post(urlPathEqualTo("/v1.0/things"))
            .willReturn(aResponse().withStatus(401)));

        assertThatThrownBy(() -> client.request("POST", "things", Map.of(), Map.of("a", 1)))
            .isInstanceOf(AuthenticationException.class)
            .hasMessageContaining("things");
        server.verify(1, postRequestedFor(urlPathEqualTo("/v1.0/things")));
    }

    @Test
    void shouldSurfaceClientErrorWithBody() {
        server.stubFor(get(urlPathEqualTo("/v1.0/users/missing"))
            .willReturn(aResponse().withStatus(404)
                .withBody("{\"error\":{\"code\":\"Request_ResourceNotFound\"}}")));

        assertThatThrownBy(() -> client.get("users/missing"))
            .isInstanceOfSatisfying(RequestException.class, e -> {
                assertThat(e.getStatusCode()).isEqualTo(404);
                assertThat(e.getBody()).contains("Request_ResourceNotFound");
            });
        server.verify(1, getRequestedFor(urlPathEqualTo("/v1.0/users/missing")));
    }

    @Test
    void shouldRetryWriteWhenConnectionDropsBeforeAnyResponse() {
        // Given the first POST is reset by the server, the second succeeds
        server.stubFor(post(urlPathEqualTo("/v1.0/groups")).inScenario("reset")
            .whenScenarioStateIs(STARTED)
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER))
            .willSetStateTo("recovered"));
        server.stubFor(post(urlPathEqualTo("/v1.0/groups")).inScenario("reset")
            .whenScenarioStateIs("recovered")
            .willReturn(aResponse().withStatus(201).withHeader("Content-Type", "application/json")
                .withBody("{\"id\":\"g1\"}")));

        // When
        JsonNode created = client.request("POST", "groups", Map.of(), Map.of("displayName", "Auditors"));

        // Then
        assertThat(created.path("id").asText()).isEqualTo("g1");
        server.verify(2, postRequestedFor(urlPathEqualTo("/v1.0/groups")));
        assertThat(graph.sleeps()).containsExactly(Duration.ofMillis(100));
    }

    @Test
    void shouldRaiseNetworkExceptionWhenNothingListens() {
        // Given a port with no server behind it
        WireMockServer closed = new WireMockServer(options().dynamicPort());
        closed.start();
        String deadUrl = closed.baseUrl();
        closed.stop();
        GraphClient unreachable = graph.client(Map.of(
            "entragov.graph.base-url", deadUrl,
            "entragov.graph.retry.max-network-retries", "2"));

        // When / Then
        assertThatThrownBy(() -> unreachable.get("users"))
            .isInstanceOf(NetworkException.class)
            .satisfies(e -> assertThat(((NetworkException) e).hasResponse()).isFalse());
        assertThat(graph.sleeps()).hasSize(2);
    }

    @Test
    void shouldRaiseTimeoutWhenResponseIsTooSlow() {
        server.stubFor(get(urlPathEqualTo("/v1.0/slow"))
            .willReturn(okJson("{}").withFixedDelay(2000)));
        GraphClient impatient = graph.client(Map.of(
            "entragov.graph.http.request-timeout", "PT0.2S",
            "entragov.graph.retry.max-network-retries", "0"));

        assertThatThrownBy(() -> impatient.get("slow"))
            .isInstanceOf(RequestTimeoutException.class);
    }

    @Test
    void shouldKeepAbsoluteUrlsUnchanged() {
        server.stubFor(get(urlPathEqualTo("/beta/users"))
            .willReturn(okJson("{\"value\":[]}")));

        client.get(server.baseUrl() + "/beta/users");

        server.verify(1, getRequestedFor(urlPathEqualTo("/beta/users")));
    }
}
