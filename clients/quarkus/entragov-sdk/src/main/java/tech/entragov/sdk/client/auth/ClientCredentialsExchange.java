package tech.entragov.sdk.client.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import tech.entragov.sdk.config.GraphConfig;
import tech.entragov.sdk.exception.AuthenticationException;
import tech.entragov.sdk.exception.NetworkException;
import tech.entragov.sdk.exception.RequestTimeoutException;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * OAuth2 client credentials grant against the Microsoft identity platform.
 *
 * <p>A rejected grant raises {@link AuthenticationException}. Failing to reach the token
 * endpoint raises {@link RequestTimeoutException} or {@link NetworkException}.
 */
public class ClientCredentialsExchange implements CredentialExchange {

    private static final Logger LOG = Logger.getLogger(ClientCredentialsExchange.class);

    private final GraphConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ClientCredentialsExchange(GraphConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(config.http().connectTimeout())
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Credential exchange(Set<String> scopes) {
        String tenantId = config.tenantId()
            .orElseThrow(AuthenticationException::missingCredentials);
        String clientId = config.clientId()
            .orElseThrow(AuthenticationException::missingCredentials);
        String clientSecret = config.clientSecret()
            .orElseThrow(AuthenticationException::missingCredentials);

        String tokenUrl = config.tokenUrl()
            .orElseGet(() -> config.authority().replaceAll("/$", "") + "/" + tenantId + "/oauth2/v2.0/token");

        String body = "grant_type=client_credentials"
            + "&client_id=" + encode(clientId)
            + "&client_secret=" + encode(clientSecret)
            + "&scope=" + encode(String.join(" ", scopes));

        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(config.http().requestTimeout())
                .build();

            Instant requestedAt = clock.instant();
            HttpResponse<String> response = httpClient.send(
                request, HttpResponse.BodyHandlers.ofString()
            );

            JsonNode json = response.body() != null && !response.body().isBlank()
                ? objectMapper.readTree(response.body())
                : objectMapper.createObjectNode();

            if (response.statusCode() != 200 || !json.hasNonNull("access_token")) {
                String error = json.path("error").asText("http_" + response.statusCode());
                String description = json.path("error_description").asText("No description");
                LOG.warnf("Token request for client [%s] rejected: %s", clientId, error);
                throw AuthenticationException.invalidCredentials(error, description);
            }

            long expiresIn = json.path("expires_in").asLong(3600);
            Set<String> grantedScopes = json.hasNonNull("scope")
                ? Arrays.stream(json.get("scope").asText().split(" "))
                    .filter(s -> !s.isBlank())
                    .collect(Collectors.toCollection(LinkedHashSet::new))
                : scopes;

            LOG.infof("Access token acquired for client [%s], expires in %ds", clientId, expiresIn);
            return new Credential(
                json.get("access_token").asText(),
                requestedAt.plusSeconds(expiresIn),
                grantedScopes
            );
        } catch (JsonProcessingException e) {
            throw new AuthenticationException("Unreadable token response: " + e.getOriginalMessage(), e);
        } catch (HttpTimeoutException e) {
            throw new RequestTimeoutException(tokenUrl, config.http().requestTimeout(), e);
        } catch (IOException e) {
            throw new NetworkException("Token endpoint " + tokenUrl + " unreachable", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw NetworkException.interrupted(tokenUrl, e);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationException("Invalid token endpoint " + tokenUrl, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
