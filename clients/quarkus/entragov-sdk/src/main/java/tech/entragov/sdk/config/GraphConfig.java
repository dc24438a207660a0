package tech.entragov.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Configuration for the Entra governance Graph SDK.
 *
 * <p>Configure in application.properties:
 * <pre>
 * entragov.graph.tenant-id=00000000-0000-0000-0000-000000000000
 * entragov.graph.client-id=your_app_registration_id
 * entragov.graph.client-secret=your_client_secret
 * entragov.graph.base-url=https://graph.microsoft.com/beta
 * </pre>
 */
@ConfigMapping(prefix = "entragov.graph")
public interface GraphConfig {

    /**
     * Directory (tenant) ID the app registration lives in.
     */
    @WithName("tenant-id")
    Optional<String> tenantId();

    /**
     * App registration client ID.
     */
    @WithName("client-id")
    Optional<String> clientId();

    /**
     * App registration client secret.
     */
    @WithName("client-secret")
    Optional<String> clientSecret();

    /**
     * Identity platform authority. The token endpoint is
     * {authority}/{tenant-id}/oauth2/v2.0/token unless token-url is set.
     */
    @WithDefault("https://login.microsoftonline.com")
    String authority();

    /**
     * Explicit token endpoint, overrides the authority-derived one.
     */
    @WithName("token-url")
    Optional<String> tokenUrl();

    /**
     * Base URL for resource requests (v1.0 or beta).
     */
    @WithName("base-url")
    @WithDefault("https://graph.microsoft.com/v1.0")
    String baseUrl();

    /**
     * Scopes requested in the client credentials exchange.
     */
    @WithDefault("https://graph.microsoft.com/.default")
    List<String> scopes();

    /**
     * A cached token is refreshed once it is this close to expiry.
     */
    @WithName("token-refresh-margin")
    @WithDefault("PT5M")
    Duration tokenRefreshMargin();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    /**
     * Retry and backoff configuration.
     */
    RetryConfig retry();

    /**
     * Batch configuration.
     */
    BatchConfig batch();

    /**
     * Paging configuration.
     */
    PagingConfig paging();

    interface HttpConfig {
        @WithName("connect-timeout")
        @WithDefault("PT10S")
        Duration connectTimeout();

        /**
         * Timeout for a single request, including reading the response.
         */
        @WithName("request-timeout")
        @WithDefault("PT30S")
        Duration requestTimeout();
    }

    interface RetryConfig {
        /**
         * Retries allowed for 429 and 503-with-Retry-After responses.
         */
        @WithName("max-rate-limit-retries")
        @WithDefault("5")
        int maxRateLimitRetries();

        /**
         * Retries allowed for other 5xx responses.
         */
        @WithName("max-server-error-retries")
        @WithDefault("3")
        int maxServerErrorRetries();

        /**
         * Retries allowed for connection failures and timeouts.
         */
        @WithName("max-network-retries")
        @WithDefault("3")
        int maxNetworkRetries();

        @WithName("backoff-base")
        @WithDefault("PT1S")
        Duration backoffBase();

        @WithName("backoff-max")
        @WithDefault("PT60S")
        Duration backoffMax();
    }

    interface BatchConfig {
        /**
         * Sub-requests per $batch call. Graph accepts at most 20.
         */
        @WithDefault("20")
        int size();
    }

    interface PagingConfig {
        /**
         * Pages fetched before the continuation chain is considered broken.
         */
        @WithName("max-pages")
        @WithDefault("1000")
        int maxPages();

        @WithName("max-items")
        @WithDefault("200000")
        int maxItems();

        /**
         * Query parameter used to send back opaque (non-URL) cursors.
         */
        @WithName("continuation-param")
        @WithDefault("$skiptoken")
        String continuationParam();
    }
}
