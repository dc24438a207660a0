package tech.entragov.sdk.client.auth;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.entragov.sdk.config.GraphConfig;
import tech.entragov.sdk.exception.AuthenticationException;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caches client credentials tokens per identity and scope set.
 *
 * <p>Refresh is single-flight: while an exchange for a key is running, every other caller
 * asking for that key waits on the same future instead of starting its own exchange.
 */
@ApplicationScoped
public class TokenManager {

    private static final Logger LOG = Logger.getLogger(TokenManager.class);

    private final CredentialExchange exchange;
    private final Clock clock;
    private final Duration margin;
    private final String identity;
    private final Set<String> defaultScopes;

    private final ConcurrentMap<CacheKey, Credential> cache = new ConcurrentHashMap<>();
    private final ConcurrentMap<CacheKey, CompletableFuture<Credential>> inFlight = new ConcurrentHashMap<>();

    @Inject
    public TokenManager(GraphConfig config) {
        this(config, new ClientCredentialsExchange(config, Clock.systemUTC()), Clock.systemUTC());
    }

    public TokenManager(GraphConfig config, CredentialExchange exchange, Clock clock) {
        this.exchange = exchange;
        this.clock = clock;
        this.margin = config.tokenRefreshMargin();
        this.identity = config.tenantId().orElse("") + "/" + config.clientId().orElse("");
        this.defaultScopes = Set.copyOf(config.scopes());
    }

    /**
     * Get a usable token for the configured scopes, exchanging credentials if necessary.
     */
    public Credential getToken() {
        return getToken(defaultScopes);
    }

    /**
     * Get a usable token for the given scopes, exchanging credentials if necessary.
     */
    public Credential getToken(Set<String> scopes) {
        CacheKey key = new CacheKey(identity, new TreeSet<>(scopes).toString());
        Credential cached = cache.get(key);
        if (cached != null && cached.isUsableAt(clock.instant(), margin)) {
            return cached;
        }
        return refresh(key, scopes);
    }

    /**
     * Drop {@code stale} from the cache if it is still the cached token for its scopes.
     * A credential that was already replaced by a concurrent refresh is left alone.
     */
    public void invalidate(Credential stale) {
        // Granted scopes can differ from the requested ones, so match on the value
        if (cache.entrySet().removeIf(entry -> entry.getValue().equals(stale))) {
            LOG.debug("Cached access token invalidated");
        }
    }

    private Credential refresh(CacheKey key, Set<String> scopes) {
        CompletableFuture<Credential> mine = new CompletableFuture<>();
        CompletableFuture<Credential> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            return await(running);
        }

        try {
            // Another caller may have finished a refresh between our cache read and putIfAbsent
            Credential current = cache.get(key);
            Credential fresh = current != null && current.isUsableAt(clock.instant(), margin)
                ? current
                : exchange.exchange(scopes);
            if (!fresh.isUsableAt(clock.instant(), margin)) {
                LOG.warnf("Fresh access token expires at %s, inside the %s refresh margin",
                    fresh.expiresAt(), margin);
            }
            cache.put(key, fresh);
            mine.complete(fresh);
            return fresh;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(key, mine);
        }
    }

    private Credential await(CompletableFuture<Credential> running) {
        try {
            return running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new AuthenticationException("Token refresh failed", e.getCause());
        }
    }

    private record CacheKey(String identity, String scopes) {}
}
