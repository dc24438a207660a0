package tech.entragov.sdk.client.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/**
 * A bearer token and the moment it stops being accepted.
 */
public record Credential(
    String accessToken,
    Instant expiresAt,
    Set<String> scopes
) {
    public Credential {
        scopes = scopes != null ? Set.copyOf(scopes) : Set.of();
    }

    /**
     * Whether the token can still be handed out at {@code now}, keeping {@code margin}
     * in reserve for clock skew and in-flight request time.
     */
    public boolean isUsableAt(Instant now, Duration margin) {
        return accessToken != null
            && expiresAt != null
            && now.isBefore(expiresAt.minus(margin));
    }

    @Override
    public String toString() {
        return "Credential[expiresAt=" + expiresAt + ", scopes=" + scopes + "]";
    }
}
