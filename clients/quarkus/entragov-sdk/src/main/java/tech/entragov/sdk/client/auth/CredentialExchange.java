package tech.entragov.sdk.client.auth;

import java.util.Set;

/**
 * Trades the configured client identity for a fresh bearer credential.
 */
@FunctionalInterface
public interface CredentialExchange {

    /**
     * @throws tech.entragov.sdk.exception.AuthenticationException if the identity provider rejects the exchange
     */
    Credential exchange(Set<String> scopes);
}
