package io.github.drompincen.fixflow.runtime.auth;

/**
 * Trades a one-time session id issued by the external identity provider for the
 * identity it stands for.
 */
public interface IdentityExchange {

    ExternalIdentity exchange(String sessionId) throws IdentityExchangeException;
}
