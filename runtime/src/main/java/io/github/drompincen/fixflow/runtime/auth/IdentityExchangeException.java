package io.github.drompincen.fixflow.runtime.auth;

public class IdentityExchangeException extends Exception {

    private final boolean timeout;

    public IdentityExchangeException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
    }

    public IdentityExchangeException(String message) {
        this(message, false, null);
    }

    public boolean isTimeout() { return timeout; }
}
