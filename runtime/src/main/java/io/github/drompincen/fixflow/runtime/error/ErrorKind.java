package io.github.drompincen.fixflow.runtime.error;

public enum ErrorKind {
    UNAUTHENTICATED,
    FORBIDDEN,
    NOT_FOUND,
    CONFLICT,
    BAD_REQUEST,
    UPSTREAM_TIMEOUT
}
