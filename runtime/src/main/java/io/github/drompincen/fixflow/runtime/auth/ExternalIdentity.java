package io.github.drompincen.fixflow.runtime.auth;

/** Identity returned by the external provider for a one-time session id. */
public record ExternalIdentity(String email, String name, String picture, String sessionToken) {}
