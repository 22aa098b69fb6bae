package io.github.drompincen.fixflow.runtime.auth;

import io.github.drompincen.fixflow.persistence.document.UserDocument;

import java.time.Instant;

/** Outcome of an external-identity login: the stored session and its owner. */
public record SessionLogin(UserDocument user, String sessionToken, Instant expiresAt) {}
