package io.github.drompincen.fixflow.runtime.auth;

import io.github.drompincen.fixflow.persistence.document.UserDocument;

/** A freshly signed bearer token and the user it belongs to. */
public record AuthResult(String token, UserDocument user) {}
