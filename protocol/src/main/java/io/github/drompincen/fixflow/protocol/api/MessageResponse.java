package io.github.drompincen.fixflow.protocol.api;

public record MessageResponse(String message) {}
