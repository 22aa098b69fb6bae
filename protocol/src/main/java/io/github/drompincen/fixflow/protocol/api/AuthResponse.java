package io.github.drompincen.fixflow.protocol.api;

public record AuthResponse(String token, PublicUserDto user) {}
