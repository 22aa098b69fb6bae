package io.github.drompincen.fixflow.protocol.api;

public record PublicUserDto(String id, String email, String name, UserRole role, String picture) {}
