package io.github.drompincen.fixflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record UserDto(
        String id,
        String email,
        String name,
        UserRole role,
        String picture,
        @JsonProperty("is_active") boolean isActive,
        Instant createdAt
) {}
