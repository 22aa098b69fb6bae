package io.github.drompincen.fixflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record NotificationDto(
        String id,
        String userId,
        String title,
        String message,
        String link,
        @JsonProperty("is_read") boolean isRead,
        Instant createdAt
) {}
