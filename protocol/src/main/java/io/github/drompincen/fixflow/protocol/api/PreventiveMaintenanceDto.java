package io.github.drompincen.fixflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record PreventiveMaintenanceDto(
        String id,
        String title,
        String description,
        String location,
        String frequency,
        String nextDueDate,
        String assignedToId,
        String assignedToName,
        @JsonProperty("is_active") boolean isActive,
        Instant createdAt
) {}
