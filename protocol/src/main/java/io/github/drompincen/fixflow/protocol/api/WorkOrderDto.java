package io.github.drompincen.fixflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record WorkOrderDto(
        String id,
        String requestId,
        String title,
        String description,
        WorkOrderStatus status,
        RequestType requestType,
        SlaType slaType,
        String location,
        String department,
        String clientId,
        String clientName,
        String assignedToId,
        String assignedToName,
        String startDate,
        String dueDate,
        String completedAt,
        Integer durationDays,
        @JsonProperty("is_delayed") boolean isDelayed,
        double totalCost,
        String createdById,
        String createdByName,
        Instant createdAt,
        Instant updatedAt
) {}
