package io.github.drompincen.fixflow.protocol.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateWorkOrderRequest(
        @NotBlank String title,
        @NotBlank String description,
        @NotNull RequestType requestType,
        SlaType slaType,
        @NotBlank String location,
        String department,
        @NotBlank String clientId,
        String assignedToId,
        String startDate,
        String dueDate,
        Integer durationDays
) {}
