package io.github.drompincen.fixflow.protocol.api;

import jakarta.validation.constraints.NotBlank;

public record CreatePreventiveMaintenanceRequest(
        @NotBlank String title,
        @NotBlank String description,
        @NotBlank String location,
        @NotBlank String frequency,
        @NotBlank String nextDueDate,
        String assignedToId
) {}
