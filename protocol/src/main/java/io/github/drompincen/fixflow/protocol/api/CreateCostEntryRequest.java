package io.github.drompincen.fixflow.protocol.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record CreateCostEntryRequest(
        String workOrderId,
        @NotBlank String description,
        @NotBlank String costType,
        @NotNull Double amount
) {}
