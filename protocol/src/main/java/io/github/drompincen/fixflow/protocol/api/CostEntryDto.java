package io.github.drompincen.fixflow.protocol.api;

import java.time.Instant;

public record CostEntryDto(
        String id,
        String workOrderId,
        String description,
        String costType,
        double amount,
        String createdById,
        String createdByName,
        Instant createdAt
) {}
