package io.github.drompincen.fixflow.protocol.api;

import java.time.Instant;

public record CompanySettingsDto(
        String id,
        String companyName,
        String logoUrl,
        String primaryColor,
        String secondaryColor,
        String timezone,
        Instant updatedAt
) {}
