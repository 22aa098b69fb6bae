package io.github.drompincen.fixflow.protocol.api;

public record UpdateCompanySettingsRequest(
        String companyName,
        String logoUrl,
        String primaryColor,
        String secondaryColor,
        String timezone
) {}
