package io.github.drompincen.fixflow.gateway.controller;

import io.github.drompincen.fixflow.persistence.document.CompanySettingsDocument;
import io.github.drompincen.fixflow.protocol.api.CompanySettingsDto;
import io.github.drompincen.fixflow.protocol.api.UpdateCompanySettingsRequest;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.settings.SettingsService;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/settings")
public class SettingsController {

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @GetMapping
    public CompanySettingsDto get(@AuthenticationPrincipal CurrentUser user) {
        return toDto(settingsService.get(user));
    }

    @PatchMapping
    public CompanySettingsDto update(@RequestBody UpdateCompanySettingsRequest req,
                                     @AuthenticationPrincipal CurrentUser user) {
        return toDto(settingsService.update(req, user));
    }

    private CompanySettingsDto toDto(CompanySettingsDocument s) {
        return new CompanySettingsDto(s.getId(), s.getCompanyName(), s.getLogoUrl(), s.getPrimaryColor(),
                s.getSecondaryColor(), s.getTimezone(), s.getUpdatedAt());
    }
}
