package io.github.drompincen.fixflow.runtime.settings;

import io.github.drompincen.fixflow.persistence.document.CompanySettingsDocument;
import io.github.drompincen.fixflow.persistence.repository.CompanySettingsRepository;
import io.github.drompincen.fixflow.protocol.api.UpdateCompanySettingsRequest;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.access.Operation;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * The single company-settings record. It is created with defaults on first read, and
 * later reads return the stored record unchanged.
 */
@Service
public class SettingsService {

    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    private final CompanySettingsRepository settingsRepository;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    public SettingsService(CompanySettingsRepository settingsRepository, AccessPolicy accessPolicy, Clock clock) {
        this.settingsRepository = settingsRepository;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    public CompanySettingsDocument get(CurrentUser user) {
        accessPolicy.check(user, Operation.SETTINGS_READ);
        return loadOrInitialize();
    }

    public CompanySettingsDocument update(UpdateCompanySettingsRequest request, CurrentUser user) {
        accessPolicy.check(user, Operation.SETTINGS_UPDATE);
        CompanySettingsDocument settings = settingsRepository.findById(CompanySettingsDocument.SINGLETON_ID)
                .orElseGet(this::defaults);

        if (request.companyName() != null) settings.setCompanyName(request.companyName());
        if (request.logoUrl() != null) settings.setLogoUrl(request.logoUrl());
        if (request.primaryColor() != null) settings.setPrimaryColor(request.primaryColor());
        if (request.secondaryColor() != null) settings.setSecondaryColor(request.secondaryColor());
        if (request.timezone() != null) settings.setTimezone(request.timezone());
        settings.setUpdatedAt(clock.instant());

        settings = settingsRepository.save(settings);
        log.info("Company settings updated by {}", user.id());
        return settings;
    }

    CompanySettingsDocument loadOrInitialize() {
        return settingsRepository.findById(CompanySettingsDocument.SINGLETON_ID).orElseGet(() -> {
            try {
                CompanySettingsDocument created = settingsRepository.insert(defaults());
                log.info("Initialized default company settings");
                return created;
            } catch (DuplicateKeyException e) {
                log.debug("Company settings initialized concurrently");
                return settingsRepository.findById(CompanySettingsDocument.SINGLETON_ID).orElseThrow(() -> e);
            }
        });
    }

    private CompanySettingsDocument defaults() {
        CompanySettingsDocument settings = CompanySettingsDocument.defaults();
        settings.setUpdatedAt(clock.instant());
        return settings;
    }
}
