package io.github.drompincen.fixflow.runtime.settings;

import io.github.drompincen.fixflow.persistence.document.CompanySettingsDocument;
import io.github.drompincen.fixflow.persistence.repository.CompanySettingsRepository;
import io.github.drompincen.fixflow.protocol.api.UpdateCompanySettingsRequest;
import io.github.drompincen.fixflow.runtime.Actors;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.error.ErrorKind;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static io.github.drompincen.fixflow.runtime.Actors.admin;
import static io.github.drompincen.fixflow.runtime.Actors.client;
import static io.github.drompincen.fixflow.runtime.Actors.supervisor;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SettingsServiceTest {

    @Mock
    private CompanySettingsRepository settingsRepository;

    private SettingsService service;
    private final AtomicReference<CompanySettingsDocument> stored = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        service = new SettingsService(settingsRepository, new AccessPolicy(), Actors.CLOCK);
    }

    private void backRepositoryWithMemory() {
        when(settingsRepository.findById(CompanySettingsDocument.SINGLETON_ID))
                .thenAnswer(inv -> Optional.ofNullable(stored.get()));
    }

    @Test
    void firstReadCreatesDefaultsOnceThenReturnsStoredRecord() {
        backRepositoryWithMemory();
        when(settingsRepository.insert(any(CompanySettingsDocument.class))).thenAnswer(inv -> {
            stored.set(inv.getArgument(0));
            return inv.getArgument(0);
        });

        CompanySettingsDocument first = service.get(client("c1"));
        CompanySettingsDocument second = service.get(client("c1"));

        assertThat(first.getCompanyName()).isEqualTo("My Company");
        assertThat(first.getPrimaryColor()).isEqualTo("#3b82f6");
        assertThat(first.getSecondaryColor()).isEqualTo("#10b981");
        assertThat(first.getTimezone()).isEqualTo("UTC");
        assertThat(first.getLogoUrl()).isNull();
        assertThat(second).isSameAs(first);
        verify(settingsRepository, times(1)).insert(any(CompanySettingsDocument.class));
    }

    @Test
    void updateMergesOnlyProvidedFields() {
        backRepositoryWithMemory();
        CompanySettingsDocument existing = CompanySettingsDocument.defaults();
        existing.setCompanyName("Acme");
        stored.set(existing);
        when(settingsRepository.save(any(CompanySettingsDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        CompanySettingsDocument updated = service.update(
                new UpdateCompanySettingsRequest(null, "https://logo", "#000000", null, null), admin());

        assertThat(updated.getCompanyName()).isEqualTo("Acme");
        assertThat(updated.getLogoUrl()).isEqualTo("https://logo");
        assertThat(updated.getPrimaryColor()).isEqualTo("#000000");
        assertThat(updated.getSecondaryColor()).isEqualTo("#10b981");
        assertThat(updated.getUpdatedAt()).isEqualTo(Actors.NOW);
    }

    @Test
    void updateBeforeAnyReadUpsertsDefaults() {
        backRepositoryWithMemory();
        when(settingsRepository.save(any(CompanySettingsDocument.class))).thenAnswer(inv -> inv.getArgument(0));

        CompanySettingsDocument updated = service.update(
                new UpdateCompanySettingsRequest("Fresh Co", null, null, null, "Europe/Paris"), admin());

        assertThat(updated.getId()).isEqualTo(CompanySettingsDocument.SINGLETON_ID);
        assertThat(updated.getCompanyName()).isEqualTo("Fresh Co");
        assertThat(updated.getTimezone()).isEqualTo("Europe/Paris");
        assertThat(updated.getPrimaryColor()).isEqualTo("#3b82f6");
    }

    @Test
    void onlyAdminsUpdate() {
        assertThatThrownBy(() -> service.update(
                new UpdateCompanySettingsRequest("x", null, null, null, null), supervisor()))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
        verifyNoInteractions(settingsRepository);
    }
}
