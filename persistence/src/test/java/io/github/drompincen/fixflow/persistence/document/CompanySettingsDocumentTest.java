package io.github.drompincen.fixflow.persistence.document;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CompanySettingsDocumentTest {

    @Test
    void defaultsMatchDocumentedValues() {
        CompanySettingsDocument settings = CompanySettingsDocument.defaults();

        assertThat(settings.getId()).isEqualTo(CompanySettingsDocument.SINGLETON_ID);
        assertThat(settings.getCompanyName()).isEqualTo("My Company");
        assertThat(settings.getLogoUrl()).isNull();
        assertThat(settings.getPrimaryColor()).isEqualTo("#3b82f6");
        assertThat(settings.getSecondaryColor()).isEqualTo("#10b981");
        assertThat(settings.getTimezone()).isEqualTo("UTC");
        assertThat(settings.getUpdatedAt()).isNotNull();
    }
}
