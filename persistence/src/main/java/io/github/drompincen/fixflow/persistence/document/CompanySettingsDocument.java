package io.github.drompincen.fixflow.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "company_settings")
public class CompanySettingsDocument {

    public static final String SINGLETON_ID = "company_settings";

    @Id
    private String id;
    private String companyName;
    private String logoUrl;
    private String primaryColor;
    private String secondaryColor;
    private String timezone;
    private Instant updatedAt;

    public CompanySettingsDocument() {}

    public static CompanySettingsDocument defaults() {
        CompanySettingsDocument settings = new CompanySettingsDocument();
        settings.setId(SINGLETON_ID);
        settings.setCompanyName("My Company");
        settings.setPrimaryColor("#3b82f6");
        settings.setSecondaryColor("#10b981");
        settings.setTimezone("UTC");
        settings.setUpdatedAt(Instant.now());
        return settings;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getCompanyName() { return companyName; }
    public void setCompanyName(String companyName) { this.companyName = companyName; }

    public String getLogoUrl() { return logoUrl; }
    public void setLogoUrl(String logoUrl) { this.logoUrl = logoUrl; }

    public String getPrimaryColor() { return primaryColor; }
    public void setPrimaryColor(String primaryColor) { this.primaryColor = primaryColor; }

    public String getSecondaryColor() { return secondaryColor; }
    public void setSecondaryColor(String secondaryColor) { this.secondaryColor = secondaryColor; }

    public String getTimezone() { return timezone; }
    public void setTimezone(String timezone) { this.timezone = timezone; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
