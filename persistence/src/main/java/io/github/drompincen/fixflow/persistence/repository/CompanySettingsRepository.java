package io.github.drompincen.fixflow.persistence.repository;

import io.github.drompincen.fixflow.persistence.document.CompanySettingsDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface CompanySettingsRepository extends MongoRepository<CompanySettingsDocument, String> {
}
