package io.github.drompincen.fixflow.persistence.repository;

import io.github.drompincen.fixflow.persistence.document.PreventiveMaintenanceDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface PreventiveMaintenanceRepository extends MongoRepository<PreventiveMaintenanceDocument, String> {
    List<PreventiveMaintenanceDocument> findAllByOrderByNextDueDateAsc();
}
