package io.github.drompincen.fixflow.persistence.repository;

import io.github.drompincen.fixflow.persistence.document.CostEntryDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CostEntryRepository extends MongoRepository<CostEntryDocument, String> {
    List<CostEntryDocument> findTop100ByWorkOrderIdOrderByCreatedAtDesc(String workOrderId);
    List<CostEntryDocument> findByWorkOrderId(String workOrderId);
}
