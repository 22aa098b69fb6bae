package io.github.drompincen.fixflow.persistence.repository;

import io.github.drompincen.fixflow.persistence.document.WorkOrderDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface WorkOrderRepository extends MongoRepository<WorkOrderDocument, String> {
    List<WorkOrderDocument> findAllByOrderByCreatedAtDesc();
    List<WorkOrderDocument> findByClientIdOrderByCreatedAtDesc(String clientId);
    List<WorkOrderDocument> findByAssignedToIdOrderByCreatedAtDesc(String assignedToId);
}
