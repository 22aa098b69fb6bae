package io.github.drompincen.fixflow.persistence.repository;

import io.github.drompincen.fixflow.persistence.document.CommentDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CommentRepository extends MongoRepository<CommentDocument, String> {
    List<CommentDocument> findTop100ByWorkOrderIdOrderByCreatedAtDesc(String workOrderId);
}
