package io.github.drompincen.fixflow.persistence.repository;

import io.github.drompincen.fixflow.persistence.document.NotificationDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface NotificationRepository extends MongoRepository<NotificationDocument, String> {
    List<NotificationDocument> findTop50ByUserIdOrderByCreatedAtDesc(String userId);
    List<NotificationDocument> findByUserId(String userId);
    Optional<NotificationDocument> findByIdAndUserId(String id, String userId);
}
