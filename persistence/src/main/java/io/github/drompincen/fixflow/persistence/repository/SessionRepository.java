package io.github.drompincen.fixflow.persistence.repository;

import io.github.drompincen.fixflow.persistence.document.SessionDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface SessionRepository extends MongoRepository<SessionDocument, String> {
    List<SessionDocument> findBySessionToken(String sessionToken);
    long deleteBySessionToken(String sessionToken);
}
