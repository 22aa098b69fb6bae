package io.github.drompincen.fixflow.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Server-side session bound to a cookie token. Expiry is checked on read;
 * expired records are not swept.
 */
@Document(collection = "sessions")
public class SessionDocument {

    @Id
    private String id;

    @Indexed
    private String sessionToken;

    private String userId;
    private Instant expiresAt;
    private Instant createdAt;

    public SessionDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getSessionToken() { return sessionToken; }
    public void setSessionToken(String sessionToken) { this.sessionToken = sessionToken; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public boolean isExpiredAt(Instant now) {
        return expiresAt == null || !expiresAt.isAfter(now);
    }
}
