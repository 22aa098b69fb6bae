package io.github.drompincen.fixflow.persistence.document;

import io.github.drompincen.fixflow.protocol.api.UserRole;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "comments")
@CompoundIndex(name = "work_order_created", def = "{'workOrderId': 1, 'createdAt': -1}")
public class CommentDocument {

    @Id
    private String id;
    private String workOrderId;
    private String userId;
    private String userName;
    private UserRole userRole;
    private String content;
    private Instant createdAt;

    public CommentDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getWorkOrderId() { return workOrderId; }
    public void setWorkOrderId(String workOrderId) { this.workOrderId = workOrderId; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getUserName() { return userName; }
    public void setUserName(String userName) { this.userName = userName; }

    public UserRole getUserRole() { return userRole; }
    public void setUserRole(UserRole userRole) { this.userRole = userRole; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
