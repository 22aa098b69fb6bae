package io.github.drompincen.fixflow.protocol.api;

import java.time.Instant;

public record CommentDto(
        String id,
        String workOrderId,
        String userId,
        String userName,
        UserRole userRole,
        String content,
        Instant createdAt
) {}
