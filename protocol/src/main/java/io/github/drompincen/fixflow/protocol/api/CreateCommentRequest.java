package io.github.drompincen.fixflow.protocol.api;

import jakarta.validation.constraints.NotBlank;

public record CreateCommentRequest(String workOrderId, @NotBlank String content) {}
