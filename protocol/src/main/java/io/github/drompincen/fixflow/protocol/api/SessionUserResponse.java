package io.github.drompincen.fixflow.protocol.api;

public record SessionUserResponse(PublicUserDto user) {}
