package io.github.drompincen.fixflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum UserRole {
    ADMIN("admin"),
    SUPERVISOR("supervisor"),
    TECHNICIAN("technician"),
    CLIENT("client");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    public boolean isStaff() {
        return this == ADMIN || this == SUPERVISOR;
    }

    @JsonCreator
    public static UserRole fromValue(String value) {
        for (UserRole role : values()) {
            if (role.value.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
