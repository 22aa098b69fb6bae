package io.github.drompincen.fixflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SlaType {
    NORMAL("normal"),
    URGENT("urgent"),
    CRITICAL("critical");

    private final String value;

    SlaType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    @JsonCreator
    public static SlaType fromValue(String value) {
        for (SlaType sla : values()) {
            if (sla.value.equalsIgnoreCase(value) || sla.name().equalsIgnoreCase(value)) {
                return sla;
            }
        }
        throw new IllegalArgumentException("Unknown SLA type: " + value);
    }
}
