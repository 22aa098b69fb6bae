package io.github.drompincen.fixflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RequestType {
    MEP("MEP"),
    CIVIL("Civil"),
    PLUMBING("Plumbing"),
    ELECTRICAL("Electrical"),
    HVAC("HVAC"),
    OTHER("Other");

    private final String value;

    RequestType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    @JsonCreator
    public static RequestType fromValue(String value) {
        for (RequestType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown request type: " + value);
    }
}
