package io.github.drompincen.fixflow.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum WorkOrderStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    APPROVED("approved"),
    CANCELLED("cancelled");

    private final String value;

    WorkOrderStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    /** Approved and cancelled orders accept no further transitions when transitions are enforced. */
    public boolean isTerminal() {
        return this == APPROVED || this == CANCELLED;
    }

    @JsonCreator
    public static WorkOrderStatus fromValue(String value) {
        for (WorkOrderStatus status : values()) {
            if (status.value.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown work order status: " + value);
    }
}
