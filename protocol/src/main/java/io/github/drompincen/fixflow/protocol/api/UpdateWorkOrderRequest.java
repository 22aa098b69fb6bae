package io.github.drompincen.fixflow.protocol.api;

/**
 * Partial update of a work order. Null components are left untouched.
 * {@code totalCost} is accepted on the wire only so that it can be rejected:
 * the total is derived from cost entries.
 */
public record UpdateWorkOrderRequest(
        String title,
        String description,
        WorkOrderStatus status,
        RequestType requestType,
        SlaType slaType,
        String location,
        String department,
        String assignedToId,
        String startDate,
        String dueDate,
        String completedAt,
        Integer durationDays,
        Double totalCost
) {}
