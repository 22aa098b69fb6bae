package io.github.drompincen.fixflow.runtime.access;

/**
 * The set of work orders a caller may see: everything, or only those matching one
 * ownership field.
 */
public record WorkOrderScope(Kind kind, String userId) {

    public enum Kind { ALL, CLIENT, ASSIGNEE }

    public static WorkOrderScope all() {
        return new WorkOrderScope(Kind.ALL, null);
    }

    public static WorkOrderScope client(String userId) {
        return new WorkOrderScope(Kind.CLIENT, userId);
    }

    public static WorkOrderScope assignee(String userId) {
        return new WorkOrderScope(Kind.ASSIGNEE, userId);
    }
}
