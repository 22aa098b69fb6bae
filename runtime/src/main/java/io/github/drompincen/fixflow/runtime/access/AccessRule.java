package io.github.drompincen.fixflow.runtime.access;

import io.github.drompincen.fixflow.persistence.document.WorkOrderDocument;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;

import java.util.Objects;

public enum AccessRule {
    ALLOW,
    DENY,
    /** Only work orders whose client is the caller. */
    OWN_AS_CLIENT,
    /** Only work orders currently assigned to the caller. */
    OWN_AS_ASSIGNEE;

    public boolean permits(CurrentUser user, WorkOrderDocument workOrder) {
        return switch (this) {
            case ALLOW -> true;
            case DENY -> false;
            case OWN_AS_CLIENT -> workOrder != null && Objects.equals(workOrder.getClientId(), user.id());
            case OWN_AS_ASSIGNEE -> workOrder != null && Objects.equals(workOrder.getAssignedToId(), user.id());
        };
    }
}
