package io.github.drompincen.fixflow.runtime.workorder;

import io.github.drompincen.fixflow.protocol.api.WorkOrderStatus;
import io.github.drompincen.fixflow.runtime.config.FixFlowProperties;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Status lifecycle: pending, in_progress, completed, approved, with cancelled reachable
 * from any non-terminal status. Only checked when
 * {@code fixflow.work-orders.enforce-transitions} is on.
 */
@Component
public class WorkOrderTransitions {

    private static final Map<WorkOrderStatus, Set<WorkOrderStatus>> NEXT = new EnumMap<>(WorkOrderStatus.class);

    static {
        NEXT.put(WorkOrderStatus.PENDING, EnumSet.of(WorkOrderStatus.IN_PROGRESS, WorkOrderStatus.CANCELLED));
        NEXT.put(WorkOrderStatus.IN_PROGRESS, EnumSet.of(WorkOrderStatus.COMPLETED, WorkOrderStatus.CANCELLED));
        NEXT.put(WorkOrderStatus.COMPLETED, EnumSet.of(WorkOrderStatus.APPROVED, WorkOrderStatus.CANCELLED));
        for (WorkOrderStatus status : WorkOrderStatus.values()) {
            if (status.isTerminal()) {
                NEXT.put(status, EnumSet.noneOf(WorkOrderStatus.class));
            }
        }
    }

    private final boolean enforced;

    @Autowired
    public WorkOrderTransitions(FixFlowProperties properties) {
        this(properties.getWorkOrders().isEnforceTransitions());
    }

    WorkOrderTransitions(boolean enforced) {
        this.enforced = enforced;
    }

    public boolean isEnforced() { return enforced; }

    public boolean isAllowed(WorkOrderStatus from, WorkOrderStatus to) {
        if (from == null || from == to) {
            return true;
        }
        return NEXT.getOrDefault(from, Set.of()).contains(to);
    }

    public void validate(WorkOrderStatus from, WorkOrderStatus to) {
        if (enforced && !isAllowed(from, to)) {
            throw FixFlowException.badRequest(
                    "Cannot change status from " + from.value() + " to " + to.value());
        }
    }
}
