package io.github.drompincen.fixflow.runtime.access;

import io.github.drompincen.fixflow.persistence.document.WorkOrderDocument;
import io.github.drompincen.fixflow.protocol.api.UserRole;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static io.github.drompincen.fixflow.runtime.access.AccessRule.ALLOW;
import static io.github.drompincen.fixflow.runtime.access.AccessRule.DENY;
import static io.github.drompincen.fixflow.runtime.access.AccessRule.OWN_AS_ASSIGNEE;
import static io.github.drompincen.fixflow.runtime.access.AccessRule.OWN_AS_CLIENT;

/**
 * Operation x role permission table. Every service consults this table instead of
 * testing roles itself; ownership rules compare the caller id with a work order field.
 */
@Component
public class AccessPolicy {

    private static final Logger log = LoggerFactory.getLogger(AccessPolicy.class);

    private final Map<Operation, Map<UserRole, AccessRule>> table = new EnumMap<>(Operation.class);

    public AccessPolicy() {
        //                                          admin  supervisor technician        client
        define(Operation.WORK_ORDER_LIST,           ALLOW, ALLOW,     OWN_AS_ASSIGNEE,  OWN_AS_CLIENT);
        define(Operation.WORK_ORDER_READ,           ALLOW, ALLOW,     OWN_AS_ASSIGNEE,  OWN_AS_CLIENT);
        define(Operation.WORK_ORDER_CREATE,         ALLOW, ALLOW,     DENY,             DENY);
        define(Operation.WORK_ORDER_UPDATE,         ALLOW, ALLOW,     OWN_AS_ASSIGNEE,  DENY);
        define(Operation.WORK_ORDER_DELETE,         ALLOW, ALLOW,     DENY,             DENY);
        define(Operation.COMMENT_LIST,              ALLOW, ALLOW,     ALLOW,            ALLOW);
        define(Operation.COMMENT_CREATE,            ALLOW, ALLOW,     ALLOW,            ALLOW);
        define(Operation.COST_LIST,                 ALLOW, ALLOW,     ALLOW,            ALLOW);
        define(Operation.COST_CREATE,               ALLOW, ALLOW,     ALLOW,            DENY);
        define(Operation.PREVENTIVE_MAINTENANCE_READ,   ALLOW, ALLOW, DENY,             DENY);
        define(Operation.PREVENTIVE_MAINTENANCE_CREATE, ALLOW, ALLOW, DENY,             DENY);
        define(Operation.USER_LIST,                 ALLOW, ALLOW,     DENY,             DENY);
        define(Operation.USER_UPDATE,               ALLOW, DENY,      DENY,             DENY);
        define(Operation.USER_DEACTIVATE,           ALLOW, DENY,      DENY,             DENY);
        define(Operation.SETTINGS_READ,             ALLOW, ALLOW,     ALLOW,            ALLOW);
        define(Operation.SETTINGS_UPDATE,           ALLOW, DENY,      DENY,             DENY);
        define(Operation.NOTIFICATION_ACCESS,       ALLOW, ALLOW,     ALLOW,            ALLOW);
        define(Operation.DASHBOARD_READ,            ALLOW, ALLOW,     OWN_AS_ASSIGNEE,  OWN_AS_CLIENT);

        for (Operation op : Operation.values()) {
            if (!table.containsKey(op)) {
                throw new IllegalStateException("No access rule for " + op);
            }
        }
    }

    private void define(Operation op, AccessRule admin, AccessRule supervisor,
                        AccessRule technician, AccessRule client) {
        Map<UserRole, AccessRule> rules = new EnumMap<>(UserRole.class);
        rules.put(UserRole.ADMIN, admin);
        rules.put(UserRole.SUPERVISOR, supervisor);
        rules.put(UserRole.TECHNICIAN, technician);
        rules.put(UserRole.CLIENT, client);
        table.put(op, Collections.unmodifiableMap(rules));
    }

    public AccessRule ruleFor(UserRole role, Operation op) {
        return table.get(op).getOrDefault(role, DENY);
    }

    public boolean isAllowed(CurrentUser user, Operation op, WorkOrderDocument workOrder) {
        return ruleFor(user.role(), op).permits(user, workOrder);
    }

    /** Requires an unconditional grant; ownership rules need a resource and fail here. */
    public void check(CurrentUser user, Operation op) {
        if (ruleFor(user.role(), op) != ALLOW) {
            log.warn("Denied {} to user {} with role {}", op, user.id(), user.role());
            throw FixFlowException.forbidden("Insufficient permissions");
        }
    }

    public void check(CurrentUser user, Operation op, WorkOrderDocument workOrder) {
        AccessRule rule = ruleFor(user.role(), op);
        if (rule == DENY) {
            log.warn("Denied {} to user {} with role {}", op, user.id(), user.role());
            throw FixFlowException.forbidden("Insufficient permissions");
        }
        if (!rule.permits(user, workOrder)) {
            log.warn("Denied {} on work order {} to user {}", op, workOrder.getId(), user.id());
            throw FixFlowException.forbidden("Access denied");
        }
    }

    /** Translates the caller's rule for a listing operation into a query scope. */
    public WorkOrderScope scopeFor(CurrentUser user, Operation op) {
        return switch (ruleFor(user.role(), op)) {
            case ALLOW -> WorkOrderScope.all();
            case OWN_AS_CLIENT -> WorkOrderScope.client(user.id());
            case OWN_AS_ASSIGNEE -> WorkOrderScope.assignee(user.id());
            case DENY -> throw FixFlowException.forbidden("Insufficient permissions");
        };
    }
}
