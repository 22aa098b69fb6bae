package io.github.drompincen.fixflow.runtime.access;

public enum Operation {
    WORK_ORDER_LIST,
    WORK_ORDER_READ,
    WORK_ORDER_CREATE,
    WORK_ORDER_UPDATE,
    WORK_ORDER_DELETE,
    COMMENT_LIST,
    COMMENT_CREATE,
    COST_LIST,
    COST_CREATE,
    PREVENTIVE_MAINTENANCE_READ,
    PREVENTIVE_MAINTENANCE_CREATE,
    USER_LIST,
    USER_UPDATE,
    USER_DEACTIVATE,
    SETTINGS_READ,
    SETTINGS_UPDATE,
    NOTIFICATION_ACCESS,
    DASHBOARD_READ
}
