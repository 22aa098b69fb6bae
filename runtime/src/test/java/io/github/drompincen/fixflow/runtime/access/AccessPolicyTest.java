package io.github.drompincen.fixflow.runtime.access;

import io.github.drompincen.fixflow.persistence.document.WorkOrderDocument;
import io.github.drompincen.fixflow.protocol.api.UserRole;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.error.ErrorKind;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import org.junit.jupiter.api.Test;

import static io.github.drompincen.fixflow.runtime.Actors.admin;
import static io.github.drompincen.fixflow.runtime.Actors.client;
import static io.github.drompincen.fixflow.runtime.Actors.supervisor;
import static io.github.drompincen.fixflow.runtime.Actors.technician;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessPolicyTest {

    private final AccessPolicy policy = new AccessPolicy();

    private static WorkOrderDocument order(String clientId, String assigneeId) {
        WorkOrderDocument wo = new WorkOrderDocument();
        wo.setId("wo-1");
        wo.setClientId(clientId);
        wo.setAssignedToId(assigneeId);
        return wo;
    }

    @Test
    void everyOperationHasARuleForEveryRole() {
        for (Operation op : Operation.values()) {
            for (UserRole role : UserRole.values()) {
                assertThat(policy.ruleFor(role, op)).as("%s/%s", op, role).isNotNull();
            }
        }
    }

    @Test
    void listingScopeFollowsRole() {
        assertThat(policy.scopeFor(admin(), Operation.WORK_ORDER_LIST)).isEqualTo(WorkOrderScope.all());
        assertThat(policy.scopeFor(supervisor(), Operation.WORK_ORDER_LIST)).isEqualTo(WorkOrderScope.all());
        assertThat(policy.scopeFor(technician("t1"), Operation.WORK_ORDER_LIST))
                .isEqualTo(WorkOrderScope.assignee("t1"));
        assertThat(policy.scopeFor(client("c1"), Operation.WORK_ORDER_LIST))
                .isEqualTo(WorkOrderScope.client("c1"));
    }

    @Test
    void dashboardUsesTheSameScopeAsListing() {
        for (CurrentUser user : new CurrentUser[]{admin(), supervisor(), technician("t1"), client("c1")}) {
            assertThat(policy.scopeFor(user, Operation.DASHBOARD_READ))
                    .isEqualTo(policy.scopeFor(user, Operation.WORK_ORDER_LIST));
        }
    }

    @Test
    void clientsCannotCreateUpdateOrDeleteWorkOrders() {
        CurrentUser client = client("c1");
        WorkOrderDocument own = order("c1", null);

        assertThatThrownBy(() -> policy.check(client, Operation.WORK_ORDER_CREATE))
                .isInstanceOf(FixFlowException.class)
                .extracting(e -> ((FixFlowException) e).getKind()).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(policy.isAllowed(client, Operation.WORK_ORDER_UPDATE, own)).isFalse();
        assertThat(policy.isAllowed(client, Operation.WORK_ORDER_DELETE, own)).isFalse();
    }

    @Test
    void clientReadsOnlyOwnOrders() {
        assertThat(policy.isAllowed(client("c1"), Operation.WORK_ORDER_READ, order("c1", "t1"))).isTrue();
        assertThat(policy.isAllowed(client("c1"), Operation.WORK_ORDER_READ, order("c2", "t1"))).isFalse();
    }

    @Test
    void technicianUpdatesOnlyAssignedOrders() {
        CurrentUser tech = technician("t1");

        assertThatCode(() -> policy.check(tech, Operation.WORK_ORDER_UPDATE, order("c1", "t1")))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(tech, Operation.WORK_ORDER_UPDATE, order("c1", "t2")))
                .isInstanceOf(FixFlowException.class)
                .hasMessage("Access denied");
        assertThatThrownBy(() -> policy.check(tech, Operation.WORK_ORDER_UPDATE, order("c1", null)))
                .isInstanceOf(FixFlowException.class);
    }

    @Test
    void ownershipRulesFailWithoutAResource() {
        assertThatThrownBy(() -> policy.check(technician("t1"), Operation.WORK_ORDER_UPDATE))
                .isInstanceOf(FixFlowException.class)
                .hasMessage("Insufficient permissions");
    }

    @Test
    void onlyAdminManagesUsersAndSettings() {
        assertThatCode(() -> policy.check(admin(), Operation.USER_UPDATE)).doesNotThrowAnyException();
        assertThatCode(() -> policy.check(admin(), Operation.SETTINGS_UPDATE)).doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(supervisor(), Operation.USER_UPDATE)).isInstanceOf(FixFlowException.class);
        assertThatThrownBy(() -> policy.check(supervisor(), Operation.SETTINGS_UPDATE)).isInstanceOf(FixFlowException.class);
        assertThatCode(() -> policy.check(supervisor(), Operation.USER_LIST)).doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(technician("t1"), Operation.USER_LIST)).isInstanceOf(FixFlowException.class);
    }

    @Test
    void costEntriesAreClosedToClients() {
        assertThatCode(() -> policy.check(technician("t1"), Operation.COST_CREATE)).doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(client("c1"), Operation.COST_CREATE)).isInstanceOf(FixFlowException.class);
    }

    @Test
    void preventiveMaintenanceIsStaffOnly() {
        assertThatCode(() -> policy.check(supervisor(), Operation.PREVENTIVE_MAINTENANCE_READ)).doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(technician("t1"), Operation.PREVENTIVE_MAINTENANCE_READ))
                .isInstanceOf(FixFlowException.class);
        assertThatThrownBy(() -> policy.check(client("c1"), Operation.PREVENTIVE_MAINTENANCE_CREATE))
                .isInstanceOf(FixFlowException.class);
    }
}
