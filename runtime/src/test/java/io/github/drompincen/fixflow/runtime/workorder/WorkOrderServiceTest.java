package io.github.drompincen.fixflow.runtime.workorder;

import io.github.drompincen.fixflow.persistence.document.WorkOrderDocument;
import io.github.drompincen.fixflow.persistence.repository.UserRepository;
import io.github.drompincen.fixflow.persistence.repository.WorkOrderRepository;
import io.github.drompincen.fixflow.persistence.sequence.SequenceGenerator;
import io.github.drompincen.fixflow.protocol.api.CreateWorkOrderRequest;
import io.github.drompincen.fixflow.protocol.api.RequestType;
import io.github.drompincen.fixflow.protocol.api.SlaType;
import io.github.drompincen.fixflow.protocol.api.UpdateWorkOrderRequest;
import io.github.drompincen.fixflow.protocol.api.UserRole;
import io.github.drompincen.fixflow.protocol.api.WorkOrderStatus;
import io.github.drompincen.fixflow.runtime.Actors;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.error.ErrorKind;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import io.github.drompincen.fixflow.runtime.notification.NotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

import static io.github.drompincen.fixflow.runtime.Actors.admin;
import static io.github.drompincen.fixflow.runtime.Actors.client;
import static io.github.drompincen.fixflow.runtime.Actors.supervisor;
import static io.github.drompincen.fixflow.runtime.Actors.technician;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WorkOrderServiceTest {

    @Mock
    private WorkOrderRepository workOrderRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private SequenceGenerator sequenceGenerator;

    @Mock
    private NotificationService notificationService;

    private WorkOrderService service;

    @BeforeEach
    void setUp() {
        service = new WorkOrderService(workOrderRepository, userRepository, sequenceGenerator,
                notificationService, new AccessPolicy(), new WorkOrderTransitions(false), Actors.CLOCK);
        when(workOrderRepository.save(any(WorkOrderDocument.class))).thenAnswer(inv -> {
            WorkOrderDocument wo = inv.getArgument(0);
            if (wo.getId() == null) {
                wo.setId("wo-id");
            }
            return wo;
        });
        when(sequenceGenerator.next(eq("work_orders"), any(LongSupplier.class))).thenReturn(7L);
        when(userRepository.findById("c1")).thenReturn(Optional.of(Actors.user("c1", "Carla", UserRole.CLIENT)));
        when(userRepository.findById("t1")).thenReturn(Optional.of(Actors.user("t1", "Theo", UserRole.TECHNICIAN)));
        when(userRepository.findById("t2")).thenReturn(Optional.of(Actors.user("t2", "Tina", UserRole.TECHNICIAN)));
    }

    private static CreateWorkOrderRequest createRequest(String assignedToId) {
        return new CreateWorkOrderRequest("Leaking pipe", "Water under sink", RequestType.PLUMBING, null,
                "Block A", "Facilities", "c1", assignedToId, "2026-03-02", "2026-03-05", 3);
    }

    private static UpdateWorkOrderRequest statusChange(WorkOrderStatus status) {
        return new UpdateWorkOrderRequest(null, null, status, null, null, null, null, null,
                null, null, null, null, null);
    }

    private static UpdateWorkOrderRequest reassign(String assigneeId) {
        return new UpdateWorkOrderRequest(null, null, null, null, null, null, null, assigneeId,
                null, null, null, null, null);
    }

    private static WorkOrderDocument existing(String clientId, String assigneeId) {
        WorkOrderDocument wo = new WorkOrderDocument();
        wo.setId("wo-1");
        wo.setRequestId("WO-00001");
        wo.setTitle("Broken light");
        wo.setStatus(WorkOrderStatus.PENDING);
        wo.setClientId(clientId);
        wo.setAssignedToId(assigneeId);
        wo.setTotalCost(12.5);
        wo.setCreatedAt(Actors.NOW.minusSeconds(3600));
        wo.setUpdatedAt(Actors.NOW.minusSeconds(3600));
        return wo;
    }

    @Test
    void createAssignsSequentialRequestIdAndDefaults() {
        WorkOrderDocument wo = service.create(createRequest(null), supervisor());

        assertThat(wo.getRequestId()).isEqualTo("WO-00007");
        assertThat(wo.getStatus()).isEqualTo(WorkOrderStatus.PENDING);
        assertThat(wo.getSlaType()).isEqualTo(SlaType.NORMAL);
        assertThat(wo.getClientName()).isEqualTo("Carla");
        assertThat(wo.getTotalCost()).isZero();
        assertThat(wo.isDelayed()).isFalse();
        assertThat(wo.getCreatedByName()).isEqualTo("Sam Supervisor");
        assertThat(wo.getCreatedAt()).isEqualTo(Actors.NOW);
    }

    @Test
    void createWithoutAssigneeNotifiesOnlyClient() {
        service.create(createRequest(null), admin());

        verify(notificationService).notify("c1", "New Work Order",
                "Work order WO-00007 has been created", "/work-orders/wo-id");
        verifyNoMoreInteractions(notificationService);
    }

    @Test
    void createWithAssigneeNotifiesClientAndAssignee() {
        WorkOrderDocument wo = service.create(createRequest("t1"), admin());

        assertThat(wo.getAssignedToName()).isEqualTo("Theo");
        verify(notificationService).notify(eq("c1"), eq("New Work Order"), anyString(), anyString());
        verify(notificationService).notify("t1", "New Assignment",
                "You have been assigned to work order WO-00007", "/work-orders/wo-id");
        verifyNoMoreInteractions(notificationService);
    }

    @Test
    void createRejectsNonStaff() {
        assertThatThrownBy(() -> service.create(createRequest(null), client("c1")))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
        assertThatThrownBy(() -> service.create(createRequest(null), technician("t1")))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
        verify(workOrderRepository, never()).save(any());
    }

    @Test
    void createWithUnknownClientOrAssigneeIsNotFound() {
        when(userRepository.findById("nobody")).thenReturn(Optional.empty());
        CreateWorkOrderRequest unknownClient = new CreateWorkOrderRequest("t", "d", RequestType.HVAC, SlaType.URGENT,
                "loc", null, "nobody", null, null, null, null);

        assertThatThrownBy(() -> service.create(unknownClient, admin()))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
        assertThatThrownBy(() -> service.create(createRequest("nobody"), admin()))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void listIsScopedByRole() {
        List<WorkOrderDocument> all = List.of(existing("c1", "t1"));
        when(workOrderRepository.findAllByOrderByCreatedAtDesc()).thenReturn(all);
        when(workOrderRepository.findByClientIdOrderByCreatedAtDesc("c1")).thenReturn(all);
        when(workOrderRepository.findByAssignedToIdOrderByCreatedAtDesc("t1")).thenReturn(all);

        service.list(admin());
        service.list(client("c1"));
        service.list(technician("t1"));

        verify(workOrderRepository).findAllByOrderByCreatedAtDesc();
        verify(workOrderRepository).findByClientIdOrderByCreatedAtDesc("c1");
        verify(workOrderRepository).findByAssignedToIdOrderByCreatedAtDesc("t1");
    }

    @Test
    void clientCannotReadSomeoneElsesOrder() {
        when(workOrderRepository.findById("wo-1")).thenReturn(Optional.of(existing("c2", null)));

        assertThatThrownBy(() -> service.get("wo-1", client("c1")))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
    }

    @Test
    void missingOrderIsNotFound() {
        when(workOrderRepository.findById("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.get("nope", admin()))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
        assertThatThrownBy(() -> service.update("nope", statusChange(WorkOrderStatus.COMPLETED), admin()))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void technicianMayUpdateOnlyAssignedOrders() {
        when(workOrderRepository.findById("wo-1")).thenReturn(Optional.of(existing("c1", "t1")));

        WorkOrderDocument updated = service.update("wo-1", statusChange(WorkOrderStatus.IN_PROGRESS), technician("t1"));
        assertThat(updated.getStatus()).isEqualTo(WorkOrderStatus.IN_PROGRESS);

        assertThatThrownBy(() -> service.update("wo-1", statusChange(WorkOrderStatus.COMPLETED), technician("t2")))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
    }

    @Test
    void clientCannotUpdateEvenOwnOrder() {
        when(workOrderRepository.findById("wo-1")).thenReturn(Optional.of(existing("c1", null)));

        assertThatThrownBy(() -> service.update("wo-1", statusChange(WorkOrderStatus.CANCELLED), client("c1")))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
    }

    @Test
    void statusChangeNotifiesClientAndBumpsUpdatedAt() {
        when(workOrderRepository.findById("wo-1")).thenReturn(Optional.of(existing("c1", "t1")));

        WorkOrderDocument updated = service.update("wo-1", statusChange(WorkOrderStatus.COMPLETED), supervisor());

        assertThat(updated.getUpdatedAt()).isEqualTo(Actors.NOW);
        verify(notificationService).notify("c1", "Work Order Updated",
                "Work order WO-00001 status changed to completed", "/work-orders/wo-1");
    }

    @Test
    void sameStatusDoesNotNotify() {
        when(workOrderRepository.findById("wo-1")).thenReturn(Optional.of(existing("c1", "t1")));

        service.update("wo-1", statusChange(WorkOrderStatus.PENDING), supervisor());

        verifyNoInteractions(notificationService);
    }

    @Test
    void reassignmentRefreshesNameAndNotifiesNewAssignee() {
        when(workOrderRepository.findById("wo-1")).thenReturn(Optional.of(existing("c1", "t1")));

        WorkOrderDocument updated = service.update("wo-1", reassign("t2"), admin());

        assertThat(updated.getAssignedToId()).isEqualTo("t2");
        assertThat(updated.getAssignedToName()).isEqualTo("Tina");
        verify(notificationService).notify("t2", "New Assignment",
                "You have been assigned to work order WO-00001", "/work-orders/wo-1");
        verifyNoMoreInteractions(notificationService);
    }

    @Test
    void totalCostCannotBeSetDirectly() {
        when(workOrderRepository.findById("wo-1")).thenReturn(Optional.of(existing("c1", "t1")));
        UpdateWorkOrderRequest request = new UpdateWorkOrderRequest(null, null, null, null, null, null, null, null,
                null, null, null, null, 999.0);

        assertThatThrownBy(() -> service.update("wo-1", request, admin()))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.BAD_REQUEST));
        verify(workOrderRepository, never()).save(any());
    }

    @Test
    void enforcedTransitionsRejectSkippingAhead() {
        WorkOrderService strict = new WorkOrderService(workOrderRepository, userRepository, sequenceGenerator,
                notificationService, new AccessPolicy(), new WorkOrderTransitions(true), Actors.CLOCK);
        when(workOrderRepository.findById("wo-1")).thenReturn(Optional.of(existing("c1", "t1")));

        assertThatThrownBy(() -> strict.update("wo-1", statusChange(WorkOrderStatus.APPROVED), admin()))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.BAD_REQUEST));
    }

    @Test
    void deleteIsStaffOnlyAndRequiresExistingOrder() {
        when(workOrderRepository.existsById("wo-1")).thenReturn(true);
        when(workOrderRepository.existsById("nope")).thenReturn(false);

        service.delete("wo-1", admin());
        verify(workOrderRepository).deleteById("wo-1");

        assertThatThrownBy(() -> service.delete("nope", supervisor()))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
        assertThatThrownBy(() -> service.delete("wo-1", technician("t1")))
                .satisfies(e -> assertThat(((FixFlowException) e).getKind()).isEqualTo(ErrorKind.FORBIDDEN));
    }

    @Test
    void requestIdCounterIsSeededFromExistingOrders() {
        when(workOrderRepository.count()).thenReturn(41L);
        when(sequenceGenerator.next(eq("work_orders"), any(LongSupplier.class)))
                .thenAnswer(inv -> ((LongSupplier) inv.getArgument(1)).getAsLong() + 1);

        assertThat(service.nextRequestId()).isEqualTo("WO-00042");
    }
}
