package io.github.drompincen.fixflow.runtime.workorder;

import io.github.drompincen.fixflow.persistence.document.UserDocument;
import io.github.drompincen.fixflow.persistence.document.WorkOrderDocument;
import io.github.drompincen.fixflow.persistence.repository.UserRepository;
import io.github.drompincen.fixflow.persistence.repository.WorkOrderRepository;
import io.github.drompincen.fixflow.persistence.sequence.SequenceGenerator;
import io.github.drompincen.fixflow.protocol.api.CreateWorkOrderRequest;
import io.github.drompincen.fixflow.protocol.api.SlaType;
import io.github.drompincen.fixflow.protocol.api.UpdateWorkOrderRequest;
import io.github.drompincen.fixflow.protocol.api.WorkOrderStatus;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.access.Operation;
import io.github.drompincen.fixflow.runtime.access.WorkOrderScope;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import io.github.drompincen.fixflow.runtime.notification.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Work order lifecycle: creation with a sequential request id, partial updates and
 * deletion, each gated by {@link AccessPolicy} and announcing changes through
 * {@link NotificationService}.
 */
@Service
public class WorkOrderService {

    private static final Logger log = LoggerFactory.getLogger(WorkOrderService.class);

    static final String REQUEST_ID_SEQUENCE = "work_orders";

    private final WorkOrderRepository workOrderRepository;
    private final UserRepository userRepository;
    private final SequenceGenerator sequenceGenerator;
    private final NotificationService notificationService;
    private final AccessPolicy accessPolicy;
    private final WorkOrderTransitions transitions;
    private final Clock clock;

    public WorkOrderService(WorkOrderRepository workOrderRepository, UserRepository userRepository,
                            SequenceGenerator sequenceGenerator, NotificationService notificationService,
                            AccessPolicy accessPolicy, WorkOrderTransitions transitions, Clock clock) {
        this.workOrderRepository = workOrderRepository;
        this.userRepository = userRepository;
        this.sequenceGenerator = sequenceGenerator;
        this.notificationService = notificationService;
        this.accessPolicy = accessPolicy;
        this.transitions = transitions;
        this.clock = clock;
    }

    public List<WorkOrderDocument> list(CurrentUser user) {
        return findInScope(accessPolicy.scopeFor(user, Operation.WORK_ORDER_LIST));
    }

    public List<WorkOrderDocument> findInScope(WorkOrderScope scope) {
        return switch (scope.kind()) {
            case ALL -> workOrderRepository.findAllByOrderByCreatedAtDesc();
            case CLIENT -> workOrderRepository.findByClientIdOrderByCreatedAtDesc(scope.userId());
            case ASSIGNEE -> workOrderRepository.findByAssignedToIdOrderByCreatedAtDesc(scope.userId());
        };
    }

    public WorkOrderDocument get(String id, CurrentUser user) {
        WorkOrderDocument workOrder = require(id);
        accessPolicy.check(user, Operation.WORK_ORDER_READ, workOrder);
        return workOrder;
    }

    public WorkOrderDocument require(String id) {
        return workOrderRepository.findById(id)
                .orElseThrow(() -> FixFlowException.notFound("Work order not found"));
    }

    public WorkOrderDocument create(CreateWorkOrderRequest request, CurrentUser user) {
        accessPolicy.check(user, Operation.WORK_ORDER_CREATE);

        UserDocument client = userRepository.findById(request.clientId())
                .orElseThrow(() -> FixFlowException.notFound("Client not found"));
        UserDocument assignee = isBlank(request.assignedToId()) ? null
                : userRepository.findById(request.assignedToId())
                        .orElseThrow(() -> FixFlowException.notFound("Assigned user not found"));

        Instant now = clock.instant();
        WorkOrderDocument workOrder = new WorkOrderDocument();
        workOrder.setRequestId(nextRequestId());
        workOrder.setTitle(request.title());
        workOrder.setDescription(request.description());
        workOrder.setStatus(WorkOrderStatus.PENDING);
        workOrder.setRequestType(request.requestType());
        workOrder.setSlaType(request.slaType() != null ? request.slaType() : SlaType.NORMAL);
        workOrder.setLocation(request.location());
        workOrder.setDepartment(request.department());
        workOrder.setClientId(client.getId());
        workOrder.setClientName(client.getName());
        if (assignee != null) {
            workOrder.setAssignedToId(assignee.getId());
            workOrder.setAssignedToName(assignee.getName());
        }
        workOrder.setStartDate(request.startDate());
        workOrder.setDueDate(request.dueDate());
        workOrder.setDurationDays(request.durationDays());
        workOrder.setDelayed(false);
        workOrder.setTotalCost(0.0);
        workOrder.setCreatedById(user.id());
        workOrder.setCreatedByName(user.name());
        workOrder.setCreatedAt(now);
        workOrder.setUpdatedAt(now);
        workOrder = workOrderRepository.save(workOrder);
        log.info("Created work order {} ({}) for client {}", workOrder.getRequestId(), workOrder.getId(), client.getId());

        notificationService.notify(client.getId(), "New Work Order",
                "Work order " + workOrder.getRequestId() + " has been created", linkTo(workOrder));
        if (assignee != null) {
            notifyAssignment(workOrder);
        }
        return workOrder;
    }

    /**
     * Applies the non-null fields of the request. A changed assignee is re-resolved and
     * notified; a changed status notifies the client.
     */
    public WorkOrderDocument update(String id, UpdateWorkOrderRequest request, CurrentUser user) {
        WorkOrderDocument workOrder = require(id);
        accessPolicy.check(user, Operation.WORK_ORDER_UPDATE, workOrder);
        if (request.totalCost() != null) {
            throw FixFlowException.badRequest("total_cost is derived from cost entries and cannot be set");
        }

        if (request.title() != null) workOrder.setTitle(request.title());
        if (request.description() != null) workOrder.setDescription(request.description());
        if (request.requestType() != null) workOrder.setRequestType(request.requestType());
        if (request.slaType() != null) workOrder.setSlaType(request.slaType());
        if (request.location() != null) workOrder.setLocation(request.location());
        if (request.department() != null) workOrder.setDepartment(request.department());
        if (request.startDate() != null) workOrder.setStartDate(request.startDate());
        if (request.dueDate() != null) workOrder.setDueDate(request.dueDate());
        if (request.completedAt() != null) workOrder.setCompletedAt(request.completedAt());
        if (request.durationDays() != null) workOrder.setDurationDays(request.durationDays());

        boolean statusChanged = request.status() != null && request.status() != workOrder.getStatus();
        if (statusChanged) {
            transitions.validate(workOrder.getStatus(), request.status());
            workOrder.setStatus(request.status());
        }

        boolean reassigned = !isBlank(request.assignedToId())
                && !request.assignedToId().equals(workOrder.getAssignedToId());
        if (reassigned) {
            UserDocument assignee = userRepository.findById(request.assignedToId())
                    .orElseThrow(() -> FixFlowException.notFound("Assigned user not found"));
            workOrder.setAssignedToId(assignee.getId());
            workOrder.setAssignedToName(assignee.getName());
        }

        workOrder.setUpdatedAt(clock.instant());
        workOrder = workOrderRepository.save(workOrder);

        if (reassigned) {
            notifyAssignment(workOrder);
        }
        if (statusChanged) {
            log.info("Work order {} moved to {}", workOrder.getRequestId(), workOrder.getStatus().value());
            notificationService.notify(workOrder.getClientId(), "Work Order Updated",
                    "Work order " + workOrder.getRequestId() + " status changed to " + workOrder.getStatus().value(),
                    linkTo(workOrder));
        }
        return workOrder;
    }

    public void delete(String id, CurrentUser user) {
        accessPolicy.check(user, Operation.WORK_ORDER_DELETE);
        if (!workOrderRepository.existsById(id)) {
            throw FixFlowException.notFound("Work order not found");
        }
        workOrderRepository.deleteById(id);
        log.info("Deleted work order {}", id);
    }

    String nextRequestId() {
        long next = sequenceGenerator.next(REQUEST_ID_SEQUENCE, workOrderRepository::count);
        return String.format("WO-%05d", next);
    }

    private void notifyAssignment(WorkOrderDocument workOrder) {
        notificationService.notify(workOrder.getAssignedToId(), "New Assignment",
                "You have been assigned to work order " + workOrder.getRequestId(), linkTo(workOrder));
    }

    private static String linkTo(WorkOrderDocument workOrder) {
        return "/work-orders/" + workOrder.getId();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
