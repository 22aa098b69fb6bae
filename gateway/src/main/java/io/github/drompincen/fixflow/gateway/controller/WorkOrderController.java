package io.github.drompincen.fixflow.gateway.controller;

import io.github.drompincen.fixflow.persistence.document.CommentDocument;
import io.github.drompincen.fixflow.persistence.document.CostEntryDocument;
import io.github.drompincen.fixflow.persistence.document.WorkOrderDocument;
import io.github.drompincen.fixflow.protocol.api.CommentDto;
import io.github.drompincen.fixflow.protocol.api.CostEntryDto;
import io.github.drompincen.fixflow.protocol.api.CreateCommentRequest;
import io.github.drompincen.fixflow.protocol.api.CreateCostEntryRequest;
import io.github.drompincen.fixflow.protocol.api.CreateWorkOrderRequest;
import io.github.drompincen.fixflow.protocol.api.MessageResponse;
import io.github.drompincen.fixflow.protocol.api.UpdateWorkOrderRequest;
import io.github.drompincen.fixflow.protocol.api.WorkOrderDto;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.comment.CommentService;
import io.github.drompincen.fixflow.runtime.workorder.CostLedgerService;
import io.github.drompincen.fixflow.runtime.workorder.WorkOrderService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/work-orders")
public class WorkOrderController {

    private final WorkOrderService workOrderService;
    private final CommentService commentService;
    private final CostLedgerService costLedgerService;

    public WorkOrderController(WorkOrderService workOrderService, CommentService commentService,
                               CostLedgerService costLedgerService) {
        this.workOrderService = workOrderService;
        this.commentService = commentService;
        this.costLedgerService = costLedgerService;
    }

    @GetMapping
    public List<WorkOrderDto> list(@AuthenticationPrincipal CurrentUser user) {
        return workOrderService.list(user).stream().map(this::toDto).collect(Collectors.toList());
    }

    @GetMapping("/{workOrderId}")
    public WorkOrderDto get(@PathVariable String workOrderId, @AuthenticationPrincipal CurrentUser user) {
        return toDto(workOrderService.get(workOrderId, user));
    }

    @PostMapping
    public ResponseEntity<WorkOrderDto> create(@Valid @RequestBody CreateWorkOrderRequest req,
                                               @AuthenticationPrincipal CurrentUser user) {
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(workOrderService.create(req, user)));
    }

    @PatchMapping("/{workOrderId}")
    public WorkOrderDto update(@PathVariable String workOrderId, @RequestBody UpdateWorkOrderRequest req,
                               @AuthenticationPrincipal CurrentUser user) {
        return toDto(workOrderService.update(workOrderId, req, user));
    }

    @DeleteMapping("/{workOrderId}")
    public MessageResponse delete(@PathVariable String workOrderId, @AuthenticationPrincipal CurrentUser user) {
        workOrderService.delete(workOrderId, user);
        return new MessageResponse("Work order deleted successfully");
    }

    @GetMapping("/{workOrderId}/comments")
    public List<CommentDto> comments(@PathVariable String workOrderId, @AuthenticationPrincipal CurrentUser user) {
        return commentService.list(workOrderId, user).stream().map(this::toDto).collect(Collectors.toList());
    }

    @PostMapping("/{workOrderId}/comments")
    public ResponseEntity<CommentDto> addComment(@PathVariable String workOrderId,
                                                 @Valid @RequestBody CreateCommentRequest req,
                                                 @AuthenticationPrincipal CurrentUser user) {
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(commentService.add(workOrderId, req, user)));
    }

    @GetMapping("/{workOrderId}/costs")
    public List<CostEntryDto> costs(@PathVariable String workOrderId, @AuthenticationPrincipal CurrentUser user) {
        return costLedgerService.list(workOrderId, user).stream().map(this::toDto).collect(Collectors.toList());
    }

    @PostMapping("/{workOrderId}/costs")
    public ResponseEntity<CostEntryDto> addCost(@PathVariable String workOrderId,
                                                @Valid @RequestBody CreateCostEntryRequest req,
                                                @AuthenticationPrincipal CurrentUser user) {
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(costLedgerService.add(workOrderId, req, user)));
    }

    private WorkOrderDto toDto(WorkOrderDocument wo) {
        return new WorkOrderDto(wo.getId(), wo.getRequestId(), wo.getTitle(), wo.getDescription(),
                wo.getStatus(), wo.getRequestType(), wo.getSlaType(), wo.getLocation(), wo.getDepartment(),
                wo.getClientId(), wo.getClientName(), wo.getAssignedToId(), wo.getAssignedToName(),
                wo.getStartDate(), wo.getDueDate(), wo.getCompletedAt(), wo.getDurationDays(),
                wo.isDelayed(), wo.getTotalCost(), wo.getCreatedById(), wo.getCreatedByName(),
                wo.getCreatedAt(), wo.getUpdatedAt());
    }

    private CommentDto toDto(CommentDocument c) {
        return new CommentDto(c.getId(), c.getWorkOrderId(), c.getUserId(), c.getUserName(), c.getUserRole(),
                c.getContent(), c.getCreatedAt());
    }

    private CostEntryDto toDto(CostEntryDocument e) {
        return new CostEntryDto(e.getId(), e.getWorkOrderId(), e.getDescription(), e.getCostType(), e.getAmount(),
                e.getCreatedById(), e.getCreatedByName(), e.getCreatedAt());
    }
}
