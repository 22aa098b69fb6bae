package io.github.drompincen.fixflow.gateway.controller;

import io.github.drompincen.fixflow.persistence.document.PreventiveMaintenanceDocument;
import io.github.drompincen.fixflow.protocol.api.CreatePreventiveMaintenanceRequest;
import io.github.drompincen.fixflow.protocol.api.PreventiveMaintenanceDto;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.maintenance.PreventiveMaintenanceService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/preventive-maintenance")
public class PreventiveMaintenanceController {

    private final PreventiveMaintenanceService maintenanceService;

    public PreventiveMaintenanceController(PreventiveMaintenanceService maintenanceService) {
        this.maintenanceService = maintenanceService;
    }

    @GetMapping
    public List<PreventiveMaintenanceDto> list(@AuthenticationPrincipal CurrentUser user) {
        return maintenanceService.list(user).stream().map(this::toDto).collect(Collectors.toList());
    }

    @PostMapping
    public ResponseEntity<PreventiveMaintenanceDto> create(@Valid @RequestBody CreatePreventiveMaintenanceRequest req,
                                                           @AuthenticationPrincipal CurrentUser user) {
        return ResponseEntity.status(HttpStatus.CREATED).body(toDto(maintenanceService.create(req, user)));
    }

    private PreventiveMaintenanceDto toDto(PreventiveMaintenanceDocument pm) {
        return new PreventiveMaintenanceDto(pm.getId(), pm.getTitle(), pm.getDescription(), pm.getLocation(),
                pm.getFrequency(), pm.getNextDueDate(), pm.getAssignedToId(), pm.getAssignedToName(),
                pm.isActive(), pm.getCreatedAt());
    }
}
