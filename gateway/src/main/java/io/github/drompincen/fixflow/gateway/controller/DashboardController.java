package io.github.drompincen.fixflow.gateway.controller;

import io.github.drompincen.fixflow.protocol.api.DashboardStatsDto;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.dashboard.DashboardService;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

    private final DashboardService dashboardService;

    public DashboardController(DashboardService dashboardService) {
        this.dashboardService = dashboardService;
    }

    @GetMapping("/stats")
    public DashboardStatsDto stats(@AuthenticationPrincipal CurrentUser user) {
        return dashboardService.stats(user);
    }
}
