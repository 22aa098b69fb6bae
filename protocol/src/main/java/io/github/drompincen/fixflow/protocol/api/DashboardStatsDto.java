package io.github.drompincen.fixflow.protocol.api;

public record DashboardStatsDto(
        long totalOrders,
        long pending,
        long inProgress,
        long completed,
        long approved,
        long cancelled,
        double totalCost,
        double completionRate
) {}
