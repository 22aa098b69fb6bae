package io.github.drompincen.fixflow.runtime.dashboard;

import io.github.drompincen.fixflow.persistence.document.WorkOrderDocument;
import io.github.drompincen.fixflow.protocol.api.DashboardStatsDto;
import io.github.drompincen.fixflow.protocol.api.WorkOrderStatus;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.access.Operation;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.workorder.WorkOrderService;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Aggregates over the work orders visible to the caller, using the listing scope. */
@Service
public class DashboardService {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final WorkOrderService workOrderService;
    private final AccessPolicy accessPolicy;

    public DashboardService(WorkOrderService workOrderService, AccessPolicy accessPolicy) {
        this.workOrderService = workOrderService;
        this.accessPolicy = accessPolicy;
    }

    public DashboardStatsDto stats(CurrentUser user) {
        List<WorkOrderDocument> orders =
                workOrderService.findInScope(accessPolicy.scopeFor(user, Operation.DASHBOARD_READ));

        Map<WorkOrderStatus, Long> counts = new EnumMap<>(WorkOrderStatus.class);
        for (WorkOrderStatus status : WorkOrderStatus.values()) {
            counts.put(status, 0L);
        }
        BigDecimal totalCost = BigDecimal.ZERO;
        for (WorkOrderDocument order : orders) {
            if (order.getStatus() != null) {
                counts.merge(order.getStatus(), 1L, Long::sum);
            }
            totalCost = totalCost.add(BigDecimal.valueOf(order.getTotalCost()));
        }

        long total = orders.size();
        long done = counts.get(WorkOrderStatus.COMPLETED) + counts.get(WorkOrderStatus.APPROVED);
        double completionRate = total == 0 ? 0.0
                : BigDecimal.valueOf(done).multiply(HUNDRED)
                        .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP)
                        .doubleValue();

        return new DashboardStatsDto(
                total,
                counts.get(WorkOrderStatus.PENDING),
                counts.get(WorkOrderStatus.IN_PROGRESS),
                counts.get(WorkOrderStatus.COMPLETED),
                counts.get(WorkOrderStatus.APPROVED),
                counts.get(WorkOrderStatus.CANCELLED),
                totalCost.doubleValue(),
                completionRate);
    }
}
