package io.github.drompincen.fixflow.runtime.maintenance;

import io.github.drompincen.fixflow.persistence.document.PreventiveMaintenanceDocument;
import io.github.drompincen.fixflow.persistence.document.UserDocument;
import io.github.drompincen.fixflow.persistence.repository.PreventiveMaintenanceRepository;
import io.github.drompincen.fixflow.persistence.repository.UserRepository;
import io.github.drompincen.fixflow.protocol.api.CreatePreventiveMaintenanceRequest;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.access.Operation;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import io.github.drompincen.fixflow.runtime.notification.NotificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

@Service
public class PreventiveMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(PreventiveMaintenanceService.class);

    static final String LINK = "/preventive-maintenance";

    private final PreventiveMaintenanceRepository maintenanceRepository;
    private final UserRepository userRepository;
    private final NotificationService notificationService;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    public PreventiveMaintenanceService(PreventiveMaintenanceRepository maintenanceRepository,
                                        UserRepository userRepository, NotificationService notificationService,
                                        AccessPolicy accessPolicy, Clock clock) {
        this.maintenanceRepository = maintenanceRepository;
        this.userRepository = userRepository;
        this.notificationService = notificationService;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    /** Soonest due first. */
    public List<PreventiveMaintenanceDocument> list(CurrentUser user) {
        accessPolicy.check(user, Operation.PREVENTIVE_MAINTENANCE_READ);
        return maintenanceRepository.findAllByOrderByNextDueDateAsc();
    }

    public PreventiveMaintenanceDocument create(CreatePreventiveMaintenanceRequest request, CurrentUser user) {
        accessPolicy.check(user, Operation.PREVENTIVE_MAINTENANCE_CREATE);

        UserDocument assignee = null;
        if (request.assignedToId() != null && !request.assignedToId().isBlank()) {
            assignee = userRepository.findById(request.assignedToId())
                    .orElseThrow(() -> FixFlowException.notFound("Assigned user not found"));
        }

        PreventiveMaintenanceDocument task = new PreventiveMaintenanceDocument();
        task.setTitle(request.title());
        task.setDescription(request.description());
        task.setLocation(request.location());
        task.setFrequency(request.frequency());
        task.setNextDueDate(request.nextDueDate());
        if (assignee != null) {
            task.setAssignedToId(assignee.getId());
            task.setAssignedToName(assignee.getName());
        }
        task.setActive(true);
        task.setCreatedAt(clock.instant());
        task = maintenanceRepository.save(task);
        log.info("Scheduled preventive maintenance {} due {}", task.getId(), task.getNextDueDate());

        if (assignee != null) {
            notificationService.notify(assignee.getId(), "New Preventive Maintenance Task",
                    "You have been assigned to: " + task.getTitle(), LINK);
        }
        return task;
    }
}
