package io.github.drompincen.fixflow.runtime.workorder;

import io.github.drompincen.fixflow.persistence.document.CostEntryDocument;
import io.github.drompincen.fixflow.persistence.document.WorkOrderDocument;
import io.github.drompincen.fixflow.persistence.repository.CostEntryRepository;
import io.github.drompincen.fixflow.persistence.repository.WorkOrderRepository;
import io.github.drompincen.fixflow.protocol.api.CreateCostEntryRequest;
import io.github.drompincen.fixflow.runtime.access.AccessPolicy;
import io.github.drompincen.fixflow.runtime.access.Operation;
import io.github.drompincen.fixflow.runtime.auth.CurrentUser;
import io.github.drompincen.fixflow.runtime.error.FixFlowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Cost entries of a work order. The order's {@code totalCost} is always the sum of its
 * entries, recomputed from scratch after every insert.
 */
@Service
public class CostLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CostLedgerService.class);

    private final CostEntryRepository costEntryRepository;
    private final WorkOrderRepository workOrderRepository;
    private final MongoTemplate mongoTemplate;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    public CostLedgerService(CostEntryRepository costEntryRepository, WorkOrderRepository workOrderRepository,
                             MongoTemplate mongoTemplate, AccessPolicy accessPolicy, Clock clock) {
        this.costEntryRepository = costEntryRepository;
        this.workOrderRepository = workOrderRepository;
        this.mongoTemplate = mongoTemplate;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    public List<CostEntryDocument> list(String workOrderId, CurrentUser user) {
        accessPolicy.check(user, Operation.COST_LIST);
        return costEntryRepository.findTop100ByWorkOrderIdOrderByCreatedAtDesc(workOrderId);
    }

    public CostEntryDocument add(String workOrderId, CreateCostEntryRequest request, CurrentUser user) {
        accessPolicy.check(user, Operation.COST_CREATE);
        if (!workOrderRepository.existsById(workOrderId)) {
            throw FixFlowException.notFound("Work order not found");
        }

        Instant now = clock.instant();
        CostEntryDocument entry = new CostEntryDocument();
        entry.setWorkOrderId(workOrderId);
        entry.setDescription(request.description());
        entry.setCostType(request.costType());
        entry.setAmount(request.amount());
        entry.setCreatedById(user.id());
        entry.setCreatedByName(user.name());
        entry.setCreatedAt(now);
        entry = costEntryRepository.save(entry);

        double total = totalOf(workOrderId);
        mongoTemplate.updateFirst(
                Query.query(Criteria.where("_id").is(workOrderId)),
                new Update().set("totalCost", total).set("updatedAt", now),
                WorkOrderDocument.class);
        log.info("Cost entry {} on work order {}, total now {}", entry.getId(), workOrderId, total);
        return entry;
    }

    double totalOf(String workOrderId) {
        BigDecimal sum = BigDecimal.ZERO;
        for (CostEntryDocument entry : costEntryRepository.findByWorkOrderId(workOrderId)) {
            sum = sum.add(BigDecimal.valueOf(entry.getAmount()));
        }
        return sum.doubleValue();
    }
}
