package io.github.drompincen.fixflow.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "cost_entries")
@CompoundIndex(name = "work_order_created", def = "{'workOrderId': 1, 'createdAt': -1}")
public class CostEntryDocument {

    @Id
    private String id;
    private String workOrderId;
    private String description;
    // observed values are "material" and "labor"; not enforced
    private String costType;
    private double amount;
    private String createdById;
    private String createdByName;
    private Instant createdAt;

    public CostEntryDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getWorkOrderId() { return workOrderId; }
    public void setWorkOrderId(String workOrderId) { this.workOrderId = workOrderId; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getCostType() { return costType; }
    public void setCostType(String costType) { this.costType = costType; }

    public double getAmount() { return amount; }
    public void setAmount(double amount) { this.amount = amount; }

    public String getCreatedById() { return createdById; }
    public void setCreatedById(String createdById) { this.createdById = createdById; }

    public String getCreatedByName() { return createdByName; }
    public void setCreatedByName(String createdByName) { this.createdByName = createdByName; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
