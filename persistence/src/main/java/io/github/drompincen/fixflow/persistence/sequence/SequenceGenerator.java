package io.github.drompincen.fixflow.persistence.sequence;

import io.github.drompincen.fixflow.persistence.document.CounterDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.util.function.LongSupplier;

/**
 * Named monotonically increasing counters backed by the {@code counters} collection.
 * Each call is a single {@code findAndModify} with {@code $inc}, so concurrent callers
 * never observe the same value.
 */
@Component
public class SequenceGenerator {

    private static final Logger log = LoggerFactory.getLogger(SequenceGenerator.class);

    private final MongoTemplate mongoTemplate;

    public SequenceGenerator(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public long next(String name) {
        return next(name, () -> 0L);
    }

    /**
     * Returns the next value of the named counter. The first time a counter is used it is
     * seeded with {@code seed}, so that counters introduced over existing data continue
     * from where the data left off.
     */
    public long next(String name, LongSupplier seed) {
        Query byName = Query.query(Criteria.where("_id").is(name));
        if (!mongoTemplate.exists(byName, CounterDocument.class)) {
            try {
                mongoTemplate.insert(new CounterDocument(name, seed.getAsLong()));
                log.info("Seeded counter {}", name);
            } catch (DuplicateKeyException e) {
                log.debug("Counter {} was seeded by a concurrent caller", name);
            }
        }
        CounterDocument counter = mongoTemplate.findAndModify(
                byName,
                new Update().inc("value", 1),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                CounterDocument.class);
        return counter.getValue();
    }
}
