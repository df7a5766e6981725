package io.cronagent.config;

import io.cronagent.internal.mongo.CronJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the {@code cron_jobs} collection.
 *
 * <p>Indexes are not created unless {@code cron.ensure-indexes-on-startup=true}; in production they
 * are usually managed by migrations. Equivalent mongosh script:
 * <pre>
 * db.cron_jobs.createIndex({ createdAt: 1, _id: 1 }, { name: "idx_created" });
 * db.cron_jobs.createIndex({ enabled: 1, nextRunAt: 1 }, { name: "idx_due" });
 * </pre>
 */
public class CronMongoIndexConfig {

    public static final String IDX_CREATED = "idx_created";
    public static final String IDX_DUE = "idx_due";

    private final MongoTemplate mongoTemplate;

    public CronMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(CronJobDocument.class).ensureIndex(createdIndex());
        mongoTemplate.indexOps(CronJobDocument.class).ensureIndex(dueIndex());
    }

    /**
     * Listing order. Keys: createdAt ASC, _id ASC
     */
    public static Index createdIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.ASC)
                .on("_id", Sort.Direction.ASC)
                .named(IDX_CREATED);
    }

    /**
     * Resync of armed jobs. Keys: enabled ASC, nextRunAt ASC
     */
    public static Index dueIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_DUE);
    }
}
