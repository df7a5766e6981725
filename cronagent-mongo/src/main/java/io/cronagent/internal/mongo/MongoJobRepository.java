package io.cronagent.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cronagent.core.CronJobException;
import io.cronagent.core.Job;
import io.cronagent.core.JobState;
import io.cronagent.core.RunStatus;
import io.cronagent.json.PayloadJson;
import io.cronagent.json.ScheduleJson;
import io.cronagent.store.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * MongoDB persistence for cron jobs (collection {@code cron_jobs}).
 *
 * <p>Read-modify-write goes through the document's {@code version} field: a write that lost a race
 * with another writer is retried against the fresh document, up to {@value #MAX_UPDATE_ATTEMPTS}
 * times.
 */
public class MongoJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(MongoJobRepository.class);

    static final int MAX_UPDATE_ATTEMPTS = 5;

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobRepository(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void insert(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        try {
            mongoTemplate.insert(toDocument(job, null));
        } catch (DuplicateKeyException e) {
            throw new IllegalStateException("Duplicate job id: " + job.id(), e);
        }
    }

    @Override
    public Optional<Job> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(mongoTemplate.findById(id, CronJobDocument.class)).map(this::toJob);
    }

    @Override
    public List<Job> findAll() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        List<CronJobDocument> docs = mongoTemplate.find(q, CronJobDocument.class);
        List<Job> jobs = new ArrayList<>(docs.size());
        for (CronJobDocument doc : docs) {
            try {
                jobs.add(toJob(doc));
            } catch (RuntimeException e) {
                log.warn("cron store skipped invalid job id={} msg={}", doc.getId(), e.getMessage());
            }
        }
        return jobs;
    }

    @Override
    public Optional<Job> update(String id, UnaryOperator<Job> change) {
        Objects.requireNonNull(change, "change must not be null");
        for (int attempt = 1; attempt <= MAX_UPDATE_ATTEMPTS; attempt++) {
            CronJobDocument doc = mongoTemplate.findById(id, CronJobDocument.class);
            if (doc == null) {
                return Optional.empty();
            }
            Job current = toJob(doc);
            Job next = change.apply(current);
            if (next == null || next == current) {
                return Optional.of(current);
            }
            try {
                mongoTemplate.save(toDocument(next, doc.getVersion()));
                return Optional.of(next);
            } catch (OptimisticLockingFailureException e) {
                log.debug("cron job write conflict, retrying id={} attempt={}", id, attempt);
            }
        }
        throw new CronJobException("Cron job " + id + " kept changing concurrently, gave up after "
                + MAX_UPDATE_ATTEMPTS + " attempts");
    }

    @Override
    public boolean deleteById(String id) {
        if (id == null) {
            return false;
        }
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.remove(q, CronJobDocument.class).getDeletedCount() > 0;
    }

    CronJobDocument toDocument(Job job, Long version) {
        CronJobDocument doc = new CronJobDocument();
        doc.setId(job.id());
        doc.setVersion(version);
        doc.setName(job.name());
        doc.setEnabled(job.enabled());
        doc.setDeleteAfterRun(job.deleteAfterRun());

        ScheduleJson schedule = ScheduleJson.from(job.schedule());
        doc.setScheduleKind(schedule.kind());
        doc.setAt(schedule.atMs() == null ? null : Instant.ofEpochMilli(schedule.atMs()));
        doc.setEveryMs(schedule.everyMs());
        doc.setCronExpr(schedule.expr());
        doc.setCronTz(schedule.tz());

        doc.setPayload(objectMapper.convertValue(PayloadJson.from(job.payload()), new TypeReference<>() {
        }));

        JobState state = job.state();
        doc.setNextRunAt(state.nextRunAt());
        doc.setLastRunAt(state.lastRunAt());
        doc.setLastStatus(state.lastStatus() == RunStatus.NONE ? null : state.lastStatus().wireName());
        doc.setLastError(state.lastError());

        doc.setCreatedAt(job.createdAt());
        doc.setUpdatedAt(job.updatedAt());
        return doc;
    }

    Job toJob(CronJobDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");

        ScheduleJson schedule = new ScheduleJson(
                doc.getScheduleKind(),
                doc.getAt() == null ? null : doc.getAt().toEpochMilli(),
                doc.getEveryMs(),
                doc.getCronExpr(),
                doc.getCronTz()
        );
        Map<String, Object> rawPayload = doc.getPayload() == null ? Map.of() : doc.getPayload();
        PayloadJson payload = objectMapper.convertValue(rawPayload, PayloadJson.class);

        JobState state = new JobState(
                doc.getNextRunAt(),
                doc.getLastRunAt(),
                RunStatus.fromWireName(doc.getLastStatus()),
                doc.getLastError()
        );
        return new Job(
                doc.getId(),
                doc.getName(),
                doc.isEnabled(),
                schedule.toSchedule(),
                doc.isDeleteAfterRun(),
                payload.toPayload(),
                state,
                doc.getCreatedAt(),
                doc.getUpdatedAt() != null ? doc.getUpdatedAt() : doc.getCreatedAt()
        );
    }
}
