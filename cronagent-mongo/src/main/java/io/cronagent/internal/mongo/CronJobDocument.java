package io.cronagent.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for a persisted cron job. The schedule is flattened into
 * {@code scheduleKind} plus the fields of that kind; the payload is kept as a plain map.
 */
@Document(collection = "cron_jobs")
public class CronJobDocument {

    @Id
    private String id;

    @Version
    private Long version;

    private String name;
    private boolean enabled;
    private boolean deleteAfterRun;

    private String scheduleKind;
    private Instant at;
    private Long everyMs;
    private String cronExpr;
    private String cronTz;

    private Map<String, Object> payload;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextRunAt;

    private Instant lastRunAt;
    private String lastStatus;
    private String lastError;

    private Instant createdAt;
    private Instant updatedAt;

    public CronJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isDeleteAfterRun() {
        return deleteAfterRun;
    }

    public void setDeleteAfterRun(boolean deleteAfterRun) {
        this.deleteAfterRun = deleteAfterRun;
    }

    public String getScheduleKind() {
        return scheduleKind;
    }

    public void setScheduleKind(String scheduleKind) {
        this.scheduleKind = scheduleKind;
    }

    public Instant getAt() {
        return at;
    }

    public void setAt(Instant at) {
        this.at = at;
    }

    public Long getEveryMs() {
        return everyMs;
    }

    public void setEveryMs(Long everyMs) {
        this.everyMs = everyMs;
    }

    public String getCronExpr() {
        return cronExpr;
    }

    public void setCronExpr(String cronExpr) {
        this.cronExpr = cronExpr;
    }

    public String getCronTz() {
        return cronTz;
    }

    public void setCronTz(String cronTz) {
        this.cronTz = cronTz;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public String getLastStatus() {
        return lastStatus;
    }

    public void setLastStatus(String lastStatus) {
        this.lastStatus = lastStatus;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
