package io.cronagent.config;

import io.cronagent.core.SchedulerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration for the cron scheduler, bound from {@code cron.*}.
 */
@ConfigurationProperties(prefix = "cron")
public class CronProperties {

    public enum StoreType {
        FILE,
        MEMORY,
        MONGO
    }

    private boolean enabled = true;
    private int workerThreads = 8;
    private Duration maxRunDuration = Duration.ofMinutes(5);
    private Duration resyncEvery = Duration.ofMinutes(1);
    private int maxErrorLength = 1024;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private boolean ensureIndexesOnStartup = false; // mongo store only

    private final Store store = new Store();
    private final Web web = new Web();

    public SchedulerSettings toSettings() {
        return new SchedulerSettings(workerThreads, maxRunDuration, resyncEvery, maxErrorLength, shutdownTimeout);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public Duration getMaxRunDuration() {
        return maxRunDuration;
    }

    public void setMaxRunDuration(Duration maxRunDuration) {
        this.maxRunDuration = maxRunDuration;
    }

    public Duration getResyncEvery() {
        return resyncEvery;
    }

    public void setResyncEvery(Duration resyncEvery) {
        this.resyncEvery = resyncEvery;
    }

    public int getMaxErrorLength() {
        return maxErrorLength;
    }

    public void setMaxErrorLength(int maxErrorLength) {
        this.maxErrorLength = maxErrorLength;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Store getStore() {
        return store;
    }

    public Web getWeb() {
        return web;
    }

    public static class Store {
        private StoreType type = StoreType.FILE;
        private String path = System.getProperty("user.home") + "/.cronagent/cron/jobs.json";

        public StoreType getType() {
            return type;
        }

        public void setType(StoreType type) {
            this.type = type;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    public static class Web {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
