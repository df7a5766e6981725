package io.cronagent.config;

import io.cronagent.CronService;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the cron service's start/stop with the Spring container lifecycle.
 */
public class CronLifecycle implements SmartLifecycle {
    private final CronService cronService;

    public CronLifecycle(CronService cronService) {
        this.cronService = cronService;
    }

    @Override
    public void start() {
        cronService.start();
    }

    @Override
    public void stop() {
        cronService.stop();
    }

    @Override
    public boolean isRunning() {
        return cronService.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
