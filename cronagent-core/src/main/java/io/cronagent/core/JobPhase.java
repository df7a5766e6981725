package io.cronagent.core;

/**
 * Where a job sits in the scheduler's state machine.
 * <ul>
 *   <li>IDLE: no pending fire (disabled, spent one-shot, or no further cron occurrence)</li>
 *   <li>ARMED: enabled with a next fire time</li>
 *   <li>RUNNING: an execution holds the job's run lock</li>
 *   <li>DELETED: no longer in the store</li>
 * </ul>
 */
public enum JobPhase {
    IDLE,
    ARMED,
    RUNNING,
    DELETED
}
