package io.cronagent.store;

import io.cronagent.core.Job;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persistence SPI for jobs. Implementations decide the storage technology; each operation must be
 * atomic with respect to concurrent readers, so no reader observes a half-written job.
 */
public interface JobRepository {

    /**
     * Store a new job.
     *
     * @throws IllegalStateException if a job with the same id already exists
     */
    void insert(Job job);

    Optional<Job> findById(String id);

    /**
     * All jobs, oldest first (by createdAt).
     */
    List<Job> findAll();

    /**
     * Atomic read-modify-write of one job.
     *
     * <p>{@code change} receives the current job and returns its replacement. Returning the same
     * instance means "no change" and nothing is written. Exceptions thrown by {@code change} propagate
     * and leave the stored job untouched. {@code change} may be invoked more than once when an
     * implementation retries on a concurrent write.
     *
     * @return the stored job after the change, or empty if no job has this id
     */
    Optional<Job> update(String id, UnaryOperator<Job> change);

    /**
     * @return true if a job was removed
     */
    boolean deleteById(String id);
}
