package io.cronagent.store;

import io.cronagent.core.Job;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Process-local repository. Jobs are lost on restart.
 */
public class InMemoryJobRepository implements JobRepository {

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();

    @Override
    public void insert(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (jobs.putIfAbsent(job.id(), job) != null) {
            throw new IllegalStateException("Duplicate job id: " + job.id());
        }
    }

    @Override
    public Optional<Job> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<Job> findAll() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(Job::createdAt).thenComparing(Job::id))
                .toList();
    }

    @Override
    public Optional<Job> update(String id, UnaryOperator<Job> change) {
        Objects.requireNonNull(change, "change must not be null");
        return Optional.ofNullable(jobs.computeIfPresent(id, (key, current) -> {
            Job next = change.apply(current);
            return next != null ? next : current;
        }));
    }

    @Override
    public boolean deleteById(String id) {
        return jobs.remove(id) != null;
    }
}
