package io.cronagent.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.cronagent.core.Job;
import io.cronagent.json.JobFileJson;
import io.cronagent.json.JobJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Keeps every job in a single JSON file ({@code {"version":1,"jobs":[...]}}).
 *
 * <p>The whole file is rewritten on each mutation, through a temporary file and a move, and is
 * readable by its owner only where the file system supports POSIX permissions. A missing, empty or
 * unreadable file loads as an empty store; a corrupt file is logged and left in place until the
 * next write replaces it.
 */
public class JsonFileJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileJobRepository.class);

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final ObjectMapper objectMapper;
    private final Path file;
    private final Map<String, Job> jobs = new LinkedHashMap<>();

    /**
     * Uses a private {@link ObjectMapper}, so the file format does not follow application-wide Jackson settings.
     */
    public JsonFileJobRepository(Path file) {
        this(file, new ObjectMapper());
    }

    public JsonFileJobRepository(Path file, ObjectMapper objectMapper) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
        load();
    }

    public Path file() {
        return file;
    }

    /**
     * (Re)reads the file, replacing everything held in memory.
     */
    public synchronized void load() {
        jobs.clear();
        if (!Files.exists(file)) {
            return;
        }

        JobFileJson stored;
        try {
            if (Files.size(file) == 0) {
                return;
            }
            stored = objectMapper.readValue(file.toFile(), JobFileJson.class);
        } catch (IOException e) {
            log.warn("cron store unreadable, starting empty path={} msg={}", file, e.getMessage());
            return;
        }
        if (stored == null) {
            return;
        }

        for (JobJson json : stored.jobs()) {
            try {
                Job job = json.toJob();
                jobs.put(job.id(), job);
            } catch (RuntimeException e) {
                log.warn("cron store skipped invalid job id={} msg={}", json.id(), e.getMessage());
            }
        }
        log.debug("cron store loaded path={} jobs={}", file, jobs.size());
    }

    @Override
    public synchronized void insert(Job job) {
        Objects.requireNonNull(job, "job must not be null");
        if (jobs.containsKey(job.id())) {
            throw new IllegalStateException("Duplicate job id: " + job.id());
        }
        jobs.put(job.id(), job);
        try {
            persist();
        } catch (UncheckedIOException e) {
            jobs.remove(job.id());
            throw e;
        }
    }

    @Override
    public synchronized Optional<Job> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public synchronized List<Job> findAll() {
        return jobs.values().stream()
                .sorted(Comparator.comparing(Job::createdAt).thenComparing(Job::id))
                .toList();
    }

    @Override
    public synchronized Optional<Job> update(String id, UnaryOperator<Job> change) {
        Objects.requireNonNull(change, "change must not be null");
        Job current = jobs.get(id);
        if (current == null) {
            return Optional.empty();
        }
        Job next = change.apply(current);
        if (next == null || next == current) {
            return Optional.of(current);
        }
        jobs.put(id, next);
        try {
            persist();
        } catch (UncheckedIOException e) {
            jobs.put(id, current);
            throw e;
        }
        return Optional.of(next);
    }

    @Override
    public synchronized boolean deleteById(String id) {
        Job removed = jobs.remove(id);
        if (removed == null) {
            return false;
        }
        try {
            persist();
        } catch (UncheckedIOException e) {
            jobs.put(id, removed);
            throw e;
        }
        return true;
    }

    private void persist() {
        List<JobJson> out = new ArrayList<>(jobs.size());
        for (Job job : jobs.values()) {
            out.add(JobJson.from(job));
        }

        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                restrictToOwner(tmp);
                objectMapper.writeValue(tmp.toFile(), JobFileJson.of(out));
                try {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(tmp);
            }
            restrictToOwner(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cron store " + file, e);
        }
    }

    private static void restrictToOwner(Path path) throws IOException {
        if (path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, OWNER_ONLY);
        }
    }
}
