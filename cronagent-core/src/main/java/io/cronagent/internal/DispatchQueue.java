package io.cronagent.internal;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Pending fires ordered by due time, at most one entry per job.
 *
 * <p>Replaced and removed entries stay in the heap and are dropped when they surface, so upsert and
 * remove are O(log n) and O(1). Thread-safe.
 */
public class DispatchQueue {

    public record Entry(String jobId, Instant dueAt) {
        public Entry {
            Objects.requireNonNull(jobId, "jobId must not be null");
            Objects.requireNonNull(dueAt, "dueAt must not be null");
        }
    }

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(
            Comparator.comparing(Entry::dueAt).thenComparing(Entry::jobId));
    private final Map<String, Entry> live = new HashMap<>();

    /**
     * Insert or move the job's entry to {@code dueAt}.
     */
    public synchronized void upsert(String jobId, Instant dueAt) {
        Entry entry = new Entry(jobId, dueAt);
        live.put(jobId, entry);
        heap.offer(entry);
        if (heap.size() > 2 * live.size() + 64) {
            compact();
        }
    }

    /**
     * @return true if the job had an entry
     */
    public synchronized boolean remove(String jobId) {
        return live.remove(jobId) != null;
    }

    public synchronized Optional<Entry> peekEarliest() {
        discardStale();
        return Optional.ofNullable(heap.peek());
    }

    /**
     * Remove and return every entry due at or before {@code now}, earliest first.
     */
    public synchronized List<Entry> popDue(Instant now) {
        List<Entry> due = new ArrayList<>();
        while (true) {
            discardStale();
            Entry head = heap.peek();
            if (head == null || head.dueAt().isAfter(now)) {
                break;
            }
            heap.poll();
            live.remove(head.jobId());
            due.add(head);
        }
        return due;
    }

    public synchronized Optional<Instant> dueAt(String jobId) {
        Entry entry = live.get(jobId);
        return entry == null ? Optional.empty() : Optional.of(entry.dueAt());
    }

    public synchronized int size() {
        return live.size();
    }

    public synchronized void clear() {
        heap.clear();
        live.clear();
    }

    private void compact() {
        heap.clear();
        heap.addAll(live.values());
    }

    private void discardStale() {
        Entry head;
        while ((head = heap.peek()) != null && live.get(head.jobId()) != head) {
            heap.poll();
        }
    }
}
