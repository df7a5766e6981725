package io.cronagent.internal;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchQueueTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final DispatchQueue queue = new DispatchQueue();

    @Test
    void popDueShouldReturnDueEntriesEarliestFirst() {
        queue.upsert("late", T0.plusSeconds(30));
        queue.upsert("b", T0.plusSeconds(2));
        queue.upsert("a", T0.plusSeconds(1));

        assertThat(queue.popDue(T0.plusSeconds(5)))
                .extracting(DispatchQueue.Entry::jobId)
                .containsExactly("a", "b");
        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.peekEarliest()).map(DispatchQueue.Entry::jobId).contains("late");
    }

    @Test
    void upsertShouldMoveExistingEntry() {
        queue.upsert("job", T0.plusSeconds(1));
        queue.upsert("job", T0.plusSeconds(60));

        assertThat(queue.popDue(T0.plusSeconds(10))).isEmpty();
        assertThat(queue.dueAt("job")).contains(T0.plusSeconds(60));
        assertThat(queue.size()).isEqualTo(1);
    }

    @Test
    void removedEntryShouldNeverSurface() {
        queue.upsert("gone", T0);
        queue.upsert("kept", T0.plusSeconds(1));

        assertThat(queue.remove("gone")).isTrue();
        assertThat(queue.remove("gone")).isFalse();
        assertThat(queue.peekEarliest()).map(DispatchQueue.Entry::jobId).contains("kept");
        assertThat(queue.popDue(T0.plusSeconds(1)))
                .extracting(DispatchQueue.Entry::jobId)
                .containsExactly("kept");
    }

    @Test
    void manyReschedulesShouldKeepOneLiveEntry() {
        for (int i = 0; i < 500; i++) {
            queue.upsert("busy", T0.plusSeconds(i));
        }

        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.popDue(T0.plusSeconds(1000)))
                .containsExactly(new DispatchQueue.Entry("busy", T0.plusSeconds(499)));
    }
}
