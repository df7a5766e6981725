package io.cronagent.store;

import io.cronagent.core.Job;
import io.cronagent.core.JobPayload;
import io.cronagent.core.JobState;
import io.cronagent.core.Schedule;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobRepositoryTest {

    private final InMemoryJobRepository repo = new InMemoryJobRepository();

    @Test
    void insertShouldRejectDuplicateId() {
        repo.insert(job("a", Instant.EPOCH));

        assertThatThrownBy(() -> repo.insert(job("a", Instant.EPOCH)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void updateReturningSameInstanceShouldNotWrite() {
        Job stored = job("a", Instant.EPOCH);
        repo.insert(stored);

        assertThat(repo.update("a", j -> j)).containsSame(stored);
        assertThat(repo.update("missing", j -> j)).isEmpty();
    }

    @Test
    void updateShouldLeaveJobUntouchedWhenChangeThrows() {
        Job stored = job("a", Instant.EPOCH);
        repo.insert(stored);

        assertThatThrownBy(() -> repo.update("a", j -> {
            throw new IllegalArgumentException("rejected");
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(repo.findById("a")).containsSame(stored);
    }

    @Test
    void findAllShouldSortByCreatedAt() {
        repo.insert(job("late", Instant.EPOCH.plusSeconds(10)));
        repo.insert(job("early", Instant.EPOCH));

        assertThat(repo.findAll()).extracting(Job::id).containsExactly("early", "late");
    }

    private static Job job(String id, Instant createdAt) {
        return new Job(id, id, true, Schedule.every(Duration.ofSeconds(1)), false,
                JobPayload.message("m"), JobState.initial(null), createdAt, createdAt);
    }
}
