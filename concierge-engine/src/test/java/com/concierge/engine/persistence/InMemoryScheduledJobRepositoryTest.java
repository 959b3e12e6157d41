package com.concierge.engine.persistence;

import com.concierge.core.exception.DuplicateScheduleException;
import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.ScheduledJob;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryScheduledJobRepositoryTest {

    private final InMemoryScheduledJobRepository repository = new InMemoryScheduledJobRepository();

    @Test
    void save_withTakenName_shouldThrowDuplicate() {
        ScheduledJob job = ScheduledJob.create("u", "digest", "0 9 * * *", null, null);
        repository.save(job);

        assertThatThrownBy(() -> repository.save(ScheduledJob.create("u", "digest", "0 10 * * *", null, null)))
            .isInstanceOf(DuplicateScheduleException.class)
            .satisfies(e -> assertThat(((DuplicateScheduleException) e).getExistingJobId()).isEqualTo(job.id()));

        repository.save(ScheduledJob.create("other-user", "digest", "0 9 * * *", null, null));
        assertThat(repository.findEnabled()).hasSize(2);
    }

    @Test
    void update_unknownJob_shouldThrowNotFound() {
        assertThatThrownBy(() -> repository.update(ScheduledJob.create("u", "x", "* * * * *", null, null)))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void recordRun_shouldWriteBothTimestamps() {
        ScheduledJob job = ScheduledJob.create("u", "digest", "0 9 * * *", null, null);
        repository.save(job);
        Instant last = Instant.parse("2024-01-15T09:00:00Z");
        Instant next = Instant.parse("2024-01-16T09:00:00Z");

        repository.recordRun(job.id(), last, next);

        ScheduledJob stored = repository.findById(job.id()).orElseThrow();
        assertThat(stored.lastRunAt()).isEqualTo(last);
        assertThat(stored.nextRunAt()).isEqualTo(next);
    }

    @Test
    void findEnabled_shouldSkipDisabledJobs() {
        ScheduledJob job = ScheduledJob.create("u", "digest", "0 9 * * *", null, null);
        repository.save(job);
        repository.update(job.withEnabled(false));

        assertThat(repository.findEnabled()).isEmpty();
        assertThat(repository.findByUser("u")).hasSize(1);
    }
}
