package com.concierge.engine.persistence;

import com.concierge.core.exception.DuplicateScheduleException;
import com.concierge.core.exception.NotFoundException;
import com.concierge.core.model.ScheduledJob;
import com.concierge.core.repository.ScheduledJobRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory implementation of ScheduledJobRepository.
 * Writes are synchronized so the (userId, name) uniqueness check and the insert are atomic.
 */
@Repository
public class InMemoryScheduledJobRepository implements ScheduledJobRepository {

    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();

    @Override
    public synchronized void save(ScheduledJob job) {
        Optional<ScheduledJob> existing = findByUserAndName(job.userId(), job.name());
        if (existing.isPresent()) {
            throw new DuplicateScheduleException(job.userId(), job.name(), existing.get().id());
        }
        jobs.put(job.id(), job);
    }

    @Override
    public synchronized void update(ScheduledJob job) {
        ScheduledJob stored = jobs.get(job.id());
        if (stored == null) {
            throw new NotFoundException("ScheduledJob", job.id());
        }
        Optional<ScheduledJob> clash = findByUserAndName(job.userId(), job.name())
            .filter(other -> !other.id().equals(job.id()));
        if (clash.isPresent()) {
            throw new DuplicateScheduleException(job.userId(), job.name(), clash.get().id());
        }
        jobs.put(job.id(), job.withRun(stored.lastRunAt(), job.nextRunAt()));
    }

    @Override
    public synchronized Optional<ScheduledJob> findById(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized Optional<ScheduledJob> findByUserAndName(String userId, String name) {
        return jobs.values().stream()
            .filter(j -> j.userId().equals(userId) && j.name().equals(name))
            .findFirst();
    }

    @Override
    public synchronized List<ScheduledJob> findByUser(String userId) {
        return jobs.values().stream()
            .filter(j -> j.userId().equals(userId))
            .sorted(Comparator.comparing(ScheduledJob::createdAt))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ScheduledJob> findEnabled() {
        return jobs.values().stream()
            .filter(ScheduledJob::enabled)
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void recordRun(String jobId, Instant lastRunAt, Instant nextRunAt) {
        jobs.computeIfPresent(jobId, (id, job) -> job.withRun(lastRunAt, nextRunAt));
    }

    @Override
    public synchronized void updateNextRun(String jobId, Instant nextRunAt) {
        jobs.computeIfPresent(jobId, (id, job) -> job.withNextRunAt(nextRunAt));
    }

    @Override
    public synchronized boolean delete(String jobId) {
        return jobs.remove(jobId) != null;
    }
}
