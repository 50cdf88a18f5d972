package net.ogimage.adapters.persistence;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import net.ogimage.application.render.TaskLedger;
import net.ogimage.domain.render.RenderTask;
import net.ogimage.domain.render.RenderTaskState;
import net.ogimage.domain.render.TaskTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

/**
 * Single-process task ledger for local development and tests.
 *
 * <p>The active-task index is a {@link ConcurrentMap} keyed by fingerprint, so
 * {@code putIfAbsent} is the atomic check-and-create. Per-task updates run inside
 * {@code computeIfPresent} which serializes competing transitions on the same id.</p>
 */
@Repository
@ConditionalOnProperty(prefix = "og.pipeline", name = "ledger", havingValue = "memory")
public class InMemoryTaskLedger implements TaskLedger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskLedger.class);

    private final ConcurrentMap<UUID, RenderTask> tasks = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, UUID> activeByFingerprint = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<UUID> pendingQueue = new ConcurrentLinkedQueue<>();
    private final Clock clock;

    public InMemoryTaskLedger(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<RenderTask> createIfAbsent(RenderTask pendingTask) {
        if (pendingTask.state() != RenderTaskState.PENDING) {
            throw new IllegalArgumentException("Only pending tasks can be created, got " + pendingTask.state());
        }
        if (tasks.putIfAbsent(pendingTask.id(), pendingTask) != null) {
            throw new IllegalArgumentException("Render task id " + pendingTask.id() + " already exists");
        }
        UUID existing = activeByFingerprint.putIfAbsent(pendingTask.fingerprint(), pendingTask.id());
        if (existing != null) {
            tasks.remove(pendingTask.id());
            return Optional.empty();
        }
        pendingQueue.add(pendingTask.id());
        return Optional.of(pendingTask);
    }

    @Override
    public Optional<RenderTask> findActive(String fingerprint) {
        UUID activeId = activeByFingerprint.get(fingerprint);
        if (activeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(activeId)).filter(task -> task.state().isActive());
    }

    @Override
    public Optional<RenderTask> get(UUID taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public Optional<RenderTask> claimNextPending(String workerId) {
        UUID next;
        while ((next = pendingQueue.poll()) != null) {
            AtomicReference<RenderTask> claimed = new AtomicReference<>();
            tasks.computeIfPresent(next, (id, task) -> {
                if (task.state() != RenderTaskState.PENDING) {
                    return task;
                }
                RenderTask processing = task.claimedBy(workerId, clock.instant());
                claimed.set(processing);
                return processing;
            });
            if (claimed.get() != null) {
                return Optional.of(claimed.get());
            }
            log.debug("Skipping queued render task {} which is no longer pending", next);
        }
        return Optional.empty();
    }

    @Override
    public Optional<RenderTask> transition(TaskTransition transition) {
        AtomicReference<RenderTask> applied = new AtomicReference<>();
        tasks.computeIfPresent(transition.taskId(), (id, task) -> {
            if (task.state() != transition.expectedState() || !task.isOwnedBy(transition.ownerId())) {
                return task;
            }
            Instant now = clock.instant();
            RenderTask updated = transition.targetState() == RenderTaskState.COMPLETED
                ? task.completed(transition.imageUrl(), now)
                : task.failed(transition.errorMessage(), now);
            applied.set(updated);
            return updated;
        });
        RenderTask updated = applied.get();
        if (updated == null) {
            return Optional.empty();
        }
        if (updated.state().isTerminal()) {
            activeByFingerprint.remove(updated.fingerprint(), updated.id());
        }
        return Optional.of(updated);
    }

    @Override
    public Optional<RenderTask> heartbeat(UUID taskId, String ownerId) {
        AtomicReference<RenderTask> touched = new AtomicReference<>();
        tasks.computeIfPresent(taskId, (id, task) -> {
            if (task.state() != RenderTaskState.PROCESSING || !task.isOwnedBy(ownerId)) {
                return task;
            }
            RenderTask refreshed = task.touched(clock.instant());
            touched.set(refreshed);
            return refreshed;
        });
        return Optional.ofNullable(touched.get());
    }

    @Override
    public List<RenderTask> findProcessingUpdatedBefore(Instant cutoff) {
        return tasks.values().stream()
            .filter(task -> task.state() == RenderTaskState.PROCESSING)
            .filter(task -> task.updatedAt().isBefore(cutoff))
            .sorted(Comparator.comparing(RenderTask::updatedAt))
            .toList();
    }
}
