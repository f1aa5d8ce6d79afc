package org.example.course.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.example.course.entity.GenerationTaskEntity;
import org.example.course.entity.GenerationTaskStatus;
import org.example.course.repository.GenerationTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls {@code generation_tasks}, claims due tasks with a lease and runs them. A task whose lease
 * expires (worker crash) becomes claimable again, so delivery is at-least-once.
 */
@Component
@ConditionalOnProperty(name = "generation.queue.store", havingValue = "database")
public class GenerationTaskWorker {

    private static final Logger log = LoggerFactory.getLogger(GenerationTaskWorker.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    private final GenerationTaskRepository repository;
    private final GenerationWorkHandler workHandler;
    private final ScheduledExecutorService poller = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "generation-task-worker");
        thread.setDaemon(true);
        return thread;
    });

    @Value("${generation.queue.poll-interval-ms:2000}")
    private long pollIntervalMs;

    @Value("${generation.queue.batch-size:5}")
    private int batchSize;

    @Value("${generation.queue.lease-seconds:180}")
    private int leaseSeconds;

    @Value("${generation.queue.max-attempts:3}")
    private int maxAttempts;

    @Value("${generation.queue.initial-delay-seconds:30}")
    private int initialRetryDelaySeconds;

    @Value("${generation.queue.max-delay-seconds:600}")
    private int maxRetryDelaySeconds;

    @Value("${generation.queue.worker-id:}")
    private String configuredWorkerId;

    private String workerId;

    public GenerationTaskWorker(GenerationTaskRepository repository, GenerationWorkHandler workHandler) {
        this.repository = repository;
        this.workHandler = workHandler;
    }

    @PostConstruct
    public void init() {
        workerId = (configuredWorkerId != null && !configuredWorkerId.isBlank())
                ? configuredWorkerId
                : "generation-" + UUID.randomUUID();
        long interval = Math.max(100, pollIntervalMs);
        poller.scheduleWithFixedDelay(this::pollSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Generation task worker started (workerId={}, pollIntervalMs={})", workerId, interval);
    }

    @PreDestroy
    public void shutdown() {
        poller.shutdownNow();
        log.info("Generation task worker shutting down");
    }

    /**
     * Claims and runs one batch of due tasks. Returns how many tasks this worker ran.
     */
    int pollOnce() {
        LocalDateTime now = LocalDateTime.now();
        List<String> candidates = repository.findClaimableIds(
                now, GenerationTaskStatus.PENDING, GenerationTaskStatus.RUNNING,
                PageRequest.of(0, Math.max(1, batchSize)));
        int processed = 0;
        for (String taskId : candidates) {
            LocalDateTime claimedAt = LocalDateTime.now();
            int claimed = repository.claimLease(
                    taskId,
                    claimedAt,
                    claimedAt.plusSeconds(Math.max(1, leaseSeconds)),
                    workerId,
                    GenerationTaskStatus.PENDING,
                    GenerationTaskStatus.RUNNING);
            if (claimed == 0) {
                log.debug("Task {} was claimed by another worker", taskId);
                continue;
            }
            repository.findById(taskId).ifPresent(this::run);
            processed++;
        }
        return processed;
    }

    private void run(GenerationTaskEntity task) {
        try {
            workHandler.handle(DatabaseGenerationTaskQueue.toWork(task));
            task.setStatus(GenerationTaskStatus.COMPLETED);
            task.setLastError(null);
            clearLease(task);
            repository.save(task);
        } catch (RuntimeException e) {
            handleFailure(task, e);
        }
    }

    private void handleFailure(GenerationTaskEntity task, RuntimeException error) {
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        task.setLastError(message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message);
        clearLease(task);

        int configuredMaxAttempts = Math.max(1, maxAttempts);
        if (GenerationWorkHandler.isRetryable(error) && task.getAttempts() < configuredMaxAttempts) {
            long delayMs = computeRetryDelayMillis(task.getAttempts());
            task.setStatus(GenerationTaskStatus.PENDING);
            task.setNextAttemptAt(LocalDateTime.now().plus(Duration.ofMillis(delayMs)));
            repository.save(task);
            log.warn("Retrying generation task {} in {}s (attempt {}/{}): {}",
                    task.getId(), Math.max(1L, delayMs / 1000L), task.getAttempts() + 1, configuredMaxAttempts, message);
            return;
        }

        task.setStatus(GenerationTaskStatus.FAILED);
        repository.save(task);
        log.error("Generation task {} failed after {} attempts: {}", task.getId(), task.getAttempts(), message);
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Error polling generation tasks", e);
        }
    }

    private void clearLease(GenerationTaskEntity task) {
        task.setLeaseOwner(null);
        task.setLeaseExpiresAt(null);
    }

    private long computeRetryDelayMillis(int attempts) {
        long baseSeconds = Math.max(1, initialRetryDelaySeconds);
        long maxSeconds = Math.max(baseSeconds, maxRetryDelaySeconds);
        long delaySeconds = baseSeconds;
        for (int i = 1; i < attempts; i++) {
            if (delaySeconds >= maxSeconds) {
                break;
            }
            delaySeconds = Math.min(maxSeconds, delaySeconds * 2);
        }
        return Math.max(1L, delaySeconds) * 1000L;
    }
}
