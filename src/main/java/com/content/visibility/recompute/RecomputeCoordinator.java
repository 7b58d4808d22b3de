package com.content.visibility.recompute;

import com.content.visibility.core.model.EntityType;
import com.content.visibility.error.NotFoundException;
import com.content.visibility.exclusion.ExclusionComputer;
import com.content.visibility.exclusion.ExclusionResult;
import com.content.visibility.hidden.HiddenEntityListener;
import com.content.visibility.lock.RecomputeLock;
import com.content.visibility.logging.LogContext;
import com.content.visibility.metrics.MetricsService;
import com.content.visibility.metrics.NoOpMetricsService;
import com.content.visibility.user.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs recompute passes: one user on the caller's thread, all users on a bounded
 * worker pool, and asynchronous single-user requests queued after an unhide.
 *
 * <p>Concurrent calls for the same user share one pass, and passes are still
 * serialized through the {@link RecomputeLock}; passes for different users run
 * concurrently. A failing user in
 * {@link #recomputeAll()} is counted and reported, never rethrown.</p>
 */
public class RecomputeCoordinator implements HiddenEntityListener, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RecomputeCoordinator.class);

    private final ExclusionComputer computer;
    private final UserDirectory users;
    private final RecomputeLock lock;
    private final MetricsService metrics;
    private final RecomputeConfig config;
    private final ExecutorService workers;
    private final Map<Long, CompletableFuture<ExclusionResult>> pending = new ConcurrentHashMap<>();
    private final Map<Long, CompletableFuture<ExclusionResult>> running = new ConcurrentHashMap<>();

    public RecomputeCoordinator(ExclusionComputer computer, UserDirectory users, RecomputeLock lock,
                                MetricsService metrics, RecomputeConfig config) {
        this.computer = Objects.requireNonNull(computer, "computer");
        this.users = Objects.requireNonNull(users, "users");
        this.lock = Objects.requireNonNull(lock, "lock");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.config = config != null ? config : RecomputeConfig.defaults();
        this.workers = Executors.newFixedThreadPool(this.config.maxParallelUsers(), new WorkerThreadFactory());
        log.info("RecomputeCoordinator initialized: maxParallelUsers={} passTimeoutMs={} recomputeOnUnhide={}",
                this.config.maxParallelUsers(), this.config.passTimeoutMs(), this.config.recomputeOnUnhide());
    }

    /**
     * Recomputes one user on the calling thread. A call for a user whose pass is
     * already running joins that pass and returns its result, or its failure.
     *
     * @throws NotFoundException if the user does not exist
     * @throws com.content.visibility.lock.LockAcquisitionException if the user's
     *         lock could not be acquired in time
     */
    public ExclusionResult recomputeUser(long userId) {
        if (!users.exists(userId)) {
            throw NotFoundException.user(userId);
        }
        CompletableFuture<ExclusionResult> pass = new CompletableFuture<>();
        CompletableFuture<ExclusionResult> inFlight = running.putIfAbsent(userId, pass);
        if (inFlight != null) {
            log.debug("recompute.joined userId={}", userId);
            return await(inFlight);
        }
        try {
            ExclusionResult result = runPass(userId);
            pass.complete(result);
            return result;
        } catch (RuntimeException e) {
            pass.completeExceptionally(e);
            throw e;
        } finally {
            running.remove(userId, pass);
        }
    }

    private ExclusionResult runPass(long userId) {
        try (LogContext ctx = LogContext.forRecompute(LogContext.generateCorrelationId(), userId)) {
            long start = System.nanoTime();
            lock.lock(userId);
            try {
                ExclusionResult result = computer.recompute(userId);
                metrics.recordRecompute(Duration.ofNanos(System.nanoTime() - start), true);
                return result;
            } catch (RuntimeException e) {
                metrics.recordRecompute(Duration.ofNanos(System.nanoTime() - start), false);
                log.warn("recompute.failed userId={} error={}", userId, e.getMessage());
                throw e;
            } finally {
                lock.unlock(userId);
            }
        }
    }

    private static ExclusionResult await(CompletableFuture<ExclusionResult> inFlight) {
        try {
            return inFlight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Recomputes every user known to the directory, up to
     * {@link RecomputeConfig#maxParallelUsers()} at a time.
     */
    public RecomputeAllResult recomputeAll() {
        String batchId = LogContext.generateCorrelationId();
        try (LogContext ctx = LogContext.forBatch(batchId)) {
            List<Long> userIds = new ArrayList<>(users.allUserIds());
            userIds.sort(Comparator.naturalOrder());
            log.info("recomputeAll.started users={}", userIds.size());

            Map<Long, Future<ExclusionResult>> futures = new LinkedHashMap<>();
            for (long userId : userIds) {
                futures.put(userId, workers.submit(() -> recomputeUser(userId)));
            }

            int success = 0;
            List<RecomputeAllResult.UserFailure> errors = new ArrayList<>();
            for (Map.Entry<Long, Future<ExclusionResult>> entry : futures.entrySet()) {
                try {
                    entry.getValue().get();
                    success++;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    errors.add(new RecomputeAllResult.UserFailure(entry.getKey(), describe(cause)));
                    log.error("recomputeAll.userFailed userId={} error={}", entry.getKey(), cause.getMessage(), cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    errors.add(new RecomputeAllResult.UserFailure(entry.getKey(), "Interrupted"));
                    log.warn("recomputeAll.interrupted userId={}", entry.getKey());
                }
            }
            log.info("recomputeAll.completed success={} failed={}", success, errors.size());
            return new RecomputeAllResult(success, errors.size(), errors);
        }
    }

    /**
     * Queues a recompute of one user. A request for a user that already has one
     * waiting to start returns the waiting one. Failures are logged.
     */
    public CompletableFuture<ExclusionResult> requestRecompute(long userId) {
        return pending.computeIfAbsent(userId, id -> {
            CompletableFuture<ExclusionResult> future = CompletableFuture.supplyAsync(() -> {
                pending.remove(id);
                return recomputeUser(id);
            }, workers);
            future.whenComplete((result, error) -> {
                if (error != null) {
                    log.warn("recompute.asyncFailed userId={} error={}", id, error.getMessage());
                }
            });
            return future;
        });
    }

    @Override
    public void onUnhide(long userId, EntityType type) {
        if (config.recomputeOnUnhide()) {
            log.debug("recompute.queued userId={} reason=unhide type={}", userId, type);
            requestRecompute(userId);
        }
    }

    public RecomputeConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("RecomputeCoordinator closed");
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "visibility-recompute-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
