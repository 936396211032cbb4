package io.storyloom.core.execution.parallel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.BooleanSupplier;
import java.util.logging.Logger;

/// Runs one task per item with at most `concurrency` tasks in flight.
///
/// Items are claimed in index order from a shared cursor by up to `concurrency` drainers:
/// the calling thread itself plus `concurrency - 1` tasks submitted to the executor. The
/// calling thread always makes progress on its own, so a fan-out nested inside an item
/// finishes even when every pool thread is busy with outer items. Results are returned
/// ordered by item index, regardless of finishing order. A failed item never stops its
/// siblings.
///
/// ### Retries
/// A failed item is re-run up to `retryCount` times, unless the run is aborting.
///
/// ### Abort
/// When `abortRequested` turns true no new items start; items never started are reported
/// as failed. The wait for running items checks `abortRequested` every poll interval and,
/// once it is set, interrupts them and returns without waiting further.
public class ParallelItemRunner {

    private static final Logger logger = Logger.getLogger(ParallelItemRunner.class.getName());

    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(50);

    private final ExecutorService executorService;
    private final Duration pollInterval;

    public ParallelItemRunner(ExecutorService executorService) {
        this(executorService, DEFAULT_POLL_INTERVAL);
    }

    /// @param executorService pool for the extra drainers, not null
    /// @param pollInterval how often a waiting caller re-checks the abort flag, positive
    public ParallelItemRunner(ExecutorService executorService, Duration pollInterval) {
        this.executorService =
                Objects.requireNonNull(executorService, "executorService must not be null");
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.pollInterval = pollInterval;
    }

    /// Work performed for one item.
    @FunctionalInterface
    public interface ItemTask {

        /// Runs one attempt for an item.
        ///
        /// @param index 0-based item index
        /// @param item item text, not null
        /// @return item output, never null
        /// @throws Exception if the attempt fails
        String run(int index, String item) throws Exception;
    }

    /// Runs all items and waits for them to finish or for the run to abort.
    ///
    /// @param items items in input order, not null
    /// @param concurrency maximum items in flight, at least 1
    /// @param retryCount extra attempts per failed item, at least 0
    /// @param task per-item work, not null
    /// @param abortRequested polled before each start and retry and while waiting, not null
    /// @return results ordered by item index, one per item, never null
    /// @throws InterruptedException if the waiting thread is interrupted; running items
    ///     are cancelled
    public List<ItemResult> run(
            List<String> items,
            int concurrency,
            int retryCount,
            ItemTask task,
            BooleanSupplier abortRequested)
            throws InterruptedException {
        int total = items.size();
        if (total == 0) {
            return List.of();
        }

        int window = Math.max(1, Math.min(concurrency, total));
        Batch batch = new Batch(items, retryCount, task, abortRequested);
        List<Future<?>> drainers = new ArrayList<>(window - 1);

        try {
            for (int i = 1; i < window; i++) {
                drainers.add(executorService.submit(batch::drain));
            }
        } catch (RejectedExecutionException e) {
            // The caller drains whatever the pool refused.
            logger.fine("Worker pool refused a drainer: " + e.getMessage());
        }

        try {
            batch.drain();
            while (!batch.finished.await(pollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                if (abortRequested.getAsBoolean()) {
                    drainers.forEach(f -> f.cancel(true));
                    logger.fine("Stopped waiting on running items: run aborted");
                    break;
                }
            }
        } catch (InterruptedException e) {
            drainers.forEach(f -> f.cancel(true));
            throw e;
        }

        List<ItemResult> ordered = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            ItemResult result = batch.results.get(i);
            if (result != null) {
                ordered.add(result);
            } else if (i < batch.started.get()) {
                ordered.add(ItemResult.failure(i, "aborted while running", 0));
            } else {
                ordered.add(ItemResult.failure(i, "not started: run aborted", 0));
            }
        }
        logger.fine("Finished " + total + " items with concurrency " + window);
        return ordered;
    }

    /// Shared state of one `run` call.
    private static final class Batch {

        private final List<String> items;
        private final int retryCount;
        private final ItemTask task;
        private final BooleanSupplier abortRequested;
        private final AtomicInteger cursor = new AtomicInteger();
        // Started items always form the prefix [0, started).
        private final AtomicInteger started = new AtomicInteger();
        private final AtomicReferenceArray<ItemResult> results;
        private final CountDownLatch finished;

        private Batch(
                List<String> items, int retryCount, ItemTask task, BooleanSupplier abortRequested) {
            this.items = items;
            this.retryCount = retryCount;
            this.task = task;
            this.abortRequested = abortRequested;
            this.results = new AtomicReferenceArray<>(items.size());
            this.finished = new CountDownLatch(items.size());
        }

        private void drain() {
            while (!abortRequested.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
                int index = cursor.getAndIncrement();
                if (index >= items.size()) {
                    return;
                }
                started.incrementAndGet();
                try {
                    results.set(index, attempt(index, items.get(index)));
                } finally {
                    finished.countDown();
                }
            }
            // Unclaimed items will never run.
            int unclaimed = items.size() - Math.min(cursor.getAndSet(items.size()), items.size());
            for (int i = 0; i < unclaimed; i++) {
                finished.countDown();
            }
        }

        private ItemResult attempt(int index, String item) {
            String lastError = null;
            int attempts = 0;
            for (int attempt = 0; attempt <= retryCount; attempt++) {
                attempts++;
                try {
                    return ItemResult.success(index, task.run(index, item), attempts);
                } catch (Exception e) {
                    lastError =
                            e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                    logger.warning(
                            "Item " + index + " failed (attempt " + attempts + "/"
                                    + (retryCount + 1) + "): " + lastError);
                    if (e instanceof InterruptedException) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                    if (abortRequested.getAsBoolean()) {
                        break;
                    }
                }
            }
            return ItemResult.failure(index, lastError, attempts);
        }
    }
}
