package com.autoconcurrency.scheduler.executor;

import com.autoconcurrency.scheduler.model.Outcome;
import com.autoconcurrency.scheduler.model.RunReport;
import com.autoconcurrency.scheduler.model.Strategy;
import com.autoconcurrency.scheduler.model.WorkItem;
import com.autoconcurrency.scheduler.translate.ThreadedParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process scheduler for the THREADED strategy.
 *
 * Each call to {@link #execute} owns its ready queue, its worker pool and its
 * {@link ResultAggregator}; nothing is shared between runs.
 *
 * <ol>
 *   <li>Items are partitioned into DispatchUnits ({@link UnitPartitioner}).</li>
 *   <li>A fixed pool of {@code workerCount} threads (capped at the number of
 *       units) pulls units from one FIFO queue until it is empty, so fast
 *       workers keep taking more units.</li>
 *   <li>A unit's items run one after another on the worker that took it.</li>
 *   <li>Any throwable from an item becomes that item's Outcome; the worker,
 *       the rest of the unit and the other workers carry on. An interrupt
 *       raised by an item is cleared before the worker's next item.</li>
 * </ol>
 * The caller blocks until every worker has exited.
 */
@Component
public class ThreadedExecutor {

    private static final Logger log = LoggerFactory.getLogger(ThreadedExecutor.class);

    private final String threadPrefix;

    public ThreadedExecutor(
            @Value("${autoconcurrency.worker-thread-prefix:auto-concurrency-worker-}") String threadPrefix) {
        this.threadPrefix = threadPrefix;
    }

    public RunReport execute(List<WorkItem> items, ThreadedParameters params) {
        return execute(items, params, new CancellationToken());
    }

    /**
     * Run every item and return outcomes in submission order.
     *
     * @throws SchedulerException if the calling thread is interrupted while waiting
     */
    public RunReport execute(List<WorkItem> items, ThreadedParameters params, CancellationToken token) {
        if (items.isEmpty()) {
            return RunReport.empty(Strategy.THREADED);
        }

        List<DispatchUnit> units = UnitPartitioner.partition(items, params.groupingEnabled());
        Queue<DispatchUnit> ready  = new ConcurrentLinkedQueue<>(units);
        ResultAggregator  results = new ResultAggregator(items);
        // Threads beyond the number of units would only start and exit.
        int workerCount = Math.min(params.workerCount(), units.size());

        log.debug("Dispatching {} items as {} units across {} workers",
                items.size(), units.size(), workerCount);

        ExecutorService pool = Executors.newFixedThreadPool(workerCount, workerThreads());
        try {
            List<Future<Integer>> workers = new ArrayList<>(workerCount);
            for (int i = 0; i < workerCount; i++) {
                workers.add(pool.submit(() -> drain(ready, results, token)));
            }
            for (Future<Integer> worker : workers) {
                worker.get();
            }
        } catch (InterruptedException e) {
            token.cancel();
            Thread.currentThread().interrupt();
            throw new SchedulerException("Interrupted while waiting for " + workerCount + " workers", e);
        } catch (ExecutionException e) {
            token.cancel();
            throw new SchedulerException("Worker terminated abnormally", e.getCause());
        } finally {
            pool.shutdown();
        }

        RunReport report = results.toReport(Strategy.THREADED, token.isCancelled());
        if (report.cancelled()) {
            log.info("Run cancelled: {} of {} items completed", results.completed(), items.size());
        }
        return report;
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    /** Worker loop: take units until the queue is empty or the run is cancelled. */
    private int drain(Queue<DispatchUnit> ready, ResultAggregator results, CancellationToken token) {
        int executed = 0;
        DispatchUnit unit;
        while (!token.isCancelled() && (unit = ready.poll()) != null) {
            for (ScheduledItem scheduled : unit.items()) {
                results.record(scheduled.position(), runItem(scheduled.item()));
                executed++;
            }
        }
        log.debug("{} exiting after {} items", Thread.currentThread().getName(), executed);
        return executed;
    }

    private Outcome runItem(WorkItem item) {
        try {
            item.body().run();
            return Outcome.passed(item.id());
        } catch (AssertionError e) {
            log.debug("Item {} failed: {}", item.id(), e.getMessage());
            return Outcome.failed(item.id(), e);
        } catch (Throwable t) {
            log.warn("Item {} errored: {}", item.id(), t.toString(), t);
            return Outcome.errored(item.id(), t);
        } finally {
            // An item's interrupt belongs to that item; the worker keeps serving the queue.
            if (Thread.interrupted()) {
                log.debug("Cleared interrupt left by item {}", item.id());
            }
        }
    }

    private ThreadFactory workerThreads() {
        AtomicInteger index = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, threadPrefix + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
