package io.kestra.plugin.etl.engine;

import io.kestra.plugin.etl.EtlException;
import io.kestra.plugin.etl.EvaluationException;
import io.kestra.plugin.etl.InvalidConfigurationException;
import io.kestra.plugin.etl.PartitionFailureException;
import io.kestra.plugin.etl.PartitionFailureException.PartitionError;
import io.kestra.plugin.etl.graph.ExecutionPlan;
import io.kestra.plugin.etl.graph.OperationGraph;
import io.kestra.plugin.etl.monitor.ExecutionMonitor;
import io.kestra.plugin.etl.monitor.ExecutionReport;
import io.kestra.plugin.etl.partition.Partition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a graph over a stream of partitions on a fixed pool of worker threads.
 * <p>
 * The calling thread pulls a partition only once a worker slot is free, so at most
 * {@code concurrency} partitions are held in memory besides the partial results. Every
 * dispatched task runs to completion: a failing partition does not cancel the others, and
 * all failures are reported together once the pool is drained. A concurrency of one goes
 * through the same path with a single worker.
 */
public final class PartitionScheduler {
    private static final Logger log = LoggerFactory.getLogger(PartitionScheduler.class);

    private final PartitionExecutor executor;

    public PartitionScheduler() {
        this(new PartitionExecutor());
    }

    public PartitionScheduler(PartitionExecutor executor) {
        this.executor = executor;
    }

    /**
     * @throws InvalidConfigurationException when {@code concurrency} is not positive
     * @throws PartitionFailureException     when at least one partition failed
     * @throws EtlException                  when reading the partitions failed or the
     *                                       results could not be merged
     */
    public ExecutionOutcome run(OperationGraph graph, Iterator<Partition> partitions, int concurrency) throws EtlException {
        if (concurrency <= 0) {
            throw new InvalidConfigurationException("concurrency must be > 0, got " + concurrency);
        }
        ExecutionPlan plan = graph.plan();
        ExecutionMonitor monitor = new ExecutionMonitor();
        monitor.start(concurrency);

        Semaphore slots = new Semaphore(concurrency);
        ExecutorService pool = Executors.newFixedThreadPool(concurrency, new WorkerThreadFactory());
        List<Dispatched> dispatched = new ArrayList<>();
        RuntimeException readFailure = null;

        List<PartialResult> partials = new ArrayList<>();
        List<PartitionError> errors = new ArrayList<>();
        try {
            while (true) {
                slots.acquire();
                Partition partition;
                try {
                    if (!partitions.hasNext()) {
                        slots.release();
                        break;
                    }
                    partition = partitions.next();
                } catch (RuntimeException e) {
                    slots.release();
                    readFailure = e;
                    log.warn("Reading input failed after {} partitions, waiting for in-flight tasks", dispatched.size(), e);
                    break;
                }
                log.debug("Dispatching partition {} ({} records)", partition.index(), partition.size());
                Future<PartialResult> future = pool.submit(() -> {
                    try {
                        return runTask(plan, partition, monitor);
                    } finally {
                        slots.release();
                    }
                });
                dispatched.add(new Dispatched(partition.index(), future));
            }

            for (Dispatched task : dispatched) {
                try {
                    partials.add(task.future().get());
                } catch (ExecutionException e) {
                    errors.add(new PartitionError(task.partitionIndex(), asEvaluationException(task.partitionIndex(), e.getCause())));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            throw new EtlException("Interrupted while running partitions", e);
        } finally {
            pool.shutdown();
        }

        if (readFailure != null) {
            EtlException failure = new EtlException("Failed to read input after " + dispatched.size() + " partitions", readFailure);
            for (PartitionError error : errors) {
                failure.addSuppressed(error.cause());
            }
            throw failure;
        }

        if (!errors.isEmpty()) {
            ExecutionReport report = monitor.finish();
            errors.sort(Comparator.comparingInt(PartitionError::partitionIndex));
            for (PartitionError error : errors) {
                log.warn("Partition {} failed: {}", error.partitionIndex(), error.cause().getMessage());
            }
            throw new PartitionFailureException(errors, report);
        }

        PipelineOutput output = new AggregationMerger(plan).merge(partials);
        ExecutionReport report = monitor.finish();
        log.info("Ran {} partitions with concurrency {} in {} ms (peak {} concurrent tasks, {} output records)",
            report.getPartitionCount(),
            concurrency,
            report.getTotalElapsed().toMillis(),
            report.getPeakConcurrency(),
            output.size()
        );
        return new ExecutionOutcome(output, report);
    }

    private PartialResult runTask(ExecutionPlan plan, Partition partition, ExecutionMonitor monitor) throws EvaluationException {
        long started = monitor.taskStarted();
        boolean succeeded = false;
        try {
            PartialResult result = executor.execute(plan, partition);
            succeeded = true;
            return result;
        } finally {
            monitor.taskFinished(partition.index(), partition.size(), started, succeeded);
            log.debug("Partition {} {}", partition.index(), succeeded ? "done" : "failed");
        }
    }

    private static EvaluationException asEvaluationException(int partitionIndex, Throwable cause) {
        if (cause instanceof EvaluationException evaluationException) {
            return evaluationException;
        }
        return new EvaluationException(partitionIndex, -1L, "partition task", null, cause);
    }

    private record Dispatched(int partitionIndex, Future<PartialResult> future) {
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNT = new AtomicInteger();

        private final int pool = POOL_COUNT.incrementAndGet();
        private final AtomicInteger threadCount = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "etl-" + pool + "-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
