package io.kestra.plugin.etl.monitor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Instruments one run: overall start and end, every task's start and end, and how many
 * tasks were running at once. One instance per run; task callbacks may come from any
 * worker thread.
 */
public final class ExecutionMonitor {
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peak = new AtomicInteger();
    private final Queue<PartitionTiming> timings = new ConcurrentLinkedQueue<>();
    private volatile long startedNanos;
    private volatile int concurrency;

    public void start(int concurrency) {
        this.concurrency = concurrency;
        this.startedNanos = System.nanoTime();
    }

    /**
     * @return the task's start time, to hand back to {@link #taskFinished}
     */
    public long taskStarted() {
        int running = active.incrementAndGet();
        peak.accumulateAndGet(running, Math::max);
        return System.nanoTime();
    }

    public void taskFinished(int partitionIndex, int recordCount, long startedNanos, boolean succeeded) {
        long elapsed = System.nanoTime() - startedNanos;
        active.decrementAndGet();
        timings.add(new PartitionTiming(
            partitionIndex,
            recordCount,
            Duration.ofNanos(elapsed),
            succeeded,
            Thread.currentThread().getName()
        ));
    }

    public int activeTasks() {
        return active.get();
    }

    public ExecutionReport finish() {
        long elapsed = System.nanoTime() - startedNanos;
        List<PartitionTiming> ordered = new ArrayList<>(timings);
        ordered.sort(Comparator.comparingInt(PartitionTiming::partitionIndex));
        int succeeded = (int) ordered.stream().filter(PartitionTiming::succeeded).count();
        return ExecutionReport.builder()
            .totalElapsed(Duration.ofNanos(elapsed))
            .partitionTimings(List.copyOf(ordered))
            .partitionCount(ordered.size())
            .concurrency(concurrency)
            .peakConcurrency(peak.get())
            .succeededTasks(succeeded)
            .failedTasks(ordered.size() - succeeded)
            .build();
    }

    /**
     * Speedup of a parallel run over a sequential baseline of the same work: sequential
     * elapsed divided by parallel elapsed, the latter clamped to one nanosecond.
     */
    public static double compare(ExecutionReport parallel, ExecutionReport sequential) {
        long parallelNanos = Math.max(parallel.getTotalElapsed().toNanos(), 1L);
        return (double) sequential.getTotalElapsed().toNanos() / parallelNanos;
    }
}
