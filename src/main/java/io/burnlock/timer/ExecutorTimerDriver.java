package io.burnlock.timer;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public final class ExecutorTimerDriver implements TimerDriver {
    private final Clock clock;
    private final ScheduledExecutorService executor;

    public ExecutorTimerDriver(Clock clock, int threads) {
        this.clock = clock;
        ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(Math.max(1, threads), new DaemonFactory());
        pool.setRemoveOnCancelPolicy(true);
        pool.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        pool.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        this.executor = pool;
    }

    public static ExecutorTimerDriver systemDefault() {
        return new ExecutorTimerDriver(Clock.systemUTC(), 2);
    }

    @Override
    public Clock clock() {
        return clock;
    }

    @Override
    public TimerHandle arm(long delayMs, Runnable task) {
        ScheduledFuture<?> future = executor.schedule(task, Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public TimerHandle schedulePeriodic(long initialDelayMs, long periodMs, Runnable task) {
        ScheduledFuture<?> future = executor.scheduleWithFixedDelay(
                task,
                Math.max(0L, initialDelayMs),
                Math.max(1L, periodMs),
                TimeUnit.MILLISECONDS
        );
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class DaemonFactory implements ThreadFactory {
        private final ThreadFactory delegate = Executors.defaultThreadFactory();
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = delegate.newThread(r);
            t.setName("burnlock-timer-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
