package com.phillippitts.worktracker.testutil;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * TaskScheduler that only runs one-shot tasks when the test tells it to.
 *
 * <p>{@link #runDueTasks(Instant)} executes, in due order, every uncancelled task due at or
 * before the given instant. Periodic scheduling is not supported.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final List<ManualFuture> tasks = new CopyOnWriteArrayList<>();

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Instant startTime) {
        ManualFuture future = new ManualFuture(task, startTime);
        tasks.add(future);
        return future;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("trigger scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("periodic scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("periodic scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("periodic scheduling not supported");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("periodic scheduling not supported");
    }

    /**
     * Runs every pending task due at or before {@code now}.
     *
     * @return number of tasks run
     */
    public int runDueTasks(Instant now) {
        int ran = 0;
        while (true) {
            ManualFuture next = tasks.stream()
                    .filter(f -> !f.isDone() && !f.dueAt.isAfter(now))
                    .min(Comparator.comparing(f -> f.dueAt))
                    .orElse(null);
            if (next == null) {
                return ran;
            }
            next.run();
            ran++;
        }
    }

    /**
     * @return due times of tasks that have neither run nor been cancelled
     */
    public List<Instant> pendingDueTimes() {
        List<Instant> due = new ArrayList<>();
        for (ManualFuture f : tasks) {
            if (!f.isDone()) {
                due.add(f.dueAt);
            }
        }
        due.sort(Comparator.naturalOrder());
        return due;
    }

    public int cancelledCount() {
        return (int) tasks.stream().filter(ManualFuture::isCancelled).count();
    }

    static final class ManualFuture implements ScheduledFuture<Object> {
        private final Runnable task;
        private final Instant dueAt;
        private volatile boolean cancelled;
        private volatile boolean done;

        ManualFuture(Runnable task, Instant dueAt) {
            this.task = task;
            this.dueAt = dueAt;
        }

        void run() {
            try {
                task.run();
            } finally {
                done = true;
            }
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(Instant.now(), dueAt).toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            done = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
