package com.odin.call_signaling_service.call;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.PriorityQueue;

/**
 * Event loop driven by the test thread with a virtual clock. Nothing runs
 * until {@link #runUntilIdle()} or {@link #advance(long)} is called.
 */
public class ManualCallEventLoop implements CallEventLoop {

    private static final int MAX_TASKS_PER_DRAIN = 100_000;

    private final Deque<Runnable> ready = new ArrayDeque<>();
    private final PriorityQueue<Timer> timers = new PriorityQueue<>(
            Comparator.comparingLong((Timer t) -> t.due).thenComparingLong(t -> t.sequence));
    private long now = 1_000_000L;
    private long sequence;
    private boolean shutdown;

    private static final class Timer {
        private final long due;
        private final long sequence;
        private final Runnable task;
        private boolean cancelled;

        private Timer(long due, long sequence, Runnable task) {
            this.due = due;
            this.sequence = sequence;
            this.task = task;
        }
    }

    @Override
    public void execute(Runnable task) {
        if (!shutdown) {
            ready.addLast(task);
        }
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMs) {
        if (shutdown) {
            return () -> { };
        }
        Timer timer = new Timer(now + Math.max(0, delayMs), sequence++, task);
        timers.add(timer);
        return () -> timer.cancelled = true;
    }

    @Override
    public long now() {
        return now;
    }

    @Override
    public void shutdown() {
        shutdown = true;
        ready.clear();
        timers.clear();
    }

    /**
     * Runs queued tasks, including the ones they queue, without moving the clock.
     */
    public int runUntilIdle() {
        int ran = 0;
        while (!ready.isEmpty()) {
            ready.pollFirst().run();
            if (++ran > MAX_TASKS_PER_DRAIN) {
                throw new IllegalStateException("event loop does not settle");
            }
        }
        return ran;
    }

    /**
     * Moves the clock forward, firing due timers in order and draining the
     * queue after each of them.
     */
    public void advance(long millis) {
        long target = now + millis;
        runUntilIdle();
        while (true) {
            Timer next = timers.peek();
            if (next == null || next.due > target) {
                break;
            }
            timers.poll();
            if (next.cancelled) {
                continue;
            }
            now = Math.max(now, next.due);
            next.task.run();
            runUntilIdle();
        }
        now = target;
        runUntilIdle();
    }

    public int pendingTimers() {
        return (int) timers.stream().filter(t -> !t.cancelled).count();
    }
}
