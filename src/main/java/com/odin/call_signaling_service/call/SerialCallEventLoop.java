package com.odin.call_signaling_service.call;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import com.odin.call_signaling_service.utility.CallLogContext;

import lombok.extern.slf4j.Slf4j;

/**
 * Event loop backed by one dedicated thread. A failing task is logged and
 * reported to the failure handler; the loop keeps running.
 */
@Slf4j
public class SerialCallEventLoop implements CallEventLoop {

    private final String roomId;
    private final String uid;
    private final ScheduledExecutorService executor;
    private volatile Consumer<Throwable> failureHandler = t -> { };

    public SerialCallEventLoop(String roomId, String uid) {
        this.roomId = roomId;
        this.uid = uid;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "call-" + roomId + "-" + uid);
            thread.setDaemon(true);
            return thread;
        });
    }

    public void setFailureHandler(Consumer<Throwable> failureHandler) {
        this.failureHandler = failureHandler;
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(() -> runGuarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Dropping task for room={} uid={}: loop is shut down", roomId, uid);
        }
    }

    @Override
    public Cancellable schedule(Runnable task, long delayMs) {
        try {
            ScheduledFuture<?> future = executor.schedule(() -> runGuarded(task), Math.max(0, delayMs),
                    TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("Dropping timer for room={} uid={}: loop is shut down", roomId, uid);
            return () -> { };
        }
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }

    private void runGuarded(Runnable task) {
        CallLogContext.set(roomId, uid);
        try {
            task.run();
        } catch (Exception e) {
            log.error("Call task failed for room={} uid={}: {}", roomId, uid, e.getMessage(), e);
            failureHandler.accept(e);
        } finally {
            CallLogContext.clear();
        }
    }
}
