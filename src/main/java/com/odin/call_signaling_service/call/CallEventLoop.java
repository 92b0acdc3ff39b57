package com.odin.call_signaling_service.call;

import java.util.concurrent.Executor;

/**
 * Serial inbox of a single call. Tasks run one at a time in submission order;
 * scheduled tasks join the same queue when their delay elapses.
 */
public interface CallEventLoop extends Executor {

    @Override
    void execute(Runnable task);

    Cancellable schedule(Runnable task, long delayMs);

    /**
     * Clock used for every timing decision of the session, in epoch millis.
     */
    long now();

    void shutdown();

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
