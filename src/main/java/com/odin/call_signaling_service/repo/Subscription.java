package com.odin.call_signaling_service.repo;

/**
 * Handle to a change subscription on the signaling store.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    Subscription NONE = () -> { };

    @Override
    void close();
}
