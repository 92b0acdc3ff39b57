package com.odin.call_signaling_service.call;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

class SessionTimerTest {

    @Test
    void rearmingReplacesThePendingRun() {
        ManualCallEventLoop loop = new ManualCallEventLoop();
        SessionTimer timer = new SessionTimer(loop, "debounce");
        List<String> fired = new ArrayList<>();

        timer.arm(100, () -> fired.add("first"));
        loop.advance(50);
        timer.arm(100, () -> fired.add("second"));
        loop.advance(60);
        assertThat(fired).isEmpty();
        assertThat(timer.isArmed()).isTrue();

        loop.advance(100);
        assertThat(fired).containsExactly("second");
        assertThat(timer.isArmed()).isFalse();
    }

    @Test
    void cancelledRunNeverFires() {
        ManualCallEventLoop loop = new ManualCallEventLoop();
        SessionTimer timer = new SessionTimer(loop, "retry");
        List<String> fired = new ArrayList<>();

        timer.arm(100, () -> fired.add("run"));
        timer.cancel();
        loop.advance(200);

        assertThat(fired).isEmpty();
        assertThat(timer.isArmed()).isFalse();
    }

    @Test
    void runAlreadyQueuedWhenCancelledIsSuppressed() {
        List<Runnable> queued = new ArrayList<>();
        CallEventLoop leaky = new CallEventLoop() {
            @Override
            public void execute(Runnable task) {
                task.run();
            }

            @Override
            public Cancellable schedule(Runnable task, long delayMs) {
                queued.add(task);
                return () -> { };
            }

            @Override
            public long now() {
                return 0;
            }

            @Override
            public void shutdown() {
            }
        };
        SessionTimer timer = new SessionTimer(leaky, "restart");
        List<String> fired = new ArrayList<>();

        timer.arm(10, () -> fired.add("run"));
        timer.cancel();
        queued.get(0).run();

        assertThat(fired).isEmpty();
    }
}
