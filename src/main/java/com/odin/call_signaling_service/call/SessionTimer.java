package com.odin.call_signaling_service.call;

/**
 * Re-armable one-shot timer owned by a {@link CallSession}. Arming replaces any
 * pending run; a run that was superseded or cancelled never fires, even if it
 * was already queued on the loop.
 */
public class SessionTimer {

    private final CallEventLoop loop;
    private final String name;
    private CallEventLoop.Cancellable pending;
    private long token;

    SessionTimer(CallEventLoop loop, String name) {
        this.loop = loop;
        this.name = name;
    }

    public void arm(long delayMs, Runnable action) {
        cancel();
        long armed = token;
        pending = loop.schedule(() -> {
            if (token != armed) {
                return;
            }
            pending = null;
            action.run();
        }, delayMs);
    }

    public void cancel() {
        token++;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    public boolean isArmed() {
        return pending != null;
    }

    public String getName() {
        return name;
    }
}
