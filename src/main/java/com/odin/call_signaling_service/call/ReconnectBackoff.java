package com.odin.call_signaling_service.call;

/**
 * Attempt counter and delay curve for full reconnects.
 */
public class ReconnectBackoff {

    private static final double GROWTH = 1.5;

    private final long baseDelayMs;
    private final double maxMultiplier;
    private final long maxDelayMs;
    private final int maxAttempts;
    private int attempt;

    public ReconnectBackoff(long baseDelayMs, double maxMultiplier, long maxDelayMs, int maxAttempts) {
        this.baseDelayMs = baseDelayMs;
        this.maxMultiplier = maxMultiplier;
        this.maxDelayMs = maxDelayMs;
        this.maxAttempts = maxAttempts;
    }

    public long delayFor(int attempt) {
        double multiplier = Math.min(Math.pow(GROWTH, attempt), maxMultiplier);
        return Math.min(Math.round(baseDelayMs * multiplier), maxDelayMs);
    }

    /**
     * Delay for the current attempt; advances the counter.
     */
    public long nextDelay() {
        return delayFor(attempt++);
    }

    public boolean isExhausted() {
        return attempt >= maxAttempts;
    }

    public int getAttempt() {
        return attempt;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void reset() {
        attempt = 0;
    }
}
