package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_ICE_RECOVERY;
import static com.odin.call_signaling_service.constants.ApplicationConstants.SOURCE_HEALTH;

import java.util.ArrayDeque;
import java.util.Deque;

import com.odin.call_signaling_service.config.CallEngineProperties;
import com.odin.call_signaling_service.enums.CallErrorCode;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.ConnectionQuality;
import com.odin.call_signaling_service.transport.MediaTransport;
import com.odin.call_signaling_service.transport.PeerConnectionState;
import com.odin.call_signaling_service.transport.TransportStats;

import lombok.extern.slf4j.Slf4j;

/**
 * Watches transport connectivity and recovers from degradation: debounced ICE
 * restarts, relay escalation after repeated errors, and full reconnects with
 * exponential backoff. A connection that comes back cancels every pending
 * recovery step.
 */
@Slf4j
public class ConnectionHealthMonitor {

    static final String TRIGGER_DISCONNECTED = "disconnected";
    static final String TRIGGER_HEALTH_CHECK = "health-check";

    private final CallSession session;
    private final CallEngineProperties properties;
    private final ReconnectBackoff backoff;
    private final Deque<Long> errorTimestamps = new ArrayDeque<>();
    private final SessionTimer restartTimer;
    private final SessionTimer disconnectedTimer;
    private final SessionTimer reconnectTimer;
    private final SessionTimer healthCheckTimer;

    private long lastConnectedAt;
    private long lastRestartAt = Long.MIN_VALUE / 2;
    private int missedChecks;

    ConnectionHealthMonitor(CallSession session) {
        this.session = session;
        this.properties = session.getProperties();
        this.backoff = new ReconnectBackoff(properties.getReconnectBaseDelayMs(),
                properties.getReconnectMaxMultiplier(), properties.getReconnectMaxDelayMs(),
                properties.getMaxReconnectAttempts());
        this.restartTimer = session.newTimer("ice-restart");
        this.disconnectedTimer = session.newTimer("disconnected-fallback");
        this.reconnectTimer = session.newTimer("full-reconnect");
        this.healthCheckTimer = session.newTimer("health-check");
    }

    public void start() {
        missedChecks = 0;
    }

    /**
     * Cancels the timers tied to the current transport. The reconnect backoff
     * and the error window survive so that escalation carries across reconnects.
     */
    public void stop() {
        restartTimer.cancel();
        disconnectedTimer.cancel();
        reconnectTimer.cancel();
        healthCheckTimer.cancel();
    }

    public void onConnectionState(PeerConnectionState connectionState) {
        log.info("Connection state {} in room {}", connectionState, session.getRoomId());
        switch (connectionState) {
            case CONNECTED:
                restartTimer.cancel();
                disconnectedTimer.cancel();
                reconnectTimer.cancel();
                backoff.reset();
                missedChecks = 0;
                lastConnectedAt = session.getLoop().now();
                session.setStatus(CallStatus.CONNECTED);
                session.getDiagnostics().info(SOURCE_HEALTH, "connected");
                healthCheckTimer.arm(properties.getHealthCheckIntervalMs(), this::runHealthCheck);
                break;
            case CONNECTING:
                if (session.getStatus() != CallStatus.RECONNECTING) {
                    session.setStatus(CallStatus.CONNECTING);
                }
                break;
            case DISCONNECTED:
                session.setStatus(CallStatus.RECONNECTING);
                session.getDiagnostics().warn(SOURCE_HEALTH, "disconnected", null);
                scheduleRestart(TRIGGER_DISCONNECTED);
                if (!disconnectedTimer.isArmed()) {
                    disconnectedTimer.arm(properties.getDisconnectedReconnectTimeoutMs(),
                            () -> scheduleFullReconnect("still disconnected"));
                }
                break;
            case FAILED:
                recordConnectivityError("connection failed");
                restartTimer.cancel();
                disconnectedTimer.cancel();
                healthCheckTimer.cancel();
                session.updateQuality(ConnectionQuality.DISCONNECTED);
                scheduleFullReconnect("connection failed");
                break;
            default:
                break;
        }
    }

    public void onCandidateError(String url, int errorCode, String errorText) {
        log.debug("Candidate error {} from {} in room {}: {}", errorCode, url, session.getRoomId(), errorText);
        recordConnectivityError("candidate error " + errorCode + " from " + url);
    }

    void scheduleRestart(String trigger) {
        long now = session.getLoop().now();
        if (lastConnectedAt > 0 && now - lastConnectedAt < properties.getRestartCooldownAfterConnectMs()) {
            log.debug("Skipping ICE restart in room {}: connected {} ms ago", session.getRoomId(),
                    now - lastConnectedAt);
            return;
        }
        if (restartTimer.isArmed()) {
            return;
        }
        long delay = Math.max(properties.getRestartDebounceMs(),
                lastRestartAt + properties.getMinRestartIntervalMs() - now);
        restartTimer.arm(delay, () -> restartIce(trigger));
    }

    private void restartIce(String trigger) {
        MediaTransport transport = session.getTransport();
        if (transport == null || !session.isJoined()) {
            return;
        }
        if (!TRIGGER_HEALTH_CHECK.equals(trigger) && transport.getConnectionState() == PeerConnectionState.CONNECTED) {
            log.debug("Connection in room {} recovered before the restart", session.getRoomId());
            return;
        }
        lastRestartAt = session.getLoop().now();
        log.warn("Restarting ICE in room {} ({})", session.getRoomId(), trigger);
        session.getDiagnostics().warn(SOURCE_HEALTH, "ice restart: " + trigger, null);
        transport.restartIce();
        session.getScheduler().request(REASON_ICE_RECOVERY, false);
    }

    private void recordConnectivityError(String description) {
        long now = session.getLoop().now();
        errorTimestamps.addLast(now);
        while (!errorTimestamps.isEmpty() && now - errorTimestamps.peekFirst() > properties.getFailureWindowMs()) {
            errorTimestamps.pollFirst();
        }
        int errors = errorTimestamps.size();
        NegotiationState state = session.getState();
        if (errors >= properties.getRelayOnlyErrorThreshold() && !state.isRelayOnly()) {
            state.setRelayOnly(true);
            log.warn("{} connectivity errors in room {}, switching to relay-only", errors, session.getRoomId());
            session.getDiagnostics().warn(SOURCE_HEALTH, "relay-only after " + description, null);
        }
        if (errors >= properties.getFallbackRelayErrorThreshold() && !state.isFallbackRelayActive()
                && properties.getFallbackRelay() != null) {
            state.setFallbackRelayActive(true);
            log.warn("{} connectivity errors in room {}, adding fallback relay", errors, session.getRoomId());
            session.getDiagnostics().warn(SOURCE_HEALTH, "fallback relay after " + description, null);
        }
    }

    /**
     * Arms the next full reconnect with backoff, or gives up once the attempts
     * are exhausted. Later attempts also reset the shared session.
     */
    void scheduleFullReconnect(String reason) {
        if (!session.isJoined() || reconnectTimer.isArmed()) {
            return;
        }
        if (backoff.isExhausted()) {
            giveUp();
            return;
        }
        int attempt = backoff.getAttempt() + 1;
        long delay = backoff.nextDelay();
        boolean resetDocument = attempt >= properties.getResetDocumentAfterAttempts();
        disconnectedTimer.cancel();
        session.setStatus(CallStatus.RECONNECTING,
                "Reconnecting… (attempt " + attempt + "/" + backoff.getMaxAttempts() + ")");
        log.warn("Full reconnect {} of room {} in {} ms ({})", attempt, session.getRoomId(), delay, reason);
        session.getDiagnostics().warn(SOURCE_HEALTH, "full reconnect " + attempt + " scheduled: " + reason, null);
        reconnectTimer.arm(delay, () -> session.fullReconnect(resetDocument));
    }

    private void giveUp() {
        stop();
        log.error("Reconnect attempts exhausted in room {}", session.getRoomId());
        session.getDiagnostics().error(SOURCE_HEALTH, "reconnect attempts exhausted", null);
        session.setStatus(CallStatus.FAILED);
        session.updateQuality(ConnectionQuality.DISCONNECTED);
        session.reportError(new CallError(CallErrorCode.RECONNECT_EXHAUSTED,
                "Could not reconnect after " + backoff.getMaxAttempts() + " attempts", null));
        session.terminated();
    }

    /**
     * User-initiated reconnect: previous attempts no longer count.
     */
    void manualReconnect() {
        log.info("Manual reconnect requested in room {}", session.getRoomId());
        backoff.reset();
        stop();
        session.fullReconnect(false);
    }

    private void runHealthCheck() {
        MediaTransport transport = session.getTransport();
        long generation = session.getTransportGeneration();
        if (transport == null || !session.isJoined()) {
            return;
        }
        transport.getStats().whenCompleteAsync((stats, err) -> {
            if (!session.isJoined() || !session.isCurrent(generation)) {
                return;
            }
            if (err != null) {
                log.debug("Reading transport stats in room {} failed: {}", session.getRoomId(),
                        CallSession.unwrap(err).getMessage());
            } else {
                session.updateQuality(classify(stats));
                if (stats.hasActiveSucceededPair()) {
                    missedChecks = 0;
                } else if (++missedChecks >= properties.getHealthCheckMissThreshold()) {
                    log.warn("No active candidate pair in room {} for {} checks", session.getRoomId(), missedChecks);
                    missedChecks = 0;
                    scheduleRestart(TRIGGER_HEALTH_CHECK);
                }
            }
            if (transport.getConnectionState() == PeerConnectionState.CONNECTED) {
                healthCheckTimer.arm(properties.getHealthCheckIntervalMs(), this::runHealthCheck);
            }
        }, session.getLoop());
    }

    static ConnectionQuality classify(TransportStats stats) {
        if (stats == null || !stats.hasActiveSucceededPair()) {
            return ConnectionQuality.DISCONNECTED;
        }
        double loss = stats.getPacketLoss();
        Double rtt = stats.activeRoundTripTime();
        Double jitter = stats.getJitterSeconds();
        double rttMs = rtt == null ? 0 : rtt * 1000;
        double jitterMs = jitter == null ? 0 : jitter * 1000;
        if (loss > 0.10 || rttMs > 300 || jitterMs > 50) {
            return ConnectionQuality.POOR;
        }
        if (loss > 0.03 || rttMs > 150 || jitterMs > 20) {
            return ConnectionQuality.GOOD;
        }
        return ConnectionQuality.EXCELLENT;
    }

    public ReconnectBackoff getBackoff() {
        return backoff;
    }

    int getMissedChecks() {
        return missedChecks;
    }
}
