package com.odin.call_signaling_service.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.odin.call_signaling_service.transport.IceServerConfig;

import lombok.Data;

/**
 * Tuning of the call negotiation engine.
 *
 * All timings are in milliseconds. Values are externalized under
 * {@code call.engine.*} in application.properties.
 */
@Data
@Component
@ConfigurationProperties(prefix = "call.engine")
public class CallEngineProperties {

    /**
     * Window in which renegotiation triggers are coalesced into one cycle.
     *
     * Default: 250
     */
    private long renegotiationDebounceMs = 250;

    /**
     * Answer publications tried against a moving offer before the answerer
     * promotes itself to offerer.
     *
     * Default: 3
     */
    private int maxAnswerAttempts = 3;

    /**
     * Spacing between queued remote candidates when they are flushed after the
     * remote description is set.
     */
    private long candidateFlushSpacingMs = 20;

    /**
     * Delay before a candidate that failed to apply is tried once more.
     */
    private long candidateRetryDelayMs = 500;

    /**
     * Debounce before an ICE restart is issued for a disconnected transport.
     */
    private long restartDebounceMs = 1000;

    /**
     * Minimum spacing between two ICE restarts.
     */
    private long minRestartIntervalMs = 5000;

    /**
     * Disconnects within this window after a successful connection do not
     * trigger a restart. Transports flap right after connecting.
     */
    private long restartCooldownAfterConnectMs = 3000;

    /**
     * A transport still disconnected after this long gets a full reconnect.
     */
    private long disconnectedReconnectTimeoutMs = 10000;

    /**
     * Rolling window in which connectivity errors are counted for relay
     * escalation.
     */
    private long failureWindowMs = 60000;

    /**
     * Errors within the window after which the ICE policy becomes relay-only.
     */
    private int relayOnlyErrorThreshold = 2;

    /**
     * Errors within the window after which the fallback relay server is added.
     */
    private int fallbackRelayErrorThreshold = 3;

    /**
     * Full reconnect backoff: delay = base * min(1.5^attempt, maxMultiplier),
     * never above maxDelay.
     */
    private long reconnectBaseDelayMs = 1000;
    private double reconnectMaxMultiplier = 8.0;
    private long reconnectMaxDelayMs = 15000;

    /**
     * Full reconnects tried before the call is reported as failed.
     */
    private int maxReconnectAttempts = 5;

    /**
     * From this reconnect attempt on, the shared session document is deleted
     * and negotiation restarts from scratch.
     */
    private int resetDocumentAfterAttempts = 3;

    /**
     * Statistics poll while connected. Also drives quality classification.
     */
    private long healthCheckIntervalMs = 4000;

    /**
     * Consecutive polls without an active candidate pair before a restart.
     */
    private int healthCheckMissThreshold = 2;

    private long heartbeatIntervalMs = 10000;

    /**
     * Presence records whose heartbeat is older than this are ignored.
     */
    private long staleThresholdMs = 30000;

    /**
     * How often active records with a stale heartbeat are marked left.
     */
    private long staleCleanupIntervalMs = 15000;

    /**
     * Window in which local media flag changes are merged into one presence write.
     */
    private long mediaFlagsDebounceMs = 300;

    /**
     * Minimum spacing between two writes of the speaking flag.
     */
    private long speakingThrottleMs = 200;

    /**
     * Inline descriptions bigger than this mark the stored session as
     * oversized; it is purged before joining.
     */
    private int maxStoredDescriptionBytes = 400000;

    /**
     * Largest description still copied inline when it is also written to the
     * side channel.
     */
    private int inlineDescriptionMaxBytes = 32768;

    /**
     * Whether descriptions are also written to their own side-channel records.
     */
    private boolean sideChannelEnabled = true;

    private int iceCandidatePoolSize = 10;

    private List<IceServerConfig> iceServers = new ArrayList<>(List.of(
            IceServerConfig.of("stun:stun.l.google.com:19302", "stun:stun1.l.google.com:19302")));

    /**
     * TURN server appended once repeated connectivity errors escalate.
     */
    private IceServerConfig fallbackRelay = new IceServerConfig(
            new ArrayList<>(List.of("turn:openrelay.metered.ca:80", "turn:openrelay.metered.ca:443")),
            "openrelayproject", "openrelayproject");

    /**
     * Entries kept in each session's diagnostic log.
     */
    private int diagnosticCapacity = 200;

    /**
     * Delay before an ended session is dropped from the registry.
     */
    private long cleanupDelayMs = 5000;
}
