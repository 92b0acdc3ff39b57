package com.odin.call_signaling_service.call;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.call_signaling_service.enums.CallErrorCode;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.ConnectionQuality;
import com.odin.call_signaling_service.transport.CandidatePairStats;
import com.odin.call_signaling_service.transport.FakeMediaTransport;
import com.odin.call_signaling_service.transport.IceTransportPolicy;
import com.odin.call_signaling_service.transport.TransportConfiguration;
import com.odin.call_signaling_service.transport.TransportStats;

class ConnectionHealthMonitorTest {

    private static final String STUN = "stun:stun.l.google.com:19302";

    private CallTestRig rig;
    private CallSession bob;

    @BeforeEach
    void setUp() {
        rig = new CallTestRig();
        rig.join("alice");
        bob = rig.join("bob");
        rig.connect("alice", "bob");
    }

    @Test
    void briefDisconnectIsHealedByAnIceRestart() {
        rig.loop.advance(rig.properties.getRestartCooldownAfterConnectMs() + 1000);
        FakeMediaTransport transport = rig.transport("bob");

        transport.disconnect();
        rig.loop.runUntilIdle();
        assertThat(bob.getStatus()).isEqualTo(CallStatus.RECONNECTING);

        rig.loop.advance(1500);
        transport.connect();
        rig.loop.runUntilIdle();
        rig.loop.advance(rig.properties.getDisconnectedReconnectTimeoutMs());

        assertThat(transport.getRestartCount()).isEqualTo(1);
        assertThat(rig.factory("bob").created()).hasSize(1);
        assertThat(bob.getHealthMonitor().getBackoff().getAttempt()).isZero();
        assertThat(bob.getStatus()).isEqualTo(CallStatus.CONNECTED);
    }

    @Test
    void disconnectRightAfterConnectingDoesNotRestart() {
        FakeMediaTransport transport = rig.transport("bob");
        rig.loop.advance(1000);

        transport.disconnect();
        rig.loop.advance(2000);
        transport.connect();
        rig.loop.runUntilIdle();

        assertThat(transport.getRestartCount()).isZero();
        assertThat(rig.factory("bob").created()).hasSize(1);
    }

    @Test
    void transportStuckDisconnectedIsRebuilt() {
        rig.loop.advance(rig.properties.getRestartCooldownAfterConnectMs() + 1000);
        FakeMediaTransport first = rig.transport("bob");

        first.disconnect();
        rig.loop.advance(rig.properties.getDisconnectedReconnectTimeoutMs()
                + rig.properties.getReconnectBaseDelayMs() + 500);

        assertThat(rig.factory("bob").created()).hasSize(2);
        assertThat(first.isClosed()).isTrue();
        assertThat(bob.getHealthMonitor().getBackoff().getAttempt()).isEqualTo(1);
    }

    @Test
    void repeatedFailuresEscalateToRelayOnlyAndThenToTheFallbackRelay() {
        failAndReconnect();
        TransportConfiguration afterOne = rig.transport("bob").getConfiguration();
        assertThat(afterOne.getIceTransportPolicy()).isEqualTo(IceTransportPolicy.ALL);

        failAndReconnect();
        TransportConfiguration afterTwo = rig.transport("bob").getConfiguration();
        assertThat(afterTwo.getIceTransportPolicy()).isEqualTo(IceTransportPolicy.RELAY);
        assertThat(afterTwo.isFallbackRelayActive()).isFalse();

        failAndReconnect();
        TransportConfiguration afterThree = rig.transport("bob").getConfiguration();
        assertThat(afterThree.getIceTransportPolicy()).isEqualTo(IceTransportPolicy.RELAY);
        assertThat(afterThree.isFallbackRelayActive()).isTrue();
        assertThat(afterThree.getIceServers()).contains(rig.properties.getFallbackRelay());
        assertThat(rig.listener("bob").statusTexts).contains("Reconnecting… (attempt 1/5)");
    }

    private void failAndReconnect() {
        FakeMediaTransport before = rig.transport("bob");
        before.fail();
        rig.loop.advance(4000);
        assertThat(rig.transport("bob")).isNotSameAs(before);
    }

    @Test
    void candidateErrorsCountTowardsRelayEscalation() {
        FakeMediaTransport transport = rig.transport("bob");

        transport.emitCandidateError(STUN, 701);
        transport.emitCandidateError("stun:stun1.l.google.com:19302", 701);
        rig.loop.runUntilIdle();

        assertThat(bob.getState().isRelayOnly()).isTrue();
        assertThat(bob.getState().isFallbackRelayActive()).isFalse();
    }

    @Test
    void errorsOutsideTheFailureWindowAreForgotten() {
        rig.properties.setFailureWindowMs(1000);
        FakeMediaTransport transport = rig.transport("bob");

        transport.emitCandidateError(STUN, 701);
        rig.loop.runUntilIdle();
        rig.loop.advance(2000);
        transport.emitCandidateError(STUN, 701);
        rig.loop.runUntilIdle();

        assertThat(bob.getState().isRelayOnly()).isFalse();
    }

    @Test
    void reconnectingResetsTheBackoffOnceConnected() {
        rig.transport("bob").fail();
        rig.loop.advance(2000);
        assertThat(rig.factory("bob").created()).hasSize(2);
        assertThat(bob.getHealthMonitor().getBackoff().getAttempt()).isEqualTo(1);

        rig.transport("bob").connect();
        rig.loop.runUntilIdle();

        assertThat(bob.getHealthMonitor().getBackoff().getAttempt()).isZero();
        assertThat(bob.getStatus()).isEqualTo(CallStatus.CONNECTED);
    }

    @Test
    void reconnectAttemptsAreBoundedAndThenReported() {
        CallTestRig solo = new CallTestRig();
        CallSession carol = solo.join("carol");
        int maxAttempts = solo.properties.getMaxReconnectAttempts();

        for (int i = 0; i < maxAttempts; i++) {
            solo.transport("carol").fail();
            solo.loop.advance(solo.properties.getReconnectMaxDelayMs());
        }
        assertThat(solo.factory("carol").created()).hasSize(maxAttempts + 1);

        solo.transport("carol").fail();
        solo.loop.runUntilIdle();

        assertThat(carol.getStatus()).isEqualTo(CallStatus.FAILED);
        assertThat(carol.getQuality()).isEqualTo(ConnectionQuality.DISCONNECTED);
        assertThat(solo.listener("carol").hasError(CallErrorCode.RECONNECT_EXHAUSTED)).isTrue();
        assertThat(solo.terminated).containsExactly("carol");
        assertThat(solo.factory("carol").created()).hasSize(maxAttempts + 1);
    }

    @Test
    void manualReconnectStartsOverRightAway() {
        rig.transport("bob").fail();
        rig.loop.runUntilIdle();
        assertThat(bob.getHealthMonitor().getBackoff().getAttempt()).isEqualTo(1);

        bob.reconnect();
        rig.loop.runUntilIdle();

        assertThat(rig.factory("bob").created()).hasSize(2);
        assertThat(bob.getHealthMonitor().getBackoff().getAttempt()).isZero();
    }

    @Test
    void healthyStatsAreReportedAsExcellent() {
        rig.loop.advance(rig.properties.getHealthCheckIntervalMs());

        assertThat(bob.getQuality()).isEqualTo(ConnectionQuality.EXCELLENT);
        assertThat(rig.listener("bob").qualities).contains(ConnectionQuality.EXCELLENT);
    }

    @Test
    void missingActivePairRestartsIceWithoutAStateChange() {
        FakeMediaTransport transport = rig.transport("bob");
        transport.setStats(TransportStats.builder().build());

        rig.loop.advance(rig.properties.getHealthCheckIntervalMs() * 2 + rig.properties.getRestartDebounceMs() + 100);

        assertThat(transport.getRestartCount()).isEqualTo(1);
        assertThat(bob.getQuality()).isEqualTo(ConnectionQuality.DISCONNECTED);
    }

    @Test
    void qualityFollowsLossRoundTripAndJitter() {
        assertThat(ConnectionHealthMonitor.classify(stats(0.0, 0.05, 0.005))).isEqualTo(ConnectionQuality.EXCELLENT);
        assertThat(ConnectionHealthMonitor.classify(stats(0.05, 0.05, 0.005))).isEqualTo(ConnectionQuality.GOOD);
        assertThat(ConnectionHealthMonitor.classify(stats(0.0, 0.2, 0.005))).isEqualTo(ConnectionQuality.GOOD);
        assertThat(ConnectionHealthMonitor.classify(stats(0.0, 0.05, 0.06))).isEqualTo(ConnectionQuality.POOR);
        assertThat(ConnectionHealthMonitor.classify(stats(0.2, 0.05, 0.005))).isEqualTo(ConnectionQuality.POOR);
        assertThat(ConnectionHealthMonitor.classify(TransportStats.builder().build()))
                .isEqualTo(ConnectionQuality.DISCONNECTED);
        assertThat(ConnectionHealthMonitor.classify(null)).isEqualTo(ConnectionQuality.DISCONNECTED);
    }

    private static TransportStats stats(double loss, double rttSeconds, double jitterSeconds) {
        return TransportStats.builder()
                .candidatePairs(List.of(CandidatePairStats.builder()
                        .id("pair-1")
                        .state("succeeded")
                        .nominated(true)
                        .currentRoundTripTime(rttSeconds)
                        .build()))
                .packetLoss(loss)
                .jitterSeconds(jitterSeconds)
                .build();
    }
}
