package com.odin.call_signaling_service.call;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.call_signaling_service.dto.ParticipantPresence;
import com.odin.call_signaling_service.enums.CallErrorCode;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.ParticipantStatus;
import com.odin.call_signaling_service.transport.FakeLocalMediaSource.FakeTrack;
import com.odin.call_signaling_service.transport.MediaKind;

class PresenceRegistryTest {

    private CallTestRig rig;

    @BeforeEach
    void setUp() {
        rig = new CallTestRig();
    }

    @Test
    void joiningPublishesAnActiveRecord() {
        rig.join("alice");

        ParticipantPresence record = rig.presence("alice");
        assertThat(record.getStatus()).isEqualTo(ParticipantStatus.ACTIVE);
        assertThat(record.getDisplayName()).isEqualTo("Alice");
        assertThat(record.getStreamId()).isEqualTo("stream-alice");
        assertThat(record.isHasAudio()).isTrue();
        assertThat(record.isHasVideo()).isFalse();
        assertThat(record.getJoinedAt()).isNotNull();
    }

    @Test
    void rosterIsInJoinOrder() {
        CallSession alice = rig.join("alice");
        rig.join("bob");

        assertThat(alice.getRoster()).extracting(ParticipantPresence::getUid).containsExactly("alice", "bob");
        assertThat(rig.listener("alice").lastRoster).extracting(ParticipantPresence::getUid)
                .containsExactly("alice", "bob");
    }

    @Test
    void staleRecordsAreLeftOutOfTheRoster() {
        rig.seedParticipant("bob", rig.properties.getStaleThresholdMs() * 2);

        CallSession alice = rig.join("alice");

        assertThat(alice.getPresence().roster()).extracting(ParticipantPresence::getUid).containsExactly("alice");
        assertThat(alice.getPresence().isPresent("bob")).isFalse();
        assertThat(alice.getState().isOfferer()).isTrue();
    }

    @Test
    void vanishedParticipantsAreMarkedLeftBySweep() {
        CallSession alice = rig.join("alice");
        rig.seedParticipant("bob", 0);
        rig.seedParticipant("carol", 0);

        long threshold = rig.properties.getStaleThresholdMs();
        long interval = rig.properties.getStaleCleanupIntervalMs();
        for (long elapsed = 0; elapsed < threshold; elapsed += interval) {
            alice.heartbeat();
            rig.loop.advance(interval);
        }
        assertThat(rig.presence("bob").getStatus()).isEqualTo(ParticipantStatus.ACTIVE);
        assertThat(rig.presence("carol").getStatus()).isEqualTo(ParticipantStatus.ACTIVE);

        alice.heartbeat();
        rig.loop.advance(interval);

        assertThat(rig.presence("bob").getStatus()).isEqualTo(ParticipantStatus.LEFT);
        assertThat(rig.presence("carol").getStatus()).isEqualTo(ParticipantStatus.LEFT);
        assertThat(rig.presence("alice").getStatus()).isEqualTo(ParticipantStatus.ACTIVE);
        assertThat(alice.getRoster()).extracting(ParticipantPresence::getUid).containsExactly("alice");
    }

    @Test
    void sweepStopsWhenLeaving() {
        CallSession alice = rig.join("alice");
        rig.seedParticipant("bob", rig.properties.getStaleThresholdMs() * 2);

        alice.leave();
        rig.loop.advance(rig.properties.getStaleCleanupIntervalMs() * 2);

        assertThat(rig.repository.participantUpdates("status")).isEmpty();
    }

    @Test
    void speakingTogglesAreWrittenOncePerWindow() {
        CallSession alice = rig.join("alice");
        long window = rig.properties.getSpeakingThrottleMs();

        alice.setSpeaking(true);
        rig.loop.runUntilIdle();
        for (int i = 0; i < 5; i++) {
            alice.setSpeaking(i % 2 == 0 ? false : true);
            rig.loop.advance(window / 10);
        }
        assertThat(rig.repository.participantUpdates("speaking")).hasSize(1);
        assertThat(rig.presence("alice").isSpeaking()).isTrue();

        rig.loop.advance(window);

        assertThat(rig.repository.participantUpdates("speaking"))
                .extracting(update -> update.get("speaking"))
                .containsExactly(true, false);
        assertThat(rig.presence("alice").isSpeaking()).isFalse();
    }

    @Test
    void speakingAfterAQuietWindowIsWrittenAtOnce() {
        CallSession alice = rig.join("alice");

        alice.setSpeaking(true);
        rig.loop.advance(rig.properties.getSpeakingThrottleMs() * 2);
        alice.setSpeaking(false);
        rig.loop.runUntilIdle();

        assertThat(rig.repository.participantUpdates("speaking"))
                .extracting(update -> update.get("speaking"))
                .containsExactly(true, false);
    }

    @Test
    void heartbeatRefreshesTheRecord() {
        CallSession alice = rig.join("alice");
        rig.loop.advance(5000);

        alice.heartbeat();
        rig.loop.runUntilIdle();

        assertThat(rig.presence("alice").getLastHeartbeat()).isEqualTo(rig.loop.now());
    }

    @Test
    void mediaFlagChangesAreWrittenTogetherAfterTheDebounce() {
        CallSession alice = rig.join("alice");

        alice.setMuted(true);
        alice.setCameraEnabled(true);
        rig.loop.runUntilIdle();
        assertThat(rig.presence("alice").isMuted()).isFalse();

        rig.loop.advance(rig.properties.getMediaFlagsDebounceMs());

        ParticipantPresence record = rig.presence("alice");
        assertThat(record.isMuted()).isTrue();
        assertThat(record.isHasVideo()).isTrue();
    }

    @Test
    void deafeningMutesAndUndeafeningKeepsTheMute() {
        CallSession alice = rig.join("alice");
        FakeTrack microphone = rig.media("alice").getAcquired().get(0);

        alice.setDeafened(true);
        rig.settle();
        assertThat(rig.presence("alice").isDeafened()).isTrue();
        assertThat(rig.presence("alice").isMuted()).isTrue();
        assertThat(microphone.isEnabled()).isFalse();

        alice.setDeafened(false);
        rig.settle();
        assertThat(rig.presence("alice").isDeafened()).isFalse();
        assertThat(rig.presence("alice").isMuted()).isTrue();

        alice.setMuted(false);
        rig.settle();
        assertThat(rig.presence("alice").isMuted()).isFalse();
        assertThat(microphone.isEnabled()).isTrue();
    }

    @Test
    void kickedParticipantLeavesTheCall() {
        CallSession alice = rig.join("alice");
        CallSession bob = rig.join("bob");
        rig.connect("alice", "bob");

        alice.kick("bob");
        rig.settle();

        assertThat(bob.isJoined()).isFalse();
        assertThat(bob.getStatus()).isEqualTo(CallStatus.LEFT);
        assertThat(rig.listener("bob").hasError(CallErrorCode.REMOVED_FROM_CALL)).isTrue();
        assertThat(rig.terminated).containsExactly("bob");
        assertThat(rig.presence("bob")).isNull();
        assertThat(alice.getRoster()).extracting(ParticipantPresence::getUid).containsExactly("alice");
    }

    @Test
    void deniedCameraRollsBackTheIntent() {
        CallSession alice = rig.join("alice");
        rig.media("alice").deny(MediaKind.VIDEO);

        alice.setCameraEnabled(true);
        rig.settle();

        assertThat(alice.getIntent().isCameraOn()).isFalse();
        assertThat(alice.hasLocalTrack(MediaKind.VIDEO)).isFalse();
        assertThat(rig.listener("alice").hasError(CallErrorCode.MEDIA_ACQUISITION_FAILED)).isTrue();
        assertThat(rig.presence("alice").isHasVideo()).isFalse();
        assertThat(rig.document().offerRevision()).isEqualTo(1);
    }

    @Test
    void microphoneGrantedLaterIsPickedUpOnUnmute() {
        rig.media("alice").deny(MediaKind.AUDIO);
        CallSession alice = rig.join("alice");

        assertThat(alice.getIntent().isMuted()).isTrue();
        assertThat(alice.hasLocalTrack(MediaKind.AUDIO)).isFalse();
        assertThat(rig.listener("alice").hasError(CallErrorCode.MEDIA_ACQUISITION_FAILED)).isTrue();
        assertThat(rig.document().offerRevision()).isEqualTo(1);

        rig.media("alice").allow(MediaKind.AUDIO);
        alice.setMuted(false);
        rig.settle();

        assertThat(alice.hasLocalTrack(MediaKind.AUDIO)).isTrue();
        assertThat(rig.presence("alice").isHasAudio()).isTrue();
        assertThat(rig.document().offerRevision()).isEqualTo(2);
    }

    @Test
    void remoteTracksAreAttributedThroughTheirStream() {
        rig.join("alice");
        rig.join("bob");

        rig.transport("bob").emitRemoteTrack("stream-alice", "track-1", MediaKind.AUDIO);
        rig.transport("bob").emitRemoteTrack("stream-unknown", "track-2", MediaKind.VIDEO);
        rig.loop.runUntilIdle();

        assertThat(rig.listener("bob").remoteTrackOwners).containsExactly("alice", null);
    }
}
