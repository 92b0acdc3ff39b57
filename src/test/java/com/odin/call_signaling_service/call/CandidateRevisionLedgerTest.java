package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.call.CallTestRig.ROOM;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_CAMERA_ON;
import static com.odin.call_signaling_service.call.CallTestRig.candidate;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.enums.CandidateRole;

class CandidateRevisionLedgerTest {

    private CallTestRig rig;
    private CallSession alice;
    private CandidateRevisionLedger ledger;

    @BeforeEach
    void setUp() {
        rig = new CallTestRig();
        alice = rig.join("alice");
        ledger = alice.getLedger();
    }

    private void append(long revision, CandidateRole role, IceCandidatePayload candidate) {
        rig.repository.appendCandidate(ROOM, revision, role, candidate).join();
        rig.loop.runUntilIdle();
    }

    @Test
    void onlyThePeerSequenceOfTheActiveRevisionIsWatched() {
        append(1, CandidateRole.ANSWERER, candidate(1, 1, "bob"));
        append(1, CandidateRole.OFFERER, candidate(2, 1, "mallory"));

        assertThat(alice.getState().getPendingRemoteCandidates())
                .extracting(IceCandidatePayload::getFrom)
                .containsExactly("bob");
    }

    @Test
    void activatingANewRevisionStopsWatchingTheOldOne() {
        rig.join("bob");
        rig.connect("alice", "bob");

        alice.getScheduler().request(REASON_CAMERA_ON, true);
        rig.settle();
        assertThat(alice.getState().getActiveRevision()).isEqualTo(2);
        assertThat(alice.getState().getPendingRemoteCandidates()).isEmpty();

        append(1, CandidateRole.ANSWERER, candidate(3, 1, "bob"));
        append(2, CandidateRole.ANSWERER, candidate(4, 2, "bob"));
        rig.settle();

        assertThat(rig.transport("alice").getAppliedCandidates())
                .extracting(IceCandidatePayload::getCandidate)
                .contains(candidate(4, 2, "bob").getCandidate())
                .doesNotContain(candidate(3, 1, "bob").getCandidate());
    }

    @Test
    void reactivatingTheCurrentRevisionKeepsQueuedCandidates() {
        append(1, CandidateRole.ANSWERER, candidate(1, 1, "bob"));

        ledger.activate(1, CandidateRole.OFFERER, alice.getState().getDocumentEpoch());

        assertThat(alice.getState().getPendingRemoteCandidates()).hasSize(1);
    }

    @Test
    void newEpochAtTheSameRevisionIsAFreshGeneration() {
        append(1, CandidateRole.ANSWERER, candidate(1, 1, "bob"));

        ledger.activate(1, CandidateRole.OFFERER, "bob:42");
        rig.loop.runUntilIdle();

        assertThat(alice.getState().getDocumentEpoch()).isEqualTo("bob:42");
        assertThat(alice.getState().getPendingRemoteCandidates())
                .extracting(IceCandidatePayload::getFrom)
                .containsExactly("bob");
    }

    @Test
    void onlyTheActiveRevisionCounts() {
        assertThat(ledger.isActive(1)).isTrue();
        assertThat(ledger.isActive(2)).isFalse();
        assertThat(ledger.isActive(0)).isFalse();
        assertThat(ledger.localRole()).isEqualTo(CandidateRole.OFFERER);
    }

    @Test
    void taggingStampsRevisionAuthorAndTime() {
        IceCandidatePayload raw = IceCandidatePayload.of("candidate:1 1 udp 1 203.0.113.1 5000 typ host", "0", 0);

        IceCandidatePayload tagged = ledger.tag(raw, 7);

        assertThat(tagged.getRevision()).isEqualTo(7);
        assertThat(tagged.getFrom()).isEqualTo("alice");
        assertThat(tagged.getCreatedAt()).isEqualTo(rig.loop.now());
        assertThat(tagged.getCandidate()).isEqualTo(raw.getCandidate());
        assertThat(raw.getFrom()).isNull();
    }
}
