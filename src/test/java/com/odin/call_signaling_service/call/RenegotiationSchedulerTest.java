package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_CAMERA_ON;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_MUTE_TOGGLED;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_SCREEN_ON;
import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.odin.call_signaling_service.dto.DiagnosticEvent;
import com.odin.call_signaling_service.dto.RenegotiationRequest;
import com.odin.call_signaling_service.dto.SessionDocument;

class RenegotiationSchedulerTest {

    private CallTestRig rig;
    private CallSession alice;
    private CallSession bob;

    @BeforeEach
    void setUp() {
        rig = new CallTestRig();
        alice = rig.join("alice");
        bob = rig.join("bob");
        rig.connect("alice", "bob");
    }

    @Test
    void triggersWithinTheDebounceWindowShareOneOffer() {
        int offers = rig.transport("alice").getOfferCount();
        RenegotiationScheduler scheduler = alice.getScheduler();

        scheduler.request(REASON_CAMERA_ON, true);
        rig.loop.advance(100);
        scheduler.request(REASON_MUTE_TOGGLED, false);
        rig.loop.advance(100);
        scheduler.request(REASON_SCREEN_ON, true);
        rig.settle();

        assertThat(rig.transport("alice").getOfferCount()).isEqualTo(offers + 1);
        SessionDocument document = rig.document();
        assertThat(document.offerRevision()).isEqualTo(2);
        assertThat(document.getAnswer().getRevision()).isEqualTo(2);
        assertThat(alice.getDiagnosticsSnapshot())
                .extracting(DiagnosticEvent::getMessage)
                .anyMatch(m -> m.contains(REASON_CAMERA_ON) && m.contains(REASON_MUTE_TOGGLED)
                        && m.contains(REASON_SCREEN_ON));
    }

    @Test
    void renegotiationWaitsForTheOneInFlight() {
        RoleArbitrator arbitrator = alice.getArbitrator();
        arbitrator.acquire();

        alice.getScheduler().request(REASON_CAMERA_ON, true);
        rig.settle();

        assertThat(rig.document().offerRevision()).isEqualTo(1);
        assertThat(alice.getState().isAwaitingStable()).isTrue();

        arbitrator.release(alice.getTransportGeneration());
        rig.settle();

        assertThat(rig.document().offerRevision()).isEqualTo(2);
        assertThat(alice.getState().isAwaitingStable()).isFalse();
    }

    @Test
    void answererTurningOnItsCameraBecomesTheOfferer() {
        bob.setCameraEnabled(true);
        rig.settle();

        SessionDocument document = rig.document();
        assertThat(document.offerAuthor()).isEqualTo("bob");
        assertThat(document.offerRevision()).isEqualTo(2);
        assertThat(document.getAnswer().getUpdatedBy()).isEqualTo("alice");
        assertThat(document.getAnswer().getRevision()).isEqualTo(2);
        assertThat(bob.getState().isOfferer()).isTrue();
        assertThat(alice.getState().isOfferer()).isFalse();
    }

    @Test
    void answererAsksThePresentOffererForOtherChanges() {
        bob.getScheduler().request(REASON_MUTE_TOGGLED, false);
        rig.loop.advance(rig.properties.getRenegotiationDebounceMs());

        RenegotiationRequest request = rig.presence("bob").getRenegotiationRequest();
        assertThat(request).isNotNull();
        assertThat(request.getReason()).isEqualTo(REASON_MUTE_TOGGLED);
        assertThat(request.getRequestedBy()).isEqualTo("bob");

        rig.settle();

        SessionDocument document = rig.document();
        assertThat(document.offerAuthor()).isEqualTo("alice");
        assertThat(document.offerRevision()).isEqualTo(2);
        assertThat(document.getAnswer().getUpdatedBy()).isEqualTo("bob");
        assertThat(rig.presence("bob").getRenegotiationRequest()).isNull();
        assertThat(bob.getState().isOfferer()).isFalse();
        assertThat(bob.getState().getOutstandingRequestId()).isNull();
    }

    @Test
    void answererPromotesItselfWhenTheOffererIsGone() {
        bob.getState().setCurrentOfferAuthor("zed");

        bob.getScheduler().request(REASON_MUTE_TOGGLED, false);
        rig.settle();

        assertThat(rig.document().offerAuthor()).isEqualTo("bob");
        assertThat(bob.getState().isOfferer()).isTrue();
        assertThat(rig.presence("bob").getRenegotiationRequest()).isNull();
    }

    @Test
    void offererLeavingPromotesTheRemainingEndpoint() {
        alice.leave();
        rig.settle();

        SessionDocument document = rig.document();
        assertThat(document.offerAuthor()).isEqualTo("bob");
        assertThat(document.offerRevision()).isEqualTo(2);
        assertThat(document.getAnswer()).isNull();
        assertThat(bob.getState().isOfferer()).isTrue();
    }

    @Test
    void remoteRequestIsHonouredOncePerId() {
        RenegotiationRequest request = RenegotiationRequest.builder()
                .id("req-1")
                .reason(REASON_SCREEN_ON)
                .requestedBy("bob")
                .build();

        alice.getScheduler().onRemoteRequest("bob", request);
        alice.getScheduler().onRemoteRequest("bob", request);
        rig.settle();
        assertThat(rig.document().offerRevision()).isEqualTo(2);

        alice.getScheduler().onRemoteRequest("bob", request);
        rig.settle();
        assertThat(rig.document().offerRevision()).isEqualTo(2);
    }

    @Test
    void nonOffererIgnoresRemoteRequests() {
        RenegotiationRequest request = RenegotiationRequest.builder()
                .id("req-2")
                .reason(REASON_SCREEN_ON)
                .requestedBy("alice")
                .build();

        bob.getScheduler().onRemoteRequest("alice", request);

        assertThat(bob.getScheduler().isDebouncing()).isFalse();
        assertThat(bob.getState().getHandledRequestIds()).isEmpty();
    }
}
