package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_ANSWER_FAILED;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_ANSWER_RETRIES_EXHAUSTED;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_ICE_RECOVERY;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_MISSING_OFFER;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_OFFERER_LEFT;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_PEER_LEFT;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_REMOTE_REQUEST;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_SESSION_RESET;
import static com.odin.call_signaling_service.constants.ApplicationConstants.SOURCE_SCHEDULER;

import java.util.LinkedHashSet;
import java.util.Set;

import com.odin.call_signaling_service.dto.RenegotiationRequest;
import com.odin.call_signaling_service.transport.MediaTransport;
import com.odin.call_signaling_service.transport.SignalingState;

import lombok.extern.slf4j.Slf4j;

/**
 * Coalesces renegotiation triggers into one debounced offer cycle.
 * <p>
 * The offerer renegotiates itself. A non-offerer either promotes itself
 * (when the trigger needs this endpoint's offer and signaling is idle) or asks
 * the current offerer through a request on its own presence record.
 */
@Slf4j
public class RenegotiationScheduler {

    /**
     * Reasons that only exist to get some endpoint into the offerer role; an
     * answered remote offer satisfies them.
     */
    static final Set<String> ROLE_REASONS = Set.of(REASON_SESSION_RESET, REASON_OFFERER_LEFT, REASON_MISSING_OFFER,
            REASON_ANSWER_FAILED, REASON_ANSWER_RETRIES_EXHAUSTED);

    private final CallSession session;
    private final SessionTimer debounce;

    RenegotiationScheduler(CallSession session) {
        this.session = session;
        this.debounce = session.newTimer("renegotiation-debounce");
    }

    public void request(String reason, boolean requireOfferer) {
        if (!session.isJoined()) {
            return;
        }
        NegotiationState state = session.getState();
        state.getPendingReasons().add(reason);
        if (requireOfferer) {
            state.setPendingRequireOfferer(true);
        }
        log.debug("Renegotiation requested in room {}: {} (pending {})", session.getRoomId(), reason,
                state.getPendingReasons());
        debounce.arm(session.getProperties().getRenegotiationDebounceMs(), this::fire);
    }

    void fire() {
        if (!session.isJoined()) {
            return;
        }
        NegotiationState state = session.getState();
        if (state.getPendingReasons().isEmpty() && !state.isNeedsPromotion()) {
            return;
        }
        MediaTransport transport = session.getTransport();
        if (transport == null) {
            return;
        }
        if (state.isNegotiationInFlight()) {
            log.debug("Negotiation in flight in room {}, deferring {}", session.getRoomId(), state.getPendingReasons());
            state.setAwaitingStable(true);
            return;
        }
        SignalingState signaling = transport.getSignalingState();
        if (state.isOfferer()) {
            // an offer nobody is left to answer may be replaced right away
            boolean unanswered = signaling == SignalingState.HAVE_LOCAL_OFFER
                    && session.getPresence().remoteParticipants().isEmpty();
            if (!signaling.isIdle() && !unanswered) {
                state.setAwaitingStable(true);
                return;
            }
            runOffer();
            return;
        }
        if (state.isPendingRequireOfferer() || state.isNeedsPromotion()) {
            if (signaling.isIdle()) {
                runOffer();
            } else {
                state.setNeedsPromotion(true);
                state.setAwaitingStable(true);
            }
            return;
        }
        delegate(signaling);
    }

    private void delegate(SignalingState signaling) {
        NegotiationState state = session.getState();
        String offerer = state.getCurrentOfferAuthor();
        if (offerer == null || !session.getPresence().isPresent(offerer)) {
            log.info("No offerer present in room {}, promoting self", session.getRoomId());
            if (signaling.isIdle()) {
                runOffer();
            } else {
                state.setNeedsPromotion(true);
                state.setAwaitingStable(true);
            }
            return;
        }
        String reason = String.join(",", state.getPendingReasons());
        state.getPendingReasons().clear();
        state.setPendingRequireOfferer(false);
        log.info("Asking offerer {} in room {} to renegotiate ({})", offerer, session.getRoomId(), reason);
        session.getDiagnostics().info(SOURCE_SCHEDULER, "renegotiation delegated: " + reason);
        session.getPresence().writeRenegotiationRequest(reason, state.getLastAnswerRevision());
    }

    private void runOffer() {
        NegotiationState state = session.getState();
        Set<String> reasons = new LinkedHashSet<>(state.getPendingReasons());
        boolean requireOfferer = state.isPendingRequireOfferer() || state.isNeedsPromotion();
        state.getPendingReasons().clear();
        state.setPendingRequireOfferer(false);
        state.setNeedsPromotion(false);
        state.setAwaitingStable(false);
        debounce.cancel();

        boolean iceRestart = reasons.stream()
                .anyMatch(r -> r.contains(REASON_ICE_RECOVERY) || r.contains(REASON_PEER_LEFT));
        long generation = session.getTransportGeneration();
        session.getArbitrator().acquire();
        log.info("Renegotiating in room {} ({}, iceRestart={})", session.getRoomId(), String.join(",", reasons),
                iceRestart);
        session.getArbitrator().publishOffer(reasons, iceRestart).whenCompleteAsync((won, err) -> {
            if (session.isCurrent(generation)) {
                if (err != null) {
                    Throwable cause = CallSession.unwrap(err);
                    log.warn("Renegotiation in room {} failed: {}", session.getRoomId(), cause.getMessage());
                    session.getDiagnostics().error(SOURCE_SCHEDULER, "renegotiation failed", cause);
                } else if (!won) {
                    // the winning offer arrives as a document change; keep what it does not cover
                    state.getPendingReasons().addAll(reasons);
                    if (requireOfferer) {
                        state.setPendingRequireOfferer(true);
                    }
                }
            }
            session.getArbitrator().release(generation);
        }, session.getLoop());
    }

    public void onSignalingStable() {
        NegotiationState state = session.getState();
        if (state.isAwaitingStable()) {
            state.setAwaitingStable(false);
            fire();
        }
    }

    /**
     * Called whenever the negotiation latch is released.
     */
    public void onNegotiationSettled() {
        NegotiationState state = session.getState();
        if (state.isAwaitingStable()) {
            state.setAwaitingStable(false);
            fire();
        } else if ((!state.getPendingReasons().isEmpty() || state.isNeedsPromotion()) && !debounce.isArmed()) {
            fire();
        }
    }

    /**
     * A remote offer got our answer: whoever it was, the room has an offerer again.
     */
    public void onRemoteOfferAnswered() {
        NegotiationState state = session.getState();
        state.setNeedsPromotion(false);
        state.getPendingReasons().removeAll(ROLE_REASONS);
        if (state.getPendingReasons().isEmpty()) {
            state.setPendingRequireOfferer(false);
            state.setAwaitingStable(false);
        }
        if (state.getOutstandingRequestId() != null) {
            session.getPresence().clearRenegotiationRequest();
        }
    }

    public void onRemoteRequest(String requesterUid, RenegotiationRequest request) {
        NegotiationState state = session.getState();
        if (!state.isOfferer() || request.getId() == null) {
            return;
        }
        if (!state.getHandledRequestIds().add(request.getId())) {
            return;
        }
        log.info("Renegotiation requested by {} in room {}: {}", requesterUid, session.getRoomId(),
                request.getReason());
        request(REASON_REMOTE_REQUEST + ":" + request.getReason(), false);
    }

    public void stop() {
        debounce.cancel();
    }

    boolean isDebouncing() {
        return debounce.isArmed();
    }
}
