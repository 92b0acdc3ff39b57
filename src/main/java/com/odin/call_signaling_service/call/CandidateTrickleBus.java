package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.constants.ApplicationConstants.SOURCE_TRICKLE;

import java.util.Deque;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.transport.MediaTransport;
import com.odin.call_signaling_service.transport.SignalingState;

import lombok.extern.slf4j.Slf4j;

/**
 * Moves connectivity candidates between the transport and the store.
 * <p>
 * Local candidates are stamped with the active revision and appended to this
 * endpoint's sequence; while an offer is being created they are held until
 * the offer commits. Remote candidates are deduplicated, applied only against
 * the matching remote description and otherwise queued, then flushed in
 * arrival order.
 */
@Slf4j
public class CandidateTrickleBus {

    private final CallSession session;
    private final SessionTimer retryTimer;
    private long flushToken;
    private boolean flushing;

    CandidateTrickleBus(CallSession session) {
        this.session = session;
        this.retryTimer = session.newTimer("candidate-retry");
    }

    // local side

    public void onLocalCandidate(IceCandidatePayload candidate) {
        NegotiationState state = session.getState();
        if (state.getPendingOfferRevision() > 0) {
            state.getProvisionalLocalCandidates().addLast(candidate);
            return;
        }
        long revision = state.getActiveRevision();
        if (revision == 0) {
            log.debug("Dropping local candidate in room {}: no active revision", session.getRoomId());
            return;
        }
        publish(candidate, revision);
    }

    /**
     * Publishes the candidates gathered while the offer for {@code revision} was in flight.
     */
    public void commitProvisional(long revision) {
        Deque<IceCandidatePayload> provisional = session.getState().getProvisionalLocalCandidates();
        while (!provisional.isEmpty()) {
            publish(provisional.pollFirst(), revision);
        }
    }

    public void discardProvisional() {
        Deque<IceCandidatePayload> provisional = session.getState().getProvisionalLocalCandidates();
        if (!provisional.isEmpty()) {
            log.debug("Discarding {} candidates of an uncommitted offer in room {}", provisional.size(),
                    session.getRoomId());
            provisional.clear();
        }
    }

    private void publish(IceCandidatePayload candidate, long revision) {
        CandidateRevisionLedger ledger = session.getLedger();
        ledger.append(revision, ledger.localRole(), ledger.tag(candidate, revision))
                .whenCompleteAsync((v, err) -> {
                    if (err != null) {
                        Throwable cause = CallSession.unwrap(err);
                        log.warn("Publishing local candidate r{} in room {} failed: {}", revision,
                                session.getRoomId(), cause.getMessage());
                        session.getDiagnostics().warn(SOURCE_TRICKLE, "local candidate not published", cause);
                    }
                }, session.getLoop());
    }

    // remote side

    public void onRemoteCandidate(IceCandidatePayload candidate) {
        if (!session.isJoined() || session.getUid().equals(candidate.getFrom())) {
            return;
        }
        NegotiationState state = session.getState();
        if (candidate.getRevision() != state.getActiveRevision()) {
            log.debug("Dropping stale candidate r{} (active r{}) in room {}", candidate.getRevision(),
                    state.getActiveRevision(), session.getRoomId());
            return;
        }
        String key = candidate.dedupKey();
        if (state.getAppliedCandidateKeys().contains(key) || state.getQueuedCandidateKeys().contains(key)) {
            log.debug("Skipping duplicate candidate {} in room {}", key, session.getRoomId());
            return;
        }
        if (!flushing && state.getPendingRemoteCandidates().isEmpty() && canApply()) {
            apply(candidate);
            return;
        }
        state.getPendingRemoteCandidates().addLast(candidate);
        state.getQueuedCandidateKeys().add(key);
        if (!flushing && canApply()) {
            flush();
        }
    }

    /**
     * Whether the transport currently accepts candidates of the active revision.
     */
    boolean canApply() {
        MediaTransport transport = session.getTransport();
        NegotiationState state = session.getState();
        return transport != null
                && transport.getSignalingState() != SignalingState.CLOSED
                && transport.hasRemoteDescription()
                && state.getActiveRevision() > 0
                && state.getRemoteDescriptionRevision() == state.getActiveRevision();
    }

    /**
     * Drains the queue in arrival order, one candidate per spacing interval.
     * A newer flush or a reset supersedes a running one.
     */
    public void flush() {
        if (session.getState().getPendingRemoteCandidates().isEmpty()) {
            return;
        }
        long token = ++flushToken;
        flushing = true;
        drainNext(token);
    }

    private void drainNext(long token) {
        if (token != flushToken) {
            return;
        }
        NegotiationState state = session.getState();
        if (!canApply()) {
            flushing = false;
            return;
        }
        IceCandidatePayload next = state.getPendingRemoteCandidates().pollFirst();
        if (next == null) {
            flushing = false;
            return;
        }
        state.getQueuedCandidateKeys().remove(next.dedupKey());
        if (next.getRevision() == state.getActiveRevision()) {
            apply(next);
        }
        if (state.getPendingRemoteCandidates().isEmpty()) {
            flushing = false;
            return;
        }
        session.getLoop().schedule(() -> drainNext(token), session.getProperties().getCandidateFlushSpacingMs());
    }

    private void apply(IceCandidatePayload candidate) {
        NegotiationState state = session.getState();
        MediaTransport transport = session.getTransport();
        long generation = session.getTransportGeneration();
        String key = candidate.dedupKey();
        state.getAppliedCandidateKeys().add(key);
        transport.addIceCandidate(candidate).whenCompleteAsync((v, err) -> {
            if (err == null) {
                return;
            }
            state.getAppliedCandidateKeys().remove(key);
            if (!session.isCurrent(generation) || candidate.getRevision() != state.getActiveRevision()) {
                return;
            }
            Throwable cause = CallSession.unwrap(err);
            if (state.getRetriedCandidateKeys().add(key)) {
                log.warn("Candidate {} failed to apply in room {}, retrying once: {}", key, session.getRoomId(),
                        cause.getMessage());
                session.getDiagnostics().warn(SOURCE_TRICKLE, "candidate apply failed, requeued", cause);
                state.getPendingRemoteCandidates().addLast(candidate);
                state.getQueuedCandidateKeys().add(key);
                retryTimer.arm(session.getProperties().getCandidateRetryDelayMs(), this::flush);
            } else {
                log.warn("Dropping candidate {} in room {} after retry: {}", key, session.getRoomId(),
                        cause.getMessage());
                session.getDiagnostics().error(SOURCE_TRICKLE, "candidate dropped after retry", cause);
            }
        }, session.getLoop());
    }

    public void reset() {
        session.getState().clearCandidates();
        flushToken++;
        flushing = false;
        retryTimer.cancel();
    }

    boolean isFlushing() {
        return flushing;
    }
}
