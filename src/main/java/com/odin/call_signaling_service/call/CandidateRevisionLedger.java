package com.odin.call_signaling_service.call;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.enums.CandidateRole;
import com.odin.call_signaling_service.repo.Subscription;

import lombok.extern.slf4j.Slf4j;

/**
 * Scopes connectivity candidates by negotiation generation. Exactly one
 * revision is active at a time; only the peer's sequence under that revision
 * is watched, so candidates of a superseded exchange never reach the
 * transport.
 */
@Slf4j
public class CandidateRevisionLedger {

    private final CallSession session;
    private Subscription remoteSubscription = Subscription.NONE;
    private long watchedRevision;
    private CandidateRole watchedRole;
    private String watchedEpoch;

    CandidateRevisionLedger(CallSession session) {
        this.session = session;
    }

    /**
     * Makes {@code revision} of the given document epoch the active generation
     * and starts watching the peer's candidates under it. Re-activating the
     * current generation is a no-op.
     */
    public void activate(long revision, CandidateRole localRole, String epoch) {
        NegotiationState state = session.getState();
        CandidateRole remoteRole = localRole.opposite();
        if (revision == watchedRevision && remoteRole == watchedRole && Objects.equals(epoch, watchedEpoch)
                && state.getActiveRevision() == revision) {
            return;
        }
        state.setActiveRevision(revision);
        state.setRemoteDescriptionRevision(0);
        state.setDocumentEpoch(epoch);
        session.getTrickleBus().reset();

        remoteSubscription.close();
        watchedRevision = revision;
        watchedRole = remoteRole;
        watchedEpoch = epoch;
        CallEventLoop loop = session.getLoop();
        remoteSubscription = session.getRepository().subscribeCandidates(session.getRoomId(), revision, remoteRole,
                candidate -> loop.execute(() -> session.getTrickleBus().onRemoteCandidate(candidate)));
        log.debug("Active revision {} in room {}, watching {} candidates", revision, session.getRoomId(),
                remoteRole.key());
    }

    public boolean isActive(long revision) {
        return revision > 0 && revision == session.getState().getActiveRevision();
    }

    public CandidateRole localRole() {
        return session.getState().isOfferer() ? CandidateRole.OFFERER : CandidateRole.ANSWERER;
    }

    /**
     * Copy of the candidate stamped with the revision and this endpoint as author.
     */
    public IceCandidatePayload tag(IceCandidatePayload candidate, long revision) {
        return candidate.toBuilder()
                .revision(revision)
                .from(session.getUid())
                .createdAt(session.getLoop().now())
                .build();
    }

    public CompletableFuture<Void> append(long revision, CandidateRole role, IceCandidatePayload candidate) {
        return session.getRepository().appendCandidate(session.getRoomId(), revision, role, candidate);
    }

    public void close() {
        remoteSubscription.close();
        remoteSubscription = Subscription.NONE;
        watchedRevision = 0;
        watchedRole = null;
        watchedEpoch = null;
    }
}
