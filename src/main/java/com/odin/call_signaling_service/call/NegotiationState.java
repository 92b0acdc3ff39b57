package com.odin.call_signaling_service.call;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SessionDocument;

import lombok.Data;

/**
 * Private projection of the negotiation held by one endpoint. Only touched from
 * the session's event loop; never persisted.
 */
@Data
public class NegotiationState {

    private boolean offerer;
    private long lastOfferRevision;
    private long lastAnswerRevision;

    /** Revision of the exchange the transport currently belongs to; 0 before the first one. */
    private long activeRevision;
    /** Revision whose remote description is applied on the transport. */
    private long remoteDescriptionRevision;
    /** Revision of the offer being created and not yet committed; 0 when none. */
    private long pendingOfferRevision;
    private long appliedAnswerRevision;

    private String currentOfferAuthor;
    private String answeredPeerUid;
    /** createdBy/createdAt of the session document this state was built from. */
    private String documentEpoch;
    /** Answerer of the established pair while this endpoint waits on standby. */
    private String standbyBehind;
    private AnswerAttemptState answerState = AnswerAttemptState.IDLE;

    private final Set<String> pendingReasons = new LinkedHashSet<>();
    private boolean pendingRequireOfferer;
    private boolean awaitingStable;
    private boolean needsPromotion;
    private boolean restoreMediaAfterAnswer;
    private String outstandingRequestId;
    private final Set<String> handledRequestIds = new HashSet<>();

    private boolean negotiationInFlight;
    private Optional<SessionDocument> deferredDocument;

    private final Set<String> appliedCandidateKeys = new HashSet<>();
    private final Set<String> queuedCandidateKeys = new HashSet<>();
    private final Set<String> retriedCandidateKeys = new HashSet<>();
    private final Deque<IceCandidatePayload> pendingRemoteCandidates = new ArrayDeque<>();
    private final Deque<IceCandidatePayload> provisionalLocalCandidates = new ArrayDeque<>();

    private boolean sideChannelEnabled;
    private boolean relayOnly;
    private boolean fallbackRelayActive;

    public NegotiationState(boolean sideChannelEnabled) {
        this.sideChannelEnabled = sideChannelEnabled;
    }

    /**
     * Forgets everything tied to the current transport. Side-channel and relay
     * escalation decisions survive a reconnect.
     */
    public void reset() {
        offerer = false;
        lastOfferRevision = 0;
        lastAnswerRevision = 0;
        activeRevision = 0;
        remoteDescriptionRevision = 0;
        pendingOfferRevision = 0;
        appliedAnswerRevision = 0;
        currentOfferAuthor = null;
        answeredPeerUid = null;
        documentEpoch = null;
        standbyBehind = null;
        answerState = AnswerAttemptState.IDLE;
        pendingReasons.clear();
        pendingRequireOfferer = false;
        awaitingStable = false;
        needsPromotion = false;
        outstandingRequestId = null;
        negotiationInFlight = false;
        deferredDocument = null;
        clearCandidates();
        provisionalLocalCandidates.clear();
    }

    public void clearCandidates() {
        appliedCandidateKeys.clear();
        queuedCandidateKeys.clear();
        retriedCandidateKeys.clear();
        pendingRemoteCandidates.clear();
    }
}
