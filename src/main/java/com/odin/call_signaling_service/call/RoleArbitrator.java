package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_ANSWER_FAILED;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_ANSWER_RETRIES_EXHAUSTED;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_INITIAL;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_MISSING_OFFER;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_REJOIN;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_REJOIN_MEDIA;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_SESSION_RESET;
import static com.odin.call_signaling_service.constants.ApplicationConstants.SOURCE_ARBITRATOR;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import com.odin.call_signaling_service.dto.ParticipantPresence;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.dto.SessionDocument;
import com.odin.call_signaling_service.enums.CandidateRole;
import com.odin.call_signaling_service.enums.DescriptionKind;
import com.odin.call_signaling_service.exception.NegotiationException;
import com.odin.call_signaling_service.repo.SignalingRepository;
import com.odin.call_signaling_service.transport.MediaTransport;
import com.odin.call_signaling_service.transport.SignalingState;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides which endpoint offers and which answers, and reconciles the local
 * negotiation state with every session document change.
 * <p>
 * Offers are committed with a compare-and-set on the stored offer revision and
 * answers with a conditional write guarded by revision and offer author, so two
 * endpoints racing for either slot always converge. The negotiation latch in
 * {@link NegotiationState} keeps one exchange in flight at a time; documents
 * arriving meanwhile are deferred and the latest one is processed on release.
 */
@Slf4j
public class RoleArbitrator {

    private final CallSession session;

    RoleArbitrator(CallSession session) {
        this.session = session;
    }

    public boolean isNegotiating() {
        return session.getState().isNegotiationInFlight();
    }

    void acquire() {
        session.getState().setNegotiationInFlight(true);
    }

    /**
     * Frees the latch taken for the given transport generation, processes the
     * document deferred meanwhile and lets the scheduler run what queued up.
     */
    void release(long generation) {
        if (!session.isCurrent(generation)) {
            return;
        }
        NegotiationState state = session.getState();
        state.setNegotiationInFlight(false);
        Optional<SessionDocument> deferred = state.getDeferredDocument();
        if (deferred != null) {
            state.setDeferredDocument(null);
            onSessionDocument(deferred);
        }
        if (!state.isNegotiationInFlight()) {
            session.getScheduler().onNegotiationSettled();
        }
    }

    // join

    public void negotiateOnJoin() {
        long generation = session.getTransportGeneration();
        acquire();
        session.getRepository().readSession(session.getRoomId()).whenCompleteAsync((document, err) -> {
            if (!session.isJoined() || !session.isCurrent(generation)) {
                return;
            }
            if (err != null) {
                Throwable cause = CallSession.unwrap(err);
                log.warn("Reading session of room {} on join failed: {}", session.getRoomId(), cause.getMessage());
                session.getDiagnostics().warn(SOURCE_ARBITRATOR, "session read failed on join", cause);
                release(generation);
                session.getScheduler().request(REASON_SESSION_RESET, true);
                return;
            }
            decideRole(document.orElse(null), generation);
        }, session.getLoop());
    }

    private void decideRole(SessionDocument document, long generation) {
        String uid = session.getUid();
        if (document == null || !document.hasOffer()) {
            log.info("No offer in room {}, taking the offerer role", session.getRoomId());
            offerThenRelease(Set.of(REASON_INITIAL), generation);
            return;
        }
        String answerer = document.getAnswer() == null ? null : document.getAnswer().getUpdatedBy();
        if (uid.equals(document.offerAuthor())) {
            if (answerer == null) {
                resetThenOffer("own unanswered offer from an earlier join", generation);
            } else if (uid.equals(answerer)) {
                resetThenOffer("offer and answer both written by us", generation);
            } else {
                log.info("Room {} holds our earlier offer answered by {}, offering again", session.getRoomId(),
                        answerer);
                offerThenRelease(Set.of(REASON_REJOIN), generation);
            }
            return;
        }
        if (uid.equals(answerer)) {
            resetThenOffer("own answer from an earlier join", generation);
            return;
        }
        session.getRepository().listParticipants(session.getRoomId()).whenCompleteAsync((participants, err) -> {
            if (!session.isJoined() || !session.isCurrent(generation)) {
                return;
            }
            if (err != null) {
                log.warn("Listing participants of room {} failed, answering anyway: {}", session.getRoomId(),
                        CallSession.unwrap(err).getMessage());
                answerOffer(document, 0, generation);
                return;
            }
            if (!isPresent(participants, document.offerAuthor())) {
                resetThenOffer("offer author " + document.offerAuthor() + " is gone", generation);
            } else if (answerer == null) {
                answerOffer(document, 0, generation);
            } else if (isPresent(participants, answerer)) {
                enterStandby(document, answerer);
                release(generation);
            } else {
                log.info("Answerer {} of room {} is gone, taking over the offer", answerer, session.getRoomId());
                offerThenRelease(Set.of(REASON_SESSION_RESET), generation);
            }
        }, session.getLoop());
    }

    private boolean isPresent(List<ParticipantPresence> participants, String uid) {
        PresenceRegistry presence = session.getPresence();
        return participants.stream()
                .anyMatch(p -> p.getUid().equals(uid) && p.isActive() && presence.isFresh(p));
    }

    /**
     * Never negotiate against our own stale state: purge it and start over as offerer.
     */
    private void resetThenOffer(String cause, long generation) {
        log.warn("Resetting session of room {}: {}", session.getRoomId(), cause);
        session.getDiagnostics().warn(SOURCE_ARBITRATOR, "session reset: " + cause, null);
        session.getGarbageCollector().purgeSession().whenCompleteAsync((v, err) -> {
            if (err != null) {
                log.warn("Purging session of room {} failed: {}", session.getRoomId(),
                        CallSession.unwrap(err).getMessage());
            }
            if (session.isCurrent(generation)) {
                offerThenRelease(Set.of(REASON_SESSION_RESET), generation);
            }
        }, session.getLoop());
    }

    private void offerThenRelease(Set<String> reasons, long generation) {
        publishOffer(reasons, false).whenCompleteAsync((won, err) -> {
            if (err != null && session.isJoined() && session.isCurrent(generation)) {
                Throwable cause = CallSession.unwrap(err);
                log.error("Publishing offer in room {} failed: {}", session.getRoomId(), cause.getMessage(), cause);
                session.getDiagnostics().error(SOURCE_ARBITRATOR, "offer failed", cause);
                session.getHealthMonitor().scheduleFullReconnect("offer failed");
            } else if (Boolean.FALSE.equals(won)) {
                log.info("Lost the offer race in room {}, waiting for the winning offer", session.getRoomId());
            }
            release(generation);
        }, session.getLoop());
    }

    private void promote(String reason, long generation) {
        log.info("Promoting self to offerer in room {} ({})", session.getRoomId(), reason);
        session.getDiagnostics().info(SOURCE_ARBITRATOR, "promoting to offerer: " + reason);
        offerThenRelease(Set.of(reason), generation);
    }

    // offer

    /**
     * Creates an offer for the next revision and commits it if nobody else
     * published in between.
     *
     * @return whether this endpoint's offer won
     */
    public CompletableFuture<Boolean> publishOffer(Set<String> reasons, boolean iceRestart) {
        NegotiationState state = session.getState();
        SignalingRepository repository = session.getRepository();
        CallEventLoop loop = session.getLoop();
        String roomId = session.getRoomId();
        MediaTransport transport = session.getTransport();
        long generation = session.getTransportGeneration();

        CompletableFuture<Void> ready = transport.getSignalingState() == SignalingState.HAVE_REMOTE_OFFER
                ? transport.rollbackLocalDescription()
                : CompletableFuture.completedFuture(null);
        return ready
                .thenComposeAsync(v -> repository.readSession(roomId), loop)
                .thenComposeAsync(observed -> repository.listRevisions(roomId)
                        .thenComposeAsync(revisions -> {
                            SessionDocument current = observed.orElse(null);
                            long expected = current == null ? 0 : current.offerRevision();
                            long highest = revisions.stream().mapToLong(Long::longValue).max().orElse(0);
                            long next = Math.max(Math.max(expected, state.getLastOfferRevision()), highest) + 1;
                            return createOffer(transport, current, expected, next, iceRestart);
                        }, loop), loop)
                .handleAsync((published, err) -> {
                    state.setPendingOfferRevision(0);
                    if (!session.isCurrent(generation)) {
                        session.getTrickleBus().discardProvisional();
                        return false;
                    }
                    if (err != null) {
                        session.getTrickleBus().discardProvisional();
                        throw new CompletionException(CallSession.unwrap(err));
                    }
                    if (published.committed) {
                        onOfferCommitted(published.document, reasons);
                        return true;
                    }
                    session.getTrickleBus().discardProvisional();
                    if (transport.getSignalingState() == SignalingState.HAVE_LOCAL_OFFER) {
                        transport.rollbackLocalDescription().whenComplete((v, rollbackErr) -> {
                            if (rollbackErr != null) {
                                log.warn("Rolling back losing offer in room {} failed: {}", roomId,
                                        CallSession.unwrap(rollbackErr).getMessage());
                            }
                        });
                    }
                    session.getDiagnostics().info(SOURCE_ARBITRATOR, "offer r" + published.document.offerRevision()
                            + " lost the race");
                    return false;
                }, loop);
    }

    private CompletableFuture<PublishedOffer> createOffer(MediaTransport transport, SessionDocument current,
            long expected, long next, boolean iceRestart) {
        CallEventLoop loop = session.getLoop();
        session.getState().setPendingOfferRevision(next);
        return transport.createOffer(iceRestart)
                .thenComposeAsync(offer -> transport.setLocalDescription(offer).thenApply(v -> offer), loop)
                .thenComposeAsync(offer -> session.getSideChannel().store(DescriptionKind.OFFER, offer.toBuilder()
                        .type(DescriptionKind.OFFER.type())
                        .revision(next)
                        .updatedAt(loop.now())
                        .updatedBy(session.getUid())
                        .build()), loop)
                .thenComposeAsync(embedded -> {
                    boolean keepEpoch = current != null && current.getCreatedBy() != null;
                    SessionDocument document = SessionDocument.builder()
                            .offer(embedded)
                            .createdAt(keepEpoch ? current.getCreatedAt() : Long.valueOf(loop.now()))
                            .createdBy(keepEpoch ? current.getCreatedBy() : session.getUid())
                            .build();
                    return session.getRepository().publishOffer(session.getRoomId(), document, expected)
                            .thenApply(committed -> new PublishedOffer(document, committed));
                }, loop);
    }

    private void onOfferCommitted(SessionDocument document, Set<String> reasons) {
        NegotiationState state = session.getState();
        long revision = document.offerRevision();
        state.setOfferer(true);
        state.setLastOfferRevision(revision);
        state.setAppliedAnswerRevision(0);
        state.setCurrentOfferAuthor(session.getUid());
        state.setStandbyBehind(null);
        state.setAnswerState(AnswerAttemptState.IDLE);
        state.setNeedsPromotion(false);
        state.setRestoreMediaAfterAnswer(false);

        session.getLedger().activate(revision, CandidateRole.OFFERER, epochOf(document));
        session.getTrickleBus().commitProvisional(revision);
        session.getGarbageCollector().purgeSuperseded(revision);
        if (state.getOutstandingRequestId() != null) {
            session.getPresence().clearRenegotiationRequest();
        }
        log.info("Published offer r{} in room {} ({})", revision, session.getRoomId(), String.join(",", reasons));
        session.getDiagnostics().info(SOURCE_ARBITRATOR, "offer r" + revision + " published: " + reasons);
    }

    // document changes

    public void onSessionDocument(Optional<SessionDocument> update) {
        if (!session.isJoined()) {
            return;
        }
        NegotiationState state = session.getState();
        if (state.isNegotiationInFlight()) {
            state.setDeferredDocument(update);
            return;
        }
        SessionDocument document = update.orElse(null);
        if (document == null || !document.hasOffer()) {
            if (state.getActiveRevision() > 0) {
                confirmRemoved();
            }
            return;
        }
        if (session.getUid().equals(document.offerAuthor())) {
            onOwnOffer(document);
        } else {
            onRemoteOffer(document);
        }
    }

    /**
     * A removal notification may be older than our own latest write; only a
     * fresh read that still finds nothing resets the session.
     */
    private void confirmRemoved() {
        session.getRepository().readSession(session.getRoomId()).whenCompleteAsync((current, err) -> {
            if (!session.isJoined()) {
                return;
            }
            if (err != null) {
                log.warn("Re-reading session of room {} failed: {}", session.getRoomId(),
                        CallSession.unwrap(err).getMessage());
                return;
            }
            if (current.isEmpty() || !current.get().hasOffer()) {
                log.info("Session of room {} was removed, renegotiating", session.getRoomId());
                session.getScheduler().request(REASON_SESSION_RESET, true);
            }
        }, session.getLoop());
    }

    private void onOwnOffer(SessionDocument document) {
        NegotiationState state = session.getState();
        long revision = document.offerRevision();
        if (revision != state.getLastOfferRevision()) {
            log.debug("Ignoring own offer r{} (last published r{}) in room {}", revision,
                    state.getLastOfferRevision(), session.getRoomId());
            return;
        }
        SdpPayload answer = document.getAnswer();
        if (answer == null || answer.getRevision() != revision || state.getAppliedAnswerRevision() == revision) {
            return;
        }
        applyAnswer(answer);
    }

    private void applyAnswer(SdpPayload answer) {
        MediaTransport transport = session.getTransport();
        if (transport.getSignalingState() != SignalingState.HAVE_LOCAL_OFFER) {
            log.debug("Answer r{} arrived in signaling state {}, ignoring", answer.getRevision(),
                    transport.getSignalingState());
            return;
        }
        NegotiationState state = session.getState();
        long generation = session.getTransportGeneration();
        long revision = answer.getRevision();
        acquire();
        session.getSideChannel().resolve(DescriptionKind.ANSWER, answer)
                .thenComposeAsync(resolved -> {
                    if (resolved.isEmpty()) {
                        throw new MissingDescriptionException("answer r" + revision + " has no readable description");
                    }
                    return transport.setRemoteDescription(resolved.get());
                }, session.getLoop())
                .whenCompleteAsync((v, err) -> {
                    if (!session.isCurrent(generation)) {
                        return;
                    }
                    if (err != null) {
                        Throwable cause = CallSession.unwrap(err);
                        log.warn("Applying answer r{} in room {} failed: {}", revision, session.getRoomId(),
                                cause.getMessage());
                        session.getDiagnostics().warn(SOURCE_ARBITRATOR, "answer r" + revision + " not applied", cause);
                        release(generation);
                        session.getScheduler().request(REASON_ANSWER_FAILED, true);
                        return;
                    }
                    state.setAppliedAnswerRevision(revision);
                    state.setRemoteDescriptionRevision(revision);
                    state.setAnsweredPeerUid(answer.getUpdatedBy());
                    log.info("Applied answer r{} from {} in room {}", revision, answer.getUpdatedBy(),
                            session.getRoomId());
                    session.getDiagnostics().info(SOURCE_ARBITRATOR, "answer r" + revision + " applied");
                    session.getTrickleBus().flush();
                    release(generation);
                }, session.getLoop());
    }

    private void onRemoteOffer(SessionDocument document) {
        NegotiationState state = session.getState();
        long revision = document.offerRevision();
        String epoch = epochOf(document);
        if (epoch.equals(state.getDocumentEpoch()) && revision < state.getActiveRevision()) {
            log.debug("Ignoring stale offer r{} (active r{}) in room {}", revision, state.getActiveRevision(),
                    session.getRoomId());
            return;
        }
        if (!state.isOfferer() && revision == state.getLastAnswerRevision() && epoch.equals(state.getDocumentEpoch())
                && Objects.equals(document.offerAuthor(), state.getCurrentOfferAuthor())) {
            return;
        }
        SdpPayload answer = document.getAnswer();
        if (answer != null && answer.getRevision() == revision && answer.getUpdatedBy() != null
                && !session.getUid().equals(answer.getUpdatedBy())) {
            enterStandby(document, answer.getUpdatedBy());
            return;
        }
        if (state.getAnswerState() == AnswerAttemptState.STANDBY && state.getStandbyBehind() != null
                && session.getPresence().isPresent(state.getStandbyBehind())) {
            log.debug("Offer r{} in room {} is for {}, staying on standby", revision, session.getRoomId(),
                    state.getStandbyBehind());
            return;
        }
        if (state.isOfferer()) {
            log.info("Yielding offerer role in room {} to {} (offer r{})", session.getRoomId(),
                    document.offerAuthor(), revision);
            session.getDiagnostics().info(SOURCE_ARBITRATOR, "yielding to offer r" + revision);
        }
        acquire();
        answerOffer(document, 0, session.getTransportGeneration());
    }

    private void enterStandby(SessionDocument document, String answerer) {
        NegotiationState state = session.getState();
        if (state.getAnswerState() != AnswerAttemptState.STANDBY || !answerer.equals(state.getStandbyBehind())) {
            log.info("Room {} already has an active pair ({} / {}), waiting on standby", session.getRoomId(),
                    document.offerAuthor(), answerer);
            session.getDiagnostics().info(SOURCE_ARBITRATOR, "standby behind " + answerer);
        }
        state.setOfferer(false);
        state.setAnswerState(AnswerAttemptState.STANDBY);
        state.setStandbyBehind(answerer);
        state.setCurrentOfferAuthor(document.offerAuthor());
    }

    // answer

    private void answerOffer(SessionDocument document, int attempt, long generation) {
        NegotiationState state = session.getState();
        CallEventLoop loop = session.getLoop();
        MediaTransport transport = session.getTransport();
        long revision = document.offerRevision();
        String author = document.offerAuthor();
        state.setAnswerState(AnswerAttemptState.ATTEMPTING_ANSWER);
        state.setOfferer(false);

        session.getSideChannel().resolve(DescriptionKind.OFFER, document.getOffer())
                .thenComposeAsync(offer -> {
                    if (offer.isEmpty()) {
                        throw new MissingDescriptionException("offer r" + revision + " has no readable description");
                    }
                    state.setCurrentOfferAuthor(author);
                    state.setStandbyBehind(null);
                    session.getLedger().activate(revision, CandidateRole.ANSWERER, epochOf(document));
                    CompletableFuture<Void> ready = transport.getSignalingState().isIdle()
                            ? CompletableFuture.completedFuture(null)
                            : transport.rollbackLocalDescription();
                    return ready.thenComposeAsync(v -> transport.setRemoteDescription(offer.get()), loop);
                }, loop)
                .thenComposeAsync(v -> {
                    state.setRemoteDescriptionRevision(revision);
                    session.getTrickleBus().flush();
                    return transport.createAnswer();
                }, loop)
                .thenComposeAsync(answer -> transport.setLocalDescription(answer).thenApply(v -> answer), loop)
                .thenComposeAsync(answer -> session.getSideChannel().store(DescriptionKind.ANSWER, answer.toBuilder()
                        .type(DescriptionKind.ANSWER.type())
                        .revision(revision)
                        .updatedAt(loop.now())
                        .updatedBy(session.getUid())
                        .build()), loop)
                .thenComposeAsync(embedded -> session.getRepository()
                        .publishAnswer(session.getRoomId(), embedded, revision, author), loop)
                .whenCompleteAsync((committed, err) -> {
                    if (!session.isJoined() || !session.isCurrent(generation)) {
                        return;
                    }
                    if (err != null) {
                        Throwable cause = CallSession.unwrap(err);
                        if (cause instanceof MissingDescriptionException) {
                            log.warn("Cannot answer in room {}: {}", session.getRoomId(), cause.getMessage());
                            state.setAnswerState(AnswerAttemptState.FAILED);
                            promote(REASON_MISSING_OFFER, generation);
                            return;
                        }
                        log.warn("Answering offer r{} in room {} failed (attempt {}): {}", revision,
                                session.getRoomId(), attempt + 1, cause.getMessage());
                        session.getDiagnostics().warn(SOURCE_ARBITRATOR, "answer r" + revision + " failed", cause);
                        retryAnswer(attempt + 1, generation);
                        return;
                    }
                    if (committed) {
                        onAnswerCommitted(document, generation);
                    } else {
                        log.info("Offer r{} in room {} moved while answering (attempt {})", revision,
                                session.getRoomId(), attempt + 1);
                        retryAnswer(attempt + 1, generation);
                    }
                }, loop);
    }

    private void retryAnswer(int attempt, long generation) {
        NegotiationState state = session.getState();
        if (attempt >= session.getProperties().getMaxAnswerAttempts()) {
            state.setAnswerState(AnswerAttemptState.FAILED);
            log.error("Giving up answering in room {} after {} attempts", session.getRoomId(), attempt);
            session.getDiagnostics().error(SOURCE_ARBITRATOR, "answer retries exhausted", null);
            promote(REASON_ANSWER_RETRIES_EXHAUSTED, generation);
            return;
        }
        state.setAnswerState(AnswerAttemptState.AWAITING_REVISION);
        session.getRepository().readSession(session.getRoomId()).whenCompleteAsync((latest, err) -> {
            if (!session.isJoined() || !session.isCurrent(generation)) {
                return;
            }
            if (err != null) {
                log.warn("Re-reading session of room {} failed: {}", session.getRoomId(),
                        CallSession.unwrap(err).getMessage());
                retryAnswer(attempt + 1, generation);
                return;
            }
            SessionDocument document = latest.orElse(null);
            if (document == null || !document.hasOffer()) {
                promote(REASON_MISSING_OFFER, generation);
                return;
            }
            if (session.getUid().equals(document.offerAuthor())) {
                release(generation);
                return;
            }
            SdpPayload answer = document.getAnswer();
            if (answer != null && answer.getRevision() == document.offerRevision() && answer.getUpdatedBy() != null) {
                if (session.getUid().equals(answer.getUpdatedBy())) {
                    onAnswerCommitted(document, generation);
                } else {
                    enterStandby(document, answer.getUpdatedBy());
                    release(generation);
                }
                return;
            }
            answerOffer(document, attempt, generation);
        }, session.getLoop());
    }

    private void onAnswerCommitted(SessionDocument document, long generation) {
        NegotiationState state = session.getState();
        long revision = document.offerRevision();
        state.setLastAnswerRevision(revision);
        state.setAnswerState(AnswerAttemptState.ANSWERED);
        log.info("Answered offer r{} from {} in room {}", revision, document.offerAuthor(), session.getRoomId());
        session.getDiagnostics().info(SOURCE_ARBITRATOR, "answer r" + revision + " published");
        session.getScheduler().onRemoteOfferAnswered();
        boolean restoreMedia = state.isRestoreMediaAfterAnswer();
        state.setRestoreMediaAfterAnswer(false);
        release(generation);
        if (restoreMedia) {
            session.getScheduler().request(REASON_REJOIN_MEDIA, true);
        }
    }

    static String epochOf(SessionDocument document) {
        return document.getCreatedBy() + ":" + document.getCreatedAt();
    }

    private static final class PublishedOffer {
        private final SessionDocument document;
        private final boolean committed;

        private PublishedOffer(SessionDocument document, boolean committed) {
            this.document = document;
            this.committed = committed;
        }
    }

    private static final class MissingDescriptionException extends NegotiationException {
        private MissingDescriptionException(String message) {
            super(message);
        }
    }
}
