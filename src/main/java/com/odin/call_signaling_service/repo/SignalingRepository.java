package com.odin.call_signaling_service.repo;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.ParticipantPresence;
import com.odin.call_signaling_service.dto.PresenceChange;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.dto.SessionDocument;
import com.odin.call_signaling_service.enums.CandidateRole;
import com.odin.call_signaling_service.enums.DescriptionKind;

/**
 * Realtime shared document store used as the signaling channel of a room.
 * <p>
 * All operations are asynchronous; failures complete the returned future with a
 * {@link com.odin.call_signaling_service.exception.SignalingStoreException}.
 * Subscription callbacks may run on any thread.
 */
public interface SignalingRepository {

    // session document

    CompletableFuture<Optional<SessionDocument>> readSession(String roomId);

    /**
     * Replaces the session document if the stored offer revision (0 when there is
     * no document or no offer) equals {@code expectedRevision}.
     *
     * @return whether the write was committed
     */
    CompletableFuture<Boolean> publishOffer(String roomId, SessionDocument document, long expectedRevision);

    /**
     * Sets the answer if the stored offer is at {@code expectedRevision}, was
     * written by {@code expectedOfferAuthor} and is not already answered by a
     * different endpoint.
     *
     * @return whether the write was committed
     */
    CompletableFuture<Boolean> publishAnswer(String roomId, SdpPayload answer, long expectedRevision,
            String expectedOfferAuthor);

    CompletableFuture<Void> deleteSession(String roomId);

    /**
     * Delivers the current document (empty when absent) and then every change.
     */
    Subscription subscribeSession(String roomId, Consumer<Optional<SessionDocument>> consumer);

    // revision subtrees

    /**
     * Appends to the revision's candidate sequence. Revisions without a marker,
     * never offered or already collected, are left alone and the candidate is
     * dropped.
     */
    CompletableFuture<Void> appendCandidate(String roomId, long revision, CandidateRole role,
            IceCandidatePayload candidate);

    /**
     * Delivers the candidates already stored under the revision/role, in order,
     * followed by every candidate appended later.
     */
    Subscription subscribeCandidates(String roomId, long revision, CandidateRole role,
            Consumer<IceCandidatePayload> consumer);

    CompletableFuture<List<Long>> listRevisions(String roomId);

    /**
     * Removes both candidate sequences of the revision and then its marker.
     */
    CompletableFuture<Void> deleteRevision(String roomId, long revision);

    /**
     * Removes candidate collections written before candidates were scoped by revision.
     */
    CompletableFuture<Void> deleteLegacyCandidates(String roomId);

    // side-channel descriptions

    CompletableFuture<Void> writeDescription(String roomId, DescriptionKind kind, SdpPayload description);

    CompletableFuture<Optional<SdpPayload>> readDescription(String roomId, DescriptionKind kind);

    CompletableFuture<Void> deleteDescriptions(String roomId);

    // presence

    CompletableFuture<Void> upsertParticipant(String roomId, ParticipantPresence participant);

    /**
     * Merges the given top-level fields into an existing participant record.
     * Concurrent updates of the same record never overwrite each other.
     */
    CompletableFuture<Void> updateParticipant(String roomId, String uid, Map<String, Object> fields);

    CompletableFuture<Void> deleteParticipant(String roomId, String uid);

    CompletableFuture<List<ParticipantPresence>> listParticipants(String roomId);

    CompletableFuture<Void> deleteAllParticipants(String roomId);

    /**
     * Delivers every existing participant as ADDED and then every change.
     */
    Subscription subscribeParticipants(String roomId, Consumer<PresenceChange> consumer);
}
