package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.constants.ApplicationConstants.SOURCE_GC;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import com.odin.call_signaling_service.dto.ParticipantPresence;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.dto.SessionDocument;
import com.odin.call_signaling_service.repo.SignalingRepository;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the room's signaling storage bounded: superseded revision subtrees go
 * when a new offer commits, everything goes when the last participant leaves.
 */
@Slf4j
public class ArtifactGarbageCollector {

    private final CallSession session;

    ArtifactGarbageCollector(CallSession session) {
        this.session = session;
    }

    /**
     * Purges a stored session whose descriptions grew past the size threshold.
     * Failing to purge does not block the join.
     */
    public CompletableFuture<Void> guardOversizedSession() {
        String roomId = session.getRoomId();
        return session.getRepository().readSession(roomId).thenComposeAsync(document -> {
            if (document.isEmpty() || !isOversized(document.get())) {
                return CompletableFuture.<Void>completedFuture(null);
            }
            log.warn("Session of room {} exceeds {} bytes, purging before join", roomId,
                    session.getProperties().getMaxStoredDescriptionBytes());
            session.getDiagnostics().warn(SOURCE_GC, "oversized session purged", null);
            return purgeSession().<Void>handle((v, err) -> {
                if (err != null) {
                    log.warn("Purging oversized session of room {} failed: {}", roomId,
                            CallSession.unwrap(err).getMessage());
                }
                return null;
            });
        }, session.getLoop());
    }

    boolean isOversized(SessionDocument document) {
        int limit = session.getProperties().getMaxStoredDescriptionBytes();
        return length(document.getOffer()) > limit || length(document.getAnswer()) > limit;
    }

    private static int length(SdpPayload payload) {
        return payload == null ? 0 : payload.sdpLength();
    }

    /**
     * Deletes every revision subtree below {@code keep} and the legacy
     * candidate collections. Errors are recorded, never propagated.
     */
    public CompletableFuture<Void> purgeSuperseded(long keep) {
        SignalingRepository repository = session.getRepository();
        String roomId = session.getRoomId();
        return repository.listRevisions(roomId)
                .thenComposeAsync(revisions -> {
                    List<CompletableFuture<Void>> deletions = revisions.stream()
                            .filter(revision -> revision < keep)
                            .map(revision -> repository.deleteRevision(roomId, revision))
                            .collect(Collectors.toList());
                    deletions.add(repository.deleteLegacyCandidates(roomId));
                    if (deletions.size() > 1) {
                        log.debug("Deleting {} superseded revisions in room {}", deletions.size() - 1, roomId);
                    }
                    return CompletableFuture.allOf(deletions.toArray(new CompletableFuture[0]));
                }, session.getLoop())
                .handleAsync((v, err) -> {
                    if (err != null) {
                        Throwable cause = CallSession.unwrap(err);
                        log.warn("Deleting revisions below r{} in room {} failed: {}", keep, roomId,
                                cause.getMessage());
                        session.getDiagnostics().warn(SOURCE_GC, "superseded revisions not deleted", cause);
                    }
                    return null;
                }, session.getLoop());
    }

    /**
     * Deletes the session document with all revision subtrees, legacy
     * candidates and side-channel descriptions.
     */
    public CompletableFuture<Void> purgeSession() {
        SignalingRepository repository = session.getRepository();
        String roomId = session.getRoomId();
        log.info("Purging session of room {}", roomId);
        return repository.listRevisions(roomId)
                .thenComposeAsync(revisions -> CompletableFuture.allOf(revisions.stream()
                        .map(revision -> repository.deleteRevision(roomId, revision))
                        .toArray(CompletableFuture[]::new)), session.getLoop())
                .thenComposeAsync(v -> repository.deleteLegacyCandidates(roomId), session.getLoop())
                .thenComposeAsync(v -> repository.deleteDescriptions(roomId), session.getLoop())
                .thenComposeAsync(v -> repository.deleteSession(roomId), session.getLoop())
                .whenCompleteAsync((v, err) -> {
                    if (err != null) {
                        session.getDiagnostics().error(SOURCE_GC, "session purge failed", CallSession.unwrap(err));
                    } else {
                        session.getDiagnostics().info(SOURCE_GC, "session purged");
                    }
                }, session.getLoop());
    }

    /**
     * Leaves the presence registry and, when nobody else is active, deletes
     * the room's signaling state entirely.
     */
    public CompletableFuture<Void> onLeave() {
        SignalingRepository repository = session.getRepository();
        String roomId = session.getRoomId();
        PresenceRegistry presence = session.getPresence();
        return presence.removeSelf()
                .thenComposeAsync(v -> repository.listParticipants(roomId), session.getLoop())
                .thenComposeAsync(participants -> {
                    if (isOccupied(participants, presence)) {
                        log.debug("Room {} still has participants, keeping its session", roomId);
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    log.info("Room {} is empty, deleting its signaling state", roomId);
                    return purgeSession().thenComposeAsync(v -> repository.deleteAllParticipants(roomId),
                            session.getLoop());
                }, session.getLoop())
                .handleAsync((v, err) -> {
                    if (err != null) {
                        Throwable cause = CallSession.unwrap(err);
                        log.warn("Cleaning up room {} on leave failed: {}", roomId, cause.getMessage());
                        session.getDiagnostics().warn(SOURCE_GC, "cleanup on leave failed", cause);
                    }
                    return null;
                }, session.getLoop());
    }

    private boolean isOccupied(List<ParticipantPresence> participants, PresenceRegistry presence) {
        return participants.stream()
                .anyMatch(p -> !session.getUid().equals(p.getUid()) && p.isActive() && presence.isFresh(p));
    }
}
