package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.constants.ApplicationConstants.SOURCE_PRESENCE;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import com.odin.call_signaling_service.dto.ParticipantPresence;
import com.odin.call_signaling_service.dto.ParticipantProfile;
import com.odin.call_signaling_service.dto.PresenceChange;
import com.odin.call_signaling_service.dto.RenegotiationRequest;
import com.odin.call_signaling_service.enums.ChangeType;
import com.odin.call_signaling_service.enums.ParticipantStatus;
import com.odin.call_signaling_service.exception.StorePermissionDeniedException;
import com.odin.call_signaling_service.repo.Subscription;
import com.odin.call_signaling_service.transport.MediaKind;

import lombok.extern.slf4j.Slf4j;

/**
 * This endpoint's view of the room roster and the writer of its own presence
 * record. Records whose heartbeat went stale are kept but not counted as present.
 */
@Slf4j
public class PresenceRegistry {

    private final CallSession session;
    private final SessionTimer flagsDebounce;
    private final SessionTimer speakingThrottle;
    private final SessionTimer staleSweep;
    private final Map<String, ParticipantPresence> participants = new LinkedHashMap<>();
    private volatile List<ParticipantPresence> rosterSnapshot = List.of();
    private Subscription subscription = Subscription.NONE;
    private Boolean pendingSpeaking;
    private boolean speaking;
    private long lastSpeakingWrite = Long.MIN_VALUE;

    PresenceRegistry(CallSession session) {
        this.session = session;
        this.flagsDebounce = session.newTimer("media-flags");
        this.speakingThrottle = session.newTimer("speaking");
        this.staleSweep = session.newTimer("stale-presence");
    }

    /**
     * Upserts our record as active and starts following the room's presence.
     */
    public CompletableFuture<Void> join() {
        long now = session.getLoop().now();
        ParticipantProfile profile = session.getProfile();
        MediaIntent intent = session.getIntent();
        ParticipantPresence self = ParticipantPresence.builder()
                .uid(profile.getUid())
                .displayName(profile.getDisplayName())
                .photoUrl(profile.getPhotoUrl())
                .hasAudio(true)
                .hasVideo(intent.isCameraOn())
                .screenSharing(intent.isScreenSharing())
                .muted(intent.isMuted())
                .deafened(intent.isDeafened())
                .status(ParticipantStatus.ACTIVE)
                .streamId(session.getStreamId())
                .joinedAt(now)
                .lastHeartbeat(now)
                .build();
        return session.getRepository().upsertParticipant(session.getRoomId(), self).thenRunAsync(() -> {
            participants.put(self.getUid(), self);
            refreshSnapshot();
            subscription.close();
            CallEventLoop loop = session.getLoop();
            subscription = session.getRepository().subscribeParticipants(session.getRoomId(),
                    change -> loop.execute(() -> onChange(change)));
            scheduleStaleSweep();
        }, session.getLoop());
    }

    private void onChange(PresenceChange change) {
        if (!session.isJoined()) {
            return;
        }
        ParticipantPresence previous = change.getType() == ChangeType.REMOVED
                ? participants.remove(change.getUid())
                : participants.put(change.getUid(), change.getParticipant());
        refreshSnapshot();
        session.onPresenceChange(change, previous);
    }

    // roster

    public boolean isFresh(ParticipantPresence participant) {
        Long heartbeat = participant.getLastHeartbeat();
        return heartbeat != null
                && session.getLoop().now() - heartbeat <= session.getProperties().getStaleThresholdMs();
    }

    /**
     * Active participants with a fresh heartbeat, in join order.
     */
    public List<ParticipantPresence> roster() {
        return participants.values().stream()
                .filter(p -> p.isActive() && isFresh(p))
                .sorted(Comparator.comparing(ParticipantPresence::getJoinedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .collect(Collectors.toList());
    }

    /**
     * Last computed roster, safe to read from any thread.
     */
    public List<ParticipantPresence> rosterSnapshot() {
        return rosterSnapshot;
    }

    private void refreshSnapshot() {
        rosterSnapshot = List.copyOf(roster());
    }

    public boolean isPresent(String uid) {
        ParticipantPresence participant = participants.get(uid);
        return participant != null && participant.isActive() && isFresh(participant);
    }

    public List<ParticipantPresence> remoteParticipants() {
        return roster().stream()
                .filter(p -> !session.getUid().equals(p.getUid()))
                .collect(Collectors.toList());
    }

    public Optional<ParticipantPresence> findByStreamId(String streamId) {
        return participants.values().stream()
                .filter(p -> streamId != null && streamId.equals(p.getStreamId()))
                .findFirst();
    }

    // own record

    public void heartbeat() {
        long now = session.getLoop().now();
        ParticipantPresence self = participants.get(session.getUid());
        if (self != null) {
            participants.put(self.getUid(), self.toBuilder().lastHeartbeat(now).build());
        }
        refreshSnapshot();
        write("heartbeat", Map.of("lastHeartbeat", now));
    }

    /**
     * Schedules one write of the current media flags; calls within the debounce
     * window are merged.
     */
    public void publishMediaFlags() {
        flagsDebounce.arm(session.getProperties().getMediaFlagsDebounceMs(), this::writeMediaFlags);
    }

    private void writeMediaFlags() {
        if (!session.isJoined()) {
            return;
        }
        MediaIntent intent = session.getIntent();
        Map<String, Object> fields = new HashMap<>();
        fields.put("muted", intent.isMuted());
        fields.put("deafened", intent.isDeafened());
        fields.put("hasAudio", session.hasLocalTrack(MediaKind.AUDIO));
        fields.put("hasVideo", intent.isCameraOn() && session.hasLocalTrack(MediaKind.VIDEO));
        fields.put("screenSharing", intent.isScreenSharing() && session.hasLocalTrack(MediaKind.SCREEN));
        write("media flags", fields);
    }

    /**
     * Publishes the speaking flag at most once per throttle window. The first
     * change of a window is written at once, the last one when the window ends.
     */
    public void setSpeaking(boolean value) {
        long now = session.getLoop().now();
        long window = session.getProperties().getSpeakingThrottleMs();
        long sinceLast = lastSpeakingWrite == Long.MIN_VALUE ? Long.MAX_VALUE : now - lastSpeakingWrite;
        if (sinceLast >= window && !speakingThrottle.isArmed()) {
            if (value != speaking) {
                writeSpeaking(value);
            }
            return;
        }
        pendingSpeaking = value;
        if (!speakingThrottle.isArmed()) {
            speakingThrottle.arm(window - sinceLast, this::flushSpeaking);
        }
    }

    private void flushSpeaking() {
        Boolean value = pendingSpeaking;
        pendingSpeaking = null;
        if (value != null && value != speaking) {
            writeSpeaking(value);
        }
    }

    private void writeSpeaking(boolean value) {
        if (!session.isJoined()) {
            return;
        }
        speaking = value;
        lastSpeakingWrite = session.getLoop().now();
        write("speaking", Map.of("speaking", value));
    }

    public void writeRenegotiationRequest(String reason, long offerRevision) {
        String id = UUID.randomUUID().toString();
        session.getState().setOutstandingRequestId(id);
        RenegotiationRequest request = RenegotiationRequest.builder()
                .id(id)
                .reason(reason)
                .requestedBy(session.getUid())
                .requestedAt(session.getLoop().now())
                .offerRevision(offerRevision)
                .build();
        Map<String, Object> fields = new HashMap<>();
        fields.put("renegotiationRequest", request);
        write("renegotiation request", fields);
    }

    public void clearRenegotiationRequest() {
        session.getState().setOutstandingRequestId(null);
        Map<String, Object> fields = new HashMap<>();
        fields.put("renegotiationRequest", null);
        write("renegotiation request clear", fields);
    }

    private void write(String what, Map<String, Object> fields) {
        session.getRepository().updateParticipant(session.getRoomId(), session.getUid(), fields)
                .whenCompleteAsync((v, err) -> {
                    if (err != null) {
                        Throwable cause = CallSession.unwrap(err);
                        log.warn("Presence {} write in room {} failed: {}", what, session.getRoomId(),
                                cause.getMessage());
                        session.getDiagnostics().warn(SOURCE_PRESENCE, what + " not written", cause);
                    }
                }, session.getLoop());
    }

    /**
     * Marks another participant as removed; its endpoint sees the change and leaves.
     */
    public CompletableFuture<Void> kick(String uid) {
        log.info("Removing {} from room {}", uid, session.getRoomId());
        session.getDiagnostics().info(SOURCE_PRESENCE, "kicked " + uid);
        Map<String, Object> fields = new HashMap<>();
        fields.put("status", ParticipantStatus.REMOVED);
        return session.getRepository().updateParticipant(session.getRoomId(), uid, fields);
    }

    private void scheduleStaleSweep() {
        staleSweep.arm(session.getProperties().getStaleCleanupIntervalMs(), () -> {
            if (!session.isJoined()) {
                return;
            }
            markStaleParticipantsLeft();
            scheduleStaleSweep();
        });
    }

    /**
     * Marks active records of others whose heartbeat went stale as left, so
     * endpoints that vanished without leaving drop out of every roster.
     */
    void markStaleParticipantsLeft() {
        String roomId = session.getRoomId();
        List<String> stale = participants.values().stream()
                .filter(p -> p.isActive() && !isFresh(p) && !session.getUid().equals(p.getUid()))
                .map(ParticipantPresence::getUid)
                .collect(Collectors.toList());
        for (String uid : stale) {
            log.info("Marking stale participant {} of room {} as left", uid, roomId);
            Map<String, Object> fields = new HashMap<>();
            fields.put("status", ParticipantStatus.LEFT);
            session.getRepository().updateParticipant(roomId, uid, fields)
                    .whenCompleteAsync((v, err) -> {
                        if (err != null) {
                            log.debug("Stale participant {} of room {} not marked left: {}", uid, roomId,
                                    CallSession.unwrap(err).getMessage());
                        }
                    }, session.getLoop());
        }
    }

    /**
     * Deletes our record, or marks it left when the store refuses the delete.
     * Never fails: leaving must go on regardless.
     */
    public CompletableFuture<Void> removeSelf() {
        stop();
        String roomId = session.getRoomId();
        String uid = session.getUid();
        return session.getRepository().deleteParticipant(roomId, uid)
                .handleAsync((v, err) -> {
                    if (err == null) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    Throwable cause = CallSession.unwrap(err);
                    if (cause instanceof StorePermissionDeniedException) {
                        log.warn("Deleting presence in room {} denied, marking it left", roomId);
                        Map<String, Object> fields = new HashMap<>();
                        fields.put("status", ParticipantStatus.LEFT);
                        return session.getRepository().updateParticipant(roomId, uid, fields);
                    }
                    return CompletableFuture.<Void>failedFuture(cause);
                }, session.getLoop())
                .thenCompose(next -> next)
                .handleAsync((v, err) -> {
                    if (err != null) {
                        Throwable cause = CallSession.unwrap(err);
                        log.warn("Removing presence in room {} failed: {}", roomId, cause.getMessage());
                        session.getDiagnostics().warn(SOURCE_PRESENCE, "presence not removed", cause);
                    }
                    return null;
                }, session.getLoop());
    }

    public void stop() {
        flagsDebounce.cancel();
        speakingThrottle.cancel();
        staleSweep.cancel();
        pendingSpeaking = null;
        speaking = false;
        lastSpeakingWrite = Long.MIN_VALUE;
        subscription.close();
        subscription = Subscription.NONE;
        participants.clear();
        refreshSnapshot();
    }
}
