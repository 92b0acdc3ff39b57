package com.odin.call_signaling_service.repo;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.ParticipantPresence;
import com.odin.call_signaling_service.dto.PresenceChange;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.dto.SessionDocument;
import com.odin.call_signaling_service.enums.CandidateRole;
import com.odin.call_signaling_service.enums.ChangeType;
import com.odin.call_signaling_service.enums.DescriptionKind;
import com.odin.call_signaling_service.exception.SignalingStoreException;

import lombok.extern.slf4j.Slf4j;

/**
 * Single-JVM signaling store. Writes are serialized on the room, notifications
 * are fanned out synchronously after the write and outside the room lock.
 * Values are deep-copied on the way in and out. A room that holds no state and
 * no subscribers is dropped.
 */
@Slf4j
public class InMemorySignalingRepository implements SignalingRepository {

    private final ObjectMapper objectMapper;
    private final Map<String, RoomState> rooms = new ConcurrentHashMap<>();

    public InMemorySignalingRepository() {
        this(new ObjectMapper());
    }

    public InMemorySignalingRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private static final class RoomState {
        SessionDocument session;
        final TreeSet<Long> revisions = new TreeSet<>();
        final Map<String, List<IceCandidatePayload>> candidates = new HashMap<>();
        final Map<CandidateRole, List<IceCandidatePayload>> legacyCandidates = new HashMap<>();
        final Map<DescriptionKind, SdpPayload> descriptions = new HashMap<>();
        final Map<String, ParticipantPresence> participants = new LinkedHashMap<>();

        final List<Consumer<Optional<SessionDocument>>> sessionSubscribers = new CopyOnWriteArrayList<>();
        final Map<String, List<Consumer<IceCandidatePayload>>> candidateSubscribers = new ConcurrentHashMap<>();
        final List<Consumer<PresenceChange>> presenceSubscribers = new CopyOnWriteArrayList<>();

        // set once the room was dropped from the map; writers then retry on a fresh one
        boolean retired;

        boolean isIdle() {
            return session == null
                    && revisions.isEmpty()
                    && candidates.isEmpty()
                    && legacyCandidates.isEmpty()
                    && descriptions.isEmpty()
                    && participants.isEmpty()
                    && sessionSubscribers.isEmpty()
                    && presenceSubscribers.isEmpty()
                    && candidateSubscribers.values().stream().allMatch(List::isEmpty);
        }
    }

    /**
     * Runs {@code action} under the lock of the live room, creating it if needed.
     */
    private <T> T write(String roomId, Function<RoomState, T> action) {
        while (true) {
            RoomState room = rooms.computeIfAbsent(roomId, id -> new RoomState());
            synchronized (room) {
                if (!room.retired) {
                    return action.apply(room);
                }
            }
        }
    }

    /**
     * Runs {@code action} under the room lock, or returns {@code absent} for a
     * room that holds nothing.
     */
    private <T> T read(String roomId, Function<RoomState, T> action, T absent) {
        RoomState room = rooms.get(roomId);
        if (room == null) {
            return absent;
        }
        synchronized (room) {
            return action.apply(room);
        }
    }

    private void pruneIfIdle(String roomId) {
        rooms.computeIfPresent(roomId, (id, room) -> {
            synchronized (room) {
                if (!room.isIdle()) {
                    return room;
                }
                room.retired = true;
                log.debug("Dropped empty room {}", roomId);
                return null;
            }
        });
    }

    private static String subtreeKey(long revision, CandidateRole role) {
        return revision + ":" + role.key();
    }

    private <T> T copy(T value, Class<T> type) {
        return value == null ? null : objectMapper.convertValue(value, type);
    }

    // session document

    @Override
    public CompletableFuture<Optional<SessionDocument>> readSession(String roomId) {
        return CompletableFuture.completedFuture(Optional.ofNullable(
                read(roomId, room -> copy(room.session, SessionDocument.class), null)));
    }

    @Override
    public CompletableFuture<Boolean> publishOffer(String roomId, SessionDocument document, long expectedRevision) {
        Runnable notification = write(roomId, room -> {
            long current = room.session == null ? 0L : room.session.offerRevision();
            if (current != expectedRevision) {
                log.debug("Offer write rejected for room={} expectedRevision={} storedRevision={}",
                        roomId, expectedRevision, current);
                return null;
            }
            room.session = copy(document, SessionDocument.class);
            if (document.hasOffer()) {
                room.revisions.add(document.offerRevision());
            }
            SessionDocument committed = copy(room.session, SessionDocument.class);
            return () -> notifySession(room, committed);
        });
        if (notification == null) {
            return CompletableFuture.completedFuture(false);
        }
        notification.run();
        return CompletableFuture.completedFuture(true);
    }

    @Override
    public CompletableFuture<Boolean> publishAnswer(String roomId, SdpPayload answer, long expectedRevision,
            String expectedOfferAuthor) {
        Runnable notification = write(roomId, room -> {
            SessionDocument current = room.session;
            if (current == null || !current.hasOffer()
                    || current.offerRevision() != expectedRevision
                    || !expectedOfferAuthor.equals(current.offerAuthor())
                    || answeredByOther(current, answer)) {
                log.debug("Answer write rejected for room={} expectedRevision={}", roomId, expectedRevision);
                return null;
            }
            current.setAnswer(copy(answer, SdpPayload.class));
            SessionDocument committed = copy(current, SessionDocument.class);
            return () -> notifySession(room, committed);
        });
        if (notification == null) {
            return CompletableFuture.completedFuture(false);
        }
        notification.run();
        return CompletableFuture.completedFuture(true);
    }

    private static boolean answeredByOther(SessionDocument current, SdpPayload answer) {
        return current.getAnswer() != null
                && current.getAnswer().getUpdatedBy() != null
                && !current.getAnswer().getUpdatedBy().equals(answer.getUpdatedBy());
    }

    @Override
    public CompletableFuture<Void> deleteSession(String roomId) {
        Runnable notification = read(roomId, room -> {
            if (room.session == null) {
                return null;
            }
            room.session = null;
            return () -> notifySession(room, null);
        }, null);
        if (notification != null) {
            notification.run();
        }
        pruneIfIdle(roomId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Subscription subscribeSession(String roomId, Consumer<Optional<SessionDocument>> consumer) {
        SessionDocument current = write(roomId, room -> {
            room.sessionSubscribers.add(consumer);
            return copy(room.session, SessionDocument.class);
        });
        consumer.accept(Optional.ofNullable(current));
        return () -> {
            read(roomId, room -> room.sessionSubscribers.remove(consumer), false);
            pruneIfIdle(roomId);
        };
    }

    private void notifySession(RoomState room, SessionDocument document) {
        for (Consumer<Optional<SessionDocument>> subscriber : room.sessionSubscribers) {
            subscriber.accept(Optional.ofNullable(copy(document, SessionDocument.class)));
        }
    }

    // revision subtrees

    @Override
    public CompletableFuture<Void> appendCandidate(String roomId, long revision, CandidateRole role,
            IceCandidatePayload candidate) {
        String key = subtreeKey(revision, role);
        List<Consumer<IceCandidatePayload>> subscribers = read(roomId, room -> {
            if (!room.revisions.contains(revision)) {
                return null;
            }
            room.candidates.computeIfAbsent(key, k -> new ArrayList<>())
                    .add(copy(candidate, IceCandidatePayload.class));
            return room.candidateSubscribers.getOrDefault(key, List.of());
        }, null);
        if (subscribers == null) {
            log.debug("Dropped candidate for unknown revision {} in room={}", revision, roomId);
            return CompletableFuture.completedFuture(null);
        }
        for (Consumer<IceCandidatePayload> subscriber : subscribers) {
            subscriber.accept(copy(candidate, IceCandidatePayload.class));
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Subscription subscribeCandidates(String roomId, long revision, CandidateRole role,
            Consumer<IceCandidatePayload> consumer) {
        String key = subtreeKey(revision, role);
        List<IceCandidatePayload> existing = write(roomId, room -> {
            room.candidateSubscribers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(consumer);
            return new ArrayList<>(room.candidates.getOrDefault(key, List.of()));
        });
        existing.forEach(c -> consumer.accept(copy(c, IceCandidatePayload.class)));
        return () -> {
            read(roomId, room -> {
                List<Consumer<IceCandidatePayload>> subscribers = room.candidateSubscribers.get(key);
                if (subscribers != null) {
                    subscribers.remove(consumer);
                    if (subscribers.isEmpty()) {
                        room.candidateSubscribers.remove(key);
                    }
                }
                return null;
            }, null);
            pruneIfIdle(roomId);
        };
    }

    @Override
    public CompletableFuture<List<Long>> listRevisions(String roomId) {
        return CompletableFuture.completedFuture(
                read(roomId, room -> new ArrayList<>(room.revisions), new ArrayList<>()));
    }

    @Override
    public CompletableFuture<Void> deleteRevision(String roomId, long revision) {
        read(roomId, room -> {
            for (CandidateRole role : CandidateRole.values()) {
                room.candidates.remove(subtreeKey(revision, role));
            }
            return room.revisions.remove(revision);
        }, false);
        pruneIfIdle(roomId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> deleteLegacyCandidates(String roomId) {
        read(roomId, room -> {
            room.legacyCandidates.clear();
            return null;
        }, null);
        pruneIfIdle(roomId);
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Stores a candidate in the pre-revision flat layout, as older clients did.
     */
    public void appendLegacyCandidate(String roomId, CandidateRole role, IceCandidatePayload candidate) {
        write(roomId, room -> room.legacyCandidates.computeIfAbsent(role, r -> new ArrayList<>())
                .add(copy(candidate, IceCandidatePayload.class)));
    }

    // side-channel descriptions

    @Override
    public CompletableFuture<Void> writeDescription(String roomId, DescriptionKind kind, SdpPayload description) {
        write(roomId, room -> room.descriptions.put(kind, copy(description, SdpPayload.class)));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Optional<SdpPayload>> readDescription(String roomId, DescriptionKind kind) {
        return CompletableFuture.completedFuture(Optional.ofNullable(
                read(roomId, room -> copy(room.descriptions.get(kind), SdpPayload.class), null)));
    }

    @Override
    public CompletableFuture<Void> deleteDescriptions(String roomId) {
        read(roomId, room -> {
            room.descriptions.clear();
            return null;
        }, null);
        pruneIfIdle(roomId);
        return CompletableFuture.completedFuture(null);
    }

    // presence

    @Override
    public CompletableFuture<Void> upsertParticipant(String roomId, ParticipantPresence participant) {
        Runnable notification = write(roomId, room -> {
            ChangeType type = room.participants.containsKey(participant.getUid())
                    ? ChangeType.MODIFIED
                    : ChangeType.ADDED;
            room.participants.put(participant.getUid(), copy(participant, ParticipantPresence.class));
            return () -> notifyPresence(room, new PresenceChange(type, participant.getUid(), participant));
        });
        notification.run();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> updateParticipant(String roomId, String uid, Map<String, Object> fields) {
        Runnable notification;
        try {
            notification = read(roomId, room -> {
                ParticipantPresence existing = room.participants.get(uid);
                if (existing == null) {
                    return null;
                }
                ParticipantPresence updated;
                try {
                    updated = objectMapper.updateValue(copy(existing, ParticipantPresence.class), fields);
                } catch (JsonMappingException e) {
                    throw new SignalingStoreException("Invalid participant update for " + uid, e);
                }
                room.participants.put(uid, updated);
                return () -> notifyPresence(room, new PresenceChange(ChangeType.MODIFIED, uid, updated));
            }, null);
        } catch (SignalingStoreException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (notification == null) {
            return CompletableFuture.failedFuture(
                    new SignalingStoreException("No participant " + uid + " in room " + roomId));
        }
        notification.run();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> deleteParticipant(String roomId, String uid) {
        Runnable notification = read(roomId, room -> {
            if (room.participants.remove(uid) == null) {
                return null;
            }
            return () -> notifyPresence(room, new PresenceChange(ChangeType.REMOVED, uid, null));
        }, null);
        if (notification != null) {
            notification.run();
        }
        pruneIfIdle(roomId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<List<ParticipantPresence>> listParticipants(String roomId) {
        return CompletableFuture.completedFuture(read(roomId, room -> {
            List<ParticipantPresence> result = new ArrayList<>();
            room.participants.values().forEach(p -> result.add(copy(p, ParticipantPresence.class)));
            return result;
        }, new ArrayList<>()));
    }

    @Override
    public CompletableFuture<Void> deleteAllParticipants(String roomId) {
        Runnable notification = read(roomId, room -> {
            List<String> removed = new ArrayList<>(room.participants.keySet());
            room.participants.clear();
            return () -> removed.forEach(uid ->
                    notifyPresence(room, new PresenceChange(ChangeType.REMOVED, uid, null)));
        }, null);
        if (notification != null) {
            notification.run();
        }
        pruneIfIdle(roomId);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public Subscription subscribeParticipants(String roomId, Consumer<PresenceChange> consumer) {
        List<ParticipantPresence> existing = write(roomId, room -> {
            room.presenceSubscribers.add(consumer);
            return new ArrayList<>(room.participants.values());
        });
        existing.forEach(p -> consumer.accept(
                new PresenceChange(ChangeType.ADDED, p.getUid(), copy(p, ParticipantPresence.class))));
        return () -> {
            read(roomId, room -> room.presenceSubscribers.remove(consumer), false);
            pruneIfIdle(roomId);
        };
    }

    private void notifyPresence(RoomState room, PresenceChange change) {
        for (Consumer<PresenceChange> subscriber : room.presenceSubscribers) {
            ParticipantPresence participant = copy(change.getParticipant(), ParticipantPresence.class);
            subscriber.accept(new PresenceChange(change.getType(), change.getUid(), participant));
        }
    }

    /**
     * Number of stored artifacts of any kind (session, revisions, candidates,
     * descriptions, participants) left for the room.
     */
    public int artifactCount(String roomId) {
        return read(roomId, room -> {
            int count = room.session == null ? 0 : 1;
            count += room.revisions.size();
            count += room.candidates.values().stream().mapToInt(List::size).sum();
            count += room.legacyCandidates.values().stream().mapToInt(List::size).sum();
            count += room.descriptions.size();
            count += room.participants.size();
            return count;
        }, 0);
    }

    /**
     * Whether the store still keeps an entry for the room.
     */
    public boolean holdsRoom(String roomId) {
        return rooms.containsKey(roomId);
    }
}
