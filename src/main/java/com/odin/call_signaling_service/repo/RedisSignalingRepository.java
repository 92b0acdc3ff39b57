package com.odin.call_signaling_service.repo;

import static com.odin.call_signaling_service.constants.ApplicationConstants.CALL_KEY_PREFIX;
import static com.odin.call_signaling_service.constants.ApplicationConstants.DESCRIPTION_KEY_SEGMENT;
import static com.odin.call_signaling_service.constants.ApplicationConstants.EVENTS_CHANNEL_SUFFIX;
import static com.odin.call_signaling_service.constants.ApplicationConstants.EVENT_CANDIDATE;
import static com.odin.call_signaling_service.constants.ApplicationConstants.EVENT_PRESENCE;
import static com.odin.call_signaling_service.constants.ApplicationConstants.EVENT_SESSION;
import static com.odin.call_signaling_service.constants.ApplicationConstants.LEGACY_CANDIDATES_KEY_SEGMENT;
import static com.odin.call_signaling_service.constants.ApplicationConstants.PARTICIPANTS_KEY_SUFFIX;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REVISIONS_KEY_SUFFIX;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REVISION_KEY_SEGMENT;
import static com.odin.call_signaling_service.constants.ApplicationConstants.SESSION_KEY_SUFFIX;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.ParticipantPresence;
import com.odin.call_signaling_service.dto.PresenceChange;
import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.dto.SessionDocument;
import com.odin.call_signaling_service.enums.CandidateRole;
import com.odin.call_signaling_service.enums.ChangeType;
import com.odin.call_signaling_service.enums.DescriptionKind;
import com.odin.call_signaling_service.exception.SignalingStoreException;
import com.odin.call_signaling_service.exception.StorePermissionDeniedException;
import com.odin.call_signaling_service.utility.RedisChangeSubscriber;

import lombok.extern.slf4j.Slf4j;

/**
 * Signaling store on Redis. Values are JSON strings; conditional writes use
 * WATCH/MULTI/EXEC. Every write publishes a small change notification on the
 * room channel and subscribers re-read the affected key.
 */
@Slf4j
public class RedisSignalingRepository implements SignalingRepository {

    private static final int WATCHED_WRITE_ATTEMPTS = 5;

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public RedisSignalingRepository(StringRedisTemplate redisTemplate,
            RedisMessageListenerContainer listenerContainer, ObjectMapper objectMapper, Executor executor) {
        this.redisTemplate = redisTemplate;
        this.listenerContainer = listenerContainer;
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.executor = executor;
    }

    // session document

    @Override
    public CompletableFuture<Optional<SessionDocument>> readSession(String roomId) {
        return async("readSession", roomId, () -> Optional.ofNullable(loadSession(roomId)));
    }

    private SessionDocument loadSession(String roomId) {
        return fromJson(redisTemplate.opsForValue().get(sessionKey(roomId)), SessionDocument.class);
    }

    @Override
    public CompletableFuture<Boolean> publishOffer(String roomId, SessionDocument document, long expectedRevision) {
        return async("publishOffer", roomId, () -> {
            String key = sessionKey(roomId);
            String json = toJson(document);
            List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);
                    SessionDocument current = fromJson(ops.opsForValue().get(key), SessionDocument.class);
                    long storedRevision = current == null ? 0L : current.offerRevision();
                    if (storedRevision != expectedRevision) {
                        ops.unwatch();
                        log.debug("Offer write rejected for room={} expectedRevision={} storedRevision={}",
                                roomId, expectedRevision, storedRevision);
                        return null;
                    }
                    ops.multi();
                    ops.opsForValue().set(key, json);
                    if (document.hasOffer()) {
                        long revision = document.offerRevision();
                        ops.opsForZSet().add(revisionsKey(roomId), String.valueOf(revision), revision);
                    }
                    return ops.exec();
                }
            });
            boolean committed = results != null && !results.isEmpty();
            if (committed) {
                notifyChange(roomId, EVENT_SESSION, null);
            }
            return committed;
        });
    }

    @Override
    public CompletableFuture<Boolean> publishAnswer(String roomId, SdpPayload answer, long expectedRevision,
            String expectedOfferAuthor) {
        return async("publishAnswer", roomId, () -> {
            String key = sessionKey(roomId);
            List<Object> results = redisTemplate.execute(new SessionCallback<List<Object>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> List<Object> execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);
                    SessionDocument current = fromJson(ops.opsForValue().get(key), SessionDocument.class);
                    if (current == null || !current.hasOffer()
                            || current.offerRevision() != expectedRevision
                            || !expectedOfferAuthor.equals(current.offerAuthor())
                    || answeredByOther(current, answer)) {
                        ops.unwatch();
                        log.debug("Answer write rejected for room={} expectedRevision={}", roomId, expectedRevision);
                        return null;
                    }
                    current.setAnswer(answer);
                    ops.multi();
                    ops.opsForValue().set(key, toJson(current));
                    return ops.exec();
                }
            });
            boolean committed = results != null && !results.isEmpty();
            if (committed) {
                notifyChange(roomId, EVENT_SESSION, null);
            }
            return committed;
        });
    }

    private static boolean answeredByOther(SessionDocument current, SdpPayload answer) {
        return current.getAnswer() != null
                && current.getAnswer().getUpdatedBy() != null
                && !current.getAnswer().getUpdatedBy().equals(answer.getUpdatedBy());
    }

    @Override
    public CompletableFuture<Void> deleteSession(String roomId) {
        return async("deleteSession", roomId, () -> {
            if (Boolean.TRUE.equals(redisTemplate.delete(sessionKey(roomId)))) {
                notifyChange(roomId, EVENT_SESSION, null);
            }
            return null;
        });
    }

    @Override
    public Subscription subscribeSession(String roomId, Consumer<Optional<SessionDocument>> consumer) {
        Object lock = new Object();
        Runnable deliver = () -> {
            synchronized (lock) {
                consumer.accept(Optional.ofNullable(loadSession(roomId)));
            }
        };
        Subscription subscription = listen(roomId, EVENT_SESSION, json -> deliver.run());
        return snapshot("subscribeSession", roomId, subscription, deliver);
    }

    // revision subtrees

    @Override
    public CompletableFuture<Void> appendCandidate(String roomId, long revision, CandidateRole role,
            IceCandidatePayload candidate) {
        return async("appendCandidate", roomId, () -> {
            String revisions = revisionsKey(roomId);
            String marker = String.valueOf(revision);
            String json = toJson(candidate);
            boolean appended = watchedWrite("appendCandidate", roomId, revisions, ops -> {
                if (ops.opsForZSet().score(revisions, marker) == null) {
                    return false;
                }
                ops.multi();
                ops.opsForList().rightPush(candidatesKey(roomId, revision, role), json);
                return true;
            });
            if (!appended) {
                log.debug("Dropped candidate for unknown revision {} in room={}", revision, roomId);
                return null;
            }
            notifyChange(roomId, EVENT_CANDIDATE, node -> node.put("revision", revision).put("role", role.key()));
            return null;
        });
    }

    @Override
    public Subscription subscribeCandidates(String roomId, long revision, CandidateRole role,
            Consumer<IceCandidatePayload> consumer) {
        String key = candidatesKey(roomId, revision, role);
        long[] cursor = {0L};
        Object lock = new Object();
        Runnable drain = () -> {
            synchronized (lock) {
                List<String> entries = redisTemplate.opsForList().range(key, cursor[0], -1);
                if (entries == null) {
                    return;
                }
                for (String entry : entries) {
                    cursor[0]++;
                    consumer.accept(fromJson(entry, IceCandidatePayload.class));
                }
            }
        };
        Subscription subscription = listen(roomId, EVENT_CANDIDATE, json -> {
            if (json.path("revision").asLong() == revision && role.key().equals(json.path("role").asText())) {
                drain.run();
            }
        });
        return snapshot("subscribeCandidates", roomId, subscription, drain);
    }

    @Override
    public CompletableFuture<List<Long>> listRevisions(String roomId) {
        return async("listRevisions", roomId, () -> {
            Set<String> members = redisTemplate.opsForZSet().range(revisionsKey(roomId), 0, -1);
            List<Long> revisions = new ArrayList<>();
            if (members != null) {
                members.forEach(m -> revisions.add(Long.parseLong(m)));
            }
            return revisions;
        });
    }

    @Override
    public CompletableFuture<Void> deleteRevision(String roomId, long revision) {
        return async("deleteRevision", roomId, () -> {
            redisTemplate.delete(List.of(
                    candidatesKey(roomId, revision, CandidateRole.OFFERER),
                    candidatesKey(roomId, revision, CandidateRole.ANSWERER)));
            redisTemplate.opsForZSet().remove(revisionsKey(roomId), String.valueOf(revision));
            log.debug("Deleted revision {} artifacts for room={}", revision, roomId);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> deleteLegacyCandidates(String roomId) {
        return async("deleteLegacyCandidates", roomId, () -> {
            redisTemplate.delete(List.of(
                    legacyCandidatesKey(roomId, CandidateRole.OFFERER),
                    legacyCandidatesKey(roomId, CandidateRole.ANSWERER)));
            return null;
        });
    }

    // side-channel descriptions

    @Override
    public CompletableFuture<Void> writeDescription(String roomId, DescriptionKind kind, SdpPayload description) {
        return async("writeDescription", roomId, () -> {
            redisTemplate.opsForValue().set(descriptionKey(roomId, kind), toJson(description));
            return null;
        });
    }

    @Override
    public CompletableFuture<Optional<SdpPayload>> readDescription(String roomId, DescriptionKind kind) {
        return async("readDescription", roomId, () -> Optional.ofNullable(
                fromJson(redisTemplate.opsForValue().get(descriptionKey(roomId, kind)), SdpPayload.class)));
    }

    @Override
    public CompletableFuture<Void> deleteDescriptions(String roomId) {
        return async("deleteDescriptions", roomId, () -> {
            redisTemplate.delete(List.of(
                    descriptionKey(roomId, DescriptionKind.OFFER),
                    descriptionKey(roomId, DescriptionKind.ANSWER)));
            return null;
        });
    }

    // presence

    @Override
    public CompletableFuture<Void> upsertParticipant(String roomId, ParticipantPresence participant) {
        return async("upsertParticipant", roomId, () -> {
            redisTemplate.opsForHash().put(participantsKey(roomId), participant.getUid(), toJson(participant));
            notifyChange(roomId, EVENT_PRESENCE, node -> node.put("uid", participant.getUid()));
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> updateParticipant(String roomId, String uid, Map<String, Object> fields) {
        return async("updateParticipant", roomId, () -> {
            String key = participantsKey(roomId);
            boolean updated = watchedWrite("updateParticipant", roomId, key, ops -> {
                Object json = ops.opsForHash().get(key, uid);
                if (json == null) {
                    return false;
                }
                ParticipantPresence merged = merge(fromJson(json.toString(), ParticipantPresence.class), uid, fields);
                String mergedJson = toJson(merged);
                ops.multi();
                ops.opsForHash().put(key, uid, mergedJson);
                return true;
            });
            if (!updated) {
                throw new SignalingStoreException("No participant " + uid + " in room " + roomId);
            }
            notifyChange(roomId, EVENT_PRESENCE, node -> node.put("uid", uid));
            return null;
        });
    }

    private ParticipantPresence merge(ParticipantPresence existing, String uid, Map<String, Object> fields) {
        try {
            return objectMapper.updateValue(existing, fields);
        } catch (JsonProcessingException e) {
            throw new SignalingStoreException("Invalid participant update for " + uid, e);
        }
    }

    @Override
    public CompletableFuture<Void> deleteParticipant(String roomId, String uid) {
        return async("deleteParticipant", roomId, () -> {
            Long removed = redisTemplate.opsForHash().delete(participantsKey(roomId), uid);
            if (removed != null && removed > 0) {
                notifyChange(roomId, EVENT_PRESENCE, node -> node.put("uid", uid));
            }
            return null;
        });
    }

    @Override
    public CompletableFuture<List<ParticipantPresence>> listParticipants(String roomId) {
        return async("listParticipants", roomId, () -> loadParticipants(roomId));
    }

    @Override
    public CompletableFuture<Void> deleteAllParticipants(String roomId) {
        return async("deleteAllParticipants", roomId, () -> {
            Set<Object> uids = redisTemplate.opsForHash().keys(participantsKey(roomId));
            redisTemplate.delete(participantsKey(roomId));
            if (uids != null) {
                uids.forEach(uid -> notifyChange(roomId, EVENT_PRESENCE, node -> node.put("uid", uid.toString())));
            }
            return null;
        });
    }

    @Override
    public Subscription subscribeParticipants(String roomId, Consumer<PresenceChange> consumer) {
        Set<String> known = new HashSet<>();
        Subscription subscription = listen(roomId, EVENT_PRESENCE, json -> {
            String uid = json.path("uid").asText();
            ParticipantPresence participant = loadParticipant(roomId, uid);
            synchronized (known) {
                if (participant == null) {
                    if (known.remove(uid)) {
                        consumer.accept(new PresenceChange(ChangeType.REMOVED, uid, null));
                    }
                } else {
                    ChangeType type = known.add(uid) ? ChangeType.ADDED : ChangeType.MODIFIED;
                    consumer.accept(new PresenceChange(type, uid, participant));
                }
            }
        });
        return snapshot("subscribeParticipants", roomId, subscription, () -> {
            synchronized (known) {
                for (ParticipantPresence participant : loadParticipants(roomId)) {
                    if (known.add(participant.getUid())) {
                        consumer.accept(new PresenceChange(ChangeType.ADDED, participant.getUid(), participant));
                    }
                }
            }
        });
    }

    private ParticipantPresence loadParticipant(String roomId, String uid) {
        Object json = redisTemplate.opsForHash().get(participantsKey(roomId), uid);
        return json == null ? null : fromJson(json.toString(), ParticipantPresence.class);
    }

    private List<ParticipantPresence> loadParticipants(String roomId) {
        Map<Object, Object> entries = redisTemplate.opsForHash().entries(participantsKey(roomId));
        List<ParticipantPresence> participants = new ArrayList<>();
        if (entries != null) {
            entries.values().forEach(v -> participants.add(fromJson(v.toString(), ParticipantPresence.class)));
        }
        return participants;
    }

    // notifications

    private Subscription listen(String roomId, String eventType, Consumer<JsonNode> handler) {
        ChannelTopic topic = new ChannelTopic(eventsChannel(roomId));
        RedisChangeSubscriber subscriber = new RedisChangeSubscriber(objectMapper, eventType, handler);
        listenerContainer.addMessageListener(subscriber, topic);
        return () -> listenerContainer.removeMessageListener(subscriber, topic);
    }

    private void notifyChange(String roomId, String eventType, Consumer<ObjectNode> details) {
        var payload = objectMapper.createObjectNode().put("type", eventType);
        if (details != null) {
            details.accept(payload);
        }
        try {
            redisTemplate.convertAndSend(eventsChannel(roomId), payload.toString());
        } catch (DataAccessException e) {
            // the write itself succeeded; subscribers catch up on the next change
            log.warn("Failed to publish {} change for room={}: {}", eventType, roomId, e.getMessage());
        }
    }

    /**
     * Delivers the initial state on the store executor once the listener is in
     * place. Nothing is delivered after the subscription was closed.
     */
    private Subscription snapshot(String operation, String roomId, Subscription subscription, Runnable initial) {
        AtomicBoolean closed = new AtomicBoolean();
        async(operation, roomId, () -> {
            if (!closed.get()) {
                initial.run();
            }
            return null;
        }).exceptionally(err -> {
            log.warn("Initial {} read for room={} failed, waiting for the next change: {}", operation, roomId,
                    err.getMessage());
            return null;
        });
        return () -> {
            closed.set(true);
            subscription.close();
        };
    }

    /**
     * WATCH/MULTI/EXEC write retried while the watched key keeps changing under it.
     * {@code body} reads what it needs, then either returns {@code false} to write
     * nothing or opens the transaction with {@code multi()}, queues its writes and
     * returns {@code true}.
     *
     * @return whether the write was committed; {@code false} when the body declined
     */
    private boolean watchedWrite(String operation, String roomId, String key,
            Predicate<RedisOperations<String, String>> body) {
        for (int attempt = 1; attempt <= WATCHED_WRITE_ATTEMPTS; attempt++) {
            Boolean committed = redisTemplate.execute(new SessionCallback<Boolean>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> Boolean execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);
                    if (!body.test(ops)) {
                        ops.unwatch();
                        return null;
                    }
                    List<Object> results = ops.exec();
                    return results != null && !results.isEmpty();
                }
            });
            if (committed == null) {
                return false;
            }
            if (committed) {
                return true;
            }
            log.debug("{} for room={} raced a concurrent write on {}, retrying (attempt {})", operation, roomId,
                    key, attempt);
        }
        throw new SignalingStoreException(operation + " for room " + roomId
                + " kept conflicting with concurrent writes");
    }

    // plumbing

    private <T> CompletableFuture<T> async(String operation, String roomId, Supplier<T> action) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return action.get();
            } catch (DataAccessException e) {
                throw translate(operation, roomId, e);
            }
        }, executor);
    }

    private static SignalingStoreException translate(String operation, String roomId, DataAccessException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains("NOPERM")) {
                log.warn("{} denied for room={}: {}", operation, roomId, t.getMessage());
                return new StorePermissionDeniedException(operation + " denied for room " + roomId);
            }
        }
        log.error("{} failed for room={}: {}", operation, roomId, e.getMessage(), e);
        return new SignalingStoreException(operation + " failed for room " + roomId, e);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SignalingStoreException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new SignalingStoreException("Failed to parse stored " + type.getSimpleName(), e);
        }
    }

    static String sessionKey(String roomId) {
        return CALL_KEY_PREFIX + roomId + SESSION_KEY_SUFFIX;
    }

    static String revisionsKey(String roomId) {
        return CALL_KEY_PREFIX + roomId + REVISIONS_KEY_SUFFIX;
    }

    static String candidatesKey(String roomId, long revision, CandidateRole role) {
        return CALL_KEY_PREFIX + roomId + REVISION_KEY_SEGMENT + revision + ":" + role.key();
    }

    static String legacyCandidatesKey(String roomId, CandidateRole role) {
        return CALL_KEY_PREFIX + roomId + LEGACY_CANDIDATES_KEY_SEGMENT + role.key();
    }

    static String descriptionKey(String roomId, DescriptionKind kind) {
        return CALL_KEY_PREFIX + roomId + DESCRIPTION_KEY_SEGMENT + kind.type();
    }

    static String participantsKey(String roomId) {
        return CALL_KEY_PREFIX + roomId + PARTICIPANTS_KEY_SUFFIX;
    }

    static String eventsChannel(String roomId) {
        return CALL_KEY_PREFIX + roomId + EVENTS_CHANNEL_SUFFIX;
    }
}
