package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_CAMERA_OFF;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_CAMERA_ON;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_MUTE_TOGGLED;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_OFFERER_LEFT;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_PEER_LEFT;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_SCREEN_OFF;
import static com.odin.call_signaling_service.constants.ApplicationConstants.REASON_SCREEN_ON;
import static com.odin.call_signaling_service.constants.ApplicationConstants.SOURCE_MEDIA;
import static com.odin.call_signaling_service.constants.ApplicationConstants.SOURCE_SESSION;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.odin.call_signaling_service.config.CallEngineProperties;
import com.odin.call_signaling_service.dto.DiagnosticEvent;
import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.ParticipantPresence;
import com.odin.call_signaling_service.dto.ParticipantProfile;
import com.odin.call_signaling_service.dto.PresenceChange;
import com.odin.call_signaling_service.enums.CallErrorCode;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.ChangeType;
import com.odin.call_signaling_service.enums.ConnectionQuality;
import com.odin.call_signaling_service.enums.ParticipantStatus;
import com.odin.call_signaling_service.exception.MediaAcquisitionException;
import com.odin.call_signaling_service.repo.SignalingRepository;
import com.odin.call_signaling_service.repo.Subscription;
import com.odin.call_signaling_service.transport.IceConnectionState;
import com.odin.call_signaling_service.transport.IceServerConfig;
import com.odin.call_signaling_service.transport.IceTransportPolicy;
import com.odin.call_signaling_service.transport.LocalMediaSource;
import com.odin.call_signaling_service.transport.MediaKind;
import com.odin.call_signaling_service.transport.MediaTrack;
import com.odin.call_signaling_service.transport.MediaTransport;
import com.odin.call_signaling_service.transport.MediaTransportFactory;
import com.odin.call_signaling_service.transport.MediaTransportListener;
import com.odin.call_signaling_service.transport.PeerConnectionState;
import com.odin.call_signaling_service.transport.SignalingState;
import com.odin.call_signaling_service.transport.TransportConfiguration;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * One endpoint's participation in a room's call. Owns the negotiation state,
 * the media transport and every collaborator; all of them run on the
 * session's {@link CallEventLoop}.
 * <p>
 * Public intents may be called from any thread; they are queued onto the loop
 * and complete when their immediate effect is done.
 */
@Slf4j
@Getter
public class CallSession {

    private final String roomId;
    private final ParticipantProfile profile;
    private final CallEngineProperties properties;
    private final SignalingRepository repository;
    private final CallEventLoop loop;
    private final DiagnosticLog diagnostics;
    private final NegotiationState state;
    private final MediaIntent intent = new MediaIntent();
    private final String streamId;

    private final CandidateRevisionLedger ledger;
    private final CandidateTrickleBus trickleBus;
    private final DescriptionSideChannel sideChannel;
    private final RoleArbitrator arbitrator;
    private final RenegotiationScheduler scheduler;
    private final ConnectionHealthMonitor healthMonitor;
    private final ArtifactGarbageCollector garbageCollector;
    private final PresenceRegistry presence;

    @Getter(AccessLevel.NONE)
    private final MediaTransportFactory transportFactory;
    @Getter(AccessLevel.NONE)
    private final LocalMediaSource mediaSource;
    @Getter(AccessLevel.NONE)
    private final CallSessionListener listener;
    @Getter(AccessLevel.NONE)
    private final Consumer<CallSession> terminationHandler;
    @Getter(AccessLevel.NONE)
    private final Map<MediaKind, MediaTrack> localTracks = new EnumMap<>(MediaKind.class);
    @Getter(AccessLevel.NONE)
    private Subscription sessionSubscription = Subscription.NONE;

    private MediaTransport transport;
    private long transportGeneration;
    private volatile boolean joined;
    private volatile CallStatus status = CallStatus.IDLE;
    private volatile String statusText = CallStatus.IDLE.defaultText();
    private volatile ConnectionQuality quality = ConnectionQuality.DISCONNECTED;

    @Builder
    private CallSession(String roomId, ParticipantProfile profile, CallEngineProperties properties,
            SignalingRepository repository, MediaTransportFactory transportFactory, LocalMediaSource mediaSource,
            CallEventLoop loop, CallSessionListener listener, DiagnosticSink diagnosticSink,
            Consumer<CallSession> terminationHandler) {
        this.roomId = roomId;
        this.profile = profile;
        this.properties = properties;
        this.repository = repository;
        this.transportFactory = transportFactory;
        this.mediaSource = mediaSource;
        this.loop = loop;
        this.listener = listener == null ? CallSessionListener.NOOP : listener;
        this.terminationHandler = terminationHandler == null ? ended -> { } : terminationHandler;
        this.diagnostics = new DiagnosticLog(roomId, profile.getUid(), properties.getDiagnosticCapacity(),
                loop::now, diagnosticSink == null ? DiagnosticSink.NOOP : diagnosticSink);
        this.state = new NegotiationState(properties.isSideChannelEnabled());
        this.streamId = "stream-" + profile.getUid();

        this.ledger = new CandidateRevisionLedger(this);
        this.trickleBus = new CandidateTrickleBus(this);
        this.sideChannel = new DescriptionSideChannel(this);
        this.arbitrator = new RoleArbitrator(this);
        this.scheduler = new RenegotiationScheduler(this);
        this.healthMonitor = new ConnectionHealthMonitor(this);
        this.garbageCollector = new ArtifactGarbageCollector(this);
        this.presence = new PresenceRegistry(this);

        if (loop instanceof SerialCallEventLoop) {
            ((SerialCallEventLoop) loop).setFailureHandler(
                    e -> diagnostics.error(SOURCE_SESSION, "event loop task failed", e));
        }
    }

    public String getUid() {
        return profile.getUid();
    }

    SessionTimer newTimer(String name) {
        return new SessionTimer(loop, name);
    }

    boolean isCurrent(long generation) {
        return generation == transportGeneration;
    }

    // intents

    public CompletableFuture<Void> join() {
        return submit(() -> connect(false));
    }

    public CompletableFuture<Void> leave() {
        return submit(this::disconnect);
    }

    public CompletableFuture<Void> setMuted(boolean muted) {
        return submit(() -> {
            intent.setMuted(muted);
            if (!muted) {
                intent.setDeafened(false);
            }
            return applyAudioIntent();
        });
    }

    /**
     * Deafening also mutes; undeafening leaves the mute state as it is.
     */
    public CompletableFuture<Void> setDeafened(boolean deafened) {
        return submit(() -> {
            intent.setDeafened(deafened);
            if (deafened) {
                intent.setMuted(true);
            }
            return applyAudioIntent();
        });
    }

    public CompletableFuture<Void> setCameraEnabled(boolean enabled) {
        return submit(() -> toggleTrack(MediaKind.VIDEO, enabled));
    }

    public CompletableFuture<Void> setScreenSharing(boolean sharing) {
        return submit(() -> toggleTrack(MediaKind.SCREEN, sharing));
    }

    /**
     * Voice activity of the local user, as detected by the host's audio level meter.
     */
    public CompletableFuture<Void> setSpeaking(boolean speaking) {
        return submit(() -> {
            if (joined) {
                presence.setSpeaking(speaking);
            }
            return CompletableFuture.completedFuture(null);
        });
    }

    /**
     * User-requested reconnect: forgets previous attempts and rebuilds at once.
     */
    public CompletableFuture<Void> reconnect() {
        return submit(() -> {
            if (joined) {
                healthMonitor.manualReconnect();
            }
            return CompletableFuture.completedFuture(null);
        });
    }

    public CompletableFuture<Void> kick(String uid) {
        return submit(() -> presence.kick(uid));
    }

    public void heartbeat() {
        loop.execute(() -> {
            if (joined) {
                presence.heartbeat();
            }
        });
    }

    public List<ParticipantPresence> getRoster() {
        return presence.rosterSnapshot();
    }

    public List<DiagnosticEvent> getDiagnosticsSnapshot() {
        return diagnostics.snapshot();
    }

    private CompletableFuture<Void> submit(Supplier<CompletableFuture<Void>> action) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        loop.execute(() -> {
            try {
                action.get().whenComplete((v, err) -> {
                    if (err != null) {
                        result.completeExceptionally(unwrap(err));
                    } else {
                        result.complete(null);
                    }
                });
            } catch (RuntimeException e) {
                log.error("Call intent failed in room {}: {}", roomId, e.getMessage(), e);
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    // lifecycle

    CompletableFuture<Void> connect(boolean rejoin) {
        if (joined && !rejoin) {
            return CompletableFuture.completedFuture(null);
        }
        joined = true;
        if (rejoin) {
            setStatus(CallStatus.RECONNECTING, statusText);
        } else {
            setStatus(CallStatus.JOINING);
        }
        state.setRestoreMediaAfterAnswer(intent.isCameraOn() || intent.isScreenSharing());
        return garbageCollector.guardOversizedSession()
                .thenComposeAsync(v -> presence.join(), loop)
                .thenComposeAsync(v -> {
                    openTransport();
                    return restoreMedia();
                }, loop)
                .thenRunAsync(() -> {
                    if (!joined) {
                        return;
                    }
                    arbitrator.negotiateOnJoin();
                    sessionSubscription = repository.subscribeSession(roomId,
                            doc -> loop.execute(() -> arbitrator.onSessionDocument(doc)));
                    healthMonitor.start();
                    if (!rejoin) {
                        setStatus(CallStatus.CONNECTING);
                    }
                    log.info("Joined room {} as {}", roomId, getUid());
                    diagnostics.info(SOURCE_SESSION, rejoin ? "rejoined room" : "joined room");
                }, loop)
                .whenCompleteAsync((v, err) -> {
                    if (err == null) {
                        return;
                    }
                    Throwable cause = unwrap(err);
                    log.error("Joining room {} failed: {}", roomId, cause.getMessage(), cause);
                    diagnostics.error(SOURCE_SESSION, "join failed", cause);
                    if (rejoin && joined) {
                        healthMonitor.scheduleFullReconnect("rejoin failed");
                    } else {
                        setStatus(CallStatus.FAILED);
                        reportError(new CallError(CallErrorCode.JOIN_FAILED, cause.getMessage(), cause));
                        terminated();
                    }
                }, loop);
    }

    CompletableFuture<Void> disconnect() {
        if (!joined) {
            return CompletableFuture.completedFuture(null);
        }
        joined = false;
        stopNegotiation();
        closeTransport();
        releaseTracks();
        state.reset();
        setStatus(CallStatus.LEFT);
        updateQuality(ConnectionQuality.DISCONNECTED);
        return garbageCollector.onLeave().whenCompleteAsync((v, err) -> {
            log.info("Left room {}", roomId);
            diagnostics.info(SOURCE_SESSION, "left room");
        }, loop);
    }

    /**
     * Tears down transport and presence and joins again from scratch, keeping
     * the user's media intent.
     *
     * @param resetDocument also delete the shared session document
     */
    void fullReconnect(boolean resetDocument) {
        if (!joined) {
            return;
        }
        log.warn("Full reconnect in room {} (resetDocument={})", roomId, resetDocument);
        diagnostics.warn(SOURCE_SESSION, "full reconnect" + (resetDocument ? " with session reset" : ""), null);
        stopNegotiation();
        closeTransport();
        releaseTracks();
        presence.removeSelf()
                .thenComposeAsync(v -> resetDocument
                        ? garbageCollector.purgeSession()
                        : CompletableFuture.<Void>completedFuture(null), loop)
                .thenComposeAsync(v -> {
                    if (!joined) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    state.reset();
                    return connect(true);
                }, loop)
                .whenCompleteAsync((v, err) -> {
                    if (err != null) {
                        log.warn("Reconnect in room {} did not complete: {}", roomId, unwrap(err).getMessage());
                    }
                }, loop);
    }

    private void stopNegotiation() {
        scheduler.stop();
        healthMonitor.stop();
        sessionSubscription.close();
        sessionSubscription = Subscription.NONE;
        ledger.close();
        trickleBus.reset();
        presence.stop();
    }

    private void openTransport() {
        transportGeneration++;
        TransportConfiguration configuration = buildTransportConfiguration();
        transport = transportFactory.create(configuration, new TransportEvents(transportGeneration));
        localTracks.values().forEach(transport::addTrack);
        log.info("Opened media transport #{} in room {} (policy={}, fallbackRelay={})", transportGeneration,
                roomId, configuration.getIceTransportPolicy(), configuration.isFallbackRelayActive());
    }

    TransportConfiguration buildTransportConfiguration() {
        List<IceServerConfig> servers = new ArrayList<>(properties.getIceServers());
        boolean fallback = state.isFallbackRelayActive() && properties.getFallbackRelay() != null;
        if (fallback) {
            servers.add(properties.getFallbackRelay());
        }
        return TransportConfiguration.builder()
                .iceServers(servers)
                .iceTransportPolicy(state.isRelayOnly() ? IceTransportPolicy.RELAY : IceTransportPolicy.ALL)
                .iceCandidatePoolSize(properties.getIceCandidatePoolSize())
                .localStreamId(streamId)
                .fallbackRelayActive(fallback)
                .build();
    }

    private void closeTransport() {
        if (transport == null) {
            return;
        }
        transportGeneration++;
        try {
            transport.close();
        } catch (RuntimeException e) {
            log.warn("Closing media transport in room {} failed: {}", roomId, e.getMessage());
        }
    }

    // media

    private CompletableFuture<Void> restoreMedia() {
        CompletableFuture<Void> chain = acquireTrack(MediaKind.AUDIO).thenAccept(track -> {
            if (track != null) {
                track.setEnabled(!intent.isMuted());
            }
        });
        if (intent.isCameraOn()) {
            chain = chain.thenComposeAsync(v -> acquireTrack(MediaKind.VIDEO), loop).thenAccept(track -> { });
        }
        if (intent.isScreenSharing()) {
            chain = chain.thenComposeAsync(v -> acquireTrack(MediaKind.SCREEN), loop).thenAccept(track -> { });
        }
        return chain;
    }

    private CompletableFuture<MediaTrack> acquireTrack(MediaKind kind) {
        return mediaSource.acquire(kind).handleAsync((track, err) -> {
            if (err != null) {
                onMediaFailure(kind, unwrap(err));
                return null;
            }
            if (!joined) {
                track.stop();
                return null;
            }
            MediaTrack previous = localTracks.put(kind, track);
            if (previous != null) {
                transport.removeTrack(previous);
                previous.stop();
            }
            transport.addTrack(track);
            return track;
        }, loop);
    }

    private void onMediaFailure(MediaKind kind, Throwable cause) {
        switch (kind) {
            case AUDIO:
                intent.setMuted(true);
                break;
            case VIDEO:
                intent.setCameraOn(false);
                break;
            case SCREEN:
                intent.setScreenSharing(false);
                break;
            default:
                break;
        }
        MediaAcquisitionException error = new MediaAcquisitionException(kind, cause);
        log.warn("{} in room {}: {}", error.getMessage(), roomId, cause.getMessage());
        diagnostics.error(SOURCE_MEDIA, error.getMessage(), cause);
        reportError(new CallError(CallErrorCode.MEDIA_ACQUISITION_FAILED, error.getMessage(), error));
        presence.publishMediaFlags();
    }

    private CompletableFuture<Void> applyAudioIntent() {
        presence.publishMediaFlags();
        MediaTrack audio = localTracks.get(MediaKind.AUDIO);
        if (audio != null) {
            audio.setEnabled(!intent.isMuted());
            return CompletableFuture.completedFuture(null);
        }
        if (intent.isMuted() || !joined) {
            return CompletableFuture.completedFuture(null);
        }
        // no capture yet (e.g. the microphone was unavailable at join)
        return acquireTrack(MediaKind.AUDIO).thenAcceptAsync(track -> {
            if (track != null) {
                scheduler.request(REASON_MUTE_TOGGLED, false);
            }
        }, loop);
    }

    private CompletableFuture<Void> toggleTrack(MediaKind kind, boolean enabled) {
        boolean video = kind == MediaKind.VIDEO;
        if (video) {
            intent.setCameraOn(enabled);
        } else {
            intent.setScreenSharing(enabled);
        }
        if (!joined) {
            return CompletableFuture.completedFuture(null);
        }
        if (enabled) {
            if (localTracks.containsKey(kind)) {
                return CompletableFuture.completedFuture(null);
            }
            return acquireTrack(kind).thenAcceptAsync(track -> {
                if (track != null) {
                    presence.publishMediaFlags();
                    scheduler.request(video ? REASON_CAMERA_ON : REASON_SCREEN_ON, true);
                }
            }, loop);
        }
        MediaTrack track = localTracks.remove(kind);
        if (track != null) {
            transport.removeTrack(track);
            track.stop();
            scheduler.request(video ? REASON_CAMERA_OFF : REASON_SCREEN_OFF, true);
        }
        presence.publishMediaFlags();
        return CompletableFuture.completedFuture(null);
    }

    private void releaseTracks() {
        localTracks.values().forEach(MediaTrack::stop);
        localTracks.clear();
    }

    public boolean hasLocalTrack(MediaKind kind) {
        return localTracks.containsKey(kind);
    }

    // presence

    void onPresenceChange(PresenceChange change, ParticipantPresence previous) {
        String uid = change.getUid();
        ParticipantPresence participant = change.getParticipant();
        if (getUid().equals(uid)) {
            if (participant != null && participant.getStatus() == ParticipantStatus.REMOVED) {
                log.warn("Removed from room {} by another participant", roomId);
                diagnostics.warn(SOURCE_SESSION, "removed from call", null);
                reportError(new CallError(CallErrorCode.REMOVED_FROM_CALL, "Removed from the call", null));
                disconnect();
                terminated();
            }
            return;
        }
        listener.onRosterChanged(presence.rosterSnapshot());
        if (participant != null && participant.getRenegotiationRequest() != null) {
            scheduler.onRemoteRequest(uid, participant.getRenegotiationRequest());
        }
        boolean departed = change.getType() == ChangeType.REMOVED
                || (participant != null && !participant.isActive());
        if (!departed) {
            return;
        }
        if (previous == null || !previous.isActive()) {
            return;
        }
        log.info("Participant {} left room {}", uid, roomId);
        if (!state.isOfferer() && uid.equals(state.getCurrentOfferAuthor())) {
            scheduler.request(REASON_OFFERER_LEFT, true);
        } else if (state.isOfferer() && uid.equals(state.getAnsweredPeerUid())) {
            state.setAnsweredPeerUid(null);
            scheduler.request(REASON_PEER_LEFT, false);
        }
    }

    // presentation

    void setStatus(CallStatus newStatus) {
        setStatus(newStatus, newStatus.defaultText());
    }

    void setStatus(CallStatus newStatus, String text) {
        if (newStatus == status && text.equals(statusText)) {
            return;
        }
        status = newStatus;
        statusText = text;
        listener.onStatusChanged(newStatus, text);
    }

    void updateQuality(ConnectionQuality newQuality) {
        if (newQuality == quality) {
            return;
        }
        quality = newQuality;
        listener.onQualityChanged(newQuality);
    }

    void reportError(CallError error) {
        listener.onError(error);
    }

    /**
     * Tells the owner the session ended without a {@link #leave()} call: it
     * was removed from the room or gave up connecting.
     */
    void terminated() {
        try {
            terminationHandler.accept(this);
        } catch (RuntimeException e) {
            log.warn("Termination handler of room {} failed: {}", roomId, e.getMessage(), e);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Transport callbacks, hopped onto the loop and dropped once the transport
     * they came from has been replaced.
     */
    private final class TransportEvents implements MediaTransportListener {

        private final long generation;

        private TransportEvents(long generation) {
            this.generation = generation;
        }

        private void dispatch(Runnable event) {
            loop.execute(() -> {
                if (joined && isCurrent(generation)) {
                    event.run();
                }
            });
        }

        @Override
        public void onSignalingStateChange(SignalingState signalingState) {
            dispatch(() -> {
                log.debug("Signaling state {} in room {}", signalingState, roomId);
                if (signalingState.isIdle()) {
                    scheduler.onSignalingStable();
                }
            });
        }

        @Override
        public void onConnectionStateChange(PeerConnectionState connectionState) {
            dispatch(() -> healthMonitor.onConnectionState(connectionState));
        }

        @Override
        public void onIceConnectionStateChange(IceConnectionState iceState) {
            dispatch(() -> log.debug("ICE connection state {} in room {}", iceState, roomId));
        }

        @Override
        public void onLocalCandidate(IceCandidatePayload candidate) {
            dispatch(() -> trickleBus.onLocalCandidate(candidate));
        }

        @Override
        public void onCandidateError(String url, int errorCode, String errorText) {
            dispatch(() -> healthMonitor.onCandidateError(url, errorCode, errorText));
        }

        @Override
        public void onRemoteTrack(String remoteStreamId, String trackId, MediaKind kind) {
            dispatch(() -> {
                String owner = presence.findByStreamId(remoteStreamId)
                        .map(ParticipantPresence::getUid)
                        .orElse(null);
                log.info("Remote {} track {} from {} in room {}", kind, trackId, owner, roomId);
                listener.onRemoteTrack(owner, remoteStreamId, trackId, kind);
            });
        }
    }
}
