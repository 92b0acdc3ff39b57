package com.odin.call_signaling_service.transport;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SdpPayload;

/**
 * Scripted transport: follows the offer/answer signaling state machine,
 * gathers a fixed number of host candidates after every local description and
 * only changes connectivity when the test says so.
 */
public class FakeMediaTransport implements MediaTransport {

    private static final TransportStats HEALTHY = TransportStats.builder()
            .candidatePairs(List.of(new CandidatePairStats("pair-1", "succeeded", true, 0.04)))
            .packetLoss(0.0)
            .jitterSeconds(0.005)
            .build();

    private final String label;
    private final TransportConfiguration configuration;
    private final MediaTransportListener listener;

    private SignalingState signalingState = SignalingState.NEW;
    private PeerConnectionState connectionState = PeerConnectionState.NEW;
    private SdpPayload localDescription;
    private SdpPayload remoteDescription;
    private SdpPayload stableRemoteDescription;
    private final List<IceCandidatePayload> appliedCandidates = new ArrayList<>();
    private final List<SdpPayload> appliedRemoteDescriptions = new ArrayList<>();
    private final List<MediaTrack> tracks = new ArrayList<>();
    private TransportStats stats = HEALTHY;
    private int candidatesPerDescription = 2;
    private int gathered;
    private int offerCount;
    private int answerCount;
    private int restartCount;
    private int failNextCandidateAdds;
    private boolean failNextRemoteDescription;
    private boolean closed;

    public FakeMediaTransport(String label, TransportConfiguration configuration, MediaTransportListener listener) {
        this.label = label;
        this.configuration = configuration;
        this.listener = listener;
    }

    @Override
    public CompletableFuture<SdpPayload> createOffer(boolean iceRestart) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("transport closed"));
        }
        offerCount++;
        String sdp = "v=0\r\no=" + label + " offer " + offerCount + (iceRestart ? " ice-restart" : "")
                + "\r\n" + "m=tracks " + tracks.size();
        return CompletableFuture.completedFuture(SdpPayload.of("offer", sdp));
    }

    @Override
    public CompletableFuture<SdpPayload> createAnswer() {
        if (closed || signalingState != SignalingState.HAVE_REMOTE_OFFER) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("cannot answer in " + signalingState));
        }
        answerCount++;
        return CompletableFuture.completedFuture(SdpPayload.of("answer", "v=0\r\no=" + label + " answer " + answerCount));
    }

    @Override
    public CompletableFuture<Void> setLocalDescription(SdpPayload description) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("transport closed"));
        }
        if ("offer".equals(description.getType())) {
            if (signalingState == SignalingState.HAVE_REMOTE_OFFER) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("local offer in " + signalingState));
            }
            localDescription = description;
            changeSignaling(SignalingState.HAVE_LOCAL_OFFER);
        } else {
            if (signalingState != SignalingState.HAVE_REMOTE_OFFER) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("local answer in " + signalingState));
            }
            localDescription = description;
            stableRemoteDescription = remoteDescription;
            changeSignaling(SignalingState.STABLE);
        }
        gatherCandidates();
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> setRemoteDescription(SdpPayload description) {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("transport closed"));
        }
        if (failNextRemoteDescription) {
            failNextRemoteDescription = false;
            return CompletableFuture.failedFuture(new IllegalStateException("malformed description"));
        }
        if ("offer".equals(description.getType())) {
            if (!signalingState.isIdle()) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("remote offer in " + signalingState));
            }
            remoteDescription = description;
            appliedRemoteDescriptions.add(description);
            changeSignaling(SignalingState.HAVE_REMOTE_OFFER);
        } else {
            if (signalingState != SignalingState.HAVE_LOCAL_OFFER) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("remote answer in " + signalingState));
            }
            remoteDescription = description;
            stableRemoteDescription = description;
            appliedRemoteDescriptions.add(description);
            changeSignaling(SignalingState.STABLE);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> rollbackLocalDescription() {
        if (signalingState == SignalingState.HAVE_REMOTE_OFFER) {
            remoteDescription = stableRemoteDescription;
            changeSignaling(SignalingState.STABLE);
        } else if (signalingState == SignalingState.HAVE_LOCAL_OFFER) {
            changeSignaling(SignalingState.STABLE);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> addIceCandidate(IceCandidatePayload candidate) {
        if (closed || remoteDescription == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("no remote description"));
        }
        if (failNextCandidateAdds > 0) {
            failNextCandidateAdds--;
            return CompletableFuture.failedFuture(new IllegalStateException("candidate rejected"));
        }
        appliedCandidates.add(candidate);
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void restartIce() {
        restartCount++;
    }

    @Override
    public CompletableFuture<TransportStats> getStats() {
        return CompletableFuture.completedFuture(stats);
    }

    @Override
    public void addTrack(MediaTrack track) {
        tracks.add(track);
    }

    @Override
    public void removeTrack(MediaTrack track) {
        tracks.remove(track);
    }

    @Override
    public SignalingState getSignalingState() {
        return signalingState;
    }

    @Override
    public PeerConnectionState getConnectionState() {
        return connectionState;
    }

    @Override
    public boolean hasRemoteDescription() {
        return remoteDescription != null;
    }

    @Override
    public void close() {
        closed = true;
        signalingState = SignalingState.CLOSED;
        connectionState = PeerConnectionState.CLOSED;
    }

    private void changeSignaling(SignalingState next) {
        signalingState = next;
        listener.onSignalingStateChange(next);
    }

    private void gatherCandidates() {
        for (int i = 0; i < candidatesPerDescription; i++) {
            gathered++;
            String candidate = "candidate:" + gathered + " 1 udp 2122260223 192.0.2." + gathered + " "
                    + (50000 + gathered) + " typ host generation 0 ufrag " + label;
            listener.onLocalCandidate(IceCandidatePayload.of(candidate, "0", 0));
        }
    }

    // test controls

    public void connect() {
        changeConnection(PeerConnectionState.CONNECTED);
    }

    public void disconnect() {
        changeConnection(PeerConnectionState.DISCONNECTED);
    }

    public void fail() {
        changeConnection(PeerConnectionState.FAILED);
    }

    public void changeConnection(PeerConnectionState next) {
        connectionState = next;
        listener.onConnectionStateChange(next);
    }

    public void emitCandidateError(String url, int errorCode) {
        listener.onCandidateError(url, errorCode, "STUN binding request timed out");
    }

    public void emitRemoteTrack(String streamId, String trackId, MediaKind kind) {
        listener.onRemoteTrack(streamId, trackId, kind);
    }

    public void setStats(TransportStats stats) {
        this.stats = stats;
    }

    public void setCandidatesPerDescription(int candidatesPerDescription) {
        this.candidatesPerDescription = candidatesPerDescription;
    }

    public void failNextCandidateAdds(int count) {
        this.failNextCandidateAdds = count;
    }

    public void failNextRemoteDescription() {
        this.failNextRemoteDescription = true;
    }

    public TransportConfiguration getConfiguration() {
        return configuration;
    }

    public List<IceCandidatePayload> getAppliedCandidates() {
        return appliedCandidates;
    }

    public List<SdpPayload> getAppliedRemoteDescriptions() {
        return appliedRemoteDescriptions;
    }

    public SdpPayload getLocalDescription() {
        return localDescription;
    }

    public List<MediaTrack> getTracks() {
        return tracks;
    }

    public int getOfferCount() {
        return offerCount;
    }

    public int getRestartCount() {
        return restartCount;
    }

    public boolean isClosed() {
        return closed;
    }
}
