package com.odin.call_signaling_service.transport;

import java.util.concurrent.CompletableFuture;

import com.odin.call_signaling_service.dto.IceCandidatePayload;
import com.odin.call_signaling_service.dto.SdpPayload;

/**
 * Standards-based peer-to-peer media connection, treated as an opaque async
 * service. Only {@code type} and {@code sdp} of an {@link SdpPayload} are
 * meaningful to the transport.
 */
public interface MediaTransport {

    CompletableFuture<SdpPayload> createOffer(boolean iceRestart);

    CompletableFuture<SdpPayload> createAnswer();

    CompletableFuture<Void> setLocalDescription(SdpPayload description);

    CompletableFuture<Void> setRemoteDescription(SdpPayload description);

    /**
     * Drops a local or remote offer that was applied but never completed,
     * returning the signaling state to stable.
     */
    CompletableFuture<Void> rollbackLocalDescription();

    CompletableFuture<Void> addIceCandidate(IceCandidatePayload candidate);

    void restartIce();

    CompletableFuture<TransportStats> getStats();

    void addTrack(MediaTrack track);

    void removeTrack(MediaTrack track);

    SignalingState getSignalingState();

    PeerConnectionState getConnectionState();

    boolean hasRemoteDescription();

    void close();
}
