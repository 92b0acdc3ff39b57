package com.odin.call_signaling_service.transport;

import com.odin.call_signaling_service.dto.IceCandidatePayload;

/**
 * Events raised by a {@link MediaTransport}. Implementations may be called
 * from any thread.
 */
public interface MediaTransportListener {

    void onSignalingStateChange(SignalingState state);

    void onConnectionStateChange(PeerConnectionState state);

    void onIceConnectionStateChange(IceConnectionState state);

    void onLocalCandidate(IceCandidatePayload candidate);

    void onCandidateError(String url, int errorCode, String errorText);

    void onRemoteTrack(String streamId, String trackId, MediaKind kind);
}
