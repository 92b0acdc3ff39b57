package com.odin.call_signaling_service.call;

import java.util.List;

import com.odin.call_signaling_service.dto.ParticipantPresence;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.enums.ConnectionQuality;
import com.odin.call_signaling_service.transport.MediaKind;

/**
 * Presentation sink of a call. Invoked on the session's event loop.
 */
public interface CallSessionListener {

    CallSessionListener NOOP = new CallSessionListener() { };

    default void onStatusChanged(CallStatus status, String statusText) {
    }

    default void onRosterChanged(List<ParticipantPresence> roster) {
    }

    default void onQualityChanged(ConnectionQuality quality) {
    }

    /**
     * @param participantUid owner of the stream, null when no presence record carries it
     */
    default void onRemoteTrack(String participantUid, String streamId, String trackId, MediaKind kind) {
    }

    default void onError(CallError error) {
    }
}
