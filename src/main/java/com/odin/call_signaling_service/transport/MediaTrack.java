package com.odin.call_signaling_service.transport;

/**
 * Handle to a locally captured track. Capture itself lives outside the engine.
 */
public interface MediaTrack {

    String getId();

    MediaKind getKind();

    void setEnabled(boolean enabled);

    boolean isEnabled();

    void stop();
}
