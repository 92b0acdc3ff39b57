package com.odin.call_signaling_service.transport;

import java.util.concurrent.CompletableFuture;

/**
 * Local device capture (microphone, camera, screen). Acquisition failures
 * complete the future exceptionally.
 */
public interface LocalMediaSource {

    CompletableFuture<MediaTrack> acquire(MediaKind kind);
}
