package com.odin.call_signaling_service.exception;

import com.odin.call_signaling_service.transport.MediaKind;

import lombok.Getter;

@Getter
public class MediaAcquisitionException extends RuntimeException {

    private final MediaKind kind;

    public MediaAcquisitionException(MediaKind kind, Throwable cause) {
        super("Could not acquire " + kind.name().toLowerCase() + " track", cause);
        this.kind = kind;
    }
}
