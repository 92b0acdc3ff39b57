package com.odin.call_signaling_service.call;

import lombok.Data;

/**
 * What the user asked for, restored after every full reconnect.
 */
@Data
public class MediaIntent {
    private boolean muted;
    private boolean deafened;
    private boolean cameraOn;
    private boolean screenSharing;
}
