package com.odin.call_signaling_service.dto;

import com.odin.call_signaling_service.enums.ChangeType;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PresenceChange {
    private ChangeType type;
    private String uid;
    private ParticipantPresence participant;    // null for REMOVED
}
