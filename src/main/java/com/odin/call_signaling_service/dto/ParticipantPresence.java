package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.call_signaling_service.enums.ParticipantStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ParticipantPresence {

    private String uid;
    private String displayName;
    private String photoUrl;

    private boolean hasAudio;
    private boolean hasVideo;
    private boolean screenSharing;
    private boolean muted;
    private boolean deafened;
    private boolean speaking;

    private ParticipantStatus status;
    private String streamId;          // transport-level stream carrying this participant's media
    private Long joinedAt;
    private Long lastHeartbeat;

    private RenegotiationRequest renegotiationRequest;

    @JsonIgnore
    public boolean isActive() {
        return status == ParticipantStatus.ACTIVE;
    }
}
