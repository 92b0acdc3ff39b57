package com.odin.call_signaling_service.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ParticipantProfile {
    private String uid;
    private String displayName;
    private String photoUrl;
}
