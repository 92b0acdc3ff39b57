package com.odin.call_signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ParticipantStatus {
    @JsonProperty("active") ACTIVE,
    @JsonProperty("left") LEFT,
    @JsonProperty("removed") REMOVED
}
