package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IceCandidatePayload {
    private String candidate;
    private String sdpMid;
    private Integer sdpMLineIndex;
    private long revision;
    private String from;
    private Long createdAt;

    public static IceCandidatePayload of(String candidate, String sdpMid, Integer sdpMLineIndex) {
        return IceCandidatePayload.builder()
                .candidate(candidate)
                .sdpMid(sdpMid)
                .sdpMLineIndex(sdpMLineIndex)
                .build();
    }

    /**
     * Structural identity of the candidate within its negotiation generation.
     */
    public String dedupKey() {
        return revision + "|" + sdpMid + "|" + sdpMLineIndex + "|" + candidate;
    }
}
