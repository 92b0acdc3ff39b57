package com.odin.call_signaling_service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Out-of-band ask, written by a non-offerer onto its own presence record, for
 * the current offerer to run a negotiation cycle.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class RenegotiationRequest {
    private String id;
    private String reason;
    private String requestedBy;
    private Long requestedAt;
    private long offerRevision;    // offer revision the requester had answered
}
