package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.odin.call_signaling_service.enums.DiagnosticSeverity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entry of the per-session diagnostic log. Also the Kafka payload when
 * diagnostics shipping is enabled.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagnosticEvent {
    private long id;
    private Long timestamp;
    private String roomId;
    private String uid;
    private String source;
    private String message;
    private DiagnosticSeverity severity;
    private String details;
}
