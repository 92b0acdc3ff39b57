package com.odin.call_signaling_service.transport;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CandidatePairStats {
    private String id;
    private String state;              // frozen, waiting, in-progress, failed, succeeded
    private boolean nominated;
    private Double currentRoundTripTime;

    public boolean isSucceeded() {
        return "succeeded".equals(state);
    }
}
