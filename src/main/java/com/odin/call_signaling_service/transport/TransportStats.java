package com.odin.call_signaling_service.transport;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reduced view of the transport statistics report that the health loop reads.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TransportStats {
    private long timestamp;
    @Builder.Default
    private List<CandidatePairStats> candidatePairs = new ArrayList<>();
    private double packetLoss;          // 0..1, worst inbound stream
    private Double jitterSeconds;
    private long bytesReceived;
    private long bytesSent;

    public boolean hasActiveSucceededPair() {
        return candidatePairs.stream().anyMatch(p -> p.isSucceeded() && p.isNominated());
    }

    public Double activeRoundTripTime() {
        return candidatePairs.stream()
                .filter(p -> p.isSucceeded() && p.isNominated())
                .map(CandidatePairStats::getCurrentRoundTripTime)
                .filter(rtt -> rtt != null)
                .findFirst()
                .orElse(null);
    }
}
