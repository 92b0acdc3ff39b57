package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One side of the offer/answer exchange as stored in the session document.
 * <p>
 * {@code sdp} is the inline copy. When {@code externalized} is set, the full
 * description was also written to the side channel and the inline copy may be
 * absent for large payloads.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SdpPayload {
    private String type;          // offer / answer
    private String sdp;
    private long revision;
    private Long updatedAt;
    private String updatedBy;
    private boolean externalized;

    public static SdpPayload of(String type, String sdp) {
        return SdpPayload.builder().type(type).sdp(sdp).build();
    }

    public int sdpLength() {
        return sdp == null ? 0 : sdp.length();
    }
}
