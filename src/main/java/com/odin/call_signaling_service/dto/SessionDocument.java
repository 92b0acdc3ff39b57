package com.odin.call_signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The single shared record per room through which the two endpoints exchange
 * offer and answer. Replaced as a whole on every new offer.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionDocument {

    private SdpPayload offer;
    private SdpPayload answer;
    private Long createdAt;
    private String createdBy;

    public long offerRevision() {
        return offer == null ? 0L : offer.getRevision();
    }

    public String offerAuthor() {
        return offer == null ? null : offer.getUpdatedBy();
    }

    public boolean hasOffer() {
        return offer != null;
    }
}
