package com.odin.call_signaling_service.transport;

import java.util.List;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Parameters a fresh {@link MediaTransport} is built with. A new instance is
 * produced for every (re)connect so that relay escalation takes effect.
 */
@Getter
@Builder
@ToString
public class TransportConfiguration {
    private final List<IceServerConfig> iceServers;
    private final IceTransportPolicy iceTransportPolicy;
    private final int iceCandidatePoolSize;
    private final String localStreamId;
    private final boolean fallbackRelayActive;
}
