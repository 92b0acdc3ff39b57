package com.odin.call_signaling_service.transport;

public interface MediaTransportFactory {

    MediaTransport create(TransportConfiguration configuration, MediaTransportListener listener);
}
