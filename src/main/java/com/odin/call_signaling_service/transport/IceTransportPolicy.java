package com.odin.call_signaling_service.transport;

public enum IceTransportPolicy {
    ALL,
    RELAY
}
