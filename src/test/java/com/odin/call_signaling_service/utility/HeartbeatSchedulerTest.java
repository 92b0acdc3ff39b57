package com.odin.call_signaling_service.utility;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.odin.call_signaling_service.call.CallSession;
import com.odin.call_signaling_service.service.CallSessionRegistryService;

class HeartbeatSchedulerTest {

    @Test
    void everyActiveSessionIsRefreshed() {
        CallSessionRegistryService registry = mock(CallSessionRegistryService.class);
        CallSession first = mock(CallSession.class);
        CallSession second = mock(CallSession.class);
        when(registry.activeSessions()).thenReturn(List.of(first, second));

        new HeartbeatScheduler(registry).refreshPresence();

        verify(first).heartbeat();
        verify(second).heartbeat();
    }

    @Test
    void nothingHappensWithoutSessions() {
        CallSessionRegistryService registry = mock(CallSessionRegistryService.class);
        when(registry.activeSessions()).thenReturn(List.of());

        new HeartbeatScheduler(registry).refreshPresence();

        verify(registry).activeSessions();
        verifyNoMoreInteractions(registry);
    }
}
