package com.odin.call_signaling_service.utility;

import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.odin.call_signaling_service.call.CallSession;
import com.odin.call_signaling_service.service.CallSessionRegistryService;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
public class HeartbeatScheduler {

    private final CallSessionRegistryService registryService;

    public HeartbeatScheduler(CallSessionRegistryService registryService) {
        this.registryService = registryService;
    }

    @Scheduled(fixedRateString = "${call.engine.heartbeat-interval-ms:10000}")
    public void refreshPresence() {
        List<CallSession> activeSessions = registryService.activeSessions();
        log.debug("HeartbeatScheduler: refreshing presence for {} active call sessions", activeSessions.size());
        activeSessions.forEach(CallSession::heartbeat);
    }
}
