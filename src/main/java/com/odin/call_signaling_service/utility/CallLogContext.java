package com.odin.call_signaling_service.utility;

import org.slf4j.MDC;

import com.odin.call_signaling_service.constants.ApplicationConstants;

public class CallLogContext {

    // Put room and uid of the running call task into MDC
    public static void set(String roomId, String uid) {
        MDC.put(ApplicationConstants.MDC_CALL_ROOM, roomId);
        MDC.put(ApplicationConstants.MDC_CALL_UID, uid);
    }

    public static String getRoom() {
        return MDC.get(ApplicationConstants.MDC_CALL_ROOM);
    }

    // Clear after the task so pooled threads don't leak the context
    public static void clear() {
        MDC.remove(ApplicationConstants.MDC_CALL_ROOM);
        MDC.remove(ApplicationConstants.MDC_CALL_UID);
    }

    private CallLogContext() {
    }
}
