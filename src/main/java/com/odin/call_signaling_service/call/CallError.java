package com.odin.call_signaling_service.call;

import com.odin.call_signaling_service.enums.CallErrorCode;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class CallError {
    private final CallErrorCode code;
    private final String message;
    private final Throwable cause;
}
