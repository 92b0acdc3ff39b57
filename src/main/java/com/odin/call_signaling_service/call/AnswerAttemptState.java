package com.odin.call_signaling_service.call;

/**
 * Progress of the answerer side of one offer/answer exchange.
 * <pre>
 * IDLE -> ATTEMPTING_ANSWER -> ANSWERED
 *              |      ^
 *              v      |
 *        AWAITING_REVISION -> FAILED (promote to offerer)
 * </pre>
 * STANDBY is entered when the current offer is already answered by another
 * endpoint of the room.
 */
public enum AnswerAttemptState {
    IDLE,
    ATTEMPTING_ANSWER,
    AWAITING_REVISION,
    ANSWERED,
    STANDBY,
    FAILED
}
