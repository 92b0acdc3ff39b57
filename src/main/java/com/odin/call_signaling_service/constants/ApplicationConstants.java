package com.odin.call_signaling_service.constants;

public class ApplicationConstants {

	// Redis key layout, all scoped by room
	public static final String CALL_KEY_PREFIX = "call:";
	public static final String SESSION_KEY_SUFFIX = ":session";
	public static final String REVISIONS_KEY_SUFFIX = ":revisions";
	public static final String REVISION_KEY_SEGMENT = ":rev:";
	public static final String LEGACY_CANDIDATES_KEY_SEGMENT = ":candidates:";
	public static final String DESCRIPTION_KEY_SEGMENT = ":sdp:";
	public static final String PARTICIPANTS_KEY_SUFFIX = ":participants";
	public static final String EVENTS_CHANNEL_SUFFIX = ":events";

	// Change notification types carried on the room channel
	public static final String EVENT_SESSION = "session";
	public static final String EVENT_CANDIDATE = "candidate";
	public static final String EVENT_PRESENCE = "presence";

	// Store selection
	public static final String STORE_TYPE_PROPERTY = "call.store.type";
	public static final String STORE_TYPE_REDIS = "redis";
	public static final String STORE_TYPE_MEMORY = "memory";

	// Kafka
	public static final String KAFKA_DIAGNOSTICS_ENABLED_PROPERTY = "call.diagnostics.kafka.enabled";
	public static final String KAFKA_DEFAULT_DIAGNOSTICS_TOPIC = "call.diagnostics";

	// MDC keys
	public static final String MDC_CALL_ROOM = "callRoom";
	public static final String MDC_CALL_UID = "callUid";

	// Renegotiation reasons
	public static final String REASON_CAMERA_ON = "camera-on";
	public static final String REASON_CAMERA_OFF = "camera-off";
	public static final String REASON_SCREEN_ON = "screen-on";
	public static final String REASON_SCREEN_OFF = "screen-off";
	public static final String REASON_MUTE_TOGGLED = "mute-toggled";
	public static final String REASON_ICE_RECOVERY = "ice-recovery";
	public static final String REASON_OFFERER_LEFT = "offerer-left";
	public static final String REASON_PEER_LEFT = "peer-left";
	public static final String REASON_SESSION_RESET = "session-reset";
	public static final String REASON_REJOIN_MEDIA = "rejoin-media";
	public static final String REASON_MISSING_OFFER = "missing-offer";
	public static final String REASON_REMOTE_REQUEST = "remote-request";
	public static final String REASON_ANSWER_FAILED = "answer-failed";
	public static final String REASON_ANSWER_RETRIES_EXHAUSTED = "answer-retries-exhausted";
	public static final String REASON_INITIAL = "initial";
	public static final String REASON_REJOIN = "rejoin";

	// Diagnostic sources
	public static final String SOURCE_ARBITRATOR = "arbitrator";
	public static final String SOURCE_SCHEDULER = "scheduler";
	public static final String SOURCE_TRICKLE = "trickle";
	public static final String SOURCE_HEALTH = "health";
	public static final String SOURCE_GC = "gc";
	public static final String SOURCE_PRESENCE = "presence";
	public static final String SOURCE_SESSION = "session";
	public static final String SOURCE_MEDIA = "media";

	private ApplicationConstants() {
	}
}
