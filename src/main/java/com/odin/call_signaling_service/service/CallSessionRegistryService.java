package com.odin.call_signaling_service.service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import com.odin.call_signaling_service.call.CallSession;
import com.odin.call_signaling_service.call.CallSessionListener;
import com.odin.call_signaling_service.call.DiagnosticSink;
import com.odin.call_signaling_service.call.SerialCallEventLoop;
import com.odin.call_signaling_service.config.CallEngineProperties;
import com.odin.call_signaling_service.dto.ParticipantProfile;
import com.odin.call_signaling_service.enums.CallStatus;
import com.odin.call_signaling_service.repo.SignalingRepository;
import com.odin.call_signaling_service.transport.LocalMediaSource;
import com.odin.call_signaling_service.transport.MediaTransportFactory;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Live call sessions of this process, one per room and local participant.
 * The media transport factory and the capture source come from the host
 * application's beans.
 */
@Slf4j
@Service
public class CallSessionRegistryService {

	private static final long SHUTDOWN_LEAVE_TIMEOUT_MS = 2000;

	private final ConcurrentHashMap<String, CallSession> sessions = new ConcurrentHashMap<>();
	private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1);

	private final SignalingRepository repository;
	private final CallEngineProperties properties;
	private final ObjectProvider<MediaTransportFactory> transportFactory;
	private final ObjectProvider<LocalMediaSource> mediaSource;
	private final ObjectProvider<DiagnosticSink> diagnosticSink;

	public CallSessionRegistryService(SignalingRepository repository, CallEngineProperties properties,
			ObjectProvider<MediaTransportFactory> transportFactory, ObjectProvider<LocalMediaSource> mediaSource,
			ObjectProvider<DiagnosticSink> diagnosticSink) {
		this.repository = repository;
		this.properties = properties;
		this.transportFactory = transportFactory;
		this.mediaSource = mediaSource;
		this.diagnosticSink = diagnosticSink;
	}

	private static String key(String roomId, String uid) {
		return roomId + ":" + uid;
	}

	/**
	 * Creates the session and starts joining; the returned session reports
	 * progress through the listener.
	 */
	public CallSession joinRoom(String roomId, ParticipantProfile profile, CallSessionListener listener) {
		String key = key(roomId, profile.getUid());
		CallSession existing = sessions.get(key);
		if (existing != null && existing.isJoined()) {
			log.warn("joinRoom: {} already joined room {}", profile.getUid(), roomId);
			return existing;
		}
		MediaTransportFactory factory = transportFactory.getIfAvailable();
		LocalMediaSource source = mediaSource.getIfAvailable();
		if (factory == null || source == null) {
			throw new IllegalStateException("No MediaTransportFactory / LocalMediaSource bean is configured");
		}
		CallSession session = CallSession.builder()
				.roomId(roomId)
				.profile(profile)
				.properties(properties)
				.repository(repository)
				.transportFactory(factory)
				.mediaSource(source)
				.loop(new SerialCallEventLoop(roomId, profile.getUid()))
				.listener(listener)
				.diagnosticSink(diagnosticSink.getIfAvailable(() -> DiagnosticSink.NOOP))
				.terminationHandler(ended -> markForCleanup(roomId, ended.getUid()))
				.build();
		CallSession replaced = sessions.put(key, session);
		if (replaced != null) {
			replaced.getLoop().shutdown();
		}
		log.info("CALL SESSION CREATED: room={} uid={}", roomId, profile.getUid());
		session.join();
		return session;
	}

	public CompletableFuture<Void> leaveRoom(String roomId, String uid) {
		CallSession session = sessions.get(key(roomId, uid));
		if (session == null) {
			log.warn("leaveRoom: no session for {} in room {}", uid, roomId);
			return CompletableFuture.completedFuture(null);
		}
		return session.leave().whenComplete((v, err) -> markForCleanup(roomId, uid));
	}

	public CallSession getSession(String roomId, String uid) {
		return sessions.get(key(roomId, uid));
	}

	public boolean sessionExists(String roomId, String uid) {
		return sessions.containsKey(key(roomId, uid));
	}

	public List<CallSession> activeSessions() {
		return sessions.values().stream()
				.filter(CallSession::isJoined)
				.collect(Collectors.toList());
	}

	public void markForCleanup(String roomId, String uid) {
	    String key = key(roomId, uid);
	    CallSession session = sessions.get(key);

	    if (session == null) {
	        log.warn("markForCleanup: Session {} not found", key);
	        return;
	    }

	    log.info("SESSION {} marked for cleanup in {} ms", key, properties.getCleanupDelayMs());

	    scheduler.schedule(() -> endSession(key, session), properties.getCleanupDelayMs(), TimeUnit.MILLISECONDS);
	}

	private void endSession(String key, CallSession session) {
		if (session.isJoined() && session.getStatus() != CallStatus.FAILED) {
			log.info("SESSION {} reconnected before cleanup, keeping it", key);
			return;
		}
		if (session.isJoined()) {
			try {
				session.leave().get(SHUTDOWN_LEAVE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				log.warn("Interrupted while leaving room {}", session.getRoomId());
			} catch (ExecutionException | TimeoutException e) {
				log.warn("Leaving failed session {} did not complete: {}", key, e.getMessage());
			}
		}
		if (sessions.remove(key, session)) {
			session.getLoop().shutdown();
			log.info("CALL SESSION REMOVED: {}", key);
		}
	}

	@PreDestroy
	public void shutdown() {
		log.info("Leaving {} call sessions on shutdown", sessions.size());
		for (CallSession session : sessions.values()) {
			try {
				session.leave().get(SHUTDOWN_LEAVE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				log.warn("Interrupted while leaving room {}", session.getRoomId());
			} catch (ExecutionException | TimeoutException e) {
				log.warn("Leaving room {} on shutdown did not complete: {}", session.getRoomId(), e.getMessage());
			}
			session.getLoop().shutdown();
		}
		sessions.clear();
		scheduler.shutdownNow();
	}
}
