package com.odin.call_signaling_service.call;

import static com.odin.call_signaling_service.constants.ApplicationConstants.SOURCE_ARBITRATOR;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.odin.call_signaling_service.dto.SdpPayload;
import com.odin.call_signaling_service.enums.DescriptionKind;
import com.odin.call_signaling_service.exception.StorePermissionDeniedException;

import lombok.extern.slf4j.Slf4j;

/**
 * Secondary storage of full descriptions next to the session document. The
 * document keeps an inline copy unless the description is too large; a
 * permission failure turns the side channel off for the rest of the session.
 */
@Slf4j
public class DescriptionSideChannel {

    private final CallSession session;

    DescriptionSideChannel(CallSession session) {
        this.session = session;
    }

    /**
     * Stores the description and returns the copy to embed in the session document.
     */
    public CompletableFuture<SdpPayload> store(DescriptionKind kind, SdpPayload description) {
        if (!session.getState().isSideChannelEnabled()) {
            return CompletableFuture.completedFuture(description.toBuilder().externalized(false).build());
        }
        return session.getRepository().writeDescription(session.getRoomId(), kind, description)
                .handleAsync((v, err) -> {
                    if (err != null) {
                        onFailure(kind, "write", err);
                        return description.toBuilder().externalized(false).build();
                    }
                    boolean inline = description.sdpLength() <= session.getProperties().getInlineDescriptionMaxBytes();
                    return description.toBuilder()
                            .externalized(true)
                            .sdp(inline ? description.getSdp() : null)
                            .build();
                }, session.getLoop());
    }

    /**
     * Full description for an embedded one: the side-channel record when it
     * matches the revision, else the inline copy, else empty.
     */
    public CompletableFuture<Optional<SdpPayload>> resolve(DescriptionKind kind, SdpPayload embedded) {
        Optional<SdpPayload> inline = embedded.getSdp() == null ? Optional.empty() : Optional.of(embedded);
        if (!embedded.isExternalized() || !session.getState().isSideChannelEnabled()) {
            return CompletableFuture.completedFuture(inline);
        }
        return session.getRepository().readDescription(session.getRoomId(), kind)
                .handleAsync((stored, err) -> {
                    if (err != null) {
                        onFailure(kind, "read", err);
                        return inline;
                    }
                    if (stored.isPresent() && stored.get().getRevision() == embedded.getRevision()
                            && stored.get().getSdp() != null) {
                        return stored;
                    }
                    log.debug("Side-channel {} for r{} missing in room {}, using inline copy", kind.type(),
                            embedded.getRevision(), session.getRoomId());
                    return inline;
                }, session.getLoop());
    }

    private void onFailure(DescriptionKind kind, String operation, Throwable err) {
        Throwable cause = CallSession.unwrap(err);
        if (cause instanceof StorePermissionDeniedException) {
            session.getState().setSideChannelEnabled(false);
            log.warn("Side-channel {} {} denied in room {}, using inline descriptions from now on", kind.type(),
                    operation, session.getRoomId());
            session.getDiagnostics().warn(SOURCE_ARBITRATOR, "side channel disabled", cause);
            return;
        }
        log.warn("Side-channel {} {} failed in room {}: {}", kind.type(), operation, session.getRoomId(),
                cause.getMessage());
        session.getDiagnostics().warn(SOURCE_ARBITRATOR, "side channel " + operation + " failed", cause);
    }
}
