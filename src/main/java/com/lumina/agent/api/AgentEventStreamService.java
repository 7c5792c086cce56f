package com.lumina.agent.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.agent.core.AgentEvent;
import com.lumina.agent.core.AgentLoop;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Server-Sent Events bridge for a loop's event stream.
 *
 * Usage:
 * 1. Client calls GET /api/v1/agent/sessions/{id}/events
 * 2. A "state" event carries the current snapshot, so late subscribers catch up
 * 3. Every loop event follows, named after its type (status_changed, pending_tool, ...)
 *
 * Each emitter holds its own subscription, dropped when the stream ends.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentEventStreamService {

    private static final long SSE_TIMEOUT_MS = 30 * 60 * 1000;

    private final ObjectMapper objectMapper;

    public SseEmitter subscribe(AgentLoop loop) {
        String sessionId = loop.getSessionId();
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        AtomicReference<Runnable> unsubscribe = new AtomicReference<>(() -> { });

        emitter.onCompletion(() -> {
            log.debug("SSE stream completed [session={}]", sessionId);
            unsubscribe.get().run();
        });
        emitter.onTimeout(() -> {
            log.debug("SSE stream timed out [session={}]", sessionId);
            unsubscribe.get().run();
        });
        emitter.onError(error -> {
            log.debug("SSE stream error [session={}]: {}", sessionId, error.getMessage());
            unsubscribe.get().run();
        });

        try {
            emitter.send(SseEmitter.event()
                    .name("state")
                    .data(objectMapper.writeValueAsString(loop.getState())));
        } catch (IOException e) {
            log.warn("Failed to send initial state [session={}]", sessionId, e);
            emitter.completeWithError(e);
            return emitter;
        }

        unsubscribe.set(loop.onAll(event -> forward(emitter, event, sessionId, unsubscribe)));
        log.info("SSE subscriber attached [session={}]", sessionId);
        return emitter;
    }

    private void forward(SseEmitter emitter, AgentEvent event, String sessionId, AtomicReference<Runnable> unsubscribe) {
        try {
            emitter.send(SseEmitter.event()
                    .name(event.getType().name().toLowerCase(Locale.ROOT))
                    .data(objectMapper.writeValueAsString(event)));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping SSE subscriber [session={}]: {}", sessionId, e.getMessage());
            unsubscribe.get().run();
            emitter.completeWithError(e);
        }
    }
}
