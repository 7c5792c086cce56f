package com.lumina.agent.api;

import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.core.AgentLoop;
import com.lumina.agent.core.AgentSessionRegistry;
import com.lumina.agent.core.AgentState;
import com.lumina.agent.memory.ConversationStore;
import com.lumina.agent.model.ApprovalRequest;
import com.lumina.agent.model.Message;
import com.lumina.agent.model.StartTaskRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * Agent endpoints, one conversation per session id.
 *
 * POST /api/v1/agent/sessions/{id}/tasks          start a task (runs asynchronously)
 * POST /api/v1/agent/sessions/{id}/approval       approve or reject the pending tool
 * POST /api/v1/agent/sessions/{id}/abort
 * POST /api/v1/agent/sessions/{id}/retry-timeout  reissue a slow model call
 * GET  /api/v1/agent/sessions/{id}/state
 * PUT  /api/v1/agent/sessions/{id}/messages       replace the history
 * POST /api/v1/agent/sessions/{id}/restore        reload the saved history
 * POST /api/v1/agent/sessions/{id}/clear
 * GET  /api/v1/agent/sessions/{id}/events         SSE
 * GET  /api/v1/agent/health
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final AgentSessionRegistry sessionRegistry;
    private final AgentTaskRunner taskRunner;
    private final AgentEventStreamService eventStreamService;
    private final ConversationStore conversationStore;
    private final AgentProperties agentProperties;

    @PostMapping("/sessions/{sessionId}/tasks")
    public ResponseEntity<Map<String, Object>> startTask(@PathVariable String sessionId,
                                                         @Valid @RequestBody StartTaskRequest request) {
        log.info("Start task request [session={}, mode={}, intent={}]",
                sessionId, request.getMode(), request.getIntent());

        AgentLoop loop = sessionRegistry.getOrCreate(sessionId);
        AgentLoop.TaskHandle task = loop.claimTask(request.getMessage(),
                request.toContext(agentProperties.getRag().getIndexRoot()), request.getLlmConfig());
        try {
            taskRunner.run(loop, task);
        } catch (TaskRejectedException e) {
            loop.releaseUnstarted(task, "Agent is busy, task could not be scheduled");
            throw e;
        }

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("sessionId", sessionId, "accepted", true));
    }

    @PostMapping("/sessions/{sessionId}/approval")
    public ResponseEntity<Map<String, Object>> approve(@PathVariable String sessionId,
                                                       @Valid @RequestBody ApprovalRequest request) {
        boolean resolved = sessionRegistry.find(sessionId)
                .map(loop -> loop.approveToolCall(request.getApproved()))
                .orElse(false);
        return ResponseEntity.ok(Map.of("resolved", resolved));
    }

    @PostMapping("/sessions/{sessionId}/abort")
    public ResponseEntity<AgentState> abort(@PathVariable String sessionId) {
        AgentLoop loop = sessionRegistry.getOrCreate(sessionId);
        loop.abort();
        return ResponseEntity.ok(loop.getState());
    }

    @PostMapping("/sessions/{sessionId}/retry-timeout")
    public ResponseEntity<Map<String, Object>> retryTimeout(@PathVariable String sessionId) {
        boolean retried = sessionRegistry.find(sessionId)
                .map(AgentLoop::retryTimedOutRequest)
                .orElse(false);
        return ResponseEntity.ok(Map.of("retried", retried));
    }

    @GetMapping("/sessions/{sessionId}/state")
    public ResponseEntity<AgentState> state(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionRegistry.getOrCreate(sessionId).getState());
    }

    @PutMapping("/sessions/{sessionId}/messages")
    public ResponseEntity<AgentState> replaceMessages(@PathVariable String sessionId,
                                                      @RequestBody List<Message> messages) {
        AgentLoop loop = sessionRegistry.getOrCreate(sessionId);
        loop.setMessages(messages);
        conversationStore.save(sessionId, messages);
        return ResponseEntity.ok(loop.getState());
    }

    @PostMapping("/sessions/{sessionId}/restore")
    public ResponseEntity<AgentState> restore(@PathVariable String sessionId) {
        AgentLoop loop = sessionRegistry.getOrCreate(sessionId);
        return conversationStore.load(sessionId)
                .map(messages -> {
                    loop.setMessages(messages);
                    log.info("Restored {} messages [session={}]", messages.size(), sessionId);
                    return ResponseEntity.ok(loop.getState());
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/sessions/{sessionId}/clear")
    public ResponseEntity<AgentState> clear(@PathVariable String sessionId) {
        AgentLoop loop = sessionRegistry.getOrCreate(sessionId);
        loop.clearChat();
        conversationStore.clear(sessionId);
        return ResponseEntity.ok(loop.getState());
    }

    @GetMapping(value = "/sessions/{sessionId}/events", produces = "text/event-stream")
    public SseEmitter events(@PathVariable String sessionId) {
        return eventStreamService.subscribe(sessionRegistry.getOrCreate(sessionId));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
