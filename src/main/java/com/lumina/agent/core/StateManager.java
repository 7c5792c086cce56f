package com.lumina.agent.core;

import com.lumina.agent.llm.LlmConfigOverride;
import com.lumina.agent.model.AgentStatus;
import com.lumina.agent.model.Message;
import com.lumina.agent.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Single source of truth for one loop's status, history, pending tool and counters.
 *
 * Mutations come from the loop thread; the lock only makes snapshots read from
 * other threads consistent. Listeners are notified after the lock is released,
 * and a failing listener is logged and skipped.
 *
 * Guarantees:
 * - pendingTool is non-null iff status == waiting_approval
 * - a terminal status only changes through {@link #beginTask} or {@link #reset}
 * - history only shrinks through {@link #reset} or {@link #setMessages}
 */
@Slf4j
public class StateManager {

    private final Object lock = new Object();

    private AgentStatus status = AgentStatus.idle;
    private final List<Message> messages = new ArrayList<>();
    private ToolCall pendingTool;
    private int consecutiveErrors;
    private Long llmRequestStartTime;
    private int llmRequestCount;
    private String task;
    private String errorMessage;
    private LlmConfigOverride llmConfig;

    private final Map<AgentEventType, List<AgentEventListener>> listeners = new EnumMap<>(AgentEventType.class);
    private final List<AgentEventListener> allListeners = new CopyOnWriteArrayList<>();

    public StateManager() {
        for (AgentEventType type : AgentEventType.values()) {
            listeners.put(type, new CopyOnWriteArrayList<>());
        }
    }

    // ─── Reads ────────────────────────────────────────────────────────────────

    public AgentState getState() {
        synchronized (lock) {
            return AgentState.builder()
                    .status(status)
                    .messages(List.copyOf(messages))
                    .pendingTool(pendingTool)
                    .consecutiveErrorCount(consecutiveErrors)
                    .llmRequestStartTime(llmRequestStartTime)
                    .llmRequestCount(llmRequestCount)
                    .task(task)
                    .errorMessage(errorMessage)
                    .build();
        }
    }

    public AgentStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public List<Message> getMessages() {
        synchronized (lock) {
            return List.copyOf(messages);
        }
    }

    public int getConsecutiveErrors() {
        synchronized (lock) {
            return consecutiveErrors;
        }
    }

    public LlmConfigOverride getLlmConfig() {
        synchronized (lock) {
            return llmConfig;
        }
    }

    // ─── Status ───────────────────────────────────────────────────────────────

    /**
     * Moves a terminal or idle state back to running for a new task. History is kept.
     */
    public void beginTask(String taskText, LlmConfigOverride override) {
        synchronized (lock) {
            task = taskText;
            llmConfig = override;
            consecutiveErrors = 0;
            llmRequestCount = 0;
            llmRequestStartTime = null;
            errorMessage = null;
            pendingTool = null;
            status = AgentStatus.running;
        }
        publish(AgentEventType.STATUS_CHANGED, AgentStatus.running);
    }

    public void setStatus(AgentStatus next) {
        if (next == AgentStatus.waiting_approval) {
            throw new IllegalStateException("waiting_approval is entered through setPendingTool");
        }
        synchronized (lock) {
            if (status == next) return;
            if (status.isTerminal()) {
                log.debug("Ignoring transition {} -> {} out of terminal state", status, next);
                return;
            }
            status = next;
            pendingTool = null;
        }
        publish(AgentEventType.STATUS_CHANGED, next);
    }

    /**
     * Ends the task in error with a human-readable reason.
     */
    public void fail(String message) {
        synchronized (lock) {
            if (status.isTerminal()) {
                log.debug("Ignoring failure '{}' after terminal state {}", message, status);
                return;
            }
            status = AgentStatus.error;
            pendingTool = null;
            errorMessage = message;
        }
        publish(AgentEventType.ERROR, message);
        publish(AgentEventType.STATUS_CHANGED, AgentStatus.error);
    }

    /**
     * Non-null parks the loop in waiting_approval; null releases it back to running.
     */
    public void setPendingTool(ToolCall tool) {
        synchronized (lock) {
            if (tool != null) {
                if (status != AgentStatus.running) {
                    throw new IllegalStateException("Cannot wait for approval while " + status);
                }
                pendingTool = tool;
                status = AgentStatus.waiting_approval;
            } else {
                pendingTool = null;
                if (status != AgentStatus.waiting_approval) return;
                status = AgentStatus.running;
            }
        }
        if (tool != null) {
            publish(AgentEventType.PENDING_TOOL, tool);
            publish(AgentEventType.STATUS_CHANGED, AgentStatus.waiting_approval);
        } else {
            publish(AgentEventType.STATUS_CHANGED, AgentStatus.running);
        }
    }

    // ─── History ──────────────────────────────────────────────────────────────

    public void addMessage(Message message) {
        synchronized (lock) {
            messages.add(message);
        }
        publish(AgentEventType.MESSAGE_ADDED, message);
    }

    /** Full replace, used when restoring a persisted conversation or starting the first task. */
    public void setMessages(List<Message> history) {
        List<Message> copy;
        synchronized (lock) {
            messages.clear();
            messages.addAll(history);
            copy = List.copyOf(messages);
        }
        publish(AgentEventType.MESSAGES_REPLACED, copy);
    }

    /**
     * Refreshes the head system prompt of a resumed conversation. A history that
     * does not open with a system message gets one prepended.
     */
    public void replaceSystemPrompt(String systemPrompt) {
        List<Message> copy;
        synchronized (lock) {
            if (!messages.isEmpty() && messages.get(0).getRole() == Message.Role.system) {
                messages.set(0, Message.system(systemPrompt));
            } else {
                messages.add(0, Message.system(systemPrompt));
            }
            copy = List.copyOf(messages);
        }
        publish(AgentEventType.MESSAGES_REPLACED, copy);
    }

    // ─── Counters ─────────────────────────────────────────────────────────────

    public int incrementErrors() {
        synchronized (lock) {
            return ++consecutiveErrors;
        }
    }

    public void resetErrors() {
        synchronized (lock) {
            consecutiveErrors = 0;
        }
    }

    public void setLLMRequestStartTime(Long epochMillis) {
        synchronized (lock) {
            llmRequestStartTime = epochMillis;
        }
    }

    public int incrementLLMRequestCount() {
        synchronized (lock) {
            return ++llmRequestCount;
        }
    }

    /** Clears only the in-flight timer and counter; history is untouched. */
    public void resetLLMRequest() {
        synchronized (lock) {
            llmRequestStartTime = null;
            llmRequestCount = 0;
        }
    }

    /** Back to a pristine idle state; the only path that drops history. */
    public void reset() {
        synchronized (lock) {
            status = AgentStatus.idle;
            messages.clear();
            pendingTool = null;
            consecutiveErrors = 0;
            llmRequestStartTime = null;
            llmRequestCount = 0;
            task = null;
            errorMessage = null;
            llmConfig = null;
        }
        publish(AgentEventType.MESSAGES_REPLACED, List.of());
        publish(AgentEventType.STATUS_CHANGED, AgentStatus.idle);
    }

    // ─── Events ───────────────────────────────────────────────────────────────

    /**
     * Subscribe to one event type. Returns a handle that unsubscribes.
     */
    public Runnable on(AgentEventType type, AgentEventListener listener) {
        List<AgentEventListener> bucket = listeners.get(type);
        bucket.add(listener);
        return () -> bucket.remove(listener);
    }

    public Runnable onAll(AgentEventListener listener) {
        allListeners.add(listener);
        return () -> allListeners.remove(listener);
    }

    public void publish(AgentEventType type, Object payload) {
        AgentEvent event = AgentEvent.of(type, payload);
        notify(listeners.get(type), event);
        notify(allListeners, event);
    }

    private void notify(List<AgentEventListener> targets, AgentEvent event) {
        for (AgentEventListener listener : targets) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.warn("Agent event listener failed [type={}]: {}", event.getType(), e.getMessage(), e);
            }
        }
    }
}
