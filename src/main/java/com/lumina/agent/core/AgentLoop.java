package com.lumina.agent.core;

import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.exception.ModelTransportException;
import com.lumina.agent.exception.TaskAlreadyRunningException;
import com.lumina.agent.exception.TaskCancelledException;
import com.lumina.agent.llm.LlmConfigOverride;
import com.lumina.agent.llm.ModelCallOptions;
import com.lumina.agent.llm.ModelClient;
import com.lumina.agent.llm.ModelReply;
import com.lumina.agent.llm.StreamChunk;
import com.lumina.agent.llm.TokenUsage;
import com.lumina.agent.model.AgentStatus;
import com.lumina.agent.model.Message;
import com.lumina.agent.model.TaskContext;
import com.lumina.agent.model.ToolCall;
import com.lumina.agent.model.ToolResult;
import com.lumina.agent.observability.RunContext;
import com.lumina.agent.prompt.PromptBuilder;
import com.lumina.agent.search.ContextEnricher;
import com.lumina.agent.tool.ToolContext;
import com.lumina.agent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tool-using agent loop for one conversation.
 *
 * Per task:
 * 1. Enrich the context with related notes (once)
 * 2. Refresh the system prompt and append the user turn
 * 3. Loop: model call → parse → append reply → run tools (behind the approval gate) → repeat
 * 4. Stop on completion, on an exhausted error budget, or on abort
 *
 * {@link #startTask} runs on the caller's thread and returns once the task is
 * terminal. Callers that hand the work to another thread use {@link #claimTask}
 * then {@link #runTask}. A loop runs one task thread at a time: after an abort
 * the next task is refused until the aborted thread has returned. The other
 * entry points are safe from any thread: they only signal the cancellation
 * token, the approval gate or the in-flight model future.
 */
@Slf4j
public class AgentLoop {

    static final String TOOL_USE_FAILURE = "Agent failed to use tools correctly";

    private final String sessionId;
    private final ModelClient modelClient;
    private final ToolRegistry toolRegistry;
    private final MessageParser messageParser;
    private final PromptBuilder promptBuilder;
    private final ContextEnricher contextEnricher;
    private final NoToolReplyPolicy noToolReplyPolicy;
    private final AgentProperties properties;
    private final ExecutorService modelCallExecutor;
    private final StateManager stateManager = new StateManager();
    private final RequestTimeoutMonitor timeoutMonitor;

    private final Object taskLock = new Object();
    private final AtomicBoolean timeoutRetryRequested = new AtomicBoolean();

    private volatile CancellationToken cancellationToken = new CancellationToken();
    private volatile ApprovalGate approvalGate;
    private volatile Future<ModelReply> inFlight;
    private int timeoutRetryCount;
    private TaskHandle currentTask;

    public AgentLoop(String sessionId,
                     ModelClient modelClient,
                     ToolRegistry toolRegistry,
                     MessageParser messageParser,
                     PromptBuilder promptBuilder,
                     ContextEnricher contextEnricher,
                     NoToolReplyPolicy noToolReplyPolicy,
                     AgentProperties properties,
                     ExecutorService modelCallExecutor,
                     ScheduledExecutorService timeoutScheduler) {
        this.sessionId = sessionId;
        this.modelClient = modelClient;
        this.toolRegistry = toolRegistry;
        this.messageParser = messageParser;
        this.promptBuilder = promptBuilder;
        this.contextEnricher = contextEnricher;
        this.noToolReplyPolicy = noToolReplyPolicy;
        this.properties = properties;
        this.modelCallExecutor = modelCallExecutor;
        this.timeoutMonitor = new RequestTimeoutMonitor(timeoutScheduler, stateManager,
                properties.getTimeout().getThreshold(), properties.getTimeout().getCheckInterval());
    }

    // ─── Entry points ─────────────────────────────────────────────────────────

    public void startTask(String userMessage, TaskContext context) {
        startTask(userMessage, context, null);
    }

    /**
     * Runs a task to a terminal status on the caller's thread.
     *
     * @throws TaskAlreadyRunningException if a task is running, waiting for approval,
     *         or still unwinding after an abort; nothing else escapes, failures end up in the state
     */
    public void startTask(String userMessage, TaskContext context, LlmConfigOverride override) {
        runTask(claimTask(userMessage, context, override));
    }

    /**
     * Reserves the loop for a new task and moves it to running. The returned handle
     * must be passed to {@link #runTask}, or to {@link #releaseUnstarted} if it never runs.
     * The loop stays reserved until the task's own thread has returned.
     */
    public TaskHandle claimTask(String userMessage, TaskContext context, LlmConfigOverride override) {
        synchronized (taskLock) {
            if (currentTask != null || stateManager.getStatus().isActive()) {
                throw new TaskAlreadyRunningException(sessionId);
            }
            CancellationToken token = new CancellationToken();
            cancellationToken = token;
            timeoutRetryCount = 0;
            timeoutRetryRequested.set(false);
            stateManager.beginTask(taskLabel(userMessage, context), override);
            currentTask = new TaskHandle(token, userMessage, context);
            return currentTask;
        }
    }

    public void runTask(TaskHandle task) {
        synchronized (taskLock) {
            if (currentTask != task) {
                throw new IllegalStateException("Task handle is not the current task of session " + sessionId);
            }
        }
        CancellationToken token = task.token;
        TaskContext context = task.context;
        RunContext run = new RunContext();
        log.info("Agent task started [session={}, mode={}, intent={}, input='{}']",
                sessionId, context.getMode(), context.getIntent(), stateManager.getState().getTask());

        try {
            TaskContext enriched = contextEnricher.enrich(task.message, context);
            token.throwIfCancelled();
            openTurn(task.message, enriched);
            runLoop(enriched, token, run);

        } catch (TaskCancelledException e) {
            log.info("Agent task cancelled [session={}]", sessionId);
            stateManager.setStatus(AgentStatus.aborted);
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                stateManager.setStatus(AgentStatus.aborted);
            } else {
                log.error("Agent task failed unexpectedly [session={}]", sessionId, e);
                stateManager.fail("Unexpected error: " + e.getMessage());
            }
        } finally {
            synchronized (taskLock) {
                currentTask = null;
            }
        }

        log.info("Agent task finished [session={}, status={}, modelCalls={}, tools={}, failedTools={}, latency={}ms, tokens={}]",
                sessionId, stateManager.getStatus(), run.getModelCalls(), run.getToolCallRecords().size(),
                run.failedToolCalls(), run.elapsedMs(), run.totalTokens());
    }

    /**
     * Gives back a claimed task that was never run, ending it in error.
     */
    public void releaseUnstarted(TaskHandle task, String reason) {
        synchronized (taskLock) {
            if (currentTask != task) {
                return;
            }
            currentTask = null;
            stateManager.fail(reason);
        }
        log.warn("Agent task released before it ran [session={}]: {}", sessionId, reason);
    }

    /** True while a task is claimed or its thread has not yet returned. */
    public boolean isBusy() {
        synchronized (taskLock) {
            return currentTask != null;
        }
    }

    /**
     * Stops the running task. Status becomes aborted at once; a pending approval
     * resolves as rejected and the in-flight model call is cancelled.
     * No-op when no task is active.
     */
    public void abort() {
        CancellationToken token;
        synchronized (taskLock) {
            if (!stateManager.getStatus().isActive()) {
                log.debug("Abort ignored, no active task [session={}]", sessionId);
                return;
            }
            token = cancellationToken;
            stateManager.setStatus(AgentStatus.aborted);
        }
        log.info("Agent task aborted [session={}]", sessionId);
        token.cancel();
    }

    /**
     * Resolves the pending approval. Returns false when nothing is waiting.
     */
    public boolean approveToolCall(boolean approved) {
        ApprovalGate gate = approvalGate;
        if (gate == null || stateManager.getStatus() != AgentStatus.waiting_approval) {
            return false;
        }
        log.info("Tool call {} [session={}]", approved ? "approved" : "rejected", sessionId);
        return gate.resolve(approved);
    }

    /**
     * Cancels the in-flight model call and reissues it on the same history, with
     * a hint noting the retry. Returns false when no call is in flight; a second
     * request for the same call is a no-op.
     */
    public boolean retryTimedOutRequest() {
        Future<ModelReply> current = inFlight;
        if (current == null || current.isDone()) {
            return false;
        }
        timeoutRetryRequested.set(true);
        if (!current.cancel(true)) {
            timeoutRetryRequested.set(false);
            return false;
        }
        log.info("Retrying timed-out model call [session={}]", sessionId);
        return true;
    }

    /** Replaces the whole history, e.g. when restoring a saved conversation. */
    public void setMessages(List<Message> messages) {
        synchronized (taskLock) {
            if (currentTask != null || stateManager.getStatus().isActive()) {
                throw new TaskAlreadyRunningException(sessionId);
            }
            stateManager.setMessages(messages);
        }
    }

    /** Drops the history and returns to idle. */
    public void clearChat() {
        synchronized (taskLock) {
            if (currentTask != null || stateManager.getStatus().isActive()) {
                throw new TaskAlreadyRunningException(sessionId);
            }
            stateManager.reset();
        }
    }

    public AgentState getState() {
        return stateManager.getState();
    }

    public Runnable on(AgentEventType type, AgentEventListener listener) {
        return stateManager.on(type, listener);
    }

    public Runnable onAll(AgentEventListener listener) {
        return stateManager.onAll(listener);
    }

    public String getSessionId() {
        return sessionId;
    }

    // ─── Loop ─────────────────────────────────────────────────────────────────

    private static String taskLabel(String userMessage, TaskContext context) {
        String display = context.getDisplayMessage();
        return display != null && !display.isBlank() ? display : userMessage;
    }

    private void openTurn(String userMessage, TaskContext context) {
        String systemPrompt = promptBuilder.build(context);
        Message userTurn = Message.user(promptBuilder.buildUserContent(userMessage, context));

        if (stateManager.getMessages().size() > 1) {
            stateManager.replaceSystemPrompt(systemPrompt);
            stateManager.addMessage(userTurn);
        } else {
            stateManager.setMessages(List.of(Message.system(systemPrompt), userTurn));
        }
    }

    private void runLoop(TaskContext context, CancellationToken token, RunContext run) {
        ToolContext toolContext = ToolContext.builder()
                .workspacePath(context.getWorkspacePath())
                .activeNotePath(context.getActiveNote())
                .build();

        while (!stateManager.getStatus().isTerminal()) {
            token.throwIfCancelled();

            ModelReply reply;
            try {
                reply = requestModelReply(token, run);
            } catch (TaskCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                token.throwIfCancelled();
                log.warn("Model call failed [session={}]: {}", sessionId, e.getMessage());
                recordFailure("Model call failed: " + e.getMessage(),
                        ConversationPrompts.systemError("The model call failed: " + e.getMessage()));
                continue;
            }

            token.throwIfCancelled();
            handleReply(reply.getContent(), context, toolContext, token, run);
        }
    }

    private void handleReply(String rawReply, TaskContext context, ToolContext toolContext,
                             CancellationToken token, RunContext run) {
        String raw = rawReply != null ? rawReply : "";
        ParsedReply parsed = messageParser.parse(raw);
        stateManager.addMessage(Message.assistant(raw));

        if (parsed.hasToolCalls()) {
            log.info("Model requested {} tool call(s) [session={}]", parsed.getToolCalls().size(), sessionId);
            boolean allDispatched = executeToolCalls(parsed.getToolCalls(), toolContext, token, run);
            if (allDispatched && parsed.isCompletion()) {
                complete();
            }
            return;
        }

        if (parsed.isCompletion()) {
            complete();
            return;
        }

        if (noToolReplyPolicy.evaluate(raw, context) == NoToolReplyPolicy.Verdict.ACCEPT_AS_COMPLETION) {
            complete();
        } else {
            log.warn("Model replied without using a tool [session={}]", sessionId);
            recordFailure(TOOL_USE_FAILURE, ConversationPrompts.noToolUsed());
        }
    }

    /**
     * Runs the calls in document order. A rejection stops the rest of the reply.
     *
     * @return false if the user rejected one of the calls
     */
    private boolean executeToolCalls(List<ToolCall> calls, ToolContext toolContext,
                                     CancellationToken token, RunContext run) {
        for (int i = 0; i < calls.size(); i++) {
            token.throwIfCancelled();
            ToolCall call = calls.get(i);

            if (toolRegistry.requiresApproval(call.getName()) && !awaitApproval(call, token)) {
                stateManager.addMessage(Message.user(
                        ConversationPrompts.toolRejected(call.getName(), calls.size() - i - 1)));
                return false;
            }

            token.throwIfCancelled();
            log.info("Executing tool [{}] [session={}]", call.getName(), sessionId);
            long start = System.currentTimeMillis();
            ToolResult result = toolRegistry.execute(call.getName(), call.getParams(), toolContext);
            run.recordToolCall(call.getName(), System.currentTimeMillis() - start, result.isSuccess());

            token.throwIfCancelled();
            if (result.isSuccess()) {
                stateManager.resetErrors();
            } else {
                log.warn("Tool [{}] failed [session={}]: {}", call.getName(), sessionId, result.getError());
            }
            stateManager.addMessage(Message.user(ConversationPrompts.toolResult(call, result)));
        }
        return true;
    }

    private boolean awaitApproval(ToolCall call, CancellationToken token) {
        ApprovalGate gate = new ApprovalGate();
        approvalGate = gate;
        Runnable deregister = token.onCancel(() -> gate.resolve(false));
        try {
            stateManager.setPendingTool(call);
            log.info("Waiting for approval of [{}] [session={}]", call.getName(), sessionId);
            boolean approved = gate.await();
            token.throwIfCancelled();
            return approved;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskCancelledException();
        } finally {
            deregister.run();
            approvalGate = null;
            stateManager.setPendingTool(null);
        }
    }

    /**
     * One model reply. A timeout retry cancels the attempt and loops back here
     * with the hint appended; nothing else is replayed.
     */
    private ModelReply requestModelReply(CancellationToken token, RunContext run) {
        while (true) {
            token.throwIfCancelled();
            List<Message> history = stateManager.getMessages();
            ModelCallOptions options = callOptions(token);

            long start = System.currentTimeMillis();
            stateManager.setLLMRequestStartTime(start);
            stateManager.incrementLLMRequestCount();

            // Published before it runs, so a retry or abort can always reach it
            FutureTask<ModelReply> future = new FutureTask<>(() -> invokeModel(history, options));
            inFlight = future;
            Runnable deregister = token.onCancel(() -> future.cancel(true));
            ScheduledFuture<?> watch = timeoutMonitor.watch(start);
            modelCallExecutor.execute(future);

            try {
                ModelReply reply = future.get();
                run.recordModelCall(reply.getUsage());
                return reply;

            } catch (CancellationException e) {
                token.throwIfCancelled();
                if (!timeoutRetryRequested.getAndSet(false)) {
                    throw new ModelTransportException("Model call was cancelled");
                }
                appendTimeoutHint();

            } catch (ExecutionException e) {
                token.throwIfCancelled();
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new ModelTransportException("Model call failed: " + cause.getMessage(), cause);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new TaskCancelledException();

            } finally {
                watch.cancel(false);
                deregister.run();
                inFlight = null;
                stateManager.setLLMRequestStartTime(null);
            }
        }
    }

    private void appendTimeoutHint() {
        timeoutRetryCount++;
        long thresholdSeconds = timeoutMonitor.getThresholdMs() / 1000;
        stateManager.resetLLMRequest();
        stateManager.addMessage(Message.user(ConversationPrompts.timeoutRetry(timeoutRetryCount, thresholdSeconds)));
    }

    private ModelReply invokeModel(List<Message> history, ModelCallOptions options) {
        if (!properties.isStreaming()) {
            return modelClient.call(history, options);
        }

        StringBuilder text = new StringBuilder();
        AtomicReference<TokenUsage> usage = new AtomicReference<>();
        modelClient.stream(history, options, chunk -> {
            options.getCancellationToken().throwIfCancelled();
            stateManager.publish(AgentEventType.STREAM_CHUNK, chunk);
            if (chunk.getType() == StreamChunk.Type.TEXT && chunk.getText() != null) {
                text.append(chunk.getText());
            } else if (chunk.getType() == StreamChunk.Type.USAGE) {
                usage.set(chunk.getUsage());
            } else if (chunk.getType() == StreamChunk.Type.ERROR) {
                throw new ModelTransportException(chunk.getError());
            }
        });
        return ModelReply.builder().content(text.toString()).usage(usage.get()).build();
    }

    private ModelCallOptions callOptions(CancellationToken token) {
        LlmConfigOverride override = stateManager.getLlmConfig();
        Double temperature = override != null && override.getTemperature() != null
                ? override.getTemperature()
                : properties.getTemperature();
        return ModelCallOptions.builder()
                .cancellationToken(token)
                .temperature(temperature)
                .maxTokens(override != null ? override.getMaxTokens() : null)
                .override(override)
                .build();
    }

    private void complete() {
        stateManager.resetErrors();
        stateManager.setStatus(AgentStatus.completed);
    }

    private void recordFailure(String fatalMessage, String correction) {
        int errors = stateManager.incrementErrors();
        if (errors >= properties.getMaxConsecutiveErrors()) {
            log.error("Error budget exhausted after {} consecutive failures [session={}]", errors, sessionId);
            stateManager.fail(fatalMessage);
        } else {
            stateManager.addMessage(Message.user(correction));
        }
    }

    /** A claimed task: its cancellation token plus what it was started with. */
    public static final class TaskHandle {

        private final CancellationToken token;
        private final String message;
        private final TaskContext context;

        private TaskHandle(CancellationToken token, String message, TaskContext context) {
            this.token = token;
            this.message = message;
            this.context = context;
        }
    }
}
