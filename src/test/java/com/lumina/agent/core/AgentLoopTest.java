package com.lumina.agent.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.config.ToolProperties;
import com.lumina.agent.exception.ModelTransportException;
import com.lumina.agent.exception.TaskAlreadyRunningException;
import com.lumina.agent.llm.ModelCallOptions;
import com.lumina.agent.llm.ModelClient;
import com.lumina.agent.llm.ModelReply;
import com.lumina.agent.model.AgentMode;
import com.lumina.agent.model.AgentStatus;
import com.lumina.agent.model.Message;
import com.lumina.agent.model.TaskContext;
import com.lumina.agent.model.TaskIntent;
import com.lumina.agent.model.ToolResult;
import com.lumina.agent.prompt.PromptBuilder;
import com.lumina.agent.search.ContextEnricher;
import com.lumina.agent.search.SearchCapability;
import com.lumina.agent.tool.AgentTool;
import com.lumina.agent.tool.ToolContext;
import com.lumina.agent.tool.ToolParameter;
import com.lumina.agent.tool.ToolRegistry;
import com.lumina.agent.tool.impl.AttemptCompletionTool;
import com.lumina.agent.tool.impl.CreateNoteTool;
import com.lumina.agent.tool.impl.WorkspaceFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class AgentLoopTest {

    private static final String LONG_CHATTER =
            "I have thought carefully about the request and will describe the changes in prose instead.";

    @TempDir
    Path workspace;

    private ExecutorService modelCallExecutor;
    private ScheduledExecutorService timeoutScheduler;
    private AgentProperties properties;
    private ToolProperties toolProperties;
    private ScriptedModelClient model;
    private final List<String> executionOrder = new CopyOnWriteArrayList<>();
    private RecordingTool deleteTool;
    private RecordingTool readTool;
    private RecordingTool folderTool;

    @BeforeEach
    void setUp() {
        modelCallExecutor = Executors.newCachedThreadPool();
        timeoutScheduler = Executors.newSingleThreadScheduledExecutor();
        properties = new AgentProperties();
        toolProperties = new ToolProperties();
        toolProperties.getApproval().put("create_note", false);
        model = new ScriptedModelClient();
        deleteTool = new RecordingTool("delete_note", true, executionOrder);
        readTool = new RecordingTool("read_note", false, executionOrder);
        folderTool = new RecordingTool("create_folder", false, executionOrder);
    }

    @AfterEach
    void tearDown() {
        modelCallExecutor.shutdownNow();
        timeoutScheduler.shutdownNow();
    }

    private AgentLoop newLoop() {
        List<AgentTool> tools = List.of(
                new CreateNoteTool(new WorkspaceFiles(toolProperties)), deleteTool, readTool, folderTool,
                new AttemptCompletionTool());
        ToolRegistry registry = new ToolRegistry(tools, toolProperties);
        SearchCapability search = mock(SearchCapability.class);
        return new AgentLoop("test-session", model, registry,
                new MessageParser(registry.getToolNames(), new ObjectMapper()),
                new PromptBuilder(registry, properties),
                new ContextEnricher(search, properties),
                new NoToolReplyPolicy(properties),
                properties, modelCallExecutor, timeoutScheduler);
    }

    private TaskContext context() {
        return TaskContext.builder()
                .workspacePath(workspace.toString())
                .mode(AgentMode.EDITOR)
                .build();
    }

    private static long countUserMessagesStartingWith(AgentState state, String prefix) {
        return state.getMessages().stream()
                .filter(m -> m.getRole() == Message.Role.user)
                .filter(m -> m.getContent().startsWith(prefix))
                .count();
    }

    // ─── Scenarios ────────────────────────────────────────────────────────────

    @Test
    void createNote_thenCompletionMarker_completesAfterOneExecution() {
        model.reply("<create_note>\n<path>notes/a.md</path>\n<content>\n# A\n</content>\n</create_note>")
                .reply("Created the note.\n[TASK_COMPLETE]");
        AgentLoop loop = newLoop();

        loop.startTask("create a file notes/a.md", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(state.getMessages()).filteredOn(m -> m.getRole() == Message.Role.assistant).hasSize(2);
        assertThat(countUserMessagesStartingWith(state, "[create_note] Result")).isEqualTo(1);
        assertThat(workspace.resolve("notes/a.md")).exists();
        assertThat(state.getConsecutiveErrorCount()).isZero();
        assertThat(state.getPendingTool()).isNull();
    }

    @Test
    void rejectedToolFollowedByChatter_exhaustsErrorBudget() {
        model.reply("<delete_note><path>a.md</path></delete_note>").reply(LONG_CHATTER)
                .reply("<delete_note><path>a.md</path></delete_note>").reply(LONG_CHATTER)
                .reply("<delete_note><path>a.md</path></delete_note>").reply(LONG_CHATTER);
        AgentLoop loop = newLoop();
        loop.on(AgentEventType.PENDING_TOOL, e -> loop.approveToolCall(false));

        loop.startTask("delete my old note", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.error);
        assertThat(state.getConsecutiveErrorCount()).isEqualTo(3);
        assertThat(state.getErrorMessage()).isEqualTo("Agent failed to use tools correctly");
        assertThat(countUserMessagesStartingWith(state, "The user rejected the tool call")).isEqualTo(3);
        assertThat(deleteTool.executions.get()).isZero();
        assertThat(state.getPendingTool()).isNull();
    }

    @Test
    void approvedTool_runsAndReturnsToRunning() {
        model.reply("<delete_note><path>a.md</path></delete_note>").reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();
        List<AgentStatus> statuses = new CopyOnWriteArrayList<>();
        loop.on(AgentEventType.STATUS_CHANGED, e -> statuses.add((AgentStatus) e.getPayload()));
        loop.on(AgentEventType.PENDING_TOOL, e -> loop.approveToolCall(true));

        loop.startTask("delete a.md", context());

        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(deleteTool.executions.get()).isEqualTo(1);
        assertThat(statuses).containsSubsequence(
                AgentStatus.running, AgentStatus.waiting_approval, AgentStatus.running, AgentStatus.completed);
    }

    @Test
    void abortWhileWaitingForApproval_rejectsAndAborts() throws Exception {
        model.reply("<delete_note><path>a.md</path></delete_note>");
        AgentLoop loop = newLoop();
        CountDownLatch waiting = new CountDownLatch(1);
        loop.on(AgentEventType.PENDING_TOOL, e -> waiting.countDown());

        CompletableFuture<Void> task = CompletableFuture.runAsync(() -> loop.startTask("delete a.md", context()));
        assertThat(waiting.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.waiting_approval);

        loop.abort();
        task.get(5, TimeUnit.SECONDS);

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.aborted);
        assertThat(state.getPendingTool()).isNull();
        assertThat(state.getErrorMessage()).isNull();
        assertThat(deleteTool.executions.get()).isZero();
        assertThat(loop.approveToolCall(true)).isFalse();
    }

    @Test
    void transportErrorsWithinBudget_retryAndComplete() {
        model.fail("connection reset").fail("connection reset").reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();

        loop.startTask("summarize my notes", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(countUserMessagesStartingWith(state, "[SYSTEM ERROR]")).isEqualTo(2);
        assertThat(state.getConsecutiveErrorCount()).isZero();
        assertThat(model.calls.get()).isEqualTo(3);
    }

    @Test
    void transportErrorsPastBudget_endInError() {
        model.fail("503").fail("503").fail("503");
        AgentLoop loop = newLoop();

        loop.startTask("summarize my notes", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.error);
        assertThat(state.getErrorMessage()).startsWith("Model call failed").contains("503");
        assertThat(state.getConsecutiveErrorCount()).isEqualTo(3);
    }

    @Test
    void malformedToolTag_isCountedNotThrown() {
        model.reply("<create_note><path>a.md</path><content>x</content>")
                .reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();

        loop.startTask("create a.md", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(countUserMessagesStartingWith(state, "[ERROR] You did not use a tool")).isEqualTo(1);
        assertThat(workspace.resolve("a.md")).doesNotExist();
    }

    @Test
    void failedTool_isReportedBackToTheModel() {
        readTool.failWith("Note not found: missing.md");
        model.reply("<read_note><path>missing.md</path></read_note>").reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();

        loop.startTask("read missing.md", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(state.getMessages()).anySatisfy(m ->
                assertThat(m.getContent()).startsWith("[read_note] Error:").contains("Note not found"));
    }

    @Test
    void chatIntent_acceptsFreeText() {
        model.reply(LONG_CHATTER);
        AgentLoop loop = newLoop();

        loop.startTask("what do you think about my plan", context().withIntent(TaskIntent.CHAT));

        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(model.calls.get()).isEqualTo(1);
    }

    @Test
    void terminalState_ignoresSignals_andNextTaskKeepsHistory() {
        model.reply("[TASK_COMPLETE]").reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();
        loop.startTask("first task", context());
        int messagesAfterFirst = loop.getState().getMessages().size();

        loop.abort();
        assertThat(loop.approveToolCall(true)).isFalse();
        assertThat(loop.retryTimedOutRequest()).isFalse();
        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.completed);

        loop.startTask("second task", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(state.getMessages()).hasSize(messagesAfterFirst + 2);
        assertThat(state.getMessages()).filteredOn(m -> m.getRole() == Message.Role.system).hasSize(1);
        assertThat(state.getMessages().get(0).getRole()).isEqualTo(Message.Role.system);
        assertThat(state.getTask()).isEqualTo("second task");
    }

    @Test
    void startTask_whileRunning_isRejected() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        model.block(entered, new CountDownLatch(1));
        AgentLoop loop = newLoop();

        CompletableFuture<Void> task = CompletableFuture.runAsync(() -> loop.startTask("long task", context()));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> loop.startTask("another", context()))
                .isInstanceOf(TaskAlreadyRunningException.class);
        assertThatThrownBy(loop::clearChat).isInstanceOf(TaskAlreadyRunningException.class);

        loop.abort();
        task.get(5, TimeUnit.SECONDS);
        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.aborted);
        assertThat(loop.getState().getLlmRequestStartTime()).isNull();
    }

    @Test
    void timeoutRetry_appendsHintOnce_withoutReplayingTools() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        model.reply("<read_note><path>a.md</path></read_note>")
                .block(entered, new CountDownLatch(1))
                .reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();

        CompletableFuture<Void> task = CompletableFuture.runAsync(() -> loop.startTask("read a.md", context()));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(loop.retryTimedOutRequest()).isTrue();
        task.get(5, TimeUnit.SECONDS);

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(readTool.executions.get()).isEqualTo(1);
        assertThat(countUserMessagesStartingWith(state, "[NOTICE]")).isEqualTo(1);
        assertThat(state.getMessages()).extracting(Message::getRole).containsExactly(
                Message.Role.system,
                Message.Role.user,
                Message.Role.assistant,
                Message.Role.user,
                Message.Role.user,
                Message.Role.assistant);
        assertThat(state.getMessages().get(4).getContent()).contains("retry #1");
        assertThat(state.getConsecutiveErrorCount()).isZero();
    }

    @Test
    void slowModelCall_isReportedOnce() throws Exception {
        properties.getTimeout().setThreshold(Duration.ofMillis(50));
        properties.getTimeout().setCheckInterval(Duration.ofMillis(10));
        CountDownLatch release = new CountDownLatch(1);
        model.block(new CountDownLatch(1), release);
        AgentLoop loop = newLoop();
        AtomicInteger timeouts = new AtomicInteger();
        CountDownLatch reported = new CountDownLatch(1);
        loop.on(AgentEventType.REQUEST_TIMEOUT, e -> {
            timeouts.incrementAndGet();
            reported.countDown();
        });

        CompletableFuture<Void> task = CompletableFuture.runAsync(() -> loop.startTask("slow task", context()));
        assertThat(reported.await(5, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(100);
        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.running);

        release.countDown();
        task.get(5, TimeUnit.SECONDS);

        assertThat(timeouts.get()).isEqualTo(1);
        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.completed);
    }

    @Test
    void toolsInOneReply_runInDocumentOrder() {
        model.reply("<create_folder><path>projects</path></create_folder>\n"
                        + "<read_note><path>projects/plan.md</path></read_note>")
                .reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();

        loop.startTask("set up a projects folder", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(executionOrder).containsExactly("create_folder", "read_note");
        assertThat(state.getMessages()).filteredOn(m -> m.getRole() == Message.Role.user)
                .extracting(m -> m.getContent().substring(0, m.getContent().indexOf(']') + 1))
                .containsSubsequence("[create_folder]", "[read_note]");
    }

    @Test
    void attemptCompletionAlongsideOtherTools_runsAllThenCompletes() {
        model.reply("<read_note><path>a.md</path></read_note>\n"
                + "<attempt_completion><result>Read the note.</result></attempt_completion>");
        AgentLoop loop = newLoop();

        loop.startTask("read a.md", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(model.calls.get()).isEqualTo(1);
        assertThat(readTool.executions.get()).isEqualTo(1);
        assertThat(countUserMessagesStartingWith(state, "[read_note] Result")).isEqualTo(1);
        assertThat(countUserMessagesStartingWith(state, "[attempt_completion] Result")).isEqualTo(1);
    }

    @Test
    void rejectionMidReply_skipsLaterCalls() {
        model.reply("<read_note><path>a.md</path></read_note>\n"
                        + "<delete_note><path>a.md</path></delete_note>\n"
                        + "<create_folder><path>archive</path></create_folder>")
                .reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();
        loop.on(AgentEventType.PENDING_TOOL, e -> loop.approveToolCall(false));

        loop.startTask("archive a.md", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(executionOrder).containsExactly("read_note");
        assertThat(deleteTool.executions.get()).isZero();
        assertThat(folderTool.executions.get()).isZero();
        assertThat(state.getMessages()).anySatisfy(m -> assertThat(m.getContent())
                .startsWith("The user rejected the tool call: delete_note.")
                .contains("The 1 tool call(s) after it"));
        assertThat(model.calls.get()).isEqualTo(2);
    }

    @Test
    void abortDuringFirstTool_stopsTheSecond() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        readTool.blockUntil(entered, release);
        model.reply("<read_note><path>a.md</path></read_note>\n"
                + "<create_folder><path>archive</path></create_folder>");
        AgentLoop loop = newLoop();

        CompletableFuture<Void> task = CompletableFuture.runAsync(() -> loop.startTask("archive a.md", context()));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        loop.abort();
        release.countDown();
        task.get(5, TimeUnit.SECONDS);

        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.aborted);
        assertThat(readTool.executions.get()).isEqualTo(1);
        assertThat(folderTool.executions.get()).isZero();
        assertThat(model.calls.get()).isEqualTo(1);
    }

    @Test
    void abortWhileModelCallInFlight_appendsNoErrorMessage() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        model.block(entered, new CountDownLatch(1));
        AgentLoop loop = newLoop();

        CompletableFuture<Void> task = CompletableFuture.runAsync(() -> loop.startTask("summarize", context()));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        loop.abort();
        task.get(5, TimeUnit.SECONDS);

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.aborted);
        assertThat(state.getErrorMessage()).isNull();
        assertThat(countUserMessagesStartingWith(state, "[SYSTEM ERROR]")).isZero();
        assertThat(state.getMessages()).filteredOn(m -> m.getRole() == Message.Role.assistant).isEmpty();
        assertThat(state.getConsecutiveErrorCount()).isZero();
    }

    @Test
    void newTask_isRefusedUntilAbortedThreadReturns_andIsNotTerminatedByIt() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        readTool.blockUntil(entered, release);
        model.reply("<read_note><path>a.md</path></read_note>").reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();

        CompletableFuture<Void> first = CompletableFuture.runAsync(() -> loop.startTask("first task", context()));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        loop.abort();
        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.aborted);
        assertThat(loop.isBusy()).isTrue();

        assertThatThrownBy(() -> loop.startTask("second task", context()))
                .isInstanceOf(TaskAlreadyRunningException.class);
        assertThatThrownBy(loop::clearChat).isInstanceOf(TaskAlreadyRunningException.class);
        assertThatThrownBy(() -> loop.setMessages(List.of()))
                .isInstanceOf(TaskAlreadyRunningException.class);

        release.countDown();
        first.get(5, TimeUnit.SECONDS);
        assertThat(loop.isBusy()).isFalse();

        loop.startTask("second task", context());

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.completed);
        assertThat(state.getTask()).isEqualTo("second task");
        assertThat(model.calls.get()).isEqualTo(2);
    }

    @Test
    void claimedTask_reservesLoopUntilRunOrReleased() {
        model.reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();

        AgentLoop.TaskHandle unstarted = loop.claimTask("never scheduled", context(), null);
        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.running);
        assertThatThrownBy(() -> loop.claimTask("another", context(), null))
                .isInstanceOf(TaskAlreadyRunningException.class);

        loop.releaseUnstarted(unstarted, "could not be scheduled");
        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.error);
        assertThat(loop.getState().getErrorMessage()).isEqualTo("could not be scheduled");
        assertThatThrownBy(() -> loop.runTask(unstarted)).isInstanceOf(IllegalStateException.class);

        loop.runTask(loop.claimTask("real task", context(), null));
        assertThat(loop.getState().getStatus()).isEqualTo(AgentStatus.completed);
    }

    @Test
    void displayMessage_isRecordedAsTheTask_whileModelSeesFullMessage() {
        model.reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();
        TaskContext context = context().withDisplayMessage("Summarize @plan.md");

        loop.startTask("Summarize this note:\n# Plan\nship it", context);

        AgentState state = loop.getState();
        assertThat(state.getTask()).isEqualTo("Summarize @plan.md");
        assertThat(model.histories.get(0).get(1).getContent()).contains("# Plan\nship it");
    }

    @Test
    void clearChat_dropsHistoryAndReturnsToIdle() {
        model.reply("[TASK_COMPLETE]");
        AgentLoop loop = newLoop();
        loop.startTask("first task", context());

        loop.clearChat();

        AgentState state = loop.getState();
        assertThat(state.getStatus()).isEqualTo(AgentStatus.idle);
        assertThat(state.getMessages()).isEmpty();
    }

    // ─── Fakes ────────────────────────────────────────────────────────────────

    /** Model that answers from a script, one step per call. */
    static class ScriptedModelClient implements ModelClient {

        interface Step {
            ModelReply run() throws Exception;
        }

        private final Queue<Step> steps = new ConcurrentLinkedQueue<>();
        final AtomicInteger calls = new AtomicInteger();
        final List<List<Message>> histories = new CopyOnWriteArrayList<>();

        ScriptedModelClient reply(String text) {
            steps.add(() -> ModelReply.of(text));
            return this;
        }

        ScriptedModelClient fail(String error) {
            steps.add(() -> {
                throw new ModelTransportException(error);
            });
            return this;
        }

        /** Blocks until released or interrupted, then answers with completion. */
        ScriptedModelClient block(CountDownLatch entered, CountDownLatch release) {
            steps.add(() -> {
                entered.countDown();
                release.await();
                return ModelReply.of("[TASK_COMPLETE]");
            });
            return this;
        }

        @Override
        public ModelReply call(List<Message> messages, ModelCallOptions options) {
            calls.incrementAndGet();
            histories.add(new ArrayList<>(messages));
            Step step = steps.poll();
            if (step == null) {
                throw new IllegalStateException("Model script exhausted");
            }
            try {
                return step.run();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new ModelTransportException("Interrupted", e);
            }
        }
    }

    static class RecordingTool implements AgentTool {

        private final String name;
        private final boolean approval;
        private final List<String> executionOrder;
        private String failure;
        private CountDownLatch entered;
        private CountDownLatch release;
        final AtomicInteger executions = new AtomicInteger();

        RecordingTool(String name, boolean approval, List<String> executionOrder) {
            this.name = name;
            this.approval = approval;
            this.executionOrder = executionOrder;
        }

        void failWith(String error) {
            this.failure = error;
        }

        /** Makes execute() signal {@code entered} and wait for {@code release}. */
        void blockUntil(CountDownLatch entered, CountDownLatch release) {
            this.entered = entered;
            this.release = release;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getDescription() {
            return "Test tool " + name;
        }

        @Override
        public List<ToolParameter> getParameters() {
            return List.of(ToolParameter.required("path", "Note path"));
        }

        @Override
        public boolean requiresApproval() {
            return approval;
        }

        @Override
        public ToolResult execute(Map<String, Object> params, ToolContext context) {
            executions.incrementAndGet();
            executionOrder.add(name);
            if (entered != null) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ToolResult.failure("interrupted");
                }
            }
            return failure != null ? ToolResult.failure(failure) : ToolResult.ok(name + " done");
        }
    }
}
