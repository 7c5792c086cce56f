package com.lumina.agent.core;

import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.exception.TaskAlreadyRunningException;
import com.lumina.agent.llm.ModelClient;
import com.lumina.agent.prompt.PromptBuilder;
import com.lumina.agent.search.ContextEnricher;
import com.lumina.agent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Owns one {@link AgentLoop} per conversation id. Loops share the stateless
 * collaborators and the thread pools; each keeps its own state.
 */
@Component
@Slf4j
public class AgentSessionRegistry {

    private final ConcurrentMap<String, AgentLoop> loops = new ConcurrentHashMap<>();

    private final ModelClient modelClient;
    private final ToolRegistry toolRegistry;
    private final MessageParser messageParser;
    private final PromptBuilder promptBuilder;
    private final ContextEnricher contextEnricher;
    private final NoToolReplyPolicy noToolReplyPolicy;
    private final AgentProperties agentProperties;
    private final ExecutorService modelCallExecutor;
    private final ScheduledExecutorService timeoutScheduler;

    public AgentSessionRegistry(ModelClient modelClient,
                                ToolRegistry toolRegistry,
                                MessageParser messageParser,
                                PromptBuilder promptBuilder,
                                ContextEnricher contextEnricher,
                                NoToolReplyPolicy noToolReplyPolicy,
                                AgentProperties agentProperties,
                                @Qualifier("modelCallExecutor") ExecutorService modelCallExecutor,
                                @Qualifier("timeoutScheduler") ScheduledExecutorService timeoutScheduler) {
        this.modelClient = modelClient;
        this.toolRegistry = toolRegistry;
        this.messageParser = messageParser;
        this.promptBuilder = promptBuilder;
        this.contextEnricher = contextEnricher;
        this.noToolReplyPolicy = noToolReplyPolicy;
        this.agentProperties = agentProperties;
        this.modelCallExecutor = modelCallExecutor;
        this.timeoutScheduler = timeoutScheduler;
    }

    public AgentLoop getOrCreate(String sessionId) {
        return loops.computeIfAbsent(sessionId, id -> {
            log.info("Creating agent loop [session={}]", id);
            return new AgentLoop(id, modelClient, toolRegistry, messageParser, promptBuilder,
                    contextEnricher, noToolReplyPolicy, agentProperties, modelCallExecutor, timeoutScheduler);
        });
    }

    public Optional<AgentLoop> find(String sessionId) {
        return Optional.ofNullable(loops.get(sessionId));
    }

    /**
     * Forgets a conversation. A loop with an active task has to be aborted first.
     */
    public void remove(String sessionId) {
        AgentLoop loop = loops.get(sessionId);
        if (loop == null) {
            return;
        }
        if (loop.isBusy() || loop.getState().getStatus().isActive()) {
            throw new TaskAlreadyRunningException(sessionId);
        }
        loops.remove(sessionId, loop);
        log.info("Removed agent loop [session={}]", sessionId);
    }

    public int size() {
        return loops.size();
    }
}
