package com.lumina.agent.api;

import com.lumina.agent.core.AgentLoop;
import com.lumina.agent.memory.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Drives a claimed task off the request thread and saves the conversation once it is terminal.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentTaskRunner {

    private final ConversationStore conversationStore;

    @Async("agentTaskExecutor")
    public void run(AgentLoop loop, AgentLoop.TaskHandle task) {
        loop.runTask(task);
        conversationStore.save(loop.getSessionId(), loop.getState().getMessages());
        log.debug("Conversation saved [session={}]", loop.getSessionId());
    }
}
