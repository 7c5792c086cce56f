package com.lumina.agent.core;

@FunctionalInterface
public interface AgentEventListener {

    void onEvent(AgentEvent event);
}
