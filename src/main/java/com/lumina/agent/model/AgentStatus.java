package com.lumina.agent.model;

public enum AgentStatus {
    idle,
    running,
    waiting_approval,
    completed,
    error,
    aborted;

    /** completed, error and aborted only leave through a new task. */
    public boolean isTerminal() {
        return this == completed || this == error || this == aborted;
    }

    public boolean isActive() {
        return this == running || this == waiting_approval;
    }
}
