package com.lumina.agent.exception;

public class TaskAlreadyRunningException extends AgentException {

    public TaskAlreadyRunningException(String sessionId) {
        super("A task is already running for session '" + sessionId + "'. Abort it first.");
    }
}
