package com.lumina.agent.exception;

/**
 * Base unchecked exception for agent failures that callers may want to map
 * to an HTTP status or a terminal task state.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
