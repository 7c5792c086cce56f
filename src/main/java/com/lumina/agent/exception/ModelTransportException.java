package com.lumina.agent.exception;

/**
 * A model call failed at the network or provider layer, or returned a body
 * that could not be read. Counts against the consecutive-error budget.
 */
public class ModelTransportException extends AgentException {

    public ModelTransportException(String message) {
        super(message);
    }

    public ModelTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
