package com.lumina.agent.exception;

/**
 * Raised inside the loop when the task's cancellation token fires.
 * Always ends the task as aborted, never retried.
 */
public class TaskCancelledException extends AgentException {

    public TaskCancelledException() {
        super("Task was cancelled");
    }
}
