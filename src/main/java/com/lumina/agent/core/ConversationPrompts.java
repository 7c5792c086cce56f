package com.lumina.agent.core;

import com.lumina.agent.model.ToolCall;
import com.lumina.agent.model.ToolResult;

/**
 * Synthetic user-role messages the loop writes into the conversation.
 */
public final class ConversationPrompts {

    private ConversationPrompts() {
    }

    public static String toolResult(ToolCall call, ToolResult result) {
        if (result.isSuccess()) {
            return "[" + call.getName() + "] Result:\n" + nullToEmpty(result.getContent());
        }
        return "[" + call.getName() + "] Error:\n" + nullToEmpty(result.getError()) + """


                The system refused to run this tool call. Reflect before retrying:
                1. Is the tool name correct?
                2. Do the parameters follow the documented tag format?
                3. Are the values valid (file paths in particular)?

                In your next reply, analyse the cause inside <thinking> tags, then fix the call and try again.""";
    }

    public static String noToolUsed() {
        return """
                [ERROR] You did not use a tool in your previous response. Retry with a tool use.

                Reminders:
                - Call tools with the tag format: <tool_name><param>value</param></tool_name>
                - When the task is finished, call <attempt_completion> with a summary of the outcome
                - If you need more information from the user, ask a direct question""";
    }

    public static String toolRejected(String toolName, int skippedCalls) {
        String skipped = skippedCalls > 0
                ? " The " + skippedCalls + " tool call(s) after it in the same reply were not run either."
                : "";
        return "The user rejected the tool call: " + toolName + "." + skipped + "\n\n"
                + "Use <thinking> tags to consider why (the operation may be risky, the parameters wrong, "
                + "or not what the user wanted), then try another approach or ask the user what they need.";
    }

    public static String systemError(String message) {
        return "[SYSTEM ERROR] " + message + "\n\n"
                + "Use <thinking> tags to analyse the cause, then retry or take another approach.";
    }

    public static String timeoutRetry(int retryCount, long thresholdSeconds) {
        return "[NOTICE] The previous request took longer than " + thresholdSeconds
                + " seconds and was retried (retry #" + retryCount + "). "
                + "Continue the task from where the conversation stands; do not repeat tool calls that already succeeded.";
    }

    private static String nullToEmpty(String s) {
        return s != null ? s : "";
    }
}
