package com.lumina.agent.core;

import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.model.AgentMode;
import com.lumina.agent.model.TaskContext;
import com.lumina.agent.model.TaskIntent;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Decides what a reply without tool calls or completion marker means.
 *
 * Order of checks:
 * 1. intent "chat" → conversational, the task is done (intent wins over mode)
 * 2. empty text or something shaped like a tool tag → the model fumbled a tool call
 * 3. neither an action mode (editor, organizer) nor an action intent (create, edit, organize)
 *    → free text is a legitimate answer
 * 4. otherwise accept only a question, or a short reply when the intent is not an explicit action
 *
 * Length and question checks run on the text without reasoning blocks and code fences.
 */
@Component
public class NoToolReplyPolicy {

    public enum Verdict {
        ACCEPT_AS_COMPLETION,
        DEMAND_TOOL_USE
    }

    private static final Pattern CODE_FENCE = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern POTENTIAL_TOOL_TAG = Pattern.compile("<[a-z]+(_[a-z]+)+", Pattern.CASE_INSENSITIVE);

    private final int shortReplyThreshold;

    public NoToolReplyPolicy(AgentProperties agentProperties) {
        this.shortReplyThreshold = agentProperties.getShortReplyThreshold();
    }

    public Verdict evaluate(String rawReply, TaskContext context) {
        String withoutReasoning = MessageParser.stripReasoning(rawReply).strip();
        String text = CODE_FENCE.matcher(withoutReasoning).replaceAll("").strip();

        TaskIntent intent = context.getIntent();
        if (intent == TaskIntent.CHAT) {
            return Verdict.ACCEPT_AS_COMPLETION;
        }

        if (text.isEmpty() || POTENTIAL_TOOL_TAG.matcher(text).find()) {
            return Verdict.DEMAND_TOOL_USE;
        }

        AgentMode mode = context.getMode();
        boolean actionMode = mode != null && mode.isActionOriented();
        boolean explicitAction = intent != null && intent.isExplicitAction();
        if (!actionMode && !explicitAction) {
            return Verdict.ACCEPT_AS_COMPLETION;
        }

        boolean question = text.contains("?") || text.contains("？");
        boolean shortReply = text.length() < shortReplyThreshold;
        if (question || (shortReply && !explicitAction)) {
            return Verdict.ACCEPT_AS_COMPLETION;
        }
        return Verdict.DEMAND_TOOL_USE;
    }
}
