package com.lumina.agent.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.agent.model.ToolCall;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw model output into tool calls, a completion flag and cleaned text.
 *
 * Grammar: {@code <tool_name><param>value</param>...</tool_name>}, any number of
 * invocations per reply, returned in document order. Only registered tool names
 * are recognized. A fragment is dropped, never thrown, when:
 * - its closing tag is missing or belongs to another tag
 * - its body holds anything besides parameter tags
 * - a parameter repeats
 * - an object-shaped value ({@code {...}}) is not valid JSON
 *
 * Reasoning blocks ({@code <thinking>}, {@code <think>}) are ignored for parsing;
 * tool tags written inside them are examples, not invocations.
 */
@Slf4j
public class MessageParser {

    public static final String COMPLETION_TOOL = "attempt_completion";
    public static final String COMPLETION_MARKER = "[TASK_COMPLETE]";

    private static final Pattern REASONING = Pattern.compile(
            "<(thinking|think)>[\\s\\S]*?</\\1>", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPEN_TAG = Pattern.compile("<([a-z][a-z0-9_]*)>");
    private static final Pattern PARAM = Pattern.compile("<([A-Za-z_][A-Za-z0-9_]*)>([\\s\\S]*?)</\\1>");

    private final Set<String> toolNames;
    private final ObjectMapper objectMapper;

    public MessageParser(Collection<String> toolNames, ObjectMapper objectMapper) {
        this.toolNames = Set.copyOf(toolNames);
        this.objectMapper = objectMapper;
    }

    public ParsedReply parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return new ParsedReply(List.of(), false, "");
        }

        String visible = stripReasoning(rawText);
        List<ToolCall> calls = new ArrayList<>();
        StringBuilder cleaned = new StringBuilder();
        int copiedUpTo = 0;
        int searchFrom = 0;

        Matcher open = OPEN_TAG.matcher(visible);
        while (searchFrom < visible.length() && open.find(searchFrom)) {
            String name = open.group(1);
            if (!toolNames.contains(name)) {
                searchFrom = open.end();
                continue;
            }

            String closeTag = "</" + name + ">";
            int close = visible.indexOf(closeTag, open.end());
            if (close < 0) {
                log.debug("Dropping <{}>: no closing tag", name);
                searchFrom = open.end();
                continue;
            }

            int fragmentEnd = close + closeTag.length();
            Optional<ToolCall> call = parseCall(name, visible.substring(open.end(), close));
            if (call.isPresent()) {
                calls.add(call.get());
                cleaned.append(visible, copiedUpTo, open.start());
                copiedUpTo = fragmentEnd;
            }
            searchFrom = fragmentEnd;
        }
        cleaned.append(visible.substring(copiedUpTo));

        boolean completion = visible.contains(COMPLETION_MARKER)
                || calls.stream().anyMatch(c -> COMPLETION_TOOL.equals(c.getName()));
        String cleanedText = cleaned.toString().replace(COMPLETION_MARKER, "").strip();

        return new ParsedReply(List.copyOf(calls), completion, cleanedText);
    }

    /**
     * Removes reasoning blocks. The stored transcript keeps them; only
     * classification and parsing work on the stripped text.
     */
    public static String stripReasoning(String text) {
        return text == null ? "" : REASONING.matcher(text).replaceAll("");
    }

    private Optional<ToolCall> parseCall(String name, String body) {
        Map<String, Object> params = new LinkedHashMap<>();
        StringBuilder residue = new StringBuilder();
        int last = 0;

        Matcher m = PARAM.matcher(body);
        while (m.find()) {
            residue.append(body, last, m.start());
            last = m.end();

            String key = m.group(1);
            Optional<Object> value = parseValue(m.group(2));
            if (value.isEmpty()) {
                log.debug("Dropping <{}>: parameter '{}' is not valid JSON", name, key);
                return Optional.empty();
            }
            if (params.putIfAbsent(key, value.get()) != null) {
                log.debug("Dropping <{}>: parameter '{}' repeats", name, key);
                return Optional.empty();
            }
        }
        residue.append(body.substring(last));

        if (!residue.toString().isBlank()) {
            log.debug("Dropping <{}>: unexpected text in body", name);
            return Optional.empty();
        }
        return Optional.of(ToolCall.builder().name(name).params(params).build());
    }

    private Optional<Object> parseValue(String raw) {
        String value = trimOneNewline(raw);
        String trimmed = value.strip();

        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            try {
                return Optional.of(objectMapper.readValue(trimmed, Object.class));
            } catch (JsonProcessingException e) {
                return Optional.empty();
            }
        }
        if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
            // Wiki links such as [[note]] look like arrays but are plain text
            try {
                return Optional.of(objectMapper.readValue(trimmed, Object.class));
            } catch (JsonProcessingException e) {
                return Optional.of(value);
            }
        }
        return Optional.of(value);
    }

    private static String trimOneNewline(String value) {
        String v = value;
        if (v.startsWith("\r\n")) v = v.substring(2);
        else if (v.startsWith("\n")) v = v.substring(1);
        if (v.endsWith("\r\n")) v = v.substring(0, v.length() - 2);
        else if (v.endsWith("\n")) v = v.substring(0, v.length() - 1);
        return v;
    }
}
