package com.lumina.agent.memory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lumina.agent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Redis copy of a conversation's history, so a client can restore it through
 * {@code AgentLoop.setMessages} after a restart.
 *
 * - Key pattern: lumina:conversation:{sessionId}:messages
 * - Stored as one JSON array, read and written whole
 * - TTL reset on every write
 *
 * The loop never reads this; a failed write is logged and the task result stands.
 */
@Component
@Slf4j
public class ConversationStore {

    private static final String KEY_PREFIX = "lumina:conversation:";
    private static final String KEY_SUFFIX = ":messages";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${agent.conversation.ttl-minutes:1440}")
    private long ttlMinutes;

    public ConversationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Empty when the conversation was never saved, expired, or cannot be read.
     */
    public Optional<List<Message>> load(String sessionId) {
        String json;
        try {
            json = redisTemplate.opsForValue().get(buildKey(sessionId));
        } catch (DataAccessException e) {
            log.error("Failed to read conversation for session: {}", sessionId, e);
            return Optional.empty();
        }

        if (json == null) {
            log.debug("No saved conversation for session: {}", sessionId);
            return Optional.empty();
        }

        try {
            List<Message> messages = objectMapper.readValue(json, new TypeReference<>() {});
            log.debug("Loaded {} messages for session: {}", messages.size(), sessionId);
            return Optional.of(messages);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize conversation for session: {}", sessionId, e);
            return Optional.empty();
        }
    }

    public void save(String sessionId, List<Message> messages) {
        try {
            String json = objectMapper.writeValueAsString(messages);
            redisTemplate.opsForValue().set(buildKey(sessionId), json, Duration.ofMinutes(ttlMinutes));
            log.debug("Saved {} messages for session: {} (TTL: {}m)", messages.size(), sessionId, ttlMinutes);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize conversation for session: {}", sessionId, e);
        } catch (DataAccessException e) {
            log.error("Failed to save conversation for session: {}", sessionId, e);
        }
    }

    public void clear(String sessionId) {
        redisTemplate.delete(buildKey(sessionId));
        log.info("Cleared saved conversation for session: {}", sessionId);
    }

    private String buildKey(String sessionId) {
        return KEY_PREFIX + sessionId + KEY_SUFFIX;
    }
}
