package com.z254.robi.domain.repository.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.robi.config.RobiProperties;
import com.z254.robi.domain.model.ConversationMessage;
import com.z254.robi.domain.model.MessageRole;
import com.z254.robi.domain.repository.ConversationHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Redis-backed conversation history. Each session is a sorted set scored by message index,
 * with a companion counter key handing out indexes. Prefix replacement runs as one Lua script.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "robi.storage.type", havingValue = "redis")
public class RedisConversationHistoryRepository implements ConversationHistoryRepository {

    private static final RedisScript<Long> REPLACE_PREFIX = RedisScript.of("""
            local head = redis.call('ZRANGE', KEYS[1], 0, 0, 'WITHSCORES')
            if #head == 0 or tonumber(head[2]) ~= tonumber(ARGV[1]) then
              return 0
            end
            local last = redis.call('ZRANGEBYSCORE', KEYS[1], ARGV[2], ARGV[2])
            if #last == 0 then
              return 0
            end
            redis.call('ZREMRANGEBYSCORE', KEYS[1], ARGV[1], ARGV[2])
            redis.call('ZADD', KEYS[1], ARGV[1], ARGV[3])
            return 1
            """, Long.class);

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration ttl;

    public RedisConversationHistoryRepository(
            ReactiveRedisTemplate<String, String> redisTemplate,
            ObjectMapper objectMapper,
            RobiProperties robiProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keyPrefix = robiProperties.getStorage().getKeyPrefix() + "history:";
        this.ttl = robiProperties.getStorage().getHistoryTtl();
    }

    @Override
    public Mono<ConversationMessage> append(String sessionId, MessageRole role, String content) {
        String key = messagesKey(sessionId);
        return redisTemplate.opsForValue()
                .increment(sequenceKey(sessionId))
                .flatMap(sequence -> {
                    ConversationMessage message = ConversationMessage.builder()
                            .sessionId(sessionId)
                            .role(role)
                            .content(content)
                            .index(sequence - 1)
                            .timestamp(Instant.now())
                            .build();
                    return redisTemplate.opsForZSet()
                            .add(key, serialize(message), message.getIndex())
                            .then(redisTemplate.expire(key, ttl))
                            .then(redisTemplate.expire(sequenceKey(sessionId), ttl))
                            .thenReturn(message);
                })
                .doOnSuccess(message -> log.debug("Appended message {} to session {}",
                        message.getIndex(), sessionId));
    }

    @Override
    public Flux<ConversationMessage> findBySessionId(String sessionId) {
        return redisTemplate.opsForZSet()
                .rangeByScore(messagesKey(sessionId), Range.unbounded())
                .map(this::deserialize);
    }

    @Override
    public Mono<Long> count(String sessionId) {
        return redisTemplate.opsForZSet().size(messagesKey(sessionId));
    }

    @Override
    public Mono<Boolean> replacePrefix(String sessionId, long firstIndex, long lastIndex, String summaryContent) {
        ConversationMessage summary = ConversationMessage.builder()
                .sessionId(sessionId)
                .role(MessageRole.USER)
                .content(summaryContent)
                .index(firstIndex)
                .compactionSummary(true)
                .timestamp(Instant.now())
                .build();
        return redisTemplate.execute(REPLACE_PREFIX,
                        List.of(messagesKey(sessionId)),
                        List.of(String.valueOf(firstIndex), String.valueOf(lastIndex), serialize(summary)))
                .next()
                .map(applied -> applied == 1L)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Void> deleteBySessionId(String sessionId) {
        return redisTemplate.delete(messagesKey(sessionId), sequenceKey(sessionId)).then();
    }

    private String messagesKey(String sessionId) {
        return keyPrefix + sessionId;
    }

    private String sequenceKey(String sessionId) {
        return keyPrefix + sessionId + ":seq";
    }

    private String serialize(ConversationMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize conversation message", e);
        }
    }

    private ConversationMessage deserialize(String json) {
        try {
            return objectMapper.readValue(json, ConversationMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize conversation message", e);
        }
    }
}
