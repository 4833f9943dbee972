package com.eventrelay.common.idempotency.store;

import com.eventrelay.common.idempotency.IdempotencyKeys;
import com.eventrelay.common.idempotency.IdempotencyRecord;
import com.eventrelay.common.idempotency.IdempotencyStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

public class RedisIdempotencyStore implements IdempotencyStore {

    private static final Logger log = LoggerFactory.getLogger(RedisIdempotencyStore.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RedisIdempotencyStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this(redisTemplate, objectMapper, Clock.systemUTC());
    }

    public RedisIdempotencyStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Optional<IdempotencyRecord> find(String key) {
        String raw = redisTemplate.opsForValue().get(key);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw, IdempotencyRecord.class));
        } catch (JsonProcessingException e) {
            log.error("Unreadable idempotency record key={}", IdempotencyKeys.mask(key), e);
            throw new IdempotencyStoreException("Unreadable idempotency record key=" + IdempotencyKeys.mask(key), e);
        }
    }

    @Override
    public boolean createPending(String key, Duration ttl) {
        String json = write(IdempotencyRecord.pending(key, expiresAt(ttl)));
        Boolean ok = redisTemplate.opsForValue().setIfAbsent(key, json, normalize(ttl));
        return Boolean.TRUE.equals(ok);
    }

    @Override
    public void complete(String key, JsonNode response, Duration ttl) {
        String json = write(IdempotencyRecord.completed(key, response, expiresAt(ttl)));
        redisTemplate.opsForValue().set(key, json, normalize(ttl));
    }

    @Override
    public void delete(String key) {
        redisTemplate.delete(key);
    }

    private long expiresAt(Duration ttl) {
        return clock.millis() + normalize(ttl).toMillis();
    }

    private Duration normalize(Duration ttl) {
        return ttl.getSeconds() < 1 ? Duration.ofSeconds(1) : ttl;
    }

    private String write(IdempotencyRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize idempotency record key=" + IdempotencyKeys.mask(record.key()), e);
        }
    }
}
