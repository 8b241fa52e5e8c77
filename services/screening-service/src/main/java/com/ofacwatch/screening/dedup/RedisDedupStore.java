package com.ofacwatch.screening.dedup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ofacwatch.screening.domain.AlertRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed store so uniqueness survives restarts and is shared by replicas.
 *
 * <p>Records live in one hash; {@code HSETNX} gives the atomic insert-if-absent. Command
 * timeouts come from {@code spring.data.redis.timeout}.</p>
 */
@Slf4j
public class RedisDedupStore implements DedupStore {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String hashKey;

    public RedisDedupStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String hashKey) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.hashKey = hashKey;
    }

    @Override
    public boolean recordIfNew(String key, AlertRecord record) {
        Objects.requireNonNull(key, "key");
        String payload = serialize(record);
        Boolean stored = hash().putIfAbsent(hashKey, key, payload);
        if (!Boolean.TRUE.equals(stored)) {
            log.debug("Dedup key already recorded in {}: {}", hashKey, key);
            return false;
        }
        return true;
    }

    @Override
    public Optional<AlertRecord> find(String key) {
        String payload = hash().get(hashKey, key);
        if (payload == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(payload, AlertRecord.class));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable alert record stored under " + key, e);
        }
    }

    @Override
    public long size() {
        Long size = hash().size(hashKey);
        return size == null ? 0L : size;
    }

    private HashOperations<String, String, String> hash() {
        return redisTemplate.opsForHash();
    }

    private String serialize(AlertRecord record) {
        try {
            return objectMapper.writeValueAsString(Objects.requireNonNull(record, "record"));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Alert record could not be serialized: " + record.dedupKey(), e);
        }
    }
}
