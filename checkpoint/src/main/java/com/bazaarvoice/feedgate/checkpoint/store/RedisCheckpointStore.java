package com.bazaarvoice.feedgate.checkpoint.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * {@link CheckpointStore} keeping each entry as a JSON string in its own Redis key with a time to live.
 */
public class RedisCheckpointStore implements CheckpointStore {

    private final RedissonClient _redisson;
    private final String _keyPrefix;
    private final ObjectMapper _objectMapper;

    public RedisCheckpointStore(RedissonClient redisson, String keyPrefix, ObjectMapper objectMapper) {
        _redisson = requireNonNull(redisson, "redisson");
        _keyPrefix = requireNonNull(keyPrefix, "keyPrefix");
        _objectMapper = requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public Optional<CheckpointEntry> get(String handle) {
        String json;
        try {
            json = bucket(handle).get();
        } catch (RedisException e) {
            throw new CheckpointStoreException("Failed to read checkpoint for handle " + handle, e);
        }
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(_objectMapper.readValue(json, CheckpointEntry.class));
        } catch (JsonProcessingException e) {
            throw new CheckpointStoreException("Unreadable checkpoint for handle " + handle, e);
        }
    }

    @Override
    public boolean putIfAbsent(String handle, CheckpointEntry entry, Duration ttl) {
        String json = toJson(entry);
        try {
            return bucket(handle).trySet(json, ttl.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RedisException e) {
            throw new CheckpointStoreException("Failed to write checkpoint for handle " + handle, e);
        }
    }

    @Override
    public void put(String handle, CheckpointEntry entry, Duration ttl) {
        String json = toJson(entry);
        try {
            bucket(handle).set(json, ttl.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RedisException e) {
            throw new CheckpointStoreException("Failed to write checkpoint for handle " + handle, e);
        }
    }

    private RBucket<String> bucket(String handle) {
        return _redisson.getBucket(keyFor(handle), StringCodec.INSTANCE);
    }

    private String toJson(CheckpointEntry entry) {
        try {
            return _objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            // Two longs always serialize
            throw new IllegalStateException(e);
        }
    }

    @VisibleForTesting
    String keyFor(String handle) {
        return _keyPrefix + ":" + requireNonNull(handle, "handle");
    }
}
