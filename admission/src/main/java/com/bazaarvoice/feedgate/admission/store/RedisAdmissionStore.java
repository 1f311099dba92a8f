package com.bazaarvoice.feedgate.admission.store;

import com.google.common.annotations.VisibleForTesting;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.StringCodec;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * {@link AdmissionStore} backed by one Redis sorted set per tenant, scored by acquisition time in epoch millis.
 * The acquire sequence runs as a single Lua script so concurrent callers on every gateway instance observe it
 * atomically.
 */
public class RedisAdmissionStore implements AdmissionStore {

    // KEYS[1] = tenant key; ARGV = now millis, window millis, limit, request id
    @VisibleForTesting
    static final String ACQUIRE_SCRIPT =
            "local now = tonumber(ARGV[1])\n" +
            "local window = tonumber(ARGV[2])\n" +
            "local limit = tonumber(ARGV[3])\n" +
            "redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', '(' .. (now - window))\n" +
            "redis.call('ZADD', KEYS[1], now, ARGV[4])\n" +
            "redis.call('PEXPIRE', KEYS[1], window)\n" +
            "if redis.call('ZCARD', KEYS[1]) > limit then\n" +
            "  redis.call('ZREM', KEYS[1], ARGV[4])\n" +
            "  return 0\n" +
            "end\n" +
            "return 1\n";

    private final RedissonClient _redisson;
    private final String _keyPrefix;
    private final Clock _clock;

    public RedisAdmissionStore(RedissonClient redisson, String keyPrefix, Clock clock) {
        _redisson = requireNonNull(redisson, "redisson");
        _keyPrefix = requireNonNull(keyPrefix, "keyPrefix");
        _clock = requireNonNull(clock, "clock");
    }

    @Override
    public boolean tryAcquire(String tenantKey, String requestId, int limit, Duration window) {
        requireNonNull(requestId, "requestId");
        checkArgument(!window.isNegative() && !window.isZero(), "window must be positive");

        List<Object> keys = Collections.singletonList(keyFor(tenantKey));
        Long granted;
        try {
            granted = _redisson.getScript(StringCodec.INSTANCE).eval(
                    RScript.Mode.READ_WRITE, ACQUIRE_SCRIPT, RScript.ReturnType.INTEGER, keys,
                    _clock.millis(), window.toMillis(), limit, requestId);
        } catch (RedisException e) {
            throw new AdmissionStoreException("Failed to acquire admission slot for " + tenantKey, e);
        }
        if (granted == null) {
            throw new AdmissionStoreException("No reply acquiring admission slot for " + tenantKey);
        }
        return granted == 1L;
    }

    @Override
    public void release(String tenantKey, String requestId) {
        try {
            _redisson.<String>getScoredSortedSet(keyFor(tenantKey), StringCodec.INSTANCE).remove(requestId);
        } catch (RedisException e) {
            throw new AdmissionStoreException("Failed to release admission slot for " + tenantKey, e);
        }
    }

    @Override
    public int count(String tenantKey, Duration window) {
        double cutoff = _clock.millis() - window.toMillis();
        try {
            return _redisson.<String>getScoredSortedSet(keyFor(tenantKey), StringCodec.INSTANCE)
                    .count(cutoff, true, Double.POSITIVE_INFINITY, true);
        } catch (RedisException e) {
            throw new AdmissionStoreException("Failed to count admission slots for " + tenantKey, e);
        }
    }

    @VisibleForTesting
    String keyFor(String tenantKey) {
        return _keyPrefix + ":" + requireNonNull(tenantKey, "tenantKey");
    }
}
