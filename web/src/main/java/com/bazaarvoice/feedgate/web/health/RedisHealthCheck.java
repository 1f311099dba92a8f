package com.bazaarvoice.feedgate.web.health;

import com.codahale.metrics.health.HealthCheck;
import org.redisson.api.RedissonClient;
import org.redisson.api.redisnode.RedisNodes;

import static java.util.Objects.requireNonNull;

/**
 * Reports whether the Redis server holding admission slots and checkpoints answers a ping.
 */
public class RedisHealthCheck extends HealthCheck {

    private final RedissonClient _redisson;

    public RedisHealthCheck(RedissonClient redisson) {
        _redisson = requireNonNull(redisson, "redisson");
    }

    @Override
    protected Result check() throws Exception {
        try {
            if (_redisson.getRedisNodes(RedisNodes.SINGLE).pingAll()) {
                return Result.healthy("Redis is healthy");
            }
            return Result.unhealthy("Redis did not answer a ping");
        } catch (Exception e) {
            return Result.unhealthy("Redis is unhealthy: " + e.getMessage());
        }
    }
}
