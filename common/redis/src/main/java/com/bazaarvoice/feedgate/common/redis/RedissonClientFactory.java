package com.bazaarvoice.feedgate.common.redis;

import com.bazaarvoice.feedgate.common.dropwizard.lifecycle.LifeCycleRegistry;
import com.google.common.annotations.VisibleForTesting;
import io.dropwizard.lifecycle.Managed;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Builds the process-wide {@link RedissonClient} and ties its shutdown to the server life cycle.
 */
public class RedissonClientFactory {

    private static final Logger _log = LoggerFactory.getLogger(RedissonClientFactory.class);

    private final RedisConfiguration _configuration;

    public RedissonClientFactory(RedisConfiguration configuration) {
        _configuration = requireNonNull(configuration, "configuration");
    }

    public RedissonClient build(LifeCycleRegistry lifeCycle) {
        _log.info("Connecting to Redis at {} (database {})", _configuration.getAddress(), _configuration.getDatabase());
        final RedissonClient client = Redisson.create(toRedissonConfig());
        lifeCycle.manage(new Managed() {
            @Override
            public void start() {
                // Connected on creation
            }

            @Override
            public void stop() {
                if (!client.isShutdown()) {
                    client.shutdown();
                }
            }
        });
        return client;
    }

    private Config toRedissonConfig() {
        Config config = new Config();
        configureServer(config.useSingleServer());
        return config;
    }

    @VisibleForTesting
    SingleServerConfig configureServer(SingleServerConfig server) {
        server.setAddress(_configuration.getAddress())
                .setDatabase(_configuration.getDatabase())
                .setConnectionPoolSize(_configuration.getConnectionPoolSize())
                .setConnectionMinimumIdleSize(_configuration.getConnectionMinimumIdleSize())
                .setTimeout((int) _configuration.getTimeout().toMilliseconds())
                .setConnectTimeout((int) _configuration.getConnectTimeout().toMilliseconds())
                .setRetryAttempts(_configuration.getRetryAttempts());
        _configuration.getUsername().ifPresent(server::setUsername);
        _configuration.getPassword().ifPresent(server::setPassword);
        return server;
    }
}
