package com.bazaarvoice.feedgate.checkpoint;

import com.bazaarvoice.feedgate.checkpoint.store.CheckpointStore;
import com.bazaarvoice.feedgate.checkpoint.store.InMemoryCheckpointStore;
import com.bazaarvoice.feedgate.checkpoint.store.RedisCheckpointStore;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLogFactory;
import com.bazaarvoice.feedgate.common.redis.SharedStorage;
import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.PrivateModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.redisson.api.RedissonClient;

import java.time.Clock;

/**
 * Guice module for constructing a {@link CheckpointCache}.
 * <p>
 * Requires the following external references:
 * <ul>
 * <li> {@link CheckpointConfiguration}
 * <li> {@link SharedStorage}
 * <li> {@link RedissonClient}, only resolved when the shared storage is {@link SharedStorage#REDIS}
 * <li> {@link ObjectMapper}
 * <li> {@link Clock}
 * <li> {@link MetricRegistry}
 * <li> {@link RateLimitedLogFactory}
 * </ul>
 * Exports the following:
 * <ul>
 * <li> {@link CheckpointCache}
 * </ul>
 */
public class CheckpointModule extends PrivateModule {

    @Override
    protected void configure() {
        bind(CheckpointCache.class).asEagerSingleton();
        expose(CheckpointCache.class);
    }

    @Provides @Singleton
    CheckpointStore provideCheckpointStore(SharedStorage storage, CheckpointConfiguration configuration,
                                           Provider<RedissonClient> redisson, ObjectMapper objectMapper, Clock clock) {
        if (storage == SharedStorage.MEMORY) {
            return new InMemoryCheckpointStore(clock);
        }
        return new RedisCheckpointStore(redisson.get(), configuration.getKeyPrefix(), objectMapper);
    }
}
