package com.bazaarvoice.feedgate.admission;

import com.bazaarvoice.feedgate.admission.limits.ConcurrencyLimitProvider;
import com.bazaarvoice.feedgate.admission.limits.TenantLimitsProvider;
import com.bazaarvoice.feedgate.admission.store.AdmissionStore;
import com.bazaarvoice.feedgate.admission.store.InMemoryAdmissionStore;
import com.bazaarvoice.feedgate.admission.store.RedisAdmissionStore;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLogFactory;
import com.bazaarvoice.feedgate.common.redis.SharedStorage;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.PrivateModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.redisson.api.RedissonClient;

import java.time.Clock;

/**
 * Guice module for constructing a {@link ConcurrencyAdmissionController}.
 * <p>
 * Requires the following external references:
 * <ul>
 * <li> {@link AdmissionConfiguration}
 * <li> {@link SharedStorage}
 * <li> {@link RedissonClient}, only resolved when the shared storage is {@link SharedStorage#REDIS}
 * <li> {@link Clock}
 * <li> {@link MetricRegistry}
 * <li> {@link RateLimitedLogFactory}
 * </ul>
 * Exports the following:
 * <ul>
 * <li> {@link ConcurrencyAdmissionController}
 * <li> {@link ConcurrencyLimitProvider}
 * <li> {@link TenantLimitsProvider}
 * </ul>
 */
public class AdmissionModule extends PrivateModule {

    @Override
    protected void configure() {
        bind(ConcurrencyAdmissionController.class).asEagerSingleton();
        expose(ConcurrencyAdmissionController.class);

        bind(TenantLimitsProvider.class).asEagerSingleton();
        bind(ConcurrencyLimitProvider.class).to(TenantLimitsProvider.class);
        expose(TenantLimitsProvider.class);
        expose(ConcurrencyLimitProvider.class);
    }

    @Provides @Singleton @SharedAdmissionStore
    AdmissionStore provideSharedAdmissionStore(SharedStorage storage, AdmissionConfiguration configuration,
                                               Provider<RedissonClient> redisson, Clock clock) {
        if (storage == SharedStorage.MEMORY) {
            return new InMemoryAdmissionStore(clock);
        }
        return new RedisAdmissionStore(redisson.get(), configuration.getKeyPrefix(), clock);
    }

    @Provides @Singleton @FallbackAdmissionStore
    AdmissionStore provideFallbackAdmissionStore(Clock clock) {
        return new InMemoryAdmissionStore(clock);
    }
}
