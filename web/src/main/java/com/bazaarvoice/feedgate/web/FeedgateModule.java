package com.bazaarvoice.feedgate.web;

import com.bazaarvoice.feedgate.admission.AdmissionConfiguration;
import com.bazaarvoice.feedgate.admission.AdmissionModule;
import com.bazaarvoice.feedgate.checkpoint.CheckpointConfiguration;
import com.bazaarvoice.feedgate.checkpoint.CheckpointModule;
import com.bazaarvoice.feedgate.common.dropwizard.lifecycle.LifeCycleRegistry;
import com.bazaarvoice.feedgate.common.dropwizard.log.DefaultRateLimitedLogFactory;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLogFactory;
import com.bazaarvoice.feedgate.common.redis.RedisConfiguration;
import com.bazaarvoice.feedgate.common.redis.RedissonClientFactory;
import com.bazaarvoice.feedgate.common.redis.SharedStorage;
import com.bazaarvoice.feedgate.shape.ShapeConfiguration;
import com.bazaarvoice.feedgate.shape.ShapeModule;
import com.bazaarvoice.feedgate.shape.poll.OriginClient;
import com.bazaarvoice.feedgate.web.auth.ApiKeyTenantAuthenticator;
import com.bazaarvoice.feedgate.web.auth.TenantAuthConfiguration;
import com.bazaarvoice.feedgate.web.auth.TenantAuthenticator;
import com.bazaarvoice.feedgate.web.client.JerseyOriginClient;
import com.bazaarvoice.feedgate.web.client.OriginHttpClient;
import com.bazaarvoice.feedgate.web.lifecycle.DropwizardLifeCycleRegistry;
import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.dropwizard.client.JerseyClientBuilder;
import io.dropwizard.client.JerseyClientConfiguration;
import io.dropwizard.setup.Environment;
import org.redisson.api.RedissonClient;

import javax.ws.rs.client.Client;
import java.time.Clock;

import static java.util.Objects.requireNonNull;

/**
 * Top-level Guice module.  Binds the configuration sections and the Dropwizard-provided services, then installs one
 * private module per gateway component.
 */
public class FeedgateModule extends AbstractModule {
    private final FeedgateConfiguration _configuration;
    private final Environment _environment;

    public FeedgateModule(FeedgateConfiguration configuration, Environment environment) {
        _configuration = requireNonNull(configuration, "configuration");
        _environment = requireNonNull(environment, "environment");
    }

    @Override
    protected void configure() {
        // Prevent accidents.  All bindings must be explicit.
        binder().requireExplicitBindings();

        bind(Environment.class).toInstance(_environment);
        bind(MetricRegistry.class).toInstance(_environment.metrics());
        bind(ObjectMapper.class).toInstance(_environment.getObjectMapper());
        bind(Clock.class).toInstance(Clock.systemUTC());
        bind(LifeCycleRegistry.class).to(DropwizardLifeCycleRegistry.class).asEagerSingleton();
        bind(RateLimitedLogFactory.class).to(DefaultRateLimitedLogFactory.class).asEagerSingleton();

        bind(SharedStorage.class).toInstance(_configuration.getStorage());
        bind(RedisConfiguration.class).toInstance(_configuration.getRedisConfiguration());
        bind(JerseyClientConfiguration.class).toInstance(_configuration.getHttpClientConfiguration());
        bind(TenantAuthConfiguration.class).toInstance(_configuration.getAuthConfiguration());
        bind(AdmissionConfiguration.class).toInstance(_configuration.getAdmissionConfiguration());
        bind(CheckpointConfiguration.class).toInstance(_configuration.getCheckpointConfiguration());
        bind(ShapeConfiguration.class).toInstance(_configuration.getShapeConfiguration());

        bind(TenantAuthenticator.class).to(ApiKeyTenantAuthenticator.class).asEagerSingleton();
        bind(OriginClient.class).to(JerseyOriginClient.class).asEagerSingleton();

        install(new AdmissionModule());
        install(new CheckpointModule());
        install(new ShapeModule());
    }

    /** Connects to Redis on first use, so a gateway running with {@code storage: memory} never does. */
    @Provides @Singleton
    RedissonClient provideRedissonClient(RedisConfiguration configuration, LifeCycleRegistry lifeCycle) {
        return new RedissonClientFactory(configuration).build(lifeCycle);
    }

    @Provides @Singleton @OriginHttpClient
    Client provideOriginHttpClient(JerseyClientConfiguration configuration, Environment environment) {
        return new JerseyClientBuilder(environment).using(configuration).build("origin");
    }
}
