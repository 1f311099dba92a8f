package com.bazaarvoice.feedgate.shape;

import com.bazaarvoice.feedgate.admission.ConcurrencyAdmissionController;
import com.bazaarvoice.feedgate.admission.limits.ConcurrencyLimitProvider;
import com.bazaarvoice.feedgate.checkpoint.CheckpointCache;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLogFactory;
import com.bazaarvoice.feedgate.shape.poll.LongPollExecutor;
import com.bazaarvoice.feedgate.shape.poll.OriginClient;
import com.bazaarvoice.feedgate.shape.query.ShapeQueryBuilder;
import com.bazaarvoice.feedgate.shape.routing.OriginRouter;
import com.bazaarvoice.feedgate.shape.time.DurationResolver;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.PrivateModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

import java.time.Clock;

/**
 * Guice module for constructing the {@link RealtimeGateway}.
 * <p>
 * Requires the following external references:
 * <ul>
 * <li> {@link ShapeConfiguration}
 * <li> {@link OriginClient}
 * <li> {@link CheckpointCache}
 * <li> {@link ConcurrencyAdmissionController}
 * <li> {@link ConcurrencyLimitProvider}
 * <li> {@link Clock}
 * <li> {@link MetricRegistry}
 * <li> {@link RateLimitedLogFactory}
 * </ul>
 * Exports the following:
 * <ul>
 * <li> {@link RealtimeGateway}
 * </ul>
 */
public class ShapeModule extends PrivateModule {

    @Override
    protected void configure() {
        bind(LongPollExecutor.class).asEagerSingleton();
        bind(RealtimeGateway.class).asEagerSingleton();
        expose(RealtimeGateway.class);
    }

    @Provides @Singleton
    OriginRouter provideOriginRouter(ShapeConfiguration configuration) {
        return new OriginRouter(configuration.getOrigins());
    }

    @Provides @Singleton
    DurationResolver provideDurationResolver(ShapeConfiguration configuration) {
        return new DurationResolver(configuration.getMaxLookBack().toJavaDuration());
    }

    @Provides @Singleton
    ShapeQueryBuilder provideShapeQueryBuilder(ShapeConfiguration configuration) {
        return new ShapeQueryBuilder(configuration.getTable());
    }
}
