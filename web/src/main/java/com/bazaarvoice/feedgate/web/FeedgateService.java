package com.bazaarvoice.feedgate.web;

import com.bazaarvoice.feedgate.admission.ConcurrencyAdmissionController;
import com.bazaarvoice.feedgate.admission.limits.TenantLimitsProvider;
import com.bazaarvoice.feedgate.common.redis.SharedStorage;
import com.bazaarvoice.feedgate.shape.RealtimeGateway;
import com.bazaarvoice.feedgate.web.auth.TenantAuthenticator;
import com.bazaarvoice.feedgate.web.health.RedisHealthCheck;
import com.bazaarvoice.feedgate.web.jersey.ExceptionMappers;
import com.bazaarvoice.feedgate.web.resources.limits.LimitsResource1;
import com.bazaarvoice.feedgate.web.resources.realtime.RealtimeResource1;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.dropwizard.Application;
import io.dropwizard.setup.Environment;
import org.redisson.api.RedissonClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FeedgateService extends Application<FeedgateConfiguration> {

    private static final Logger _log = LoggerFactory.getLogger(FeedgateService.class);

    public static void main(String... args) throws Exception {
        new FeedgateService().run(args);
    }

    @Override
    public String getName() {
        return "feedgate";
    }

    @Override
    public void run(FeedgateConfiguration configuration, Environment environment)
            throws Exception {
        _log.info("Starting with {} origins and {} shared storage",
                configuration.getShapeConfiguration().getOrigins().size(), configuration.getStorage());

        // Configure Jersey exception mappers
        for (Object mapper : ExceptionMappers.getMappers()) {
            environment.jersey().register(mapper);
        }

        // Build every component before registering resources so no request arrives before the gateway is ready
        Injector injector = Guice.createInjector(new FeedgateModule(configuration, environment));

        TenantAuthenticator authenticator = injector.getInstance(TenantAuthenticator.class);
        environment.jersey().register(new RealtimeResource1(
                injector.getInstance(RealtimeGateway.class),
                authenticator,
                configuration.getShapeConfiguration().getLongPollTimeout().toJavaDuration()));
        environment.jersey().register(new LimitsResource1(
                injector.getInstance(TenantLimitsProvider.class),
                injector.getInstance(ConcurrencyAdmissionController.class),
                authenticator));

        if (configuration.getStorage() == SharedStorage.REDIS) {
            environment.healthChecks().register("redis", new RedisHealthCheck(injector.getInstance(RedissonClient.class)));
        }
    }
}
