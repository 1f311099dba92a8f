package com.bazaarvoice.feedgate.web.lifecycle;

import com.bazaarvoice.feedgate.common.dropwizard.lifecycle.LifeCycleRegistry;
import com.google.inject.Inject;
import io.dropwizard.lifecycle.Managed;
import io.dropwizard.setup.Environment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Hands Feedgate's managed components to the Dropwizard server lifecycle.
 */
public class DropwizardLifeCycleRegistry implements LifeCycleRegistry {
    private static final Logger _log = LoggerFactory.getLogger(DropwizardLifeCycleRegistry.class);

    private final Environment _environment;

    @Inject
    public DropwizardLifeCycleRegistry(Environment environment) {
        _environment = requireNonNull(environment, "environment");
    }

    @Override
    public <T extends Managed> T manage(T managed) {
        requireNonNull(managed, "managed");
        _log.debug("Registering {} with the server lifecycle", managed);
        _environment.lifecycle().manage(managed);
        return managed;
    }
}
