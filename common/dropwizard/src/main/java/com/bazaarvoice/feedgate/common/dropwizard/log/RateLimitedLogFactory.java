package com.bazaarvoice.feedgate.common.dropwizard.log;

import org.slf4j.Logger;

public interface RateLimitedLogFactory {

    /**
     * Returns a wrapper around {@code log} that reports each distinct message at most once per interval, where the
     * interval is chosen by the factory.
     */
    RateLimitedLog from(Logger log);
}
