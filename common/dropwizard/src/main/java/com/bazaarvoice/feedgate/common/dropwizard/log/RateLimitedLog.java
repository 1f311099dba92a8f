package com.bazaarvoice.feedgate.common.dropwizard.log;

/**
 * Logger wrapper for failures that tend to repeat on every request while they last, such as an unreachable Redis.
 * Repeats of the same message (ignoring arguments) are folded into a periodic summary.
 */
public interface RateLimitedLog {

    void warn(Throwable t, String message, Object... args);

    void error(Throwable t, String message, Object... args);
}
