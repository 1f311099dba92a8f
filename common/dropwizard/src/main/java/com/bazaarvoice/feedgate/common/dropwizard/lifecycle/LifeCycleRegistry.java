package com.bazaarvoice.feedgate.common.dropwizard.lifecycle;

import io.dropwizard.lifecycle.Managed;

/**
 * Registry that starts and stops each registered {@link Managed} along with the server.  The Redis client and the
 * rate-limited log executor register here so they shut down cleanly without depending on Dropwizard's
 * {@code Environment} directly.
 */
public interface LifeCycleRegistry {
    <T extends Managed> T manage(T managed);
}
