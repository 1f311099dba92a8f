package com.bazaarvoice.feedgate.shape.time;

import com.bazaarvoice.feedgate.shape.api.RelativeDuration;

import javax.annotation.Nullable;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Turns a relative time window such as "24h" into an absolute lower bound, never further back than the maximum
 * look-back.  The clamp bounds the size of the initial snapshot an origin has to compute.
 */
public class DurationResolver {

    private final Duration _maxLookBack;

    public DurationResolver(Duration maxLookBack) {
        checkArgument(!maxLookBack.isNegative() && !maxLookBack.isZero(), "maxLookBack must be positive");
        _maxLookBack = maxLookBack;
    }

    /**
     * Returns {@code now} minus the window, clamped to {@code now} minus the maximum look-back, or empty if the
     * window does not parse.  An empty result means the caller applies no lower bound.
     */
    public Optional<Instant> resolveCutoff(@Nullable String window, Instant now) {
        return RelativeDuration.parse(window)
                .map(duration -> duration.compareTo(_maxLookBack) > 0 ? _maxLookBack : duration)
                .map(now::minus);
    }

    public Duration getMaxLookBack() {
        return _maxLookBack;
    }
}
