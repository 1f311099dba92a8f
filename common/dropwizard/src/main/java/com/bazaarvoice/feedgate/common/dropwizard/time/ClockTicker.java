package com.bazaarvoice.feedgate.common.dropwizard.time;

import com.google.common.base.Ticker;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

import static java.util.Objects.requireNonNull;

/**
 * Guava {@link Ticker} driven by a {@link Clock}.  Caches built with this ticker expire entries on the same timeline
 * as the business logic that reads {@link Clock#instant()}, which lets tests move both forward together with a single
 * mocked clock.  Resolution is milliseconds.
 */
public final class ClockTicker {

    private static final Ticker SYSTEM_UTC = new ClockTickerImpl(Clock.systemUTC());

    private ClockTicker() {
        // empty
    }

    public static Ticker getDefault() {
        return SYSTEM_UTC;
    }

    public static Ticker getTicker(Clock clock) {
        if (Clock.systemUTC().equals(clock)) {
            return SYSTEM_UTC;
        }
        return new ClockTickerImpl(clock);
    }

    private static class ClockTickerImpl extends Ticker {
        private final Clock _clock;

        private ClockTickerImpl(Clock clock) {
            _clock = requireNonNull(clock, "clock");
        }

        @Override
        public long read() {
            return TimeUnit.MILLISECONDS.toNanos(_clock.millis());
        }
    }
}
