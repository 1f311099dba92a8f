package com.bazaarvoice.feedgate.checkpoint;

import com.bazaarvoice.feedgate.checkpoint.store.CheckpointEntry;
import com.bazaarvoice.feedgate.checkpoint.store.CheckpointStore;
import com.bazaarvoice.feedgate.checkpoint.store.CheckpointStoreException;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLog;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLogFactory;
import com.bazaarvoice.feedgate.common.dropwizard.time.ClockTicker;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Maps a continuation handle to the absolute cutoff that was resolved when its subscription started, so every
 * resumed poll of that subscription filters on the same lower bound.
 * <p>
 * Two tiers: a bounded in-process cache in front of a {@link CheckpointStore} shared by every instance.  The local
 * tier is never authoritative; a local miss always consults the shared tier.  Entries younger than the fresh window
 * are returned as-is.  Entries between the fresh and stale windows are returned and rewritten with the same cutoff
 * and a new write time.  Older entries are misses.
 * <p>
 * Shared store failures are treated as misses, so the caller falls back to resolving a new cutoff.
 */
public class CheckpointCache {

    private static final Logger _log = LoggerFactory.getLogger(CheckpointCache.class);

    private final CheckpointStore _store;
    private final Cache<String, CheckpointEntry> _local;
    private final Duration _freshWindow;
    private final Duration _staleWindow;
    private final Clock _clock;
    private final RateLimitedLog _rateLimitedLog;
    private final Meter _freshHits;
    private final Meter _staleHits;
    private final Meter _misses;
    private final Meter _storeFailures;

    @Inject
    public CheckpointCache(CheckpointStore store, CheckpointConfiguration configuration, Clock clock,
                           MetricRegistry metricRegistry, RateLimitedLogFactory logFactory) {
        this(store, configuration.getFreshWindow().toJavaDuration(), configuration.getStaleWindow().toJavaDuration(),
                configuration.getLocalCacheSize(), clock, metricRegistry, logFactory);
    }

    public CheckpointCache(CheckpointStore store, Duration freshWindow, Duration staleWindow, long localCacheSize,
                           Clock clock, MetricRegistry metricRegistry, RateLimitedLogFactory logFactory) {
        checkArgument(freshWindow.compareTo(staleWindow) <= 0, "Fresh window cannot exceed the stale window");
        _store = requireNonNull(store, "store");
        _freshWindow = freshWindow;
        _staleWindow = staleWindow;
        _clock = requireNonNull(clock, "clock");
        _local = CacheBuilder.newBuilder()
                .ticker(ClockTicker.getTicker(clock))
                .expireAfterWrite(staleWindow.toMillis(), TimeUnit.MILLISECONDS)
                .maximumSize(localCacheSize)
                .build();
        _rateLimitedLog = logFactory.from(_log);
        _freshHits = metricRegistry.meter(MetricRegistry.name("bv.feedgate.checkpoint", "CheckpointCache", "fresh"));
        _staleHits = metricRegistry.meter(MetricRegistry.name("bv.feedgate.checkpoint", "CheckpointCache", "stale"));
        _misses = metricRegistry.meter(MetricRegistry.name("bv.feedgate.checkpoint", "CheckpointCache", "miss"));
        _storeFailures = metricRegistry.meter(MetricRegistry.name("bv.feedgate.checkpoint", "CheckpointCache", "store-failures"));
    }

    /**
     * Returns the cutoff pinned for the handle, or empty if there is none or it is past the stale window.
     */
    public Optional<Instant> get(String handle) {
        requireNonNull(handle, "handle");
        CheckpointEntry entry = _local.getIfPresent(handle);
        if (entry == null) {
            try {
                entry = _store.get(handle).orElse(null);
            } catch (CheckpointStoreException e) {
                _storeFailures.mark();
                _rateLimitedLog.warn(e, "Checkpoint store unavailable, treating lookup as a miss");
            }
            if (entry == null) {
                _misses.mark();
                return Optional.empty();
            }
            _local.put(handle, entry);
        }

        Instant now = _clock.instant();
        Duration age = Duration.between(entry.getWrittenAt(), now);
        if (age.compareTo(_freshWindow) < 0) {
            _freshHits.mark();
            return Optional.of(entry.getCutoff());
        }
        if (age.compareTo(_staleWindow) < 0) {
            _staleHits.mark();
            revalidate(handle, entry.rewrittenAt(now));
            return Optional.of(entry.getCutoff());
        }

        _local.invalidate(handle);
        _misses.mark();
        return Optional.empty();
    }

    /**
     * Pins the cutoff for a newly minted handle.  A handle that already has a cutoff keeps it.
     */
    public void set(String handle, Instant cutoff) {
        requireNonNull(handle, "handle");
        CheckpointEntry entry = new CheckpointEntry(cutoff, _clock.instant());
        try {
            if (_store.putIfAbsent(handle, entry, _staleWindow)) {
                _local.put(handle, entry);
            } else {
                _log.debug("Checkpoint for handle {} already exists, keeping the original cutoff", handle);
                _local.invalidate(handle);
            }
        } catch (CheckpointStoreException e) {
            _storeFailures.mark();
            _rateLimitedLog.warn(e, "Checkpoint store unavailable, checkpoint kept on this instance only");
            _local.asMap().putIfAbsent(handle, entry);
        }
    }

    private void revalidate(String handle, CheckpointEntry refreshed) {
        _local.put(handle, refreshed);
        try {
            _store.put(handle, refreshed, _staleWindow);
        } catch (CheckpointStoreException e) {
            _storeFailures.mark();
            _rateLimitedLog.warn(e, "Checkpoint store unavailable, unable to revalidate stale checkpoint");
        }
    }
}
