package com.bazaarvoice.feedgate.checkpoint.store;

import com.google.common.collect.Maps;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * {@link CheckpointStore} for a single instance.  Expired entries are dropped when next read or written.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ConcurrentMap<String, Expiring> _entries = Maps.newConcurrentMap();
    private final Clock _clock;

    public InMemoryCheckpointStore(Clock clock) {
        _clock = requireNonNull(clock, "clock");
    }

    @Override
    public Optional<CheckpointEntry> get(String handle) {
        Expiring expiring = _entries.get(handle);
        if (expiring == null) {
            return Optional.empty();
        }
        if (expiring.isExpired(_clock.instant())) {
            _entries.remove(handle, expiring);
            return Optional.empty();
        }
        return Optional.of(expiring._entry);
    }

    @Override
    public boolean putIfAbsent(String handle, CheckpointEntry entry, Duration ttl) {
        Instant now = _clock.instant();
        Expiring created = new Expiring(entry, now.plus(ttl));
        Expiring result = _entries.merge(handle, created, (existing, ignore) -> existing.isExpired(now) ? created : existing);
        return result == created;
    }

    @Override
    public void put(String handle, CheckpointEntry entry, Duration ttl) {
        _entries.put(handle, new Expiring(entry, _clock.instant().plus(ttl)));
    }

    private static class Expiring {
        private final CheckpointEntry _entry;
        private final Instant _expiresAt;

        Expiring(CheckpointEntry entry, Instant expiresAt) {
            _entry = requireNonNull(entry, "entry");
            _expiresAt = expiresAt;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(_expiresAt);
        }
    }
}
