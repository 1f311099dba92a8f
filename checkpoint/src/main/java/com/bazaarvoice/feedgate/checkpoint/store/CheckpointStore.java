package com.bazaarvoice.feedgate.checkpoint.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Durable tier of the checkpoint cache, shared by every gateway instance.  All methods throw
 * {@link CheckpointStoreException} when the store cannot be reached.
 */
public interface CheckpointStore {

    Optional<CheckpointEntry> get(String handle);

    /**
     * Stores the entry only if the handle has none yet.
     *
     * @return true if the entry was stored
     */
    boolean putIfAbsent(String handle, CheckpointEntry entry, Duration ttl);

    /** Stores the entry, replacing any existing one and restarting its time to live. */
    void put(String handle, CheckpointEntry entry, Duration ttl);
}
