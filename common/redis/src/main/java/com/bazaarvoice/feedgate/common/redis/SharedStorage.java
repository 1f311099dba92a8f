package com.bazaarvoice.feedgate.common.redis;

/**
 * Where the cross-instance state (admission slots, durable checkpoints) lives.
 */
public enum SharedStorage {
    /** Redis via Redisson; required whenever more than one gateway instance serves traffic. */
    REDIS,
    /** In-process maps, for local development and tests only. */
    MEMORY
}
