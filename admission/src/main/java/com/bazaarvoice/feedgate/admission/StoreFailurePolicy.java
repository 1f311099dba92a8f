package com.bazaarvoice.feedgate.admission;

/**
 * What the admission controller does when the shared admission store cannot be reached.
 */
public enum StoreFailurePolicy {
    /**
     * Enforce the same limit against an in-process store.  Concurrency stays bounded per instance, so the cluster
     * wide worst case is the number of instances times the limit.
     */
    LOCAL_FALLBACK,

    /** Reject the request as if the tenant were over its limit. */
    REJECT,

    /** Admit the request without holding a slot. */
    ADMIT
}
