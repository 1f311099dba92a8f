package com.bazaarvoice.feedgate.admission.limits;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * API rate limiter configuration.  A closed union discriminated by the {@code type} property; each variant carries
 * its own required fields and checks them in {@link #validate()}.
 */
@JsonTypeInfo (use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes ({
        @JsonSubTypes.Type (value = FixedWindowLimiter.class, name = "fixedWindow"),
        @JsonSubTypes.Type (value = SlidingWindowLimiter.class, name = "slidingWindow"),
        @JsonSubTypes.Type (value = TokenBucketLimiter.class, name = "tokenBucket")
})
public abstract class LimiterConfig {

    LimiterConfig() {
        // Only the variants in this package
    }

    /**
     * @throws IllegalArgumentException if a required field is missing or out of range
     */
    public abstract void validate();
}
