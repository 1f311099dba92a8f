package com.bazaarvoice.feedgate.admission.limits;

import com.bazaarvoice.feedgate.shape.api.RelativeDuration;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Adds {@code refillRate} tokens every {@code interval}, up to a burst of {@code maxTokens}.
 */
public final class TokenBucketLimiter extends LimiterConfig {

    private final int _refillRate;
    private final String _interval;
    private final int _maxTokens;

    @JsonCreator
    public TokenBucketLimiter(@JsonProperty ("refillRate") int refillRate,
                              @JsonProperty ("interval") String interval,
                              @JsonProperty ("maxTokens") int maxTokens) {
        _refillRate = refillRate;
        _interval = interval;
        _maxTokens = maxTokens;
    }

    @JsonProperty ("refillRate")
    public int getRefillRate() {
        return _refillRate;
    }

    @JsonProperty ("interval")
    public String getInterval() {
        return _interval;
    }

    @JsonProperty ("maxTokens")
    public int getMaxTokens() {
        return _maxTokens;
    }

    @Override
    public void validate() {
        checkArgument(_refillRate > 0, "refillRate must be positive: %s", _refillRate);
        checkArgument(RelativeDuration.isValid(_interval), "Invalid interval: %s", _interval);
        checkArgument(_maxTokens > 0, "maxTokens must be positive: %s", _maxTokens);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TokenBucketLimiter)) {
            return false;
        }
        TokenBucketLimiter that = (TokenBucketLimiter) o;
        return _refillRate == that._refillRate &&
                _maxTokens == that._maxTokens &&
                Objects.equal(_interval, that._interval);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_refillRate, _interval, _maxTokens);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("refillRate", _refillRate)
                .add("interval", _interval)
                .add("maxTokens", _maxTokens)
                .toString();
    }
}
