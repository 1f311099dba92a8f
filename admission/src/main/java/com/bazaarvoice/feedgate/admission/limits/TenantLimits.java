package com.bazaarvoice.feedgate.admission.limits;

import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.google.common.base.MoreObjects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Limits resolved for one tenant on one request.
 */
public class TenantLimits {

    private final TenantEnvironment _tenant;
    private final int _concurrencyLimit;
    private final LimiterConfig _apiRateLimiter;

    public TenantLimits(TenantEnvironment tenant, int concurrencyLimit, LimiterConfig apiRateLimiter) {
        checkArgument(concurrencyLimit > 0, "concurrencyLimit must be positive");
        _tenant = requireNonNull(tenant, "tenant");
        _concurrencyLimit = concurrencyLimit;
        _apiRateLimiter = requireNonNull(apiRateLimiter, "apiRateLimiter");
    }

    public TenantEnvironment getTenant() {
        return _tenant;
    }

    public int getConcurrencyLimit() {
        return _concurrencyLimit;
    }

    public LimiterConfig getApiRateLimiter() {
        return _apiRateLimiter;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("tenant", _tenant)
                .add("concurrencyLimit", _concurrencyLimit)
                .add("apiRateLimiter", _apiRateLimiter)
                .toString();
    }
}
