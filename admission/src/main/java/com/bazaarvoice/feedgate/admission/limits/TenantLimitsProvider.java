package com.bazaarvoice.feedgate.admission.limits;

import com.bazaarvoice.feedgate.admission.AdmissionConfiguration;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Resolves per-organization limit overrides against the configured defaults.  Overrides are raw JSON objects keyed
 * by organization id, for example:
 * <pre>
 * org_123:
 *   realtimeConcurrencyLimit: 250
 *   apiRateLimiter: {type: slidingWindow, window: 1m, tokens: 1000}
 * </pre>
 * Any part of an override that is missing or invalid falls back to the default for that part.
 */
public class TenantLimitsProvider implements ConcurrencyLimitProvider {

    private static final Logger _log = LoggerFactory.getLogger(TenantLimitsProvider.class);

    static final String CONCURRENCY_LIMIT_PROPERTY = "realtimeConcurrencyLimit";
    static final String API_RATE_LIMITER_PROPERTY = "apiRateLimiter";

    private final Map<String, JsonNode> _organizationOverrides;
    private final int _defaultConcurrencyLimit;
    private final LimiterConfig _defaultApiRateLimiter;

    @Inject
    public TenantLimitsProvider(AdmissionConfiguration configuration) {
        this(configuration.getOrganizationOverrides(), configuration.getDefaultConcurrencyLimit(),
                configuration.getDefaultApiRateLimiter());
    }

    public TenantLimitsProvider(Map<String, JsonNode> organizationOverrides, int defaultConcurrencyLimit,
                                LimiterConfig defaultApiRateLimiter) {
        checkArgument(defaultConcurrencyLimit > 0, "defaultConcurrencyLimit must be positive");
        defaultApiRateLimiter.validate();
        _organizationOverrides = ImmutableMap.copyOf(requireNonNull(organizationOverrides, "organizationOverrides"));
        _defaultConcurrencyLimit = defaultConcurrencyLimit;
        _defaultApiRateLimiter = defaultApiRateLimiter;
    }

    public TenantLimits getLimits(TenantEnvironment tenant) {
        JsonNode override = _organizationOverrides.get(tenant.getOrganizationId());
        return new TenantLimits(tenant, resolveConcurrencyLimit(tenant, override),
                LimiterConfigs.resolve(override != null ? override.get(API_RATE_LIMITER_PROPERTY) : null, _defaultApiRateLimiter));
    }

    @Override
    public int getConcurrencyLimit(TenantEnvironment tenant) {
        return resolveConcurrencyLimit(tenant, _organizationOverrides.get(tenant.getOrganizationId()));
    }

    private int resolveConcurrencyLimit(TenantEnvironment tenant, @Nullable JsonNode override) {
        JsonNode limit = override != null ? override.get(CONCURRENCY_LIMIT_PROPERTY) : null;
        if (limit == null || limit.isNull()) {
            return _defaultConcurrencyLimit;
        }
        if (limit.isIntegralNumber() && limit.canConvertToInt() && limit.intValue() > 0) {
            return limit.intValue();
        }
        _log.warn("Ignoring invalid {} override for organization {}: {}",
                CONCURRENCY_LIMIT_PROPERTY, tenant.getOrganizationId(), limit);
        return _defaultConcurrencyLimit;
    }
}
