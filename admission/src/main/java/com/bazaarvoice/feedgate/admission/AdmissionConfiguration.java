package com.bazaarvoice.feedgate.admission;

import com.bazaarvoice.feedgate.admission.limits.LimiterConfig;
import com.bazaarvoice.feedgate.admission.limits.TokenBucketLimiter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.Maps;
import io.dropwizard.util.Duration;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;
import java.util.Map;

public class AdmissionConfiguration {

    /**
     * How long a slot counts against its tenant.  A slot that is never released stops counting after this long,
     * so it should exceed the longest live request the gateway lets through.
     */
    @Valid
    @NotNull
    @JsonProperty ("window")
    private Duration _window = Duration.minutes(5);

    @NotNull
    @JsonProperty ("keyPrefix")
    private String _keyPrefix = "feedgate:realtime:concurrency";

    @Min (1)
    @JsonProperty ("defaultConcurrencyLimit")
    private int _defaultConcurrencyLimit = 100;

    @NotNull
    @JsonProperty ("storeFailurePolicy")
    private StoreFailurePolicy _storeFailurePolicy = StoreFailurePolicy.LOCAL_FALLBACK;

    /**
     * Raw per-organization overrides.  Validated per request rather than at startup so one bad entry cannot keep
     * the service from starting.
     */
    @NotNull
    @JsonProperty ("organizationOverrides")
    private Map<String, JsonNode> _organizationOverrides = Maps.newHashMap();

    @NotNull
    @JsonProperty ("defaultApiRateLimiter")
    private LimiterConfig _defaultApiRateLimiter = new TokenBucketLimiter(250, "10s", 750);

    public Duration getWindow() {
        return _window;
    }

    public AdmissionConfiguration setWindow(Duration window) {
        _window = window;
        return this;
    }

    public String getKeyPrefix() {
        return _keyPrefix;
    }

    public AdmissionConfiguration setKeyPrefix(String keyPrefix) {
        _keyPrefix = keyPrefix;
        return this;
    }

    public int getDefaultConcurrencyLimit() {
        return _defaultConcurrencyLimit;
    }

    public AdmissionConfiguration setDefaultConcurrencyLimit(int defaultConcurrencyLimit) {
        _defaultConcurrencyLimit = defaultConcurrencyLimit;
        return this;
    }

    public StoreFailurePolicy getStoreFailurePolicy() {
        return _storeFailurePolicy;
    }

    public AdmissionConfiguration setStoreFailurePolicy(StoreFailurePolicy storeFailurePolicy) {
        _storeFailurePolicy = storeFailurePolicy;
        return this;
    }

    public Map<String, JsonNode> getOrganizationOverrides() {
        return _organizationOverrides;
    }

    public AdmissionConfiguration setOrganizationOverrides(Map<String, JsonNode> organizationOverrides) {
        _organizationOverrides = organizationOverrides;
        return this;
    }

    public LimiterConfig getDefaultApiRateLimiter() {
        return _defaultApiRateLimiter;
    }

    public AdmissionConfiguration setDefaultApiRateLimiter(LimiterConfig defaultApiRateLimiter) {
        _defaultApiRateLimiter = defaultApiRateLimiter;
        return this;
    }
}
