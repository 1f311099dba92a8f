package com.bazaarvoice.feedgate.web.auth;

import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Maps;

import javax.validation.constraints.NotNull;
import java.util.Map;

/**
 * API keys accepted by the gateway and the tenant each one acts for.
 */
public class TenantAuthConfiguration {

    @NotNull
    @JsonProperty ("apiKeys")
    private Map<String, TenantEnvironment> _apiKeys = Maps.newHashMap();

    public Map<String, TenantEnvironment> getApiKeys() {
        return _apiKeys;
    }

    public TenantAuthConfiguration setApiKeys(Map<String, TenantEnvironment> apiKeys) {
        _apiKeys = apiKeys;
        return this;
    }
}
