package com.bazaarvoice.feedgate.web.auth;

import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import com.google.inject.Inject;

import javax.annotation.Nullable;
import javax.ws.rs.NotAuthorizedException;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * {@link TenantAuthenticator} backed by a static map of API keys, presented as {@code Authorization: Bearer <key>}.
 */
public class ApiKeyTenantAuthenticator implements TenantAuthenticator {

    private static final String CHALLENGE = "Bearer";

    private final Map<String, TenantEnvironment> _tenantsByApiKey;

    @Inject
    public ApiKeyTenantAuthenticator(TenantAuthConfiguration configuration) {
        this(configuration.getApiKeys());
    }

    public ApiKeyTenantAuthenticator(Map<String, TenantEnvironment> tenantsByApiKey) {
        _tenantsByApiKey = ImmutableMap.copyOf(requireNonNull(tenantsByApiKey, "tenantsByApiKey"));
    }

    @Override
    public TenantEnvironment authenticate(@Nullable String authorizationHeader) {
        String apiKey = parseApiKey(authorizationHeader);
        if (apiKey == null) {
            throw new NotAuthorizedException("Missing API key", CHALLENGE);
        }
        TenantEnvironment tenant = _tenantsByApiKey.get(apiKey);
        if (tenant == null) {
            throw new NotAuthorizedException("Invalid API key", CHALLENGE);
        }
        return tenant;
    }

    @Nullable
    private static String parseApiKey(@Nullable String authorizationHeader) {
        if (Strings.isNullOrEmpty(authorizationHeader)
                || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return Strings.emptyToNull(authorizationHeader.substring(BEARER_PREFIX.length()).trim());
    }
}
