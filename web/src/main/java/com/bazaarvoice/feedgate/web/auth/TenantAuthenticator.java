package com.bazaarvoice.feedgate.web.auth;

import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;

import javax.annotation.Nullable;
import javax.ws.rs.NotAuthorizedException;

/**
 * Resolves the caller of a request to the tenant it acts for.  The gateway trusts the result without further checks.
 */
public interface TenantAuthenticator {

    String BEARER_PREFIX = "Bearer ";

    /**
     * @param authorizationHeader the raw {@code Authorization} request header, possibly null
     * @throws NotAuthorizedException if the header is missing or names no known tenant
     */
    TenantEnvironment authenticate(@Nullable String authorizationHeader) throws NotAuthorizedException;
}
