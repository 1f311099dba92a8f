package com.bazaarvoice.feedgate.web.auth;

import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

import javax.ws.rs.NotAuthorizedException;

import static org.testng.Assert.assertEquals;

public class ApiKeyTenantAuthenticatorTest {

    private static final TenantEnvironment TENANT = new TenantEnvironment("env_1", "org_1");

    private final ApiKeyTenantAuthenticator _authenticator =
            new ApiKeyTenantAuthenticator(ImmutableMap.of("tr_dev_abc123", TENANT));

    @Test
    public void testKnownKey() {
        assertEquals(_authenticator.authenticate("Bearer tr_dev_abc123"), TENANT);
    }

    @Test
    public void testSchemeIsCaseInsensitive() {
        assertEquals(_authenticator.authenticate("bearer  tr_dev_abc123 "), TENANT);
    }

    @Test (expectedExceptions = NotAuthorizedException.class)
    public void testUnknownKey() {
        _authenticator.authenticate("Bearer tr_dev_other");
    }

    @Test (expectedExceptions = NotAuthorizedException.class)
    public void testMissingHeader() {
        _authenticator.authenticate(null);
    }

    @Test (expectedExceptions = NotAuthorizedException.class)
    public void testWrongScheme() {
        _authenticator.authenticate("Basic dXNlcjpwYXNz");
    }

    @Test (expectedExceptions = NotAuthorizedException.class)
    public void testEmptyKey() {
        _authenticator.authenticate("Bearer ");
    }
}
