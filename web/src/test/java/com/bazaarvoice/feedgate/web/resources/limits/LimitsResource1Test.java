package com.bazaarvoice.feedgate.web.resources.limits;

import com.bazaarvoice.feedgate.admission.ConcurrencyAdmissionController;
import com.bazaarvoice.feedgate.admission.limits.FixedWindowLimiter;
import com.bazaarvoice.feedgate.admission.limits.TenantLimitsProvider;
import com.bazaarvoice.feedgate.admission.limits.TokenBucketLimiter;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.bazaarvoice.feedgate.web.auth.TenantAuthenticator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

import java.util.Map;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertEquals;

public class LimitsResource1Test {

    private static final String AUTHORIZATION = "Bearer tr_dev_abc123";

    @Test
    public void testDefaultLimits() throws Exception {
        TenantEnvironment tenant = new TenantEnvironment("env_1", "org_1");
        Map<String, Object> limits = newResource(tenant, ImmutableMap.of(), 3).getLimits(AUTHORIZATION);

        assertEquals(limits.get("organizationId"), "org_1");
        assertEquals(limits.get("environmentId"), "env_1");
        assertEquals(limits.get("concurrencyLimit"), 100);
        assertEquals(limits.get("liveRequests"), 3);
        assertEquals(limits.get("apiRateLimiter"), new TokenBucketLimiter(250, "10s", 750));
    }

    @Test
    public void testOrganizationOverride() throws Exception {
        TenantEnvironment tenant = new TenantEnvironment("env_2", "org_big");
        JsonNode override = new ObjectMapper().readTree(
                "{\"realtimeConcurrencyLimit\":500,\"apiRateLimiter\":{\"type\":\"fixedWindow\",\"window\":\"1m\",\"tokens\":6000}}");
        Map<String, Object> limits = newResource(tenant, ImmutableMap.of("org_big", override), 0).getLimits(AUTHORIZATION);

        assertEquals(limits.get("concurrencyLimit"), 500);
        assertEquals(limits.get("liveRequests"), 0);
        assertEquals(limits.get("apiRateLimiter"), new FixedWindowLimiter("1m", 6000));
    }

    private LimitsResource1 newResource(TenantEnvironment tenant, Map<String, JsonNode> overrides, int liveRequests) {
        TenantAuthenticator authenticator = mock(TenantAuthenticator.class);
        when(authenticator.authenticate(AUTHORIZATION)).thenReturn(tenant);
        ConcurrencyAdmissionController admissionController = mock(ConcurrencyAdmissionController.class);
        when(admissionController.countLiveRequests(tenant)).thenReturn(liveRequests);

        TenantLimitsProvider limitsProvider = new TenantLimitsProvider(overrides, 100, new TokenBucketLimiter(250, "10s", 750));
        return new LimitsResource1(limitsProvider, admissionController, authenticator);
    }
}
