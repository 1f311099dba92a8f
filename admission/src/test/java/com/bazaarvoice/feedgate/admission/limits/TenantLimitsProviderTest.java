package com.bazaarvoice.feedgate.admission.limits;

import com.bazaarvoice.feedgate.admission.AdmissionConfiguration;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class TenantLimitsProviderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String value) throws Exception {
        return MAPPER.readTree(value);
    }

    private TenantLimitsProvider newProvider(String organizationId, String override) throws Exception {
        AdmissionConfiguration configuration = new AdmissionConfiguration()
                .setDefaultConcurrencyLimit(100)
                .setOrganizationOverrides(ImmutableMap.of(organizationId, json(override)));
        return new TenantLimitsProvider(configuration);
    }

    @Test
    public void testDefaultsWithoutOverride() throws Exception {
        TenantLimitsProvider provider = newProvider("org_other", "{\"realtimeConcurrencyLimit\":5}");
        TenantLimits limits = provider.getLimits(new TenantEnvironment("env_1", "org_1"));

        assertEquals(limits.getConcurrencyLimit(), 100);
        assertEquals(limits.getApiRateLimiter(), new TokenBucketLimiter(250, "10s", 750));
    }

    @Test
    public void testOrganizationOverride() throws Exception {
        TenantLimitsProvider provider = newProvider("org_1",
                "{\"realtimeConcurrencyLimit\":250,\"apiRateLimiter\":{\"type\":\"fixedWindow\",\"window\":\"1m\",\"tokens\":60}}");
        TenantEnvironment tenant = new TenantEnvironment("env_1", "org_1");

        assertEquals(provider.getConcurrencyLimit(tenant), 250);
        assertEquals(provider.getLimits(tenant).getApiRateLimiter(), new FixedWindowLimiter("1m", 60));
    }

    @Test
    public void testInvalidConcurrencyOverrideUsesDefault() throws Exception {
        TenantEnvironment tenant = new TenantEnvironment("env_1", "org_1");

        assertEquals(newProvider("org_1", "{\"realtimeConcurrencyLimit\":0}").getConcurrencyLimit(tenant), 100);
        assertEquals(newProvider("org_1", "{\"realtimeConcurrencyLimit\":\"lots\"}").getConcurrencyLimit(tenant), 100);
        assertEquals(newProvider("org_1", "{\"realtimeConcurrencyLimit\":12.5}").getConcurrencyLimit(tenant), 100);
    }

    @Test
    public void testInvalidLimiterKeepsValidConcurrencyOverride() throws Exception {
        TenantLimitsProvider provider = newProvider("org_1",
                "{\"realtimeConcurrencyLimit\":7,\"apiRateLimiter\":{\"type\":\"tokenBucket\",\"refillRate\":-1}}");
        TenantLimits limits = provider.getLimits(new TenantEnvironment("env_1", "org_1"));

        assertEquals(limits.getConcurrencyLimit(), 7);
        assertEquals(limits.getApiRateLimiter(), new TokenBucketLimiter(250, "10s", 750));
    }
}
