package com.bazaarvoice.feedgate.web.resources.limits;

import com.bazaarvoice.feedgate.admission.ConcurrencyAdmissionController;
import com.bazaarvoice.feedgate.admission.limits.TenantLimits;
import com.bazaarvoice.feedgate.admission.limits.TenantLimitsProvider;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.bazaarvoice.feedgate.web.auth.TenantAuthenticator;
import com.google.common.collect.ImmutableMap;

import javax.ws.rs.GET;
import javax.ws.rs.HeaderParam;
import javax.ws.rs.Path;
import javax.ws.rs.Produces;
import javax.ws.rs.core.HttpHeaders;
import javax.ws.rs.core.MediaType;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Reports the limits that apply to the caller and how much of its realtime concurrency it is using.
 */
@Path ("/realtime/v1/limits")
@Produces (MediaType.APPLICATION_JSON)
public class LimitsResource1 {

    private final TenantLimitsProvider _limitsProvider;
    private final ConcurrencyAdmissionController _admissionController;
    private final TenantAuthenticator _authenticator;

    public LimitsResource1(TenantLimitsProvider limitsProvider, ConcurrencyAdmissionController admissionController,
                           TenantAuthenticator authenticator) {
        _limitsProvider = requireNonNull(limitsProvider, "limitsProvider");
        _admissionController = requireNonNull(admissionController, "admissionController");
        _authenticator = requireNonNull(authenticator, "authenticator");
    }

    @GET
    public Map<String, Object> getLimits(@HeaderParam (HttpHeaders.AUTHORIZATION) String authorization) {
        TenantEnvironment tenant = _authenticator.authenticate(authorization);
        TenantLimits limits = _limitsProvider.getLimits(tenant);
        return ImmutableMap.<String, Object>builder()
                .put("organizationId", tenant.getOrganizationId())
                .put("environmentId", tenant.getEnvironmentId())
                .put("concurrencyLimit", limits.getConcurrencyLimit())
                .put("liveRequests", _admissionController.countLiveRequests(tenant))
                .put("apiRateLimiter", limits.getApiRateLimiter())
                .build();
    }
}
