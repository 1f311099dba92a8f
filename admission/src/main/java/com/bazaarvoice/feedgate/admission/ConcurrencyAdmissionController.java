package com.bazaarvoice.feedgate.admission;

import com.bazaarvoice.feedgate.admission.store.AdmissionStore;
import com.bazaarvoice.feedgate.admission.store.AdmissionStoreException;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLog;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLogFactory;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.google.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Per-tenant, time-windowed concurrency semaphore for live requests.  Unlike a local {@link java.util.concurrent.Semaphore}
 * the permits live in a store shared by every gateway instance, and a permit whose owner never releases it is
 * reclaimed once it is older than the admission window.  Rejection is immediate; there is no queue of waiters.
 * <p>
 * When the shared store is unreachable the configured {@link StoreFailurePolicy} decides the outcome.
 */
public class ConcurrencyAdmissionController {

    private static final Logger _log = LoggerFactory.getLogger(ConcurrencyAdmissionController.class);

    private final AdmissionStore _store;
    private final AdmissionStore _fallbackStore;
    private final Duration _window;
    private final StoreFailurePolicy _failurePolicy;
    private final RateLimitedLog _rateLimitedLog;
    private final Meter _granted;
    private final Meter _rejected;
    private final Meter _storeFailures;

    @Inject
    public ConcurrencyAdmissionController(@SharedAdmissionStore AdmissionStore store,
                                          @FallbackAdmissionStore AdmissionStore fallbackStore,
                                          AdmissionConfiguration configuration,
                                          MetricRegistry metricRegistry,
                                          RateLimitedLogFactory logFactory) {
        this(store, fallbackStore, configuration.getWindow().toJavaDuration(), configuration.getStoreFailurePolicy(),
                metricRegistry, logFactory);
    }

    public ConcurrencyAdmissionController(AdmissionStore store, AdmissionStore fallbackStore, Duration window,
                                          StoreFailurePolicy failurePolicy, MetricRegistry metricRegistry,
                                          RateLimitedLogFactory logFactory) {
        _store = requireNonNull(store, "store");
        _fallbackStore = requireNonNull(fallbackStore, "fallbackStore");
        _window = requireNonNull(window, "window");
        _failurePolicy = requireNonNull(failurePolicy, "failurePolicy");
        _rateLimitedLog = logFactory.from(_log);
        _granted = metricRegistry.meter(MetricRegistry.name("bv.feedgate.admission", "ConcurrencyAdmissionController", "granted"));
        _rejected = metricRegistry.meter(MetricRegistry.name("bv.feedgate.admission", "ConcurrencyAdmissionController", "rejected"));
        _storeFailures = metricRegistry.meter(MetricRegistry.name("bv.feedgate.admission", "ConcurrencyAdmissionController", "store-failures"));
    }

    /**
     * Attempts to admit one live request for the tenant.
     *
     * @return the granted slot, which the caller must release exactly once when the request completes, or empty
     *         if the tenant already holds {@code limit} live requests.
     */
    public Optional<AdmissionSlot> tryAcquire(TenantEnvironment tenant, int limit) {
        checkArgument(limit >= 0, "limit cannot be negative");
        String tenantKey = tenant.getEnvironmentId();
        String requestId = UUID.randomUUID().toString();

        try {
            return grantIf(_store.tryAcquire(tenantKey, requestId, limit, _window), _store, tenantKey, requestId);
        } catch (AdmissionStoreException e) {
            _storeFailures.mark();
            _rateLimitedLog.warn(e, "Admission store unavailable, applying {} policy", _failurePolicy);
        }

        switch (_failurePolicy) {
            case LOCAL_FALLBACK:
                return grantIf(_fallbackStore.tryAcquire(tenantKey, requestId, limit, _window),
                        _fallbackStore, tenantKey, requestId);
            case ADMIT:
                _granted.mark();
                return Optional.of(new AdmissionSlot(null, tenantKey, requestId, _rateLimitedLog));
            case REJECT:
                _rejected.mark();
                return Optional.empty();
            default:
                throw new UnsupportedOperationException(String.valueOf(_failurePolicy));
        }
    }

    /**
     * Returns the number of live requests the tenant currently holds.  Falls back to this instance's local count
     * when the shared store is unreachable.
     */
    public int countLiveRequests(TenantEnvironment tenant) {
        String tenantKey = tenant.getEnvironmentId();
        try {
            return _store.count(tenantKey, _window);
        } catch (AdmissionStoreException e) {
            _storeFailures.mark();
            _rateLimitedLog.warn(e, "Admission store unavailable, reporting local live request count");
            return _fallbackStore.count(tenantKey, _window);
        }
    }

    private Optional<AdmissionSlot> grantIf(boolean granted, AdmissionStore store, String tenantKey, String requestId) {
        if (!granted) {
            _rejected.mark();
            _log.debug("Rejected live request for tenant {}: concurrency limit reached", tenantKey);
            return Optional.empty();
        }
        _granted.mark();
        return Optional.of(new AdmissionSlot(store, tenantKey, requestId, _rateLimitedLog));
    }
}
