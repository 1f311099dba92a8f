package com.bazaarvoice.feedgate.admission;

import com.bazaarvoice.feedgate.admission.store.AdmissionStore;
import com.bazaarvoice.feedgate.admission.store.AdmissionStoreException;
import com.bazaarvoice.feedgate.common.dropwizard.log.RateLimitedLog;
import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.util.Objects.requireNonNull;

/**
 * A granted admission for one live request.  The slot remembers the store that granted it so release always goes
 * back to that store, even if the controller has since switched to its fallback.  {@link #release()} may be called
 * any number of times; only the first call reaches the store.
 */
public class AdmissionSlot {

    private final AdmissionStore _store;
    private final String _tenantKey;
    private final String _requestId;
    private final RateLimitedLog _log;
    private final AtomicBoolean _released = new AtomicBoolean();

    AdmissionSlot(@Nullable AdmissionStore store, String tenantKey, String requestId, RateLimitedLog log) {
        _store = store;
        _tenantKey = requireNonNull(tenantKey, "tenantKey");
        _requestId = requireNonNull(requestId, "requestId");
        _log = requireNonNull(log, "log");
    }

    public String getTenantKey() {
        return _tenantKey;
    }

    public String getRequestId() {
        return _requestId;
    }

    /** False when the request was admitted without a slot because the store was unreachable. */
    public boolean isHeld() {
        return _store != null;
    }

    public boolean isReleased() {
        return _released.get();
    }

    public void release() {
        if (!_released.compareAndSet(false, true) || _store == null) {
            return;
        }
        try {
            _store.release(_tenantKey, _requestId);
        } catch (AdmissionStoreException e) {
            // The slot expires on its own once the admission window passes
            _log.warn(e, "Unable to release admission slot for tenant {}", _tenantKey);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("tenantKey", _tenantKey)
                .add("requestId", _requestId)
                .add("held", isHeld())
                .add("released", isReleased())
                .toString();
    }
}
