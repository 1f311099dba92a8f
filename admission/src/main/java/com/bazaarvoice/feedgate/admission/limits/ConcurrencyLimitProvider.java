package com.bazaarvoice.feedgate.admission.limits;

import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;

/**
 * Supplies the number of live requests a tenant may hold at once.  Implementations return a safe default rather
 * than fail when a tenant has no usable configuration.
 */
public interface ConcurrencyLimitProvider {

    int getConcurrencyLimit(TenantEnvironment tenant);
}
