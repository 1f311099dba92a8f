package com.bazaarvoice.feedgate.shape.poll;

import com.google.common.collect.ListMultimap;
import com.google.common.util.concurrent.ListenableFuture;

import java.net.URI;

/**
 * Asynchronous HTTP access to a change-feed origin.
 */
public interface OriginClient {

    /**
     * Issues {@code GET <origin>/v1/shape} with the given query parameters.  The returned future completes with the
     * origin's response whatever its status, fails with an
     * {@link com.bazaarvoice.feedgate.shape.api.OriginRequestFailedException} if no response was received, and
     * aborts the request if it is cancelled.
     */
    ListenableFuture<OriginResponse> getShape(URI origin, ListMultimap<String, String> queryParams);
}
