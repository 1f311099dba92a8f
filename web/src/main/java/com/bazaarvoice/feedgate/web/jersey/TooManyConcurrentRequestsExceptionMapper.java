package com.bazaarvoice.feedgate.web.jersey;

import com.bazaarvoice.feedgate.shape.api.TooManyConcurrentRequestsException;
import com.google.common.collect.ImmutableMap;

import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;

/**
 * Exception mapper for live requests rejected because the tenant already holds as many live requests as its limit
 * allows.  The gateway never queues these, so the caller is told when to try again.
 */
@Provider
public class TooManyConcurrentRequestsExceptionMapper implements ExceptionMapper<TooManyConcurrentRequestsException> {

    static final int RETRY_AFTER_SECONDS = 5;

    @Override
    public Response toResponse(TooManyConcurrentRequestsException e) {
        return Response.status(Response.Status.TOO_MANY_REQUESTS)
                .header("X-BV-Exception", TooManyConcurrentRequestsException.class.getName())
                .header("Retry-After", RETRY_AFTER_SECONDS)
                .entity(ImmutableMap.of(
                        "error", e.getMessage(),
                        "limit", e.getLimit()))
                .type(MediaType.APPLICATION_JSON_TYPE)
                .build();
    }
}
