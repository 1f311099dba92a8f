package com.bazaarvoice.feedgate.web.jersey;

import com.bazaarvoice.feedgate.shape.api.OriginRequestFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.ws.rs.core.MediaType;
import javax.ws.rs.core.Response;
import javax.ws.rs.ext.ExceptionMapper;
import javax.ws.rs.ext.Provider;

/**
 * Returns an origin's error response to the caller as-is.  When the origin could not be reached at all the caller
 * gets a 502.
 */
@Provider
public class OriginRequestFailedExceptionMapper implements ExceptionMapper<OriginRequestFailedException> {

    private static final Logger _log = LoggerFactory.getLogger(OriginRequestFailedExceptionMapper.class);

    @Override
    public Response toResponse(OriginRequestFailedException e) {
        if (!e.hasResponse()) {
            _log.debug("No response from origin {}", e.getOrigin(), e);
            return Response.status(Response.Status.BAD_GATEWAY)
                    .header("X-BV-Exception", OriginRequestFailedException.class.getName())
                    .entity("Unable to reach the change-feed origin.")
                    .type(MediaType.TEXT_PLAIN_TYPE)
                    .build();
        }

        Response.ResponseBuilder response = Response.status(e.getResponseCode())
                .header("X-BV-Exception", OriginRequestFailedException.class.getName());
        if (e.getContent() != null) {
            response.entity(e.getContent());
            response.type(e.getContentType() != null ? e.getContentType() : MediaType.TEXT_PLAIN);
        }
        return response.build();
    }
}
