package com.bazaarvoice.feedgate.shape.api;

import javax.annotation.Nullable;
import java.net.URI;

/**
 * A call to a change-feed origin did not produce a successful response.  Either the origin answered with a non-2xx
 * status, in which case its status and body are carried here to be proxied back unchanged, or no response was
 * received at all ({@link #hasResponse()} is false).
 */
public class OriginRequestFailedException extends RuntimeException {

    private final URI _origin;
    private final int _responseCode;
    private final String _content;
    private final String _contentType;

    public OriginRequestFailedException(URI origin, int responseCode, @Nullable String content, @Nullable String contentType) {
        super("Shape request to origin " + origin + " failed with status " + responseCode);
        _origin = origin;
        _responseCode = responseCode;
        _content = content;
        _contentType = contentType;
    }

    public OriginRequestFailedException(URI origin, Throwable cause) {
        super("Shape request to origin " + origin + " failed: " + cause, cause);
        _origin = origin;
        _responseCode = -1;
        _content = cause.getMessage();
        _contentType = null;
    }

    public URI getOrigin() {
        return _origin;
    }

    public boolean hasResponse() {
        return _responseCode > 0;
    }

    /** The origin's status code, or -1 when no response was received. */
    public int getResponseCode() {
        return _responseCode;
    }

    @Nullable
    public String getContent() {
        return _content;
    }

    @Nullable
    public String getContentType() {
        return _contentType;
    }
}
