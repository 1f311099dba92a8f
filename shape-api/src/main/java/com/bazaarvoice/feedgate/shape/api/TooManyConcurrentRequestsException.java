package com.bazaarvoice.feedgate.shape.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Thrown when a tenant already holds as many live requests as its concurrency limit allows.  The request is rejected
 * immediately rather than queued; the caller is expected to back off and retry.  Corresponds to HTTP 429.
 */
@JsonIgnoreProperties ({"cause", "localizedMessage", "stackTrace", "suppressed"})
public class TooManyConcurrentRequestsException extends RuntimeException {

    private final String _environmentId;
    private final int _limit;

    @JsonCreator
    public TooManyConcurrentRequestsException(@JsonProperty("environmentId") String environmentId,
                                              @JsonProperty("limit") int limit) {
        super("Too many concurrent requests, please try again later.");
        _environmentId = environmentId;
        _limit = limit;
    }

    public String getEnvironmentId() {
        return _environmentId;
    }

    public int getLimit() {
        return _limit;
    }
}
