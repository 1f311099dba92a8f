package com.bazaarvoice.feedgate.web.jersey;

import com.google.common.collect.ImmutableList;

public class ExceptionMappers {

    public static Iterable<Object> getMappers() {
        return ImmutableList.<Object>of(
                new IllegalArgumentExceptionMapper(),
                new TooManyConcurrentRequestsExceptionMapper(),
                new OriginRequestFailedExceptionMapper());
    }
}
