package com.bazaarvoice.feedgate.shape.poll;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import static java.util.Objects.requireNonNull;

/**
 * A fully buffered response, either as received from an origin or as translated for the caller.
 */
public class OriginResponse {

    private final int _status;
    private final ListMultimap<String, String> _headers;
    private final byte[] _body;

    public OriginResponse(int status, ListMultimap<String, String> headers, byte[] body) {
        _status = status;
        _headers = ImmutableListMultimap.copyOf(headers);
        _body = requireNonNull(body, "body");
    }

    public int getStatus() {
        return _status;
    }

    public boolean isSuccessful() {
        return _status >= 200 && _status < 300;
    }

    public ListMultimap<String, String> getHeaders() {
        return _headers;
    }

    public byte[] getBody() {
        return _body;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("status", _status)
                .add("headers", _headers)
                .add("bodyLength", _body.length)
                .toString();
    }
}
