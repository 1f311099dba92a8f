package com.bazaarvoice.feedgate.shape.protocol;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The two naming schemes callers speak.  Current clients send the {@code X-Feedgate-Client-Version} header and use
 * {@code handle} / {@code electric-handle}; older clients send no version and use {@code shape_id} /
 * {@code electric-shape-id}.  The protocol is chosen once when a request is parsed and then drives both the
 * outbound parameter names and the response header names.
 */
public enum ClientProtocol {

    CURRENT("handle", "electric-handle", "electric-offset"),
    LEGACY("shape_id", "electric-shape-id", "electric-chunk-last-offset");

    public static final String CLIENT_VERSION_HEADER = "X-Feedgate-Client-Version";

    /** Origin cursor parameters forwarded unchanged. */
    public static final List<String> PASSTHROUGH_PARAMS = ImmutableList.of("offset", "cursor");

    public static final String LIVE_PARAM = "live";

    private final String _handleParam;
    private final String _handleHeader;
    private final String _offsetHeader;

    ClientProtocol(String handleParam, String handleHeader, String offsetHeader) {
        _handleParam = handleParam;
        _handleHeader = handleHeader;
        _offsetHeader = offsetHeader;
    }

    public static ClientProtocol forVersion(@Nullable String clientVersion) {
        return Strings.isNullOrEmpty(clientVersion) ? LEGACY : CURRENT;
    }

    public String getHandleParam() {
        return _handleParam;
    }

    public String getHandleHeader() {
        return _handleHeader;
    }

    public String getOffsetHeader() {
        return _offsetHeader;
    }

    /**
     * Picks the continuation handle from the values sent under each parameter name.  Both names are accepted; the
     * one matching this protocol wins when both are present.
     */
    public Optional<String> selectHandle(@Nullable String handleParamValue, @Nullable String shapeIdParamValue) {
        String own = this == CURRENT ? handleParamValue : shapeIdParamValue;
        String other = this == CURRENT ? shapeIdParamValue : handleParamValue;
        if (!Strings.isNullOrEmpty(own)) {
            return Optional.of(own);
        }
        return Optional.ofNullable(Strings.emptyToNull(other));
    }

    /**
     * Renames the handle and offset headers, under whichever scheme the origin used, to this protocol's names.
     * All other headers pass through unchanged.
     */
    public ListMultimap<String, String> translateResponseHeaders(ListMultimap<String, String> originHeaders) {
        ImmutableListMultimap.Builder<String, String> headers = ImmutableListMultimap.builder();
        for (Map.Entry<String, String> entry : originHeaders.entries()) {
            headers.put(translateHeaderName(entry.getKey()), entry.getValue());
        }
        return headers.build();
    }

    private String translateHeaderName(String name) {
        for (ClientProtocol protocol : values()) {
            if (protocol._handleHeader.equalsIgnoreCase(name)) {
                return _handleHeader;
            }
            if (protocol._offsetHeader.equalsIgnoreCase(name)) {
                return _offsetHeader;
            }
        }
        return name;
    }

    /**
     * Returns the continuation handle an origin response carries, under either naming scheme.
     */
    public static Optional<String> readOriginHandle(ListMultimap<String, String> originHeaders) {
        for (Map.Entry<String, String> entry : originHeaders.entries()) {
            for (ClientProtocol protocol : values()) {
                if (protocol._handleHeader.equalsIgnoreCase(entry.getKey()) && !Strings.isNullOrEmpty(entry.getValue())) {
                    return Optional.of(entry.getValue());
                }
            }
        }
        return Optional.empty();
    }
}
