package com.bazaarvoice.feedgate.shape;

import com.bazaarvoice.feedgate.shape.api.ShapeTarget;
import com.bazaarvoice.feedgate.shape.protocol.ClientProtocol;
import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * One inbound poll of a shape, as parsed from the caller's request.
 */
public final class ShapeRequest {

    private final ShapeTarget _target;
    private final ClientProtocol _protocol;
    private final boolean _live;
    private final String _handle;
    private final String _createdAt;
    private final List<String> _skipColumns;
    private final Map<String, String> _passthrough;

    private ShapeRequest(Builder builder) {
        _target = requireNonNull(builder._target, "target");
        _protocol = requireNonNull(builder._protocol, "protocol");
        _live = builder._live;
        _handle = Strings.emptyToNull(builder._handle);
        _createdAt = Strings.emptyToNull(builder._createdAt);
        _skipColumns = ImmutableList.copyOf(builder._skipColumns);
        _passthrough = ImmutableMap.copyOf(builder._passthrough);
    }

    public static Builder builder(ShapeTarget target) {
        return new Builder(target);
    }

    public ShapeTarget getTarget() {
        return _target;
    }

    public ClientProtocol getProtocol() {
        return _protocol;
    }

    /** True if the caller asked to block until new rows are available. */
    public boolean isLive() {
        return _live;
    }

    public Optional<String> getHandle() {
        return Optional.ofNullable(_handle);
    }

    /** The relative time window, such as "24h", or empty for an unbounded subscription. */
    public Optional<String> getCreatedAt() {
        return Optional.ofNullable(_createdAt);
    }

    public List<String> getSkipColumns() {
        return _skipColumns;
    }

    /** Origin cursor parameters to forward unchanged. */
    public Map<String, String> getPassthrough() {
        return _passthrough;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("target", _target)
                .add("protocol", _protocol)
                .add("live", _live)
                .add("handle", _handle)
                .add("createdAt", _createdAt)
                .add("skipColumns", _skipColumns)
                .add("passthrough", _passthrough)
                .omitNullValues()
                .toString();
    }

    public static class Builder {
        private final ShapeTarget _target;
        private ClientProtocol _protocol = ClientProtocol.LEGACY;
        private boolean _live;
        private String _handle;
        private String _createdAt;
        private List<String> _skipColumns = ImmutableList.of();
        private final Map<String, String> _passthrough = Maps.newLinkedHashMap();

        private Builder(ShapeTarget target) {
            _target = requireNonNull(target, "target");
        }

        public Builder protocol(ClientProtocol protocol) {
            _protocol = protocol;
            return this;
        }

        public Builder live(boolean live) {
            _live = live;
            return this;
        }

        public Builder handle(@Nullable String handle) {
            _handle = handle;
            return this;
        }

        public Builder createdAt(@Nullable String createdAt) {
            _createdAt = createdAt;
            return this;
        }

        public Builder skipColumns(Collection<String> skipColumns) {
            _skipColumns = ImmutableList.copyOf(skipColumns);
            return this;
        }

        public Builder passthrough(String name, @Nullable String value) {
            if (!Strings.isNullOrEmpty(value)) {
                _passthrough.put(name, value);
            }
            return this;
        }

        public ShapeRequest build() {
            return new ShapeRequest(this);
        }
    }
}
