package com.bazaarvoice.feedgate.admission.limits;

import com.bazaarvoice.feedgate.shape.api.RelativeDuration;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Allows {@code tokens} requests per window, with the counter reset at each window boundary.
 */
public final class FixedWindowLimiter extends LimiterConfig {

    private final String _window;
    private final int _tokens;

    @JsonCreator
    public FixedWindowLimiter(@JsonProperty ("window") String window, @JsonProperty ("tokens") int tokens) {
        _window = window;
        _tokens = tokens;
    }

    @JsonProperty ("window")
    public String getWindow() {
        return _window;
    }

    @JsonProperty ("tokens")
    public int getTokens() {
        return _tokens;
    }

    @Override
    public void validate() {
        checkArgument(RelativeDuration.isValid(_window), "Invalid window: %s", _window);
        checkArgument(_tokens > 0, "tokens must be positive: %s", _tokens);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FixedWindowLimiter)) {
            return false;
        }
        FixedWindowLimiter that = (FixedWindowLimiter) o;
        return _tokens == that._tokens && Objects.equal(_window, that._window);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_window, _tokens);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("window", _window)
                .add("tokens", _tokens)
                .toString();
    }
}
