package com.bazaarvoice.feedgate.shape;

import com.bazaarvoice.feedgate.shape.query.ShapeQueryBuilder;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.Lists;
import io.dropwizard.util.Duration;

import javax.validation.Valid;
import javax.validation.constraints.NotEmpty;
import javax.validation.constraints.NotNull;
import java.net.URI;
import java.util.List;

public class ShapeConfiguration {

    /**
     * Change-feed origins.  Tenants are pinned to origins by position, so new origins must be appended to the end
     * of the list; reordering or removing origins resets the subscriptions of the tenants that move.
     */
    @NotEmpty
    @JsonProperty ("origins")
    private List<URI> _origins = Lists.newArrayList();

    @NotNull
    @JsonProperty ("table")
    private String _table = ShapeQueryBuilder.DEFAULT_TABLE;

    @Valid
    @NotNull
    @JsonProperty ("maxLookBack")
    private Duration _maxLookBack = Duration.days(30);

    /** How long a live request may wait on its origin before the gateway gives up on it. */
    @Valid
    @NotNull
    @JsonProperty ("longPollTimeout")
    private Duration _longPollTimeout = Duration.seconds(60);

    public List<URI> getOrigins() {
        return _origins;
    }

    public ShapeConfiguration setOrigins(List<URI> origins) {
        _origins = origins;
        return this;
    }

    public String getTable() {
        return _table;
    }

    public ShapeConfiguration setTable(String table) {
        _table = table;
        return this;
    }

    public Duration getMaxLookBack() {
        return _maxLookBack;
    }

    public ShapeConfiguration setMaxLookBack(Duration maxLookBack) {
        _maxLookBack = maxLookBack;
        return this;
    }

    public Duration getLongPollTimeout() {
        return _longPollTimeout;
    }

    public ShapeConfiguration setLongPollTimeout(Duration longPollTimeout) {
        _longPollTimeout = longPollTimeout;
        return this;
    }
}
