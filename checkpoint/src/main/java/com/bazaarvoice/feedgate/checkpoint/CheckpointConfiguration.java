package com.bazaarvoice.feedgate.checkpoint;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.util.Duration;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotNull;

public class CheckpointConfiguration {

    /** Checkpoints younger than this are used without revalidation. */
    @Valid
    @NotNull
    @JsonProperty ("freshWindow")
    private Duration _freshWindow = Duration.days(7);

    /** Checkpoints older than this are discarded.  Also the time to live of entries in the shared store. */
    @Valid
    @NotNull
    @JsonProperty ("staleWindow")
    private Duration _staleWindow = Duration.days(14);

    @Min (1)
    @JsonProperty ("localCacheSize")
    private long _localCacheSize = 10000;

    @NotNull
    @JsonProperty ("keyPrefix")
    private String _keyPrefix = "feedgate:realtime:checkpoint";

    public Duration getFreshWindow() {
        return _freshWindow;
    }

    public CheckpointConfiguration setFreshWindow(Duration freshWindow) {
        _freshWindow = freshWindow;
        return this;
    }

    public Duration getStaleWindow() {
        return _staleWindow;
    }

    public CheckpointConfiguration setStaleWindow(Duration staleWindow) {
        _staleWindow = staleWindow;
        return this;
    }

    public long getLocalCacheSize() {
        return _localCacheSize;
    }

    public CheckpointConfiguration setLocalCacheSize(long localCacheSize) {
        _localCacheSize = localCacheSize;
        return this;
    }

    public String getKeyPrefix() {
        return _keyPrefix;
    }

    public CheckpointConfiguration setKeyPrefix(String keyPrefix) {
        _keyPrefix = keyPrefix;
        return this;
    }
}
