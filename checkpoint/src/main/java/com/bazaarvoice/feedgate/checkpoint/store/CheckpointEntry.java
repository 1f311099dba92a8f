package com.bazaarvoice.feedgate.checkpoint.store;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

import java.time.Instant;

import static java.util.Objects.requireNonNull;

/**
 * The absolute cutoff pinned for one continuation handle, and when it was last written.  Freshness is measured from
 * the write time; the cutoff itself never changes for a handle.
 */
@JsonPropertyOrder ({"cutoff", "writtenAt"})
@JsonAutoDetect (getterVisibility = JsonAutoDetect.Visibility.NONE, isGetterVisibility = JsonAutoDetect.Visibility.NONE)
public final class CheckpointEntry {

    private final Instant _cutoff;
    private final Instant _writtenAt;

    public CheckpointEntry(Instant cutoff, Instant writtenAt) {
        _cutoff = requireNonNull(cutoff, "cutoff");
        _writtenAt = requireNonNull(writtenAt, "writtenAt");
    }

    @JsonCreator
    private CheckpointEntry(@JsonProperty ("cutoff") long cutoffMillis,
                            @JsonProperty ("writtenAt") long writtenAtMillis) {
        this(Instant.ofEpochMilli(cutoffMillis), Instant.ofEpochMilli(writtenAtMillis));
    }

    public Instant getCutoff() {
        return _cutoff;
    }

    public Instant getWrittenAt() {
        return _writtenAt;
    }

    @JsonProperty ("cutoff")
    private long getCutoffMillis() {
        return _cutoff.toEpochMilli();
    }

    @JsonProperty ("writtenAt")
    private long getWrittenAtMillis() {
        return _writtenAt.toEpochMilli();
    }

    /** Returns an entry with the same cutoff, written at {@code now}. */
    public CheckpointEntry rewrittenAt(Instant now) {
        return new CheckpointEntry(_cutoff, now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CheckpointEntry)) {
            return false;
        }
        CheckpointEntry that = (CheckpointEntry) o;
        return _cutoff.equals(that._cutoff) && _writtenAt.equals(that._writtenAt);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_cutoff, _writtenAt);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("cutoff", _cutoff)
                .add("writtenAt", _writtenAt)
                .toString();
    }
}
