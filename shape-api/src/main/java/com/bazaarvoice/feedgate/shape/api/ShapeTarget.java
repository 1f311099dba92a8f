package com.bazaarvoice.feedgate.shape.api;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Which runs a subscription follows: one run, the runs of one batch, or every run carrying a set of tags.
 */
public final class ShapeTarget {

    public enum Kind {
        RUN,
        BATCH,
        TAGS
    }

    private final Kind _kind;
    private final String _id;
    private final List<String> _tags;

    private ShapeTarget(Kind kind, String id, List<String> tags) {
        _kind = kind;
        _id = id;
        _tags = tags;
    }

    public static ShapeTarget forRun(String runId) {
        checkArgument(!Strings.isNullOrEmpty(runId), "runId is required");
        return new ShapeTarget(Kind.RUN, runId, ImmutableList.<String>of());
    }

    public static ShapeTarget forBatch(String batchId) {
        checkArgument(!Strings.isNullOrEmpty(batchId), "batchId is required");
        return new ShapeTarget(Kind.BATCH, batchId, ImmutableList.<String>of());
    }

    /** An empty tag list follows every run in the environment. */
    public static ShapeTarget forTags(Collection<String> tags) {
        requireNonNull(tags, "tags");
        return new ShapeTarget(Kind.TAGS, null, ImmutableList.copyOf(tags));
    }

    public Kind getKind() {
        return _kind;
    }

    /** The run or batch id; null for {@link Kind#TAGS}. */
    public String getId() {
        return _id;
    }

    public List<String> getTags() {
        return _tags;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ShapeTarget)) {
            return false;
        }
        ShapeTarget that = (ShapeTarget) o;
        return _kind == that._kind && Objects.equal(_id, that._id) && _tags.equals(that._tags);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_kind, _id, _tags);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("kind", _kind)
                .add("id", _id)
                .add("tags", _tags)
                .omitNullValues()
                .toString();
    }
}
