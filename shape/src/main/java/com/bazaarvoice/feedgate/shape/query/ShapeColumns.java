package com.bazaarvoice.feedgate.shape.query;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Column projection for run shapes.
 */
public final class ShapeColumns {

    public static final List<String> DEFAULT = ImmutableList.of(
            "id", "taskIdentifier", "createdAt", "updatedAt", "startedAt", "delayUntil", "queuedAt", "expiredAt",
            "completedAt", "friendlyId", "number", "isTest", "status", "usageDurationMs", "costInCents",
            "baseCostInCents", "ttl", "payload", "payloadType", "metadata", "metadataType", "output", "outputType",
            "runTags", "error");

    /** Columns clients rely on to identify and order runs; they cannot be skipped. */
    public static final Set<String> RESERVED = ImmutableSet.of("id", "status", "taskIdentifier", "createdAt", "friendlyId");

    private ShapeColumns() {
        // empty
    }

    /**
     * Returns the default columns, in order, minus any non-reserved column named in {@code skipColumns}.  Unknown
     * names in the skip list are ignored.
     */
    public static List<String> project(Collection<String> skipColumns) {
        Set<String> skip = ImmutableSet.copyOf(skipColumns);
        ImmutableList.Builder<String> columns = ImmutableList.builder();
        for (String column : DEFAULT) {
            if (RESERVED.contains(column) || !skip.contains(column)) {
                columns.add(column);
            }
        }
        return columns.build();
    }
}
