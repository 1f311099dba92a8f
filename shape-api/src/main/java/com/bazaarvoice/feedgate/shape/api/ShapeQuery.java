package com.bazaarvoice.feedgate.shape.api;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * The upstream request for one poll: target table, boolean filter expression, column projection and, on resumed
 * polls, the continuation handle minted by the origin.  Built per request and never persisted.
 */
public final class ShapeQuery {

    private final String _table;
    private final String _where;
    private final List<String> _columns;
    private final String _handle;

    public ShapeQuery(String table, String where, List<String> columns, @Nullable String handle) {
        checkArgument(!Strings.isNullOrEmpty(table), "table is required");
        checkArgument(!Strings.isNullOrEmpty(where), "where is required");
        checkArgument(!columns.isEmpty(), "at least one column is required");
        _table = table;
        _where = where;
        _columns = ImmutableList.copyOf(columns);
        _handle = Strings.emptyToNull(handle);
    }

    public String getTable() {
        return _table;
    }

    public String getWhere() {
        return _where;
    }

    public List<String> getColumns() {
        return _columns;
    }

    public Optional<String> getHandle() {
        return Optional.ofNullable(_handle);
    }

    /** A query without a continuation handle starts a new subscription on the origin. */
    public boolean isResume() {
        return _handle != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ShapeQuery)) {
            return false;
        }
        ShapeQuery that = (ShapeQuery) o;
        return _table.equals(that._table) &&
                _where.equals(that._where) &&
                _columns.equals(that._columns) &&
                Objects.equal(_handle, that._handle);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(_table, _where, _columns, _handle);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("table", _table)
                .add("where", _where)
                .add("columns", _columns)
                .add("handle", _handle)
                .omitNullValues()
                .toString();
    }
}
