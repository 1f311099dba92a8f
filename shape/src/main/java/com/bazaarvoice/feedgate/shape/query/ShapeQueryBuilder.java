package com.bazaarvoice.feedgate.shape.query;

import com.bazaarvoice.feedgate.shape.api.ShapeQuery;
import com.bazaarvoice.feedgate.shape.api.ShapeTarget;
import com.bazaarvoice.feedgate.shape.api.TenantEnvironment;
import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Builds the upstream {@link ShapeQuery} for a subscription.  The filter is the conjunction of the tenant scoping
 * clause, the target clause and, when a cutoff applies, the lower bound on creation time.
 */
public class ShapeQueryBuilder {

    public static final String DEFAULT_TABLE = "public.\"TaskRun\"";

    private static final Joiner AND = Joiner.on(" AND ");

    private final String _table;

    public ShapeQueryBuilder() {
        this(DEFAULT_TABLE);
    }

    public ShapeQueryBuilder(String table) {
        _table = requireNonNull(table, "table");
    }

    public ShapeQuery build(TenantEnvironment tenant, ShapeTarget target, Optional<Instant> cutoff,
                            Collection<String> skipColumns, @Nullable String handle) {
        List<String> clauses = Lists.newArrayList();
        clauses.add(identifier("runtimeEnvironmentId") + "=" + literal(tenant.getEnvironmentId()));

        switch (target.getKind()) {
            case RUN:
                clauses.add(identifier("id") + "=" + literal(target.getId()));
                break;
            case BATCH:
                clauses.add(identifier("batchId") + "=" + literal(target.getId()));
                break;
            case TAGS:
                if (!target.getTags().isEmpty()) {
                    clauses.add(identifier("runTags") + " @> " + array(target.getTags()));
                }
                break;
            default:
                throw new UnsupportedOperationException(String.valueOf(target.getKind()));
        }

        cutoff.ifPresent(instant -> clauses.add(identifier("createdAt") + " > " + literal(instant.toString())));

        return new ShapeQuery(_table, AND.join(clauses), ShapeColumns.project(skipColumns), handle);
    }

    /** Renders the column list the way origins expect it: each name double-quoted, comma-joined. */
    public static String columnList(List<String> columns) {
        List<String> quoted = Lists.newArrayListWithCapacity(columns.size());
        for (String column : columns) {
            quoted.add(identifier(column));
        }
        return Joiner.on(',').join(quoted);
    }

    private static String identifier(String name) {
        return '"' + name.replace("\"", "\"\"") + '"';
    }

    private static String literal(String value) {
        return '\'' + value.replace("'", "''") + '\'';
    }

    private static String array(List<String> values) {
        List<String> literals = Lists.newArrayListWithCapacity(values.size());
        for (String value : values) {
            literals.add(literal(value));
        }
        return "ARRAY[" + Joiner.on(',').join(literals) + "]";
    }
}
