package com.company.silencing.repository;

import com.company.silencing.domain.enums.SilenceStatus;
import com.company.silencing.exception.SilenceValidationException;
import lombok.RequiredArgsConstructor;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds parameterized list/count SQL from a {@link SilenceFilter}.
 * Status filters are evaluated against starts_at/ends_at, never against the stored status column.
 */
@RequiredArgsConstructor
class SilenceQueryBuilder {

    static final String SELECT_BASE = """
        SELECT s.id, s.created_by, s.comment_text, s.starts_at, s.ends_at,
               s.status, s.created_at, s.updated_at
        FROM silences s
        """;

    private static final String COUNT_BASE = """
        SELECT COUNT(*)
        FROM silences s
        """;

    private final int defaultLimit;
    private final int maxLimit;

    SqlQuery buildListQuery(SilenceFilter filter, Instant now) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder(SELECT_BASE);
        appendWhere(sql, args, filter, now);

        SilenceFilter.SortField sortBy = filter.getSortBy() != null
                ? filter.getSortBy()
                : SilenceFilter.SortField.CREATED_AT;
        SilenceFilter.SortDirection direction = filter.getDirection() != null
                ? filter.getDirection()
                : SilenceFilter.SortDirection.DESC;

        // id tie-break keeps pages disjoint when sort values collide
        sql.append("ORDER BY s.").append(sortBy.getColumn()).append(' ').append(direction.name())
                .append(", s.id ").append(direction.name()).append('\n');

        // Validated integers, inlined for portability of OFFSET/FETCH across databases
        sql.append("OFFSET ").append(resolveOffset(filter)).append(" ROWS ")
                .append("FETCH NEXT ").append(resolveLimit(filter)).append(" ROWS ONLY");

        return new SqlQuery(sql.toString(), args.toArray());
    }

    SqlQuery buildCountQuery(SilenceFilter filter, Instant now) {
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder(COUNT_BASE);
        appendWhere(sql, args, filter, now);
        return new SqlQuery(sql.toString(), args.toArray());
    }

    int resolveLimit(SilenceFilter filter) {
        Integer limit = filter.getLimit();
        if (limit == null || limit == 0) {
            return defaultLimit;
        }
        if (limit < 0) {
            throw new SilenceValidationException("limit", "Limit must not be negative");
        }
        return Math.min(limit, maxLimit);
    }

    int resolveOffset(SilenceFilter filter) {
        Integer offset = filter.getOffset();
        if (offset == null) {
            return 0;
        }
        if (offset < 0) {
            throw new SilenceValidationException("offset", "Offset must not be negative");
        }
        return offset;
    }

    private void appendWhere(StringBuilder sql, List<Object> args, SilenceFilter filter, Instant now) {
        sql.append("WHERE 1=1\n");

        if (filter.getStatuses() != null && !filter.getStatuses().isEmpty()) {
            List<String> clauses = new ArrayList<>();
            for (SilenceStatus status : filter.getStatuses().stream().distinct().toList()) {
                clauses.add(statusClause(status, args, now));
            }
            sql.append("AND (").append(String.join(" OR ", clauses)).append(")\n");
        }

        if (hasText(filter.getCreatedBy())) {
            sql.append("AND s.created_by = ?\n");
            args.add(filter.getCreatedBy());
        }

        // Name and value are matched independently: each may hold on a different matcher
        if (hasText(filter.getMatcherName())) {
            sql.append("AND EXISTS (SELECT 1 FROM silence_matchers m WHERE m.silence_id = s.id"
                    + " AND m.label_name = ?)\n");
            args.add(filter.getMatcherName());
        }
        if (hasText(filter.getMatcherValue())) {
            sql.append("AND EXISTS (SELECT 1 FROM silence_matchers m WHERE m.silence_id = s.id"
                    + " AND m.label_value = ?)\n");
            args.add(filter.getMatcherValue());
        }

        appendTimeBound(sql, args, "s.starts_at >= ?", filter.getStartsAfter());
        appendTimeBound(sql, args, "s.starts_at <= ?", filter.getStartsBefore());
        appendTimeBound(sql, args, "s.ends_at >= ?", filter.getEndsAfter());
        appendTimeBound(sql, args, "s.ends_at <= ?", filter.getEndsBefore());
    }

    private static String statusClause(SilenceStatus status, List<Object> args, Instant now) {
        Timestamp ts = Timestamp.from(now);
        switch (status) {
            case PENDING:
                args.add(ts);
                return "s.starts_at > ?";
            case ACTIVE:
                args.add(ts);
                args.add(ts);
                return "(s.starts_at <= ? AND s.ends_at > ?)";
            case EXPIRED:
                args.add(ts);
                return "s.ends_at <= ?";
            default:
                throw new IllegalArgumentException("Unsupported status " + status);
        }
    }

    private static void appendTimeBound(StringBuilder sql, List<Object> args, String clause, Instant value) {
        if (value != null) {
            sql.append("AND ").append(clause).append('\n');
            args.add(Timestamp.from(value));
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
