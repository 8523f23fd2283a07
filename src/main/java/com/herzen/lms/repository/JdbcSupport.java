package com.herzen.lms.repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Collection;

final class JdbcSupport {
    private JdbcSupport() {
    }

    static OffsetDateTime time(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, OffsetDateTime.class);
    }

    static Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    /**
     * Resolves a client-supplied sort field against a whitelist, falling back to the default column.
     */
    static String sortColumn(String requested, Map<String, String> allowed, String fallback) {
        if (requested == null) return fallback;
        return allowed.getOrDefault(requested, fallback);
    }

    static String direction(String orderBy) {
        return "desc".equalsIgnoreCase(orderBy) ? "DESC" : "ASC";
    }

    static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }

    /**
     * Accumulates an optional WHERE clause together with its positional arguments.
     */
    static final class Where {
        private final StringBuilder sql = new StringBuilder();
        private final List<Object> args = new ArrayList<>();

        Where and(String condition, Object... values) {
            sql.append(sql.length() == 0 ? " WHERE " : " AND ").append(condition);
            args.addAll(Arrays.asList(values));
            return this;
        }

        Where andIf(boolean present, String condition, Object... values) {
            return present ? and(condition, values) : this;
        }

        Where andIn(String column, Collection<String> values) {
            if (values.isEmpty()) return and("1 = 0");
            return and(column + " IN (" + placeholders(values.size()) + ")", values.toArray());
        }

        String sql() {
            return sql.toString();
        }

        Object[] args(Object... extra) {
            List<Object> all = new ArrayList<>(args);
            all.addAll(Arrays.asList(extra));
            return all.toArray();
        }
    }
}
