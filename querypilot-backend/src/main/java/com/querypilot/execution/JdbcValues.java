package com.querypilot.execution;

import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

/**
 * Converts driver values into JSON-safe primitives so result rows can be cached and serialized as-is.
 */
final class JdbcValues {

    private static final int MAX_STRING_CHARS = 10_000;
    private static final int MAX_BINARY_BYTES = 10_000;
    private static final int MAX_NESTED_DEPTH = 2;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcValues() {
    }

    static Object read(ResultSet rs, int columnIndex) throws SQLException {
        return toJsonSafe(rs.getObject(columnIndex), 0);
    }

    private static Object toJsonSafe(Object v, int depth) throws SQLException {
        if (v == null) {
            return null;
        }
        if (depth > MAX_NESTED_DEPTH) {
            return UNSUPPORTED_PLACEHOLDER;
        }
        if (v instanceof Number || v instanceof Boolean) {
            return v;
        }
        if (v instanceof String s) {
            return truncate(s);
        }
        if (v instanceof Clob clob) {
            long length = clob.length();
            return length <= 0 ? "" : clob.getSubString(1, (int) Math.min(length, MAX_STRING_CHARS));
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            return length <= 0 ? "" : Base64.getEncoder().encodeToString(
                    blob.getBytes(1, (int) Math.min(length, MAX_BINARY_BYTES)));
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof java.util.Date || v instanceof TemporalAccessor || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof Array array) {
            Object values = array.getArray();
            if (values instanceof Object[] objects) {
                List<Object> out = new ArrayList<>(objects.length);
                for (Object element : objects) {
                    out.add(toJsonSafe(element, depth + 1));
                }
                return out;
            }
            return truncate(String.valueOf(values));
        }
        // PGobject (json, jsonb, interval) and other driver types render their value through toString
        return truncate(String.valueOf(v));
    }

    private static String truncate(String s) {
        return s.length() <= MAX_STRING_CHARS ? s : s.substring(0, MAX_STRING_CHARS);
    }
}
