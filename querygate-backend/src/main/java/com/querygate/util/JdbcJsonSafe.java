package com.querygate.util;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Converts JDBC driver values into JSON-safe primitives so that driver-specific objects never
 * leak into response rows.
 */
public final class JdbcJsonSafe {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";

    private JdbcJsonSafe() {
    }

    /**
     * Reads a JDBC column value and returns a JSON-safe equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     * @throws SQLException when the column cannot be read at all
     */
    public static Object readJsonSafeValue(ResultSet rs, int columnIndex) throws SQLException {
        Object v = rs.getObject(columnIndex);
        return toJsonSafe(v);
    }

    /**
     * Converts an arbitrary JDBC object into a JSON-safe primitive or list.
     *
     * @param v value to convert
     * @return json-safe value, or a placeholder when the value cannot be materialized
     */
    public static Object toJsonSafe(Object v) {
        try {
            return sanitize(v, 0);
        } catch (SQLException e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private static Object sanitize(Object v, int depth) throws SQLException {
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
            int toRead = (int) Math.min(length, MAX_LOB_CHARS);
            return toRead <= 0 ? "" : clob.getSubString(1, toRead);
        }
        if (v instanceof Blob blob) {
            long length = blob.length();
            int toRead = (int) Math.min(length, MAX_BLOB_BYTES);
            return toRead <= 0 ? "" : Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                List<Object> out = new ArrayList<>(objectArray.length);
                for (Object element : objectArray) {
                    out.add(sanitize(element, depth + 1));
                }
                return out;
            }
            return truncate(String.valueOf(arrayValue));
        }

        // Dates, times, UUIDs and driver objects such as PGobject all render through toString().
        return truncate(String.valueOf(v));
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }
}
