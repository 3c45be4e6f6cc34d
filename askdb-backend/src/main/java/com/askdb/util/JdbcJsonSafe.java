package com.askdb.util;

import java.io.Reader;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Struct;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts JDBC rows into JSON-safe maps.
 *
 * <p>Tenant databases are arbitrary, so driver-specific objects (PGobject, LOBs, arrays) must
 * never leak into JSON serialization.
 */
public final class JdbcJsonSafe {
    private static final int MAX_LOB_CHARS = 100_000;
    private static final int MAX_BLOB_BYTES = 100_000;
    private static final int MAX_STRING_CHARS = 100_000;
    private static final int MAX_NESTED_DEPTH = 3;
    private static final String UNSUPPORTED_PLACEHOLDER = "[unsupported]";
    private static final String PG_OBJECT_CLASS = "org.postgresql.util.PGobject";

    private JdbcJsonSafe() {
    }

    /**
     * Read the current row of a result set, keyed by column label in select-list order.
     *
     * <p>When two columns share a label the later one wins, as it would in a JSON object.
     *
     * @param rs result set positioned on a row
     * @param meta result set metadata
     * @return ordered row map
     * @throws SQLException on JDBC errors
     */
    public static Map<String, Object> readRow(ResultSet rs, ResultSetMetaData meta) throws SQLException {
        int columnCount = meta.getColumnCount();
        Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);
        for (int i = 1; i <= columnCount; i++) {
            row.put(meta.getColumnLabel(i), readJsonSafeValue(rs, i));
        }
        return row;
    }

    /**
     * Reads a JDBC column value and returns a JSON-safe equivalent.
     *
     * @param rs result set
     * @param columnIndex 1-based column index
     * @return json-safe value
     */
    public static Object readJsonSafeValue(ResultSet rs, int columnIndex) {
        try {
            return sanitize(rs.getObject(columnIndex), 0);
        } catch (Exception e) {
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
        if (PG_OBJECT_CLASS.equals(v.getClass().getName())) {
            return truncate(readPgObject(v));
        }
        if (v instanceof Clob clob) {
            return readClob(clob);
        }
        if (v instanceof Blob blob) {
            return readBlobBase64(blob);
        }
        if (v instanceof SQLXML xml) {
            return truncate(xml.getString());
        }
        if (v instanceof java.util.Date || v instanceof TemporalAccessor || v instanceof UUID) {
            return v.toString();
        }
        if (v instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (v instanceof Struct struct) {
            Object[] attrs = struct.getAttributes();
            return sanitizeAll(attrs != null ? attrs : new Object[0], depth);
        }
        if (v instanceof java.sql.Array arr) {
            Object arrayValue = arr.getArray();
            if (arrayValue instanceof Object[] objectArray) {
                return sanitizeAll(objectArray, depth);
            }
            return truncate(String.valueOf(arrayValue));
        }
        return truncate(String.valueOf(v));
    }

    private static List<Object> sanitizeAll(Object[] values, int depth) throws SQLException {
        List<Object> out = new ArrayList<>(values.length);
        for (Object value : values) {
            out.add(sanitize(value, depth + 1));
        }
        return out;
    }

    private static String readPgObject(Object v) {
        try {
            Object value = v.getClass().getMethod("getValue").invoke(v);
            return value != null ? value.toString() : "";
        } catch (ReflectiveOperationException e) {
            return String.valueOf(v);
        }
    }

    private static String truncate(String s) {
        if (s == null || s.length() <= MAX_STRING_CHARS) {
            return s;
        }
        return s.substring(0, MAX_STRING_CHARS);
    }

    private static String readClob(Clob clob) throws SQLException {
        int toRead = (int) Math.min(clob.length(), MAX_LOB_CHARS);
        if (toRead <= 0) {
            return "";
        }
        try {
            return clob.getSubString(1, toRead);
        } catch (SQLException e) {
            return readClobStream(clob);
        }
    }

    private static String readClobStream(Clob clob) {
        try (Reader reader = clob.getCharacterStream()) {
            if (reader == null) {
                return "";
            }
            char[] buf = new char[8192];
            StringBuilder sb = new StringBuilder();
            int n;
            while (sb.length() < MAX_LOB_CHARS
                    && (n = reader.read(buf, 0, Math.min(buf.length, MAX_LOB_CHARS - sb.length()))) > 0) {
                sb.append(buf, 0, n);
            }
            return sb.toString();
        } catch (Exception e) {
            return UNSUPPORTED_PLACEHOLDER;
        }
    }

    private static String readBlobBase64(Blob blob) throws SQLException {
        int toRead = (int) Math.min(blob.length(), MAX_BLOB_BYTES);
        if (toRead <= 0) {
            return "";
        }
        return Base64.getEncoder().encodeToString(blob.getBytes(1, toRead));
    }
}
