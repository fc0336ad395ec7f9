package com.example.sqlsentinel.service.sql.dto;

import lombok.Getter;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A fully qualified table reference. Two tables are equal when their canonical
 * strings are equal: every present part percent-escaped, a literal "." inside a part
 * written as {@code %2E}, parts joined by ".".
 */
@Getter
public final class Table {
    private final String table;
    private final String schema;
    private final String catalog;

    public Table(String table) {
        this(table, null, null);
    }

    public Table(String table, String schema) {
        this(table, schema, null);
    }

    public Table(String table, String schema, String catalog) {
        this.table = table;
        this.schema = emptyToNull(schema);
        this.catalog = emptyToNull(catalog);
    }

    /** Inverse of {@link #toString()}: 1 to 3 dot-separated, percent-escaped parts. */
    public static Table parse(String qualified) {
        String[] parts = qualified.split("\\.", -1);
        if (parts.length < 1 || parts.length > 3) {
            throw new IllegalArgumentException("Not a table reference: " + qualified);
        }
        List<String> decoded = new ArrayList<>(parts.length);
        for (String p : parts) decoded.add(UriUtils.decode(p, StandardCharsets.UTF_8));
        return switch (decoded.size()) {
            case 1 -> new Table(decoded.get(0));
            case 2 -> new Table(decoded.get(1), decoded.get(0));
            default -> new Table(decoded.get(2), decoded.get(1), decoded.get(0));
        };
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[]{catalog, schema, table}) {
            if (part == null || part.isEmpty()) continue;
            if (sb.length() > 0) sb.append('.');
            sb.append(escape(part));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Table other)) return false;
        return toString().equals(other.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    private static String escape(String part) {
        return UriUtils.encode(part, StandardCharsets.UTF_8).replace(".", "%2E");
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }
}
