package com.example.sqlsentinel.service.implement;

public interface RlsServiceImpl {
    /**
     * Rewrites every statement of {@code sql} that reads a table so the row-level filters
     * of {@code databaseId} apply.
     *
     * @param schema schema for unqualified tables; null falls back to the configured default
     */
    String applyRls(String sql, String engine, int databaseId, String schema);
}
