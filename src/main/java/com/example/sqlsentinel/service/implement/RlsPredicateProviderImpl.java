package com.example.sqlsentinel.service.implement;

import java.util.Optional;

public interface RlsPredicateProviderImpl {
    /**
     * Row-level filter for a table.
     *
     * @param databaseId database the query runs against
     * @param schema     schema of the table, may be null
     * @param table      unquoted table name
     * @return the predicate, or empty when no filter applies
     */
    Optional<String> lookup(int databaseId, String schema, String table);
}
