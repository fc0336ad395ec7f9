package com.example.sqlsentinel.service.sql.token.config;

import lombok.NoArgsConstructor;

import java.util.Set;

/** Keyword tables used to classify WORD tokens. All sets are upper-case and unmodifiable. */
@NoArgsConstructor
public final class KeywordConfig {

    public static final Set<String> DML = Set.of(
            "SELECT", "INSERT", "UPDATE", "DELETE", "UPSERT", "REPLACE", "MERGE");

    public static final Set<String> DDL = Set.of(
            "CREATE", "ALTER", "DROP", "TRUNCATE", "RENAME", "GRANT", "REVOKE");

    public static final Set<String> CTE = Set.of("WITH");

    public static final Set<String> KEYWORDS = Set.of(
            // clauses
            "FROM", "WHERE", "HAVING", "LIMIT", "OFFSET", "FETCH", "FOR", "INTO", "VALUES",
            "RETURNING", "WINDOW", "QUALIFY", "UNION", "EXCEPT", "INTERSECT", "MINUS",
            "GROUP", "ORDER", "BY", "PARTITION", "OVER", "FILTER", "WITHIN", "TOP", "DISTINCT",
            // joins
            "JOIN", "INNER", "OUTER", "LEFT", "RIGHT", "FULL", "CROSS", "NATURAL", "ON", "USING",
            "LATERAL", "APPLY", "ONLY", "TABLESAMPLE", "FINAL",
            // predicates
            "AND", "OR", "NOT", "IS", "NULL", "IN", "LIKE", "ILIKE", "RLIKE", "REGEXP", "SIMILAR",
            "BETWEEN", "EXISTS", "ANY", "ALL", "SOME", "ESCAPE", "TRUE", "FALSE", "COLLATE",
            "CASE", "WHEN", "THEN", "ELSE", "END", "AS", "ASC", "DESC", "NULLS", "INTERVAL",
            // niladic functions
            "CURRENT_DATE", "CURRENT_TIME", "CURRENT_TIMESTAMP", "CURRENT_USER", "SESSION_USER",
            "LOCALTIME", "LOCALTIMESTAMP",
            // utility statements
            "SET", "SHOW", "EXPLAIN", "DESCRIBE", "USE", "CALL", "EXEC", "EXECUTE", "DECLARE",
            "BEGIN", "COMMIT", "ROLLBACK", "START", "TRANSACTION", "ANALYZE", "VACUUM", "LOCK",
            "KILL", "LOAD", "PRAGMA", "REFRESH", "CACHE", "MSCK", "COPY",
            // ddl vocabulary
            "TABLE", "VIEW", "INDEX", "SCHEMA", "DATABASE", "IF", "RECURSIVE", "TEMPORARY",
            "MATERIALIZED", "CONSTRAINT", "PRIMARY", "FOREIGN", "REFERENCES", "UNIQUE", "CHECK",
            "DEFAULT", "ROWS", "RANGE", "PRECEDING", "FOLLOWING", "UNBOUNDED", "CURRENT", "ROLLUP");

    /**
     * Keywords that keep their keyword type when directly followed by "(".
     * Any other word in that position is a function name.
     */
    public static final Set<String> KEEP_BEFORE_PARENTHESIS = Set.of(
            "CASE", "IN", "VALUES", "USING", "FROM", "AS", "WHERE", "ON", "AND", "OR", "NOT",
            "EXISTS", "SELECT", "HAVING", "WHEN", "THEN", "ELSE", "INTO", "OVER", "FILTER",
            "WITHIN", "ANY", "ALL", "SOME", "UNION", "EXCEPT", "INTERSECT", "JOIN", "LATERAL",
            "RETURNING", "SET", "BY", "WITH", "TABLE", "LIMIT", "TOP", "DISTINCT", "BETWEEN",
            "LIKE", "IS", "INSERT", "UPDATE", "DELETE", "MERGE", "CREATE", "ALTER", "DROP");

    /** Keywords that close a WHERE clause at the same nesting level. */
    public static final Set<String> WHERE_TERMINATORS = Set.of(
            "ORDER BY", "GROUP BY", "LIMIT", "OFFSET", "FETCH", "FOR", "UNION", "UNION ALL",
            "EXCEPT", "INTERSECT", "MINUS", "HAVING", "RETURNING", "INTO", "WINDOW", "QUALIFY");
}
