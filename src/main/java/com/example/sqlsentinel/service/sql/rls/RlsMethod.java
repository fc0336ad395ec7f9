package com.example.sqlsentinel.service.sql.rls;

/**
 * How row-level predicates are injected. {@link #AS_SUBQUERY} replaces the table with a
 * filtered sub-select; {@link #AS_PREDICATE} AND-s the predicate into WHERE/ON, for
 * engines without sub-query support.
 */
public enum RlsMethod {
    AS_SUBQUERY,
    AS_PREDICATE
}
