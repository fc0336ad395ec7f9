package com.example.sqlsentinel.service.sql.query;

/**
 * A query split after its leading WITH clause.
 *
 * @param cte       {@code "WITH <first cte clause>"}, or null when the query has no WITH
 * @param remainder the text after the CTE clause, or the original text
 */
public record CteRemainder(String cte, String remainder) {
}
