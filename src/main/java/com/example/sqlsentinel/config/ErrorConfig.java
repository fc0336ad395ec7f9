package com.example.sqlsentinel.config;

public final class ErrorConfig {
    private ErrorConfig() {}
    public static final String INTERNAL_SERVER_ERROR = "INTERNAL_SERVER_ERROR";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String SQL_PARSE_ERROR = "SQL_PARSE_ERROR";
    public static final String QUERY_SECURITY_ACCESS_ERROR = "QUERY_SECURITY_ACCESS_ERROR";
    public static final String INVALID_CLAUSE = "INVALID_CLAUSE";
    public static final String RLS_LOOKUP_ERROR = "RLS_LOOKUP_ERROR";
}
