package com.example.sqlsentinel.service.sql.token;

public enum GroupKind {
    STATEMENT,
    PARENTHESIS,
    FUNCTION,
    IDENTIFIER,
    IDENTIFIER_LIST,
    WHERE
}
