package com.example.sqlsentinel.service.sql.token;

public enum TokenType {
    WHITESPACE,
    NEWLINE,
    COMMENT_SINGLE,
    COMMENT_MULTILINE,
    KEYWORD,
    DML,
    DDL,
    CTE,
    NAME,
    STRING,
    INTEGER,
    FLOAT,
    PUNCTUATION,
    OPERATOR,
    COMPARISON,
    WILDCARD,
    PLACEHOLDER,
    ERROR;

    public boolean isWhitespace() {
        return this == WHITESPACE || this == NEWLINE;
    }

    public boolean isComment() {
        return this == COMMENT_SINGLE || this == COMMENT_MULTILINE;
    }

    /** KEYWORD and its DML / DDL / CTE refinements. */
    public boolean isKeyword() {
        return this == KEYWORD || this == DML || this == DDL || this == CTE;
    }

    public boolean isLiteral() {
        return this == STRING || this == INTEGER || this == FLOAT;
    }
}
