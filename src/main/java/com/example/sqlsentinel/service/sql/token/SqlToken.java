package com.example.sqlsentinel.service.sql.token;

import java.util.Locale;

public record SqlToken(TokenType type, String value) implements SqlNode {

    public static SqlToken whitespace() {
        return new SqlToken(TokenType.WHITESPACE, " ");
    }

    public static SqlToken keyword(String value) {
        return new SqlToken(TokenType.KEYWORD, value);
    }

    public static SqlToken punctuation(String value) {
        return new SqlToken(TokenType.PUNCTUATION, value);
    }

    public static SqlToken name(String value) {
        return new SqlToken(TokenType.NAME, value);
    }

    /** Keywords upper-cased with inner whitespace collapsed ("left  outer\njoin" -> "LEFT OUTER JOIN"). */
    public String normalized() {
        if (!type.isKeyword()) return value;
        return value.trim().replaceAll("\\s+", " ").toUpperCase(Locale.ROOT);
    }

    @Override
    public String text() {
        return value;
    }

    @Override
    public boolean isWhitespace() {
        return type.isWhitespace();
    }

    @Override
    public boolean isComment() {
        return type.isComment();
    }

    @Override
    public String toString() {
        return type + "('" + value + "')";
    }
}
