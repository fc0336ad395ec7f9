package com.example.sqlsentinel.service.sql.token;

/**
 * A node of the token tree: either a leaf {@link SqlToken} or a {@link TokenGroup}.
 * Nodes are immutable; {@link #text()} of a statement reproduces its source exactly.
 */
public interface SqlNode {

    String text();

    boolean isWhitespace();

    boolean isComment();

    default boolean isSignificant() {
        return !isWhitespace() && !isComment();
    }

    default boolean isGroup(GroupKind kind) {
        return this instanceof TokenGroup g && g.kind() == kind;
    }

    default boolean isToken(TokenType type) {
        return this instanceof SqlToken t && t.type() == type;
    }

    /** True for keyword-family leaves whose normalized value is one of {@code values}. */
    default boolean isKeyword(String... values) {
        if (!(this instanceof SqlToken t) || !t.type().isKeyword()) return false;
        String norm = t.normalized();
        for (String v : values) {
            if (v.equals(norm)) return true;
        }
        return false;
    }

    default boolean isPunctuation(String value) {
        return this instanceof SqlToken t && t.type() == TokenType.PUNCTUATION && t.value().equals(value);
    }
}
