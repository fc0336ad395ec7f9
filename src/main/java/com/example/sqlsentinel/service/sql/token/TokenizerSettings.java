package com.example.sqlsentinel.service.sql.token;

import com.example.sqlsentinel.service.sql.token.config.KeywordConfig;

import java.util.Locale;
import java.util.Set;

/**
 * Immutable keyword tables handed to {@link SqlTokenizer}. Build a custom instance to
 * extend the vocabulary; there is no mutable global registry.
 */
public record TokenizerSettings(Set<String> dml,
                                Set<String> ddl,
                                Set<String> cte,
                                Set<String> keywords,
                                Set<String> keepBeforeParenthesis,
                                Set<String> whereTerminators) {

    private static final TokenizerSettings DEFAULTS = new TokenizerSettings(
            KeywordConfig.DML,
            KeywordConfig.DDL,
            KeywordConfig.CTE,
            KeywordConfig.KEYWORDS,
            KeywordConfig.KEEP_BEFORE_PARENTHESIS,
            KeywordConfig.WHERE_TERMINATORS);

    public TokenizerSettings {
        dml = Set.copyOf(dml);
        ddl = Set.copyOf(ddl);
        cte = Set.copyOf(cte);
        keywords = Set.copyOf(keywords);
        keepBeforeParenthesis = Set.copyOf(keepBeforeParenthesis);
        whereTerminators = Set.copyOf(whereTerminators);
    }

    public static TokenizerSettings defaults() {
        return DEFAULTS;
    }

    /** Keyword-family type of an upper-cased word, or {@link TokenType#NAME}. */
    public TokenType classify(String word) {
        String upper = word.toUpperCase(Locale.ROOT);
        if (dml.contains(upper)) return TokenType.DML;
        if (ddl.contains(upper)) return TokenType.DDL;
        if (cte.contains(upper)) return TokenType.CTE;
        if (keywords.contains(upper)) return TokenType.KEYWORD;
        return TokenType.NAME;
    }
}
