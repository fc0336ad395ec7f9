package com.example.sqlsentinel.service.sql.token;

import com.example.sqlsentinel.service.sql.dto.CaseChangingCharStream;
import lombok.Getter;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Lossless SQL tokenizer producing classified tokens and grouped statement trees.
 * Stateless apart from its immutable {@link TokenizerSettings}; safe to share.
 */
public class SqlTokenizer {
    @Getter
    private final TokenizerSettings settings;
    private final TokenGrouper grouper;

    public SqlTokenizer(TokenizerSettings settings) {
        this.settings = settings;
        this.grouper = new TokenGrouper(settings);
    }

    public static SqlTokenizer standard() {
        return new SqlTokenizer(TokenizerSettings.defaults());
    }

    /** Flat token stream; concatenated values equal {@code sql}. */
    public List<SqlToken> tokenize(String sql) {
        if (sql == null || sql.isEmpty()) return List.of();

        SqlTokenLexer lexer = new SqlTokenLexer(new CaseChangingCharStream(CharStreams.fromString(sql), true));
        lexer.removeErrorListeners();
        List<? extends Token> raw = lexer.getAllTokens();

        List<SqlToken> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            out.add(new SqlToken(typeOf(raw, i), raw.get(i).getText()));
        }
        return out;
    }

    /** Splits {@code sql} into statements and groups each one into a token tree. */
    public List<TokenGroup> parse(String sql) {
        return grouper.statements(tokenize(sql));
    }

    /**
     * Removes comments. A line comment ending in a newline leaves the newline behind; a
     * comment between two words leaves a single space. The result is trimmed.
     */
    public String stripComments(String sql) {
        List<SqlToken> tokens = tokenize(sql);
        StringBuilder sb = new StringBuilder(sql == null ? 0 : sql.length());
        for (int i = 0; i < tokens.size(); i++) {
            SqlToken t = tokens.get(i);
            if (!t.isComment()) {
                sb.append(t.value());
                continue;
            }
            if (t.type() == TokenType.COMMENT_SINGLE && t.value().endsWith("\n")) {
                sb.append('\n');
            } else if (sb.length() > 0 && !Character.isWhitespace(sb.charAt(sb.length() - 1))
                    && i + 1 < tokens.size() && tokens.get(i + 1).type() != TokenType.PUNCTUATION
                    && !tokens.get(i + 1).isWhitespace()) {
                sb.append(' ');
            }
        }
        return sb.toString().strip();
    }

    private TokenType typeOf(List<? extends Token> raw, int i) {
        Token tk = raw.get(i);
        return switch (tk.getType()) {
            case SqlTokenLexer.LINE_COMMENT -> TokenType.COMMENT_SINGLE;
            case SqlTokenLexer.BLOCK_COMMENT -> TokenType.COMMENT_MULTILINE;
            case SqlTokenLexer.NEWLINE -> TokenType.NEWLINE;
            case SqlTokenLexer.SPACE -> TokenType.WHITESPACE;
            case SqlTokenLexer.SINGLE_QUOTED, SqlTokenLexer.DOLLAR_QUOTED -> TokenType.STRING;
            case SqlTokenLexer.DOUBLE_QUOTED, SqlTokenLexer.BACKTICK_QUOTED, SqlTokenLexer.BRACKET_QUOTED -> TokenType.NAME;
            case SqlTokenLexer.JOIN_KEYWORD, SqlTokenLexer.GROUP_BY, SqlTokenLexer.ORDER_BY, SqlTokenLexer.UNION_ALL ->
                    TokenType.KEYWORD;
            case SqlTokenLexer.FLOAT -> TokenType.FLOAT;
            case SqlTokenLexer.INTEGER -> TokenType.INTEGER;
            case SqlTokenLexer.WORD -> wordType(raw, i);
            case SqlTokenLexer.PLACEHOLDER -> TokenType.PLACEHOLDER;
            case SqlTokenLexer.LPAREN, SqlTokenLexer.RPAREN, SqlTokenLexer.COMMA,
                 SqlTokenLexer.SEMICOLON, SqlTokenLexer.DOT -> TokenType.PUNCTUATION;
            case SqlTokenLexer.STAR -> TokenType.WILDCARD;
            case SqlTokenLexer.COMPARISON -> TokenType.COMPARISON;
            case SqlTokenLexer.OPERATOR -> TokenType.OPERATOR;
            default -> TokenType.ERROR;
        };
    }

    /* A keyword directly before "(" (function call) or next to "." (qualified name) is a name. */
    private TokenType wordType(List<? extends Token> raw, int i) {
        String word = raw.get(i).getText();
        TokenType type = settings.classify(word);
        if (type == TokenType.NAME) return type;

        int prev = i > 0 ? raw.get(i - 1).getType() : Token.INVALID_TYPE;
        int next = i + 1 < raw.size() ? raw.get(i + 1).getType() : Token.INVALID_TYPE;
        if (prev == SqlTokenLexer.DOT || next == SqlTokenLexer.DOT) return TokenType.NAME;
        if (next == SqlTokenLexer.LPAREN
                && !settings.keepBeforeParenthesis().contains(word.toUpperCase(Locale.ROOT))) {
            return TokenType.NAME;
        }
        return type;
    }
}
