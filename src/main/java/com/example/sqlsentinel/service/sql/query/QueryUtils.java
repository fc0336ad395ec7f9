package com.example.sqlsentinel.service.sql.query;

import com.example.sqlsentinel.exception.ClauseValidationException;
import com.example.sqlsentinel.service.sql.token.SqlNode;
import com.example.sqlsentinel.service.sql.token.SqlToken;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import com.example.sqlsentinel.service.sql.token.TokenGroup;
import com.example.sqlsentinel.service.sql.token.TokenType;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class QueryUtils {

    /**
     * Value following the first {@code TOP}-like keyword, for dialects that write
     * {@code SELECT TOP n}. Null when no keyword is found or the next word is not an integer.
     */
    public static Integer extractTopFromQuery(String statement, Set<String> topKeywords) {
        String flat = statement.replace("\n", " ").replace("\r", "").stripTrailing();
        List<String> words = Arrays.stream(flat.split(" "))
                .filter(w -> !w.isEmpty())
                .toList();
        for (int i = 0; i < words.size(); i++) {
            if (topKeywords.contains(words.get(i).toUpperCase(Locale.ROOT)) && i < words.size() - 1) {
                try {
                    return Integer.valueOf(words.get(i + 1));
                } catch (NumberFormatException e) {
                    return null;
                }
            }
        }
        return null;
    }

    /** Splits off the first WITH clause of the first statement. */
    public static CteRemainder getCteRemainderQuery(String sql, SqlTokenizer tokenizer) {
        List<TokenGroup> statements = tokenizer.parse(sql);
        if (statements.isEmpty()) return new CteRemainder(null, sql);

        TokenGroup statement = statements.get(0);
        int idx = statement.nextSignificant(0);
        if (idx < 0 || !statement.children().get(idx).isToken(TokenType.CTE)) {
            return new CteRemainder(null, sql);
        }

        int cteIdx = idx + 1;
        while (cteIdx < statement.children().size() && statement.children().get(cteIdx).isWhitespace()) cteIdx++;
        if (cteIdx >= statement.children().size()) return new CteRemainder(null, sql);

        StringBuilder remainder = new StringBuilder();
        for (SqlNode node : statement.children().subList(cteIdx + 1, statement.children().size())) {
            remainder.append(node.text());
        }
        return new CteRemainder("WITH " + statement.children().get(cteIdx).text(), remainder.toString().strip());
    }

    public static boolean checkSqlFunctionsExist(String sql, Set<String> functions, String engine,
                                                 SqlTokenizer tokenizer) {
        return new ParsedQuery(sql, false, engine, tokenizer).checkFunctionsExist(functions);
    }

    /** Comment stripping for engines that reject comments; only tokenizes when "--" occurs. */
    public static String stripCommentsFromSql(String statement, String engine, SqlTokenizer tokenizer) {
        return statement.contains("--")
                ? new ParsedQuery(statement, false, engine, tokenizer).stripComments()
                : statement;
    }

    /**
     * Validates a filter fragment before it is spliced into a query.
     * Returns the clause, with a newline appended when it ends in an open line comment.
     *
     * @throws ClauseValidationException on several statements, stray comment markers or
     *                                   unbalanced parentheses
     */
    public static String sanitizeClause(String clause, SqlTokenizer tokenizer) {
        List<TokenGroup> statements = tokenizer.parse(clause);
        if (statements.size() != 1) {
            throw new ClauseValidationException("Clause contains multiple statements");
        }

        // Flat scan: an unterminated "/*" lexes as "/" and "*" rather than a comment.
        int openParens = 0;
        SqlToken previous = null;
        for (SqlToken token : statements.get(0).flatten()) {
            String value = token.value();
            if ("/".equals(value) && previous != null && "*".equals(previous.value())) {
                throw new ClauseValidationException("Closing unopened multiline comment");
            }
            if ("*".equals(value) && previous != null && "/".equals(previous.value())) {
                throw new ClauseValidationException("Unclosed multiline comment");
            }
            if ("(".equals(value) || ")".equals(value)) {
                openParens += "(".equals(value) ? 1 : -1;
                if (openParens < 0) {
                    throw new ClauseValidationException("Closing unclosed parenthesis in filter clause");
                }
            }
            previous = token;
        }
        if (openParens > 0) {
            throw new ClauseValidationException("Unclosed parenthesis in filter clause");
        }

        if (previous != null && previous.isComment() && !previous.value().endsWith("\n")) {
            return clause + "\n";
        }
        return clause;
    }
}
