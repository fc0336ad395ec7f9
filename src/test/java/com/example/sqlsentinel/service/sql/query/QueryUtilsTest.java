package com.example.sqlsentinel.service.sql.query;

import com.example.sqlsentinel.exception.ClauseValidationException;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryUtilsTest {
    private final SqlTokenizer tokenizer = SqlTokenizer.standard();

    @Test
    void extractsTopValue() {
        assertThat(QueryUtils.extractTopFromQuery("SELECT TOP 10 * FROM t", Set.of("TOP"))).isEqualTo(10);
        assertThat(QueryUtils.extractTopFromQuery("select\ntop\n5 a from t", Set.of("TOP"))).isEqualTo(5);
        assertThat(QueryUtils.extractTopFromQuery("SELECT TOP x * FROM t", Set.of("TOP"))).isNull();
        assertThat(QueryUtils.extractTopFromQuery("SELECT * FROM t TOP", Set.of("TOP"))).isNull();
    }

    @Test
    void splitsLeadingCte() {
        CteRemainder split = QueryUtils.getCteRemainderQuery("WITH x AS (SELECT 1) SELECT * FROM x", tokenizer);
        assertThat(split.cte()).isEqualTo("WITH x AS (SELECT 1)");
        assertThat(split.remainder()).isEqualTo("SELECT * FROM x");

        CteRemainder none = QueryUtils.getCteRemainderQuery("SELECT 1", tokenizer);
        assertThat(none.cte()).isNull();
        assertThat(none.remainder()).isEqualTo("SELECT 1");
    }

    @Test
    void stripsCommentsOnlyWhenLineCommentsArePresent() {
        assertThat(QueryUtils.stripCommentsFromSql("SELECT 1 -- c", null, tokenizer)).isEqualTo("SELECT 1");
        assertThat(QueryUtils.stripCommentsFromSql("SELECT /* kept */ 1", null, tokenizer))
                .isEqualTo("SELECT /* kept */ 1");
    }

    @Test
    void checksFunctions() {
        assertThat(QueryUtils.checkSqlFunctionsExist("SELECT NOW()", Set.of("now"), null, tokenizer)).isTrue();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "a = 1; b = 2      | Clause contains multiple statements",
            "a = 1 */          | Closing unopened multiline comment",
            "a = 1 /* open     | Unclosed multiline comment",
            "a = 1) OR (1 = 1  | Closing unclosed parenthesis in filter clause",
            "(a = 1            | Unclosed parenthesis in filter clause"
    })
    void rejectsMalformedClauses(String clause, String message) {
        assertThatThrownBy(() -> QueryUtils.sanitizeClause(clause, tokenizer))
                .isInstanceOf(ClauseValidationException.class)
                .hasMessage(message);
    }

    @Test
    void closesTrailingLineComment() {
        assertThat(QueryUtils.sanitizeClause("a = 1 -- note", tokenizer)).isEqualTo("a = 1 -- note\n");
        assertThat(QueryUtils.sanitizeClause("(a = 1) OR b IS NULL", tokenizer)).isEqualTo("(a = 1) OR b IS NULL");
    }
}
