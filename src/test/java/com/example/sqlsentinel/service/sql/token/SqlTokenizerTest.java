package com.example.sqlsentinel.service.sql.token;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class SqlTokenizerTest {
    private final SqlTokenizer tokenizer = SqlTokenizer.standard();

    @ParameterizedTest
    @ValueSource(strings = {
            "SELECT a, b FROM s.t AS x WHERE y = 'it''s' -- done\n",
            "select count(*) from \"My Table\" where v::text like '%x%' /* c */ limit 10",
            "WITH c AS (SELECT 1) SELECT * FROM c;\n\nSELECT $$raw$$, `q`, [b]",
            "SELECT (1 + (2"
    })
    void tokensReproduceTheInput(String sql) {
        String joined = tokenizer.tokenize(sql).stream().map(SqlToken::value).collect(Collectors.joining());
        assertThat(joined).isEqualTo(sql);

        String grouped = tokenizer.parse(sql).stream().map(TokenGroup::text).collect(Collectors.joining());
        assertThat(grouped).isEqualTo(sql);
    }

    @Test
    void classifiesKeywordsAndNames() {
        List<SqlToken> tokens = tokenizer.tokenize("select count(x) from t left outer join u");

        assertThat(tokens.get(0).type()).isEqualTo(TokenType.DML);
        assertThat(tokens.get(0).normalized()).isEqualTo("SELECT");
        assertThat(tokens.get(2)).isEqualTo(new SqlToken(TokenType.NAME, "count"));
        assertThat(tokens).contains(new SqlToken(TokenType.KEYWORD, "left outer join"));
        assertThat(tokens.stream().filter(t -> t.type() == TokenType.KEYWORD).map(SqlToken::normalized))
                .containsExactly("FROM", "LEFT OUTER JOIN");
    }

    @Test
    void straightJoinIsOneKeyword() {
        assertThat(tokenizer.tokenize("a straight_join b"))
                .contains(new SqlToken(TokenType.KEYWORD, "straight_join"));
    }

    @Test
    void keywordNextToDotIsAName() {
        List<SqlToken> tokens = tokenizer.tokenize("t.limit");
        assertThat(tokens).extracting(SqlToken::type)
                .containsExactly(TokenType.NAME, TokenType.PUNCTUATION, TokenType.NAME);
    }

    @Test
    void groupsIdentifiersWithAliases() {
        TokenGroup statement = tokenizer.parse("SELECT a FROM s.t AS x WHERE y = 1").get(0);

        TokenGroup table = (TokenGroup) statement.children().get(statement.indexOfKeyword("FROM") + 2);
        assertThat(table.kind()).isEqualTo(GroupKind.IDENTIFIER);
        assertThat(table.hasAlias()).isTrue();
        assertThat(table.alias()).isEqualTo("x");
        assertThat(table.realName()).isEqualTo("t");
        assertThat(table.parentName()).isEqualTo("s");

        SqlNode last = statement.children().get(statement.children().size() - 1);
        assertThat(last.isGroup(GroupKind.WHERE)).isTrue();
        assertThat(last.text()).isEqualTo("WHERE y = 1");
    }

    @Test
    void whereStopsAtClauseTerminators() {
        TokenGroup statement = tokenizer.parse("SELECT * FROM t WHERE a = 1 ORDER BY a").get(0);

        TokenGroup where = statement.children().stream()
                .filter(n -> n.isGroup(GroupKind.WHERE))
                .map(TokenGroup.class::cast)
                .findFirst()
                .orElseThrow();
        assertThat(where.text()).isEqualTo("WHERE a = 1 ");
        assertThat(statement.indexOfKeyword("ORDER BY")).isPositive();
    }

    @Test
    void splitsStatementsOnTopLevelSemicolons() {
        List<TokenGroup> statements = tokenizer.parse("SELECT 1; SELECT ';'; \n");

        assertThat(statements).hasSize(2);
        assertThat(statements.get(0).text()).isEqualTo("SELECT 1;");
        assertThat(statements.get(1).text()).isEqualTo(" SELECT ';'; \n");
        assertThat(statements).allMatch(s -> "SELECT".equals(s.statementType()));
    }

    @Test
    void statementTypeLooksPastWith() {
        TokenGroup statement = tokenizer.parse("WITH x AS (SELECT 1) INSERT INTO t SELECT * FROM x").get(0);
        assertThat(statement.statementType()).isEqualTo("INSERT");
        assertThat(tokenizer.parse("SHOW TABLES").get(0).statementType()).isEqualTo("UNKNOWN");
    }

    @Test
    void stripsComments() {
        assertThat(tokenizer.stripComments("SELECT 1 -- c\nFROM t")).isEqualTo("SELECT 1 \nFROM t");
        assertThat(tokenizer.stripComments("SELECT/*x*/1")).isEqualTo("SELECT 1");
        assertThat(tokenizer.stripComments("-- only\nSELECT 1 /* tail */")).isEqualTo("SELECT 1");
    }

    @Test
    void settingsAreImmutable() {
        TokenizerSettings settings = TokenizerSettings.defaults();
        assertThat(settings.classify("select")).isEqualTo(TokenType.DML);
        assertThat(settings.classify("with")).isEqualTo(TokenType.CTE);
        assertThat(settings.classify("my_column")).isEqualTo(TokenType.NAME);
        assertThat(tokenizer.getSettings()).isEqualTo(settings);
    }
}
