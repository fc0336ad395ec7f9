package com.example.sqlsentinel.service.sql.rls;

import com.example.sqlsentinel.config.ErrorConfig;
import com.example.sqlsentinel.exception.AppException;
import com.example.sqlsentinel.service.implement.RlsPredicateProviderImpl;
import com.example.sqlsentinel.service.sql.dto.Table;
import com.example.sqlsentinel.service.sql.query.ParsedQuery;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import com.example.sqlsentinel.service.sql.token.TokenGroup;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RlsRewriterTest {
    private static final int DATABASE_ID = 1;

    private final SqlTokenizer tokenizer = SqlTokenizer.standard();

    private RlsRewriter rewriter(Map<String, String> predicates) {
        RlsPredicateProviderImpl provider = (databaseId, schema, table) -> Optional.ofNullable(predicates.get(table));
        return new RlsRewriter(provider, tokenizer);
    }

    private String inPredicate(String sql, Map<String, String> predicates) {
        return rewriter(predicates).insertRlsInPredicate(statement(sql), DATABASE_ID, null).text();
    }

    private String asSubquery(String sql, Map<String, String> predicates) {
        return rewriter(predicates).insertRlsAsSubquery(statement(sql), DATABASE_ID, null).text();
    }

    private TokenGroup statement(String sql) {
        return tokenizer.parse(sql).get(0);
    }

    /* ===================== PREDICATE ===================== */

    @Test
    void andsPredicateIntoExistingWhere() {
        assertThat(inPredicate("SELECT * FROM t WHERE 1=1", Map.of("t", "id=42")))
                .isEqualTo("SELECT * FROM t WHERE ( 1=1) AND t.id=42");
    }

    @Test
    void qualifiesColumnsWithAlias() {
        assertThat(inPredicate("SELECT * FROM t AS x WHERE 1=1", Map.of("t", "id=42")))
                .isEqualTo("SELECT * FROM t AS x WHERE ( 1=1) AND x.id=42");
    }

    @Test
    void addsWhereWhenMissing() {
        assertThat(inPredicate("SELECT * FROM t", Map.of("t", "id=42")))
                .isEqualTo("SELECT * FROM t WHERE t.id=42");
        assertThat(inPredicate("SELECT * FROM t ORDER BY a", Map.of("t", "id=42")))
                .isEqualTo("SELECT * FROM t WHERE t.id=42 ORDER BY a");
    }

    @Test
    void neverInsertsInsideTrailingComment() {
        assertThat(inPredicate("SELECT * FROM t -- note", Map.of("t", "id=42")))
                .isEqualTo("SELECT * FROM t WHERE t.id=42 -- note");
    }

    @Test
    void skipsCommentsBetweenFromAndTable() {
        assertThat(inPredicate("SELECT * FROM /* c */ t", Map.of("t", "id=42")))
                .isEqualTo("SELECT * FROM /* c */ t WHERE t.id=42");
    }

    @Test
    void joinTablePredicateGoesIntoOn() {
        assertThat(inPredicate("SELECT * FROM a JOIN b ON a.id = b.id", Map.of("a", "x=1", "b", "y=2")))
                .isEqualTo("SELECT * FROM a JOIN b ON b.y=2 AND ( a.id = b.id ) WHERE a.x=1");
    }

    @Test
    void straightJoinIsAJoin() {
        Map<String, String> predicates = Map.of("a", "x=1", "b", "y=2");

        assertThat(inPredicate("SELECT * FROM a STRAIGHT_JOIN b", predicates))
                .isEqualTo("SELECT * FROM a STRAIGHT_JOIN b WHERE (a.x=1) AND (b.y=2)");
        assertThat(inPredicate("SELECT * FROM a straight_join b ON a.id = b.id", predicates))
                .isEqualTo("SELECT * FROM a straight_join b ON b.y=2 AND ( a.id = b.id ) WHERE a.x=1");
        assertThat(asSubquery("SELECT * FROM a STRAIGHT_JOIN b", predicates))
                .isEqualTo("SELECT * FROM (SELECT * FROM a WHERE a.x=1) AS a "
                        + "STRAIGHT_JOIN (SELECT * FROM b WHERE b.y=2) AS b");
    }

    @Test
    void parenthesisedJoinPredicatesGoAfterTheGroup() {
        Map<String, String> predicates = Map.of("a", "x=1", "b", "y=2");

        assertThat(inPredicate("SELECT * FROM (a CROSS JOIN b)", predicates))
                .isEqualTo("SELECT * FROM (a CROSS JOIN b) WHERE (a.x=1) AND (b.y=2)");
        assertThat(inPredicate("SELECT * FROM (a JOIN b ON a.id = b.id) WHERE a.z = 0", predicates))
                .isEqualTo("SELECT * FROM (a JOIN b ON b.y=2 AND ( a.id = b.id )) WHERE ( a.z = 0) AND a.x=1");
    }

    @Test
    void everyMemberOfAFromListIsFiltered() {
        assertThat(inPredicate("SELECT * FROM a, b", Map.of("a", "x=1", "b", "y=2")))
                .isEqualTo("SELECT * FROM a, b WHERE (a.x=1) AND (b.y=2)");
    }

    @Test
    void wrapsPredicateWithTopLevelOr() {
        assertThat(inPredicate("SELECT * FROM t", Map.of("t", "region = 'eu' OR owner = 7")))
                .isEqualTo("SELECT * FROM t WHERE (t.region = 'eu' OR t.owner = 7)");
    }

    @Test
    void filtersTablesInsideSubqueries() {
        assertThat(inPredicate("SELECT * FROM (SELECT * FROM t) AS s", Map.of("t", "id=42")))
                .isEqualTo("SELECT * FROM (SELECT * FROM t WHERE t.id=42) AS s");
    }

    @Test
    void unfilteredTablesAreLeftAlone() {
        String sql = "SELECT * FROM other WHERE a = 1";
        assertThat(inPredicate(sql, Map.of("t", "id=42"))).isEqualTo(sql);
        assertThat(asSubquery(sql, Map.of("t", "id=42"))).isEqualTo(sql);
    }

    /* ===================== SUBQUERY ===================== */

    @Test
    void everyTableOfAParenthesisedJoinIsWrapped() {
        assertThat(asSubquery("SELECT * FROM (a CROSS JOIN b)", Map.of("a", "x=1", "b", "y=2")))
                .isEqualTo("SELECT * FROM ((SELECT * FROM a WHERE a.x=1) AS a "
                        + "CROSS JOIN (SELECT * FROM b WHERE b.y=2) AS b)");
    }

    @Test
    void replacesTableWithFilteredSubquery() {
        assertThat(asSubquery("SELECT * FROM t WHERE 1=1", Map.of("t", "id=42")))
                .isEqualTo("SELECT * FROM (SELECT * FROM t WHERE t.id=42) AS t WHERE 1=1");
    }

    @Test
    void subqueryKeepsTheAlias() {
        assertThat(asSubquery("SELECT * FROM t AS x", Map.of("t", "id=42")))
                .isEqualTo("SELECT * FROM (SELECT * FROM t WHERE t.id=42) AS x");
    }

    @Test
    void subqueryWrapsJoinedTables() {
        assertThat(asSubquery("SELECT * FROM a JOIN b ON a.id = b.id", Map.of("a", "x=1", "b", "y=2")))
                .isEqualTo("SELECT * FROM (SELECT * FROM a WHERE a.x=1) AS a "
                        + "JOIN (SELECT * FROM b WHERE b.y=2) AS b ON a.id = b.id");
    }

    @Test
    void rewrittenQueriesStillReadTheSameTables() {
        Map<String, String> predicates = Map.of("t", "id=42");
        for (String rewritten : List.of(
                inPredicate("SELECT * FROM t WHERE 1=1", predicates),
                asSubquery("SELECT * FROM t WHERE 1=1", predicates))) {
            assertThat(new ParsedQuery(rewritten, false, "postgresql", tokenizer).getTables())
                    .containsExactly(new Table("t"));
        }
    }

    /* ===================== LOOKUP ===================== */

    @Test
    void lookupsAreMemoisedPerCallAndUseDefaultSchema() {
        AtomicInteger calls = new AtomicInteger();
        List<String> schemas = new ArrayList<>();
        RlsPredicateProviderImpl provider = (databaseId, schema, table) -> {
            calls.incrementAndGet();
            schemas.add(schema);
            return Optional.of("id=42");
        };
        RlsRewriter rewriter = new RlsRewriter(provider, tokenizer);

        rewriter.insertRlsInPredicate(statement("SELECT * FROM t UNION SELECT * FROM t"), DATABASE_ID, "public");
        assertThat(calls).hasValue(1);
        assertThat(schemas).containsExactly("public");

        rewriter.insertRlsInPredicate(statement("SELECT * FROM s.t"), DATABASE_ID, "public");
        assertThat(calls).hasValue(2);
        assertThat(schemas).containsExactly("public", "s");
    }

    @Test
    void lookupFailuresPropagate() {
        RlsPredicateProviderImpl provider = (databaseId, schema, table) -> {
            throw new AppException(ErrorConfig.RLS_LOOKUP_ERROR, "down");
        };
        RlsRewriter rewriter = new RlsRewriter(provider, tokenizer);

        assertThatThrownBy(() -> rewriter.insertRlsAsSubquery(statement("SELECT * FROM t"), DATABASE_ID, null))
                .isInstanceOf(AppException.class)
                .hasMessage("down");
    }

    /* ===================== HELPERS ===================== */

    @Test
    void detectsTableReads() {
        assertThat(RlsRewriter.hasTableQuery(statement("SELECT * FROM t"))).isTrue();
        assertThat(RlsRewriter.hasTableQuery(statement("SELECT * FROM (SELECT * FROM t) x"))).isTrue();
        assertThat(RlsRewriter.hasTableQuery(statement("SELECT * FROM (SELECT 1)"))).isFalse();
        assertThat(RlsRewriter.hasTableQuery(statement("SELECT * FROM (a)"))).isTrue();
        assertThat(RlsRewriter.hasTableQuery(statement("SELECT 1"))).isFalse();
    }

    @Test
    void qualifiesColumnsButNotTables() {
        TokenGroup rls = statement("id = 1 AND name IN (SELECT name FROM allowed)");
        assertThat(RlsRewriter.addTableName(rls, "t").text())
                .isEqualTo("t.id = 1 AND t.name IN (SELECT t.name FROM allowed)");
    }
}
