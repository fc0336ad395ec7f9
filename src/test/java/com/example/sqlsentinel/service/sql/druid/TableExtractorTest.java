package com.example.sqlsentinel.service.sql.druid;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.example.sqlsentinel.service.sql.dto.Table;
import com.example.sqlsentinel.service.sql.statement.SqlStatement;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TableExtractorTest {

    private static Set<Table> extract(String sql, DbType dbType) {
        SQLStatement statement = SqlStatement.parseAll(sql, dbType).get(0);
        return TableExtractor.extract(statement, dbType);
    }

    @Test
    void plainSelect() {
        assertThat(extract("SELECT * FROM a", DbType.postgresql)).containsExactly(new Table("a"));
    }

    @Test
    void genericGrammarReadsPlainSelects() {
        assertThat(extract("SELECT * FROM s.a JOIN b ON a.id = b.id", DbType.other))
                .containsExactlyInAnyOrder(new Table("a", "s"), new Table("b"));
    }

    @Test
    void cteNamesAreNeverReported() {
        assertThat(extract("WITH cte AS (SELECT * FROM a) SELECT * FROM cte", DbType.postgresql))
                .containsExactly(new Table("a"));
        assertThat(extract("WITH c AS (SELECT * FROM a) SELECT * FROM (SELECT * FROM c) x", DbType.postgresql))
                .containsExactly(new Table("a"));
    }

    @Test
    void cteLookupStopsAtTheImmediateParent() {
        Set<Table> tables = extract(
                "WITH c AS (SELECT 1) SELECT * FROM (SELECT * FROM (SELECT * FROM c) x) y", DbType.postgresql);
        assertThat(tables).containsExactly(new Table("c"));
    }

    @Test
    void qualifiedCteNameIsATable() {
        assertThat(extract("WITH a AS (SELECT 1) SELECT * FROM s.a", DbType.postgresql))
                .containsExactly(new Table("a", "s"));
    }

    @Test
    void collectsJoinsUnionsAndSubqueries() {
        assertThat(extract("SELECT * FROM s.a JOIN b ON a.id = b.id WHERE b.x IN (SELECT x FROM c)", DbType.postgresql))
                .containsExactlyInAnyOrder(new Table("a", "s"), new Table("b"), new Table("c"));
        assertThat(extract("SELECT * FROM a UNION SELECT * FROM cat.s.b", DbType.postgresql))
                .containsExactlyInAnyOrder(new Table("a"), new Table("b", "s", "cat"));
    }

    @Test
    void dmlTargetsAreTables() {
        assertThat(extract("INSERT INTO t SELECT * FROM u", DbType.mysql))
                .containsExactlyInAnyOrder(new Table("t"), new Table("u"));
    }

    @Test
    void quotedNamesAreUnquoted() {
        assertThat(extract("SELECT * FROM \"My Table\"", DbType.postgresql))
                .containsExactly(new Table("My Table"));
    }

    @Test
    void describeReportsTheTable() {
        assertThat(extract("DESCRIBE a", DbType.mysql)).containsExactly(new Table("a"));
    }

    @Test
    void showCommandArgumentIsProbed() {
        SQLStatement statement = SqlStatement.parseAll("SHOW COLUMNS FROM x", DbType.mysql).get(0);

        assertThat(StatementCategory.of(statement)).isEqualTo(StatementCategory.COMMAND);
        assertThat(TableExtractor.extract(statement, DbType.mysql)).containsExactly(new Table("x"));
    }

    @Test
    void showTablesIsACommandWithoutTables() {
        SQLStatement statement = SqlStatement.parseAll("SHOW TABLES", DbType.mysql).get(0);

        assertThat(StatementCategory.of(statement)).isEqualTo(StatementCategory.COMMAND);
        assertThat(TableExtractor.extract(statement, DbType.mysql)).isEmpty();
    }

    @Test
    void generalStatementsAreGeneral() {
        SQLStatement statement = SqlStatement.parseAll("UPDATE t SET a = 1", DbType.postgresql).get(0);
        assertThat(StatementCategory.of(statement)).isEqualTo(StatementCategory.GENERAL);
    }
}
