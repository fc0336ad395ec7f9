package com.example.sqlsentinel.service.sql.druid;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLExpr;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.expr.SQLIdentifierExpr;
import com.alibaba.druid.sql.ast.expr.SQLPropertyExpr;
import com.alibaba.druid.sql.ast.statement.SQLDescribeStatement;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlExplainStatement;
import com.alibaba.druid.sql.parser.ParserException;
import com.alibaba.druid.sql.visitor.SQLASTVisitorAdapter;
import com.example.sqlsentinel.exception.SqlParseException;
import com.example.sqlsentinel.service.sql.dto.Table;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Physical tables a parsed statement reads or writes, CTE names excluded. */
@Slf4j
public final class TableExtractor {

    private TableExtractor() {}

    public static Set<Table> extract(SQLStatement statement, DbType dbType) {
        return switch (StatementCategory.of(statement)) {
            case DESCRIBE -> describedTables(statement);
            case COMMAND -> commandTables(statement, dbType);
            case GENERAL -> scopedTables(statement);
        };
    }

    /* ===================== DESCRIBE ===================== */

    private static Set<Table> describedTables(SQLStatement statement) {
        Set<Table> out = new LinkedHashSet<>();
        if (statement instanceof SQLDescribeStatement describe) {
            addIfPresent(out, toTable(describe.getObject()));
        } else if (statement instanceof MySqlExplainStatement explain) {
            addIfPresent(out, toTable(explain.getTableName()));
        }
        return out;
    }

    /* ===================== COMMAND ===================== */

    /* SHOW <argument>: the argument is probed as "SELECT <argument>"; best effort only. */
    private static Set<Table> commandTables(SQLStatement statement, DbType dbType) {
        String text = SQLUtils.toSQLString(statement, dbType).trim();
        String[] parts = text.split("\\s+", 2);
        if (parts.length < 2 || parts[1].isBlank()) return Collections.emptySet();

        String probe = "SELECT " + parts[1];
        List<SQLStatement> parsed;
        try {
            parsed = SQLUtils.parseStatements(probe, dbType);
        } catch (ParserException e) {
            log.debug("Command argument is not a table expression: {}", probe);
            return Collections.emptySet();
        }

        Set<Table> out = new LinkedHashSet<>();
        SQLASTVisitorAdapter collector = new SQLASTVisitorAdapter() {
            @Override
            public boolean visit(SQLExprTableSource x) {
                addIfPresent(out, toTable(x.getExpr()));
                return true;
            }
        };
        for (SQLStatement st : parsed) st.accept(collector);
        return out;
    }

    /* ===================== GENERAL ===================== */

    private static Set<Table> scopedTables(SQLStatement statement) {
        ScopeVisitor visitor = new ScopeVisitor();
        try {
            statement.accept(visitor);
        } catch (IllegalArgumentException e) {
            // dialect-only statements reject generic visitors
            throw new SqlParseException("Unsupported statement: " + statement.getClass().getSimpleName(), e);
        }

        Set<Table> out = new LinkedHashSet<>();
        for (Scope scope : visitor.getScopes()) {
            for (Scope.Source source : scope.getSources()) {
                if (source.isTable() && !scope.isCte(source.table())) out.add(source.table());
            }
        }
        return out;
    }

    /* ===================== NAMES ===================== */

    /** {@code a}, {@code s.a} or {@code c.s.a} as a table; null for anything else. */
    static Table toTable(SQLExpr expr) {
        if (expr instanceof SQLIdentifierExpr id) return new Table(stripQuote(id.getName()));
        if (!(expr instanceof SQLPropertyExpr prop)) return null;

        List<String> parts = new ArrayList<>();
        parts.add(prop.getName());
        SQLExpr owner = prop.getOwner();
        while (owner instanceof SQLPropertyExpr p) {
            parts.add(p.getName());
            owner = p.getOwner();
        }
        if (owner instanceof SQLIdentifierExpr id) parts.add(id.getName());
        else if (owner != null) return null;

        return new Table(
                stripQuote(parts.get(0)),
                parts.size() > 1 ? stripQuote(parts.get(1)) : null,
                parts.size() > 2 ? stripQuote(parts.get(2)) : null);
    }

    private static String stripQuote(String s) {
        return s == null ? null : SQLUtils.normalize(s);
    }

    private static void addIfPresent(Set<Table> out, Table table) {
        if (table != null) out.add(table);
    }
}
