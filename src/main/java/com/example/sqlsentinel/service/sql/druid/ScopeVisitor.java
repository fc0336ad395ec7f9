package com.example.sqlsentinel.service.sql.druid;

import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLObject;
import com.alibaba.druid.sql.ast.statement.SQLExprTableSource;
import com.alibaba.druid.sql.ast.statement.SQLSelect;
import com.alibaba.druid.sql.ast.statement.SQLSelectQueryBlock;
import com.alibaba.druid.sql.ast.statement.SQLSubqueryTableSource;
import com.alibaba.druid.sql.ast.statement.SQLWithSubqueryClause;
import com.alibaba.druid.sql.visitor.SQLASTVisitorAdapter;
import com.example.sqlsentinel.service.sql.dto.Table;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the scope tree of a statement while Druid walks it. Every SELECT opens a scope;
 * a query block opens its own scope unless it is the body of that SELECT (set-operation
 * branches, bare sub-query blocks). CTE names are declared on the scope that owns the
 * WITH clause, before its body and main query are visited.
 */
class ScopeVisitor extends SQLASTVisitorAdapter {
    private final Deque<Scope> stack = new ArrayDeque<>();
    @Getter
    private final List<Scope> scopes = new ArrayList<>();

    ScopeVisitor() {
        Scope root = new Scope(null);
        stack.push(root);
        scopes.add(root);
    }

    private Scope current() {
        return stack.peek();
    }

    private Scope open() {
        Scope scope = new Scope(current());
        stack.push(scope);
        scopes.add(scope);
        return scope;
    }

    @Override
    public boolean visit(SQLSelect x) {
        Scope parent = current();
        Scope scope = open();
        SQLObject owner = x.getParent();
        if (owner instanceof SQLWithSubqueryClause.Entry entry) {
            parent.addScope(name(entry.getAlias()), scope);
        } else if (owner instanceof SQLSubqueryTableSource derived) {
            parent.addScope(name(derived.getAlias()), scope);
        }
        return true;
    }

    @Override
    public void endVisit(SQLSelect x) {
        stack.pop();
    }

    @Override
    public boolean visit(SQLSelectQueryBlock x) {
        if (!(x.getParent() instanceof SQLSelect)) open();
        return true;
    }

    @Override
    public void endVisit(SQLSelectQueryBlock x) {
        if (!(x.getParent() instanceof SQLSelect)) stack.pop();
    }

    @Override
    public boolean visit(SQLWithSubqueryClause.Entry x) {
        current().declareCte(name(x.getAlias()));
        return true;
    }

    @Override
    public boolean visit(SQLExprTableSource x) {
        Table table = TableExtractor.toTable(x.getExpr());
        if (table != null) {
            current().addTable(x.getAlias() != null ? name(x.getAlias()) : table.getTable(), table);
        }
        return true;
    }

    private static String name(String raw) {
        return raw == null ? null : SQLUtils.normalize(raw);
    }
}
