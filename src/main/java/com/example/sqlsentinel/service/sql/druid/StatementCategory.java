package com.example.sqlsentinel.service.sql.druid;

import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.SQLDescribeStatement;
import com.alibaba.druid.sql.ast.statement.SQLShowStatement;
import com.alibaba.druid.sql.dialect.mysql.ast.statement.MySqlExplainStatement;

/** How table references are collected from a parsed statement. */
public enum StatementCategory {
    /** DESCRIBE / DESC of a table: every name in the statement, no scoping. */
    DESCRIBE,
    /** Opaque utility command (SHOW ...): the argument is re-parsed as a SELECT. */
    COMMAND,
    /** Everything else: scope tree with CTE shadowing. */
    GENERAL;

    public static StatementCategory of(SQLStatement statement) {
        if (statement instanceof SQLDescribeStatement) return DESCRIBE;
        if (statement instanceof MySqlExplainStatement explain && explain.getTableName() != null) return DESCRIBE;
        if (statement instanceof SQLShowStatement) return COMMAND;
        return GENERAL;
    }
}
