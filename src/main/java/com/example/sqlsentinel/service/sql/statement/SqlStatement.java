package com.example.sqlsentinel.service.sql.statement;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.alibaba.druid.sql.ast.statement.SQLAssignItem;
import com.alibaba.druid.sql.ast.statement.SQLSetStatement;
import com.alibaba.druid.sql.parser.ParserException;
import com.alibaba.druid.sql.parser.SQLParserFeature;
import com.example.sqlsentinel.exception.SqlParseException;
import com.example.sqlsentinel.service.sql.dialect.config.DialectConfig;
import com.example.sqlsentinel.service.sql.druid.TableExtractor;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Statement parsed by the Druid grammar of its engine. */
public class SqlStatement extends BaseSqlStatement<SQLStatement> {
    @Getter
    private final DbType dbType;

    SqlStatement(SQLStatement parsed, String engine, DbType dbType) {
        super(parsed, engine, TableExtractor.extract(parsed, dbType));
        this.dbType = dbType;
    }

    /** Parses exactly one statement. */
    public static SqlStatement parse(String statement, String engine) {
        DbType dbType = DialectConfig.grammarFor(engine);
        List<SQLStatement> parsed = parseAll(statement, dbType);
        if (parsed.size() != 1) {
            throw new SqlParseException("SQLStatement should have exactly one statement");
        }
        return new SqlStatement(parsed.get(0), engine, dbType);
    }

    /** Splits a script into statements in source order; any parse error aborts the split. */
    public static List<SqlStatement> splitQuery(String query, String engine) {
        DbType dbType = DialectConfig.grammarFor(engine);
        List<SqlStatement> out = new ArrayList<>();
        for (SQLStatement st : parseAll(query, dbType)) {
            out.add(new SqlStatement(st, engine, dbType));
        }
        return out;
    }

    public static List<SQLStatement> parseAll(String sql, DbType dbType) {
        try {
            List<SQLStatement> out = new ArrayList<>();
            for (SQLStatement st : SQLUtils.parseStatements(sql, dbType, SQLParserFeature.KeepComments)) {
                if (st != null) out.add(st);
            }
            return out;
        } catch (ParserException e) {
            throw new SqlParseException("Unable to split query", e);
        } catch (IllegalArgumentException | IllegalStateException | ClassCastException e) {
            // some dialect parsers fail outside ParserException on malformed input
            throw new SqlParseException("Unable to split query", e);
        }
    }

    /** Druid renders the terminating ";" of a statement; the script adds its own separators. */
    @Override
    public String format(boolean comments, SqlTokenizer tokenizer) {
        String rendered = SQLUtils.toSQLString(parsed, dbType);
        if (!comments) rendered = tokenizer.stripComments(rendered);
        return stripTerminator(rendered);
    }

    static String stripTerminator(String rendered) {
        int end = rendered.length();
        while (end > 0) {
            char c = rendered.charAt(end - 1);
            if (c != ';' && !Character.isWhitespace(c)) break;
            end--;
        }
        return rendered.substring(0, end).strip();
    }

    @Override
    public Map<String, Object> getSettings() {
        if (!(parsed instanceof SQLSetStatement set)) return Collections.emptyMap();
        Map<String, Object> out = new LinkedHashMap<>();
        for (SQLAssignItem item : set.getItems()) {
            if (item.getTarget() == null || item.getValue() == null) continue;
            out.put(SQLUtils.toSQLString(item.getTarget(), dbType), SQLUtils.toSQLString(item.getValue(), dbType));
        }
        return out;
    }
}
