package com.example.sqlsentinel.service.sql.statement;

import com.example.sqlsentinel.service.sql.dialect.config.DialectConfig;
import com.example.sqlsentinel.service.sql.dto.Table;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/** A script of zero or more statements, split with the statement class of its engine. */
@Getter
public class SqlScript {
    /** Engines without a SQL grammar. Keep this table small. */
    private static final Map<String, BiFunction<String, String, List<? extends BaseSqlStatement<?>>>> SPECIAL_ENGINES =
            Map.of(DialectConfig.KUSTO_KQL, KustoKqlStatement::splitQuery);

    private final String engine;
    private final List<BaseSqlStatement<?>> statements;

    public SqlScript(String query, String engine) {
        this.engine = engine;
        List<? extends BaseSqlStatement<?>> split = SPECIAL_ENGINES
                .getOrDefault(engine == null ? "" : engine, SqlStatement::splitQuery)
                .apply(query, engine);
        this.statements = Collections.unmodifiableList(new ArrayList<>(split));
    }

    public String format(boolean comments, SqlTokenizer tokenizer) {
        return statements.stream()
                .map(statement -> statement.format(comments, tokenizer))
                .collect(Collectors.joining(";\n"));
    }

    public String format(boolean comments) {
        return format(comments, SqlTokenizer.standard());
    }

    public String format() {
        return format(true);
    }

    /** Settings of all statements; a later assignment of the same name wins. */
    public Map<String, Object> getSettings() {
        Map<String, Object> out = new LinkedHashMap<>();
        for (BaseSqlStatement<?> statement : statements) out.putAll(statement.getSettings());
        return out;
    }

    public Set<Table> getTables() {
        Set<Table> out = new LinkedHashSet<>();
        for (BaseSqlStatement<?> statement : statements) out.addAll(statement.getTables());
        return out;
    }
}
