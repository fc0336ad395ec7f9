package com.example.sqlsentinel.service.sql.statement;

import com.example.sqlsentinel.exception.SqlParseException;
import com.example.sqlsentinel.service.sql.dialect.config.DialectConfig;
import com.example.sqlsentinel.service.sql.dto.Table;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Kusto KQL statement. There is no grammar for KQL, so the statement is kept as
 * trimmed text and tables cannot be extracted.
 */
@Slf4j
public class KustoKqlStatement extends BaseSqlStatement<String> {
    private static final Pattern SET_REGEX =
            Pattern.compile("^set\\s+(?<name>\\w+)(?:\\s*=\\s*(?<value>\\w+))?$", Pattern.CASE_INSENSITIVE);

    KustoKqlStatement(String parsed, String engine) {
        super(parsed, engine, noTables());
    }

    public static KustoKqlStatement parse(String statement, String engine) {
        if (!DialectConfig.isKustoKql(engine)) {
            throw new SqlParseException("Invalid engine: " + engine);
        }
        List<String> statements = KqlSplitter.split(statement);
        if (statements.size() != 1) {
            throw new SqlParseException("SQLStatement should have exactly one statement");
        }
        return new KustoKqlStatement(statements.get(0).strip(), engine);
    }

    public static List<KustoKqlStatement> splitQuery(String query, String engine) {
        List<KustoKqlStatement> out = new ArrayList<>();
        for (String statement : KqlSplitter.split(query)) out.add(parse(statement, engine));
        return out;
    }

    private static Set<Table> noTables() {
        log.warn("Kusto KQL doesn't support table extraction. This means that data access "
                + "roles will not be enforced in the database.");
        return Collections.emptySet();
    }

    @Override
    public String format(boolean comments, SqlTokenizer tokenizer) {
        return parsed;
    }

    @Override
    public Map<String, Object> getSettings() {
        Matcher m = SET_REGEX.matcher(parsed);
        if (!m.matches()) return Collections.emptyMap();
        String value = m.group("value");
        return Map.of(m.group("name"), value != null ? value : Boolean.TRUE);
    }
}
