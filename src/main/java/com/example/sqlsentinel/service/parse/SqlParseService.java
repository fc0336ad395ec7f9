package com.example.sqlsentinel.service.parse;

import com.example.sqlsentinel.dto.QueryAnalysisDto;
import com.example.sqlsentinel.service.implement.SqlParseServiceImpl;
import com.example.sqlsentinel.service.sql.dto.Table;
import com.example.sqlsentinel.service.sql.query.ParsedQuery;
import com.example.sqlsentinel.service.sql.statement.SqlScript;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SqlParseService implements SqlParseServiceImpl {
    private final SqlTokenizer tokenizer;

    @Override
    public List<String> extractTables(String sql, String engine) {
        return new ParsedQuery(sql, false, engine, tokenizer).getTables().stream()
                .map(Table::toString)
                .toList();
    }

    @Override
    public QueryAnalysisDto analyze(String sql, String engine) {
        SqlScript script = new SqlScript(sql, engine);
        ParsedQuery query = new ParsedQuery(sql, false, engine, tokenizer);
        log.info("Analyzing {} statement(s) for engine {}", script.getStatements().size(), engine);

        return QueryAnalysisDto.builder()
                .engine(engine)
                .statementCount(script.getStatements().size())
                .select(query.isSelect())
                .explain(query.isExplain())
                .show(query.isShow())
                .set(query.isSet())
                .validCtas(query.isValidCtas())
                .validCvas(query.isValidCvas())
                .limit(query.getLimit())
                .settings(script.getSettings())
                .tables(query.getTables().stream().map(Table::toString).toList())
                .build();
    }

    @Override
    public String format(String sql, String engine, boolean comments) {
        return new SqlScript(sql, engine).format(comments, tokenizer);
    }

    @Override
    public String applyLimit(String sql, String engine, int limit, boolean force) {
        return new ParsedQuery(sql, false, engine, tokenizer).setOrUpdateQueryLimit(limit, force);
    }
}
