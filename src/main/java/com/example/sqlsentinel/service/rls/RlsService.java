package com.example.sqlsentinel.service.rls;

import com.example.sqlsentinel.config.RlsConfig;
import com.example.sqlsentinel.service.implement.RlsPredicateProviderImpl;
import com.example.sqlsentinel.service.implement.RlsServiceImpl;
import com.example.sqlsentinel.service.sql.rls.RlsMethod;
import com.example.sqlsentinel.service.sql.rls.RlsRewriter;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import com.example.sqlsentinel.service.sql.token.TokenGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class RlsService implements RlsServiceImpl {
    private final RlsRewriter rewriter;
    private final SqlTokenizer tokenizer;
    private final RlsConfig rlsConfig;

    public RlsService(RlsPredicateProviderImpl predicateProvider, SqlTokenizer tokenizer, RlsConfig rlsConfig) {
        this.rewriter = new RlsRewriter(predicateProvider, tokenizer);
        this.tokenizer = tokenizer;
        this.rlsConfig = rlsConfig;
    }

    @Override
    public String applyRls(String sql, String engine, int databaseId, String schema) {
        RlsMethod method = rlsConfig.methodFor(engine);
        String defaultSchema = schema == null || schema.isBlank() ? rlsConfig.getDefaultSchema() : schema;

        StringBuilder out = new StringBuilder(sql.length());
        int rewritten = 0;
        for (TokenGroup statement : tokenizer.parse(sql)) {
            if (!RlsRewriter.hasTableQuery(statement)) {
                out.append(statement.text());
                continue;
            }
            TokenGroup result = method == RlsMethod.AS_PREDICATE
                    ? rewriter.insertRlsInPredicate(statement, databaseId, defaultSchema)
                    : rewriter.insertRlsAsSubquery(statement, databaseId, defaultSchema);
            out.append(result.text());
            rewritten++;
        }
        log.info("Applied RLS ({}) to {} statement(s) for database {}", method, rewritten, databaseId);
        return out.toString();
    }
}
