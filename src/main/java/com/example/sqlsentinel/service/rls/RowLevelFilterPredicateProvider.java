package com.example.sqlsentinel.service.rls;

import com.example.sqlsentinel.config.ErrorConfig;
import com.example.sqlsentinel.entity.RowLevelFilter;
import com.example.sqlsentinel.exception.AppException;
import com.example.sqlsentinel.repository.RowLevelFilterRepository;
import com.example.sqlsentinel.service.implement.RlsPredicateProviderImpl;
import com.example.sqlsentinel.service.sql.query.QueryUtils;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/** Row-level filters stored in {@code row_level_security_filters}. */
@Slf4j
@Service
@RequiredArgsConstructor
public class RowLevelFilterPredicateProvider implements RlsPredicateProviderImpl {
    private final RowLevelFilterRepository repository;
    private final SqlTokenizer tokenizer;

    @Override
    public Optional<String> lookup(int databaseId, String schema, String table) {
        List<RowLevelFilter> filters;
        try {
            filters = repository.findAllByDatabaseIdAndSchemaNameAndTableNameOrderById(databaseId, schema, table);
        } catch (DataAccessException e) {
            log.error("Row-level filter lookup failed for {}.{} on database {}", schema, table, databaseId, e);
            throw new AppException(ErrorConfig.RLS_LOOKUP_ERROR,
                    "Unable to load row-level filters for table " + table, e);
        }

        List<String> clauses = filters.stream()
                .map(RowLevelFilter::getClause)
                .filter(clause -> clause != null && !clause.isBlank())
                .map(clause -> QueryUtils.sanitizeClause(clause, tokenizer))
                .toList();
        if (clauses.isEmpty()) return Optional.empty();
        if (clauses.size() == 1) return Optional.of(clauses.get(0));

        // each clause keeps its own precedence
        return Optional.of(clauses.stream()
                .map(clause -> "(" + clause + ")")
                .collect(Collectors.joining(" AND ")));
    }
}
