package com.example.sqlsentinel.service.sql.statement;

import com.example.sqlsentinel.service.sql.dto.Table;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.Set;

/**
 * A single parsed statement bound to the engine it was parsed for.
 *
 * @param <T> the parsed representation (an AST, or raw text for grammar-less engines)
 */
@Getter
public abstract class BaseSqlStatement<T> {
    protected final T parsed;
    protected final String engine;
    private final Set<Table> tables;

    protected BaseSqlStatement(T parsed, String engine, Set<Table> tables) {
        this.parsed = parsed;
        this.engine = engine;
        this.tables = Collections.unmodifiableSet(tables);
    }

    /**
     * Renders the statement without its terminating ";", with or without comments.
     * {@code tokenizer} removes the comments when they are not wanted.
     */
    public abstract String format(boolean comments, SqlTokenizer tokenizer);

    public String format(boolean comments) {
        return format(comments, SqlTokenizer.standard());
    }

    public String format() {
        return format(true);
    }

    /**
     * Session settings assigned by the statement: name to value text, or
     * {@link Boolean#TRUE} for a bare flag.
     */
    public abstract Map<String, Object> getSettings();

    @Override
    public String toString() {
        return format();
    }
}
