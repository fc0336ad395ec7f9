package com.example.sqlsentinel.service.sql.druid;

import com.example.sqlsentinel.service.sql.dto.Table;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * One SELECT level (or a DML statement root) of a query. Holds the CTE names declared
 * at this level and, in order, the sources its FROM clauses read.
 */
public final class Scope {
    @Getter
    private final Scope parent;
    private final Set<String> cteNames = new HashSet<>();
    private final List<Source> sources = new ArrayList<>();

    public Scope(Scope parent) {
        this.parent = parent;
    }

    /** A FROM source: a physical table or a nested scope (derived table / CTE body). */
    public record Source(String name, Table table, Scope scope) {
        public boolean isTable() {
            return table != null;
        }
    }

    void declareCte(String name) {
        cteNames.add(name);
    }

    void addTable(String name, Table table) {
        sources.add(new Source(name, table, null));
    }

    void addScope(String name, Scope scope) {
        sources.add(new Source(name, null, scope));
    }

    public Set<String> getCteNames() {
        return Collections.unmodifiableSet(cteNames);
    }

    public List<Source> getSources() {
        return Collections.unmodifiableList(sources);
    }

    /**
     * True when an unqualified {@code table} names a CTE bound in this scope or in its
     * immediate parent. Grand-parents are deliberately not consulted.
     */
    public boolean isCte(Table table) {
        if (table.getSchema() != null || table.getCatalog() != null) return false;
        String name = table.getTable();
        if (cteNames.contains(name)) return true;
        return parent != null && parent.cteNames.contains(name);
    }
}
