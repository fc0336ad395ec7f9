package com.example.sqlsentinel.service.sql.druid;

import com.example.sqlsentinel.service.sql.dto.Table;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeTest {

    @Test
    void resolvesCtesInOwnAndParentScopeOnly() {
        Scope root = new Scope(null);
        root.declareCte("c");
        Scope child = new Scope(root);
        Scope grandChild = new Scope(child);

        assertThat(root.isCte(new Table("c"))).isTrue();
        assertThat(child.isCte(new Table("c"))).isTrue();
        assertThat(grandChild.isCte(new Table("c"))).isFalse();
        assertThat(child.isCte(new Table("c", "s"))).isFalse();
    }

    @Test
    void recordsSourcesInOrder() {
        Scope scope = new Scope(null);
        Scope derived = new Scope(scope);
        scope.addTable("a", new Table("a"));
        scope.addScope("x", derived);

        assertThat(scope.getSources()).hasSize(2);
        assertThat(scope.getSources().get(0).isTable()).isTrue();
        assertThat(scope.getSources().get(1).scope()).isSameAs(derived);
    }
}
