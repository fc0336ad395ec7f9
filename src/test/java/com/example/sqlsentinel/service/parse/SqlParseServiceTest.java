package com.example.sqlsentinel.service.parse;

import com.example.sqlsentinel.dto.QueryAnalysisDto;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SqlParseServiceTest {
    private final SqlParseService service = new SqlParseService(SqlTokenizer.standard());

    @Test
    void extractsQualifiedTableNames() {
        assertThat(service.extractTables("SELECT * FROM s.a JOIN b ON a.id = b.id", "postgresql"))
                .containsExactlyInAnyOrder("s.a", "b");
    }

    @Test
    void analyzesScript() {
        QueryAnalysisDto analysis = service.analyze("SELECT * FROM t LIMIT 5", "postgresql");

        assertThat(analysis.getStatementCount()).isEqualTo(1);
        assertThat(analysis.isSelect()).isTrue();
        assertThat(analysis.isExplain()).isFalse();
        assertThat(analysis.getLimit()).isEqualTo(5);
        assertThat(analysis.getTables()).containsExactly("t");
    }

    @Test
    void appliesLimit() {
        assertThat(service.applyLimit("SELECT * FROM t LIMIT 50", "postgresql", 10, false))
                .isEqualTo("SELECT * FROM t LIMIT 10");
    }
}
