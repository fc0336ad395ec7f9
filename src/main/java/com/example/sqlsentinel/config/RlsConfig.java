package com.example.sqlsentinel.config;

import com.example.sqlsentinel.service.sql.rls.RlsMethod;
import lombok.AccessLevel;
import lombok.Data;
import lombok.experimental.FieldDefaults;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
@Data
@FieldDefaults(level = AccessLevel.PRIVATE)
public class RlsConfig {

    @Value("${sqlsentinel.rls.predicate-engines:druid,elasticsearch,odelasticsearch,pinot}")
    List<String> predicateEngines;

    @Value("${sqlsentinel.rls.default-schema:#{null}}")
    String defaultSchema;

    /** Engines without sub-query support get the predicate inlined. */
    public RlsMethod methodFor(String engine) {
        if (engine == null) return RlsMethod.AS_SUBQUERY;
        return predicateEngines.contains(engine.toLowerCase(Locale.ROOT))
                ? RlsMethod.AS_PREDICATE
                : RlsMethod.AS_SUBQUERY;
    }
}
