package com.example.sqlsentinel.service.sql.dialect.config;

import com.alibaba.druid.DbType;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Engine identifier -> Druid grammar. Engines missing from the table are parsed with the
 * generic grammar ({@link DbType#other}); {@link #KUSTO_KQL} has no SQL grammar at all.
 */
@NoArgsConstructor
public final class DialectConfig {

    /** The only engine handled without a SQL grammar. */
    public static final String KUSTO_KQL = "kustokql";

    /** Grammar used when the engine is unknown or absent. */
    public static final DbType GENERIC = DbType.other;

    public static final Map<String, DbType> ENGINE_DIALECTS;
    static {
        Map<String, DbType> m = new LinkedHashMap<>();
        // Hive / Spark family
        m.put("ascend", DbType.hive);
        m.put("hive", DbType.hive);
        m.put("spark", DbType.spark);
        m.put("databricks", DbType.spark);
        m.put("impala", DbType.impala);

        // Presto family
        m.put("awsathena", DbType.athena);
        m.put("presto", DbType.presto);
        m.put("trino", DbType.trino);

        // Postgres wire-compatible
        m.put("postgresql", DbType.postgresql);
        m.put("cockroachdb", DbType.postgresql);
        m.put("hana", DbType.postgresql);
        m.put("netezza", DbType.postgresql);
        m.put("vertica", DbType.postgresql);
        m.put("duckdb", DbType.postgresql);
        m.put("redshift", DbType.redshift);

        // MySQL family
        m.put("mysql", DbType.mysql);
        m.put("mariadb", DbType.mariadb);
        m.put("pydoris", DbType.doris);
        m.put("starrocks", DbType.starrocks);

        // SQLite-backed
        m.put("sqlite", DbType.sqlite);
        m.put("gsheets", DbType.sqlite);
        m.put("shillelagh", DbType.sqlite);
        m.put("superset", DbType.sqlite);

        // Others
        m.put("bigquery", DbType.bigquery);
        m.put("clickhouse", DbType.clickhouse);
        m.put("clickhousedb", DbType.clickhouse);
        m.put("db2", DbType.db2);
        m.put("mssql", DbType.sqlserver);
        m.put("oracle", DbType.oracle);
        m.put("snowflake", DbType.snowflake);
        m.put("teradatasql", DbType.teradata);

        ENGINE_DIALECTS = Collections.unmodifiableMap(m);
    }

    public static Optional<DbType> dbTypeFor(String engine) {
        if (engine == null) return Optional.empty();
        return Optional.ofNullable(ENGINE_DIALECTS.get(engine.toLowerCase(Locale.ROOT)));
    }

    /** Grammar for the engine, falling back to the generic one. */
    public static DbType grammarFor(String engine) {
        return dbTypeFor(engine).orElse(GENERIC);
    }

    public static boolean isKustoKql(String engine) {
        return KUSTO_KQL.equals(engine);
    }
}
