package com.example.sqlsentinel.repository;

import com.example.sqlsentinel.entity.RowLevelFilter;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RowLevelFilterRepository extends JpaRepository<RowLevelFilter, Long> {
    List<RowLevelFilter> findAllByDatabaseIdAndSchemaNameAndTableNameOrderById(Integer databaseId,
                                                                            String schemaName,
                                                                            String tableName);
}
