package com.example.sqlsentinel.service.implement;

import com.example.sqlsentinel.dto.QueryAnalysisDto;

import java.util.List;

public interface SqlParseServiceImpl {
    List<String> extractTables(String sql, String engine);
    QueryAnalysisDto analyze(String sql, String engine);
    String format(String sql, String engine, boolean comments);
    String applyLimit(String sql, String engine, int limit, boolean force);
}
