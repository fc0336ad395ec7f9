package com.example.sqlsentinel.controller;

import com.example.sqlsentinel.config.ErrorConfig;
import com.example.sqlsentinel.dto.QueryAnalysisDto;
import com.example.sqlsentinel.dto.request.LimitRequest;
import com.example.sqlsentinel.dto.request.RlsRequest;
import com.example.sqlsentinel.dto.request.SqlRequest;
import com.example.sqlsentinel.exception.AppException;
import com.example.sqlsentinel.service.parse.SqlParseService;
import com.example.sqlsentinel.service.rls.RlsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/sql")
public class SqlController {
    private final SqlParseService sqlParseService;
    private final RlsService rlsService;

    @PostMapping("/tables")
    public ResponseEntity<List<String>> onTables(@RequestBody SqlRequest request) {
        requireSql(request.getSql());
        return ResponseEntity.ok(sqlParseService.extractTables(request.getSql(), request.getEngine()));
    }

    @PostMapping("/analyze")
    public ResponseEntity<QueryAnalysisDto> onAnalyze(@RequestBody SqlRequest request) {
        requireSql(request.getSql());
        return ResponseEntity.ok(sqlParseService.analyze(request.getSql(), request.getEngine()));
    }

    @PostMapping("/format")
    public ResponseEntity<String> onFormat(@RequestBody SqlRequest request) {
        requireSql(request.getSql());
        return ResponseEntity.ok(sqlParseService.format(request.getSql(), request.getEngine(), request.isComments()));
    }

    @PostMapping("/limit")
    public ResponseEntity<String> onLimit(@RequestBody LimitRequest request) {
        requireSql(request.getSql());
        if (request.getLimit() == null || request.getLimit() < 0) {
            throw new AppException(ErrorConfig.INVALID_REQUEST, "Limit must be a non-negative integer");
        }
        return ResponseEntity.ok(sqlParseService.applyLimit(
                request.getSql(), request.getEngine(), request.getLimit(), request.isForce()));
    }

    @PostMapping("/rls")
    public ResponseEntity<String> onRls(@RequestBody RlsRequest request) {
        requireSql(request.getSql());
        if (request.getDatabaseId() == null) {
            throw new AppException(ErrorConfig.INVALID_REQUEST, "databaseId is required");
        }
        return ResponseEntity.ok(rlsService.applyRls(
                request.getSql(), request.getEngine(), request.getDatabaseId(), request.getSchema()));
    }

    private static void requireSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            throw new AppException(ErrorConfig.INVALID_REQUEST, "SQL is empty");
        }
    }
}
