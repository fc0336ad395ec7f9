package com.example.sqlsentinel.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.FieldDefaults;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class QueryAnalysisDto {
    String engine;
    int statementCount;
    boolean select;
    boolean explain;
    boolean show;
    boolean set;
    boolean validCtas;
    boolean validCvas;
    Integer limit;
    Map<String, Object> settings;
    List<String> tables;
}
