package com.example.sqlsentinel.dto.request;

import lombok.*;
import lombok.experimental.FieldDefaults;

@NoArgsConstructor
@AllArgsConstructor
@Data
@FieldDefaults(level = AccessLevel.PRIVATE)
public class SqlRequest {
    String sql;
    String engine;
    boolean comments = true;
}
