package com.example.sqlsentinel.dto.request;

import lombok.*;
import lombok.experimental.FieldDefaults;

@NoArgsConstructor
@AllArgsConstructor
@Data
@FieldDefaults(level = AccessLevel.PRIVATE)
public class RlsRequest {
    String sql;
    String engine;
    Integer databaseId;
    String schema;
}
