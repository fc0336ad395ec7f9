package com.example.sqlsentinel.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Data
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "row_level_security_filters")
public class RowLevelFilter {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Integer databaseId;

    private String schemaName;

    @Column(nullable = false)
    private String tableName;

    @Column(nullable = false, columnDefinition = "text")
    private String clause;
}
