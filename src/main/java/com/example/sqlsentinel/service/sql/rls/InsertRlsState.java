package com.example.sqlsentinel.service.sql.rls;

/** Position of the scan relative to the table source of the current clause. */
enum InsertRlsState {
    SCANNING,
    SEEN_SOURCE,
    FOUND_TABLE
}
