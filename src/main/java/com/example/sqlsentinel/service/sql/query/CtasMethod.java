package com.example.sqlsentinel.service.sql.query;

/** Kind of object a CREATE ... AS SELECT produces. */
public enum CtasMethod {
    TABLE,
    VIEW
}
