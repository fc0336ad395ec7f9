package com.example.sqlsentinel.service.sql.statement;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a KQL script on ";" outside string literals and ``` multi-line blocks.
 * An escaped quote is detected by looking one character back for a backslash, so a
 * literal ending in an escaped backslash ('\\') is not recognised as closed.
 */
public final class KqlSplitter {

    enum State {
        OUTSIDE,
        INSIDE_SINGLE_QUOTED,
        INSIDE_DOUBLE_QUOTED,
        INSIDE_MULTILINE
    }

    private KqlSplitter() {}

    public static List<String> split(String kql) {
        String query = kql.endsWith(";") ? kql : kql + ";";
        List<String> statements = new ArrayList<>();
        State state = State.OUTSIDE;
        int start = 0;

        for (int i = 0; i < query.length(); i++) {
            char ch = query.charAt(i);
            boolean fence = ch == '`' && i >= 2 && query.charAt(i - 1) == '`' && query.charAt(i - 2) == '`';
            boolean escaped = i >= 1 && query.charAt(i - 1) == '\\';

            switch (state) {
                case OUTSIDE -> {
                    if (ch == ';') {
                        statements.add(query.substring(start, i));
                        start = i + 1;
                    } else if (ch == '\'') {
                        state = State.INSIDE_SINGLE_QUOTED;
                    } else if (ch == '"') {
                        state = State.INSIDE_DOUBLE_QUOTED;
                    } else if (fence) {
                        state = State.INSIDE_MULTILINE;
                    }
                }
                case INSIDE_SINGLE_QUOTED -> {
                    if (ch == '\'' && !escaped) state = State.OUTSIDE;
                }
                case INSIDE_DOUBLE_QUOTED -> {
                    if (ch == '"' && !escaped) state = State.OUTSIDE;
                }
                case INSIDE_MULTILINE -> {
                    if (fence) state = State.OUTSIDE;
                }
            }
        }
        return statements;
    }
}
