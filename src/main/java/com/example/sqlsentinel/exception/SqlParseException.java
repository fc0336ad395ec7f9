package com.example.sqlsentinel.exception;

import com.alibaba.druid.sql.parser.ParserException;
import com.example.sqlsentinel.config.ErrorConfig;
import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL text could not be parsed, or parsed into an unexpected number of statements.
 * Position details are filled in when the parser reports them.
 */
@Getter
public class SqlParseException extends AppException {
    private static final Pattern POSITION = Pattern.compile("line (\\d+), column (\\d+)");
    private static final Pattern FRAGMENT = Pattern.compile("error in :'(.*?)'", Pattern.DOTALL);
    private static final Pattern TOKEN = Pattern.compile("token \\S+ (.+)$");

    private final String highlight;
    private final Integer line;
    private final Integer column;

    public SqlParseException(String message) {
        super(ErrorConfig.SQL_PARSE_ERROR, message);
        this.highlight = null;
        this.line = null;
        this.column = null;
    }

    public SqlParseException(String message, Throwable cause) {
        super(ErrorConfig.SQL_PARSE_ERROR, message, cause);
        this.highlight = null;
        this.line = null;
        this.column = null;
    }

    public SqlParseException(String message, ParserException cause) {
        super(ErrorConfig.SQL_PARSE_ERROR, message, cause);
        String detail = cause.getMessage() == null ? "" : cause.getMessage();

        Matcher pos = POSITION.matcher(detail);
        boolean found = pos.find();
        this.line = found ? Integer.valueOf(pos.group(1)) : null;
        this.column = found ? Integer.valueOf(pos.group(2)) : null;

        Matcher fragment = FRAGMENT.matcher(detail);
        Matcher token = TOKEN.matcher(detail);
        if (fragment.find()) this.highlight = fragment.group(1);
        else if (token.find()) this.highlight = token.group(1);
        else this.highlight = null;
    }

    /** "Error parsing near '...' at line l:c" when the position is known, else the parser message. */
    public String describe() {
        if (line == null) {
            return getCause() != null && getCause().getMessage() != null ? getCause().getMessage() : getMessage();
        }
        return "Error parsing near '" + (highlight == null ? "" : highlight) + "' at line " + line + ":" + column;
    }
}
