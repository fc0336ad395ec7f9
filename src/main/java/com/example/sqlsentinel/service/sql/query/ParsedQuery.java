package com.example.sqlsentinel.service.sql.query;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.ast.SQLStatement;
import com.example.sqlsentinel.exception.SecurityAccessException;
import com.example.sqlsentinel.exception.SqlParseException;
import com.example.sqlsentinel.service.sql.dialect.config.DialectConfig;
import com.example.sqlsentinel.service.sql.druid.TableExtractor;
import com.example.sqlsentinel.service.sql.dto.Table;
import com.example.sqlsentinel.service.sql.statement.KustoKqlStatement;
import com.example.sqlsentinel.service.sql.statement.SqlStatement;
import com.example.sqlsentinel.service.sql.token.GroupKind;
import com.example.sqlsentinel.service.sql.token.SqlNode;
import com.example.sqlsentinel.service.sql.token.SqlToken;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import com.example.sqlsentinel.service.sql.token.TokenGroup;
import com.example.sqlsentinel.service.sql.token.TokenType;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classification and structural queries over a SQL text: read-only check, CTAS/CVAS
 * validity, LIMIT extraction and replacement, function usage and table extraction.
 * Token-level questions use the {@link SqlTokenizer}; tables come from the Druid grammar
 * of the engine.
 */
@Slf4j
public class ParsedQuery {
    private static final String STRIP_CHARS = " \t\r\n;";

    @Getter
    private final String sql;
    @Getter
    private final String engine;
    private final DbType dbType;
    private final SqlTokenizer tokenizer;
    private final List<TokenGroup> parsed;
    /** LIMIT of the last statement, null when absent or not an integer. */
    @Getter
    private final Integer limit;
    private Set<Table> tables;

    public ParsedQuery(String sql, SqlTokenizer tokenizer) {
        this(sql, false, null, tokenizer);
    }

    public ParsedQuery(String sql, boolean stripComments, String engine, SqlTokenizer tokenizer) {
        this.tokenizer = tokenizer;
        this.sql = stripComments ? tokenizer.stripComments(sql) : sql;
        this.engine = engine;
        this.dbType = DialectConfig.grammarFor(engine);
        log.debug("Tokenizing statement: {}", this.sql);
        this.parsed = tokenizer.parse(stripped());

        Integer last = null;
        for (TokenGroup statement : parsed) last = extractLimit(statement);
        this.limit = last;
    }

    /* ===================== TABLES ===================== */

    /**
     * Tables referenced by every statement.
     *
     * @throws SecurityAccessException when the text cannot be parsed for the engine
     */
    public Set<Table> getTables() {
        if (tables == null) tables = Collections.unmodifiableSet(extractTablesFromSql());
        return tables;
    }

    private Set<Table> extractTablesFromSql() {
        if (DialectConfig.isKustoKql(engine)) {
            Set<Table> out = new LinkedHashSet<>();
            KustoKqlStatement.splitQuery(stripped(), engine).forEach(st -> out.addAll(st.getTables()));
            return out;
        }
        try {
            Set<Table> out = new LinkedHashSet<>();
            for (SQLStatement statement : SqlStatement.parseAll(stripped(), dbType)) {
                out.addAll(TableExtractor.extract(statement, dbType));
            }
            return out;
        } catch (SqlParseException e) {
            log.warn("Unable to parse SQL ({}): {}", dbType, sql);
            throw new SecurityAccessException(e.describe(), e);
        }
    }

    /* ===================== CLASSIFICATION ===================== */

    /**
     * True when every statement only reads: plain SELECTs, WITH queries whose CTE bodies
     * only SELECT, and USE statements. Comments are stripped first.
     */
    public boolean isSelect() {
        boolean seenSelect = false;
        for (TokenGroup statement : tokenizer.parse(stripComments())) {
            SqlNode first = statement.firstSignificant();
            if (first != null && first.isToken(TokenType.CTE) && !cteBodiesOnlySelect(statement)) {
                return false;
            }

            String type = statement.statementType();
            if ("SELECT".equals(type)) {
                seenSelect = true;
                continue;
            }
            if (!"UNKNOWN".equals(type)) return false;

            List<SqlToken> tokens = statement.flatten();
            if (tokens.stream().anyMatch(ParsedQuery::isWriteToken)) return false;
            if (first != null && first.isKeyword("USE")) continue;
            // EXPLAIN, SET, SHOW, ...
            if (first != null && first.isToken(TokenType.KEYWORD)) return false;
            if (tokens.stream().noneMatch(ParsedQuery::isSelectToken)) return false;
        }
        return seenSelect;
    }

    /* Every group between WITH and the main statement keyword holds CTE bodies. */
    private static boolean cteBodiesOnlySelect(TokenGroup statement) {
        for (SqlNode child : statement.children()) {
            if (child instanceof SqlToken t && (t.type() == TokenType.DML || t.type() == TokenType.DDL)) break;
            if (child instanceof TokenGroup g && g.flatten().stream().anyMatch(ParsedQuery::isWriteToken)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isWriteToken(SqlToken t) {
        return t.type() == TokenType.DDL || (t.type() == TokenType.DML && !"SELECT".equals(t.normalized()));
    }

    private static boolean isSelectToken(SqlToken t) {
        return t.type() == TokenType.DML && "SELECT".equals(t.normalized());
    }

    /** The last statement is a SELECT, so the script can feed a CREATE TABLE AS. */
    public boolean isValidCtas() {
        List<TokenGroup> statements = tokenizer.parse(stripComments());
        return !statements.isEmpty() && "SELECT".equals(statements.get(statements.size() - 1).statementType());
    }

    /** Exactly one SELECT statement, so the script can feed a CREATE VIEW AS. */
    public boolean isValidCvas() {
        List<TokenGroup> statements = tokenizer.parse(stripComments());
        return statements.size() == 1 && "SELECT".equals(statements.get(0).statementType());
    }

    public boolean isExplain() {
        return startsWithKeyword("EXPLAIN");
    }

    public boolean isShow() {
        return startsWithKeyword("SHOW");
    }

    public boolean isSet() {
        return startsWithKeyword("SET");
    }

    private boolean startsWithKeyword(String keyword) {
        return stripComments().toUpperCase(Locale.ROOT).startsWith(keyword);
    }

    public boolean isUnknown() {
        return parsed.isEmpty() || "UNKNOWN".equals(parsed.get(0).statementType());
    }

    public boolean checkFunctionsExist(Set<String> functions) {
        for (TokenGroup statement : parsed) {
            if (containsFunction(statement, functions)) return true;
        }
        return false;
    }

    private static boolean containsFunction(SqlNode node, Set<String> functions) {
        if (!(node instanceof TokenGroup group)) return false;
        if (group.kind() == GroupKind.FUNCTION) {
            String name = group.functionName();
            if (name != null && functions.contains(name.toLowerCase(Locale.ROOT))) return true;
        }
        for (SqlNode child : group.children()) {
            if (containsFunction(child, functions)) return true;
        }
        return false;
    }

    /* ===================== TEXT ===================== */

    /** The text without leading/trailing whitespace and semicolons. */
    public String stripped() {
        return strip(sql, STRIP_CHARS);
    }

    public String stripComments() {
        return tokenizer.stripComments(stripped());
    }

    /** Every non-empty statement, stripped. */
    public List<String> getStatements() {
        List<String> out = new ArrayList<>();
        for (TokenGroup statement : parsed) {
            String text = strip(statement.text(), " \n;\t");
            if (!text.isEmpty()) out.add(text);
        }
        return out;
    }

    public String asCreateTable(String tableName, String schemaName, boolean overwrite, CtasMethod method) {
        String fullTableName = schemaName != null && !schemaName.isEmpty() ? schemaName + "." + tableName : tableName;
        StringBuilder sb = new StringBuilder();
        if (overwrite) sb.append("DROP ").append(method).append(" IF EXISTS ").append(fullTableName).append(";\n");
        sb.append("CREATE ").append(method).append(' ').append(fullTableName).append(" AS \n").append(stripped());
        return sb.toString();
    }

    /* ===================== LIMIT ===================== */

    /**
     * The query with {@code newLimit} applied to its last statement. Without a LIMIT one
     * is appended; an integer LIMIT is lowered to {@code newLimit} (or replaced regardless
     * when {@code force}); the {@code offset, count} form keeps its offset.
     */
    public String setOrUpdateQueryLimit(int newLimit, boolean force) {
        if (limit == null || parsed.isEmpty()) return stripped() + "\nLIMIT " + newLimit;

        // the limit was read from the last statement, so that is the one rewritten
        TokenGroup statement = parsed.get(parsed.size() - 1);
        int limitPos = statement.indexOfKeyword("LIMIT");
        int operandPos = limitPos < 0 ? -1 : statement.nextSignificant(limitPos + 1);
        if (operandPos < 0) return stripped();

        List<SqlNode> children = new ArrayList<>(statement.children());
        SqlNode operand = children.get(operandPos);
        if (operand.isToken(TokenType.INTEGER)) {
            Long current = parseLong(operand.text());
            if (force || current == null || newLimit < current) {
                children.set(operandPos, new SqlToken(TokenType.INTEGER, String.valueOf(newLimit)));
            }
        } else if (operand instanceof TokenGroup list && list.kind() == GroupKind.IDENTIFIER_LIST) {
            SqlNode offset = list.firstSignificant();
            children.set(operandPos, TokenGroup.of(GroupKind.IDENTIFIER_LIST,
                    offset,
                    SqlToken.punctuation(","),
                    SqlToken.whitespace(),
                    new SqlToken(TokenType.INTEGER, String.valueOf(newLimit))));
        }
        StringBuilder out = new StringBuilder();
        for (TokenGroup previous : parsed.subList(0, parsed.size() - 1)) out.append(previous.text());
        return out.append(statement.withChildren(children).text()).toString();
    }

    static Integer extractLimit(TokenGroup statement) {
        int idx = statement.indexOfKeyword("LIMIT");
        if (idx < 0) return null;
        int next = statement.nextSignificant(idx + 1);
        if (next < 0) return null;

        SqlNode token = statement.children().get(next);
        if (token instanceof TokenGroup list && list.kind() == GroupKind.IDENTIFIER_LIST) {
            // LIMIT <offset>, <limit>
            token = null;
            for (int i = 0; i < list.children().size(); i++) {
                if (list.children().get(i).isPunctuation(",")) {
                    int after = list.nextSignificant(i + 1);
                    token = after < 0 ? null : list.children().get(after);
                    break;
                }
            }
        }
        if (token == null || !token.isToken(TokenType.INTEGER)) return null;
        Long value = parseLong(token.text());
        if (value == null || value > Integer.MAX_VALUE) {
            log.debug("LIMIT operand out of range: {}", token.text());
            return null;
        }
        return value.intValue();
    }

    /* ===================== IDENTIFIERS ===================== */

    /**
     * The table named by an identifier when it has the form {@code [[catalog.]schema.]table}
     * (alias ignored), otherwise null.
     */
    public static Table getTable(TokenGroup identifier) {
        List<SqlNode> tokens = identifier.kind() == GroupKind.IDENTIFIER
                ? identifier.withoutAlias()
                : identifier.children();
        int size = tokens.size();
        if (size != 1 && size != 3 && size != 5) return null;
        for (int i = 0; i < size; i++) {
            SqlNode token = tokens.get(i);
            boolean ok = i % 2 == 0
                    ? token.isToken(TokenType.NAME) || token.isToken(TokenType.STRING)
                    : token.isPunctuation(".");
            if (!ok) return null;
        }
        String table = removeQuotes(tokens.get(size - 1).text());
        String schema = size >= 3 ? removeQuotes(tokens.get(size - 3).text()) : null;
        String catalog = size == 5 ? removeQuotes(tokens.get(0).text()) : null;
        return new Table(table, schema, catalog);
    }

    static String removeQuotes(String value) {
        if (value == null || value.length() < 2) return value;
        char first = value.charAt(0);
        char last = value.charAt(value.length() - 1);
        boolean quoted = (first == '"' && last == '"') || (first == '\'' && last == '\'')
                || (first == '`' && last == '`') || (first == '[' && last == ']');
        return quoted ? value.substring(1, value.length() - 1) : value;
    }

    private static Long parseLong(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String strip(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) end--;
        return value.substring(start, end);
    }
}
