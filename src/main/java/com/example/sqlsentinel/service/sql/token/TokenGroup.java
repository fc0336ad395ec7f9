package com.example.sqlsentinel.service.sql.token;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Inner node of the token tree. Children are kept in source order, whitespace and
 * comments included, so the group renders back to its exact source text.
 */
public record TokenGroup(GroupKind kind, List<SqlNode> children) implements SqlNode {

    public TokenGroup {
        children = List.copyOf(children);
    }

    public static TokenGroup of(GroupKind kind, SqlNode... children) {
        return new TokenGroup(kind, Arrays.asList(children));
    }

    public TokenGroup withChildren(List<SqlNode> newChildren) {
        return new TokenGroup(kind, newChildren);
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (SqlNode child : children) sb.append(child.text());
        return sb.toString();
    }

    @Override
    public boolean isWhitespace() {
        return false;
    }

    @Override
    public boolean isComment() {
        return false;
    }

    public List<SqlToken> flatten() {
        List<SqlToken> out = new ArrayList<>();
        flattenInto(this, out);
        return out;
    }

    private static void flattenInto(SqlNode node, List<SqlToken> out) {
        if (node instanceof SqlToken t) {
            out.add(t);
        } else if (node instanceof TokenGroup g) {
            for (SqlNode child : g.children) flattenInto(child, out);
        }
    }

    /** Index of the first significant child at or after {@code from}, or -1. */
    public int nextSignificant(int from) {
        for (int i = Math.max(0, from); i < children.size(); i++) {
            if (children.get(i).isSignificant()) return i;
        }
        return -1;
    }

    /** Index of the last significant child strictly before {@code before}, or -1. */
    public int previousSignificant(int before) {
        for (int i = Math.min(before, children.size()) - 1; i >= 0; i--) {
            if (children.get(i).isSignificant()) return i;
        }
        return -1;
    }

    public SqlNode firstSignificant() {
        int idx = nextSignificant(0);
        return idx < 0 ? null : children.get(idx);
    }

    /** Index of the first top-level keyword child equal to {@code keyword}, or -1. */
    public int indexOfKeyword(String keyword) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).isKeyword(keyword)) return i;
        }
        return -1;
    }

    /* ===================== STATEMENT ===================== */

    /**
     * Statement type the way the first keyword reads: the DML/DDL keyword itself,
     * the DML/DDL following a leading WITH clause, or {@code UNKNOWN}.
     */
    public String statementType() {
        SqlNode first = firstSignificant();
        if (!(first instanceof SqlToken t)) return "UNKNOWN";
        if (t.type() == TokenType.DML || t.type() == TokenType.DDL) return t.normalized();
        if (t.type() == TokenType.CTE) {
            for (int i = children.indexOf(first) + 1; i < children.size(); i++) {
                if (children.get(i) instanceof SqlToken k
                        && (k.type() == TokenType.DML || k.type() == TokenType.DDL)) {
                    return k.normalized();
                }
            }
        }
        return "UNKNOWN";
    }

    /* ===================== IDENTIFIER ===================== */

    /** Index where the alias part ({@code [AS] alias}) starts, or the child count when there is none. */
    public int aliasStart() {
        for (int i = 1; i < children.size(); i++) {
            SqlNode child = children.get(i);
            if (child.isWhitespace() || child.isKeyword("AS")) return i;
        }
        return children.size();
    }

    public boolean hasAlias() {
        return kind == GroupKind.IDENTIFIER && aliasStart() < children.size();
    }

    /** The name part without the alias: {@code s.t AS x} -> {@code [s, ., t]}. */
    public List<SqlNode> withoutAlias() {
        return children.subList(0, aliasStart());
    }

    public String alias() {
        if (!hasAlias()) return null;
        SqlNode last = children.get(children.size() - 1);
        return last instanceof TokenGroup g && g.kind() == GroupKind.FUNCTION
                ? g.functionName()
                : last.text();
    }

    /** Last name part of a (possibly dotted) identifier, or the function name. */
    public String realName() {
        List<SqlNode> core = withoutAlias();
        for (int i = core.size() - 1; i >= 0; i--) {
            SqlNode node = core.get(i);
            if (node instanceof SqlToken t && t.type() == TokenType.NAME) return t.value();
            if (node instanceof TokenGroup g && g.kind() == GroupKind.FUNCTION) return g.functionName();
        }
        return null;
    }

    /** Name before the last dot: {@code s.t} -> {@code s}; null when not dotted. */
    public String parentName() {
        List<SqlNode> core = withoutAlias();
        for (int i = core.size() - 1; i > 0; i--) {
            if (core.get(i).isPunctuation(".")) return core.get(i - 1).text();
        }
        return null;
    }

    /* ===================== FUNCTION ===================== */

    public String functionName() {
        for (SqlNode child : children) {
            if (child instanceof SqlToken t && t.type() == TokenType.NAME) return t.value();
        }
        return null;
    }

    public TokenGroup parenthesis() {
        for (SqlNode child : children) {
            if (child.isGroup(GroupKind.PARENTHESIS)) return (TokenGroup) child;
        }
        return null;
    }

    @Override
    public String toString() {
        return kind + "[" + text() + "]";
    }
}
