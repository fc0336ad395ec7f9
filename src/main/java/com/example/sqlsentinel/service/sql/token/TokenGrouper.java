package com.example.sqlsentinel.service.sql.token;

import lombok.RequiredArgsConstructor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds statement trees from a flat token stream: statements split on top-level ";",
 * then parentheses, functions, identifiers, identifier lists and WHERE clauses are
 * grouped level by level, innermost first.
 */
@RequiredArgsConstructor
class TokenGrouper {
    private final TokenizerSettings settings;

    List<TokenGroup> statements(List<SqlToken> tokens) {
        List<List<SqlToken>> pieces = new ArrayList<>();
        List<SqlToken> current = new ArrayList<>();
        int depth = 0;
        for (SqlToken t : tokens) {
            current.add(t);
            if (t.isPunctuation("(")) depth++;
            else if (t.isPunctuation(")") && depth > 0) depth--;
            else if (t.isPunctuation(";") && depth == 0) {
                pieces.add(current);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) pieces.add(current);

        // whitespace/comment-only tails belong to the statement before them
        List<List<SqlToken>> merged = new ArrayList<>();
        for (List<SqlToken> piece : pieces) {
            boolean blank = piece.stream().noneMatch(SqlNode::isSignificant);
            if (blank && !merged.isEmpty()) merged.get(merged.size() - 1).addAll(piece);
            else merged.add(piece);
        }

        List<TokenGroup> out = new ArrayList<>(merged.size());
        for (List<SqlToken> piece : merged) {
            out.add(new TokenGroup(GroupKind.STATEMENT, nest(piece)));
        }
        return out;
    }

    /* ===================== PARENTHESIS ===================== */

    private List<SqlNode> nest(List<SqlToken> tokens) {
        Deque<List<SqlNode>> stack = new ArrayDeque<>();
        stack.push(new ArrayList<>());
        for (SqlToken t : tokens) {
            if (t.isPunctuation("(")) {
                List<SqlNode> inner = new ArrayList<>();
                inner.add(t);
                stack.push(inner);
            } else if (t.isPunctuation(")") && stack.size() > 1) {
                List<SqlNode> inner = stack.pop();
                inner.add(t);
                stack.peek().add(new TokenGroup(GroupKind.PARENTHESIS, groupLevel(inner)));
            } else {
                stack.peek().add(t);
            }
        }
        // unclosed "(" runs to the end of the statement
        while (stack.size() > 1) {
            List<SqlNode> inner = stack.pop();
            stack.peek().add(new TokenGroup(GroupKind.PARENTHESIS, groupLevel(inner)));
        }
        return groupLevel(stack.pop());
    }

    private List<SqlNode> groupLevel(List<SqlNode> nodes) {
        List<SqlNode> out = groupFunctions(nodes);
        out = groupIdentifiers(out);
        out = groupIdentifierLists(out);
        return groupWhere(out);
    }

    /* ===================== FUNCTION ===================== */

    private List<SqlNode> groupFunctions(List<SqlNode> nodes) {
        List<SqlNode> out = new ArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            SqlNode node = nodes.get(i);
            if (node.isToken(TokenType.NAME) && i + 1 < nodes.size()
                    && nodes.get(i + 1).isGroup(GroupKind.PARENTHESIS)) {
                out.add(TokenGroup.of(GroupKind.FUNCTION, node, nodes.get(i + 1)));
                i++;
            } else {
                out.add(node);
            }
        }
        return out;
    }

    /* ===================== IDENTIFIER ===================== */

    private List<SqlNode> groupIdentifiers(List<SqlNode> nodes) {
        List<SqlNode> out = new ArrayList<>(nodes.size());
        int i = 0;
        while (i < nodes.size()) {
            SqlNode node = nodes.get(i);
            boolean nameHead = node.isToken(TokenType.NAME) || node.isGroup(GroupKind.FUNCTION);
            boolean otherHead = node.isGroup(GroupKind.PARENTHESIS)
                    || (node instanceof SqlToken t && t.type().isLiteral());
            if (!nameHead && !otherHead) {
                out.add(node);
                i++;
                continue;
            }

            int end = i;
            if (nameHead) {
                while (end + 2 < nodes.size() && nodes.get(end + 1).isPunctuation(".")
                        && isNamePart(nodes.get(end + 2))) {
                    end += 2;
                }
            }
            int aliasEnd = aliasEnd(nodes, end + 1, !node.isToken(TokenType.STRING) && !isNumber(node));
            if (aliasEnd >= 0) end = aliasEnd;

            if (nameHead || aliasEnd >= 0) {
                out.add(new TokenGroup(GroupKind.IDENTIFIER, nodes.subList(i, end + 1)));
            } else {
                out.add(node);
            }
            i = end + 1;
        }
        return out;
    }

    private static boolean isNamePart(SqlNode node) {
        return node.isToken(TokenType.NAME) || node.isToken(TokenType.WILDCARD) || node.isGroup(GroupKind.FUNCTION);
    }

    private static boolean isNumber(SqlNode node) {
        return node.isToken(TokenType.INTEGER) || node.isToken(TokenType.FLOAT);
    }

    /**
     * Index of the last alias node starting the search at {@code from}, or -1.
     * {@code AS} may be followed by a name, a function-shaped alias or a parenthesis;
     * without {@code AS} only a plain name after whitespace counts.
     */
    private static int aliasEnd(List<SqlNode> nodes, int from, boolean allowImplicit) {
        int k = skipWhitespace(nodes, from);
        if (k >= nodes.size()) return -1;
        SqlNode candidate = nodes.get(k);
        if (candidate.isKeyword("AS")) {
            int m = skipWhitespace(nodes, k + 1);
            if (m >= nodes.size()) return -1;
            SqlNode alias = nodes.get(m);
            boolean ok = alias.isToken(TokenType.NAME) || alias.isToken(TokenType.STRING)
                    || alias.isGroup(GroupKind.FUNCTION) || alias.isGroup(GroupKind.PARENTHESIS);
            return ok ? m : -1;
        }
        if (allowImplicit && k > from && candidate.isToken(TokenType.NAME)) return k;
        return -1;
    }

    private static int skipWhitespace(List<SqlNode> nodes, int from) {
        int k = from;
        while (k < nodes.size() && nodes.get(k).isWhitespace()) k++;
        return k;
    }

    /* ===================== IDENTIFIER LIST ===================== */

    private List<SqlNode> groupIdentifierLists(List<SqlNode> nodes) {
        List<SqlNode> out = new ArrayList<>(nodes.size());
        int i = 0;
        while (i < nodes.size()) {
            if (!isListItem(nodes.get(i))) {
                out.add(nodes.get(i));
                i++;
                continue;
            }
            int end = i;
            int comma = nextSignificant(nodes, end + 1);
            while (comma < nodes.size() && nodes.get(comma).isPunctuation(",")) {
                int item = nextSignificant(nodes, comma + 1);
                if (item >= nodes.size() || !isListItem(nodes.get(item))) break;
                end = item;
                comma = nextSignificant(nodes, end + 1);
            }
            if (end > i) out.add(new TokenGroup(GroupKind.IDENTIFIER_LIST, nodes.subList(i, end + 1)));
            else out.add(nodes.get(i));
            i = end + 1;
        }
        return out;
    }

    private static boolean isListItem(SqlNode node) {
        if (node instanceof TokenGroup g) {
            return g.kind() == GroupKind.IDENTIFIER || g.kind() == GroupKind.FUNCTION
                    || g.kind() == GroupKind.PARENTHESIS;
        }
        SqlToken t = (SqlToken) node;
        return switch (t.type()) {
            case NAME, STRING, INTEGER, FLOAT, WILDCARD, PLACEHOLDER, KEYWORD -> true;
            default -> false;
        };
    }

    private static int nextSignificant(List<SqlNode> nodes, int from) {
        int k = from;
        while (k < nodes.size() && !nodes.get(k).isSignificant()) k++;
        return k;
    }

    /* ===================== WHERE ===================== */

    private List<SqlNode> groupWhere(List<SqlNode> nodes) {
        List<SqlNode> out = new ArrayList<>(nodes.size());
        int i = 0;
        while (i < nodes.size()) {
            if (!nodes.get(i).isKeyword("WHERE")) {
                out.add(nodes.get(i));
                i++;
                continue;
            }
            int end = i + 1;
            while (end < nodes.size() && !closesWhere(nodes.get(end))) end++;
            out.add(new TokenGroup(GroupKind.WHERE, nodes.subList(i, end)));
            i = end;
        }
        return out;
    }

    private boolean closesWhere(SqlNode node) {
        if (node.isPunctuation(";") || node.isPunctuation(")")) return true;
        return node instanceof SqlToken t && t.type().isKeyword()
                && settings.whereTerminators().contains(t.normalized());
    }
}
