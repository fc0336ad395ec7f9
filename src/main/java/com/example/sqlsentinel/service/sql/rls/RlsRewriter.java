package com.example.sqlsentinel.service.sql.rls;

import com.example.sqlsentinel.service.implement.RlsPredicateProviderImpl;
import com.example.sqlsentinel.service.sql.dto.Table;
import com.example.sqlsentinel.service.sql.query.ParsedQuery;
import com.example.sqlsentinel.service.sql.query.QueryUtils;
import com.example.sqlsentinel.service.sql.token.GroupKind;
import com.example.sqlsentinel.service.sql.token.SqlNode;
import com.example.sqlsentinel.service.sql.token.SqlToken;
import com.example.sqlsentinel.service.sql.token.SqlTokenizer;
import com.example.sqlsentinel.service.sql.token.TokenGroup;
import com.example.sqlsentinel.service.sql.token.TokenType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Injects row-level security predicates into statement token trees.
 * <p>
 * Both strategies scan each group left to right after rewriting its child groups, so
 * every sub-query gets its own predicates. Input trees are never modified; a new tree
 * is returned. Predicate lookups are memoised for the duration of one call.
 */
@Slf4j
@RequiredArgsConstructor
public class RlsRewriter {
    private static final Set<String> SOURCE_MODIFIERS = Set.of("ONLY", "LATERAL");

    private final RlsPredicateProviderImpl provider;
    private final SqlTokenizer tokenizer;

    /**
     * Replaces every filtered table with a filtered sub-select:
     * {@code FROM t WHERE 1=1} becomes {@code FROM (SELECT * FROM t WHERE t.id=42) AS t WHERE 1=1}.
     */
    public TokenGroup insertRlsAsSubquery(TokenGroup statement, int databaseId, String defaultSchema) {
        return asSubquery(statement, new PredicateLookup(databaseId, defaultSchema), false);
    }

    /**
     * AND-s predicates into the clause that filters each table:
     * {@code FROM t WHERE 1=1} becomes {@code FROM t WHERE ( 1=1) AND t.id=42}.
     */
    public TokenGroup insertRlsInPredicate(TokenGroup statement, int databaseId, String defaultSchema) {
        return inPredicate(statement, new PredicateLookup(databaseId, defaultSchema));
    }

    /* ===================== SUBQUERY ===================== */

    /**
     * {@code joinGroup}: the group is a parenthesised join right after FROM/JOIN, so its
     * first table is a source too.
     */
    private TokenGroup asSubquery(TokenGroup group, PredicateLookup lookup, boolean joinGroup) {
        List<SqlNode> out = new ArrayList<>(group.children().size());
        InsertRlsState state = joinGroup ? InsertRlsState.SEEN_SOURCE : InsertRlsState.SCANNING;
        for (SqlNode child : group.children()) {
            SqlNode node = child instanceof TokenGroup g
                    ? asSubquery(g, lookup, state == InsertRlsState.SEEN_SOURCE && isJoinGroup(g))
                    : child;

            if (isSourceKeyword(node)) {
                state = InsertRlsState.SEEN_SOURCE;
            } else if (state == InsertRlsState.SEEN_SOURCE && skippedBeforeSource(node)) {
                // keep looking for the table
            } else if (state == InsertRlsState.SEEN_SOURCE && node.isGroup(GroupKind.IDENTIFIER_LIST)) {
                node = mapSources((TokenGroup) node, ref -> wrapInSubquery(ref, lookup));
                state = InsertRlsState.SCANNING;
            } else if (state == InsertRlsState.SEEN_SOURCE && isCandidate(node)) {
                node = wrapInSubquery(node, lookup);
                state = InsertRlsState.SCANNING;
            } else if (state == InsertRlsState.SEEN_SOURCE) {
                state = InsertRlsState.SCANNING;
            }
            out.add(node);
        }
        return group.withChildren(out);
    }

    private SqlNode wrapInSubquery(SqlNode reference, PredicateLookup lookup) {
        Optional<List<SqlNode>> rls = predicateFor(reference, lookup, false);
        if (rls.isEmpty()) return reference;

        String alias = qualifierOf(reference, true);
        SqlNode inner = reference instanceof TokenGroup g && g.hasAlias()
                ? new TokenGroup(GroupKind.IDENTIFIER, g.withoutAlias())
                : reference;

        List<SqlNode> where = new ArrayList<>();
        where.add(SqlToken.keyword("WHERE"));
        where.add(SqlToken.whitespace());
        where.addAll(rls.get());

        TokenGroup subquery = TokenGroup.of(GroupKind.PARENTHESIS,
                SqlToken.punctuation("("),
                new SqlToken(TokenType.DML, "SELECT"),
                SqlToken.whitespace(),
                new SqlToken(TokenType.WILDCARD, "*"),
                SqlToken.whitespace(),
                SqlToken.keyword("FROM"),
                SqlToken.whitespace(),
                inner,
                SqlToken.whitespace(),
                new TokenGroup(GroupKind.WHERE, where),
                SqlToken.punctuation(")"));
        log.debug("Replacing {} with filtered subquery", reference.text());
        return TokenGroup.of(GroupKind.IDENTIFIER,
                subquery,
                SqlToken.whitespace(),
                SqlToken.keyword("AS"),
                SqlToken.whitespace(),
                TokenGroup.of(GroupKind.IDENTIFIER, SqlToken.name(alias)));
    }

    /* ===================== PREDICATE ===================== */

    private TokenGroup inPredicate(TokenGroup group, PredicateLookup lookup) {
        PredicateScan scan = new PredicateScan(lookup, false);
        for (SqlNode child : group.children()) scan.accept(child);
        return group.withChildren(scan.finish());
    }

    /**
     * One left-to-right pass over the children of a group. Predicates of FROM tables wait
     * for the next WHERE (crossing any JOINs); a JOIN table's predicate goes into its ON.
     * Whatever is still pending at a clause terminator or at the end becomes a new WHERE.
     * A parenthesised join never gets a WHERE of its own: its pending predicates are
     * handed to the enclosing scan.
     */
    private final class PredicateScan {
        private final PredicateLookup lookup;
        private final boolean joinGroup;
        private final List<SqlNode> out = new ArrayList<>();
        private final List<List<SqlNode>> pending = new ArrayList<>();
        private final List<List<SqlNode>> joinPending = new ArrayList<>();
        private InsertRlsState state;
        private boolean joinSource;
        private boolean onOpen;

        PredicateScan(PredicateLookup lookup, boolean joinGroup) {
            this.lookup = lookup;
            this.joinGroup = joinGroup;
            this.state = joinGroup ? InsertRlsState.SEEN_SOURCE : InsertRlsState.SCANNING;
        }

        void accept(SqlNode child) {
            SqlNode node = child;
            if (child instanceof TokenGroup g) {
                if (state == InsertRlsState.SEEN_SOURCE && isJoinGroup(g)) {
                    acceptJoinGroup(g);
                    return;
                }
                node = inPredicate(g, lookup);
            }
            if (onOpen && closesOn(node)) closeOn();

            if (isSourceKeyword(node)) {
                // the previous JOIN had no ON (USING, CROSS JOIN, ...)
                pending.addAll(joinPending);
                joinPending.clear();
                joinSource = !node.isKeyword("FROM");
                state = InsertRlsState.SEEN_SOURCE;
                out.add(node);
                return;
            }

            if (state == InsertRlsState.SEEN_SOURCE) {
                if (skippedBeforeSource(node)) {
                    out.add(node);
                    return;
                }
                if (node.isGroup(GroupKind.IDENTIFIER_LIST) || isCandidate(node)) {
                    List<List<SqlNode>> found = predicatesFor(node);
                    (joinSource ? joinPending : pending).addAll(found);
                    out.add(node);
                    state = hasPending() ? InsertRlsState.FOUND_TABLE : InsertRlsState.SCANNING;
                    return;
                }
                state = hasPending() ? InsertRlsState.FOUND_TABLE : InsertRlsState.SCANNING;
            }

            if (state == InsertRlsState.FOUND_TABLE) {
                if (node.isGroup(GroupKind.WHERE)) {
                    // added even when the predicate is already there, it could sit in "1=1 OR <rls>"
                    out.add(injectIntoWhere((TokenGroup) node, drainAll()));
                    state = InsertRlsState.SCANNING;
                    return;
                }
                if (node.isKeyword("ON") && !joinPending.isEmpty()) {
                    out.add(node);
                    out.add(SqlToken.whitespace());
                    out.addAll(combine(joinPending));
                    out.add(SqlToken.whitespace());
                    out.add(SqlToken.keyword("AND"));
                    out.add(SqlToken.whitespace());
                    out.add(SqlToken.punctuation("("));
                    joinPending.clear();
                    onOpen = true;
                    state = hasPending() ? InsertRlsState.FOUND_TABLE : InsertRlsState.SCANNING;
                    return;
                }
                if (isClauseTerminator(node) && !joinGroup) {
                    insertWhere(drainAll());
                    state = InsertRlsState.SCANNING;
                }
            }
            out.add(node);
        }

        /* FROM (a JOIN b ...): tables inside are sources, their leftover predicates are ours. */
        private void acceptJoinGroup(TokenGroup group) {
            PredicateScan inner = new PredicateScan(lookup, true);
            for (SqlNode child : group.children()) inner.accept(child);
            out.add(group.withChildren(inner.finish()));
            (joinSource ? joinPending : pending).addAll(inner.drainAll());
            state = hasPending() ? InsertRlsState.FOUND_TABLE : InsertRlsState.SCANNING;
        }

        List<SqlNode> finish() {
            if (onOpen) closeOn();
            if (hasPending() && !joinGroup) insertWhere(drainAll());
            return out;
        }

        private List<List<SqlNode>> predicatesFor(SqlNode node) {
            List<List<SqlNode>> found = new ArrayList<>();
            if (node instanceof TokenGroup list && list.kind() == GroupKind.IDENTIFIER_LIST) {
                for (SqlNode member : list.children()) {
                    if (isCandidate(member)) predicateFor(member, lookup, true).ifPresent(found::add);
                }
            } else {
                predicateFor(node, lookup, true).ifPresent(found::add);
            }
            return found;
        }

        private boolean hasPending() {
            return !pending.isEmpty() || !joinPending.isEmpty();
        }

        private List<List<SqlNode>> drainAll() {
            List<List<SqlNode>> all = new ArrayList<>(pending);
            all.addAll(joinPending);
            pending.clear();
            joinPending.clear();
            return all;
        }

        private void closeOn() {
            int at = lastSignificant(out) + 1;
            out.add(at, SqlToken.punctuation(")"));
            out.add(at, SqlToken.whitespace());
            onOpen = false;
        }

        private void insertWhere(List<List<SqlNode>> predicates) {
            List<SqlNode> where = new ArrayList<>();
            where.add(SqlToken.keyword("WHERE"));
            where.add(SqlToken.whitespace());
            where.addAll(combine(predicates));

            int at = lastSignificant(out) + 1;
            out.add(at, new TokenGroup(GroupKind.WHERE, where));
            out.add(at, SqlToken.whitespace());
        }

        private boolean closesOn(SqlNode node) {
            return node.isGroup(GroupKind.WHERE) || isSourceKeyword(node) || isClauseTerminator(node);
        }
    }

    private static TokenGroup injectIntoWhere(TokenGroup where, List<List<SqlNode>> predicates) {
        List<SqlNode> children = where.children();
        int last = Math.max(where.previousSignificant(children.size()), 0);

        List<SqlNode> out = new ArrayList<>();
        out.add(children.get(0));
        out.add(SqlToken.whitespace());
        out.add(SqlToken.punctuation("("));
        out.addAll(children.subList(1, last + 1));
        out.add(SqlToken.punctuation(")"));
        out.add(SqlToken.whitespace());
        out.add(SqlToken.keyword("AND"));
        out.add(SqlToken.whitespace());
        out.addAll(combine(predicates));
        out.addAll(children.subList(last + 1, children.size()));
        return where.withChildren(out);
    }

    /* A single predicate as is unless it has a top-level OR; several are parenthesised and AND-ed. */
    private static List<SqlNode> combine(List<List<SqlNode>> predicates) {
        if (predicates.size() == 1) {
            List<SqlNode> only = predicates.get(0);
            return only.stream().anyMatch(n -> n.isKeyword("OR")) ? List.of(parenthesised(only)) : only;
        }
        List<SqlNode> out = new ArrayList<>();
        for (List<SqlNode> predicate : predicates) {
            if (!out.isEmpty()) {
                out.add(SqlToken.whitespace());
                out.add(SqlToken.keyword("AND"));
                out.add(SqlToken.whitespace());
            }
            out.add(parenthesised(predicate));
        }
        return out;
    }

    private static TokenGroup parenthesised(List<SqlNode> nodes) {
        List<SqlNode> children = new ArrayList<>(nodes.size() + 2);
        children.add(SqlToken.punctuation("("));
        children.addAll(nodes);
        children.add(SqlToken.punctuation(")"));
        return new TokenGroup(GroupKind.PARENTHESIS, children);
    }

    private static int lastSignificant(List<SqlNode> nodes) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            if (nodes.get(i).isSignificant()) return i;
        }
        return nodes.size() - 1;
    }

    private boolean isClauseTerminator(SqlNode node) {
        if (node.isPunctuation(";") || node.isPunctuation(")")) return true;
        return node instanceof SqlToken t && t.type().isKeyword()
                && tokenizer.getSettings().whereTerminators().contains(t.normalized());
    }

    /* ===================== LOOKUP ===================== */

    /**
     * Predicate for a table reference, parsed and with its columns qualified by the table
     * name, or by the alias when {@code preferAlias} and the reference has one.
     */
    private Optional<List<SqlNode>> predicateFor(SqlNode reference, PredicateLookup lookup, boolean preferAlias) {
        Table table = tableOf(reference);
        if (table == null) return Optional.empty();

        return lookup.predicateFor(table).map(predicate -> {
            String clause = QueryUtils.sanitizeClause(predicate, tokenizer);
            TokenGroup rls = addTableName(tokenizer.parse(clause).get(0), qualifierOf(reference, preferAlias));
            return rls.children().stream()
                    .filter(n -> !n.isPunctuation(";"))
                    .toList();
        });
    }

    private final class PredicateLookup {
        private final int databaseId;
        private final String defaultSchema;
        private final Map<Table, Optional<String>> cache = new HashMap<>();

        PredicateLookup(int databaseId, String defaultSchema) {
            this.databaseId = databaseId;
            this.defaultSchema = defaultSchema;
        }

        Optional<String> predicateFor(Table table) {
            String schema = table.getSchema() != null ? table.getSchema() : defaultSchema;
            return cache.computeIfAbsent(new Table(table.getTable(), schema),
                    key -> provider.lookup(databaseId, schema, table.getTable()).filter(p -> !p.isBlank()));
        }
    }

    private static Table tableOf(SqlNode reference) {
        if (reference instanceof TokenGroup g && g.kind() == GroupKind.IDENTIFIER) return ParsedQuery.getTable(g);
        if (reference.isToken(TokenType.NAME) || reference.isToken(TokenType.KEYWORD)) {
            return ParsedQuery.getTable(TokenGroup.of(GroupKind.IDENTIFIER, SqlToken.name(reference.text())));
        }
        return null;
    }

    private static String qualifierOf(SqlNode reference, boolean preferAlias) {
        if (reference instanceof TokenGroup g) {
            return preferAlias && g.hasAlias() ? g.alias() : g.realName();
        }
        return reference.text();
    }

    /* ===================== HELPERS ===================== */

    /**
     * True when some FROM/JOIN, at any depth, is followed by a table-like reference.
     * {@code SELECT * FROM (SELECT 1)} reads no table.
     */
    public static boolean hasTableQuery(TokenGroup group) {
        return hasTableQuery(group, false);
    }

    private static boolean hasTableQuery(TokenGroup group, boolean joinGroup) {
        InsertRlsState state = joinGroup ? InsertRlsState.SEEN_SOURCE : InsertRlsState.SCANNING;
        for (SqlNode node : group.children()) {
            if (node.isComment()) continue;
            if (node instanceof TokenGroup g
                    && hasTableQuery(g, state == InsertRlsState.SEEN_SOURCE && isJoinGroup(g))) {
                return true;
            }

            if (isSourceKeyword(node)) {
                state = InsertRlsState.SEEN_SOURCE;
            } else if (state == InsertRlsState.SEEN_SOURCE
                    && (isCandidate(node) || node.isGroup(GroupKind.IDENTIFIER_LIST))) {
                return true;
            } else if (state == InsertRlsState.SEEN_SOURCE && !skippedBeforeSource(node)) {
                state = InsertRlsState.SCANNING;
            }
        }
        return false;
    }

    /**
     * Prefixes every unqualified column of a predicate with {@code table}. Names that
     * follow FROM/JOIN inside the predicate are tables and stay as they are.
     */
    public static TokenGroup addTableName(TokenGroup rls, String table) {
        List<SqlNode> out = new ArrayList<>(rls.children().size());
        boolean afterSource = false;
        for (SqlNode child : rls.children()) {
            SqlNode node = child;
            if (child instanceof TokenGroup g && g.kind() == GroupKind.IDENTIFIER && isBareColumn(g)) {
                if (!afterSource) {
                    node = TokenGroup.of(GroupKind.IDENTIFIER,
                            SqlToken.name(table), SqlToken.punctuation("."), SqlToken.name(g.realName()));
                }
            } else if (child instanceof TokenGroup g) {
                node = addTableName(g, table);
            }
            out.add(node);

            if (isSourceKeyword(child)) afterSource = true;
            else if (child.isSignificant()) afterSource = false;
        }
        return rls.withChildren(out);
    }

    private static boolean isBareColumn(TokenGroup identifier) {
        List<SqlNode> core = identifier.withoutAlias();
        return core.size() == 1 && core.get(0).isToken(TokenType.NAME);
    }

    private static boolean isSourceKeyword(SqlNode node) {
        if (!(node instanceof SqlToken t) || t.type() != TokenType.KEYWORD) return false;
        String value = t.normalized();
        return "FROM".equals(value) || value.endsWith("JOIN");
    }

    /* Nodes between FROM/JOIN and the table: layout, ONLY/LATERAL, the "(" of a join group. */
    private static boolean skippedBeforeSource(SqlNode node) {
        return !node.isSignificant() || isSourceModifier(node) || node.isPunctuation("(");
    }

    /** A parenthesis holding table references rather than a sub-query. */
    private static boolean isJoinGroup(TokenGroup group) {
        if (group.kind() != GroupKind.PARENTHESIS) return false;
        int first = group.nextSignificant(1);
        if (first < 0) return false;
        SqlNode head = group.children().get(first);
        if (head.isPunctuation(")") || head.isToken(TokenType.DML) || head.isToken(TokenType.CTE)) return false;
        return isCandidate(head) || head.isGroup(GroupKind.PARENTHESIS);
    }

    private static boolean isSourceModifier(SqlNode node) {
        return node instanceof SqlToken t && t.type() == TokenType.KEYWORD && SOURCE_MODIFIERS.contains(t.normalized());
    }

    private static boolean isCandidate(SqlNode node) {
        return node.isGroup(GroupKind.IDENTIFIER) || node.isToken(TokenType.NAME) || node.isToken(TokenType.KEYWORD);
    }

    private static TokenGroup mapSources(TokenGroup list, UnaryOperator<SqlNode> rewrite) {
        List<SqlNode> out = new ArrayList<>(list.children().size());
        for (SqlNode member : list.children()) {
            out.add(isCandidate(member) ? rewrite.apply(member) : member);
        }
        return list.withChildren(out);
    }
}
