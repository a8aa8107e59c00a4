package com.querypilot.sql;

import com.querypilot.schema.SchemaSnapshot;
import lombok.extern.slf4j.Slf4j;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.FromItem;
import net.sf.jsqlparser.statement.select.Join;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.SelectBody;
import net.sf.jsqlparser.statement.select.SetOperationList;
import net.sf.jsqlparser.statement.select.SubJoin;
import net.sf.jsqlparser.statement.select.SubSelect;
import net.sf.jsqlparser.util.TablesNamesFinder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts {@link StatementStructure} from statement text.
 *
 * <p>JSqlParser supplies table and join facts when it can parse the statement; pattern matching over the
 * literal-free text covers dialect constructs the parser rejects.
 */
@Slf4j
public class StatementAnalyzer {

    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");
    private static final Pattern FIRST_WORD = Pattern.compile("^[\\s(]*([A-Za-z]+)");

    private static final Pattern TABLE_REF = Pattern.compile(
            "\\b(?:FROM|JOIN)\\s+([\\w.\"\\[\\]`]+)(?:\\s+(?:AS\\s+)?([A-Za-z_]\\w*))?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CTE_NAME = Pattern.compile(
            "(?:\\bWITH\\s+(?:RECURSIVE\\s+)?|,\\s*)([A-Za-z_]\\w*)\\s*(?:\\([^)]*\\))?\\s+AS\\s*\\(",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern QUALIFIED_COLUMN = Pattern.compile("\\b([A-Za-z_]\\w*)\\.([A-Za-z_]\\w*|\\*)");

    private static final Pattern JOIN = Pattern.compile("\\bJOIN\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SUBQUERY_OPEN = Pattern.compile("\\(\\s*SELECT\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern SET_OPERATION = Pattern.compile("\\b(?:UNION|INTERSECT|EXCEPT|MINUS)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern WINDOW = Pattern.compile("\\bOVER\\s*\\(", Pattern.CASE_INSENSITIVE);
    private static final Pattern WHERE = Pattern.compile("\\b(?:WHERE|HAVING)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LIMIT = Pattern.compile(
            "\\bLIMIT\\s+\\d|\\bFETCH\\s+(?:FIRST|NEXT)\\b|\\bTOP\\s*\\(?\\s*\\d|\\bROWNUM\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern AGGREGATE = Pattern.compile("\\b(?:COUNT|SUM|AVG|MIN|MAX)\\s*\\(",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern GROUP_BY = Pattern.compile("\\bGROUP\\s+BY\\b", Pattern.CASE_INSENSITIVE);

    private static final Set<String> NON_ALIAS_WORDS = Set.of(
            "where", "join", "inner", "left", "right", "full", "outer", "cross", "natural", "on", "using",
            "group", "order", "having", "limit", "offset", "fetch", "union", "intersect", "except", "minus",
            "window", "lateral", "as", "with", "select", "and", "or");

    /**
     * Replace comments with a space and string literal contents with {@code ''}, scanning left to right so that
     * comment markers inside literals and quotes inside comments are not mistaken for each other. An unterminated
     * literal or block comment is kept as written.
     */
    public static String stripLiteralsAndComments(String sql) {
        if (sql == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(sql.length());
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'') {
                int end = literalEnd(sql, i);
                if (end < 0) {
                    out.append(sql, i, n);
                    break;
                }
                out.append("''");
                i = end + 1;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int newline = sql.indexOf('\n', i);
                out.append(' ');
                i = newline < 0 ? n : newline;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int close = sql.indexOf("*/", i + 2);
                if (close < 0) {
                    out.append(sql, i, n);
                    break;
                }
                out.append(' ');
                i = close + 2;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Index of the quote closing the literal opened at {@code open}, or -1. A doubled quote is an escaped quote.
     */
    private static int literalEnd(String sql, int open) {
        int i = open + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == '\'') {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * Replace string literal contents only; comments are kept so injection checks can see them.
     */
    public static String stripLiterals(String sql) {
        return sql == null ? "" : STRING_LITERAL.matcher(sql).replaceAll("''");
    }

    public static String firstKeyword(String sql) {
        Matcher m = FIRST_WORD.matcher(stripLiteralsAndComments(sql));
        return m.find() ? m.group(1).toUpperCase(Locale.ROOT) : "";
    }

    public StatementStructure analyze(String sql) {
        String text = stripLiteralsAndComments(sql);
        Set<String> cteNames = cteNames(text);

        Map<String, String> aliases = new LinkedHashMap<>();
        Set<String> writtenTables = new LinkedHashSet<>();
        List<String> regexTables = regexTables(text, aliases, writtenTables);

        List<String> tables = regexTables;
        int joinCount = count(JOIN, text);
        boolean parsed = false;
        try {
            Statement statement = CCJSqlParserUtil.parse(sql);
            parsed = true;
            if (statement instanceof Select select) {
                List<String> parsedTables = new ArrayList<>();
                for (String name : new TablesNamesFinder().getTableList(statement)) {
                    parsedTables.add(name);
                }
                tables = parsedTables;
                AstCounts counts = new AstCounts();
                walk(select.getSelectBody(), aliases, counts);
                joinCount = Math.max(joinCount, counts.joins);
            }
        } catch (JSQLParserException | RuntimeException e) {
            log.debug("Statement not parseable, using pattern analysis: {}", e.getMessage());
        }

        List<String> distinctTables = distinctTables(tables, cteNames);
        for (String table : distinctTables) {
            aliases.putIfAbsent(lower(SchemaSnapshot.stripQualifier(table)), SchemaSnapshot.stripQualifier(table));
        }
        cteNames.forEach(aliases::remove);

        return new StatementStructure(
                firstKeyword(sql),
                parsed,
                distinctTables,
                aliases,
                qualifiedColumns(text, writtenTables),
                joinCount,
                count(SUBQUERY_OPEN, text),
                maxSubqueryDepth(text),
                count(SET_OPERATION, text),
                WINDOW.matcher(text).find(),
                WHERE.matcher(text).find(),
                LIMIT.matcher(text).find(),
                AGGREGATE.matcher(text).find(),
                GROUP_BY.matcher(text).find());
    }

    private List<String> regexTables(String text, Map<String, String> aliases, Set<String> writtenTables) {
        List<String> tables = new ArrayList<>();
        Matcher m = TABLE_REF.matcher(text);
        while (m.find()) {
            String written = m.group(1);
            if (written.startsWith("(")) {
                continue;
            }
            writtenTables.add(lower(written));
            String bare = SchemaSnapshot.stripQualifier(written);
            tables.add(bare);
            String alias = m.group(2);
            if (alias != null && !NON_ALIAS_WORDS.contains(lower(alias))) {
                aliases.put(lower(alias), bare);
            }
        }
        return tables;
    }

    private void walk(SelectBody body, Map<String, String> aliases, AstCounts counts) {
        if (body instanceof PlainSelect plain) {
            visitFromItem(plain.getFromItem(), aliases, counts);
            if (plain.getJoins() != null) {
                for (Join join : plain.getJoins()) {
                    counts.joins++;
                    visitFromItem(join.getRightItem(), aliases, counts);
                }
            }
        } else if (body instanceof SetOperationList setOperations) {
            for (SelectBody member : setOperations.getSelects()) {
                walk(member, aliases, counts);
            }
        }
    }

    private void visitFromItem(FromItem item, Map<String, String> aliases, AstCounts counts) {
        if (item instanceof Table table) {
            String name = SchemaSnapshot.stripQualifier(table.getName());
            if (table.getAlias() != null && table.getAlias().getName() != null) {
                aliases.put(lower(table.getAlias().getName()), name);
            }
        } else if (item instanceof SubSelect subSelect) {
            walk(subSelect.getSelectBody(), aliases, counts);
        } else if (item instanceof SubJoin subJoin) {
            visitFromItem(subJoin.getLeft(), aliases, counts);
            if (subJoin.getJoinList() != null) {
                for (Join join : subJoin.getJoinList()) {
                    counts.joins++;
                    visitFromItem(join.getRightItem(), aliases, counts);
                }
            }
        }
    }

    private Set<String> cteNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        if (!text.toUpperCase(Locale.ROOT).contains("WITH")) {
            return names;
        }
        Matcher m = CTE_NAME.matcher(text);
        while (m.find()) {
            names.add(lower(m.group(1)));
        }
        return names;
    }

    private List<String> distinctTables(List<String> tables, Set<String> cteNames) {
        Map<String, String> distinct = new LinkedHashMap<>();
        for (String table : tables) {
            String bare = SchemaSnapshot.stripQualifier(table);
            if (bare.isEmpty() || cteNames.contains(lower(bare))) {
                continue;
            }
            distinct.putIfAbsent(lower(bare), bare);
        }
        return List.copyOf(distinct.values());
    }

    private List<ColumnRef> qualifiedColumns(String text, Set<String> writtenTables) {
        List<ColumnRef> refs = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Matcher m = QUALIFIED_COLUMN.matcher(text);
        while (m.find()) {
            String qualifier = m.group(1);
            String column = m.group(2);
            String full = lower(qualifier + "." + column);
            if ("*".equals(column) || writtenTables.contains(full) || !seen.add(full)) {
                continue;
            }
            // schema.table.column: the leading schema is consumed by the table match
            if (m.end() < text.length() && text.charAt(m.end()) == '.') {
                continue;
            }
            refs.add(new ColumnRef(qualifier, column));
        }
        return refs;
    }

    private int maxSubqueryDepth(String text) {
        Deque<Boolean> parens = new ArrayDeque<>();
        int depth = 0;
        int max = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                boolean subquery = SUBQUERY_OPEN.matcher(text).region(i, text.length()).lookingAt();
                parens.push(subquery);
                if (subquery) {
                    depth++;
                    max = Math.max(max, depth);
                }
            } else if (c == ')' && !parens.isEmpty()) {
                if (parens.pop()) {
                    depth--;
                }
            }
        }
        return max;
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) {
            n++;
        }
        return n;
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    private static final class AstCounts {
        private int joins;
    }
}
