package com.querypilot.generation;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls one statement out of a raw completion.
 *
 * <p>Prefers the first fenced code block; otherwise starts at the first line opening with SELECT or a WITH
 * clause. Stops at the first semicolon or blank line, and drops trailing narrative lines that do not look
 * like SQL.
 */
public class StatementExtractor {

    public static final String NO_SQL = "NO_SQL";

    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z0-9_-]*\\s*\\n?(.*?)```", Pattern.DOTALL);
    /** SELECT, or WITH opening a CTE, at the start of a line or right after a colon. */
    private static final Pattern START = Pattern.compile(
            "(?:^|:)[ \\t]*(SELECT\\b|WITH\\s+(?:RECURSIVE\\s+)?[A-Za-z_]\\w*\\s*(?:\\([^)]*\\)\\s*)?AS\\s*\\()",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern NARRATIVE = Pattern.compile(
            "^(?:this|the|note|explanation|here|it|these|i|that|which|query|sql\\s+query)\\b.*",
            Pattern.CASE_INSENSITIVE);

    public Extraction extract(String completion) {
        if (completion == null || completion.isBlank()) {
            return Extraction.empty();
        }
        String text = completion.strip();
        if (text.toUpperCase(Locale.ROOT).startsWith(NO_SQL)) {
            return Extraction.sentinel();
        }

        Matcher fence = FENCE.matcher(text);
        if (fence.find()) {
            text = fence.group(1).strip();
        }
        Matcher start = START.matcher(text);
        if (!start.find()) {
            return text.toUpperCase(Locale.ROOT).contains(NO_SQL) ? Extraction.sentinel() : Extraction.empty();
        }
        text = text.substring(start.start(1));

        StringBuilder statement = new StringBuilder();
        for (String line : text.split("\\R", -1)) {
            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("```")) {
                if (statement.length() > 0) {
                    break;
                }
                continue;
            }
            if (statement.length() > 0 && NARRATIVE.matcher(trimmed).matches()) {
                break;
            }
            int semicolon = indexOfSemicolonOutsideLiteral(line);
            if (semicolon >= 0) {
                statement.append(line, 0, semicolon);
                break;
            }
            statement.append(line).append('\n');
        }
        String result = statement.toString().strip();
        return result.isEmpty() ? Extraction.empty() : Extraction.of(result);
    }

    private static int indexOfSemicolonOutsideLiteral(String line) {
        boolean inLiteral = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\'') {
                inLiteral = !inLiteral;
            } else if (c == ';' && !inLiteral) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Extraction result. {@code statement} is empty when nothing usable was found.
     */
    public record Extraction(Optional<String> statement, boolean noSql) {

        static Extraction of(String statement) {
            return new Extraction(Optional.of(statement), false);
        }

        static Extraction empty() {
            return new Extraction(Optional.empty(), false);
        }

        static Extraction sentinel() {
            return new Extraction(Optional.empty(), true);
        }
    }
}
