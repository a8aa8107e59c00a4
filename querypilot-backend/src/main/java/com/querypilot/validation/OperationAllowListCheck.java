package com.querypilot.validation;

import com.querypilot.model.ValidationIssue;
import com.querypilot.sql.StatementAnalyzer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Layer 2: only read-only statements may pass.
 */
public class OperationAllowListCheck implements ValidationLayer {

    public static final String RULE_ID = "operation_allowlist";

    private static final Set<String> READ_ONLY_STARTS = Set.of("SELECT", "WITH");

    private static final Pattern FORBIDDEN = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|MERGE|UPSERT|DROP|ALTER|CREATE|TRUNCATE|GRANT|REVOKE|RENAME|CALL|LOCK"
                    + "|VACUUM|REINDEX|CLUSTER|COPY|ATTACH|DETACH|SHUTDOWN|KILL|INTO|SET|RESET|DO|COMMIT|ROLLBACK)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern ROW_LOCK = Pattern.compile(
            "\\bFOR\\s+(?:NO\\s+KEY\\s+)?UPDATE\\b|\\bFOR\\s+(?:KEY\\s+)?SHARE\\b|\\bLOCK\\s+IN\\s+SHARE\\s+MODE\\b",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public LayerResult check(ValidationInput input) {
        String text = StatementAnalyzer.stripLiteralsAndComments(input.statement());
        List<ValidationIssue> issues = new ArrayList<>();

        String first = StatementAnalyzer.firstKeyword(input.statement());
        if (!READ_ONLY_STARTS.contains(first)) {
            issues.add(ValidationIssue.critical(RULE_ID,
                    "Only read-only statements are allowed, found " + (first.isEmpty() ? "no keyword" : first)));
        }

        if (ROW_LOCK.matcher(text).find()) {
            issues.add(ValidationIssue.critical(RULE_ID, "Statement takes row locks"));
        }

        Set<String> reported = new LinkedHashSet<>();
        Matcher m = FORBIDDEN.matcher(text);
        while (m.find()) {
            String keyword = m.group(1).toUpperCase(Locale.ROOT);
            if (!keyword.equals(first) && reported.add(keyword)) {
                issues.add(ValidationIssue.critical(RULE_ID, "Statement contains forbidden keyword " + keyword));
            }
        }
        return LayerResult.of(issues);
    }
}
