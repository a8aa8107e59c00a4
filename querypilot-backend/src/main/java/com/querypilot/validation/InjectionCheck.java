package com.querypilot.validation;

import com.querypilot.model.ValidationIssue;
import com.querypilot.sql.StatementAnalyzer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Layer 1: statement chaining, comment injection, dynamic execution and privileged procedures.
 */
public class InjectionCheck implements ValidationLayer {

    public static final String RULE_ID = "injection";

    private static final int FLAGS = Pattern.CASE_INSENSITIVE;

    /** Patterns evaluated against the statement with string literal contents blanked. */
    private static final Map<String, Pattern> STRUCTURAL = new LinkedHashMap<>();
    /** Patterns that need the literals, e.g. tautologies. */
    private static final Map<String, Pattern> RAW = new LinkedHashMap<>();

    static {
        STRUCTURAL.put("statement chaining", Pattern.compile(";\\s*\\S"));
        STRUCTURAL.put("line comment", Pattern.compile("--"));
        STRUCTURAL.put("block comment", Pattern.compile("/\\*|\\*/"));
        STRUCTURAL.put("hash comment", Pattern.compile("(?m)#\\s*$"));
        STRUCTURAL.put("dynamic execution", Pattern.compile("\\bEXEC(?:UTE)?\\b|\\bsp_executesql\\b|\\bPREPARE\\b", FLAGS));
        STRUCTURAL.put("privileged procedure", Pattern.compile(
                "\\bxp_\\w+|\\bsp_(?:configure|addlogin|addsrvrolemember|OAcreate|OAmethod)\\b"
                        + "|\\bdbms_\\w+|\\butl_(?:file|http|tcp)\\b|\\bpg_(?:read_file|read_binary_file|ls_dir|sleep)\\b"
                        + "|\\blo_(?:import|export)\\b|\\bload_file\\s*\\(", FLAGS));
        STRUCTURAL.put("file output", Pattern.compile("\\bINTO\\s+(?:OUTFILE|DUMPFILE)\\b", FLAGS));
        STRUCTURAL.put("time-based delay", Pattern.compile("\\bWAITFOR\\s+DELAY\\b|\\bBENCHMARK\\s*\\(|\\bSLEEP\\s*\\(", FLAGS));
        STRUCTURAL.put("character obfuscation", Pattern.compile("\\bCHA?R\\s*\\(\\s*\\d+\\s*\\)\\s*(?:\\+|\\|\\|)", FLAGS));
        STRUCTURAL.put("hex literal", Pattern.compile("\\b0x[0-9a-f]{8,}", FLAGS));

        RAW.put("tautology", Pattern.compile(
                "\\bOR\\s+(?:'([^']*)'\\s*=\\s*'\\1'|(\\d+)\\s*=\\s*\\2)(?!\\w)", FLAGS));
    }

    @Override
    public String ruleId() {
        return RULE_ID;
    }

    @Override
    public LayerResult check(ValidationInput input) {
        String raw = input.statement();
        String structural = StatementAnalyzer.stripLiterals(raw);
        List<ValidationIssue> issues = new ArrayList<>();
        STRUCTURAL.forEach((name, pattern) -> {
            if (pattern.matcher(structural).find()) {
                issues.add(ValidationIssue.critical(RULE_ID, "Statement contains " + name));
            }
        });
        RAW.forEach((name, pattern) -> {
            if (pattern.matcher(raw).find()) {
                issues.add(ValidationIssue.critical(RULE_ID, "Statement contains " + name));
            }
        });
        return LayerResult.of(issues);
    }
}
