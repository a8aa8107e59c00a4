package com.querypilot.intent;

import com.querypilot.model.EntityType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Table names mentioned in the question, matched against the schema's tables in singular and plural form,
 * with underscores read as spaces ("lab result" finds {@code lab_results}).
 */
public class TableHintExtractor implements EntityExtractor {

    private final Supplier<Collection<String>> tableNames;

    public TableHintExtractor(Supplier<Collection<String>> tableNames) {
        this.tableNames = tableNames;
    }

    @Override
    public EntityType type() {
        return EntityType.TABLE_HINT;
    }

    @Override
    public List<String> extract(String normalizedText) {
        TreeMap<Integer, String> byPosition = new TreeMap<>();
        for (String table : tableNames.get()) {
            for (String form : forms(table)) {
                Matcher m = Pattern.compile("\\b" + Pattern.quote(form) + "\\b").matcher(normalizedText);
                if (m.find()) {
                    byPosition.putIfAbsent(m.start(), table);
                    break;
                }
            }
        }
        return new ArrayList<>(new LinkedHashSet<>(byPosition.values()));
    }

    static Set<String> forms(String table) {
        String name = table.toLowerCase(Locale.ROOT);
        Set<String> forms = new LinkedHashSet<>();
        for (String base : List.of(name, name.replace('_', ' '))) {
            forms.add(base);
            forms.add(singular(base));
            forms.add(plural(base));
        }
        forms.removeIf(String::isBlank);
        return forms;
    }

    static String singular(String word) {
        if (word.endsWith("ies") && word.length() > 3) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("ses") || word.endsWith("xes") || word.endsWith("ches") || word.endsWith("shes")) {
            return word.substring(0, word.length() - 2);
        }
        if (word.endsWith("s") && !word.endsWith("ss")) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    static String plural(String word) {
        if (word.endsWith("s")) {
            return word;
        }
        if (word.endsWith("y") && word.length() > 1 && "aeiou".indexOf(word.charAt(word.length() - 2)) < 0) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (word.endsWith("x") || word.endsWith("ch") || word.endsWith("sh")) {
            return word + "es";
        }
        return word + "s";
    }
}
