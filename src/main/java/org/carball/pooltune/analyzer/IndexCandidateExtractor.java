package org.carball.pooltune.analyzer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls columns that look like index candidates out of WHERE and JOIN ... ON clauses.
 * Token scanning only; aliases are stripped and the result is lower case.
 */
public final class IndexCandidateExtractor {

    private static final Pattern WHERE_CLAUSE = Pattern.compile(
            "\\bWHERE\\s+(.+?)(?:\\bGROUP\\s+BY\\b|\\bORDER\\s+BY\\b|\\bLIMIT\\b|\\bHAVING\\b|$)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    private static final Pattern CONDITION_COLUMN = Pattern.compile(
            "([A-Za-z_][\\w.]*)\\s*(?:=|!=|<>|<=|>=|<|>|\\bLIKE\\b|\\bIN\\b|\\bBETWEEN\\b|\\bIS\\b)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern JOIN_ON = Pattern.compile(
            "\\bJOIN\\s+\\w+(?:\\s+(?:AS\\s+)?\\w+)?\\s+ON\\s+([\\w.]+)\\s*=\\s*([\\w.]+)",
            Pattern.CASE_INSENSITIVE);

    private static final Set<String> EXCLUDED = Set.of("AND", "OR", "NOT", "NULL", "SELECT", "EXISTS");

    private IndexCandidateExtractor() {
        // Utility class - prevent instantiation
    }

    public static List<String> extract(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return List.of();
        }
        Set<String> columns = new LinkedHashSet<>();

        Matcher where = WHERE_CLAUSE.matcher(queryText);
        if (where.find()) {
            Matcher condition = CONDITION_COLUMN.matcher(where.group(1));
            while (condition.find()) {
                addColumn(columns, condition.group(1));
            }
        }

        Matcher join = JOIN_ON.matcher(queryText);
        while (join.find()) {
            addColumn(columns, join.group(1));
            addColumn(columns, join.group(2));
        }

        return new ArrayList<>(columns);
    }

    private static void addColumn(Set<String> columns, String token) {
        String column = token.contains(".") ? token.substring(token.lastIndexOf('.') + 1) : token;
        if (column.isEmpty() || EXCLUDED.contains(column.toUpperCase(Locale.ROOT))
                || Character.isDigit(column.charAt(0))) {
            return;
        }
        columns.add(column.toLowerCase(Locale.ROOT));
    }
}
