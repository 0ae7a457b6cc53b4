package org.carball.pooltune.analyzer;

import org.carball.pooltune.model.query.QueryType;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * String-level helpers for executed query text: ids, sanitizing, type
 * detection, pattern extraction and table extraction. Nothing here parses SQL.
 */
public final class QueryTextAnalyzer {

    private static final int QUERY_ID_LENGTH = 16;

    private static final Pattern TABLE_PATTERN = Pattern.compile(
            "(?:FROM|JOIN|UPDATE|INTO)\\s+[\\[\"`]?(?:\\w+\\.)?[\\[\"`]?([A-Za-z_][A-Za-z0-9_]*)[\\]\"`]?",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern PASSWORD_LITERAL = Pattern.compile(
            "password\\s*=\\s*'[^']*'", Pattern.CASE_INSENSITIVE);

    private static final Pattern NUMBER_LITERAL = Pattern.compile("\\b\\d+\\b");
    private static final Pattern STRING_LITERAL = Pattern.compile("'[^']*'|\"[^\"]*\"");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> SQL_KEYWORDS = Set.of(
            "SELECT", "WHERE", "SET", "VALUES", "ON", "AS", "LATERAL", "UNNEST", "DUAL");

    private QueryTextAnalyzer() {
        // Utility class - prevent instantiation
    }

    /**
     * Content-derived id: the first 16 hex characters of SHA-256 over the text and parameters.
     */
    public static String generateQueryId(String queryText, List<?> params) {
        String content = nullToEmpty(queryText) + (params == null ? "[]" : params.toString());
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, QUERY_ID_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Masks password literals and collapses whitespace.
     */
    public static String sanitizeQuery(String queryText) {
        String masked = PASSWORD_LITERAL.matcher(nullToEmpty(queryText)).replaceAll("password = '***'");
        return WHITESPACE.matcher(masked).replaceAll(" ").trim();
    }

    /**
     * Replaces string parameters that mention a password with a mask.
     */
    public static List<Object> sanitizeParams(List<?> params) {
        if (params == null) {
            return List.of();
        }
        List<Object> sanitized = new ArrayList<>(params.size());
        for (Object param : params) {
            if (param instanceof String value && value.toLowerCase(Locale.ROOT).contains("password")) {
                sanitized.add("***");
            } else {
                sanitized.add(param);
            }
        }
        return sanitized;
    }

    public static QueryType detectQueryType(String queryText) {
        String normalized = nullToEmpty(queryText).trim().toUpperCase(Locale.ROOT);

        if (normalized.startsWith("SELECT")) return QueryType.SELECT;
        if (normalized.startsWith("INSERT")) return QueryType.INSERT;
        if (normalized.startsWith("UPDATE")) return QueryType.UPDATE;
        if (normalized.startsWith("DELETE")) return QueryType.DELETE;
        if (normalized.startsWith("CREATE")) return QueryType.CREATE;
        if (normalized.startsWith("ALTER")) return QueryType.ALTER;
        if (normalized.startsWith("DROP")) return QueryType.DROP;
        if (normalized.contains("INDEX")) return QueryType.INDEX;
        if (normalized.startsWith("BEGIN") || normalized.startsWith("COMMIT")
                || normalized.startsWith("ROLLBACK")) {
            return QueryType.TRANSACTION;
        }
        if (normalized.startsWith("CALL") || normalized.startsWith("EXEC")) return QueryType.PROCEDURE;
        if (normalized.contains("FUNCTION") || normalized.contains("RETURNS")) return QueryType.FUNCTION;

        return QueryType.SELECT;
    }

    /**
     * Replaces numeric and quoted literals with {@code ?} so executions of the
     * same statement aggregate under one pattern.
     */
    public static String extractPattern(String queryText) {
        String pattern = NUMBER_LITERAL.matcher(nullToEmpty(queryText)).replaceAll("?");
        pattern = STRING_LITERAL.matcher(pattern).replaceAll("?");
        return WHITESPACE.matcher(pattern).replaceAll(" ").trim();
    }

    public static List<String> extractTableNames(String queryText) {
        Set<String> tables = new LinkedHashSet<>();
        Matcher matcher = TABLE_PATTERN.matcher(nullToEmpty(queryText));
        while (matcher.find()) {
            String table = matcher.group(1);
            if (!SQL_KEYWORDS.contains(table.toUpperCase(Locale.ROOT))) {
                tables.add(table.toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(tables);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
