package org.carball.pooltune.analyzer.detector;

import org.carball.pooltune.model.query.AntiPattern;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flags scalar subqueries compared in an outer WHERE whose own WHERE holds an
 * equality, and subqueries compared in a HAVING clause.
 * <p>
 * Each subquery is searched only within its own parentheses; none of the
 * patterns can backtrack across the whole query.
 */
public class CorrelatedSubqueryDetector implements AntiPatternDetector {

    private static final Pattern WHERE_KEYWORD = Pattern.compile("\\bWHERE\\b");
    private static final Pattern HAVING_KEYWORD = Pattern.compile("\\bHAVING\\b");
    private static final Pattern EQUALS_SUBQUERY = Pattern.compile("=\\s*\\(\\s*SELECT\\b");
    private static final Pattern GREATER_SUBQUERY = Pattern.compile(">\\s*\\(\\s*SELECT\\b");
    private static final Pattern EQUALITY = Pattern.compile("\\b\\w+\\s*=\\s*\\w");

    @Override
    public AntiPattern getAntiPattern() {
        return AntiPattern.CORRELATED_SUBQUERY;
    }

    @Override
    public boolean detect(String normalizedQuery) {
        return hasCorrelatedWhereSubquery(normalizedQuery) || hasHavingSubquery(normalizedQuery);
    }

    private static boolean hasCorrelatedWhereSubquery(String query) {
        Matcher where = WHERE_KEYWORD.matcher(query);
        if (!where.find()) {
            return false;
        }
        Matcher subquery = EQUALS_SUBQUERY.matcher(query);
        int from = where.end();
        while (from < query.length() && subquery.find(from)) {
            int open = query.indexOf('(', subquery.start());
            int close = closingParenthesis(query, open);
            if (hasInnerEquality(query, subquery.end(), close)) {
                return true;
            }
            from = subquery.end();
        }
        return false;
    }

    private static boolean hasInnerEquality(String query, int start, int end) {
        Matcher where = WHERE_KEYWORD.matcher(query).region(start, end);
        if (!where.find()) {
            return false;
        }
        return EQUALITY.matcher(query).region(where.end(), end).find();
    }

    private static boolean hasHavingSubquery(String query) {
        Matcher having = HAVING_KEYWORD.matcher(query);
        return having.find() && GREATER_SUBQUERY.matcher(query).region(having.end(), query.length()).find();
    }

    /**
     * @return the index of the parenthesis closing the one at {@code open}, or the query length when unbalanced
     */
    private static int closingParenthesis(String query, int open) {
        int depth = 0;
        for (int i = open; i < query.length(); i++) {
            char c = query.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && --depth == 0) {
                return i;
            }
        }
        return query.length();
    }

    @Override
    public String getReason() {
        return "Possible correlated subquery";
    }

    @Override
    public String getSuggestion() {
        return "Rewrite the correlated subquery as a JOIN or window function";
    }
}
