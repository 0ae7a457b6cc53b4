package org.carball.pooltune.analyzer.detector;

import org.carball.pooltune.model.query.AntiPattern;

import java.util.regex.Pattern;

public class TableScanDetector implements AntiPatternDetector {

    private static final Pattern SELECT_STAR = Pattern.compile("SELECT\\s+\\*\\s+FROM");
    private static final Pattern INEQUALITY_WITH_AND = Pattern.compile(
            "WHERE\\s+\\w+\\s*=\\s*\\w+\\s*AND\\s+\\w+\\s*(?:!=|<>)");
    private static final Pattern ORDER_BY = Pattern.compile("\\bORDER\\s+BY\\b");
    private static final Pattern ROW_LIMIT = Pattern.compile("\\bLIMIT\\b|\\bFETCH\\s+FIRST\\b|\\bTOP\\b");

    @Override
    public AntiPattern getAntiPattern() {
        return AntiPattern.TABLE_SCAN;
    }

    @Override
    public boolean detect(String normalizedQuery) {
        return SELECT_STAR.matcher(normalizedQuery).find()
                || INEQUALITY_WITH_AND.matcher(normalizedQuery).find()
                || (ORDER_BY.matcher(normalizedQuery).find() && !ROW_LIMIT.matcher(normalizedQuery).find());
    }

    @Override
    public String getReason() {
        return "Possible full table scan";
    }

    @Override
    public String getSuggestion() {
        return "Select only the needed columns and add indexes for filter and sort columns";
    }
}
