package org.carball.pooltune.analyzer.detector;

import org.carball.pooltune.model.query.AntiPattern;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class CartesianProductDetector implements AntiPatternDetector {

    private static final Pattern FROM_CLAUSE = Pattern.compile(
            "\\bFROM\\s+(.+?)(?:\\bGROUP\\s+BY\\b|\\bORDER\\s+BY\\b|\\bLIMIT\\b|$)");
    private static final Pattern FROM_KEYWORD = Pattern.compile("\\bFROM\\b");
    private static final Pattern WHERE_KEYWORD = Pattern.compile("\\bWHERE\\b");

    @Override
    public AntiPattern getAntiPattern() {
        return AntiPattern.CARTESIAN_PRODUCT;
    }

    @Override
    public boolean detect(String normalizedQuery) {
        if (WHERE_KEYWORD.matcher(normalizedQuery).find()) {
            return false;
        }
        return countFromKeywords(normalizedQuery) > 1 || hasTableList(normalizedQuery);
    }

    private static int countFromKeywords(String query) {
        Matcher matcher = FROM_KEYWORD.matcher(query);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static boolean hasTableList(String query) {
        Matcher matcher = FROM_CLAUSE.matcher(query);
        return matcher.find() && matcher.group(1).contains(",");
    }

    @Override
    public String getReason() {
        return "Possible cartesian product";
    }

    @Override
    public String getSuggestion() {
        return "Add join conditions between the tables in the FROM clause";
    }
}
