package org.carball.pooltune.analyzer.detector;

import org.carball.pooltune.model.query.AntiPattern;

import java.util.regex.Pattern;

public class NPlusOneDetector implements AntiPatternDetector {

    private static final Pattern NESTED_LOOKUP = Pattern.compile(
            "\\b(?:IN|EXISTS)\\s*\\(\\s*SELECT\\b", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    @Override
    public AntiPattern getAntiPattern() {
        return AntiPattern.N_PLUS_ONE;
    }

    @Override
    public boolean detect(String normalizedQuery) {
        return NESTED_LOOKUP.matcher(normalizedQuery).find();
    }

    @Override
    public String getReason() {
        return "Possible N+1 query pattern";
    }

    @Override
    public String getSuggestion() {
        return "Replace nested lookups with a JOIN or batch the lookups";
    }
}
