package org.carball.pooltune.analyzer.detector;

import org.carball.pooltune.model.query.AntiPattern;

/**
 * A heuristic check for one query anti-pattern.
 * Implementations receive upper-cased, whitespace-collapsed query text.
 */
public interface AntiPatternDetector {

    AntiPattern getAntiPattern();

    boolean detect(String normalizedQuery);

    /** Short explanation used as the analysis reason. */
    String getReason();

    String getSuggestion();
}
