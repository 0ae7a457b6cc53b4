package org.carball.pooltune.analyzer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class IndexCandidateExtractorTest {

    @Test
    void shouldExtractWhereColumns() {
        assertThat(IndexCandidateExtractor.extract(
                "SELECT * FROM orders WHERE customer_id = 1 AND status IN ('a', 'b') ORDER BY created_at"))
                .containsExactly("customer_id", "status");
    }

    @Test
    void shouldExtractJoinColumnsWithoutAliases() {
        assertThat(IndexCandidateExtractor.extract(
                "SELECT o.id FROM orders o JOIN customers c ON o.customer_id = c.id"))
                .containsExactly("customer_id", "id");
    }

    @Test
    void shouldSkipLogicalOperators() {
        assertThat(IndexCandidateExtractor.extract("SELECT 1 FROM t WHERE NOT a = 1 OR b > 2"))
                .containsExactly("a", "b");
    }

    @Test
    void shouldReturnEmptyForQueriesWithoutFilters() {
        assertThat(IndexCandidateExtractor.extract("SELECT * FROM t")).isEmpty();
        assertThat(IndexCandidateExtractor.extract("")).isEmpty();
        assertThat(IndexCandidateExtractor.extract(null)).isEmpty();
    }
}
