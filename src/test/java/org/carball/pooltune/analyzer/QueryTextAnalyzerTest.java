package org.carball.pooltune.analyzer;

import org.carball.pooltune.model.query.QueryType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class QueryTextAnalyzerTest {

    @Test
    void queryIdShouldBeStableSixteenHexCharacters() {
        String id = QueryTextAnalyzer.generateQueryId("SELECT * FROM users WHERE id = ?", List.of(42));

        assertThat(id).hasSize(16).matches("[0-9a-f]{16}");
        assertThat(QueryTextAnalyzer.generateQueryId("SELECT * FROM users WHERE id = ?", List.of(42))).isEqualTo(id);
        assertThat(QueryTextAnalyzer.generateQueryId("SELECT * FROM users WHERE id = ?", List.of(43))).isNotEqualTo(id);
    }

    @Test
    void queryIdShouldTolerateNullInput() {
        assertThat(QueryTextAnalyzer.generateQueryId(null, null)).hasSize(16);
    }

    @Test
    void shouldMaskPasswordLiteralsAndCollapseWhitespace() {
        String sanitized = QueryTextAnalyzer.sanitizeQuery(
                "UPDATE users\n   SET PASSWORD = 'hunter2'\tWHERE id = 1");

        assertThat(sanitized).isEqualTo("UPDATE users SET password = '***' WHERE id = 1");
    }

    @Test
    void shouldMaskPasswordParameters() {
        List<Object> params = QueryTextAnalyzer.sanitizeParams(Arrays.asList("alice", "myPassword=x", 7, null));

        assertThat(params).containsExactly("alice", "***", 7, null);
        assertThat(QueryTextAnalyzer.sanitizeParams(null)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "select id from users | SELECT",
            "  INSERT INTO users VALUES (1) | INSERT",
            "update users set a = 1 | UPDATE",
            "DELETE FROM users | DELETE",
            "CREATE TABLE t (id int) | CREATE",
            "ALTER TABLE t ADD c int | ALTER",
            "DROP TABLE t | DROP",
            "REINDEX users_pkey | INDEX",
            "BEGIN | TRANSACTION",
            "COMMIT | TRANSACTION",
            "ROLLBACK | TRANSACTION",
            "CALL refresh_stats() | PROCEDURE",
            "EXEC sp_who | PROCEDURE",
            "WITH x AS (SELECT 1) SELECT * FROM x | SELECT"
    })
    void shouldDetectQueryType(String query, QueryType expected) {
        assertThat(QueryTextAnalyzer.detectQueryType(query)).isEqualTo(expected);
    }

    @Test
    void createIndexShouldBeClassifiedAsCreate() {
        assertThat(QueryTextAnalyzer.detectQueryType("CREATE INDEX idx ON t (c)")).isEqualTo(QueryType.CREATE);
    }

    @Test
    void shouldReplaceLiteralsInPattern() {
        String pattern = QueryTextAnalyzer.extractPattern(
                "SELECT * FROM orders WHERE customer_id = 42 AND status = 'shipped'  LIMIT 10");

        assertThat(pattern).isEqualTo("SELECT * FROM orders WHERE customer_id = ? AND status = ? LIMIT ?");
    }

    @Test
    void queriesDifferingOnlyInLiteralsShouldShareAPattern() {
        assertThat(QueryTextAnalyzer.extractPattern("SELECT name FROM users WHERE id = 1"))
                .isEqualTo(QueryTextAnalyzer.extractPattern("SELECT name FROM users WHERE id = 9876"));
    }

    @Test
    void identifiersWithDigitsShouldSurvivePatternExtraction() {
        assertThat(QueryTextAnalyzer.extractPattern("SELECT col1 FROM table2 WHERE x = 5"))
                .isEqualTo("SELECT col1 FROM table2 WHERE x = ?");
    }

    @Test
    void shouldExtractTableNames() {
        List<String> tables = QueryTextAnalyzer.extractTableNames(
                "SELECT o.id FROM dbo.Orders o JOIN customers c ON o.customer_id = c.id");

        assertThat(tables).containsExactly("orders", "customers");
        assertThat(QueryTextAnalyzer.extractTableNames("INSERT INTO audit_log VALUES (1)")).containsExactly("audit_log");
        assertThat(QueryTextAnalyzer.extractTableNames(null)).isEmpty();
    }
}
