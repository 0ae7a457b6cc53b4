package org.carball.pooltune.pool;

import org.carball.pooltune.config.OptimizationTuning;
import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.config.PoolEnvironment;
import org.carball.pooltune.model.pool.RiskAssessment;
import org.carball.pooltune.model.pool.RiskLevel;
import org.carball.pooltune.model.pool.WorkloadMetrics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class RiskAssessorTest {

    private static final WorkloadMetrics CALM = new WorkloadMetrics(5, 8, 50, 0.0, 20);

    private final RiskAssessor assessor = new RiskAssessor(OptimizationTuning.defaults());

    @Test
    void unchangedConfigurationUnderCalmLoadShouldBeLowRisk() {
        PoolConfiguration config = PoolEnvironment.PRODUCTION.buildConfiguration();

        RiskAssessment risk = assessor.assess(config, config, CALM, PoolEnvironment.PRODUCTION);

        assertThat(risk.level()).isEqualTo(RiskLevel.LOW);
        assertThat(risk.score()).isZero();
        assertThat(risk.factors()).isEmpty();
    }

    @Test
    void productionOnlyAddsScoreWhenOtherFactorsApply() {
        PoolConfiguration current = PoolEnvironment.PRODUCTION.buildConfiguration();
        PoolConfiguration shortTimeout = current.toBuilder().connectionTimeoutMs(1_500).build();

        RiskAssessment risk = assessor.assess(current, shortTimeout, CALM, PoolEnvironment.PRODUCTION);

        assertThat(risk.score()).isEqualTo(40);
        assertThat(risk.level()).isEqualTo(RiskLevel.MEDIUM);
        assertThat(risk.factors()).containsExactly(
                "Very short connection timeout (1500ms)",
                "Change targets a production environment");
    }

    @Test
    void largeGrowthShouldScoreInNonProductionEnvironments() {
        PoolConfiguration current = PoolEnvironment.STAGING.buildConfiguration();
        PoolConfiguration grown = current.toBuilder().maxConnections(61).build();

        RiskAssessment risk = assessor.assess(current, grown, CALM, PoolEnvironment.STAGING);

        assertThat(risk.score()).isEqualTo(30);
        assertThat(risk.factors()).singleElement()
                .isEqualTo("Large increase in max connections (20 -> 61)");
    }

    @Test
    void stressedSystemShouldAccumulateScore() {
        PoolConfiguration config = PoolEnvironment.STAGING.buildConfiguration();

        RiskAssessment risk = assessor.assess(config, config, new WorkloadMetrics(10, 12, 1_200, 0.2, 40),
                PoolEnvironment.STAGING);

        assertThat(risk.score()).isEqualTo(55);
        assertThat(risk.level()).isEqualTo(RiskLevel.HIGH);
        assertThat(risk.factors()).hasSize(2);
        assertThat(risk.factors().get(0)).isEqualTo("High current error rate (20.0%)");
        assertThat(risk.factors().get(1)).startsWith("System is under stress");
    }

    @Test
    void shouldMapScoresToLevels() {
        assertThat(assessor.levelFor(0)).isEqualTo(RiskLevel.LOW);
        assertThat(assessor.levelFor(20)).isEqualTo(RiskLevel.LOW);
        assertThat(assessor.levelFor(21)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(assessor.levelFor(50)).isEqualTo(RiskLevel.MEDIUM);
        assertThat(assessor.levelFor(51)).isEqualTo(RiskLevel.HIGH);
    }
}
