package org.carball.pooltune.exception;

import org.carball.pooltune.model.pool.RiskAssessment;

/**
 * Thrown when an optimization is too risky to apply without manual confirmation.
 */
public class OptimizationRejectedException extends PoolTuningException {

    private final RiskAssessment riskAssessment;

    public OptimizationRejectedException(RiskAssessment riskAssessment) {
        super("High-risk configuration change requires manual confirmation: "
                + String.join("; ", riskAssessment.factors()));
        this.riskAssessment = riskAssessment;
    }

    public RiskAssessment getRiskAssessment() {
        return riskAssessment;
    }
}
