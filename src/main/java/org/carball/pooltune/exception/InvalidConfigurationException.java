package org.carball.pooltune.exception;

import java.util.List;

/**
 * Thrown when a proposed pool configuration violates one or more invariants.
 * The active configuration is left unchanged.
 */
public class InvalidConfigurationException extends PoolTuningException {

    private final List<String> violations;

    public InvalidConfigurationException(List<String> violations) {
        super("Invalid pool configuration: " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    /**
     * @return every violated rule, in validation order
     */
    public List<String> getViolations() {
        return violations;
    }
}
