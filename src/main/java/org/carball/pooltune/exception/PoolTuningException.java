package org.carball.pooltune.exception;

/**
 * Base type for errors raised by the pool tuning components.
 * Read paths and query recording never raise these.
 */
public class PoolTuningException extends RuntimeException {

    public PoolTuningException(String message) {
        super(message);
    }

    public PoolTuningException(String message, Throwable cause) {
        super(message, cause);
    }
}
