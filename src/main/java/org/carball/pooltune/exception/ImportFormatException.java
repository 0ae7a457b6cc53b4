package org.carball.pooltune.exception;

/**
 * Thrown when an exported configuration document cannot be read back.
 */
public class ImportFormatException extends PoolTuningException {

    public ImportFormatException(String message) {
        super(message);
    }

    public ImportFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
