package com.haulage.tickets.exception;

/**
 * Thrown when the external extraction layer is unavailable or returns an error.
 */
public class ExtractionServiceException extends TransientInfraException {

    private final String engineName;

    public ExtractionServiceException(String message, String engineName, String sourceFile) {
        super(message, sourceFile);
        this.engineName = engineName;
    }

    public ExtractionServiceException(String message, String engineName, String sourceFile, Throwable cause) {
        super(message, sourceFile, cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
