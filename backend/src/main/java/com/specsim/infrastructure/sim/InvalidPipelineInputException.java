package com.specsim.infrastructure.sim;

/**
 * Contract violation by the caller (null or malformed input). The only failure that aborts a run.
 */
public class InvalidPipelineInputException extends RuntimeException {

    public InvalidPipelineInputException(String message) {
        super(message);
    }

    public InvalidPipelineInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
