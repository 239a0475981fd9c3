package com.specsim.infrastructure.sim;

public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String message) {
        super(message);
    }

    public PipelineCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
