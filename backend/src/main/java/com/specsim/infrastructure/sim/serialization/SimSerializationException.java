package com.specsim.infrastructure.sim.serialization;

/**
 * A SIM document could not be written, parsed or mapped back to a model.
 */
public class SimSerializationException extends RuntimeException {

    public SimSerializationException(String message) {
        super(message);
    }

    public SimSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
