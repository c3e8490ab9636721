package com.vidnyan.bpml.application.port.out;

/**
 * The model input could not be read or did not have the expected shape.
 */
public class ModelReadException extends RuntimeException {

    public ModelReadException(String message) {
        super(message);
    }

    public ModelReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
