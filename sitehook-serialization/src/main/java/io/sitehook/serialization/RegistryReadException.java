package io.sitehook.serialization;

import java.io.Serial;

/// Thrown when a registry document cannot be read or has an invalid shape.
public class RegistryReadException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3398120735515706140L;

    public RegistryReadException(String message) {
        super(message);
    }

    public RegistryReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
