package com.e2eq.cnl.exceptions;

/**
 * Base type for structural failures raised by the graph core. Parse and validation
 * problems are reported as values instead and never reach this hierarchy, except when
 * a single direct edge write is rejected.
 */
public abstract class CnlGraphException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    protected CnlGraphException(String message) {
        super(message);
    }

    protected CnlGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
