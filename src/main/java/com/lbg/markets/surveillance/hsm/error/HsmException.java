package com.lbg.markets.surveillance.hsm.error;

/**
 * Base for failures raised synchronously by the status service.
 */
public abstract class HsmException extends RuntimeException {

    protected HsmException(String message) {
        super(message);
    }

    protected HsmException(String message, Throwable cause) {
        super(message, cause);
    }
}
