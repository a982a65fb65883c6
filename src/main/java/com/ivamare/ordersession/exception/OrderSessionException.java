package com.ivamare.ordersession.exception;

/**
 * Base exception for all order session errors.
 */
public class OrderSessionException extends RuntimeException {

    public OrderSessionException(String message) {
        super(message);
    }

    public OrderSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
