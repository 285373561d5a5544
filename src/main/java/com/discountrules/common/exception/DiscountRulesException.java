package com.discountrules.common.exception;

/**
 * Base exception for all discount rules exceptions.
 */
public class DiscountRulesException extends RuntimeException {

    public DiscountRulesException(String message) {
        super(message);
    }

    public DiscountRulesException(String message, Throwable cause) {
        super(message, cause);
    }
}
