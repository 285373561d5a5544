package com.discountrules.common.exception;

/**
 * Thrown when a quantity-constrained restricted product token cannot be parsed.
 */
public class MalformedRestrictedProductException extends DiscountRulesException {

    private final String token;

    public MalformedRestrictedProductException(String token, Throwable cause) {
        super("Malformed restricted product: " + token, cause);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
