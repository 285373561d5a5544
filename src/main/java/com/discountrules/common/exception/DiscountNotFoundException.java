package com.discountrules.common.exception;

/**
 * Thrown when a discount is not found.
 */
public class DiscountNotFoundException extends DiscountRulesException {

    public DiscountNotFoundException(int discountId) {
        super("Discount not found: " + discountId);
    }
}
