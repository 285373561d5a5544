package com.discountrules.common.exception;

/**
 * Thrown when a discount requirement is not found.
 */
public class DiscountRequirementNotFoundException extends DiscountRulesException {

    public DiscountRequirementNotFoundException(int discountRequirementId) {
        super("Discount requirement not found: " + discountRequirementId);
    }
}
