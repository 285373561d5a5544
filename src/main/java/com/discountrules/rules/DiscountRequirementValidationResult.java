package com.discountrules.rules;

import lombok.Value;

/**
 * Result of a discount requirement check.
 */
@Value
public class DiscountRequirementValidationResult {
    boolean valid;

    public static DiscountRequirementValidationResult valid() {
        return new DiscountRequirementValidationResult(true);
    }

    public static DiscountRequirementValidationResult invalid() {
        return new DiscountRequirementValidationResult(false);
    }
}
