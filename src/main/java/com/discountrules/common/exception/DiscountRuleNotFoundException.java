package com.discountrules.common.exception;

/**
 * Thrown when no discount requirement rule is registered under a system name.
 */
public class DiscountRuleNotFoundException extends DiscountRulesException {

    public DiscountRuleNotFoundException(String systemName) {
        super("Discount requirement rule not found: " + systemName);
    }
}
