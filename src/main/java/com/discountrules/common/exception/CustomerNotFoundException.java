package com.discountrules.common.exception;

/**
 * Thrown when a customer is not found.
 */
public class CustomerNotFoundException extends DiscountRulesException {

    public CustomerNotFoundException(int customerId) {
        super("Customer not found: " + customerId);
    }
}
