package com.discountrules.common.exception;

/**
 * Thrown when a store is not found.
 */
public class StoreNotFoundException extends DiscountRulesException {

    public StoreNotFoundException(int storeId) {
        super("Store not found: " + storeId);
    }
}
