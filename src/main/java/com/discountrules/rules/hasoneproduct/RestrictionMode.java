package com.discountrules.rules.hasoneproduct;

/**
 * How a restricted product constrains the quantity in the cart.
 */
public enum RestrictionMode {
    /**
     * {@code 77}: any quantity of the product.
     */
    ANY_QUANTITY,

    /**
     * {@code 77:2}: exactly this quantity.
     */
    EXACT_QUANTITY,

    /**
     * {@code 77:1-3}: a quantity within the inclusive range.
     */
    QUANTITY_RANGE
}
