package com.discountrules.rules.hasoneproduct;

import lombok.Value;

/**
 * One entry of a restricted product list: a product id plus an optional
 * quantity constraint, tagged by {@link RestrictionMode}.
 */
@Value
public class RestrictedProduct {
    int productId;
    RestrictionMode mode;
    int quantity;
    int minQuantity;
    int maxQuantity;

    public static RestrictedProduct anyQuantity(int productId) {
        return new RestrictedProduct(productId, RestrictionMode.ANY_QUANTITY, 0, 0, 0);
    }

    public static RestrictedProduct exactQuantity(int productId, int quantity) {
        return new RestrictedProduct(productId, RestrictionMode.EXACT_QUANTITY, quantity, 0, 0);
    }

    public static RestrictedProduct quantityRange(int productId, int minQuantity, int maxQuantity) {
        return new RestrictedProduct(productId, RestrictionMode.QUANTITY_RANGE, 0, minQuantity, maxQuantity);
    }

    /**
     * Whether a cart line satisfies this restriction. A reversed range never matches.
     */
    public boolean matches(CartLine line) {
        if (line.getProductId() != productId) {
            return false;
        }

        int total = line.getTotalQuantity();
        return switch (mode) {
            case ANY_QUANTITY -> true;
            case EXACT_QUANTITY -> total == quantity;
            case QUANTITY_RANGE -> minQuantity <= total && total <= maxQuantity;
        };
    }
}
