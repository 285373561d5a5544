package com.discountrules.customers;

/**
 * Kind of list a cart item belongs to.
 */
public enum ShoppingCartType {
    /**
     * Items the customer intends to buy.
     */
    SHOPPING_CART,

    /**
     * Items saved for later; never counted by discount rules.
     */
    WISHLIST
}
