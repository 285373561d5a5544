package com.discountrules.rules.hasoneproduct;

import com.discountrules.customers.ShoppingCartItem;
import com.discountrules.customers.ShoppingCartType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for cart aggregation.
 */
class CartLineTest {

    private static final int STORE_ID = 1;
    private static final int OTHER_STORE_ID = 2;

    @Test
    void testQuantitiesAreSummedPerProduct() {
        List<ShoppingCartItem> items = List.of(
            new ShoppingCartItem(STORE_ID, 10, 1, ShoppingCartType.SHOPPING_CART),
            new ShoppingCartItem(STORE_ID, 20, 4, ShoppingCartType.SHOPPING_CART),
            new ShoppingCartItem(STORE_ID, 10, 2, ShoppingCartType.SHOPPING_CART)
        );

        List<CartLine> lines = CartLine.groupByProduct(items, STORE_ID);

        assertEquals(List.of(new CartLine(10, 3), new CartLine(20, 4)), lines);
    }

    @Test
    void testWishlistAndOtherStoresAreExcluded() {
        List<ShoppingCartItem> items = List.of(
            new ShoppingCartItem(STORE_ID, 10, 1, ShoppingCartType.SHOPPING_CART),
            new ShoppingCartItem(STORE_ID, 10, 5, ShoppingCartType.WISHLIST),
            new ShoppingCartItem(OTHER_STORE_ID, 10, 7, ShoppingCartType.SHOPPING_CART)
        );

        List<CartLine> lines = CartLine.groupByProduct(items, STORE_ID);

        assertEquals(List.of(new CartLine(10, 1)), lines);
    }

    @Test
    void testAllStoresAreCountedWithoutStoreFilter() {
        List<ShoppingCartItem> items = List.of(
            new ShoppingCartItem(STORE_ID, 10, 1, ShoppingCartType.SHOPPING_CART),
            new ShoppingCartItem(OTHER_STORE_ID, 10, 7, ShoppingCartType.SHOPPING_CART)
        );

        List<CartLine> lines = CartLine.groupByProduct(items, null);

        assertEquals(List.of(new CartLine(10, 8)), lines);
    }

    @Test
    void testEmptyCart() {
        assertTrue(CartLine.groupByProduct(List.of(), STORE_ID).isEmpty());
    }
}
