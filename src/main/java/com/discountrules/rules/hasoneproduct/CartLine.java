package com.discountrules.rules.hasoneproduct;

import com.discountrules.customers.ShoppingCartItem;
import com.discountrules.customers.ShoppingCartType;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Total quantity of one product in a shopping cart.
 */
@Value
public class CartLine {
    int productId;
    int totalQuantity;

    /**
     * Group shopping cart items by product and sum their quantities.
     *
     * The same product can sit on several lines (distinct attributes), so the
     * total is what quantity constraints compare against. Wishlist items are
     * never counted.
     *
     * @param items   all cart items of a customer
     * @param storeId the store to count, or null to count every store
     * @return one line per product, in order of first appearance
     */
    public static List<CartLine> groupByProduct(List<ShoppingCartItem> items, Integer storeId) {
        Map<Integer, Integer> totals = items.stream()
            .filter(item -> item.getShoppingCartType() == ShoppingCartType.SHOPPING_CART)
            .filter(item -> storeId == null || item.getStoreId() == storeId)
            .collect(Collectors.groupingBy(ShoppingCartItem::getProductId, LinkedHashMap::new,
                Collectors.summingInt(ShoppingCartItem::getQuantity)));

        return totals.entrySet().stream()
            .map(entry -> new CartLine(entry.getKey(), entry.getValue()))
            .collect(Collectors.toList());
    }
}
