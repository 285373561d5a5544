package com.discountrules.customers;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One line of a customer's shopping cart or wishlist.
 *
 * The same product may appear on several lines (e.g. with distinct attributes),
 * so rules that look at quantities must sum them per product.
 */
@Entity
@Table(name = "shopping_cart_items", indexes = {
    @Index(name = "idx_cart_item_customer_id", columnList = "customer_id")
})
@Data
@NoArgsConstructor
public class ShoppingCartItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "store_id", nullable = false)
    private int storeId;

    @Column(name = "product_id", nullable = false)
    private int productId;

    @Column(nullable = false)
    private int quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "shopping_cart_type", nullable = false)
    private ShoppingCartType shoppingCartType;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public ShoppingCartItem(int storeId, int productId, int quantity, ShoppingCartType shoppingCartType) {
        this.storeId = storeId;
        this.productId = productId;
        this.quantity = quantity;
        this.shoppingCartType = shoppingCartType;
        this.createdAt = Instant.now();
    }
}
