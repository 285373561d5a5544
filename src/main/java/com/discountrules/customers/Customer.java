package com.discountrules.customers;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A customer together with every item in their carts (all stores, all cart types).
 */
@Entity
@Table(name = "customers")
@Data
@NoArgsConstructor
public class Customer {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    private String email;

    @OneToMany(cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @JoinColumn(name = "customer_id")
    private List<ShoppingCartItem> shoppingCartItems = new ArrayList<>();

    public Customer(String email) {
        this.email = email;
    }

    public void addShoppingCartItem(ShoppingCartItem item) {
        shoppingCartItems.add(item);
    }
}
