package com.discountrules.customers;

import com.discountrules.common.exception.CustomerNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for customers and their cart contents.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CustomerService {

    private final CustomerRepository customerRepository;

    @Transactional
    public Customer createCustomer(String email) {
        Customer customer = customerRepository.save(new Customer(email));
        log.info("Created customer {} ({})", customer.getId(), email);
        return customer;
    }

    @Transactional(readOnly = true)
    public Customer getCustomer(int customerId) {
        return customerRepository.findById(customerId)
            .orElseThrow(() -> new CustomerNotFoundException(customerId));
    }

    @Transactional
    public Customer addToCart(int customerId, int storeId, int productId, int quantity,
                              ShoppingCartType shoppingCartType) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }

        Customer customer = getCustomer(customerId);
        customer.addShoppingCartItem(new ShoppingCartItem(storeId, productId, quantity, shoppingCartType));
        customerRepository.save(customer);

        log.debug("Added product {} x{} to {} of customer {} in store {}",
            productId, quantity, shoppingCartType, customerId, storeId);
        return customer;
    }
}
