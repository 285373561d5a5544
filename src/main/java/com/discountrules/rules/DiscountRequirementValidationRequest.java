package com.discountrules.rules;

import com.discountrules.customers.Customer;
import com.discountrules.stores.Store;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Everything a rule needs to check one discount requirement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiscountRequirementValidationRequest {

    /**
     * Requirement being checked; rules key their configuration on it.
     */
    private int discountRequirementId;

    /**
     * Customer whose cart is checked. Null for anonymous checks.
     */
    private Customer customer;

    /**
     * Store the cart belongs to.
     */
    private Store store;
}
