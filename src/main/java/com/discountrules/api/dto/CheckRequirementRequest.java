package com.discountrules.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for checking a discount requirement against a customer's cart.
 */
@Data
public class CheckRequirementRequest {

    /**
     * Customer to check; leave empty to check without a customer.
     */
    private Integer customerId;

    @NotNull(message = "Store ID is required")
    private Integer storeId;
}
