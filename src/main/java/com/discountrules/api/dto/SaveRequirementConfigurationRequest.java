package com.discountrules.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * DTO for saving the restricted product list of a requirement.
 */
@Data
public class SaveRequirementConfigurationRequest {

    @NotNull(message = "Discount ID is required")
    private Integer discountId;

    /**
     * Requirement to update; leave empty to create a new one.
     */
    private Integer discountRequirementId;

    /**
     * Comma-separated list, e.g. "77, 123:2, 156:3-8".
     */
    private String productIds;
}
