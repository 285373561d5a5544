package com.discountrules.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a discount requirement check.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckRequirementResponse {

    private int discountRequirementId;
    private boolean valid;
}
