package com.discountrules.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current configuration shown on the rule's admin screen.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RequirementConfigurationResponse {

    private int discountId;
    private Integer requirementId;
    private String productIds;
}
