package com.discountrules.rules;

import com.discountrules.plugins.Plugin;

/**
 * Interface for discount requirement rules.
 *
 * Each rule checks one kind of requirement attached to a discount and returns
 * a result indicating whether the requirement is met.
 */
public interface DiscountRequirementRule extends Plugin {

    /**
     * Check the requirement against a customer and store.
     *
     * @param request the requirement, customer and store to check
     * @return the result of the check
     * @throws IllegalArgumentException if the request is null
     */
    DiscountRequirementValidationResult checkRequirement(DiscountRequirementValidationRequest request);

    /**
     * Get the relative URL of the admin screen that configures this rule.
     *
     * @param discountId            the discount being edited
     * @param discountRequirementId the requirement being edited, or null for a new one
     */
    String getConfigurationUrl(int discountId, Integer discountRequirementId);

    /**
     * Get the system name requirements use to refer to this rule.
     */
    String getSystemName();
}
