package com.discountrules.rules.hasoneproduct;

import com.discountrules.discounts.DiscountRequirement;
import com.discountrules.discounts.DiscountService;
import com.discountrules.settings.SettingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Backs the admin screen that edits the restricted product list of a requirement.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HasOneProductConfigurationService {

    private final DiscountService discountService;
    private final SettingService settingService;

    /**
     * Load the restricted product list of a requirement.
     *
     * @param discountId            the discount being edited; must exist
     * @param discountRequirementId the requirement being edited, or null for a new one
     * @return the stored list, or an empty string when none is stored yet
     */
    @Transactional(readOnly = true)
    public String getRestrictedProductIds(int discountId, Integer discountRequirementId) {
        discountService.getDiscount(discountId);

        if (discountRequirementId == null) {
            return "";
        }

        discountService.getDiscountRequirement(discountRequirementId);
        return settingService.getSettingByKey(HasOneProductDefaults.settingsKey(discountRequirementId))
            .orElse("");
    }

    /**
     * Save the restricted product list, creating the requirement if it does not exist yet.
     *
     * @return the id of the saved requirement
     */
    @Transactional
    public int saveRestrictedProductIds(int discountId, Integer discountRequirementId, String productIds) {
        discountService.getDiscount(discountId);

        DiscountRequirement requirement = discountRequirementId != null
            ? discountService.getDiscountRequirement(discountRequirementId)
            : discountService.insertDiscountRequirement(discountId, HasOneProductDefaults.SYSTEM_NAME);

        String value = productIds != null ? productIds.trim() : "";
        settingService.setSetting(HasOneProductDefaults.settingsKey(requirement.getId()), value);

        log.info("Saved restricted products '{}' for requirement {} of discount {}",
            value, requirement.getId(), discountId);
        return requirement.getId();
    }
}
