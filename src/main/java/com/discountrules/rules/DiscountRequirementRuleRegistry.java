package com.discountrules.rules;

import com.discountrules.common.exception.DiscountRuleNotFoundException;
import com.discountrules.customers.Customer;
import com.discountrules.customers.CustomerService;
import com.discountrules.discounts.DiscountRequirement;
import com.discountrules.discounts.DiscountService;
import com.discountrules.stores.Store;
import com.discountrules.stores.StoreService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Registry of every discount requirement rule in the application.
 *
 * Requirements refer to their rule by system name; the registry resolves that
 * name and runs the rule against a customer's cart.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscountRequirementRuleRegistry {

    private final List<DiscountRequirementRule> rules;
    private final DiscountService discountService;
    private final CustomerService customerService;
    private final StoreService storeService;

    public List<DiscountRequirementRule> getRules() {
        return rules;
    }

    public DiscountRequirementRule loadRuleBySystemName(String systemName) {
        return rules.stream()
            .filter(rule -> rule.getSystemName().equalsIgnoreCase(systemName))
            .findFirst()
            .orElseThrow(() -> new DiscountRuleNotFoundException(systemName));
    }

    /**
     * Check a stored requirement for a customer in a store.
     *
     * @param discountRequirementId the requirement to check
     * @param customerId            the customer, or null to check without one
     * @param storeId               the store the cart belongs to
     * @return the result of the requirement's rule
     */
    @Transactional(readOnly = true)
    public DiscountRequirementValidationResult checkRequirement(int discountRequirementId,
                                                               Integer customerId, int storeId) {
        DiscountRequirement requirement = discountService.getDiscountRequirement(discountRequirementId);
        DiscountRequirementRule rule = loadRuleBySystemName(requirement.getDiscountRequirementRuleSystemName());

        Store store = storeService.getStore(storeId);
        Customer customer = customerId != null ? customerService.getCustomer(customerId) : null;

        log.debug("Checking requirement {} with rule {} for customer {} in store {}",
            discountRequirementId, rule.getSystemName(), customerId, storeId);

        DiscountRequirementValidationResult result = rule.checkRequirement(
            DiscountRequirementValidationRequest.builder()
                .discountRequirementId(discountRequirementId)
                .customer(customer)
                .store(store)
                .build());

        log.info("Requirement {} ({}) {} for customer {}", discountRequirementId, rule.getSystemName(),
            result.isValid() ? "met" : "not met", customerId);
        return result;
    }
}
