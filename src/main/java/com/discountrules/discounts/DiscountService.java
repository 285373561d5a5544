package com.discountrules.discounts;

import com.discountrules.common.exception.DiscountNotFoundException;
import com.discountrules.common.exception.DiscountRequirementNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for discounts and their requirement records.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscountService {

    private final DiscountRepository discountRepository;
    private final DiscountRequirementRepository discountRequirementRepository;

    @Transactional
    public Discount createDiscount(String name) {
        Discount discount = discountRepository.save(new Discount(name));
        log.info("Created discount {} ({})", discount.getId(), name);
        return discount;
    }

    @Transactional(readOnly = true)
    public Discount getDiscount(int discountId) {
        return discountRepository.findById(discountId)
            .orElseThrow(() -> new DiscountNotFoundException(discountId));
    }

    @Transactional(readOnly = true)
    public List<DiscountRequirement> getAllDiscountRequirements() {
        return discountRequirementRepository.findAll();
    }

    @Transactional(readOnly = true)
    public List<DiscountRequirement> getRequirementsForDiscount(int discountId) {
        return discountRequirementRepository.findByDiscountId(discountId);
    }

    @Transactional(readOnly = true)
    public DiscountRequirement getDiscountRequirement(int discountRequirementId) {
        return discountRequirementRepository.findById(discountRequirementId)
            .orElseThrow(() -> new DiscountRequirementNotFoundException(discountRequirementId));
    }

    @Transactional
    public DiscountRequirement insertDiscountRequirement(int discountId, String ruleSystemName) {
        // Requirements can only hang off an existing discount
        getDiscount(discountId);

        DiscountRequirement requirement = discountRequirementRepository.save(
            new DiscountRequirement(discountId, ruleSystemName));
        log.info("Added requirement {} ({}) to discount {}",
            requirement.getId(), ruleSystemName, discountId);
        return requirement;
    }

    @Transactional
    public void deleteDiscountRequirement(DiscountRequirement requirement) {
        if (requirement.getId() == null || !discountRequirementRepository.existsById(requirement.getId())) {
            log.debug("Discount requirement {} already removed", requirement.getId());
            return;
        }
        discountRequirementRepository.delete(requirement);
        log.info("Deleted requirement {} ({}) from discount {}", requirement.getId(),
            requirement.getDiscountRequirementRuleSystemName(), requirement.getDiscountId());
    }
}
