package com.discountrules.discounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for discount requirement persistence.
 */
@Repository
public interface DiscountRequirementRepository extends JpaRepository<DiscountRequirement, Integer> {

    List<DiscountRequirement> findByDiscountId(int discountId);
}
