package com.discountrules.discounts;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for discount persistence.
 */
@Repository
public interface DiscountRepository extends JpaRepository<Discount, Integer> {
}
