package com.discountrules.stores;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for store persistence.
 */
@Repository
public interface StoreRepository extends JpaRepository<Store, Integer> {
}
