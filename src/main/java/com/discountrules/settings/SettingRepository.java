package com.discountrules.settings;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for settings.
 */
@Repository
public interface SettingRepository extends JpaRepository<Setting, Integer> {

    Optional<Setting> findByNameIgnoreCaseAndStoreId(String name, int storeId);
}
