package com.discountrules.localization;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for localized string resources.
 */
@Repository
public interface LocaleStringResourceRepository extends JpaRepository<LocaleStringResource, Integer> {

    Optional<LocaleStringResource> findByLanguageCultureAndResourceNameIgnoreCase(String languageCulture,
                                                                                String resourceName);

    List<LocaleStringResource> findByResourceNameIgnoreCase(String resourceName);

    List<LocaleStringResource> findByResourceNameStartingWithIgnoreCase(String prefix);
}
