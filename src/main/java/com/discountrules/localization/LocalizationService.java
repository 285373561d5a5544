package com.discountrules.localization;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Service for the localized strings plugins register on install.
 *
 * Plugin resources are written for the default culture only; translations are
 * added later through the same table.
 */
@Service
@Slf4j
public class LocalizationService {

    private final LocaleStringResourceRepository resourceRepository;
    private final String defaultCulture;

    public LocalizationService(LocaleStringResourceRepository resourceRepository,
                               @Value("${discount-rules.localization.default-culture:en-US}") String defaultCulture) {
        this.resourceRepository = resourceRepository;
        this.defaultCulture = defaultCulture;
    }

    @Transactional
    public void addOrUpdatePluginLocaleResource(String resourceName, String resourceValue) {
        LocaleStringResource resource = resourceRepository
            .findByLanguageCultureAndResourceNameIgnoreCase(defaultCulture, resourceName)
            .orElseGet(() -> new LocaleStringResource(defaultCulture, resourceName, null));
        boolean created = resource.getId() == null;
        resource.setResourceValue(resourceValue);
        resourceRepository.save(resource);

        log.debug("{} locale resource {} [{}]", created ? "Added" : "Updated", resourceName, defaultCulture);
    }

    /**
     * Delete a resource in every culture. Missing resources are ignored.
     */
    @Transactional
    public void deletePluginLocaleResource(String resourceName) {
        List<LocaleStringResource> resources = resourceRepository.findByResourceNameIgnoreCase(resourceName);
        resourceRepository.deleteAll(resources);
        log.debug("Deleted {} locale resource(s) named {}", resources.size(), resourceName);
    }

    @Transactional(readOnly = true)
    public Optional<String> getResource(String resourceName) {
        return resourceRepository.findByLanguageCultureAndResourceNameIgnoreCase(defaultCulture, resourceName)
            .map(LocaleStringResource::getResourceValue);
    }

    @Transactional(readOnly = true)
    public List<LocaleStringResource> getResourcesStartingWith(String prefix) {
        return resourceRepository.findByResourceNameStartingWithIgnoreCase(prefix);
    }
}
