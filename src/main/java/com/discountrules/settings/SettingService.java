package com.discountrules.settings;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Key/value settings store.
 *
 * Keys are matched case-insensitively. Only store-wide values (store id 0) are
 * handled here; per-store overrides are not used by the discount rules.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettingService {

    static final int ALL_STORES = 0;

    private final SettingRepository settingRepository;

    @Transactional(readOnly = true)
    public Optional<String> getSettingByKey(String key) {
        return settingRepository.findByNameIgnoreCaseAndStoreId(normalize(key), ALL_STORES)
            .map(Setting::getValue);
    }

    @Transactional
    public void setSetting(String key, String value) {
        String name = normalize(key);
        Setting setting = settingRepository.findByNameIgnoreCaseAndStoreId(name, ALL_STORES)
            .orElseGet(() -> new Setting(name, null, ALL_STORES));
        setting.setValue(value);
        settingRepository.save(setting);
        log.debug("Saved setting {}", name);
    }

    @Transactional
    public void deleteSetting(String key) {
        settingRepository.findByNameIgnoreCaseAndStoreId(normalize(key), ALL_STORES)
            .ifPresent(setting -> {
                settingRepository.delete(setting);
                log.debug("Deleted setting {}", setting.getName());
            });
    }

    private static String normalize(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Setting key is required");
        }
        return key.trim();
    }
}
