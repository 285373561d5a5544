package com.discountrules.stores;

import com.discountrules.common.exception.StoreNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Service for store lookup and creation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoreService {

    private final StoreRepository storeRepository;

    @Transactional
    public Store createStore(String name) {
        Store store = storeRepository.save(new Store(name));
        log.info("Created store {} ({})", store.getId(), name);
        return store;
    }

    @Transactional(readOnly = true)
    public Store getStore(int storeId) {
        return storeRepository.findById(storeId)
            .orElseThrow(() -> new StoreNotFoundException(storeId));
    }
}
