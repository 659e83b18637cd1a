package com.example.schedule.service;

import com.example.schedule.model.Provider;
import com.example.schedule.repository.ProviderRepository;
import com.example.schedule.service.exception.ScheduleStorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Provider-level discoverability, independent of any day or slot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProviderVisibilityService {

    private final ProviderRepository repository;

    @Transactional(readOnly = true)
    public boolean isVisible(String providerId) {
        try {
            return repository.findById(providerId)
                    .map(Provider::isVisible)
                    .orElse(true);
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to load visibility of provider " + providerId, e);
        }
    }

    @Transactional
    public boolean setVisible(String providerId, boolean visible) {
        try {
            Provider provider = loadOrCreate(providerId);
            provider.setVisible(visible);
            repository.save(provider);
        } catch (DataAccessException e) {
            throw new ScheduleStorageException("Failed to save visibility of provider " + providerId, e);
        }
        log.info("Provider {} is now {}", providerId, visible ? "visible" : "hidden");
        return visible;
    }

    private Provider loadOrCreate(String providerId) {
        return repository.findById(providerId)
                .orElse(Provider.builder()
                        .id(providerId)
                        .build());
    }
}
