package com.namingtool.service.validation;

import com.namingtool.config.NamingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current validation settings. Readers take a snapshot; an update swaps the
 * snapshot atomically and drops every cached existence check.
 */
@Slf4j
@Service
public class ValidationSettingsService {

    private final AtomicReference<ValidationSettings> current;
    private final ValidationResultCache cache;

    public ValidationSettingsService(NamingProperties properties, ValidationResultCache cache) {
        this.current = new AtomicReference<>(ValidationSettings.from(properties.validation()));
        this.cache = cache;
    }

    public ValidationSettings getSettings() {
        return current.get();
    }

    public ValidationSettings update(ValidationSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("Validation settings must not be null");
        }
        current.set(settings);
        cache.invalidatePrefix(ExistenceCheckService.CACHE_KEY_PREFIX);
        log.info("Validation settings updated: enabled={}, strategy={}, maxAttempts={}",
            settings.enabled(),
            settings.conflictResolution().strategy().getValue(),
            settings.conflictResolution().maxAttempts());
        return settings;
    }
}
