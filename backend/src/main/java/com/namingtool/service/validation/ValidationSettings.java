package com.namingtool.service.validation;

import com.namingtool.config.NamingProperties;
import com.namingtool.model.enums.ConflictStrategy;

import java.time.Duration;

/**
 * Immutable snapshot of the external validation settings. A snapshot is handed to each
 * engine call so that a concurrent update never changes settings mid-resolution.
 */
public record ValidationSettings(
    boolean enabled,
    ConflictResolution conflictResolution,
    Cache cache,
    Duration oracleTimeout
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 100;
    public static final Duration DEFAULT_CACHE_DURATION = Duration.ofMinutes(5);
    public static final Duration DEFAULT_ORACLE_TIMEOUT = Duration.ofSeconds(5);

    public ValidationSettings {
        if (conflictResolution == null) {
            conflictResolution = new ConflictResolution(ConflictStrategy.NOTIFY_ONLY, DEFAULT_MAX_ATTEMPTS, true);
        }
        if (cache == null) {
            cache = new Cache(true, DEFAULT_CACHE_DURATION);
        }
        if (oracleTimeout == null || oracleTimeout.isNegative() || oracleTimeout.isZero()) {
            oracleTimeout = DEFAULT_ORACLE_TIMEOUT;
        }
    }

    public record ConflictResolution(
        ConflictStrategy strategy,
        int maxAttempts,
        boolean includeWarnings
    ) {

        public ConflictResolution {
            if (strategy == null) {
                strategy = ConflictStrategy.NOTIFY_ONLY;
            }
        }
    }

    public record Cache(
        boolean enabled,
        Duration duration
    ) {

        public Cache {
            if (duration == null) {
                duration = DEFAULT_CACHE_DURATION;
            }
        }
    }

    public static ValidationSettings defaults() {
        return new ValidationSettings(false, null, null, null);
    }

    public static ValidationSettings from(NamingProperties.Validation properties) {
        if (properties == null) {
            return defaults();
        }
        return new ValidationSettings(
            properties.enabled(),
            new ConflictResolution(
                ConflictStrategy.fromValue(properties.strategy()),
                properties.maxAttempts(),
                properties.includeWarnings()),
            new Cache(properties.cacheEnabled(), properties.cacheDuration()),
            properties.oracleTimeout());
    }

    public ValidationSettings withStrategy(ConflictStrategy strategy) {
        return new ValidationSettings(enabled,
            new ConflictResolution(strategy, conflictResolution.maxAttempts(), conflictResolution.includeWarnings()),
            cache, oracleTimeout);
    }
}
