package com.namingtool.service.naming;

import com.namingtool.model.enums.ConflictStrategy;
import com.namingtool.model.enums.ResolutionFailure;
import com.namingtool.model.type.ResourceType;
import com.namingtool.service.validation.ExistenceCheck;
import com.namingtool.service.validation.ExistenceCheckException;
import com.namingtool.service.validation.ExistenceCheckService;
import com.namingtool.service.validation.ValidationSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Random;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conflict Resolution Service
 *
 * Decides what happens when a name already exists in the external namespace:
 * - FAIL: reject without consulting the namespace
 * - NOTIFY_ONLY: keep the name, attach a warning on conflict
 * - AUTO_INCREMENT: bump the trailing instance number until a free name is found
 * - SUFFIX_RANDOM: append a random suffix until a free name is found
 */
@Slf4j
@Service
public class ConflictResolutionService {

    static final int MAX_RANDOM_SUFFIX_ATTEMPTS = 50;
    static final int RANDOM_SUFFIX_LENGTH = 6;
    private static final String SUFFIX_ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";

    private static final Pattern HYPHEN_INSTANCE = Pattern.compile("-(\\d+)$");
    private static final Pattern BARE_INSTANCE = Pattern.compile("(\\d+)$");

    private final ExistenceCheckService existenceCheckService;
    private final Random random;

    @Autowired
    public ConflictResolutionService(ExistenceCheckService existenceCheckService) {
        this(existenceCheckService, new SecureRandom());
    }

    ConflictResolutionService(ExistenceCheckService existenceCheckService, Random random) {
        this.existenceCheckService = existenceCheckService;
        this.random = random;
    }

    /**
     * Result of a conflict resolution. {@code finalName} equals {@code originalName} on failure,
     * except after an exhausted auto-increment, where it holds the last candidate tried.
     */
    public record ConflictResolutionOutcome(
        String originalName,
        String finalName,
        ConflictStrategy strategy,
        boolean success,
        int attempts,
        String warning,
        String errorMessage,
        ResolutionFailure failureReason
    ) {

        public boolean nameChanged() {
            return success && finalName != null && !finalName.equals(originalName);
        }
    }

    public ConflictResolutionOutcome resolve(String originalName, ResourceType resourceType, ValidationSettings settings) {
        ConflictStrategy strategy = settings.conflictResolution().strategy();
        ConflictResolutionOutcome outcome;
        try {
            outcome = switch (strategy) {
                case FAIL -> fail(originalName);
                case NOTIFY_ONLY -> notifyOnly(originalName, resourceType, settings);
                case AUTO_INCREMENT -> autoIncrement(originalName, resourceType, settings);
                case SUFFIX_RANDOM -> suffixRandom(originalName, resourceType, settings);
            };
        } catch (RuntimeException e) {
            log.error("Conflict resolution failed for {}", originalName, e);
            return new ConflictResolutionOutcome(originalName, originalName, strategy, false, 0, null,
                "Conflict resolution failed: " + e.getMessage(), ResolutionFailure.ERROR);
        }

        log.info("Conflict resolved using {}: {} -> {} (Attempts: {})",
            strategy.getValue(), outcome.originalName(), outcome.finalName(), outcome.attempts());
        return outcome;
    }

    // ========================================================================
    // Strategies
    // ========================================================================

    private ConflictResolutionOutcome fail(String originalName) {
        return new ConflictResolutionOutcome(originalName, originalName, ConflictStrategy.FAIL, false, 0,
            "Conflict resolution strategy is set to 'Fail'. Resource name must be unique.",
            "Name conflict: '" + originalName + "' already exists in Azure and conflict strategy is set to Fail.",
            ResolutionFailure.CONFLICT);
    }

    private ConflictResolutionOutcome notifyOnly(String originalName, ResourceType resourceType, ValidationSettings settings) {
        boolean includeWarnings = settings.conflictResolution().includeWarnings();
        ExistenceCheck check;
        try {
            check = existenceCheckService.check(originalName, resourceType, settings);
        } catch (ExistenceCheckException e) {
            log.warn("Could not verify {} during notify-only resolution: {}", originalName, e.getMessage());
            String warning = includeWarnings
                ? "Warning: Name '" + originalName + "' could not be verified against Azure: " + e.getMessage()
                : null;
            return new ConflictResolutionOutcome(originalName, originalName, ConflictStrategy.NOTIFY_ONLY, true, 1,
                warning, null, ResolutionFailure.NONE);
        }

        String warning = null;
        if (check.exists() && includeWarnings) {
            int count = check.conflictingIdentifiers().size();
            warning = count > 0
                ? "Warning: Name '" + originalName + "' already exists in Azure (" + count + " conflicting resource(s) found)."
                : "Warning: Name '" + originalName + "' already exists in Azure.";
        }
        return new ConflictResolutionOutcome(originalName, originalName, ConflictStrategy.NOTIFY_ONLY, true, 1,
            warning, null, ResolutionFailure.NONE);
    }

    private ConflictResolutionOutcome autoIncrement(String originalName, ResourceType resourceType, ValidationSettings settings) {
        Matcher matcher = HYPHEN_INSTANCE.matcher(originalName);
        String separator = "-";
        if (!matcher.find()) {
            matcher = BARE_INSTANCE.matcher(originalName);
            separator = "";
            if (!matcher.find()) {
                return new ConflictResolutionOutcome(originalName, originalName, ConflictStrategy.AUTO_INCREMENT,
                    false, 0,
                    "Original name does not contain an instance number (e.g., -001 or 001). Cannot auto-increment.",
                    "Cannot auto-increment: No instance number pattern found in name",
                    ResolutionFailure.NO_INSTANCE_PATTERN);
            }
        }

        String digits = matcher.group(1);
        String prefix = originalName.substring(0, matcher.start()) + separator;
        int width = digits.length();
        BigInteger number = new BigInteger(digits);
        int maxAttempts = Math.max(1, settings.conflictResolution().maxAttempts());

        String candidate = originalName;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(originalName, ConflictStrategy.AUTO_INCREMENT, attempt - 1);
            }
            number = number.add(BigInteger.ONE);
            candidate = prefix + pad(number, width);

            ExistenceCheck check;
            try {
                check = existenceCheckService.check(candidate, resourceType, settings);
            } catch (ExistenceCheckException e) {
                return oracleFailure(originalName, ConflictStrategy.AUTO_INCREMENT, attempt, e);
            }

            if (!check.exists()) {
                String warning = settings.conflictResolution().includeWarnings()
                    ? "Original name '" + originalName + "' exists in Azure. Auto-incremented to '" + candidate + "'."
                    : null;
                return new ConflictResolutionOutcome(originalName, candidate, ConflictStrategy.AUTO_INCREMENT,
                    true, attempt, warning, null, ResolutionFailure.NONE);
            }
        }

        return new ConflictResolutionOutcome(originalName, candidate, ConflictStrategy.AUTO_INCREMENT, false,
            maxAttempts,
            "Exceeded maximum auto-increment attempts (" + maxAttempts + "). Last tried: " + candidate,
            "Could not find unique name after " + maxAttempts + " attempts",
            ResolutionFailure.EXHAUSTED);
    }

    private ConflictResolutionOutcome suffixRandom(String originalName, ResourceType resourceType, ValidationSettings settings) {
        int maxAttempts = Math.min(Math.max(1, settings.conflictResolution().maxAttempts()), MAX_RANDOM_SUFFIX_ATTEMPTS);

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(originalName, ConflictStrategy.SUFFIX_RANDOM, attempt - 1);
            }
            String candidate = originalName + "-" + randomSuffix();

            ExistenceCheck check;
            try {
                check = existenceCheckService.check(candidate, resourceType, settings);
            } catch (ExistenceCheckException e) {
                return oracleFailure(originalName, ConflictStrategy.SUFFIX_RANDOM, attempt, e);
            }

            if (!check.exists()) {
                String warning = settings.conflictResolution().includeWarnings()
                    ? "Original name '" + originalName + "' exists in Azure. Added random suffix: '" + candidate + "'."
                    : null;
                return new ConflictResolutionOutcome(originalName, candidate, ConflictStrategy.SUFFIX_RANDOM,
                    true, attempt, warning, null, ResolutionFailure.NONE);
            }
        }

        return new ConflictResolutionOutcome(originalName, originalName, ConflictStrategy.SUFFIX_RANDOM, false,
            maxAttempts, null,
            "Could not generate unique name with random suffix after " + maxAttempts + " attempts",
            ResolutionFailure.EXHAUSTED);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private ConflictResolutionOutcome oracleFailure(String originalName, ConflictStrategy strategy, int attempts,
                                                    ExistenceCheckException e) {
        if (Thread.currentThread().isInterrupted()) {
            return cancelled(originalName, strategy, attempts);
        }
        log.warn("Existence check failed during {} resolution of {}: {}", strategy.getValue(), originalName, e.getMessage());
        return new ConflictResolutionOutcome(originalName, originalName, strategy, false, attempts, null,
            "Name availability could not be verified: " + e.getMessage(), ResolutionFailure.ORACLE_FAILURE);
    }

    private ConflictResolutionOutcome cancelled(String originalName, ConflictStrategy strategy, int attempts) {
        return new ConflictResolutionOutcome(originalName, originalName, strategy, false, attempts, null,
            "Conflict resolution was cancelled", ResolutionFailure.CANCELLED);
    }

    private static String pad(BigInteger number, int width) {
        String value = number.toString();
        if (value.length() >= width) {
            return value;
        }
        return "0".repeat(width - value.length()) + value;
    }

    private String randomSuffix() {
        StringBuilder suffix = new StringBuilder(RANDOM_SUFFIX_LENGTH);
        for (int i = 0; i < RANDOM_SUFFIX_LENGTH; i++) {
            suffix.append(SUFFIX_ALPHABET.charAt(random.nextInt(SUFFIX_ALPHABET.length())));
        }
        return suffix.toString();
    }
}
