package com.namingtool.service.validation;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Validation metadata attached to a naming response.
 */
public record ExistenceCheckResult(
    boolean validationPerformed,
    boolean existsInTarget,
    List<String> conflictingResources,
    String warning,
    LocalDateTime checkedAt,
    boolean fromCache
) {

    public ExistenceCheckResult {
        conflictingResources = conflictingResources == null ? List.of() : List.copyOf(conflictingResources);
    }

    public static ExistenceCheckResult notPerformed(String warning) {
        return new ExistenceCheckResult(false, false, List.of(), warning, LocalDateTime.now(), false);
    }

    public static ExistenceCheckResult of(ExistenceCheck check, String warning) {
        return new ExistenceCheckResult(true, check.exists(), check.conflictingIdentifiers(), warning,
            LocalDateTime.now(), check.fromCache());
    }
}
