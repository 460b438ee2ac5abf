package com.namingtool.service.validation;

import java.util.List;

/**
 * Answer from an {@link ExistenceOracle}. {@code fromCache} is set when the answer was served
 * by {@link ValidationResultCache} instead of the oracle.
 */
public record ExistenceCheck(
    boolean exists,
    List<String> conflictingIdentifiers,
    boolean fromCache
) {

    public ExistenceCheck {
        conflictingIdentifiers = conflictingIdentifiers == null ? List.of() : List.copyOf(conflictingIdentifiers);
    }

    public static ExistenceCheck notFound() {
        return new ExistenceCheck(false, List.of(), false);
    }

    public static ExistenceCheck found(List<String> conflictingIdentifiers) {
        return new ExistenceCheck(true, conflictingIdentifiers, false);
    }

    public ExistenceCheck asCached() {
        return new ExistenceCheck(exists, conflictingIdentifiers, true);
    }
}
