package com.namingtool.dto.response;

import com.namingtool.service.validation.ExistenceCheckResult;

/**
 * Result of a single naming request. {@code details} is set when the name was recorded.
 */
public record ResourceNameResponse(
    boolean success,
    String resourceName,
    String message,
    GeneratedNameDto details,
    ExistenceCheckResult validationMetadata
) {

    public static ResourceNameResponse failure(String resourceName, String message) {
        return new ResourceNameResponse(false, resourceName, message, null, null);
    }
}
