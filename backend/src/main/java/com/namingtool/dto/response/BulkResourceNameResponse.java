package com.namingtool.dto.response;

import com.namingtool.service.validation.ExistenceCheckResult;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of a bulk naming request.
 */
public record BulkResourceNameResponse(
    boolean success,
    String message,
    int totalRequested,
    int successCount,
    int failureCount,
    List<BulkResourceNameResult> results,
    LocalDateTime processedAt
) {

    /**
     * Outcome for one resource type of the bulk request.
     */
    public record BulkResourceNameResult(
        String resourceType,
        boolean success,
        String resourceName,
        String errorMessage,
        GeneratedNameDto resourceNameDetails,
        ExistenceCheckResult validationMetadata
    ) {}
}
