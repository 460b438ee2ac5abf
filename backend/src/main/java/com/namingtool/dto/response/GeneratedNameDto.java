package com.namingtool.dto.response;

import com.namingtool.model.naming.ComponentContribution;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Naming history entry as returned to callers.
 */
public record GeneratedNameDto(
    Long id,
    String resourceName,
    String resourceTypeName,
    List<ComponentContribution> components,
    String createdBy,
    String message,
    LocalDateTime createdAt
) {}
