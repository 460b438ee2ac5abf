package com.namingtool.dto.request;

/**
 * Validate an existing name against a resource type, given by id or short name.
 */
public record ValidateNameRequest(
    Long resourceTypeId,
    String resourceType,
    String name
) {}
