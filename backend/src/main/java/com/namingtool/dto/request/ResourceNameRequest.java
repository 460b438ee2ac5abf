package com.namingtool.dto.request;

import lombok.Builder;

import java.util.Map;

/**
 * Naming request carrying component short names, e.g. {@code resourceEnvironment = "dev"}.
 * {@code resourceId} is only needed when several resource types share one short name.
 */
@Builder(toBuilder = true)
public record ResourceNameRequest(
    String resourceType,
    String resourceEnvironment,
    String resourceLocation,
    String resourceOrg,
    String resourceUnitDept,
    String resourceProjAppSvc,
    String resourceFunction,
    String resourceInstance,
    Map<String, String> customComponents,
    Long resourceId,
    String createdBy
) {

    public ResourceNameRequest {
        customComponents = customComponents == null ? Map.of() : customComponents;
        createdBy = createdBy == null || createdBy.isBlank() ? "System" : createdBy;
    }
}
