package com.namingtool.dto.request;

import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * Generate names for several resource types from one set of components.
 * {@code resourceTypeOverrides} is keyed by resource type short name.
 */
@Builder
public record BulkResourceNameRequest(
    List<String> resourceTypes,
    String resourceEnvironment,
    String resourceLocation,
    String resourceOrg,
    String resourceUnitDept,
    String resourceProjAppSvc,
    String resourceFunction,
    String resourceInstance,
    Map<String, String> customComponents,
    Map<String, ResourceTypeOverride> resourceTypeOverrides,
    Boolean continueOnError,
    boolean validateOnly,
    String createdBy
) {

    public BulkResourceNameRequest {
        resourceTypes = resourceTypes == null ? List.of() : List.copyOf(resourceTypes);
        customComponents = customComponents == null ? Map.of() : customComponents;
        resourceTypeOverrides = resourceTypeOverrides == null ? Map.of() : resourceTypeOverrides;
        continueOnError = continueOnError == null ? Boolean.TRUE : continueOnError;
        createdBy = createdBy == null || createdBy.isBlank() ? "System" : createdBy;
    }

    /**
     * Per-type component values; non-empty fields replace the shared ones.
     */
    @Builder
    public record ResourceTypeOverride(
        String resourceEnvironment,
        String resourceLocation,
        String resourceOrg,
        String resourceUnitDept,
        String resourceProjAppSvc,
        String resourceFunction,
        String resourceInstance,
        Map<String, String> customComponents
    ) {}
}
