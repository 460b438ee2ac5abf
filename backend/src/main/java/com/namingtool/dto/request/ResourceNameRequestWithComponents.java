package com.namingtool.dto.request;

import com.namingtool.model.component.ComponentOption;
import com.namingtool.model.delimiter.ResourceDelimiter;
import com.namingtool.model.type.ResourceType;
import lombok.Builder;

import java.util.Map;

/**
 * Naming request carrying the resolved configuration objects and an explicit delimiter.
 */
@Builder
public record ResourceNameRequestWithComponents(
    ResourceDelimiter resourceDelimiter,
    ResourceType resourceType,
    ComponentOption resourceEnvironment,
    ComponentOption resourceLocation,
    ComponentOption resourceOrg,
    ComponentOption resourceUnitDept,
    ComponentOption resourceProjAppSvc,
    ComponentOption resourceFunction,
    String resourceInstance,
    Map<String, String> customComponents,
    String createdBy
) {

    public ResourceNameRequestWithComponents {
        customComponents = customComponents == null ? Map.of() : customComponents;
        createdBy = createdBy == null || createdBy.isBlank() ? "System" : createdBy;
    }
}
