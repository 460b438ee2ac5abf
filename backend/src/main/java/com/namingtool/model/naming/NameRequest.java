package com.namingtool.model.naming;

import com.namingtool.model.component.ComponentOption;
import com.namingtool.model.type.ResourceType;
import lombok.Builder;

import java.util.HashMap;
import java.util.Map;

/**
 * Immutable input to a single composition pass.
 *
 * <p>{@code customComponents} is keyed by normalized component name
 * (see {@link ComponentNames#normalize(String)}).
 */
@Builder(toBuilder = true)
public record NameRequest(
    ResourceType resourceType,
    ComponentOption environment,
    ComponentOption location,
    ComponentOption org,
    ComponentOption unitDept,
    ComponentOption projAppSvc,
    ComponentOption function,
    String resourceInstance,
    Map<String, String> customComponents
) {

    public NameRequest {
        Map<String, String> normalized = new HashMap<>();
        if (customComponents != null) {
            customComponents.forEach((key, value) -> {
                if (value != null) {
                    normalized.put(ComponentNames.normalize(key), value);
                }
            });
        }
        customComponents = Map.copyOf(normalized);
    }
}
