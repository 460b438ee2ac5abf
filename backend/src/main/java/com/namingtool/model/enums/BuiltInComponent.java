package com.namingtool.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import com.namingtool.model.naming.ComponentNames;

import java.util.Optional;

/**
 * Reserved component names. A built-in component reads its value from a typed
 * field of the naming request rather than from the custom component map.
 */
public enum BuiltInComponent {
    RESOURCE_TYPE("ResourceType"),
    RESOURCE_ENVIRONMENT("ResourceEnvironment"),
    RESOURCE_LOCATION("ResourceLocation"),
    RESOURCE_ORG("ResourceOrg"),
    RESOURCE_UNIT_DEPT("ResourceUnitDept"),
    RESOURCE_PROJ_APP_SVC("ResourceProjAppSvc"),
    RESOURCE_FUNCTION("ResourceFunction"),
    RESOURCE_INSTANCE("ResourceInstance");

    private final String value;

    BuiltInComponent(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether values for this component come from a configured option list.
     */
    public boolean hasOptions() {
        return this != RESOURCE_TYPE && this != RESOURCE_INSTANCE;
    }

    public static BuiltInComponent fromValue(String value) {
        for (BuiltInComponent component : values()) {
            if (component.value.equals(value)) {
                return component;
            }
        }
        throw new IllegalArgumentException("Unknown BuiltInComponent: " + value);
    }

    /**
     * Match a component name against the built-ins, ignoring case, spaces and the "Resource" prefix.
     */
    public static Optional<BuiltInComponent> fromComponentName(String name) {
        String normalized = ComponentNames.normalize(name);
        for (BuiltInComponent component : values()) {
            if (ComponentNames.normalize(component.value).equals(normalized)) {
                return Optional.of(component);
            }
        }
        return Optional.empty();
    }
}
