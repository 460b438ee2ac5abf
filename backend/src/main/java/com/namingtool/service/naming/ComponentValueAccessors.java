package com.namingtool.service.naming;

import com.namingtool.model.component.ComponentOption;
import com.namingtool.model.component.ResourceComponent;
import com.namingtool.model.enums.BuiltInComponent;
import com.namingtool.model.naming.ComponentNames;
import com.namingtool.model.naming.NameRequest;
import com.namingtool.model.type.ResourceType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Typed lookup of a component's value in a {@link NameRequest}.
 *
 * <p>Built-in components read a dedicated request field; custom and free-text
 * components read the custom component map by normalized name.
 */
@Component
public class ComponentValueAccessors {

    /**
     * A component value and the label recorded for it in naming history.
     */
    public record ResolvedValue(String value, String label) {
    }

    private final Map<BuiltInComponent, Function<NameRequest, ResolvedValue>> accessors =
        new EnumMap<>(BuiltInComponent.class);

    public ComponentValueAccessors() {
        accessors.put(BuiltInComponent.RESOURCE_TYPE, request -> ofType(request.resourceType()));
        accessors.put(BuiltInComponent.RESOURCE_ENVIRONMENT, request -> ofOption(request.environment()));
        accessors.put(BuiltInComponent.RESOURCE_LOCATION, request -> ofOption(request.location()));
        accessors.put(BuiltInComponent.RESOURCE_ORG, request -> ofOption(request.org()));
        accessors.put(BuiltInComponent.RESOURCE_UNIT_DEPT, request -> ofOption(request.unitDept()));
        accessors.put(BuiltInComponent.RESOURCE_PROJ_APP_SVC, request -> ofOption(request.projAppSvc()));
        accessors.put(BuiltInComponent.RESOURCE_FUNCTION, request -> ofOption(request.function()));
        accessors.put(BuiltInComponent.RESOURCE_INSTANCE, request -> ofRaw(request.resourceInstance()));
    }

    /**
     * Resolve the value of a component, or empty when the request does not supply one.
     */
    public Optional<ResolvedValue> resolve(ResourceComponent component, NameRequest request) {
        ResolvedValue resolved;
        if (component.isCustom() || component.isFreeText()) {
            resolved = ofRaw(request.customComponents().get(ComponentNames.normalize(component.getName())));
        } else {
            resolved = BuiltInComponent.fromComponentName(component.getName())
                .map(accessors::get)
                .map(accessor -> accessor.apply(request))
                .orElse(null);
        }
        return Optional.ofNullable(resolved);
    }

    private static ResolvedValue ofType(ResourceType type) {
        if (type == null || isEmpty(type.getShortName())) {
            return null;
        }
        return new ResolvedValue(type.getShortName().toLowerCase(Locale.ROOT),
            type.getResource() + " (" + type.getShortName() + ")");
    }

    private static ResolvedValue ofOption(ComponentOption option) {
        if (option == null || isEmpty(option.getShortName())) {
            return null;
        }
        return new ResolvedValue(option.getShortName().toLowerCase(Locale.ROOT),
            option.getName() + " (" + option.getShortName() + ")");
    }

    private static ResolvedValue ofRaw(String value) {
        if (isEmpty(value)) {
            return null;
        }
        return new ResolvedValue(value, value);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
