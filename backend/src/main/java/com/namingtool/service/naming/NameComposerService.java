package com.namingtool.service.naming;

import com.namingtool.model.component.ResourceComponent;
import com.namingtool.model.enums.BuiltInComponent;
import com.namingtool.model.naming.ComponentContribution;
import com.namingtool.model.naming.ComponentNames;
import com.namingtool.model.naming.NameRequest;
import com.namingtool.model.type.ResourceType;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Name Composer Service
 *
 * Assembles a resource name from the ordered components in a single left-to-right pass:
 * - Static resource type values short-circuit composition
 * - Excluded components are skipped, optional ones may be absent
 * - The delimiter is placed between contributing components unless the type forbids it
 * - Every deficiency found is accumulated into one message
 *
 * Has no side effects; persisting the result is up to the caller.
 */
@Service
public class NameComposerService {

    public static final String STATIC_VALUE_MESSAGE =
        "The requested Resource Type name is considered a static value with specific requirements. "
            + "Please refer to https://docs.microsoft.com/en-us/azure/azure-resource-manager/management/resource-name-rules "
            + "for additional information.";
    public static final String DELIMITER_REMOVED_MESSAGE =
        "The specified delimiter is not allowed for this resource type and has been removed.";
    public static final String REQUIRED_COMPONENTS_MESSAGE = "You must supply the required components.";
    public static final String INSTANCE_NOT_NUMERIC_MESSAGE = "Resource Instance must be a numeric value.";

    private final ComponentValueAccessors accessors;

    public NameComposerService(ComponentValueAccessors accessors) {
        this.accessors = accessors;
    }

    /**
     * Result of a composition pass. When {@code success} is false, {@code message} lists every problem found.
     */
    public record CompositionResult(
        boolean success,
        String name,
        List<ComponentContribution> contributions,
        String message,
        List<String> warnings,
        boolean staticValue
    ) {

        public CompositionResult {
            contributions = contributions == null ? List.of() : List.copyOf(contributions);
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

    /**
     * Compose a name for the request.
     *
     * @param components       candidate components; sorted here by sort order
     * @param delimiter        active delimiter, may be empty
     * @param includeDisabled  also compose with disabled components (preview mode)
     */
    public CompositionResult compose(
            NameRequest request,
            ResourceType resourceType,
            List<ResourceComponent> components,
            String delimiter,
            boolean includeDisabled) {

        if (resourceType.hasStaticValue()) {
            return new CompositionResult(true, resourceType.getStaticValue(), List.of(),
                STATIC_VALUE_MESSAGE, List.of(), true);
        }

        Set<String> optional = ComponentNames.parseNameSet(resourceType.getOptional());
        Set<String> exclude = ComponentNames.parseNameSet(resourceType.getExclude());
        String activeDelimiter = delimiter == null ? "" : delimiter;
        String invalidCharacters = resourceType.getInvalidCharacters() == null ? "" : resourceType.getInvalidCharacters();

        List<ResourceComponent> ordered = components.stream()
            .filter(c -> includeDisabled || c.isEnabled())
            .sorted(Comparator.comparingInt(ResourceComponent::getSortOrder))
            .toList();

        StringBuilder name = new StringBuilder();
        List<ComponentContribution> contributions = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        StringBuilder errors = new StringBuilder();
        boolean missingRequired = false;
        boolean delimiterSuppressed = false;
        boolean previousAppliedAfter = true;
        String instanceValue = null;

        for (ResourceComponent component : ordered) {
            String normalized = ComponentNames.normalize(component.getName());
            if (exclude.contains(normalized)) {
                previousAppliedAfter = component.isApplyDelimiterAfter();
                continue;
            }

            Optional<ComponentValueAccessors.ResolvedValue> resolved = accessors.resolve(component, request);
            if (resolved.isEmpty()) {
                if (!optional.contains(normalized)) {
                    missingRequired = true;
                    errors.append(component.getName()).append(" value was not provided. ");
                }
                previousAppliedAfter = component.isApplyDelimiterAfter();
                continue;
            }

            if (!activeDelimiter.isEmpty() && !delimiterSuppressed) {
                if (invalidCharacters.contains(activeDelimiter)) {
                    delimiterSuppressed = true;
                    warnings.add(DELIMITER_REMOVED_MESSAGE);
                } else if (name.length() > 0
                        && resourceType.isApplyDelimiter()
                        && component.isApplyDelimiterBefore()
                        && previousAppliedAfter) {
                    name.append(activeDelimiter);
                }
            }

            ComponentValueAccessors.ResolvedValue value = resolved.get();
            name.append(value.value());
            contributions.add(new ComponentContribution(component.getName(), value.label()));

            if (isInstance(component)) {
                instanceValue = value.value();
            }
            previousAppliedAfter = component.isApplyDelimiterAfter();
        }

        if (instanceValue != null && !isNumeric(instanceValue)) {
            errors.append(INSTANCE_NOT_NUMERIC_MESSAGE).append(' ');
        }

        if (errors.length() > 0) {
            String message = missingRequired
                ? REQUIRED_COMPONENTS_MESSAGE + " " + errors.toString().trim()
                : errors.toString().trim();
            return new CompositionResult(false, "", contributions, message, warnings, false);
        }

        return new CompositionResult(true, name.toString().toLowerCase(Locale.ROOT), contributions,
            String.join(" ", warnings), warnings, false);
    }

    private static boolean isInstance(ResourceComponent component) {
        return !component.isCustom() && !component.isFreeText()
            && BuiltInComponent.fromComponentName(component.getName())
                .filter(b -> b == BuiltInComponent.RESOURCE_INSTANCE)
                .isPresent();
    }

    static boolean isNumeric(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
