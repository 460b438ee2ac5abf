package com.namingtool.service.naming;

import com.namingtool.config.NamingProperties;
import com.namingtool.dto.request.BulkResourceNameRequest;
import com.namingtool.dto.request.ResourceNameRequest;
import com.namingtool.dto.request.ResourceNameRequestWithComponents;
import com.namingtool.dto.request.ValidateNameRequest;
import com.namingtool.dto.response.BulkResourceNameResponse;
import com.namingtool.dto.response.BulkResourceNameResponse.BulkResourceNameResult;
import com.namingtool.dto.response.GeneratedNameDto;
import com.namingtool.dto.response.ResourceNameResponse;
import com.namingtool.dto.response.ValidateNameResponse;
import com.namingtool.model.component.ComponentOption;
import com.namingtool.model.component.CustomComponentOption;
import com.namingtool.model.component.ResourceComponent;
import com.namingtool.model.delimiter.ResourceDelimiter;
import com.namingtool.model.enums.BuiltInComponent;
import com.namingtool.model.naming.ComponentNames;
import com.namingtool.model.naming.NameRequest;
import com.namingtool.model.type.ResourceType;
import com.namingtool.service.catalog.ComponentCatalogService;
import com.namingtool.service.catalog.DelimiterService;
import com.namingtool.service.catalog.ResourceTypeService;
import com.namingtool.service.history.GeneratedNameService;
import com.namingtool.service.naming.ConflictResolutionService.ConflictResolutionOutcome;
import com.namingtool.service.naming.NameComposerService.CompositionResult;
import com.namingtool.service.naming.NameValidatorService.ValidationOutcome;
import com.namingtool.service.validation.ExistenceCheck;
import com.namingtool.service.validation.ExistenceCheckException;
import com.namingtool.service.validation.ExistenceCheckResult;
import com.namingtool.service.validation.ExistenceCheckService;
import com.namingtool.service.validation.ValidationSettings;
import com.namingtool.service.validation.ValidationSettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resource Naming Request Service
 *
 * Entry point of the naming engine. Turns a request into a name by:
 * - Resolving the delimiter and resource type
 * - Checking component values against the configured options
 * - Composing and validating the name
 * - Handling duplicates in the naming history
 * - Checking the external namespace and resolving conflicts
 * - Recording the accepted name
 *
 * Never throws; every failure comes back as an unsuccessful response.
 */
@Slf4j
@Service
public class ResourceNamingRequestService {

    public static final String NAME_NOT_GENERATED = "***RESOURCE NAME NOT GENERATED***";
    public static final String DELIMITER_NOT_SET_MESSAGE = "Delimiter value could not be set.";
    public static final String INVALID_RESOURCE_TYPE_MESSAGE = "ResourceType value is invalid.";
    public static final String UNKNOWN_RESOURCE_TYPE_MESSAGE = "Resource Type is invalid!";
    public static final String INSTANCE_INCREMENTED_MESSAGE =
        "The resource instance has been auto-incremented to the next value.";

    private final DelimiterService delimiterService;
    private final ResourceTypeService resourceTypeService;
    private final ComponentCatalogService catalogService;
    private final NameComposerService composerService;
    private final NameValidatorService validatorService;
    private final ConflictResolutionService conflictResolutionService;
    private final ExistenceCheckService existenceCheckService;
    private final ValidationSettingsService settingsService;
    private final GeneratedNameService generatedNameService;
    private final NamingProperties properties;

    public ResourceNamingRequestService(
            DelimiterService delimiterService,
            ResourceTypeService resourceTypeService,
            ComponentCatalogService catalogService,
            NameComposerService composerService,
            NameValidatorService validatorService,
            ConflictResolutionService conflictResolutionService,
            ExistenceCheckService existenceCheckService,
            ValidationSettingsService settingsService,
            GeneratedNameService generatedNameService,
            NamingProperties properties) {
        this.delimiterService = delimiterService;
        this.resourceTypeService = resourceTypeService;
        this.catalogService = catalogService;
        this.composerService = composerService;
        this.validatorService = validatorService;
        this.conflictResolutionService = conflictResolutionService;
        this.existenceCheckService = existenceCheckService;
        this.settingsService = settingsService;
        this.generatedNameService = generatedNameService;
        this.properties = properties;
    }

    // ========================================================================
    // Short-name requests
    // ========================================================================

    /**
     * Generate a name from component short names.
     */
    public ResourceNameResponse requestName(ResourceNameRequest request) {
        try {
            return doRequestName(request);
        } catch (RuntimeException e) {
            log.error("Name generation failed for resource type {}", request.resourceType(), e);
            return ResourceNameResponse.failure(NAME_NOT_GENERATED, e.getMessage());
        }
    }

    private ResourceNameResponse doRequestName(ResourceNameRequest request) {
        Optional<ResourceDelimiter> delimiter = delimiterService.getActiveDelimiter();
        if (delimiter.isEmpty()) {
            return ResourceNameResponse.failure(NAME_NOT_GENERATED, DELIMITER_NOT_SET_MESSAGE);
        }

        ResourceTypeService.TypeResolution resolution =
            resourceTypeService.resolveForRequest(request.resourceType(), request.resourceId());
        if (!resolution.isResolved()) {
            return ResourceNameResponse.failure(NAME_NOT_GENERATED, resolution.error().trim());
        }
        ResourceType resourceType = resolution.resourceType();

        if (resourceType.hasStaticValue()) {
            return new ResourceNameResponse(true, resourceType.getStaticValue(),
                NameComposerService.STATIC_VALUE_MESSAGE, null, null);
        }

        List<ResourceComponent> components = catalogService.getEnabledComponents();
        NameRequest.NameRequestBuilder builder = NameRequest.builder()
            .resourceType(resourceType)
            .resourceInstance(request.resourceInstance());
        Map<String, String> customValues = normalizeKeys(request.customComponents());
        builder.customComponents(customValues);

        String inputErrors = checkComponentValues(request, resourceType, components, customValues, builder);
        if (!inputErrors.isEmpty()) {
            return ResourceNameResponse.failure(NAME_NOT_GENERATED, inputErrors);
        }

        NameRequest nameRequest = builder.build();
        return generate(nameRequest, resourceType, components, delimiter.get().getDelimiter(),
            request.createdBy(), true);
    }

    /**
     * Check every supplied component value and put the matching options on the builder.
     *
     * @return accumulated error message, empty when every value is acceptable
     */
    private String checkComponentValues(
            ResourceNameRequest request,
            ResourceType resourceType,
            List<ResourceComponent> components,
            Map<String, String> customValues,
            NameRequest.NameRequestBuilder builder) {

        Set<String> exclude = ComponentNames.parseNameSet(resourceType.getExclude());
        StringBuilder errors = new StringBuilder();

        for (ResourceComponent component : components) {
            String normalized = ComponentNames.normalize(component.getName());
            if (exclude.contains(normalized)) {
                continue;
            }

            Optional<BuiltInComponent> builtIn = component.isCustom() || component.isFreeText()
                ? Optional.empty()
                : BuiltInComponent.fromComponentName(component.getName());
            String value = builtIn.map(b -> builtInValue(request, b)).orElseGet(() -> customValues.get(normalized));
            if (value == null || value.isEmpty()) {
                continue;
            }

            // custom values are checked against their options only, free text is unbounded
            if (builtIn.isPresent()
                    && (value.length() < component.getMinLength() || value.length() > component.getMaxLength())) {
                String displayName = component.getDisplayName() != null ? component.getDisplayName() : component.getName();
                errors.append(displayName)
                    .append(" value length is invalid. The value must be between ")
                    .append(component.getMinLength()).append(" and ").append(component.getMaxLength())
                    .append(" characters. ");
                continue;
            }

            if (builtIn.isPresent()) {
                BuiltInComponent b = builtIn.get();
                if (!b.hasOptions()) {
                    continue;
                }
                Optional<ComponentOption> option = catalogService.findOption(b, value);
                if (option.isEmpty()) {
                    errors.append(b.getValue()).append(" value is invalid. ");
                } else {
                    applyOption(builder, b, option.get());
                }
            } else if (component.isCustom() && !component.isFreeText()) {
                List<CustomComponentOption> options = catalogService.getCustomOptions(component.getName());
                boolean known = options.stream().anyMatch(o -> value.equalsIgnoreCase(o.getShortName()));
                if (!options.isEmpty() && !known) {
                    errors.append(component.getName()).append(" value is not a valid custom component short name. ");
                }
            }
        }
        return errors.toString().trim();
    }

    // ========================================================================
    // Typed requests
    // ========================================================================

    /**
     * Generate a name from resolved configuration objects. No option lookups are made.
     */
    public ResourceNameResponse requestNameWithComponents(ResourceNameRequestWithComponents request) {
        try {
            ResourceDelimiter delimiter = request.resourceDelimiter();
            if (delimiter == null) {
                return ResourceNameResponse.failure(NAME_NOT_GENERATED, DELIMITER_NOT_SET_MESSAGE);
            }
            ResourceType resourceType = request.resourceType();
            if (resourceType == null || resourceType.getShortName() == null) {
                return ResourceNameResponse.failure(NAME_NOT_GENERATED, INVALID_RESOURCE_TYPE_MESSAGE);
            }
            if (resourceType.hasStaticValue()) {
                return new ResourceNameResponse(true, resourceType.getStaticValue(),
                    NameComposerService.STATIC_VALUE_MESSAGE, null, null);
            }

            NameRequest nameRequest = NameRequest.builder()
                .resourceType(resourceType)
                .environment(request.resourceEnvironment())
                .location(request.resourceLocation())
                .org(request.resourceOrg())
                .unitDept(request.resourceUnitDept())
                .projAppSvc(request.resourceProjAppSvc())
                .function(request.resourceFunction())
                .resourceInstance(request.resourceInstance())
                .customComponents(request.customComponents())
                .build();

            return generate(nameRequest, resourceType, catalogService.getEnabledComponents(),
                delimiter.getDelimiter(), request.createdBy(), false);
        } catch (RuntimeException e) {
            log.error("Name generation with components failed", e);
            return ResourceNameResponse.failure(NAME_NOT_GENERATED, e.getMessage());
        }
    }

    // ========================================================================
    // Bulk requests
    // ========================================================================

    /**
     * Generate one name per requested resource type from a shared set of components.
     */
    public BulkResourceNameResponse requestBulk(BulkResourceNameRequest request) {
        List<BulkResourceNameResult> results = new ArrayList<>();
        int successCount = 0;
        int failureCount = 0;

        for (String typeShortName : request.resourceTypes()) {
            ResourceNameResponse response = requestName(toSingleRequest(request, typeShortName));
            if (response.success()) {
                successCount++;
                GeneratedNameDto details = request.validateOnly() ? null : response.details();
                results.add(new BulkResourceNameResult(typeShortName, true, response.resourceName(), null,
                    details, response.validationMetadata()));
            } else {
                failureCount++;
                results.add(new BulkResourceNameResult(typeShortName, false, null, response.message(),
                    null, response.validationMetadata()));
                if (!request.continueOnError()) {
                    break;
                }
            }
        }

        boolean success = failureCount == 0;
        String message;
        if (success) {
            message = "Successfully generated " + successCount + " resource name(s)";
        } else if (successCount > 0) {
            message = "Partially successful: " + successCount + " succeeded, " + failureCount + " failed";
        } else {
            message = "All " + failureCount + " resource name generation(s) failed";
        }
        log.info("Bulk name generation finished: {}", message);

        return new BulkResourceNameResponse(success, message, request.resourceTypes().size(),
            successCount, failureCount, results, LocalDateTime.now());
    }

    private static ResourceNameRequest toSingleRequest(BulkResourceNameRequest request, String typeShortName) {
        ResourceNameRequest.ResourceNameRequestBuilder builder = ResourceNameRequest.builder()
            .resourceType(typeShortName)
            .resourceEnvironment(request.resourceEnvironment())
            .resourceLocation(request.resourceLocation())
            .resourceOrg(request.resourceOrg())
            .resourceUnitDept(request.resourceUnitDept())
            .resourceProjAppSvc(request.resourceProjAppSvc())
            .resourceFunction(request.resourceFunction())
            .resourceInstance(request.resourceInstance())
            .customComponents(request.customComponents())
            .createdBy(request.createdBy());

        BulkResourceNameRequest.ResourceTypeOverride override = request.resourceTypeOverrides().get(typeShortName);
        if (override != null) {
            if (hasText(override.resourceEnvironment())) {
                builder.resourceEnvironment(override.resourceEnvironment());
            }
            if (hasText(override.resourceLocation())) {
                builder.resourceLocation(override.resourceLocation());
            }
            if (hasText(override.resourceOrg())) {
                builder.resourceOrg(override.resourceOrg());
            }
            if (hasText(override.resourceUnitDept())) {
                builder.resourceUnitDept(override.resourceUnitDept());
            }
            if (hasText(override.resourceProjAppSvc())) {
                builder.resourceProjAppSvc(override.resourceProjAppSvc());
            }
            if (hasText(override.resourceFunction())) {
                builder.resourceFunction(override.resourceFunction());
            }
            if (hasText(override.resourceInstance())) {
                builder.resourceInstance(override.resourceInstance());
            }
            if (override.customComponents() != null && !override.customComponents().isEmpty()) {
                builder.customComponents(override.customComponents());
            }
        }
        return builder.build();
    }

    // ========================================================================
    // Name validation
    // ========================================================================

    /**
     * Validate a name against the rules of a resource type, using the active delimiter.
     */
    public ValidateNameResponse validateName(ValidateNameRequest request) {
        Optional<ResourceType> resourceType =
            resourceTypeService.findByShortNameOrId(request.resourceType(), request.resourceTypeId());
        String name = request.name() == null ? "" : request.name();
        if (resourceType.isEmpty()) {
            return new ValidateNameResponse(false, name, UNKNOWN_RESOURCE_TYPE_MESSAGE);
        }
        String delimiter = delimiterService.getActiveDelimiter().map(ResourceDelimiter::getDelimiter).orElse("");
        ValidationOutcome outcome = validatorService.validate(resourceType.get(), name, delimiter);
        return new ValidateNameResponse(outcome.valid(), outcome.name(), outcome.message());
    }

    // ========================================================================
    // Shared generation steps
    // ========================================================================

    private ResourceNameResponse generate(
            NameRequest nameRequest,
            ResourceType resourceType,
            List<ResourceComponent> components,
            String delimiter,
            String createdBy,
            boolean checkExternally) {

        CompositionResult composition = composerService.compose(nameRequest, resourceType, components, delimiter, false);
        if (!composition.success()) {
            return ResourceNameResponse.failure(NAME_NOT_GENERATED, composition.message());
        }

        List<String> messages = new ArrayList<>(composition.warnings());
        ValidationOutcome validation = validatorService.validate(resourceType, composition.name(), delimiter);
        if (!validation.message().isEmpty()) {
            messages.add(validation.message());
        }
        if (!validation.valid()) {
            return ResourceNameResponse.failure(NAME_NOT_GENERATED, String.join(" ", messages));
        }
        String name = validation.name().isEmpty() ? composition.name() : validation.name();

        ValidationSettings settings = settingsService.getSettings();
        boolean externalValidation = checkExternally && settings.enabled() && existenceCheckService.isOracleActive();

        if (!externalValidation && generatedNameService.exists(name)) {
            Optional<String> deduplicated = handleLocalDuplicate(name, nameRequest.resourceInstance(), settings);
            if (deduplicated.isPresent()) {
                name = deduplicated.get();
                messages.add(INSTANCE_INCREMENTED_MESSAGE);
            } else if (!properties.duplicateNamesAllowed()) {
                return ResourceNameResponse.failure(NAME_NOT_GENERATED, "The name (" + name
                    + ") you are trying to generate already exists. Please select different component options and try again.");
            }
        }

        ExistenceCheckResult metadata = null;
        if (externalValidation) {
            try {
                ExistenceCheck check = existenceCheckService.check(name, resourceType, settings);
                metadata = ExistenceCheckResult.of(check, null);
                if (check.exists()) {
                    ConflictResolutionOutcome outcome = conflictResolutionService.resolve(name, resourceType, settings);
                    metadata = ExistenceCheckResult.of(check, outcome.warning());
                    if (!outcome.success()) {
                        return new ResourceNameResponse(false, NAME_NOT_GENERATED,
                            outcome.errorMessage() != null
                                ? outcome.errorMessage()
                                : "Failed to resolve naming conflict with Azure tenant.",
                            null, metadata);
                    }
                    name = outcome.finalName();
                    String resolutionMessage = "Name conflict resolved using " + outcome.strategy().getValue()
                        + " strategy. Original: " + outcome.originalName() + ", Final: " + outcome.finalName();
                    if (outcome.warning() != null && !outcome.warning().isEmpty()) {
                        resolutionMessage += " Warning: " + outcome.warning();
                    }
                    messages.add(resolutionMessage);
                }
            } catch (ExistenceCheckException e) {
                log.warn("Azure validation failed for {}: {}", name, e.getMessage());
                metadata = new ExistenceCheckResult(true, false, List.of(),
                    "Azure validation could not be performed: " + e.getMessage(), LocalDateTime.now(), false);
            }
        } else if (checkExternally && settings.enabled()) {
            metadata = ExistenceCheckResult.notPerformed("External name validation is not configured.");
        }

        String message = String.join(" ", messages);
        GeneratedNameDto details = generatedNameService.record(name, resourceType.getDisplayName(),
            composition.contributions(), createdBy, message);
        if (externalValidation) {
            existenceCheckService.invalidate(name, resourceType);
        }
        log.info("Generated resource name: {}", name);
        return new ResourceNameResponse(true, name, message, details, metadata);
    }

    /**
     * Bump the resource instance until the name is unused in the naming history.
     *
     * @return the free name, or empty when the name has no instance or auto-increment is off
     */
    private Optional<String> handleLocalDuplicate(String name, String instance, ValidationSettings settings) {
        if (!properties.autoIncrementResourceInstance() || !hasText(instance)
                || !NameComposerService.isNumeric(instance)) {
            return Optional.empty();
        }
        int position = name.lastIndexOf(instance);
        if (position < 0) {
            return Optional.empty();
        }
        String prefix = name.substring(0, position);
        String suffix = name.substring(position + instance.length());
        BigInteger number = new BigInteger(instance);
        int maxAttempts = Math.max(1, settings.conflictResolution().maxAttempts());

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            number = number.add(BigInteger.ONE);
            String next = number.toString();
            if (next.length() < instance.length()) {
                next = "0".repeat(instance.length() - next.length()) + next;
            }
            String candidate = prefix + next + suffix;
            if (!generatedNameService.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static String builtInValue(ResourceNameRequest request, BuiltInComponent component) {
        return switch (component) {
            case RESOURCE_TYPE -> request.resourceType();
            case RESOURCE_ENVIRONMENT -> request.resourceEnvironment();
            case RESOURCE_LOCATION -> request.resourceLocation();
            case RESOURCE_ORG -> request.resourceOrg();
            case RESOURCE_UNIT_DEPT -> request.resourceUnitDept();
            case RESOURCE_PROJ_APP_SVC -> request.resourceProjAppSvc();
            case RESOURCE_FUNCTION -> request.resourceFunction();
            case RESOURCE_INSTANCE -> request.resourceInstance();
        };
    }

    private static void applyOption(NameRequest.NameRequestBuilder builder, BuiltInComponent component,
                                    ComponentOption option) {
        switch (component) {
            case RESOURCE_ENVIRONMENT -> builder.environment(option);
            case RESOURCE_LOCATION -> builder.location(option);
            case RESOURCE_ORG -> builder.org(option);
            case RESOURCE_UNIT_DEPT -> builder.unitDept(option);
            case RESOURCE_PROJ_APP_SVC -> builder.projAppSvc(option);
            case RESOURCE_FUNCTION -> builder.function(option);
            default -> {
            }
        }
    }

    private static Map<String, String> normalizeKeys(Map<String, String> values) {
        Map<String, String> normalized = new HashMap<>();
        if (values != null) {
            values.forEach((key, value) -> normalized.put(ComponentNames.normalize(key), value));
        }
        return normalized;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
