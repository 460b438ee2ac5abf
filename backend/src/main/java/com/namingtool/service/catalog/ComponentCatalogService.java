package com.namingtool.service.catalog;

import com.namingtool.model.component.ComponentOption;
import com.namingtool.model.component.CustomComponentOption;
import com.namingtool.model.component.ResourceComponent;
import com.namingtool.model.enums.BuiltInComponent;
import com.namingtool.model.naming.ComponentNames;
import com.namingtool.repository.ComponentOptionRepository;
import com.namingtool.repository.CustomComponentOptionRepository;
import com.namingtool.repository.ResourceComponentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Component Catalog Service
 *
 * Read side of the component configuration:
 * - Ordered component lists for composition
 * - Options of built-in components and allowed values of custom components
 * - Reservation of the built-in component names
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class ComponentCatalogService {

    private final ResourceComponentRepository componentRepository;
    private final ComponentOptionRepository optionRepository;
    private final CustomComponentOptionRepository customOptionRepository;

    public ComponentCatalogService(
            ResourceComponentRepository componentRepository,
            ComponentOptionRepository optionRepository,
            CustomComponentOptionRepository customOptionRepository) {
        this.componentRepository = componentRepository;
        this.optionRepository = optionRepository;
        this.customOptionRepository = customOptionRepository;
    }

    // ========================================================================
    // Components
    // ========================================================================

    /**
     * Enabled components in ascending sort order.
     */
    public List<ResourceComponent> getEnabledComponents() {
        return componentRepository.findByEnabledTrueOrderBySortOrderAsc();
    }

    /**
     * All components, enabled or not, in ascending sort order.
     */
    public List<ResourceComponent> getAllComponents() {
        return componentRepository.findAllByOrderBySortOrderAsc();
    }

    /**
     * Find a component by name, matching normalized names so "UnitDept" finds "ResourceUnitDept".
     */
    public Optional<ResourceComponent> findComponent(String name) {
        String normalized = ComponentNames.normalize(name);
        return getAllComponents().stream()
            .filter(c -> ComponentNames.normalize(c.getName()).equals(normalized))
            .findFirst();
    }

    /**
     * Insert every missing built-in component, disabled and appended after the current last position.
     *
     * @return the components that were created
     */
    @Transactional
    public List<ResourceComponent> ensureBuiltInComponents() {
        List<ResourceComponent> existing = componentRepository.findAll();
        Integer max = componentRepository.findMaxSortOrder();
        int nextSortOrder = max == null ? 1 : max + 1;

        List<ResourceComponent> created = new ArrayList<>();
        for (BuiltInComponent builtIn : BuiltInComponent.values()) {
            String normalized = ComponentNames.normalize(builtIn.getValue());
            boolean present = existing.stream()
                .anyMatch(c -> ComponentNames.normalize(c.getName()).equals(normalized));
            if (present) {
                continue;
            }
            ResourceComponent component = ResourceComponent.builder()
                .name(builtIn.getValue())
                .displayName(displayNameOf(builtIn))
                .enabled(false)
                .custom(false)
                .freeText(false)
                .sortOrder(nextSortOrder++)
                .build();
            created.add(componentRepository.save(component));
            log.info("Added missing built-in component: {}", builtIn.getValue());
        }
        return created;
    }

    // ========================================================================
    // Options
    // ========================================================================

    /**
     * Configured options of a built-in component.
     */
    public List<ComponentOption> getOptions(BuiltInComponent component) {
        return optionRepository.findByComponentOrderBySortOrderAsc(component.getValue());
    }

    /**
     * Find a built-in component option by short name (case-insensitive).
     */
    public Optional<ComponentOption> findOption(BuiltInComponent component, String shortName) {
        if (shortName == null) {
            return Optional.empty();
        }
        return optionRepository.findByComponentAndShortNameIgnoreCase(component.getValue(), shortName)
            .stream()
            .findFirst();
    }

    /**
     * Allowed values of a custom component.
     */
    public List<CustomComponentOption> getCustomOptions(String componentName) {
        return customOptionRepository.findByParentComponentOrderBySortOrderAsc(ComponentNames.normalize(componentName));
    }

    private static String displayNameOf(BuiltInComponent builtIn) {
        return switch (builtIn) {
            case RESOURCE_TYPE -> "Resource Type";
            case RESOURCE_ENVIRONMENT -> "Environment";
            case RESOURCE_LOCATION -> "Location";
            case RESOURCE_ORG -> "Org";
            case RESOURCE_UNIT_DEPT -> "Unit/Dept";
            case RESOURCE_PROJ_APP_SVC -> "Project/App/Service";
            case RESOURCE_FUNCTION -> "Function";
            case RESOURCE_INSTANCE -> "Instance";
        };
    }
}
