package com.namingtool.service.catalog;

import com.namingtool.model.type.ResourceType;
import com.namingtool.repository.ResourceTypeRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Resource type lookups used by the naming pipeline.
 */
@Service
@Transactional(readOnly = true)
public class ResourceTypeService {

    private final ResourceTypeRepository resourceTypeRepository;

    public ResourceTypeService(ResourceTypeRepository resourceTypeRepository) {
        this.resourceTypeRepository = resourceTypeRepository;
    }

    /**
     * Outcome of resolving the resource type of a request.
     * Exactly one of {@code resourceType} and {@code error} is set.
     */
    public record TypeResolution(ResourceType resourceType, String error) {

        public boolean isResolved() {
            return resourceType != null;
        }
    }

    public Optional<ResourceType> findById(Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return resourceTypeRepository.findById(id);
    }

    public List<ResourceType> findByShortName(String shortName) {
        if (shortName == null || shortName.isBlank()) {
            return List.of();
        }
        return resourceTypeRepository.findByShortNameIgnoreCase(shortName.trim());
    }

    /**
     * Find by id when one is given, otherwise by short name (first match).
     */
    public Optional<ResourceType> findByShortNameOrId(String shortName, Long id) {
        if (id != null && id > 0) {
            return findById(id);
        }
        return findByShortName(shortName).stream().findFirst();
    }

    /**
     * Resolve the resource type of a short-name request. Several types may share one
     * short name; in that case the request must carry the type id.
     */
    public TypeResolution resolveForRequest(String shortName, Long resourceId) {
        List<ResourceType> matches = findByShortName(shortName);
        if (matches.isEmpty()) {
            return new TypeResolution(null, "ResourceType value is invalid. ");
        }
        if (matches.size() == 1) {
            return new TypeResolution(matches.get(0), null);
        }
        if (resourceId == null || resourceId <= 0) {
            return new TypeResolution(null,
                "Your configuration contains multiple resource types for the provided short name. "
                    + "You must supply the Resource Id value for the resource type in your request."
                    + "(Example: resourceId: " + matches.get(0).getId() + ")");
        }
        return matches.stream()
            .filter(t -> resourceId.equals(t.getId()))
            .findFirst()
            .map(t -> new TypeResolution(t, null))
            .orElseGet(() -> new TypeResolution(null, "Resource Id value is invalid. "));
    }
}
