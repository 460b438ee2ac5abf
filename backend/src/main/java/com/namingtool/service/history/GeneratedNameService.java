package com.namingtool.service.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.namingtool.dto.response.GeneratedNameDto;
import com.namingtool.model.history.GeneratedName;
import com.namingtool.model.naming.ComponentContribution;
import com.namingtool.repository.GeneratedNameRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Naming history: records accepted names with the components that produced them.
 */
@Slf4j
@Service
@Transactional
public class GeneratedNameService {

    private final GeneratedNameRepository generatedNameRepository;
    private final ObjectMapper objectMapper;

    public GeneratedNameService(GeneratedNameRepository generatedNameRepository, ObjectMapper objectMapper) {
        this.generatedNameRepository = generatedNameRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Record a generated name.
     */
    public GeneratedNameDto record(String resourceName, String resourceTypeName,
                                   List<ComponentContribution> components, String createdBy, String message) {
        GeneratedName entity = GeneratedName.builder()
            .resourceName(resourceName)
            .resourceTypeName(resourceTypeName)
            .componentsJson(toJson(components))
            .createdBy(createdBy)
            .message(message)
            .build();
        GeneratedName saved = generatedNameRepository.save(entity);
        log.info("Recorded generated name: {} ({})", resourceName, resourceTypeName);
        return toDto(saved);
    }

    /**
     * Check whether a name is already in the history (case-insensitive).
     */
    @Transactional(readOnly = true)
    public boolean exists(String resourceName) {
        return generatedNameRepository.existsByResourceNameIgnoreCase(resourceName);
    }

    /**
     * Most recent history entries.
     */
    @Transactional(readOnly = true)
    public List<GeneratedNameDto> findRecent() {
        return generatedNameRepository.findTop50ByOrderByCreatedAtDesc().stream()
            .map(this::toDto)
            .toList();
    }

    public GeneratedNameDto toDto(GeneratedName entity) {
        return new GeneratedNameDto(
            entity.getId(),
            entity.getResourceName(),
            entity.getResourceTypeName(),
            fromJson(entity.getComponentsJson()),
            entity.getCreatedBy(),
            entity.getMessage(),
            entity.getCreatedAt()
        );
    }

    // ========================================================================
    // JSON helpers
    // ========================================================================

    private String toJson(List<ComponentContribution> components) {
        try {
            return objectMapper.writeValueAsString(components == null ? List.of() : components);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize name components: {}", e.getMessage());
            return "[]";
        }
    }

    private List<ComponentContribution> fromJson(String json) {
        if (json == null || json.isEmpty()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<ComponentContribution>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Could not read name components: {}", e.getMessage());
            return List.of();
        }
    }
}
