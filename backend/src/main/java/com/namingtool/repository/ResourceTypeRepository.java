package com.namingtool.repository;

import com.namingtool.model.type.ResourceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for resource types and their naming rules.
 */
@Repository
public interface ResourceTypeRepository extends JpaRepository<ResourceType, Long> {

    /**
     * Find types by short name (case-insensitive). Several types may share one short name.
     */
    List<ResourceType> findByShortNameIgnoreCase(String shortName);

    /**
     * Find enabled types.
     */
    List<ResourceType> findByEnabledTrue();
}
