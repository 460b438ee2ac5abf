package com.namingtool.repository;

import com.namingtool.model.component.ResourceComponent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for name components (built-in and custom).
 */
@Repository
public interface ResourceComponentRepository extends JpaRepository<ResourceComponent, Long> {

    /**
     * Find enabled components in composition order.
     */
    List<ResourceComponent> findByEnabledTrueOrderBySortOrderAsc();

    /**
     * Find all components in composition order.
     */
    List<ResourceComponent> findAllByOrderBySortOrderAsc();

    /**
     * Highest sort order currently in use, or null when the table is empty.
     */
    @Query("SELECT MAX(c.sortOrder) FROM ResourceComponent c")
    Integer findMaxSortOrder();
}
