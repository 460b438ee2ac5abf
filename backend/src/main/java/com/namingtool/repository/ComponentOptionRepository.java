package com.namingtool.repository;

import com.namingtool.model.component.ComponentOption;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the configured options of built-in components.
 */
@Repository
public interface ComponentOptionRepository extends JpaRepository<ComponentOption, Long> {

    /**
     * Find options for one built-in component, in display order.
     */
    List<ComponentOption> findByComponentOrderBySortOrderAsc(String component);

    /**
     * Find an option by component and short name (case-insensitive).
     */
    List<ComponentOption> findByComponentAndShortNameIgnoreCase(String component, String shortName);
}
