package com.namingtool.repository;

import com.namingtool.model.component.CustomComponentOption;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the allowed values of custom components.
 */
@Repository
public interface CustomComponentOptionRepository extends JpaRepository<CustomComponentOption, Long> {

    /**
     * Find options by normalized parent component name.
     */
    List<CustomComponentOption> findByParentComponentOrderBySortOrderAsc(String parentComponent);
}
