package com.namingtool.repository;

import com.namingtool.model.history.GeneratedName;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the naming history.
 */
@Repository
public interface GeneratedNameRepository extends JpaRepository<GeneratedName, Long> {

    /**
     * Check whether a name was already generated (case-insensitive).
     */
    boolean existsByResourceNameIgnoreCase(String resourceName);

    /**
     * Most recent entries first.
     */
    List<GeneratedName> findTop50ByOrderByCreatedAtDesc();
}
