package com.namingtool.repository;

import com.namingtool.model.delimiter.ResourceDelimiter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ResourceDelimiterRepository extends JpaRepository<ResourceDelimiter, Long> {

    /**
     * Find enabled delimiters by sort order. The first one is the active delimiter.
     */
    List<ResourceDelimiter> findByEnabledTrueOrderBySortOrderAsc();
}
