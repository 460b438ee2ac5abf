package com.namingtool.service.catalog;

import com.namingtool.model.delimiter.ResourceDelimiter;
import com.namingtool.repository.ResourceDelimiterRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Resolves the active delimiter: the first enabled one by sort order.
 */
@Service
@Transactional(readOnly = true)
public class DelimiterService {

    private final ResourceDelimiterRepository delimiterRepository;

    public DelimiterService(ResourceDelimiterRepository delimiterRepository) {
        this.delimiterRepository = delimiterRepository;
    }

    /**
     * The active delimiter, or empty when no delimiter is enabled.
     */
    public Optional<ResourceDelimiter> getActiveDelimiter() {
        return delimiterRepository.findByEnabledTrueOrderBySortOrderAsc().stream().findFirst();
    }
}
