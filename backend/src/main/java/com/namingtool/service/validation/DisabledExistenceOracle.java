package com.namingtool.service.validation;

import com.namingtool.model.type.ResourceType;

/**
 * Oracle used when no external namespace is configured. Every name is reported as available.
 */
public class DisabledExistenceOracle implements ExistenceOracle {

    @Override
    public ExistenceCheck exists(String name, ResourceType resourceType) {
        return ExistenceCheck.notFound();
    }

    @Override
    public boolean isActive() {
        return false;
    }
}
