package com.namingtool.service.validation;

import com.namingtool.model.type.ResourceType;

/**
 * Answers whether a name is already taken in the external namespace for a resource type.
 */
public interface ExistenceOracle {

    /**
     * @throws ExistenceCheckException when the namespace could not be queried
     */
    ExistenceCheck exists(String name, ResourceType resourceType);

    /**
     * Whether answers from this oracle reflect the external namespace.
     */
    default boolean isActive() {
        return true;
    }
}
