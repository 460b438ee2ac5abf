package com.namingtool.service.validation;

/**
 * Supplies bearer tokens for Azure Resource Manager calls.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    String getAccessToken();
}
