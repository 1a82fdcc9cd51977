package com.netintel.wigle.service;

import com.netintel.wigle.model.ApiCredentials;

import java.util.Optional;

/**
 * Supplies the credential pair attached to every API request.
 * Looked up per request so that rotated credentials apply without a restart.
 */
public interface CredentialProvider {

    Optional<ApiCredentials> credentials();

    default boolean ready() {
        return credentials().isPresent();
    }
}
