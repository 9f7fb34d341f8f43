package com.vidnyan.flowc.domain.converter;

/**
 * Raised while building a converter registry from an inconsistent configuration.
 */
public class RegistryConfigurationException extends RuntimeException {

    public RegistryConfigurationException(String message) {
        super(message);
    }
}
