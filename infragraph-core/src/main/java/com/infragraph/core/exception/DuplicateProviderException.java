package com.infragraph.core.exception;

import java.util.Map;

/**
 * Raised when a provider identifier is registered twice.
 */
public class DuplicateProviderException extends InfraGraphException {

    public DuplicateProviderException(String providerId) {
        super("Provider '" + providerId + "' already registered", Map.of("provider", providerId));
    }
}
