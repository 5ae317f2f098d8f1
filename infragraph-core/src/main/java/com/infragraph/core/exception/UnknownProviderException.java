package com.infragraph.core.exception;

import java.util.Map;

/**
 * Raised when a provider identifier is not registered and no default provider exists.
 */
public class UnknownProviderException extends InfraGraphException {

    public UnknownProviderException(String providerId) {
        super("Unknown provider: " + providerId, Map.of("provider", String.valueOf(providerId)));
    }
}
