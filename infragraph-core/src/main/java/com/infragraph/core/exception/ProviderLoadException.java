package com.infragraph.core.exception;

import java.util.Map;

/**
 * Raised when a provider's rule configuration or handler set cannot be loaded.
 *
 * <p>Callers that treat missing rules as "nothing to do for this provider" catch this
 * and fall back to generic behavior.
 */
public class ProviderLoadException extends InfraGraphException {

    public ProviderLoadException(String providerId, String message, Throwable cause) {
        super(message, Map.of("provider", providerId), cause);
    }
}
