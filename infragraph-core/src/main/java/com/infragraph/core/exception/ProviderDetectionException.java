package com.infragraph.core.exception;

import java.util.Map;

/**
 * Raised when no supported cloud provider can be derived from a resource inventory.
 */
public class ProviderDetectionException extends InfraGraphException {

    public ProviderDetectionException(String message, Map<String, ?> context) {
        super(message, context);
    }
}
