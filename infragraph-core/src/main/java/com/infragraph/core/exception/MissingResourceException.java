package com.infragraph.core.exception;

import java.util.Map;

/**
 * Raised when a rewrite pass needs a structural anchor that is absent or ambiguous,
 * for example VPC endpoints with zero or several VPCs to attach to.
 *
 * <p>Fatal to the pipeline run. The context names the handler and the counts involved.
 */
public class MissingResourceException extends InfraGraphException {

    public MissingResourceException(String message, Map<String, ?> context) {
        super(message, context);
    }
}
