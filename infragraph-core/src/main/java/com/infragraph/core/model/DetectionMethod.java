package com.infragraph.core.model;

/**
 * Strategy that produced a {@link ProviderDetection}.
 */
public enum DetectionMethod {
    /** Explicit provider source field on the raw resources. */
    PROVIDER_FIELD,
    /** Resource type prefixes. */
    RESOURCE_PREFIX,
    /** Nothing matched; the default provider was assumed. */
    DEFAULT
}
