package com.infragraph.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of detecting which cloud providers an inventory uses.
 *
 * @param providers detected provider ids, sorted
 * @param primaryProvider provider owning the most resources
 * @param resourceCounts resources per detected provider
 * @param detectionMethod how the providers were found
 * @param confidence share of resources attributed to a known provider, bucketed to 0.4..1.0
 */
public record ProviderDetection(
    List<String> providers,
    String primaryProvider,
    Map<String, Integer> resourceCounts,
    DetectionMethod detectionMethod,
    double confidence
) {
    /**
     * Compact constructor with validation.
     */
    public ProviderDetection {
        Objects.requireNonNull(primaryProvider, "primaryProvider must not be null");
        Objects.requireNonNull(detectionMethod, "detectionMethod must not be null");
        providers = providers == null ? List.of(primaryProvider) : List.copyOf(providers);
        resourceCounts = resourceCounts == null ? Map.of() : Map.copyOf(resourceCounts);
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }

    public boolean isMultiCloud() {
        return providers.size() > 1;
    }
}
