package com.infragraph.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A non-fatal validator finding.
 *
 * @param type finding kind
 * @param resourceId offending resource
 * @param relatedIds parents or rule prefixes involved
 * @param message human-readable description
 */
public record Diagnostic(
    DiagnosticType type,
    String resourceId,
    List<String> relatedIds,
    String message
) {
    /**
     * Compact constructor with validation.
     */
    public Diagnostic {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(resourceId, "resourceId must not be null");
        Objects.requireNonNull(message, "message must not be null");
        relatedIds = relatedIds == null ? List.of() : List.copyOf(relatedIds);
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
