package com.infragraph.core.transform;

/**
 * Switches for one pipeline run.
 *
 * @param expandMultiInstance whether multi-instance detection and expansion run
 * @param validate whether the hierarchy validator runs after the passes
 * @param providerOverride provider id forced as the only provider, or null to detect
 * @param annotations hand-written graph edits, applied after the automatic annotations
 */
public record PipelineOptions(
    boolean expandMultiInstance,
    boolean validate,
    String providerOverride,
    UserAnnotations annotations
) {
    /**
     * Compact constructor normalizing a blank override to null and absent annotations to none.
     */
    public PipelineOptions {
        if (providerOverride != null && providerOverride.isBlank()) {
            providerOverride = null;
        }
        annotations = annotations == null ? UserAnnotations.none() : annotations;
    }

    public PipelineOptions(boolean expandMultiInstance, boolean validate, String providerOverride) {
        this(expandMultiInstance, validate, providerOverride, UserAnnotations.none());
    }

    /**
     * Creates the default options: expansion and validation on, providers detected.
     *
     * @return default options
     */
    public static PipelineOptions defaults() {
        return new PipelineOptions(true, true, null);
    }
}
