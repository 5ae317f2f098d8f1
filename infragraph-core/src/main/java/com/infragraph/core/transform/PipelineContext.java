package com.infragraph.core.transform;

import com.infragraph.core.model.ResourceInventory;
import com.infragraph.core.provider.ProviderContext;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.List;
import java.util.Objects;

/**
 * Read-only inputs shared by the passes of one pipeline run.
 *
 * @param inventory raw resource inventory
 * @param rules rules of all detected providers merged, for passes that run over the whole graph
 * @param providers contexts of the detected providers, primary first
 * @param options run options
 */
public record PipelineContext(
    ResourceInventory inventory,
    RuleConfiguration rules,
    List<ProviderContext> providers,
    PipelineOptions options
) {
    /**
     * Compact constructor with validation.
     */
    public PipelineContext {
        Objects.requireNonNull(inventory, "inventory must not be null");
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(options, "options must not be null");
        providers = providers == null ? List.of() : List.copyOf(providers);
    }
}
