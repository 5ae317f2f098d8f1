package com.infragraph.core.transform;

import com.infragraph.core.graph.GraphDocument;
import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.model.DetectionMethod;
import com.infragraph.core.model.Diagnostic;
import com.infragraph.core.model.ProviderDetection;
import com.infragraph.core.model.ResourceInventory;
import com.infragraph.core.provider.ProviderContext;
import com.infragraph.core.provider.ProviderRegistry;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.transform.pass.AutoAnnotationPass;
import com.infragraph.core.transform.pass.ConsolidationPass;
import com.infragraph.core.transform.pass.DisconnectPass;
import com.infragraph.core.transform.pass.ForcedDirectionPass;
import com.infragraph.core.transform.pass.MultiInstanceDetectionPass;
import com.infragraph.core.transform.pass.MultiInstanceExpansionPass;
import com.infragraph.core.transform.pass.PostExpansionPass;
import com.infragraph.core.transform.pass.RelationInferencePass;
import com.infragraph.core.transform.pass.SelfReferencePass;
import com.infragraph.core.transform.pass.SpecialResourcePass;
import com.infragraph.core.transform.pass.UserAnnotationPass;
import com.infragraph.core.transform.pass.VariantPass;
import com.infragraph.core.validate.HierarchyValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the rewrite passes over a resource graph.
 *
 * <p>The pipeline detects the providers of the inventory, merges their rules for the passes
 * that span the whole graph and hands each provider's own rules to its handlers. It works on a
 * copy of the input graph. A {@link com.infragraph.core.exception.MissingResourceException}
 * raised by a handler aborts the run.
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * TopologyPipeline pipeline = new TopologyPipeline(ProviderRegistry.withBuiltIns());
 * PipelineResult result = pipeline.run(GraphDocumentCodec.read(input), PipelineOptions.defaults());
 * result.diagnostics().forEach(d -> log.warn("{}", d));
 * }</pre>
 */
public class TopologyPipeline {

    private static final Logger log = LoggerFactory.getLogger(TopologyPipeline.class);

    private final ProviderRegistry registry;
    private final List<GraphPass> passes;

    public TopologyPipeline(ProviderRegistry registry) {
        this(registry, defaultPasses());
    }

    /**
     * Creates a pipeline with a custom pass list.
     *
     * @param registry provider registry
     * @param passes passes in execution order
     */
    public TopologyPipeline(ProviderRegistry registry, List<GraphPass> passes) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.passes = List.copyOf(passes);
    }

    /**
     * Returns the standard pass sequence.
     *
     * @return passes in execution order
     */
    public static List<GraphPass> defaultPasses() {
        return List.of(
            new DisconnectPass(),
            new RelationInferencePass(),
            new ConsolidationPass(),
            new AutoAnnotationPass(),
            new UserAnnotationPass(),
            new MultiInstanceDetectionPass(),
            new SpecialResourcePass(),
            new VariantPass(),
            new MultiInstanceExpansionPass(),
            new ForcedDirectionPass(),
            new SelfReferencePass(),
            new PostExpansionPass()
        );
    }

    public List<GraphPass> passes() {
        return passes;
    }

    /**
     * Runs the pipeline on an interchange document.
     *
     * @param document upstream document
     * @param options run options
     * @return rewritten graph, detection and diagnostics
     */
    public PipelineResult run(GraphDocument document, PipelineOptions options) {
        return run(document.toGraph(), document.toInventory(), options);
    }

    /**
     * Runs the pipeline. The input graph is not modified.
     *
     * @param input graph as produced by the upstream parser
     * @param inventory raw resource inventory
     * @param options run options
     * @return rewritten graph, detection and diagnostics
     * @throws com.infragraph.core.exception.ProviderDetectionException if no provider can be determined
     * @throws com.infragraph.core.exception.MissingResourceException if a handler lacks a structural anchor
     */
    public PipelineResult run(ResourceGraph input, ResourceInventory inventory, PipelineOptions options) {
        ProviderDetection detection = detect(inventory, options);
        List<ProviderContext> providers = new ArrayList<>();
        providers.add(registry.getContext(detection.primaryProvider()));
        for (String id : detection.providers()) {
            if (!id.equals(detection.primaryProvider())) {
                providers.add(registry.getContext(id));
            }
        }
        RuleConfiguration rules = RuleConfiguration.merge(
            providers.stream().map(ProviderContext::getConfigOrEmpty).toList());

        ResourceGraph graph = input.copy();
        PipelineContext context = new PipelineContext(inventory, rules, providers, options);
        log.info("Running {} passes over {} nodes for {}", passes.size(), graph.size(), rules.provider());
        for (GraphPass pass : passes) {
            int before = graph.size();
            pass.apply(graph, context);
            log.debug("Pass '{}' done: {} -> {} nodes", pass.name(), before, graph.size());
        }

        List<Diagnostic> diagnostics = List.of();
        if (options.validate()) {
            diagnostics = new HierarchyValidator(rules).validate(graph);
            diagnostics.forEach(d -> log.warn("{}", d));
        }
        log.info("Pipeline finished: {} nodes, {} diagnostics", graph.size(), diagnostics.size());
        return new PipelineResult(graph, detection, rules, diagnostics);
    }

    private ProviderDetection detect(ResourceInventory inventory, PipelineOptions options) {
        String override = options.providerOverride();
        if (override == null) {
            return registry.detectProviders(inventory);
        }
        String resolved = registry.getContext(override).id();
        log.info("Provider forced to '{}'", resolved);
        return new ProviderDetection(List.of(resolved), resolved, Map.of(resolved, inventory.size()),
            DetectionMethod.DEFAULT, 1.0);
    }
}
