package com.infragraph.core.detect;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.model.ResourceInventory;
import com.infragraph.core.model.ResourceRecord;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.rules.RuleConfiguration.MultiInstancePattern;
import com.infragraph.core.util.ResourceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds resources implicitly fanned out over several zones, subnets or targets and gives them
 * a synthetic {@code count}.
 *
 * <p>For every resource whose type a pattern names, the references found in the trigger
 * attributes are counted. More than one distinct reference makes the resource multi-instance.
 * Resources referenced from the pattern's also-expand attributes receive the same count, so a
 * load balancer spread over three subnets also triples its security groups.
 *
 * <p>Counts are written only where none is set yet. Numbered nodes are left alone.
 */
public class MultiInstanceDetector {

    private static final Logger log = LoggerFactory.getLogger(MultiInstanceDetector.class);
    private static final String COUNT = "count";

    private final RuleConfiguration rules;

    public MultiInstanceDetector(RuleConfiguration rules) {
        this.rules = rules;
    }

    /**
     * Annotates the graph with synthetic counts.
     *
     * @param inventory raw resource inventory
     * @param graph graph to annotate
     * @return counts written, keyed by node, in the order they were assigned
     */
    public Map<String, Integer> detect(ResourceInventory inventory, ResourceGraph graph) {
        Map<String, Integer> assigned = new LinkedHashMap<>();
        for (MultiInstancePattern pattern : rules.multiInstancePatterns()) {
            if (pattern.referencePattern() == null || pattern.referencePattern().isBlank()) {
                log.warn("Multi-instance pattern '{}' has no reference pattern", pattern.description());
                continue;
            }
            ReferenceExtractor extractor = new ReferenceExtractor(pattern.referencePattern());
            for (ResourceRecord resource : inventory.resources()) {
                if (pattern.resourceTypes().contains(resource.type())) {
                    detectResource(resource, pattern, extractor, graph, assigned);
                }
            }
        }
        if (!assigned.isEmpty()) {
            log.info("Detected {} multi-instance resources", assigned.size());
        }
        return Collections.unmodifiableMap(assigned);
    }

    private void detectResource(ResourceRecord resource, MultiInstancePattern pattern,
                                ReferenceExtractor extractor, ResourceGraph graph,
                                Map<String, Integer> assigned) {
        Set<String> references = new LinkedHashSet<>();
        for (String attribute : pattern.triggerAttributes()) {
            references.addAll(extractor.extract(resource.attributes().get(attribute)));
        }
        if (references.size() <= 1) {
            return;
        }
        int count = references.size();
        Optional<String> node = resolveNode(resource, pattern, graph);
        if (node.isEmpty()) {
            log.debug("{} spans {} references but has no node in the graph", resource.id(), count);
            return;
        }
        assignCount(graph, node.get(), count, assigned);
        log.debug("{} spans {} references ({})", node.get(), count, pattern.description());

        for (String attribute : pattern.alsoExpandAttributes()) {
            for (String reference : extractor.extract(resource.attributes().get(attribute))) {
                for (String target : findReferencedNodes(reference, graph)) {
                    assignCount(graph, target, count, assigned);
                }
            }
        }
    }

    /**
     * Finds the graph node of a raw resource: the identifier itself, a module-qualified form,
     * the consolidated node of its family, or a node of an equivalent type with the same name.
     */
    Optional<String> resolveNode(ResourceRecord resource, MultiInstancePattern pattern, ResourceGraph graph) {
        String id = resource.id();
        if (graph.contains(id)) {
            return Optional.of(id);
        }
        for (String node : graph.nodes()) {
            if (!ResourceIds.isNumbered(node) && ResourceIds.stripModule(node).equals(id)) {
                return Optional.of(node);
            }
        }
        Optional<String> consolidated = rules.consolidatedNameFor(id);
        if (consolidated.isPresent() && graph.contains(consolidated.get())) {
            return consolidated;
        }
        for (String node : graph.nodes()) {
            if (ResourceIds.isNumbered(node)) {
                continue;
            }
            boolean equivalentType = pattern.resourceTypes().contains(ResourceIds.typeOf(node));
            if (equivalentType && ResourceIds.nameOf(node).equals(resource.name())) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    private List<String> findReferencedNodes(String reference, ResourceGraph graph) {
        List<String> targets = new ArrayList<>();
        String referenceType = ResourceIds.typeOf(reference);
        Optional<String> consolidated = rules.consolidatedNameFor(reference);
        for (String node : graph.nodes()) {
            if (ResourceIds.isNumbered(node)) {
                continue;
            }
            boolean sameNode = ResourceIds.stripModule(node).contains(reference)
                && ResourceIds.typeOf(node).equals(referenceType);
            if (sameNode || consolidated.map(node::equals).orElse(false)) {
                targets.add(node);
            }
        }
        return targets;
    }

    private static void assignCount(ResourceGraph graph, String node, int count, Map<String, Integer> assigned) {
        if (ResourceIds.isNumbered(node)) {
            return;
        }
        if (graph.hasMetadata(node) && graph.metadata(node).get(COUNT) != null) {
            return;
        }
        graph.setCount(node, count);
        assigned.put(node, count);
    }
}
