package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;
import com.infragraph.core.util.ResourceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Expands every node with {@code count > 1} into numbered siblings {@code id~1..id~N}.
 *
 * <p>Shared services and types owned by a provider handler (container types excepted) keep a
 * single node. After expansion every reference points at siblings: a numbered node refers to
 * the sibling with its own number when there is one, an un-numbered node to all siblings. The
 * base node is removed.
 */
public class MultiInstanceExpansionPass implements GraphPass {

    private static final Logger log = LoggerFactory.getLogger(MultiInstanceExpansionPass.class);

    @Override
    public String name() {
        return "expand";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        if (!context.options().expandMultiInstance()) {
            return;
        }
        Map<String, List<String>> expanded = createSiblings(graph, context.rules());
        if (expanded.isEmpty()) {
            return;
        }
        for (String node : graph.nodeSnapshot()) {
            if (!expanded.containsKey(node)) {
                rewriteReferences(graph, node, expanded);
            }
        }
        expanded.keySet().forEach(graph::removeNode);
        log.info("Expanded {} multi-instance resources", expanded.size());
    }

    private static Map<String, List<String>> createSiblings(ResourceGraph graph, RuleConfiguration rules) {
        Map<String, List<String>> expanded = new LinkedHashMap<>();
        for (String node : graph.nodeSnapshot()) {
            int count = graph.count(node);
            if (count <= 1 || !isExpandable(graph, rules, node)) {
                continue;
            }
            List<String> siblings = new ArrayList<>();
            for (int i = 1; i <= count; i++) {
                String sibling = ResourceIds.numbered(node, i);
                graph.setConnections(sibling, graph.connections(node));
                graph.setMetadata(sibling, graph.metadata(node));
                graph.setCount(sibling, 1);
                siblings.add(sibling);
            }
            expanded.put(node, siblings);
            log.debug("Expanded {} into {} siblings", node, count);
        }
        return expanded;
    }

    private static boolean isExpandable(ResourceGraph graph, RuleConfiguration rules, String node) {
        if (ResourceIds.isNumbered(node) || graph.isHidden(node) || rules.isSharedService(node)) {
            return false;
        }
        String type = ResourceIds.typeOf(node);
        return !rules.isSpecialType(type) || rules.isGroupType(type);
    }

    private static void rewriteReferences(ResourceGraph graph, String node, Map<String, List<String>> expanded) {
        List<String> connections = graph.connections(node);
        if (connections.stream().noneMatch(expanded::containsKey)) {
            return;
        }
        Optional<String> number = ResourceIds.numberOf(node);
        Set<String> rewritten = new LinkedHashSet<>();
        for (String target : connections) {
            List<String> siblings = expanded.get(target);
            if (siblings == null) {
                rewritten.add(target);
                continue;
            }
            Optional<String> match = number.map(n -> ResourceIds.numbered(target, n)).filter(siblings::contains);
            if (match.isPresent()) {
                rewritten.add(match.get());
            } else {
                rewritten.addAll(siblings);
            }
        }
        rewritten.remove(node);
        graph.setConnections(node, rewritten);
    }
}
