package com.infragraph.core.validate;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.model.Diagnostic;
import com.infragraph.core.model.DiagnosticType;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.rules.RuleConfiguration.HierarchyRule;
import com.infragraph.core.util.ResourceIds;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the rewritten graph against the provider's placement rules. Never modifies the graph.
 *
 * <ul>
 *   <li>Every node matching a hierarchy rule needs a parent of one of the rule's allowed
 *       prefixes ({@link DiagnosticType#HIERARCHY_VIOLATION}).</li>
 *   <li>An un-numbered node may sit under at most one container of each shared-parent group
 *       prefix ({@link DiagnosticType#SHARED_PARENT_VIOLATION}).</li>
 * </ul>
 * Hidden nodes are not checked.
 */
public class HierarchyValidator {

    private final RuleConfiguration rules;

    public HierarchyValidator(RuleConfiguration rules) {
        this.rules = rules;
    }

    /**
     * Validates the graph.
     *
     * @param graph graph to check
     * @return findings, empty when the graph is well formed
     */
    public List<Diagnostic> validate(ResourceGraph graph) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        checkHierarchy(graph, diagnostics);
        checkSharedParents(graph, diagnostics);
        return diagnostics;
    }

    private void checkHierarchy(ResourceGraph graph, List<Diagnostic> diagnostics) {
        for (HierarchyRule rule : rules.hierarchyRules()) {
            for (String node : graph.nodeSnapshot()) {
                if (graph.isHidden(node) || !ResourceIds.stripModule(node).startsWith(rule.childPrefix())) {
                    continue;
                }
                boolean placed = graph.parentsOf(node).stream()
                    .anyMatch(parent -> ResourceIds.startsWithAny(parent, rule.validParents()));
                if (!placed) {
                    String description = rule.description() == null ? rule.childPrefix() : rule.description();
                    diagnostics.add(new Diagnostic(DiagnosticType.HIERARCHY_VIOLATION, node, rule.validParents(),
                        node + " has no parent of type " + rule.validParents() + " (rule: " + description + ")"));
                }
            }
        }
    }

    private void checkSharedParents(ResourceGraph graph, List<Diagnostic> diagnostics) {
        for (String prefix : rules.sharedParentGroupPrefixes()) {
            for (String node : graph.nodeSnapshot()) {
                if (graph.isHidden(node) || ResourceIds.isNumbered(node)) {
                    continue;
                }
                Set<String> parents = new LinkedHashSet<>();
                for (String parent : graph.parentsOf(node)) {
                    if (ResourceIds.stripModule(parent).startsWith(prefix)) {
                        parents.add(parent);
                    }
                }
                if (parents.size() > 1) {
                    diagnostics.add(new Diagnostic(DiagnosticType.SHARED_PARENT_VIOLATION, node, List.copyOf(parents),
                        node + " is listed under " + parents.size() + " " + prefix + "* containers: "
                            + String.join(", ", parents)));
                }
            }
        }
    }
}
