package com.infragraph.core.transform.pass;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.rules.RuleConfiguration.Arrow;
import com.infragraph.core.rules.RuleConfiguration.AutoAnnotation;
import com.infragraph.core.transform.GraphPass;
import com.infragraph.core.transform.PipelineContext;
import com.infragraph.core.util.ResourceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Links resources to the synthetic nodes their type implies: users in front of DNS, the
 * internet behind an internet gateway, a registry next to container services.
 *
 * <p>A link ending in {@code .*} resolves to an existing node of that type, or to
 * {@code type.this} when there is none. Forward links may drop connections listed in the
 * rule's {@code delete} prefixes.
 */
public class AutoAnnotationPass implements GraphPass {

    private static final Logger log = LoggerFactory.getLogger(AutoAnnotationPass.class);
    private static final String WILDCARD = ".*";

    @Override
    public String name() {
        return "annotate";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        RuleConfiguration rules = context.rules();
        for (AutoAnnotation annotation : rules.autoAnnotations()) {
            List<String> matches = graph.findNodes(id ->
                !graph.isHidden(id) && ResourceIds.stripModule(id).startsWith(annotation.prefix()));
            for (String node : matches) {
                for (String link : annotation.link()) {
                    String target = resolve(graph, link);
                    if (target.equals(node)) {
                        continue;
                    }
                    annotate(graph, annotation, node, target);
                }
            }
        }
    }

    private static void annotate(ResourceGraph graph, AutoAnnotation annotation, String node, String target) {
        if (!graph.contains(target)) {
            graph.addNode(target);
            graph.ensureMetadata(target);
        }
        if (annotation.arrow() == Arrow.REVERSE) {
            graph.connect(target, node);
        } else {
            graph.connect(node, target);
            for (String connection : List.copyOf(graph.connections(node))) {
                if (ResourceIds.startsWithAny(connection, annotation.delete())) {
                    graph.disconnect(node, connection);
                }
            }
        }
        log.debug("Annotated {} with {} ({})", node, target, annotation.arrow());
    }

    static String resolve(ResourceGraph graph, String link) {
        if (!link.endsWith(WILDCARD)) {
            return link;
        }
        String type = link.substring(0, link.length() - WILDCARD.length());
        return graph.findNodes(id -> ResourceIds.typeOf(id).equals(type)).stream()
            .findFirst()
            .orElse(type + ".this");
    }
}
