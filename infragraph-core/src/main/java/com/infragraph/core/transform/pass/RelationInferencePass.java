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
import java.util.Set;

/**
 * Infers edges from attribute values that mention other resources.
 *
 * <p>A resource whose attributes contain {@code aws_subnet.private} depends on that subnet. Types
 * on the reverse-arrow list are containers or sources, so edges into them are turned around
 * unless the referring resource ranks earlier in that list. Implied-connection keywords link a
 * resource to every resource of the implied type when the keyword appears among its attribute
 * names. Numbered resources only pair with resources of the same number; hidden resources are
 * never linked.
 */
public class RelationInferencePass implements GraphPass {

    private static final Logger log = LoggerFactory.getLogger(RelationInferencePass.class);

    @Override
    public String name() {
        return "relations";
    }

    @Override
    public void apply(ResourceGraph graph, PipelineContext context) {
        RuleConfiguration rules = context.rules();
        List<String> nodes = graph.findNodes(id -> !graph.isHidden(id));
        Map<String, Set<String>> inferred = new LinkedHashMap<>();

        for (String origin : nodes) {
            List<String> values = attributeTexts(graph, origin);
            Set<String> keys = attributeKeys(graph, origin);
            for (String target : nodes) {
                if (target.equals(origin) || !ResourceIds.sameNumbering(origin, target)) {
                    continue;
                }
                if (mentionsAny(values, target) || impliedBy(rules, keys, target)) {
                    orient(rules, origin, target, inferred);
                }
            }
        }

        int added = 0;
        for (Map.Entry<String, Set<String>> entry : inferred.entrySet()) {
            String from = entry.getKey();
            if (ResourceIds.startsWithAny(from, rules.disconnectList())) {
                continue;
            }
            for (String to : entry.getValue()) {
                if (!graph.hasConnection(to, from) && graph.connect(from, to)) {
                    added++;
                    log.debug("Inferred {} -> {}", from, to);
                }
            }
        }
        log.debug("Inferred {} edges", added);
    }

    private static void orient(RuleConfiguration rules, String origin, String target, Map<String, Set<String>> inferred) {
        int targetRank = rank(rules.reverseArrowList(), target);
        int originRank = rank(rules.reverseArrowList(), origin);
        boolean reverse = targetRank >= 0 && (originRank < 0 || originRank >= targetRank);
        String from = reverse ? target : origin;
        String to = reverse ? origin : target;
        inferred.computeIfAbsent(from, k -> new LinkedHashSet<>()).add(to);
    }

    private static int rank(List<String> prefixes, String id) {
        String local = ResourceIds.stripModule(id);
        for (int i = 0; i < prefixes.size(); i++) {
            if (local.startsWith(prefixes.get(i))) {
                return i;
            }
        }
        return -1;
    }

    private static boolean impliedBy(RuleConfiguration rules, Set<String> keys, String target) {
        for (Map.Entry<String, String> implied : rules.impliedConnections().entrySet()) {
            if (keys.contains(implied.getKey()) && ResourceIds.stripModule(target).startsWith(implied.getValue())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether any value mentions the target identifier as a whole word, so that
     * {@code aws_subnet.a} does not match inside {@code aws_subnet.ab}.
     */
    static boolean mentionsAny(List<String> values, String target) {
        String needle = ResourceIds.baseName(ResourceIds.stripModule(target));
        for (String value : values) {
            int index = value.indexOf(needle);
            while (index >= 0) {
                int end = index + needle.length();
                boolean startOk = index == 0 || !isWordChar(value.charAt(index - 1));
                boolean endOk = end >= value.length() || !isWordChar(value.charAt(end));
                if (startOk && endOk) {
                    return true;
                }
                index = value.indexOf(needle, index + 1);
            }
        }
        return false;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    private static List<String> attributeTexts(ResourceGraph graph, String id) {
        List<String> texts = new ArrayList<>();
        graph.originalMetadata(id).values().forEach(v -> {
            if (v != null) {
                texts.add(String.valueOf(v));
            }
        });
        if (graph.hasMetadata(id)) {
            graph.metadata(id).values().forEach(v -> {
                if (v != null) {
                    texts.add(String.valueOf(v));
                }
            });
        }
        return texts;
    }

    private static Set<String> attributeKeys(ResourceGraph graph, String id) {
        Set<String> keys = new LinkedHashSet<>(graph.originalMetadata(id).keySet());
        if (graph.hasMetadata(id)) {
            keys.addAll(graph.metadata(id).keySet());
        }
        return keys;
    }
}
