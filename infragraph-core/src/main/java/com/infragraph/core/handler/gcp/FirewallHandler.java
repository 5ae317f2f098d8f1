package com.infragraph.core.handler.gcp;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Wraps compute instances in the firewall rules that apply to them.
 *
 * <p>A rule applies to an instance on the same network whose tags intersect the rule's
 * {@code target_tags}; a rule without target tags applies to every instance on the network.
 */
public class FirewallHandler extends AbstractResourceHandler {

    private static final String FIREWALL_TYPE = "google_compute_firewall";
    private static final String NETWORK_TYPE = "google_compute_network";
    private static final String INSTANCE_TYPE = "google_compute_instance";
    private static final String DEFAULT_DIRECTION = "INGRESS";

    @Override
    public String getId() {
        return "gcp-firewall";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> networks = graph.findNodes(id -> hasType(id, NETWORK_TYPE));
        List<String> instances = graph.findNodes(id -> hasType(id, INSTANCE_TYPE));

        for (String firewall : graph.findNodes(id -> hasType(id, FIREWALL_TYPE))) {
            String networkRef = stringAttribute(graph, firewall, "network");
            if (networkRef == null) {
                log.warn("Firewall {} has no network, skipping", firewall);
                continue;
            }
            Optional<String> network = findReferenced(networkRef, networks);
            String direction = Optional.ofNullable(stringAttribute(graph, firewall, "direction")).orElse(DEFAULT_DIRECTION);
            List<String> targetTags = stringListAttribute(graph, firewall, "target_tags");

            Map<String, Object> metadata = graph.metadata(firewall);
            metadata.put("direction", direction);
            metadata.put("network", network.map(ResourceIds::stripModule).orElse(networkRef));
            metadata.put("target_tags", targetTags);

            for (String instance : instances) {
                if (onNetwork(graph, instance, networkRef, network) && tagged(graph, instance, targetTags)) {
                    graph.connect(firewall, instance);
                    graph.disconnect(instance, firewall);
                    log.debug("Firewall {} applies to {}", firewall, instance);
                }
            }
        }
    }

    private static boolean onNetwork(ResourceGraph graph, String instance, String networkRef, Optional<String> network) {
        String interfaces = String.valueOf(graph.attribute(instance, "network_interface"));
        String direct = String.valueOf(graph.attribute(instance, "network"));
        String text = interfaces + direct;
        if (text.contains(networkRef)) {
            return true;
        }
        return network.map(n -> text.contains(ResourceIds.stripModule(n))).orElse(false);
    }

    private static boolean tagged(ResourceGraph graph, String instance, List<String> targetTags) {
        if (targetTags.isEmpty()) {
            return true;
        }
        List<String> tags = stringListAttribute(graph, instance, "tags");
        return tags.stream().anyMatch(targetTags::contains);
    }
}
