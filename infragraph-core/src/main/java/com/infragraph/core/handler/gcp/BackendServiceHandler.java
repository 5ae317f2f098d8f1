package com.infragraph.core.handler.gcp;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.Locale;

/**
 * Resolves backend services to the kind of load balancer they implement and links the
 * forwarding rules that front them.
 */
public class BackendServiceHandler extends AbstractResourceHandler {

    private static final String BACKEND_TYPE = "google_compute_backend_service";
    private static final String FORWARDING_RULE_PREFIX = "google_compute_";

    @Override
    public String getId() {
        return "gcp-load-balancer";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String backend : graph.findNodes(id -> hasType(id, BACKEND_TYPE))) {
            String scheme = valueOr(graph, backend, "load_balancing_scheme", "EXTERNAL");
            String protocol = valueOr(graph, backend, "protocol", "HTTP");
            String type = loadBalancerType(scheme, protocol);
            String renamed = type + ".lb";

            foldInto(graph, backend, renamed, connection -> true, parent -> true);
            graph.metadata(renamed).put("load_balancing_scheme", scheme);
            graph.metadata(renamed).put("protocol", protocol);

            for (String rule : graph.findNodes(this::isForwardingRule)) {
                String target = stringAttribute(graph, rule, "backend_service");
                if (target == null) {
                    target = stringAttribute(graph, rule, "target");
                }
                if (refersTo(target, backend)) {
                    graph.connect(rule, renamed);
                }
            }
            log.debug("Resolved backend service {} to {}", backend, renamed);
        }
    }

    /**
     * Maps a load balancing scheme and protocol to a load balancer type.
     *
     * @param scheme {@code EXTERNAL}, {@code INTERNAL}, {@code INTERNAL_MANAGED}, ...
     * @param protocol {@code HTTP}, {@code HTTPS}, {@code SSL}, {@code TCP}, ...
     * @return load balancer resource type
     */
    static String loadBalancerType(String scheme, String protocol) {
        String upperScheme = scheme.toUpperCase(Locale.ROOT);
        String upperProtocol = protocol.toUpperCase(Locale.ROOT);
        if (upperScheme.startsWith("INTERNAL")) {
            return "google_compute_internal_lb";
        }
        if (upperProtocol.equals("HTTP") || upperProtocol.equals("HTTPS")) {
            return "google_compute_http_lb";
        }
        if (upperProtocol.equals("SSL") || upperProtocol.equals("TCP")) {
            return "google_compute_tcp_lb";
        }
        return "google_compute_network_lb";
    }

    private boolean isForwardingRule(String id) {
        return startsWith(id, FORWARDING_RULE_PREFIX) && id.contains("forwarding_rule");
    }

    private static String valueOr(ResourceGraph graph, String id, String key, String fallback) {
        String value = stringAttribute(graph, id, key);
        return value == null ? fallback : value;
    }
}
