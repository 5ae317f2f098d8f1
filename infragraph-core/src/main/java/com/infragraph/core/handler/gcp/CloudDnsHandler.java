package com.infragraph.core.handler.gcp;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Classifies Cloud DNS zones and attaches their record sets.
 *
 * <p>Zones are tagged {@code peering}, {@code forwarding}, {@code private} or {@code public}.
 * Networks listed in a private zone's visibility config point at the zone, and record sets
 * hang off the zone named by their {@code managed_zone}.
 */
public class CloudDnsHandler extends AbstractResourceHandler {

    private static final String ZONE_TYPE = "google_dns_managed_zone";
    private static final String RECORD_TYPE = "google_dns_record_set";
    private static final String NETWORK_TYPE = "google_compute_network";

    @Override
    public String getId() {
        return "gcp-cloud-dns";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        List<String> networks = graph.findNodes(id -> hasType(id, NETWORK_TYPE));
        List<String> records = graph.findNodes(id -> hasType(id, RECORD_TYPE));

        for (String zone : graph.findNodes(id -> hasType(id, ZONE_TYPE))) {
            String zoneType = zoneType(graph, zone);
            Map<String, Object> metadata = graph.metadata(zone);
            metadata.put("zone_type", zoneType);
            metadata.put("dnssec_enabled", "on".equals(mapAttribute(graph, zone, "dnssec_config").get("state")));

            if ("private".equals(zoneType)) {
                for (String url : networkUrls(graph, zone)) {
                    findReferenced(url, networks).ifPresent(network -> graph.connect(network, zone));
                }
            }
            for (String record : records) {
                if (refersTo(stringAttribute(graph, record, "managed_zone"), zone)) {
                    graph.connect(zone, record);
                    graph.disconnect(record, zone);
                    Object recordType = graph.attribute(record, "type");
                    graph.metadata(record).put("record_type", recordType == null ? "A" : recordType);
                    graph.metadata(record).put("managed_zone", zone);
                }
            }
            log.debug("Classified DNS zone {} as {}", zone, zoneType);
        }
    }

    /**
     * Classifies a zone from its peering, forwarding and visibility settings.
     *
     * @param graph graph
     * @param zone zone node
     * @return zone type
     */
    static String zoneType(ResourceGraph graph, String zone) {
        if (!mapAttribute(graph, zone, "peering_config").isEmpty()) {
            return "peering";
        }
        if (!mapAttribute(graph, zone, "forwarding_config").isEmpty()) {
            return "forwarding";
        }
        String visibility = stringAttribute(graph, zone, "visibility");
        return visibility == null ? "public" : visibility.toLowerCase(Locale.ROOT);
    }

    private static List<String> networkUrls(ResourceGraph graph, String zone) {
        Object networks = mapAttribute(graph, zone, "private_visibility_config").get("networks");
        if (networks instanceof Map<?, ?> single) {
            networks = List.of(single);
        }
        if (!(networks instanceof Collection<?> items)) {
            return List.of();
        }
        return items.stream()
            .filter(Map.class::isInstance)
            .map(item -> ((Map<?, ?>) item).get("network_url"))
            .filter(Objects::nonNull)
            .map(String::valueOf)
            .toList();
    }
}
