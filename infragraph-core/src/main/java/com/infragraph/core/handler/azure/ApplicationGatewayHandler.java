package com.infragraph.core.handler.azure;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.Locale;
import java.util.Map;

/**
 * Resolves application gateways to their tier and records their firewall settings.
 *
 * <p>WAF tiers map to {@code azurerm_application_gateway_waf.appgw}; other tiers to
 * {@code azurerm_application_gateway_<tier>.appgw} with underscores dropped. Resources
 * naming the gateway in {@code application_gateway_name} hang off the resolved node.
 */
public class ApplicationGatewayHandler extends AbstractResourceHandler {

    private static final String GATEWAY_TYPE = "azurerm_application_gateway";
    private static final String DEFAULT_TIER = "Standard_v2";
    private static final String DEFAULT_WAF_MODE = "Detection";

    @Override
    public String getId() {
        return "azure-app-gateway";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String gateway : graph.findNodes(id -> hasType(id, GATEWAY_TYPE))) {
            Object tierValue = mapAttribute(graph, gateway, "sku").get("tier");
            String tier = tierValue == null ? DEFAULT_TIER : String.valueOf(tierValue);
            boolean waf = tier.toLowerCase(Locale.ROOT).contains("waf");
            String renamed = waf
                ? GATEWAY_TYPE + "_waf.appgw"
                : GATEWAY_TYPE + "_" + tier.toLowerCase(Locale.ROOT).replace("_", "") + ".appgw";

            foldInto(graph, gateway, renamed, connection -> true, parent -> true);
            Map<String, Object> metadata = graph.metadata(renamed);
            metadata.put("tier", tier);
            metadata.put("waf_enabled", waf);
            Map<String, Object> firewall = mapAttribute(graph, gateway, "waf_configuration");
            if (!firewall.isEmpty()) {
                metadata.put("waf_mode", firewall.getOrDefault("firewall_mode", DEFAULT_WAF_MODE));
                metadata.put("waf_enabled", firewall.getOrDefault("enabled", waf));
            }

            for (String node : graph.nodeSnapshot()) {
                if (!node.equals(renamed) && refersTo(stringAttribute(graph, node, "application_gateway_name"), gateway)) {
                    graph.connect(renamed, node);
                }
            }
            log.debug("Resolved application gateway {} to {}", gateway, renamed);
        }
    }
}
