package com.infragraph.core.handler.azure;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;

import java.util.Locale;
import java.util.Map;

/**
 * Resolves Azure load balancers to their SKU variant ({@code azurerm_lb_standard.lb},
 * {@code azurerm_lb_basic.lb}) and attaches their backend address pools.
 */
public class AzureLoadBalancerHandler extends AbstractResourceHandler {

    private static final String LB_TYPE = "azurerm_lb";
    private static final String POOL_TYPE = "azurerm_lb_backend_address_pool";
    private static final String DEFAULT_SKU = "Basic";

    @Override
    public String getId() {
        return "azure-load-balancer";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        for (String lb : graph.findNodes(id -> hasType(id, LB_TYPE))) {
            String sku = skuOf(graph, lb);
            String renamed = LB_TYPE + "_" + sku.toLowerCase(Locale.ROOT) + ".lb";
            foldInto(graph, lb, renamed, connection -> true, parent -> true);
            graph.metadata(renamed).put("sku", sku);
            if (graph.count(lb) > graph.count(renamed)) {
                graph.setCount(renamed, graph.count(lb));
            }
            for (String pool : graph.findNodes(id -> hasType(id, POOL_TYPE))) {
                if (refersTo(stringAttribute(graph, pool, "loadbalancer_id"), lb)) {
                    graph.connect(renamed, pool);
                }
            }
        }
    }

    static String skuOf(ResourceGraph graph, String lb) {
        Object sku = graph.attribute(lb, "sku");
        if (sku instanceof Map<?, ?> block) {
            sku = block.get("name");
        }
        if (sku == null || String.valueOf(sku).isBlank()) {
            return DEFAULT_SKU;
        }
        return String.valueOf(sku);
    }
}
