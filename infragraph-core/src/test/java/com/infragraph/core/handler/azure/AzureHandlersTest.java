package com.infragraph.core.handler.azure;

import com.infragraph.core.exception.MissingResourceException;
import com.infragraph.core.handler.HandlerTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the Azure handlers.
 */
class AzureHandlersTest extends HandlerTestBase {

    // ==================== Virtual Networks ====================

    @Test
    void vnetSubnets_apply_subnetPlacedInReferencedNetwork() {
        edges("azurerm_subnet.app", "azurerm_virtual_network.main");
        meta("azurerm_subnet.app", Map.of("virtual_network_name", "${azurerm_virtual_network.main.name}"));

        new VnetSubnetHandler().apply(graph, AZURE);

        assertThat(graph.connections("azurerm_virtual_network.main")).containsExactly("azurerm_subnet.app");
        assertThat(graph.connections("azurerm_subnet.app")).isEmpty();
        assertThat(graph.metadata("azurerm_subnet.app")).containsEntry("vnet", "azurerm_virtual_network.main");
    }

    @Test
    void vnetSubnets_apply_literalNetworkName_matchedByName() {
        meta("azurerm_virtual_network.hub", Map.of("name", "core-vnet"));
        meta("azurerm_subnet.app", Map.of("virtual_network_name", "core-vnet"));

        new VnetSubnetHandler().apply(graph, AZURE);

        assertThat(graph.connections("azurerm_virtual_network.hub")).containsExactly("azurerm_subnet.app");
    }

    @Test
    void vnetSubnets_apply_noNetwork_throwsMissingResource() {
        meta("azurerm_subnet.app", Map.of("virtual_network_name", "core-vnet"));

        assertThatThrownBy(() -> new VnetSubnetHandler().apply(graph, AZURE))
            .isInstanceOf(MissingResourceException.class)
            .hasMessageContaining("resource_type=azurerm_virtual_network")
            .hasMessageContaining("subnet_count=1");
    }

    // ==================== Network Security Groups ====================

    @Test
    void nsg_apply_subnetAssociation_groupWrapsSubnet() {
        // Given
        edges("azurerm_virtual_network.main", "azurerm_subnet.app");
        edges("azurerm_network_security_group.web");
        meta("azurerm_subnet_network_security_group_association.app", Map.of(
            "network_security_group_id", "${azurerm_network_security_group.web.id}",
            "subnet_id", "${azurerm_subnet.app.id}"));

        // When
        new NetworkSecurityGroupHandler().apply(graph, AZURE);

        // Then
        assertThat(graph.connections("azurerm_virtual_network.main"))
            .containsExactly("azurerm_network_security_group.web");
        assertThat(graph.connections("azurerm_network_security_group.web")).containsExactly("azurerm_subnet.app");
    }

    @Test
    void nsg_apply_unresolvedAssociation_leavesGraphUntouched() {
        edges("azurerm_virtual_network.main", "azurerm_subnet.app");
        edges("azurerm_network_security_group.web");
        meta("azurerm_subnet_network_security_group_association.app", Map.of(
            "network_security_group_id", "${azurerm_network_security_group.other.id}",
            "subnet_id", "${azurerm_subnet.app.id}"));

        new NetworkSecurityGroupHandler().apply(graph, AZURE);

        assertThat(graph.connections("azurerm_virtual_network.main")).containsExactly("azurerm_subnet.app");
        assertThat(graph.connections("azurerm_network_security_group.web")).isEmpty();
    }

    // ==================== Load Balancers ====================

    @Test
    void loadBalancer_apply_skuNamesVariantAndPoolsAttach() {
        // Given
        edges("azurerm_resource_group.rg", "azurerm_lb.main");
        meta("azurerm_lb.main", Map.of("sku", "Standard"));
        meta("azurerm_lb_backend_address_pool.be", Map.of("loadbalancer_id", "${azurerm_lb.main.id}"));

        // When
        new AzureLoadBalancerHandler().apply(graph, AZURE);

        // Then
        assertThat(graph.connections("azurerm_resource_group.rg")).containsExactly("azurerm_lb_standard.lb");
        assertThat(graph.connections("azurerm_lb_standard.lb")).containsExactly("azurerm_lb_backend_address_pool.be");
        assertThat(graph.metadata("azurerm_lb_standard.lb")).containsEntry("sku", "Standard");
    }

    @Test
    void skuOf_blockOrMissing_resolvesNameOrBasic() {
        meta("azurerm_lb.block", Map.of("sku", Map.of("name", "Gateway")));
        edges("azurerm_lb.bare");

        assertThat(AzureLoadBalancerHandler.skuOf(graph, "azurerm_lb.block")).isEqualTo("Gateway");
        assertThat(AzureLoadBalancerHandler.skuOf(graph, "azurerm_lb.bare")).isEqualTo("Basic");
    }

    // ==================== Application Gateways ====================

    @Test
    void appGateway_apply_wafTier_resolvesToWafVariant() {
        meta("azurerm_application_gateway.gw", Map.of(
            "sku", List.of(Map.of("tier", "WAF_v2")),
            "waf_configuration", List.of(Map.of("firewall_mode", "Prevention", "enabled", true))));
        meta("azurerm_web_application_firewall_policy.gw",
            Map.of("application_gateway_name", "${azurerm_application_gateway.gw.name}"));

        new ApplicationGatewayHandler().apply(graph, AZURE);

        String renamed = "azurerm_application_gateway_waf.appgw";
        assertThat(graph.metadata(renamed))
            .containsEntry("tier", "WAF_v2")
            .containsEntry("waf_enabled", true)
            .containsEntry("waf_mode", "Prevention");
        assertThat(graph.connections(renamed)).containsExactly("azurerm_web_application_firewall_policy.gw");
        assertThat(graph.connections("azurerm_application_gateway.gw")).containsExactly(renamed);
    }

    @Test
    void appGateway_apply_noSku_defaultsToStandardV2() {
        edges("azurerm_subnet.gw", "azurerm_application_gateway.gw");

        new ApplicationGatewayHandler().apply(graph, AZURE);

        assertThat(graph.connections("azurerm_subnet.gw")).containsExactly("azurerm_application_gateway_standardv2.appgw");
        assertThat(graph.metadata("azurerm_application_gateway_standardv2.appgw")).containsEntry("waf_enabled", false);
    }
}
