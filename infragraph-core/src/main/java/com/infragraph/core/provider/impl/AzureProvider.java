package com.infragraph.core.provider.impl;

import com.infragraph.core.handler.HandlerSet;
import com.infragraph.core.handler.azure.ApplicationGatewayHandler;
import com.infragraph.core.handler.azure.AzureLoadBalancerHandler;
import com.infragraph.core.handler.azure.NetworkSecurityGroupHandler;
import com.infragraph.core.handler.azure.VnetSubnetHandler;
import com.infragraph.core.handler.common.RandomStringHandler;
import com.infragraph.core.handler.common.SharedServicesHandler;
import com.infragraph.core.provider.ProviderDescriptor;
import com.infragraph.core.provider.ProviderPlugin;

import java.util.List;

/**
 * Microsoft Azure (azurerm, azuread, azurestack and azapi resources).
 */
public class AzureProvider implements ProviderPlugin {

    public static final String ID = "azure";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Microsoft Azure";
    }

    @Override
    public ProviderDescriptor descriptor() {
        return new ProviderDescriptor(ID, getDisplayName(),
            List.of("azurerm_", "azuread_", "azurestack_", "azapi_"),
            List.of("azurerm", "azuread", "azurestack", "azapi"),
            "providers/azure.yaml",
            () -> HandlerSet.of(
                new VnetSubnetHandler(),
                new NetworkSecurityGroupHandler(),
                new AzureLoadBalancerHandler(),
                new ApplicationGatewayHandler(),
                new SharedServicesHandler(),
                new RandomStringHandler()
            ));
    }
}
