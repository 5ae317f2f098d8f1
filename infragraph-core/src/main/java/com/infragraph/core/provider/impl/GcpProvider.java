package com.infragraph.core.provider.impl;

import com.infragraph.core.handler.HandlerSet;
import com.infragraph.core.handler.common.RandomStringHandler;
import com.infragraph.core.handler.common.SharedServicesHandler;
import com.infragraph.core.handler.gcp.BackendServiceHandler;
import com.infragraph.core.handler.gcp.CloudDnsHandler;
import com.infragraph.core.handler.gcp.FirewallHandler;
import com.infragraph.core.handler.gcp.NetworkSubnetHandler;
import com.infragraph.core.provider.ProviderDescriptor;
import com.infragraph.core.provider.ProviderPlugin;

import java.util.List;

/**
 * Google Cloud Platform (google and google-beta resources).
 */
public class GcpProvider implements ProviderPlugin {

    public static final String ID = "gcp";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Google Cloud Platform";
    }

    @Override
    public ProviderDescriptor descriptor() {
        return new ProviderDescriptor(ID, getDisplayName(), List.of("google_"),
            List.of("google", "google-beta"), "providers/gcp.yaml",
            () -> HandlerSet.of(
                new NetworkSubnetHandler(),
                new FirewallHandler(),
                new BackendServiceHandler(),
                new CloudDnsHandler(),
                new SharedServicesHandler(),
                new RandomStringHandler()
            ));
    }
}
