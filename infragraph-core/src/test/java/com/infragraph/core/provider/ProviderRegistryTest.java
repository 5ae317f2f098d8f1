package com.infragraph.core.provider;

import com.infragraph.core.exception.DuplicateProviderException;
import com.infragraph.core.exception.ProviderDetectionException;
import com.infragraph.core.exception.ProviderLoadException;
import com.infragraph.core.exception.UnknownProviderException;
import com.infragraph.core.handler.HandlerSet;
import com.infragraph.core.model.DetectionMethod;
import com.infragraph.core.model.ProviderDetection;
import com.infragraph.core.model.ResourceInventory;
import com.infragraph.core.model.ResourceRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ProviderRegistry}.
 */
class ProviderRegistryTest {

    private static ResourceRecord resource(String type, String name) {
        return new ResourceRecord(type, name, "main.tf", Map.of());
    }

    private static ResourceRecord resource(String type, String name, String providerField) {
        return new ResourceRecord(type, name, "main.tf", Map.of(ProviderRegistry.PROVIDER_FIELD, providerField));
    }

    @Test
    void withBuiltIns_discoversAwsAzureGcp_awsIsDefault() {
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();

        assertThat(registry.descriptors()).extracting(ProviderDescriptor::id)
            .containsExactly("aws", "azure", "gcp");
        assertThat(registry.defaultProvider()).contains("aws");
    }

    @Test
    void register_duplicateId_throws() {
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();
        ProviderDescriptor duplicate = new ProviderDescriptor("aws", "Again", List.of("aws_"), null,
            "providers/aws.yaml", null);

        assertThatThrownBy(() -> registry.register(duplicate))
            .isInstanceOf(DuplicateProviderException.class)
            .hasMessageContaining("aws");
    }

    @Test
    void detectProviderForNode_moduleId_resolvesLikePlainId() {
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();

        // Repeated calls must agree: detection is deterministic
        for (int i = 0; i < 5; i++) {
            assertThat(registry.detectProviderForNode("module.vpc.aws_subnet.private")).contains("aws");
        }
        assertThat(registry.detectProviderForNode("azurerm_subnet.app")).contains("azure");
        assertThat(registry.detectProviderForNode("google_compute_network.vpc")).contains("gcp");
        assertThat(registry.detectProviderForNode("random_string.suffix")).isEmpty();
    }

    @Test
    void detectProviderForNode_longestPrefixWins() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new ProviderDescriptor("generic", null, List.of("cloud_"), null, "none.yaml", null));
        registry.register(new ProviderDescriptor("special", null, List.of("cloud_special_"), null, "none.yaml", null));

        assertThat(registry.detectProviderForNode("cloud_special_bucket.a")).contains("special");
        assertThat(registry.detectProviderForNode("cloud_bucket.a")).contains("generic");
    }

    @Test
    void detectProviders_mixedInventory_primaryHasMostResources() {
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();
        ResourceInventory inventory = new ResourceInventory(List.of(
            resource("aws_vpc", "main"),
            resource("azurerm_resource_group", "rg"),
            resource("azurerm_virtual_network", "vnet"),
            resource("google_compute_network", "net")));

        ProviderDetection detection = registry.detectProviders(inventory);

        assertThat(detection.providers()).containsExactly("aws", "azure", "gcp");
        assertThat(detection.primaryProvider()).isEqualTo("azure");
        assertThat(detection.detectionMethod()).isEqualTo(DetectionMethod.RESOURCE_PREFIX);
        assertThat(detection.confidence()).isEqualTo(1.0);
        assertThat(detection.isMultiCloud()).isTrue();
    }

    @Test
    void detectProviders_tie_brokenByRegistrationOrder() {
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();
        ResourceInventory inventory = new ResourceInventory(List.of(
            resource("google_compute_network", "net"),
            resource("aws_vpc", "main")));

        assertThat(registry.detectProviders(inventory).primaryProvider()).isEqualTo("aws");
    }

    @Test
    void detectProviders_providerField_takesPrecedenceOverPrefix() {
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();
        ResourceInventory inventory = new ResourceInventory(List.of(
            resource("aws_vpc", "main", "registry.terraform.io/hashicorp/google"),
            resource("aws_subnet", "a")));

        ProviderDetection detection = registry.detectProviders(inventory);

        assertThat(detection.primaryProvider()).isEqualTo("gcp");
        assertThat(detection.detectionMethod()).isEqualTo(DetectionMethod.PROVIDER_FIELD);
        assertThat(detection.confidence()).isEqualTo(0.65);
    }

    @Test
    void detectProviders_noKnownResources_fallsBackToDefault() {
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();
        ResourceInventory inventory = new ResourceInventory(List.of(resource("random_string", "suffix")));

        ProviderDetection detection = registry.detectProviders(inventory);

        assertThat(detection.primaryProvider()).isEqualTo("aws");
        assertThat(detection.detectionMethod()).isEqualTo(DetectionMethod.DEFAULT);
        assertThat(detection.confidence()).isEqualTo(0.4);
    }

    @Test
    void detectProviders_noKnownResourcesAndNoDefault_throws() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new ProviderDescriptor("gcp", null, List.of("google_"), null, "providers/gcp.yaml", null));
        ResourceInventory inventory = new ResourceInventory(List.of(resource("random_string", "suffix")));

        assertThatThrownBy(() -> registry.detectProviders(inventory))
            .isInstanceOf(ProviderDetectionException.class)
            .hasMessageContaining("resource_count=1");
    }

    @Test
    void detectProviders_emptyInventory_throws() {
        assertThatThrownBy(() -> ProviderRegistry.withBuiltIns().detectProviders(ResourceInventory.empty()))
            .isInstanceOf(ProviderDetectionException.class);
    }

    @Test
    void confidence_ratioBuckets_matchTable() {
        assertThat(ProviderRegistry.confidence(10, 10)).isEqualTo(1.0);
        assertThat(ProviderRegistry.confidence(9, 10)).isEqualTo(0.95);
        assertThat(ProviderRegistry.confidence(8, 10)).isEqualTo(0.85);
        assertThat(ProviderRegistry.confidence(7, 10)).isEqualTo(0.75);
        assertThat(ProviderRegistry.confidence(5, 10)).isEqualTo(0.65);
        assertThat(ProviderRegistry.confidence(4, 10)).isEqualTo(0.4);
    }

    @Test
    void getContext_unknownId_fallsBackToDefault() {
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();

        assertThat(registry.getContext("oracle").id()).isEqualTo("aws");
        assertThat(registry.getContext("gcp")).isSameAs(registry.getContext("gcp"));
    }

    @Test
    void getContext_unknownIdWithoutDefault_throws() {
        assertThatThrownBy(() -> new ProviderRegistry().getContext("oracle"))
            .isInstanceOf(UnknownProviderException.class)
            .hasMessageContaining("oracle");
    }

    @Test
    void getContext_builtIns_loadRulesAndHandlers() {
        ProviderRegistry registry = ProviderRegistry.withBuiltIns();

        for (String id : List.of("aws", "azure", "gcp")) {
            ProviderContext context = registry.getContext(id);
            assertThat(context.getConfig().provider()).isEqualTo(id);
            for (var special : context.getConfig().specialResources()) {
                assertThat(context.getHandlers().ids())
                    .as("handlers of %s for %s", id, special.prefix())
                    .containsAll(special.handlers());
            }
            assertThat(context.getHandlers().ids()).containsAll(context.getConfig().postExpansionHandlers());
        }
    }

    @Test
    void getConfigOrEmpty_missingRules_returnsEmptyRules() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new ProviderDescriptor("oci", null, List.of("oci_"), null, "providers/oci.yaml", null), true);
        ProviderContext context = registry.getContext("oci");

        assertThatThrownBy(context::getConfig).isInstanceOf(ProviderLoadException.class);
        assertThat(context.getConfigOrEmpty().provider()).isEqualTo("oci");
        assertThat(context.getConfigOrEmpty().specialResources()).isEmpty();
    }

    @Test
    void getHandlersOrEmpty_failingFactory_returnsEmptyAndRetriesLater() {
        List<Integer> calls = new ArrayList<>();
        ProviderRegistry registry = new ProviderRegistry();
        registry.register(new ProviderDescriptor("broken", null, List.of("broken_"), null, "none.yaml", () -> {
            calls.add(1);
            throw new IllegalStateException("boom");
        }));
        ProviderContext context = registry.getContext("broken");

        assertThat(context.getHandlersOrEmpty().size()).isZero();
        assertThat(context.getHandlersOrEmpty()).isSameAs(HandlerSet.empty());
        assertThat(calls).hasSize(2);
    }
}
