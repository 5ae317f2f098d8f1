package com.infragraph.core.provider;

import com.infragraph.core.exception.DuplicateProviderException;
import com.infragraph.core.exception.ProviderDetectionException;
import com.infragraph.core.exception.UnknownProviderException;
import com.infragraph.core.model.DetectionMethod;
import com.infragraph.core.model.ProviderDetection;
import com.infragraph.core.model.ResourceInventory;
import com.infragraph.core.model.ResourceRecord;
import com.infragraph.core.util.ResourceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Function;

/**
 * Registry of cloud providers.
 *
 * <p>Maps resource type prefixes to provider ids, detects the providers an inventory uses and
 * hands out cached {@link ProviderContext}s. One registry is built per process (or per test)
 * and passed to the pipeline; {@link #reset()} drops the cached contexts.
 *
 * <p>All methods are synchronized. Registration normally happens once at startup and lookups
 * dominate afterwards.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProviderRegistry registry = ProviderRegistry.withBuiltIns();
 * registry.detectProviderForNode("module.vpc.aws_subnet.private"); // Optional[aws]
 * ProviderContext aws = registry.getContext("aws");
 * RuleConfiguration rules = aws.getConfig();
 * }</pre>
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    /** Attribute holding the provider source, e.g. {@code registry.terraform.io/hashicorp/aws}. */
    public static final String PROVIDER_FIELD = "provider_name";

    private final Map<String, ProviderDescriptor> descriptors = new LinkedHashMap<>();
    private final Map<String, ProviderContext> contexts = new LinkedHashMap<>();
    private final ClassLoader classLoader;
    private String defaultProvider;

    public ProviderRegistry() {
        this(ProviderRegistry.class.getClassLoader());
    }

    public ProviderRegistry(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    /**
     * Creates a registry populated with every {@link ProviderPlugin} visible to the class loader.
     *
     * @return populated registry
     */
    public static ProviderRegistry withBuiltIns() {
        ProviderRegistry registry = new ProviderRegistry();
        registry.discover();
        return registry;
    }

    /**
     * Registers every {@link ProviderPlugin} found through {@link ServiceLoader}.
     *
     * @return number of providers registered
     */
    public synchronized int discover() {
        int count = 0;
        for (ProviderPlugin plugin : ServiceLoader.load(ProviderPlugin.class, classLoader)) {
            register(plugin.descriptor(), plugin.isDefault());
            count++;
        }
        log.debug("Discovered {} provider plugins", count);
        return count;
    }

    public synchronized void register(ProviderDescriptor descriptor) {
        register(descriptor, false);
    }

    /**
     * Registers a provider.
     *
     * @param descriptor provider descriptor
     * @param isDefault whether unknown provider ids fall back to this provider
     * @throws DuplicateProviderException if the id is already registered
     */
    public synchronized void register(ProviderDescriptor descriptor, boolean isDefault) {
        if (descriptors.containsKey(descriptor.id())) {
            throw new DuplicateProviderException(descriptor.id());
        }
        descriptors.put(descriptor.id(), descriptor);
        if (isDefault) {
            defaultProvider = descriptor.id();
        }
        log.debug("Registered provider '{}' with prefixes {}{}", descriptor.id(),
            descriptor.resourcePrefixes(), isDefault ? " (default)" : "");
    }

    public synchronized List<ProviderDescriptor> descriptors() {
        return List.copyOf(descriptors.values());
    }

    public synchronized Optional<String> defaultProvider() {
        return Optional.ofNullable(defaultProvider);
    }

    public synchronized boolean isRegistered(String providerId) {
        return descriptors.containsKey(providerId);
    }

    /**
     * Finds the provider owning a resource identifier. Module path segments are ignored, so
     * {@code module.vpc.aws_subnet.private} and {@code aws_subnet.private} resolve alike. The
     * longest matching prefix wins; ties go to the provider registered first.
     *
     * @param resourceId resource identifier
     * @return provider id, empty when no registered prefix matches
     */
    public synchronized Optional<String> detectProviderForNode(String resourceId) {
        if (resourceId == null || resourceId.isEmpty()) {
            return Optional.empty();
        }
        return providerForType(ResourceIds.typeOf(resourceId));
    }

    /**
     * Detects the providers used by an inventory.
     *
     * <p>The provider field of each resource is read first; when no resource carries a known
     * provider field, resource type prefixes are matched instead. When neither strategy finds a
     * provider the default provider is assumed.
     *
     * @param inventory raw inventory
     * @return detection result
     * @throws ProviderDetectionException if the inventory is empty, or nothing matched and no
     *                                    default provider is registered
     */
    public synchronized ProviderDetection detectProviders(ResourceInventory inventory) {
        if (inventory == null || inventory.isEmpty()) {
            throw new ProviderDetectionException(
                "No resources found; cannot detect a cloud provider without resources",
                Map.of("resource_count", 0));
        }

        Map<String, Integer> counts = countBy(inventory, this::providerFromField);
        DetectionMethod method = DetectionMethod.PROVIDER_FIELD;
        if (counts.isEmpty()) {
            counts = countBy(inventory, r -> providerForType(r.type()));
            method = DetectionMethod.RESOURCE_PREFIX;
        }

        if (counts.isEmpty()) {
            if (defaultProvider == null) {
                throw new ProviderDetectionException(
                    "Could not detect any supported cloud provider; no resource matched a known provider",
                    Map.of("resource_count", inventory.size()));
            }
            log.warn("No provider detected in {} resources, assuming default provider '{}'",
                inventory.size(), defaultProvider);
            return new ProviderDetection(List.of(defaultProvider), defaultProvider,
                Map.of(defaultProvider, 0), DetectionMethod.DEFAULT, confidence(0, inventory.size()));
        }

        String primary = null;
        for (String id : descriptors.keySet()) {
            Integer count = counts.get(id);
            if (count != null && (primary == null || count > counts.get(primary))) {
                primary = id;
            }
        }
        List<String> providers = new ArrayList<>(counts.keySet());
        providers.sort(String::compareTo);
        int known = counts.values().stream().mapToInt(Integer::intValue).sum();
        double confidence = confidence(known, inventory.size());

        log.info("Detected {} provider(s): {} (primary: {}, method: {}, confidence: {})",
            providers.size(), providers, primary, method, String.format("%.2f", confidence));
        return new ProviderDetection(providers, primary, counts, method, confidence);
    }

    /**
     * Returns the cached context for a provider. Unknown ids fall back to the default provider.
     *
     * @param providerId provider id
     * @return provider context
     * @throws UnknownProviderException if the id is unknown and no default provider is registered
     */
    public synchronized ProviderContext getContext(String providerId) {
        String resolved = providerId;
        if (resolved == null || !descriptors.containsKey(resolved)) {
            if (defaultProvider == null) {
                throw new UnknownProviderException(providerId);
            }
            log.debug("Unknown provider '{}', falling back to default '{}'", providerId, defaultProvider);
            resolved = defaultProvider;
        }
        return contexts.computeIfAbsent(resolved,
            id -> new ProviderContext(descriptors.get(id), classLoader));
    }

    /**
     * Drops cached contexts so rules and handlers are reloaded on next access.
     */
    public synchronized void reset() {
        contexts.clear();
    }

    private Optional<String> providerForType(String type) {
        String best = null;
        int bestLength = -1;
        for (ProviderDescriptor descriptor : descriptors.values()) {
            int length = descriptor.matchLength(type);
            if (length > bestLength) {
                best = descriptor.id();
                bestLength = length;
            }
        }
        return Optional.ofNullable(best);
    }

    private Optional<String> providerFromField(ResourceRecord record) {
        Object field = record.attributes().get(PROVIDER_FIELD);
        if (!(field instanceof String source) || source.isBlank()) {
            return Optional.empty();
        }
        String name = source.substring(source.lastIndexOf('/') + 1).trim();
        for (ProviderDescriptor descriptor : descriptors.values()) {
            if (descriptor.sourceNames().contains(name)) {
                return Optional.of(descriptor.id());
            }
        }
        return Optional.empty();
    }

    private static Map<String, Integer> countBy(ResourceInventory inventory,
                                                Function<ResourceRecord, Optional<String>> classifier) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (ResourceRecord record : inventory.resources()) {
            classifier.apply(record).ifPresent(id -> counts.merge(id, 1, Integer::sum));
        }
        return counts;
    }

    static double confidence(int known, int total) {
        if (total == 0) {
            return 0.4;
        }
        double ratio = (double) known / total;
        if (ratio >= 1.0) {
            return 1.0;
        } else if (ratio >= 0.9) {
            return 0.95;
        } else if (ratio >= 0.8) {
            return 0.85;
        } else if (ratio >= 0.7) {
            return 0.75;
        } else if (ratio >= 0.5) {
            return 0.65;
        }
        return 0.4;
    }
}
