package com.infragraph.core.provider;

/**
 * Service provider interface for contributing cloud providers.
 *
 * <p>Plugins are discovered with {@link java.util.ServiceLoader}; built-ins are listed in
 * {@code META-INF/services/com.infragraph.core.provider.ProviderPlugin}. An extension jar
 * registers its own plugin the same way and ships its rule tables as a classpath resource.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class OciProvider implements ProviderPlugin {
 *     @Override
 *     public String getId() {
 *         return "oci";
 *     }
 *
 *     @Override
 *     public String getDisplayName() {
 *         return "Oracle Cloud Infrastructure";
 *     }
 *
 *     @Override
 *     public ProviderDescriptor descriptor() {
 *         return new ProviderDescriptor(getId(), getDisplayName(), List.of("oci_"), List.of("oci"),
 *             "providers/oci.yaml", () -> HandlerSet.of(new RandomStringHandler()));
 *     }
 * }
 * }</pre>
 */
public interface ProviderPlugin {

    String getId();

    String getDisplayName();

    /**
     * Returns the descriptor registered for this provider.
     *
     * @return provider descriptor
     */
    ProviderDescriptor descriptor();

    /**
     * Whether this provider is the fallback for unknown identifiers. At most one registered
     * provider should return true.
     *
     * @return true for the default provider
     */
    default boolean isDefault() {
        return false;
    }
}
