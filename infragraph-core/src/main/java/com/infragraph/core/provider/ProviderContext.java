package com.infragraph.core.provider;

import com.infragraph.core.exception.ProviderLoadException;
import com.infragraph.core.handler.HandlerSet;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.rules.RuleConfigurationLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runtime view of a registered provider: its descriptor plus lazily loaded rules and handlers.
 *
 * <p>Rules and handlers are loaded on first access and cached for the lifetime of the context.
 * A failed load is not cached, so a later call retries.
 */
public final class ProviderContext {

    private static final Logger log = LoggerFactory.getLogger(ProviderContext.class);

    private final ProviderDescriptor descriptor;
    private final ClassLoader classLoader;
    private RuleConfiguration rules;
    private HandlerSet handlers;

    ProviderContext(ProviderDescriptor descriptor, ClassLoader classLoader) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor must not be null");
        this.classLoader = classLoader == null ? ProviderContext.class.getClassLoader() : classLoader;
    }

    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    public String id() {
        return descriptor.id();
    }

    /**
     * Returns the provider's rule tables, loading them on first use.
     *
     * @return rule configuration
     * @throws ProviderLoadException if the rule resource is missing or malformed
     */
    public synchronized RuleConfiguration getConfig() {
        if (rules == null) {
            rules = RuleConfigurationLoader.load(descriptor.id(), descriptor.rulesResource(), classLoader);
        }
        return rules;
    }

    /**
     * Returns the provider's rule tables, or an empty rule set when they cannot be loaded.
     *
     * @return rule configuration, never null
     */
    public RuleConfiguration getConfigOrEmpty() {
        try {
            return getConfig();
        } catch (ProviderLoadException e) {
            log.warn("Rules for provider '{}' unavailable, using generic behavior: {}",
                descriptor.id(), e.getMessage());
            return RuleConfiguration.empty(descriptor.id());
        }
    }

    /**
     * Returns the provider's handlers, creating them on first use.
     *
     * @return handler set
     * @throws ProviderLoadException if the handler factory fails
     */
    public synchronized HandlerSet getHandlers() {
        if (handlers == null) {
            try {
                HandlerSet created = descriptor.handlerSetFactory().get();
                handlers = created == null ? HandlerSet.empty() : created;
            } catch (RuntimeException e) {
                throw new ProviderLoadException(descriptor.id(),
                    "Failed to create handlers for provider " + descriptor.id() + ": " + e.getMessage(), e);
            }
        }
        return handlers;
    }

    /**
     * Returns the provider's handlers, or an empty set when they cannot be created.
     *
     * @return handler set, never null
     */
    public HandlerSet getHandlersOrEmpty() {
        try {
            return getHandlers();
        } catch (ProviderLoadException e) {
            log.warn("Handlers for provider '{}' unavailable, skipping special processing: {}",
                descriptor.id(), e.getMessage());
            return HandlerSet.empty();
        }
    }

    @Override
    public String toString() {
        return "ProviderContext{" + descriptor.id() + "}";
    }
}
