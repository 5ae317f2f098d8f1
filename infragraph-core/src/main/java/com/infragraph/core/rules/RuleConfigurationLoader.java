package com.infragraph.core.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.infragraph.core.exception.ProviderLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads {@link RuleConfiguration} tables from classpath YAML resources.
 *
 * <p>Unlike project configuration, a missing or malformed rule resource is an error:
 * the caller decides whether to fall back to generic behavior.
 *
 * <pre>{@code
 * RuleConfiguration aws = RuleConfigurationLoader.load("aws", "providers/aws.yaml");
 * }</pre>
 */
public final class RuleConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleConfigurationLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private RuleConfigurationLoader() {
        // utility
    }

    /**
     * Loads a rule resource using this class's class loader.
     *
     * @param providerId provider the rules belong to
     * @param resource classpath resource path
     * @return parsed rules
     * @throws ProviderLoadException if the resource is missing or malformed
     */
    public static RuleConfiguration load(String providerId, String resource) {
        return load(providerId, resource, RuleConfigurationLoader.class.getClassLoader());
    }

    /**
     * Loads a rule resource using the given class loader, so that extension providers can ship
     * their tables in their own jars.
     *
     * @param providerId provider the rules belong to
     * @param resource classpath resource path
     * @param classLoader loader to resolve the resource with
     * @return parsed rules
     * @throws ProviderLoadException if the resource is missing or malformed
     */
    public static RuleConfiguration load(String providerId, String resource, ClassLoader classLoader) {
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ProviderLoadException(providerId, "Rule resource not found: " + resource, null);
            }
            RuleConfiguration rules = YAML_MAPPER.readValue(in, RuleConfiguration.class);
            if (rules == null) {
                throw new ProviderLoadException(providerId, "Rule resource is empty: " + resource, null);
            }
            log.debug("Loaded {} rules from {}: {} consolidated families, {} special resources",
                providerId, resource, rules.consolidatedNodes().size(), rules.specialResources().size());
            return rules;
        } catch (IOException e) {
            throw new ProviderLoadException(providerId,
                "Failed to parse rule resource " + resource + ": " + e.getMessage(), e);
        }
    }
}
