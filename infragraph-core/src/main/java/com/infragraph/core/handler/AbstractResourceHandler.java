package com.infragraph.core.handler;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Base class for handlers, providing attribute access and the re-pointing moves most
 * handlers share.
 *
 * <p>Attributes are read through {@link ResourceGraph#attribute(String, String)}: working
 * metadata first, then the raw inventory attributes. Consolidated nodes only carry working
 * metadata, so reading the raw attributes alone would miss them.
 *
 * @see ResourceHandler
 */
public abstract class AbstractResourceHandler implements ResourceHandler {

    /**
     * Logger named after the concrete handler class.
     */
    protected final Logger log;

    protected AbstractResourceHandler() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Classification ====================

    protected static boolean isGroup(String id, RuleConfiguration rules) {
        return rules.isGroupType(ResourceIds.typeOf(id));
    }

    protected static boolean hasType(String id, String type) {
        return ResourceIds.typeOf(id).equals(type);
    }

    protected static boolean startsWith(String id, String prefix) {
        return ResourceIds.stripModule(id).startsWith(prefix);
    }

    // ==================== Attribute Access ====================

    /**
     * Reads a scalar attribute as a string.
     *
     * @param graph graph
     * @param id node identifier
     * @param key attribute name
     * @return string value, or null when absent or not a scalar
     */
    protected static String stringAttribute(ResourceGraph graph, String id, String key) {
        Object value = graph.attribute(id, key);
        if (value == null || value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return null;
        }
        String text = String.valueOf(value).trim();
        return text.isEmpty() ? null : text;
    }

    /**
     * Reads a block attribute. A list of blocks yields its first element.
     *
     * @param graph graph
     * @param id node identifier
     * @param key attribute name
     * @return block attributes, empty when absent
     */
    @SuppressWarnings("unchecked")
    protected static Map<String, Object> mapAttribute(ResourceGraph graph, String id, String key) {
        Object value = graph.attribute(id, key);
        if (value instanceof List<?> list && !list.isEmpty()) {
            value = list.get(0);
        }
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return Map.of();
    }

    /**
     * Reads a list attribute as strings. A scalar yields a single-element list.
     *
     * @param graph graph
     * @param id node identifier
     * @param key attribute name
     * @return values, empty when absent
     */
    protected static List<String> stringListAttribute(ResourceGraph graph, String id, String key) {
        return toStringList(graph.attribute(id, key));
    }

    protected static List<String> toStringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> items) {
            List<String> result = new ArrayList<>();
            for (Object item : items) {
                if (item != null) {
                    result.add(String.valueOf(item));
                }
            }
            return result;
        }
        return List.of(String.valueOf(value));
    }

    // ==================== Reference Matching ====================

    /**
     * Checks whether an attribute reference points at a node: either the reference is part of
     * the identifier, or the identifier (without module path or number) is part of the reference.
     *
     * @param reference attribute value, e.g. {@code ${azurerm_virtual_network.main.name}}
     * @param id node identifier
     * @return true on a match
     */
    protected static boolean refersTo(String reference, String id) {
        if (reference == null || reference.isBlank()) {
            return false;
        }
        return id.contains(reference) || reference.contains(ResourceIds.baseName(ResourceIds.stripModule(id)));
    }

    protected static Optional<String> findReferenced(String reference, Collection<String> candidates) {
        return candidates.stream().filter(c -> refersTo(reference, c)).findFirst();
    }

    // ==================== Graph Moves ====================

    /**
     * Folds a generic node into a variant node: moves the connections accepted by
     * {@code moveConnection} to the variant, re-points the parents accepted by
     * {@code repointParent}, then links the original to the variant.
     *
     * @param graph graph
     * @param original generic node
     * @param variant variant node, created when absent
     * @param moveConnection connections to move
     * @param repointParent parents to re-point
     */
    protected void foldInto(ResourceGraph graph, String original, String variant,
                            Predicate<String> moveConnection, Predicate<String> repointParent) {
        if (!graph.hasMetadata(variant)) {
            graph.setMetadata(variant, graph.metadata(original));
        }
        graph.addNode(variant);
        for (String connection : new ArrayList<>(graph.connections(original))) {
            if (connection.equals(variant) || !moveConnection.test(connection)) {
                continue;
            }
            graph.connect(variant, connection);
            graph.disconnect(original, connection);
        }
        for (String parent : sorted(graph.parentsOf(original))) {
            if (parent.equals(variant) || !repointParent.test(parent)) {
                continue;
            }
            graph.connect(parent, variant);
            graph.disconnect(parent, original);
        }
        graph.connect(original, variant);
        log.debug("Folded {} into {}", original, variant);
    }

    /**
     * Creates {@code copy} with the connections and working metadata of {@code source}.
     *
     * @param graph graph
     * @param source node to copy
     * @param copy identifier of the copy
     */
    protected static void copyNode(ResourceGraph graph, String source, String copy) {
        graph.setConnections(copy, graph.connections(source));
        graph.setMetadata(copy, graph.metadata(source));
    }

    protected static List<String> sorted(Collection<String> values) {
        List<String> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return copy;
    }
}
