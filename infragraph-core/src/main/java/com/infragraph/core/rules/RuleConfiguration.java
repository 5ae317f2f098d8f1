package com.infragraph.core.rules;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.infragraph.core.util.ResourceIds;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Per-provider rule tables consumed by the rewrite passes, the detector, the validator and
 * the rendering traversal.
 *
 * <p>Loaded once per provider from a classpath YAML resource ({@code providers/aws.yaml}) and
 * never mutated afterwards. Map-valued tables keep their declaration order.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * provider: aws
 * consolidated_nodes:
 *   - prefix: aws_lb
 *     resource_name: aws_lb.elb
 *     vpc: true
 * group_nodes: [aws_vpc, aws_az, aws_subnet]
 * special_resources:
 *   - prefix: aws_subnet
 *     handlers: [aws-subnet-az]
 * }</pre>
 *
 * @param provider provider id these rules belong to
 * @param consolidatedNodes prefix families merged into one canonical node
 * @param groupNodes container types, in draw order
 * @param edgeNodes boundary types drawn inside the cloud but outside networks
 * @param outerNodes types drawn outside the cloud boundary
 * @param autoAnnotations synthetic nodes linked to matching resources
 * @param nodeVariants type to ordered keyword-to-variant-type map
 * @param reverseArrowList prefixes whose discovered references point the other way
 * @param forcedDestination prefixes that may only be edge destinations
 * @param forcedOrigin prefixes that may only be edge origins
 * @param impliedConnections attribute keyword to implied target type prefix
 * @param specialResources ordered prefix to handler-id dispatch table
 * @param postExpansionHandlers handler ids run after multi-instance expansion
 * @param sharedServices types collected under the shared services group
 * @param sharedServicesGroup identifier of the shared services group node
 * @param alwaysDrawLine types whose edges are always drawn solid
 * @param neverDrawLine types whose edges are never drawn
 * @param disconnectList prefixes whose outgoing edges are dropped before inference
 * @param hideNodes prefixes of resources excluded from the diagram
 * @param multiInstancePatterns implicit fan-out detection patterns
 * @param hierarchyRules allowed parent rules checked by the validator
 * @param sharedParentGroupPrefixes group prefixes that must not share un-numbered children
 * @param acronyms words rendered upper case in labels
 * @param nameReplacements label fragment replacements
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RuleConfiguration(
    @JsonProperty("provider") String provider,
    @JsonProperty("consolidated_nodes") List<ConsolidatedNode> consolidatedNodes,
    @JsonProperty("group_nodes") List<String> groupNodes,
    @JsonProperty("edge_nodes") List<String> edgeNodes,
    @JsonProperty("outer_nodes") List<String> outerNodes,
    @JsonProperty("auto_annotations") List<AutoAnnotation> autoAnnotations,
    @JsonProperty("node_variants") Map<String, Map<String, String>> nodeVariants,
    @JsonProperty("reverse_arrow_list") List<String> reverseArrowList,
    @JsonProperty("forced_destination") List<String> forcedDestination,
    @JsonProperty("forced_origin") List<String> forcedOrigin,
    @JsonProperty("implied_connections") Map<String, String> impliedConnections,
    @JsonProperty("special_resources") List<SpecialResource> specialResources,
    @JsonProperty("post_expansion_handlers") List<String> postExpansionHandlers,
    @JsonProperty("shared_services") List<String> sharedServices,
    @JsonProperty("shared_services_group") String sharedServicesGroup,
    @JsonProperty("always_draw_line") List<String> alwaysDrawLine,
    @JsonProperty("never_draw_line") List<String> neverDrawLine,
    @JsonProperty("disconnect_list") List<String> disconnectList,
    @JsonProperty("hide_nodes") List<String> hideNodes,
    @JsonProperty("multi_instance_patterns") List<MultiInstancePattern> multiInstancePatterns,
    @JsonProperty("hierarchy_rules") List<HierarchyRule> hierarchyRules,
    @JsonProperty("shared_parent_group_prefixes") List<String> sharedParentGroupPrefixes,
    @JsonProperty("acronyms") List<String> acronyms,
    @JsonProperty("name_replacements") Map<String, String> nameReplacements
) {
    /**
     * Compact constructor replacing absent tables with empty, read-only ones.
     */
    public RuleConfiguration {
        provider = provider == null ? "" : provider;
        consolidatedNodes = list(consolidatedNodes);
        groupNodes = list(groupNodes);
        edgeNodes = list(edgeNodes);
        outerNodes = list(outerNodes);
        autoAnnotations = list(autoAnnotations);
        nodeVariants = orderedMap(nodeVariants);
        reverseArrowList = list(reverseArrowList);
        forcedDestination = list(forcedDestination);
        forcedOrigin = list(forcedOrigin);
        impliedConnections = orderedMap(impliedConnections);
        specialResources = list(specialResources);
        postExpansionHandlers = list(postExpansionHandlers);
        sharedServices = list(sharedServices);
        alwaysDrawLine = list(alwaysDrawLine);
        neverDrawLine = list(neverDrawLine);
        disconnectList = list(disconnectList);
        hideNodes = list(hideNodes);
        multiInstancePatterns = list(multiInstancePatterns);
        hierarchyRules = list(hierarchyRules);
        sharedParentGroupPrefixes = list(sharedParentGroupPrefixes);
        acronyms = list(acronyms);
        nameReplacements = orderedMap(nameReplacements);
    }

    /**
     * Creates a rule set with no rules, used when a provider's rules cannot be loaded.
     *
     * @param provider provider id
     * @return empty rules
     */
    public static RuleConfiguration empty(String provider) {
        return new RuleConfiguration(provider, null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Merges the rules of several providers for the passes that run over the whole graph.
     * Lists are concatenated in argument order without duplicates; for map tables and the
     * shared services group the first provider declaring a key wins.
     *
     * @param configurations rules to merge, primary provider first
     * @return merged rules, whose provider id joins the merged ids with {@code +}
     */
    public static RuleConfiguration merge(List<RuleConfiguration> configurations) {
        if (configurations.isEmpty()) {
            return empty("");
        }
        if (configurations.size() == 1) {
            return configurations.get(0);
        }
        String provider = String.join("+", configurations.stream().map(RuleConfiguration::provider).toList());
        String sharedGroup = configurations.stream()
            .map(RuleConfiguration::sharedServicesGroup)
            .filter(g -> g != null && !g.isBlank())
            .findFirst()
            .orElse(null);
        return new RuleConfiguration(
            provider,
            concat(configurations, RuleConfiguration::consolidatedNodes),
            concat(configurations, RuleConfiguration::groupNodes),
            concat(configurations, RuleConfiguration::edgeNodes),
            concat(configurations, RuleConfiguration::outerNodes),
            concat(configurations, RuleConfiguration::autoAnnotations),
            union(configurations, RuleConfiguration::nodeVariants),
            concat(configurations, RuleConfiguration::reverseArrowList),
            concat(configurations, RuleConfiguration::forcedDestination),
            concat(configurations, RuleConfiguration::forcedOrigin),
            union(configurations, RuleConfiguration::impliedConnections),
            concat(configurations, RuleConfiguration::specialResources),
            concat(configurations, RuleConfiguration::postExpansionHandlers),
            concat(configurations, RuleConfiguration::sharedServices),
            sharedGroup,
            concat(configurations, RuleConfiguration::alwaysDrawLine),
            concat(configurations, RuleConfiguration::neverDrawLine),
            concat(configurations, RuleConfiguration::disconnectList),
            concat(configurations, RuleConfiguration::hideNodes),
            concat(configurations, RuleConfiguration::multiInstancePatterns),
            concat(configurations, RuleConfiguration::hierarchyRules),
            concat(configurations, RuleConfiguration::sharedParentGroupPrefixes),
            concat(configurations, RuleConfiguration::acronyms),
            union(configurations, RuleConfiguration::nameReplacements));
    }

    /**
     * Returns the draw order: outer nodes, edge nodes, group nodes, consolidated prefixes,
     * then the empty prefix standing for everything else.
     *
     * @return ordered prefix tiers
     */
    public List<List<String>> drawOrder() {
        List<String> consolidated = consolidatedNodes.stream().map(ConsolidatedNode::prefix).toList();
        return List.of(outerNodes, edgeNodes, groupNodes, consolidated, List.of(""));
    }

    /**
     * Returns the canonical consolidated identifier for a resource, using the first matching prefix.
     *
     * @param id resource identifier
     * @return consolidated identifier, if the resource belongs to a consolidated family
     */
    public Optional<String> consolidatedNameFor(String id) {
        String local = ResourceIds.stripModule(id);
        for (ConsolidatedNode node : consolidatedNodes) {
            if (local.startsWith(node.prefix())) {
                return Optional.of(node.resourceName());
            }
        }
        return Optional.empty();
    }

    public Optional<ConsolidatedNode> consolidatedNodeFor(String id) {
        String local = ResourceIds.stripModule(id);
        return consolidatedNodes.stream().filter(n -> local.startsWith(n.prefix())).findFirst();
    }

    /**
     * Resolves a node variant: for the first variant family the resource starts with, returns the
     * variant type of the first keyword contained in the metadata text.
     *
     * @param id resource identifier
     * @param metadataText string rendering of the resource's metadata
     * @return variant type, if any keyword matched
     */
    public Optional<String> variantFor(String id, String metadataText) {
        String local = ResourceIds.stripModule(id);
        for (Map.Entry<String, Map<String, String>> family : nodeVariants.entrySet()) {
            if (!local.startsWith(family.getKey())) {
                continue;
            }
            for (Map.Entry<String, String> keyword : family.getValue().entrySet()) {
                if (metadataText != null && metadataText.contains(keyword.getKey())) {
                    return Optional.of(keyword.getValue());
                }
            }
            return Optional.empty();
        }
        return Optional.empty();
    }

    public boolean isGroupType(String type) {
        return groupNodes.contains(type);
    }

    public boolean isEdgeType(String type) {
        return edgeNodes.contains(type);
    }

    public boolean isOuterType(String type) {
        return outerNodes.contains(type);
    }

    public boolean isSharedService(String id) {
        return sharedServices.contains(ResourceIds.typeOf(id));
    }

    /**
     * Checks whether a type has an auto-annotation rule (either side of one).
     *
     * @param type resource type
     * @return true when the type starts with a rule prefix or is one of its link targets
     */
    public boolean hasAutoAnnotation(String type) {
        for (AutoAnnotation annotation : autoAnnotations) {
            if (type.startsWith(annotation.prefix())) {
                return true;
            }
            for (String link : annotation.link()) {
                if (ResourceIds.typeOf(link).equals(type)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns the handler ids registered for a special-resource prefix.
     *
     * @param prefix special-resource prefix
     * @return handler ids, empty when the prefix is not declared
     */
    public List<String> handlersFor(String prefix) {
        return specialResources.stream()
            .filter(s -> s.prefix().equals(prefix))
            .findFirst()
            .map(SpecialResource::handlers)
            .orElse(List.of());
    }

    /**
     * Checks whether a resource type is owned by a special-resource handler (exact type match).
     *
     * @param type resource type
     * @return true if a special-resource entry names this type
     */
    public boolean isSpecialType(String type) {
        return specialResources.stream().anyMatch(s -> s.prefix().equals(type));
    }

    private static <T> List<T> concat(List<RuleConfiguration> configurations,
                                      Function<RuleConfiguration, List<T>> table) {
        Set<T> merged = new LinkedHashSet<>();
        configurations.forEach(c -> merged.addAll(table.apply(c)));
        return new ArrayList<>(merged);
    }

    private static <V> Map<String, V> union(List<RuleConfiguration> configurations,
                                            Function<RuleConfiguration, Map<String, V>> table) {
        Map<String, V> merged = new LinkedHashMap<>();
        configurations.forEach(c -> table.apply(c).forEach(merged::putIfAbsent));
        return merged;
    }

    private static <T> List<T> list(List<T> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    private static <V> Map<String, V> orderedMap(Map<String, V> values) {
        return values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * A family of resources drawn as one canonical node.
     *
     * @param prefix type prefix of the family
     * @param resourceName canonical identifier
     * @param vpc whether the node lives inside a network boundary
     * @param edgeService whether the node is an edge service
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConsolidatedNode(
        @JsonProperty("prefix") String prefix,
        @JsonProperty("resource_name") String resourceName,
        @JsonProperty("vpc") boolean vpc,
        @JsonProperty("edge_service") boolean edgeService
    ) {}

    /**
     * Direction of an auto-annotation link.
     */
    public enum Arrow {
        @JsonProperty("forward") FORWARD,
        @JsonProperty("reverse") REVERSE
    }

    /**
     * Synthetic nodes linked to every resource whose type starts with {@code prefix}.
     *
     * @param prefix resource type prefix
     * @param link identifiers to link; {@code type.*} resolves to an existing node of that type
     * @param arrow link direction
     * @param delete connection prefixes removed from the resource on a forward link
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AutoAnnotation(
        @JsonProperty("prefix") String prefix,
        @JsonProperty("link") List<String> link,
        @JsonProperty("arrow") Arrow arrow,
        @JsonProperty("delete") List<String> delete
    ) {
        public AutoAnnotation {
            link = link == null ? List.of() : List.copyOf(link);
            delete = delete == null ? List.of() : List.copyOf(delete);
            arrow = arrow == null ? Arrow.FORWARD : arrow;
        }
    }

    /**
     * Dispatch entry: handlers run once when any node matches the prefix.
     *
     * @param prefix resource type prefix
     * @param handlers handler ids, run in order
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SpecialResource(
        @JsonProperty("prefix") String prefix,
        @JsonProperty("handlers") List<String> handlers
    ) {
        public SpecialResource {
            handlers = handlers == null ? List.of() : List.copyOf(handlers);
        }
    }

    /**
     * Pattern for resources implicitly fanned out over several zones, subnets or targets.
     *
     * @param resourceTypes types the pattern applies to (also its consolidation-equivalence set)
     * @param triggerAttributes attributes whose references define the instance count
     * @param alsoExpandAttributes attributes whose referenced resources inherit the count
     * @param referencePattern regex whose first group (or whole match) is a reference
     * @param description human-readable description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MultiInstancePattern(
        @JsonProperty("resource_types") List<String> resourceTypes,
        @JsonProperty("trigger_attributes") List<String> triggerAttributes,
        @JsonProperty("also_expand_attributes") List<String> alsoExpandAttributes,
        @JsonProperty("reference_pattern") String referencePattern,
        @JsonProperty("description") String description
    ) {
        public MultiInstancePattern {
            resourceTypes = resourceTypes == null ? List.of() : List.copyOf(resourceTypes);
            triggerAttributes = triggerAttributes == null ? List.of() : List.copyOf(triggerAttributes);
            alsoExpandAttributes = alsoExpandAttributes == null ? List.of() : List.copyOf(alsoExpandAttributes);
        }
    }

    /**
     * Every node starting with {@code childPrefix} needs a parent starting with one of
     * {@code validParents}.
     *
     * @param childPrefix child identifier prefix
     * @param validParents allowed parent identifier prefixes
     * @param description short name of the rule used in diagnostics
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HierarchyRule(
        @JsonProperty("child_prefix") String childPrefix,
        @JsonProperty("valid_parents") List<String> validParents,
        @JsonProperty("description") String description
    ) {
        public HierarchyRule {
            validParents = validParents == null ? List.of() : List.copyOf(validParents);
        }
    }
}
