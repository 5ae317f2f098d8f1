package com.infragraph.core.handler.aws;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.handler.AbstractResourceHandler;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.util.ResourceIds;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Repairs the edges of CloudFront distributions.
 *
 * <p>Load balancers fronted by a distribution become children of the distribution instead of
 * the resource that referenced both. Origins given as literal domain names are resolved to the
 * resource whose attributes carry that domain. Viewer certificates issued by ACM link the
 * distribution to the certificate node.
 *
 * <p>All lookups are best-effort: an origin nothing claims is left unresolved.
 */
public class CloudFrontOriginHandler extends AbstractResourceHandler {

    private static final String DISTRIBUTION_TYPE = "aws_cloudfront_distribution";
    private static final List<String> LOAD_BALANCER_TYPES = List.of("aws_lb", "aws_alb", "aws_nlb", "aws_elb");
    private static final String CERTIFICATE_ID = "aws_acm_certificate.acm";

    @Override
    public String getId() {
        return "aws-cloudfront-origins";
    }

    @Override
    public void apply(ResourceGraph graph, RuleConfiguration rules) {
        linkLoadBalancers(graph, rules);
        for (String distribution : graph.nodesStartingWith(DISTRIBUTION_TYPE)) {
            linkCertificate(graph, rules, distribution);
            linkOrigin(graph, distribution);
        }
    }

    private void linkLoadBalancers(ResourceGraph graph, RuleConfiguration rules) {
        List<String> loadBalancers = graph.findNodes(id -> ResourceIds.isTypeIn(id, LOAD_BALANCER_TYPES));
        for (String node : graph.nodeSnapshot()) {
            for (String distribution : List.copyOf(graph.connections(node))) {
                if (!ResourceIds.typeOf(distribution).equals(DISTRIBUTION_TYPE)) {
                    continue;
                }
                for (String lb : loadBalancers) {
                    if (!graph.connections(lb).contains(node)) {
                        continue;
                    }
                    graph.connect(distribution, lb);
                    graph.disconnect(node, distribution);
                    for (String parent : graph.parentsOf(lb)) {
                        if (!parent.equals(distribution) && !isGroup(parent, rules)) {
                            graph.disconnect(parent, lb);
                        }
                    }
                    log.debug("Placed {} behind {}", lb, distribution);
                }
            }
        }
    }

    private void linkCertificate(ResourceGraph graph, RuleConfiguration rules, String distribution) {
        Map<String, Object> certificate = mapAttribute(graph, distribution, "viewer_certificate");
        Object arn = certificate.get("acm_certificate_arn");
        if (arn == null || String.valueOf(arn).isBlank()) {
            return;
        }
        String target = rules.consolidatedNameFor(CERTIFICATE_ID).orElse(CERTIFICATE_ID);
        if (graph.contains(target)) {
            graph.connect(distribution, target);
        }
    }

    private void linkOrigin(ResourceGraph graph, String distribution) {
        Object domain = mapAttribute(graph, distribution, "origin").get("domain_name");
        if (domain == null) {
            return;
        }
        String domainName = String.valueOf(domain);
        if (domainName.isBlank() || domainName.startsWith("aws_")) {
            return;
        }
        Optional<String> owner = findDomainOwner(graph, domainName);
        if (owner.isEmpty()) {
            log.debug("No resource claims origin domain {} of {}", domainName, distribution);
            return;
        }
        graph.connect(distribution, owner.get());
        graph.metadata(distribution).put("origin_resource", owner.get());
        log.debug("Resolved origin {} of {} to {}", domainName, distribution, owner.get());
    }

    private static Optional<String> findDomainOwner(ResourceGraph graph, String domain) {
        for (String candidate : graph.nodeSnapshot()) {
            String local = ResourceIds.stripModule(candidate);
            if (local.startsWith("aws_cloudfront") || local.startsWith("aws_route53")) {
                continue;
            }
            if (mentions(graph.hasMetadata(candidate) ? graph.metadata(candidate) : Map.of(), domain)
                    || mentions(graph.originalMetadata(candidate), domain)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static boolean mentions(Map<String, Object> attributes, String domain) {
        for (Object value : attributes.values()) {
            if (value != null && String.valueOf(value).contains(domain)) {
                return true;
            }
        }
        return false;
    }
}
