package com.infragraph.core.detect;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.model.ResourceInventory;
import com.infragraph.core.model.ResourceRecord;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.rules.RuleConfigurationLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MultiInstanceDetector}.
 */
class MultiInstanceDetectorTest {

    private static final RuleConfiguration AWS = RuleConfigurationLoader.load("aws", "providers/aws.yaml");

    private static final ResourceRecord LOAD_BALANCER = new ResourceRecord("aws_lb", "web", "main.tf", Map.of(
        "subnets", List.of("${aws_subnet.a.id}", "${aws_subnet.b.id}", "${aws_subnet.c.id}"),
        "security_groups", List.of("${aws_security_group.lb.id}")));

    private ResourceGraph graph;
    private MultiInstanceDetector detector;

    @BeforeEach
    void setUp() {
        graph = new ResourceGraph();
        detector = new MultiInstanceDetector(AWS);
    }

    @Test
    void detect_loadBalancerOverThreeSubnets_countsBalancerAndItsSecurityGroup() {
        // Given
        graph.addNode("aws_lb.web");
        graph.addNode("aws_security_group.lb");
        graph.addNode("aws_security_group.lb_admin");

        // When
        Map<String, Integer> assigned = detector.detect(new ResourceInventory(List.of(LOAD_BALANCER)), graph);

        // Then
        assertThat(assigned).containsExactly(
            Map.entry("aws_lb.web", 3),
            Map.entry("aws_security_group.lb", 3),
            Map.entry("aws_security_group.lb_admin", 3));
        assertThat(graph.count("aws_lb.web")).isEqualTo(3);
    }

    @Test
    void detect_existingCount_isNotOverwritten() {
        graph.addNode("aws_lb.web");
        graph.setCount("aws_lb.web", 2);
        graph.addNode("aws_security_group.lb");

        Map<String, Integer> assigned = detector.detect(new ResourceInventory(List.of(LOAD_BALANCER)), graph);

        assertThat(assigned).containsOnlyKeys("aws_security_group.lb");
        assertThat(graph.count("aws_lb.web")).isEqualTo(2);
    }

    @Test
    void detect_singleSubnet_isNotMultiInstance() {
        ResourceRecord single = new ResourceRecord("aws_lb", "web", "main.tf",
            Map.of("subnets", List.of("${aws_subnet.a.id}", "${aws_subnet.a.id}")));
        graph.addNode("aws_lb.web");

        assertThat(detector.detect(new ResourceInventory(List.of(single)), graph)).isEmpty();
        assertThat(graph.hasMetadata("aws_lb.web")).isFalse();
    }

    @Test
    void detect_moduleNode_resolvedByLocalIdentifier() {
        graph.addNode("module.edge.aws_lb.web");

        Map<String, Integer> assigned = detector.detect(new ResourceInventory(List.of(LOAD_BALANCER)), graph);

        assertThat(assigned).containsEntry("module.edge.aws_lb.web", 3);
    }

    @Test
    void detect_consolidatedNode_receivesCount() {
        graph.addNode("aws_lb.elb");

        Map<String, Integer> assigned = detector.detect(new ResourceInventory(List.of(LOAD_BALANCER)), graph);

        assertThat(assigned).containsEntry("aws_lb.elb", 3);
    }

    @Test
    void detect_variantNodeWithSameName_resolvedByEquivalentType() {
        graph.addNode("aws_alb.web");

        Map<String, Integer> assigned = detector.detect(new ResourceInventory(List.of(LOAD_BALANCER)), graph);

        assertThat(assigned).containsEntry("aws_alb.web", 3);
    }

    @Test
    void detect_onlyNumberedNodes_leftAlone() {
        graph.addNode("aws_lb.web~1");
        graph.addNode("aws_lb.web~2");

        assertThat(detector.detect(new ResourceInventory(List.of(LOAD_BALANCER)), graph)).isEmpty();
    }
}
