package com.infragraph.core.drawing;

import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.rules.RuleConfiguration;
import com.infragraph.core.rules.RuleConfigurationLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NodeLabels}, {@link EdgeLabelResolver}, {@link EdgePolicy} and
 * {@link RecordingDrawingSink}.
 */
class DrawingSupportTest {

    private static final RuleConfiguration AWS = RuleConfigurationLoader.load("aws", "providers/aws.yaml");

    // ==================== Labels ====================

    @ParameterizedTest
    @CsvSource({
        "aws_subnet.private~2, Private 2 (Subnet)",
        "aws_instance.web, Web (EC2)",
        "aws_alb.web, Web (App Load Balancer)",
        "aws_lambda_function.this, Lambda",
        "aws_ecs_service.ecs, ECS (ECS Service)",
        "tv_aws_users.users, Users",
        "aws_db_instance.main_db, Main DB (DB Instance)"
    })
    void labelOf_resourceId_buildsReadableLabel(String id, String expected) {
        assertThat(new NodeLabels(AWS).labelOf(id)).isEqualTo(expected);
    }

    @Test
    void labelFor_consolidatedOrigin_fallsBackToFamilyNode() {
        ResourceGraph graph = new ResourceGraph();
        graph.addNode("aws_api_gateway_integration.gateway");
        graph.metadata("aws_api_gateway_integration.gateway")
            .put(EdgePolicy.EDGE_LABELS, List.of(Map.of("aws_lambda_function.handler", "invoke")));

        String label = new EdgeLabelResolver(AWS)
            .labelFor(graph, "aws_api_gateway_rest_api.api", "aws_lambda_function.handler~1");

        assertThat(label).isEqualTo("invoke");
    }

    @Test
    void labelFor_noLabels_returnsEmpty() {
        assertThat(new EdgeLabelResolver(AWS).labelFor(new ResourceGraph(), "aws_instance.a", "aws_s3_bucket.b"))
            .isEmpty();
    }

    // ==================== Edge Policy ====================

    @Test
    void okToConnect_sharedServiceRules_applied() {
        EdgePolicy policy = new EdgePolicy(AWS);

        assertThat(policy.okToConnect("aws_lambda_function.f", "aws_kms_key.kms")).isFalse();
        assertThat(policy.okToConnect("aws_ecs_service.api", "aws_kms_key.kms")).isTrue();
        assertThat(policy.okToConnect("aws_kms_key.kms", "aws_ecr_repository.ecr")).isTrue();
        assertThat(policy.okToConnect("aws_iam_role_policy.p", "aws_iam_role.r")).isFalse();
    }

    // ==================== Recording Sink ====================

    @Test
    void addMember_secondContainer_movesMember() {
        RecordingDrawingSink sink = new RecordingDrawingSink();
        sink.createGroup("g1", "G1", "aws_vpc");
        sink.createGroup("g2", "G2", "aws_vpc");
        sink.createNode("n", "N", "aws_instance");

        sink.addMember("g1", "n");
        sink.addMember("g2", "n");

        DiagramStructure structure = sink.toStructure();
        assertThat(structure.findGroup("g1").orElseThrow().members()).isEmpty();
        assertThat(structure.findGroup("g2").orElseThrow().members()).containsExactly("n");
    }

    @Test
    void addMember_cycle_isIgnored() {
        RecordingDrawingSink sink = new RecordingDrawingSink();
        sink.createGroup("outer", "Outer", "aws_vpc");
        sink.createGroup("inner", "Inner", "aws_subnet");
        sink.addMember("outer", "inner");

        sink.addMember("inner", "outer");
        sink.addMember("inner", "inner");
        sink.addMember("missing", "inner");

        DiagramStructure structure = sink.toStructure();
        assertThat(structure.findGroup("inner").orElseThrow().members()).isEmpty();
        assertThat(structure.rootIds()).containsExactly("outer");
    }
}
