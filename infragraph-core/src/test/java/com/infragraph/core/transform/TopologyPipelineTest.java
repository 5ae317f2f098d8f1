package com.infragraph.core.transform;

import com.infragraph.core.exception.MissingResourceException;
import com.infragraph.core.graph.GraphDocument;
import com.infragraph.core.graph.GraphDocumentCodec;
import com.infragraph.core.graph.ResourceGraph;
import com.infragraph.core.model.DetectionMethod;
import com.infragraph.core.model.DiagnosticType;
import com.infragraph.core.provider.ProviderRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end tests for {@link TopologyPipeline}.
 */
class TopologyPipelineTest {

    private static final String WEB_STACK = """
        {
          "graphdict": {
            "aws_vpc.main": ["aws_subnet.public"],
            "aws_subnet.public": ["aws_instance.web"],
            "aws_instance.web": ["aws_security_group.web"],
            "aws_security_group.web": [],
            "aws_iam_role_policy.logs": ["aws_instance.web"]
          },
          "meta_data": {
            "aws_subnet.public": {"availability_zone": "eu-west-1a"}
          },
          "all_resource": {
            "main.tf": [
              {"aws_vpc": {"main": {"cidr_block": "10.0.0.0/16"}}},
              {"aws_subnet": {"public": {"availability_zone": "eu-west-1a"}}},
              {"aws_instance": {"web": {"instance_type": "t3.micro"}}},
              {"aws_security_group": {"web": {}}}
            ]
          }
        }
        """;

    private static final String ZONE = "aws_az.availability_zone_eu_west_1a~1";

    private TopologyPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new TopologyPipeline(ProviderRegistry.withBuiltIns());
    }

    @Test
    void run_webStack_buildsNestedTopology() {
        // Given
        GraphDocument document = GraphDocumentCodec.fromJson(WEB_STACK);

        // When
        PipelineResult result = pipeline.run(document, PipelineOptions.defaults());

        // Then
        ResourceGraph graph = result.graph();
        assertThat(result.detection().primaryProvider()).isEqualTo("aws");
        assertThat(graph.connections("aws_vpc.main")).containsExactly(ZONE);
        assertThat(graph.connections(ZONE)).containsExactly("aws_subnet.public");
        assertThat(graph.connections("aws_subnet.public")).containsExactly("aws_security_group.web");
        assertThat(graph.connections("aws_security_group.web")).containsExactly("aws_instance.web");
        assertThat(graph.connections("aws_iam_role_policy.logs")).isEmpty();
        assertThat(result.hasDiagnostics()).isFalse();
    }

    @Test
    void run_inputGraph_isNotModified() {
        GraphDocument document = GraphDocumentCodec.fromJson(WEB_STACK);
        ResourceGraph input = document.toGraph();
        var before = input.edgesSnapshot();

        pipeline.run(input, document.toInventory(), PipelineOptions.defaults());

        assertThat(input.edgesSnapshot()).isEqualTo(before);
    }

    @Test
    void run_sameInputTwice_producesSameGraph() {
        GraphDocument document = GraphDocumentCodec.fromJson(WEB_STACK);

        var first = pipeline.run(document, PipelineOptions.defaults()).graph().edgesSnapshot();
        var second = pipeline.run(document, PipelineOptions.defaults()).graph().edgesSnapshot();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void run_orphanSubnet_reportsHierarchyViolation() {
        GraphDocument document = GraphDocumentCodec.fromJson("""
            {"graphdict": {"aws_subnet.orphan": []},
             "all_resource": {"main.tf": [{"aws_subnet": {"orphan": {}}}]}}
            """);

        PipelineResult result = pipeline.run(document, PipelineOptions.defaults());

        assertThat(result.diagnostics()).singleElement()
            .satisfies(d -> {
                assertThat(d.type()).isEqualTo(DiagnosticType.HIERARCHY_VIOLATION);
                assertThat(d.resourceId()).isEqualTo("aws_subnet.orphan");
            });
    }

    @Test
    void run_validationDisabled_reportsNothing() {
        GraphDocument document = GraphDocumentCodec.fromJson("""
            {"graphdict": {"aws_subnet.orphan": []},
             "all_resource": {"main.tf": [{"aws_subnet": {"orphan": {}}}]}}
            """);

        PipelineResult result = pipeline.run(document, new PipelineOptions(true, false, null));

        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void run_providerOverride_skipsDetection() {
        GraphDocument document = GraphDocumentCodec.fromJson(WEB_STACK);

        PipelineResult result = pipeline.run(document, new PipelineOptions(true, false, "gcp"));

        assertThat(result.detection().providers()).containsExactly("gcp");
        assertThat(result.detection().detectionMethod()).isEqualTo(DetectionMethod.DEFAULT);
        assertThat(result.rules().provider()).isEqualTo("gcp");
    }

    @Test
    void run_mixedProviders_detectsMultiCloud() {
        GraphDocument document = GraphDocumentCodec.fromJson("""
            {"graphdict": {"aws_s3_bucket.a": [], "google_storage_bucket.b": [], "google_pubsub_topic.c": []},
             "all_resource": {"main.tf": [
               {"aws_s3_bucket": {"a": {}}},
               {"google_storage_bucket": {"b": {}}},
               {"google_pubsub_topic": {"c": {}}}]}}
            """);

        PipelineResult result = pipeline.run(document, PipelineOptions.defaults());

        assertThat(result.detection().isMultiCloud()).isTrue();
        assertThat(result.detection().primaryProvider()).isEqualTo("gcp");
        assertThat(result.detection().resourceCounts()).isEqualTo(Map.of("aws", 1, "gcp", 2));
    }

    @Test
    void run_userAnnotations_appliedAfterAutomaticPasses() {
        // Given
        GraphDocument document = GraphDocumentCodec.fromJson(WEB_STACK);
        UserAnnotations annotations = new UserAnnotations("Web", null, null, null,
            List.of("aws_iam_role_policy*"), Map.of("aws_instance.web", Map.of("label", "Web tier")));

        // When
        PipelineResult result = pipeline.run(document, new PipelineOptions(true, true, null, annotations));

        // Then
        ResourceGraph graph = result.graph();
        assertThat(graph.contains("aws_iam_role_policy.logs")).isFalse();
        assertThat(graph.metadata("aws_instance.web")).containsEntry("label", "Web tier");
        assertThat(graph.connections("aws_security_group.web")).containsExactly("aws_instance.web");
    }

    @Test
    void run_endpointWithoutVpc_abortsWithMissingResource() {
        GraphDocument document = GraphDocumentCodec.fromJson("""
            {"graphdict": {"aws_vpc_endpoint.s3": []},
             "all_resource": {"main.tf": [{"aws_vpc_endpoint": {"s3": {}}}]}}
            """);

        assertThatThrownBy(() -> pipeline.run(document, PipelineOptions.defaults()))
            .isInstanceOf(MissingResourceException.class)
            .hasMessageContaining("handler=aws-vpc-endpoints");
    }
}
