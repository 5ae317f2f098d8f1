package com.infragraph.core.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ResourceGraph}.
 */
class ResourceGraphTest {

    private ResourceGraph graph;

    @BeforeEach
    void setUp() {
        graph = new ResourceGraph();
        graph.connect("aws_vpc.main", "aws_subnet.a");
        graph.connect("aws_vpc.main", "aws_subnet.b");
        graph.connect("aws_subnet.a", "aws_instance.web");
        graph.addNode("aws_subnet.b");
        graph.addNode("aws_instance.web");
    }

    @Test
    void connect_duplicateEdge_isIgnored() {
        assertThat(graph.connect("aws_vpc.main", "aws_subnet.a")).isFalse();
        assertThat(graph.connections("aws_vpc.main")).containsExactly("aws_subnet.a", "aws_subnet.b");
    }

    @Test
    void ensureMetadata_keepsExistingEntry() {
        graph.metadata("aws_subnet.a").put("cidr_block", "10.0.1.0/24");

        graph.ensureMetadata("aws_subnet.a");
        graph.ensureMetadata("aws_subnet.b");

        assertThat(graph.metadata("aws_subnet.a")).containsEntry("cidr_block", "10.0.1.0/24");
        assertThat(graph.hasMetadata("aws_subnet.b")).isTrue();
        assertThat(graph.metadata("aws_subnet.b")).isEmpty();
    }

    @Test
    void connections_returnedList_isReadOnly() {
        assertThatThrownBy(() -> graph.connections("aws_vpc.main").add("x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void removeNode_referencedNode_removesIncomingEdges() {
        graph.removeNode("aws_subnet.a");

        assertThat(graph.contains("aws_subnet.a")).isFalse();
        assertThat(graph.connections("aws_vpc.main")).containsExactly("aws_subnet.b");
    }

    @Test
    void renameNode_existingTarget_mergesAdjacencyAndRewritesReferences() {
        // Given
        graph.connect("aws_subnet.b", "aws_instance.db");
        graph.metadata("aws_subnet.a").put("cidr", "10.0.1.0/24");

        // When
        graph.renameNode("aws_subnet.a", "aws_subnet.b");

        // Then
        assertThat(graph.contains("aws_subnet.a")).isFalse();
        assertThat(graph.connections("aws_subnet.b")).containsExactly("aws_instance.db", "aws_instance.web");
        assertThat(graph.connections("aws_vpc.main")).containsExactly("aws_subnet.b");
        assertThat(graph.metadata("aws_subnet.b")).containsEntry("cidr", "10.0.1.0/24");
    }

    @Test
    void replaceReferences_wouldCreateSelfReference_dropsIt() {
        graph.connect("aws_subnet.b", "aws_subnet.a");

        graph.replaceReferences("aws_subnet.a", "aws_subnet.b");

        assertThat(graph.connections("aws_subnet.b")).doesNotContain("aws_subnet.b", "aws_subnet.a");
    }

    @Test
    void parentsOf_sharedChild_returnsAllParentsInOrder() {
        graph.connect("aws_subnet.b", "aws_instance.web");

        assertThat(graph.parentsOf("aws_instance.web")).containsExactly("aws_subnet.a", "aws_subnet.b");
    }

    @Test
    void count_stringOrMissingValue_parsesOrReturnsZero() {
        graph.metadata("aws_instance.web").put("count", "3");

        assertThat(graph.count("aws_instance.web")).isEqualTo(3);
        assertThat(graph.count("aws_subnet.b")).isZero();
    }

    @Test
    void attribute_missingInWorkingMetadata_fallsBackToOriginal() {
        ResourceGraph withOriginal = new ResourceGraph(
            Map.of("aws_instance.web", List.of()),
            Map.of("aws_instance.web", Map.of()),
            Map.of("aws_instance.web", Map.of("ami", "ami-123")),
            List.of(), null);

        assertThat(withOriginal.attribute("aws_instance.web", "ami")).isEqualTo("ami-123");
        assertThat(withOriginal.nodeList()).containsExactly("aws_instance.web");
    }

    @Test
    void copy_mutatingCopy_leavesOriginalUntouched() {
        graph.metadata("aws_instance.web").put("tags", new ArrayList<>(List.of("a")));

        ResourceGraph copy = graph.copy();
        copy.connect("aws_subnet.b", "aws_instance.extra");
        copy.hide("aws_subnet.b");
        @SuppressWarnings("unchecked")
        List<Object> tags = (List<Object>) copy.metadata("aws_instance.web").get("tags");
        tags.add("b");

        assertThat(graph.connections("aws_subnet.b")).isEmpty();
        assertThat(graph.isHidden("aws_subnet.b")).isFalse();
        assertThat(graph.metadata("aws_instance.web").get("tags")).isEqualTo(List.of("a"));
    }
}
