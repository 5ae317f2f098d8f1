package com.infragraph.core.graph;

import com.infragraph.core.exception.GraphDocumentException;
import com.infragraph.core.model.ResourceInventory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link GraphDocumentCodec} and {@link GraphDocument}.
 */
class GraphDocumentCodecTest {

    private static final String DOCUMENT = """
        {
          "graphdict": {
            "aws_vpc.main": ["aws_subnet.a"],
            "aws_subnet.a": []
          },
          "meta_data": {
            "aws_vpc.main": {"cidr_block": "10.0.0.0/16"},
            "aws_subnet.a": {"vpc_id": "${aws_vpc.main.id}"}
          },
          "all_resource": {
            "main.tf": [
              {"aws_vpc": {"main": {"cidr_block": "10.0.0.0/16"}}},
              {"aws_subnet": {"a": {"vpc_id": "${aws_vpc.main.id}"}}}
            ]
          },
          "unknown_section": 42
        }
        """;

    @TempDir
    Path tempDir;

    @Test
    void fromJson_missingOptionalSections_appliesDefaults() {
        GraphDocument document = GraphDocumentCodec.fromJson(DOCUMENT);

        assertThat(document.nodeList()).containsExactly("aws_vpc.main", "aws_subnet.a");
        assertThat(document.originalMetadata()).containsKey("aws_vpc.main");
        assertThat(document.hidden()).isEmpty();
    }

    @Test
    void toInventory_allResourceSection_parsesRecords() {
        ResourceInventory inventory = GraphDocumentCodec.fromJson(DOCUMENT).toInventory();

        assertThat(inventory.size()).isEqualTo(2);
        assertThat(inventory.ofType("aws_subnet")).singleElement()
            .satisfies(r -> {
                assertThat(r.id()).isEqualTo("aws_subnet.a");
                assertThat(r.sourceFile()).isEqualTo("main.tf");
                assertThat(r.attributes()).containsEntry("vpc_id", "${aws_vpc.main.id}");
            });
    }

    @Test
    void write_thenRead_preservesGraph() {
        GraphDocument document = GraphDocumentCodec.fromJson(DOCUMENT);
        ResourceGraph graph = document.toGraph();
        graph.hide("aws_subnet.a");
        Path target = tempDir.resolve("out/graph.json");

        GraphDocumentCodec.write(GraphDocument.of(graph, document.allResource()), target);
        GraphDocument reread = GraphDocumentCodec.read(target);

        assertThat(reread.graphdict()).isEqualTo(document.graphdict());
        assertThat(reread.hidden()).containsExactly("aws_subnet.a");
        assertThat(reread.metaData().get("aws_vpc.main")).isEqualTo(Map.of("cidr_block", "10.0.0.0/16"));
    }

    @Test
    void read_missingFile_throwsWithLocation() {
        Path missing = tempDir.resolve("missing.json");

        assertThatThrownBy(() -> GraphDocumentCodec.read(missing))
            .isInstanceOf(GraphDocumentException.class)
            .satisfies(e -> assertThat(((GraphDocumentException) e).getContext())
                .containsEntry("location", missing.toString()));
    }

    @Test
    void read_malformedJson_throwsGraphDocumentException() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "{ \"graphdict\": [");

        assertThatThrownBy(() -> GraphDocumentCodec.read(broken))
            .isInstanceOf(GraphDocumentException.class)
            .hasMessageContaining("Failed to parse graph document");
    }
}
