package com.infragraph.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infragraph.core.config.ProjectConfig;
import com.infragraph.core.drawing.DiagramStructure;
import com.infragraph.core.drawing.RenderingTraversal;
import com.infragraph.core.exception.InfraGraphException;
import com.infragraph.core.generator.DiagramGenerator;
import com.infragraph.core.generator.GeneratorConfig;
import com.infragraph.core.graph.GraphDocument;
import com.infragraph.core.graph.GraphDocumentCodec;
import com.infragraph.core.provider.ProviderRegistry;
import com.infragraph.core.renderer.GeneratedFile;
import com.infragraph.core.renderer.GeneratedOutput;
import com.infragraph.core.renderer.OutputRenderer;
import com.infragraph.core.renderer.RenderContext;
import com.infragraph.core.transform.PipelineOptions;
import com.infragraph.core.transform.PipelineResult;
import com.infragraph.core.transform.TopologyPipeline;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Runs the pipeline over an interchange document and writes the diagrams.
 *
 * <p>Steps:
 * <ol>
 *   <li>Load {@code infragraph.yaml} and the input document</li>
 *   <li>Detect providers and run the rewrite passes</li>
 *   <li>Draw the graph with the rendering traversal</li>
 *   <li>Run the selected generators</li>
 *   <li>Hand the files to the selected renderer</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * infragraph render graph.json
 * infragraph render graph.json -o ./out -f mermaid -f json --write-graph
 * infragraph render graph.json --renderer console
 * }</pre>
 */
@Command(
    name = "render",
    description = "Run the pipeline and write architecture diagrams",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    static final String GRAPH_FILE_SUFFIX = ".graph.json";

    @Spec
    CommandSpec spec;

    @Mixin
    PipelineMixin pipeline;

    @Parameters(index = "0", description = "Interchange document (JSON) produced by the resource parser")
    Path input;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    Path outputDir;

    @Option(
        names = {"-f", "--format"},
        description = "Generator id to run, repeatable (overrides config)"
    )
    List<String> formats;

    @Option(
        names = {"-t", "--title"},
        description = "Diagram title and output file base name (overrides config)"
    )
    String title;

    @Option(
        names = {"--renderer"},
        description = "Output renderer id (default: ${DEFAULT-VALUE})",
        defaultValue = "filesystem"
    )
    String rendererId;

    @Option(
        names = {"--write-graph"},
        description = "Also write the rewritten interchange document"
    )
    boolean writeGraph;

    @Option(
        names = {"--no-validate"},
        description = "Skip hierarchy validation"
    )
    boolean noValidate;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ProjectConfig config = pipeline.loadConfiguration();
            PipelineOptions options = pipeline.toOptions(config, config.pipeline().validate() && !noValidate);

            log.info("Rendering: {}", input.toAbsolutePath());
            GraphDocument document = GraphDocumentCodec.read(input);
            PipelineResult result = new TopologyPipeline(ProviderRegistry.withBuiltIns()).run(document, options);
            out.printf("✓ Providers: %s (primary: %s, method: %s)%n",
                String.join(", ", result.detection().providers()),
                result.detection().primaryProvider(),
                result.detection().detectionMethod());
            result.diagnostics().forEach(d -> out.println("  ! " + d));

            DiagramStructure structure = RenderingTraversal.record(result.graph(), result.rules());
            out.printf("✓ Drew %d groups, %d nodes, %d edges%n",
                structure.groups().size(), structure.nodes().size(), structure.edges().size());

            String diagramTitle = title != null ? title : config.diagramTitle();
            List<GeneratedFile> files = generate(structure, resolveFormats(config), diagramTitle);
            if (writeGraph || config.output().writeGraph()) {
                GraphDocument rewritten = GraphDocument.of(result.graph(), document.allResource());
                files.add(new GeneratedFile(diagramTitle + GRAPH_FILE_SUFFIX,
                    GraphDocumentCodec.toJson(rewritten), "application/json"));
            }

            String directory = outputDir != null ? outputDir.toString() : config.output().directory();
            findRenderer(rendererId).render(new GeneratedOutput(files), new RenderContext(directory, Map.of()));
            out.printf("✓ Rendered %d file(s) with %s%n", files.size(), rendererId);
            return 0;
        } catch (InfraGraphException | IllegalStateException | IllegalArgumentException e) {
            log.error("Render failed: {}", e.getMessage());
            log.debug("Render failure", e);
            err.println("✗ Render failed: " + e.getMessage());
            return 1;
        }
    }

    private List<String> resolveFormats(ProjectConfig config) {
        return formats != null && !formats.isEmpty() ? formats : config.output().formats();
    }

    private List<GeneratedFile> generate(DiagramStructure structure, List<String> ids, String diagramTitle) {
        Map<String, DiagramGenerator> available = new LinkedHashMap<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(g -> available.put(g.getId(), g));
        log.debug("Discovered diagram generators: {}", available.keySet());

        GeneratorConfig generatorConfig = GeneratorConfig.defaults().withTitle(diagramTitle);
        List<GeneratedFile> files = new ArrayList<>();
        for (String id : ids) {
            DiagramGenerator generator = available.get(id.trim().toLowerCase());
            if (generator == null) {
                throw new IllegalArgumentException("Unknown format: " + id + ". Available: " + available.keySet());
            }
            log.info("Running generator: {} ({})", generator.getDisplayName(), generator.getId());
            files.add(GeneratedFile.of(generator.generate(structure, generatorConfig)));
        }
        return files;
    }

    private OutputRenderer findRenderer(String id) {
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            if (renderer.getId().equals(id)) {
                return renderer;
            }
        }
        throw new IllegalArgumentException("Unknown renderer: " + id);
    }
}
