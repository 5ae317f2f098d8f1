package com.infragraph.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infragraph.core.config.ProjectConfig;
import com.infragraph.core.exception.InfraGraphException;
import com.infragraph.core.graph.GraphDocumentCodec;
import com.infragraph.core.model.Diagnostic;
import com.infragraph.core.provider.ProviderRegistry;
import com.infragraph.core.transform.PipelineResult;
import com.infragraph.core.transform.TopologyPipeline;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Runs the pipeline and prints the hierarchy diagnostics of the rewritten graph.
 *
 * <p>Exit code 0 when the run succeeds, 1 on a fatal error and 2 when {@code --strict}
 * is set and at least one diagnostic was reported.
 */
@Command(
    name = "validate",
    description = "Run the pipeline and report hierarchy diagnostics",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final int EXIT_DIAGNOSTICS = 2;

    @Spec
    CommandSpec spec;

    @Mixin
    PipelineMixin pipeline;

    @Parameters(index = "0", description = "Interchange document (JSON) produced by the resource parser")
    Path input;

    @Option(names = {"--strict"}, description = "Exit with code 2 when diagnostics are found")
    boolean strict;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            ProjectConfig config = pipeline.loadConfiguration();
            log.info("Validating: {}", input.toAbsolutePath());
            PipelineResult result = new TopologyPipeline(ProviderRegistry.withBuiltIns())
                .run(GraphDocumentCodec.read(input), pipeline.toOptions(config, true));

            if (!result.hasDiagnostics()) {
                out.println("✓ No diagnostics");
                return 0;
            }
            out.printf("Found %d diagnostic(s):%n", result.diagnostics().size());
            for (Diagnostic diagnostic : result.diagnostics()) {
                out.println("  • " + diagnostic);
            }
            return strict ? EXIT_DIAGNOSTICS : 0;
        } catch (InfraGraphException e) {
            log.error("Validation failed: {}", e.getMessage());
            err.println("✗ Validation failed: " + e.getMessage());
            return 1;
        }
    }
}
