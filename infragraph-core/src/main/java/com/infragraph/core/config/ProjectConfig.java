package com.infragraph.core.config;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.infragraph.core.transform.PipelineOptions;
import com.infragraph.core.transform.UserAnnotations;

/**
 * Root configuration for an InfraGraph run.
 *
 * <p>Loaded from {@code infragraph.yaml}. Every section is optional; missing values
 * fall back to the defaults below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * provider:
 *   override: aws
 *
 * pipeline:
 *   validate: true
 *   expandMultiInstance: true
 *
 * output:
 *   directory: "./diagrams"
 *   title: "production"
 *   formats:
 *     - mermaid
 *     - json
 *   writeGraph: false
 *
 * annotations:
 *   title: "Checkout"
 *   connect:
 *     aws_lambda_function*:
 *       - aws_s3_bucket.data: "writes"
 *   remove:
 *     - aws_iam_role*
 * }</pre>
 *
 * @param provider provider selection
 * @param pipeline pipeline toggles
 * @param output output settings
 * @param annotations hand-written graph edits
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("provider") ProviderSettings provider,
    @JsonProperty("pipeline") PipelineSettings pipeline,
    @JsonProperty("output") OutputSettings output,
    @JsonProperty("annotations") UserAnnotations annotations
) {
    /**
     * Compact constructor filling absent sections with defaults.
     */
    public ProjectConfig {
        provider = provider == null ? new ProviderSettings(null) : provider;
        pipeline = pipeline == null ? new PipelineSettings(null, null) : pipeline;
        output = output == null ? new OutputSettings(null, null, null, null) : output;
        annotations = annotations == null ? UserAnnotations.none() : annotations;
    }

    /**
     * Creates the default configuration: auto-detected provider, validation and
     * multi-instance expansion on, Mermaid output in {@code ./diagrams}.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(null, null, null, null);
    }

    /**
     * Returns the diagram title: the annotation title when one is set, else the output title.
     *
     * @return diagram title
     */
    public String diagramTitle() {
        return annotations.title() != null ? annotations.title() : output.title();
    }

    /**
     * Converts the pipeline, provider and annotation sections into pipeline options.
     *
     * @return options for {@code TopologyPipeline}
     */
    public PipelineOptions toPipelineOptions() {
        return new PipelineOptions(
            pipeline.expandMultiInstance(), pipeline.validate(), provider.override(), annotations);
    }

    /**
     * Provider selection.
     *
     * @param override provider id forced as primary, or null to detect
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProviderSettings(
        @JsonProperty("override") String override
    ) {
        public ProviderSettings {
            override = override == null || override.isBlank() ? null : override.trim().toLowerCase();
        }
    }

    /**
     * Pipeline toggles.
     *
     * @param validate whether the validator runs after the passes
     * @param expandMultiInstance whether counts are detected and expanded
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PipelineSettings(
        @JsonProperty("validate") Boolean validate,
        @JsonProperty("expandMultiInstance") Boolean expandMultiInstance
    ) {
        public PipelineSettings {
            validate = validate == null ? Boolean.TRUE : validate;
            expandMultiInstance = expandMultiInstance == null ? Boolean.TRUE : expandMultiInstance;
        }
    }

    /**
     * Output settings.
     *
     * @param directory output directory
     * @param title diagram title and file base name
     * @param formats generator ids to run
     * @param writeGraph whether the post-pipeline interchange document is written too
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory,
        @JsonProperty("title") String title,
        @JsonProperty("formats") List<String> formats,
        @JsonProperty("writeGraph") Boolean writeGraph
    ) {
        public static final String DEFAULT_DIRECTORY = "./diagrams";
        public static final String DEFAULT_FORMAT = "mermaid";

        public OutputSettings {
            directory = directory == null || directory.isBlank() ? DEFAULT_DIRECTORY : directory;
            title = title == null || title.isBlank() ? "architecture" : title;
            formats = formats == null || formats.isEmpty() ? List.of(DEFAULT_FORMAT) : List.copyOf(formats);
            writeGraph = writeGraph == null ? Boolean.FALSE : writeGraph;
        }
    }
}
