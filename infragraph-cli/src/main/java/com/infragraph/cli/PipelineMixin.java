package com.infragraph.cli;

import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infragraph.core.config.ConfigLoader;
import com.infragraph.core.config.ProjectConfig;
import com.infragraph.core.transform.PipelineOptions;

import picocli.CommandLine.Option;

/**
 * Options shared by the commands that run the pipeline.
 *
 * <p>Command-line values win over {@code infragraph.yaml}, which wins over the defaults.
 */
public class PipelineMixin {

    private static final Logger log = LoggerFactory.getLogger(PipelineMixin.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: infragraph.yaml)"
    )
    Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-p", "--provider"},
        description = "Force the primary provider instead of detecting it"
    )
    String provider;

    @Option(
        names = {"--no-expand"},
        description = "Skip multi-instance detection and expansion"
    )
    boolean noExpand;

    /**
     * Loads the project configuration.
     *
     * @return configuration or defaults
     */
    ProjectConfig loadConfiguration() {
        log.debug("Loading configuration from: {}", configPath.toAbsolutePath());
        return ConfigLoader.load(configPath);
    }

    /**
     * Builds pipeline options from the configuration and the command-line overrides.
     *
     * @param config project configuration
     * @param validate whether validation runs
     * @return pipeline options
     */
    PipelineOptions toOptions(ProjectConfig config, boolean validate) {
        PipelineOptions base = config.toPipelineOptions();
        boolean expand = base.expandMultiInstance() && !noExpand;
        String override = provider != null ? provider.trim().toLowerCase() : base.providerOverride();
        return new PipelineOptions(expand, validate, override, base.annotations());
    }
}
