package com.infragraph.core.renderer.impl;

import java.io.PrintStream;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.infragraph.core.renderer.GeneratedFile;
import com.infragraph.core.renderer.GeneratedOutput;
import com.infragraph.core.renderer.OutputRenderer;
import com.infragraph.core.renderer.RenderContext;

/**
 * Prints generated files to a stream with optional ANSI color formatting.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Separator between files (default: "---")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    public static final String ID = "console";

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String DEFAULT_SEPARATOR = "---";
    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = Boolean.parseBoolean(context.getSettingOrDefault("console.colors", "true"));
        String separator = context.getSettingOrDefault("console.separator", DEFAULT_SEPARATOR);
        List<GeneratedFile> files = output.files();

        log.debug("Rendering {} files to console (colors: {})", files.size(), useColors);

        for (int i = 0; i < files.size(); i++) {
            GeneratedFile file = files.get(i);
            String header = "File " + (i + 1) + "/" + files.size() + ": " + file.relativePath();
            out.println(useColors ? ANSI_BOLD + ANSI_CYAN + header + ANSI_RESET : header);
            out.println();
            out.println(file.content());
            if (i < files.size() - 1) {
                printSeparator(separator, useColors);
            }
        }
    }

    private void printSeparator(String separator, boolean useColors) {
        String line = separator.isEmpty() ? "" : separator.repeat(Math.max(1, LINE_WIDTH / separator.length()));
        out.println(useColors ? ANSI_YELLOW + line + ANSI_RESET : line);
    }
}
