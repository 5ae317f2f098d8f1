package com.infragraph.core.renderer;

/**
 * Writes generated files to an output destination.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI). Register
 * implementations in
 * {@code META-INF/services/com.infragraph.core.renderer.OutputRenderer}.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output the files to render
     * @param context rendering context with configuration and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
