package com.tracegraph.core.renderer;

/**
 * Interface for output renderers that deliver generated documents.
 *
 * <p>Renderers write the JSON documents produced by a pipeline run (connectivity graphs, code
 * mappings, batch summary, validation report) to a destination. A failing document is reported
 * in the returned {@link RenderReport} and does not stop the remaining documents.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class FileSystemRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "filesystem";
 *     }
 *
 *     @Override
 *     public RenderReport render(GeneratedOutput output, RenderContext context) {
 *         Path outputDir = context.outputPath();
 *         for (GeneratedFile file : output.files()) {
 *             Files.writeString(outputDir.resolve(file.relativePath()), file.content());
 *         }
 *         ...
 *     }
 * }
 * }</pre>
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used for selecting the renderer from the command line. Lowercase
     * (e.g., "filesystem", "console").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output the generated documents to render
     * @param context rendering context with the output directory and settings
     * @return written and failed documents
     * @throws IllegalStateException if the destination itself cannot be prepared
     */
    RenderReport render(GeneratedOutput output, RenderContext context);
}
