package com.tracegraph.core.renderer.impl;

import com.tracegraph.core.renderer.GeneratedFile;
import com.tracegraph.core.renderer.GeneratedOutput;
import com.tracegraph.core.renderer.OutputRenderer;
import com.tracegraph.core.renderer.RenderContext;
import com.tracegraph.core.renderer.RenderReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renderer that prints generated documents to a stream with optional ANSI color formatting.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.showHeaders} - Show file headers ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "-".repeat(80);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public RenderReport render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.flag("console.colors", true);
        boolean showHeaders = context.flag("console.showHeaders", true);
        logger.debug("Rendering {} files to console (colors: {}, headers: {})",
            output.files().size(), useColors, showHeaders);

        List<String> written = new ArrayList<>();
        int total = output.files().size();
        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                printFileHeader(file, i + 1, total, useColors);
            }
            out.println(file.content());
            out.println(useColors ? ANSI_YELLOW + SEPARATOR + ANSI_RESET : SEPARATOR);
            written.add(file.relativePath());
        }
        return new RenderReport(written, Map.of());
    }

    private void printFileHeader(GeneratedFile file, int index, int total, boolean useColors) {
        String pathColor = useColors ? ANSI_BOLD + ANSI_CYAN : "";
        String reset = useColors ? ANSI_RESET : "";
        out.println(pathColor + "File " + index + "/" + total + ": " + file.relativePath() + reset);
    }
}
