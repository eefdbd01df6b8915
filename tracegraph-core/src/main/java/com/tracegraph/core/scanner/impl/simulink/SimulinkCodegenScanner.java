package com.tracegraph.core.scanner.impl.simulink;

import com.tracegraph.core.archive.CodegenArchiveExtractor;
import com.tracegraph.core.model.CodeMapping;
import com.tracegraph.core.model.CodeMappingReport;
import com.tracegraph.core.scanner.ScanContext;
import com.tracegraph.core.scanner.ScanResult;
import com.tracegraph.core.scanner.ScanStatistics;
import com.tracegraph.core.scanner.base.AbstractScanner;
import com.tracegraph.core.scanner.impl.simulink.util.CodeReferenceScanner;
import com.tracegraph.core.util.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scanner for Simulink code-generation archives ({@code .slxc}).
 *
 * <p>Extracts the archive into a persistent cache directory, reads the generated source files and
 * maps every {@code '<Path>/Name'} block reference to the lines that carry it.
 *
 * <p>Settings read from the {@link ScanContext}:
 * <ul>
 *   <li>{@value ScanContext#SETTING_CODEGEN_CACHE}: cache directory, relative to the root
 *       (default: next to each archive)</li>
 *   <li>{@value ScanContext#SETTING_CODEGEN_EXTENSIONS}: comma-separated source extensions
 *       (default: {@code .c})</li>
 * </ul>
 *
 * @see CodegenArchiveExtractor
 * @see CodeReferenceScanner
 * @since 1.0.0
 */
public class SimulinkCodegenScanner extends AbstractScanner {

    private static final String SCANNER_ID = "simulink-codegen";
    private static final String SCANNER_DISPLAY_NAME = "Simulink Code Generation Scanner";
    private static final int SCANNER_PRIORITY = 30;

    private final CodeReferenceScanner referenceScanner = new CodeReferenceScanner();

    @Override
    public String getId() {
        return SCANNER_ID;
    }

    @Override
    public String getDisplayName() {
        return SCANNER_DISPLAY_NAME;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("*.slxc", "**/*.slxc");
    }

    @Override
    public int getPriority() {
        return SCANNER_PRIORITY;
    }

    @Override
    public ScanResult scan(Path input, ScanContext context) {
        CodegenArchiveExtractor extractor = extractorFor(context);
        try {
            Path extracted = extractor.extract(input);
            Map<String, String> sources = new LinkedHashMap<>();
            for (Path file : extractor.findSourceFiles(extracted)) {
                String relative = FileUtils.toPortableString(extracted.relativize(file));
                sources.put(relative, new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
                log.debug("Found source file: {}", relative);
            }

            List<CodeMapping> mappings = referenceScanner.scan(sources);
            ScanStatistics.Builder stats = new ScanStatistics.Builder()
                .elementsVisited(sources.size())
                .entitiesExtracted(mappings.size())
                .edgesCollected(mappings.stream().mapToInt(m -> m.references().size()).sum());

            List<String> warnings = new ArrayList<>();
            if (sources.isEmpty()) {
                warnings.add("No generated source files found in " + input.getFileName());
                log.warn("No generated source files found in {}", input.getFileName());
            }

            CodeMappingReport report = new CodeMappingReport(input.toString(), new ArrayList<>(sources.keySet()), mappings);
            log.info("Found {} code-to-model mappings in {}", mappings.size(), input.getFileName());
            return mappingResult(input, report, warnings, stats.build());
        } catch (IOException e) {
            return failedResult(input, e);
        }
    }

    private CodegenArchiveExtractor extractorFor(ScanContext context) {
        String cache = context.getSetting(ScanContext.SETTING_CODEGEN_CACHE);
        Path cacheRoot = cache == null || cache.isBlank() ? null : context.rootPath().resolve(cache);
        String extensions = context.getSetting(ScanContext.SETTING_CODEGEN_EXTENSIONS);
        List<String> sourceExtensions = extensions == null || extensions.isBlank()
            ? CodegenArchiveExtractor.DEFAULT_SOURCE_EXTENSIONS
            : Arrays.stream(extensions.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
        return new CodegenArchiveExtractor(cacheRoot, sourceExtensions);
    }
}
