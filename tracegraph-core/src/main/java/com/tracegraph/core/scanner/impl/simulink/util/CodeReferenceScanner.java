package com.tracegraph.core.scanner.impl.simulink.util;

import com.tracegraph.core.model.CodeMapping;
import com.tracegraph.core.model.CodeReference;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds block references in generated source code.
 *
 * <p>Code generators annotate emitted code with comments such as
 * {@code /* Gain: '<S1>/K' *}{@code /}. Every {@code '<Path>/Name'} token on every line yields one
 * reference; references are grouped by (file, block path) in order of first occurrence.
 * Reference code is the full line with a trailing carriage return removed.
 *
 * @since 1.0.0
 */
public class CodeReferenceScanner {

    /** Block reference token: {@code '<system>/block'}. */
    public static final Pattern BLOCK_REFERENCE = Pattern.compile("'<([^>]+)>/([^']+)'");

    /**
     * Scans source files.
     *
     * @param sources file content keyed by path relative to the extraction directory, in file order
     * @return mappings grouped by (file, block path)
     */
    public List<CodeMapping> scan(Map<String, String> sources) {
        List<CodeMapping> mappings = new ArrayList<>();
        sources.forEach((file, content) -> mappings.addAll(scanFile(file, content)));
        return mappings;
    }

    /**
     * Scans one source file.
     *
     * @param file path relative to the extraction directory
     * @param content file content
     * @return mappings of this file
     */
    public List<CodeMapping> scanFile(String file, String content) {
        Map<String, List<CodeReference>> byBlock = new LinkedHashMap<>();
        String[] lines = content.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            Matcher matcher = BLOCK_REFERENCE.matcher(line);
            while (matcher.find()) {
                String blockPath = "<" + matcher.group(1) + ">/" + matcher.group(2);
                byBlock.computeIfAbsent(blockPath, key -> new ArrayList<>()).add(new CodeReference(i + 1, line));
            }
        }

        List<CodeMapping> mappings = new ArrayList<>();
        byBlock.forEach((blockPath, references) -> mappings.add(new CodeMapping(file, blockPath, references)));
        return mappings;
    }
}
