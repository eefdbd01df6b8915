package com.tracegraph.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.tracegraph.core.model.CodeMapping;
import com.tracegraph.core.model.CodeMappingReport;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the code mapping document.
 *
 * <p>Document shape:
 * <pre>{@code
 * {
 *   "source_file": "Controller.slxc",
 *   "c_files": ["Controller_ert_rtw/Controller.c"],
 *   "mappings": [{
 *     "file_path": "...", "block_path": "<S1>/K", "block_name": "K",
 *     "location": "...:<S1>/K", "code_references": [{ "line": 42, "code": "..." }]
 *   }]
 * }
 * }</pre>
 */
public final class CodeMappingCodec {

    private CodeMappingCodec() {
    }

    public static Map<String, Object> toDocument(CodeMappingReport report) {
        List<Map<String, Object>> mappings = new ArrayList<>();
        for (CodeMapping mapping : report.mappings()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("file_path", mapping.filePath());
            entry.put("block_path", mapping.blockPath());
            entry.put("block_name", mapping.blockName());
            entry.put("location", mapping.location());
            entry.put("code_references", mapping.references());
            mappings.add(entry);
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("source_file", report.sourceFile());
        document.put("c_files", report.sourceFiles());
        document.put("mappings", mappings);
        return document;
    }

    public static String write(CodeMappingReport report) {
        try {
            return JsonMappers.documents().writeValueAsString(toDocument(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize code mappings of " + report.sourceFile(), e);
        }
    }
}
