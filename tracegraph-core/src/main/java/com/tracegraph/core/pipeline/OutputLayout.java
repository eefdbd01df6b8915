package com.tracegraph.core.pipeline;

/**
 * Relative paths of the documents a pipeline run emits, and of the version stores it keeps.
 */
public final class OutputLayout {

    public static final String ALL_REQUIREMENTS = "all_requirements.json";
    public static final String BATCH_SUMMARY = "batch_summary.json";
    public static final String VALIDATION_REPORT = "validation_report.json";

    /** Requirement version store, relative to the store directory. */
    public static final String REQUIREMENT_STORE = "cameo_versions.json";

    private OutputLayout() {
    }

    public static String requirementGraph(String stem) {
        return "requirements/" + stem + "_connectivity.json";
    }

    public static String blockGraph(String modelName) {
        return "simulink/" + modelName + "/block_connectivity.json";
    }

    public static String connectionVersion(String modelName) {
        return "simulink/" + modelName + "/connection_version.json";
    }

    public static String codeMappings(String stem) {
        return "codegen/" + stem + "_code_mappings.json";
    }

    /**
     * Block version store of one model, relative to the store directory.
     *
     * @param modelName model name
     * @return store path
     */
    public static String blockStore(String modelName) {
        return "simulink/" + modelName + "_versions.json";
    }
}
