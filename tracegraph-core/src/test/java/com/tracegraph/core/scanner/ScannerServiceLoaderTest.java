package com.tracegraph.core.scanner;

import com.tracegraph.core.renderer.OutputRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates SPI registration of scanners and renderers.
 *
 * @see Scanner
 * @see ServiceLoader
 */
class ScannerServiceLoaderTest {

    /**
     * Expected number of scanner implementations.
     * Update this constant when adding new scanners.
     */
    private static final int EXPECTED_SCANNER_COUNT = 3;

    @Test
    void serviceLoader_discoversAllRegisteredScanners() {
        List<Scanner> scanners = ServiceLoader.load(Scanner.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(scanners)
            .as("ServiceLoader should discover all %d registered scanners", EXPECTED_SCANNER_COUNT)
            .hasSize(EXPECTED_SCANNER_COUNT);
    }

    @Test
    void serviceLoader_scannerIdsAreUnique() {
        Set<String> ids = ServiceLoader.load(Scanner.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(Scanner::getId)
            .collect(Collectors.toSet());

        assertThat(ids).containsExactlyInAnyOrder("cameo-requirements", "simulink-blocks", "simulink-codegen");
    }

    @Test
    void serviceLoader_everyScannerHasMetadata() {
        ServiceLoader.load(Scanner.class).forEach(scanner -> {
            assertThat(scanner.getDisplayName()).as("display name of %s", scanner.getId()).isNotBlank();
            assertThat(scanner.getSupportedFilePatterns()).as("patterns of %s", scanner.getId()).isNotEmpty();
        });
    }

    @Test
    void serviceLoader_discoversRenderers() {
        Set<String> ids = ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(OutputRenderer::getId)
            .collect(Collectors.toSet());

        assertThat(ids).containsExactlyInAnyOrder("filesystem", "console");
    }
}
