package com.tracegraph.core.pipeline;

import com.tracegraph.core.config.ProjectConfig;
import com.tracegraph.core.scanner.ScanContext;
import com.tracegraph.core.scanner.ScanResult;
import com.tracegraph.core.scanner.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs scanners over their discovered inputs on a fixed worker pool.
 *
 * <p>Every input becomes one task. Tasks share nothing: each scan builds its own indices and
 * returns an immutable {@link ScanResult}. Results come back in discovery order, regardless of
 * completion order. A task that throws is turned into a failed result; the other tasks keep
 * running.
 *
 * @since 1.0.0
 */
public class BatchProcessor {

    private static final Logger log = LoggerFactory.getLogger(BatchProcessor.class);

    /**
     * One unit of work.
     *
     * @param scanner scanner to run
     * @param input input archive or model
     * @param context scan context carrying the scanner's configuration
     */
    public record Task(Scanner scanner, Path input, ScanContext context) {}

    private final int parallelism;

    public BatchProcessor(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /**
     * Discovers the inputs of every scanner.
     *
     * @param scanners enabled scanners, in run order
     * @param context base scan context
     * @param scannerConfig per-scanner configuration
     * @return tasks in discovery order
     */
    public List<Task> plan(List<Scanner> scanners, ScanContext context, ProjectConfig.ScannerConfig scannerConfig) {
        List<Task> tasks = new ArrayList<>();
        for (Scanner scanner : scanners) {
            ScanContext scannerContext = context.withConfiguration(scannerConfig.configFor(scanner.getId()));
            if (!scanner.appliesTo(scannerContext)) {
                log.debug("Scanner {} does not apply to {}", scanner.getId(), context.rootPath());
                continue;
            }
            List<Path> inputs = scanner.discoverInputs(scannerContext);
            log.info("{}: {} inputs", scanner.getDisplayName(), inputs.size());
            for (Path input : inputs) {
                tasks.add(new Task(scanner, input, scannerContext));
            }
        }
        return tasks;
    }

    /**
     * Runs tasks and waits for all of them.
     *
     * @param tasks tasks to run
     * @return one result per task, in task order
     */
    public List<ScanResult> process(List<Task> tasks) {
        if (tasks.isEmpty()) {
            return List.of();
        }

        int workers = Math.min(parallelism, tasks.size());
        log.debug("Processing {} inputs with {} workers", tasks.size(), workers);
        ExecutorService executor = Executors.newFixedThreadPool(workers, workerThreads());
        try {
            List<Future<ScanResult>> futures = new ArrayList<>(tasks.size());
            for (Task task : tasks) {
                futures.add(executor.submit(() -> task.scanner().scan(task.input(), task.context())));
            }

            List<ScanResult> results = new ArrayList<>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                results.add(await(tasks.get(i), futures.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Plans and processes in one call.
     *
     * @param scanners enabled scanners
     * @param context base scan context
     * @param scannerConfig per-scanner configuration
     * @return results in discovery order
     */
    public List<ScanResult> run(List<Scanner> scanners, ScanContext context, ProjectConfig.ScannerConfig scannerConfig) {
        return process(plan(scanners, context, scannerConfig));
    }

    private ScanResult await(Task task, Future<ScanResult> future) {
        String scannerId = task.scanner().getId();
        try {
            ScanResult result = future.get();
            return result != null ? result : ScanResult.failed(scannerId, task.input(), List.of("Scanner returned no result"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Scanner {} failed on {}: {}", scannerId, task.input(), cause.toString(), cause);
            return ScanResult.failed(scannerId, task.input(), List.of(cause.toString()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for {} on {}", scannerId, task.input());
            return ScanResult.failed(scannerId, task.input(), List.of("Interrupted"));
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "tracegraph-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
