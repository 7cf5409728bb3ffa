package com.sdlcimport.core.analyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Function;

/**
 * Runs the applicable analyzers on a fixed thread pool.
 *
 * <p>Each analyzer gets its own {@link AnalyzerOutput}; each task also renders its own
 * artifact through the supplied function, so a slow or failing analyzer never delays the
 * files of the others. Any exception escaping an analyzer becomes a FAILED result with the
 * partial output; the other analyzers are unaffected.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * AnalyzerRunner runner = new AnalyzerRunner(3);
 * List<AnalyzerRun<RenderReport>> runs = runner.run(AnalyzerRunner.discover(), context,
 *     result -> renderer.renderAnalyzerResult(result, renderContext));
 * }</pre>
 */
public class AnalyzerRunner {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerRunner.class);

    private final int threads;
    private final Map<String, AnalyzerStatus> states = new ConcurrentHashMap<>();

    public AnalyzerRunner(int threads) {
        this.threads = Math.max(1, threads);
    }

    /**
     * Discovers analyzers registered through {@link ServiceLoader}, ordered by id.
     *
     * @return analyzers
     */
    public static List<Analyzer> discover() {
        List<Analyzer> analyzers = new ArrayList<>();
        ServiceLoader.load(Analyzer.class).forEach(analyzers::add);
        analyzers.sort(Comparator.comparing(Analyzer::getId));
        log.debug("Discovered {} analyzer(s)", analyzers.size());
        return analyzers;
    }

    /**
     * Runs every applicable analyzer and renders its result.
     *
     * @param analyzers candidate analyzers
     * @param context shared read-only input
     * @param render renders one result; runs inside the analyzer's task
     * @param <R> render outcome type
     * @return one run per applicable analyzer, in the order given
     */
    public <R> List<AnalyzerRun<R>> run(List<Analyzer> analyzers, AnalysisContext context,
                                        Function<AnalyzerResult, R> render) {
        List<Analyzer> applicable = analyzers.stream().filter(a -> applies(a, context)).toList();
        if (applicable.isEmpty()) {
            log.info("No applicable analyzers");
            return List.of();
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, applicable.size()));
        try {
            List<Future<AnalyzerRun<R>>> futures = new ArrayList<>();
            for (Analyzer analyzer : applicable) {
                futures.add(executor.submit(() -> execute(analyzer, context, render)));
            }

            List<AnalyzerRun<R>> runs = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                runs.add(await(futures.get(i), applicable.get(i)));
            }
            return runs;
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Returns the last known state of an analyzer.
     *
     * @param analyzerId analyzer id
     * @return state, or null if the analyzer never ran
     */
    public AnalyzerStatus getStatus(String analyzerId) {
        return states.get(analyzerId);
    }

    private <R> AnalyzerRun<R> execute(Analyzer analyzer, AnalysisContext context, Function<AnalyzerResult, R> render) {
        states.put(analyzer.getId(), AnalyzerStatus.RUNNING);
        log.info("Running analyzer: {}", analyzer.getDisplayName());
        AnalyzerOutput output = new AnalyzerOutput();
        AnalyzerResult result;
        try {
            analyzer.analyze(context, output);
            result = AnalyzerResult.succeeded(analyzer.getId(), analyzer.artifactKind(), output);
        } catch (Exception e) {
            log.error("Analyzer {} failed: {}", analyzer.getId(), e.getMessage(), e);
            result = AnalyzerResult.failed(analyzer.getId(), analyzer.artifactKind(), output, describe(e));
        }
        states.put(analyzer.getId(), result.status());
        log.info("Analyzer {} {} ({} item(s))", analyzer.getId(), result.status(), result.itemCount());

        R rendered = render.apply(result);
        return new AnalyzerRun<>(result, rendered);
    }

    private <R> AnalyzerRun<R> await(Future<AnalyzerRun<R>> future, Analyzer analyzer) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            states.put(analyzer.getId(), AnalyzerStatus.FAILED);
            return new AnalyzerRun<>(AnalyzerResult.failed(analyzer.getId(), analyzer.artifactKind(),
                new AnalyzerOutput(), "interrupted"), null);
        } catch (ExecutionException e) {
            log.error("Rendering for analyzer {} failed", analyzer.getId(), e.getCause());
            states.put(analyzer.getId(), AnalyzerStatus.FAILED);
            return new AnalyzerRun<>(AnalyzerResult.failed(analyzer.getId(), analyzer.artifactKind(),
                new AnalyzerOutput(), describe(e.getCause())), null);
        }
    }

    private static boolean applies(Analyzer analyzer, AnalysisContext context) {
        try {
            boolean applies = analyzer.appliesTo(context);
            if (!applies) {
                log.info("Analyzer {} skipped", analyzer.getId());
            }
            return applies;
        } catch (RuntimeException e) {
            log.warn("Applicability check of analyzer {} failed, running it anyway", analyzer.getId(), e);
            return true;
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return error.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
