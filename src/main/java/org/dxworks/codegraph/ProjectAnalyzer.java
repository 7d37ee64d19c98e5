package org.dxworks.codegraph;

import org.dxworks.codegraph.analyzer.AnalyzerRegistry;
import org.dxworks.codegraph.analyzer.LanguageAnalyzer;
import org.dxworks.codegraph.analyzer.SourceDocument;
import org.dxworks.codegraph.graph.FileOutcome;
import org.dxworks.codegraph.graph.GraphAssembler;
import org.dxworks.codegraph.model.AnalysisFailure;
import org.dxworks.codegraph.model.DependencyGraph;
import org.dxworks.codegraph.model.FailureKind;
import org.dxworks.codegraph.model.FileAnalysis;
import org.dxworks.codegraph.scan.ReadFailureException;
import org.dxworks.codegraph.scan.SourceCatalog;
import org.dxworks.codegraph.scan.SourceFile;
import org.dxworks.codegraph.scan.SourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * Drives catalog, reader, analyzers and assembler over a project tree.
 * <p>
 * Files are read and analyzed on a fixed pool of {@link CodegraphConfig#getConcurrency()}
 * workers, with at most that many files in flight. Results are merged on the calling thread,
 * in catalog order when {@link CodegraphConfig#isOrderedMerge()} is set and in completion order
 * otherwise. Per-file failures are logged and recorded in the graph; only a missing root fails
 * the call.
 */
public class ProjectAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ProjectAnalyzer.class);

    private static final String UNKNOWN_LANGUAGE = "unknown";

    private final CodegraphConfig config;
    private final AnalyzerRegistry registry;
    private final SourceCatalog catalog;
    private final SourceReader reader;

    public ProjectAnalyzer(CodegraphConfig config, AnalyzerRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.catalog = new SourceCatalog(config);
        this.reader = new SourceReader(config.getFallbackEncoding());
    }

    public ProjectAnalyzer(CodegraphConfig config) {
        this(config, LanguageRegistry.buildAnalyzers(config));
    }

    public DependencyGraph analyzeProject(Path root) {
        return analyzeProject(root, AnalysisCancellation.none());
    }

    /**
     * Analyzes every catalogued file under {@code root}. When {@code cancellation} fires, no new
     * files are dispatched, running analyses complete, and the graph is returned with
     * {@code partial} set.
     *
     * @throws RootNotFoundException if {@code root} does not exist
     */
    public DependencyGraph analyzeProject(Path root, AnalysisCancellation cancellation) {
        Instant startTime = Instant.now();
        Stream<SourceFile> candidates = catalog.scan(root);
        log.info("Analyzing project {} with {} workers", root.toAbsolutePath(), config.getConcurrency());

        GraphAssembler assembler = new GraphAssembler();
        Deque<CompletableFuture<FileOutcome>> inFlight = new ArrayDeque<>();
        Semaphore slots = new Semaphore(config.getConcurrency());
        ExecutorService executor = Executors.newFixedThreadPool(config.getConcurrency(), new WorkerThreadFactory());
        boolean partial = false;

        try (candidates) {
            Iterator<SourceFile> files = candidates.iterator();
            while (files.hasNext()) {
                if (cancellation.isCancelled()) {
                    partial = true;
                    break;
                }
                SourceFile file = files.next();
                slots.acquire();
                if (cancellation.isCancelled()) {
                    slots.release();
                    partial = true;
                    break;
                }
                inFlight.add(CompletableFuture
                        .supplyAsync(() -> analyzeSource(file, root), executor)
                        .whenComplete((outcome, error) -> slots.release()));
                mergeFinished(inFlight, assembler);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            partial = true;
            log.warn("Interrupted while scanning {}; returning partial graph", root);
        } finally {
            mergeRemaining(inFlight, assembler);
            executor.shutdown();
        }

        if (partial) {
            log.info("Analysis of {} cancelled; no further files dispatched", root);
        }
        DependencyGraph graph = assembler.build(partial);
        log.info("Analyzed {} files in {} ms: {} nodes, {} edges, {} files with errors",
                graph.metadata().totalFiles(),
                Duration.between(startTime, Instant.now()).toMillis(),
                graph.metadata().totalNodes(),
                graph.metadata().totalDependencies(),
                graph.metadata().filesWithErrors());
        return graph;
    }

    /**
     * Analyzes a single file. Unknown extensions, unreadable files and analyzer crashes yield an
     * empty analysis; nothing is thrown.
     */
    public FileAnalysis analyzeFile(Path path) {
        Optional<String> language = config.getLanguageTable().detectLanguage(path);
        if (language.isEmpty()) {
            log.warn("Unsupported language for file {}", path);
            return FileAnalysis.empty(path.toString(), UNKNOWN_LANGUAGE);
        }
        FileOutcome outcome = analyzeSource(new SourceFile(path, language.get()), path.getParent());
        return outcome.analysisIfPresent()
                .orElseGet(() -> FileAnalysis.empty(path.toString(), language.get()));
    }

    FileOutcome analyzeSource(SourceFile file, Path root) {
        String path = file.path().toString();

        Optional<LanguageAnalyzer> analyzer = registry.analyzerFor(file.language());
        if (analyzer.isEmpty()) {
            log.debug("No analyzer registered for {}, skipping {}", file.language(), path);
            return FileOutcome.skipped(path);
        }

        String text;
        try {
            text = reader.read(file.path());
        } catch (ReadFailureException e) {
            log.warn(e.getMessage());
            return FileOutcome.failed(AnalysisFailure.of(path, FailureKind.READ_FAILURE, e.getCause()));
        }

        log.debug("Analyzing {}: {}", file.language(), path);
        SourceDocument document = SourceDocument.of(file.path(), root, config.getNodeIdStrategy(), text);
        try {
            return FileOutcome.analyzed(analyzer.get().analyze(document));
        } catch (RuntimeException | LinkageError | StackOverflowError e) {
            // LinkageError covers a native parser library that failed to load
            log.warn("Analyzer for {} failed on {}: {}", file.language(), path, e.toString());
            return FileOutcome.failed(AnalysisFailure.of(path, FailureKind.ANALYZER_FAILURE, e));
        }
    }

    /**
     * Hands finished results to the assembler: only the finished prefix when merging in catalog
     * order, every finished result otherwise.
     */
    private void mergeFinished(Deque<CompletableFuture<FileOutcome>> inFlight, GraphAssembler assembler) {
        if (config.isOrderedMerge()) {
            while (!inFlight.isEmpty() && inFlight.peekFirst().isDone()) {
                assembler.accept(inFlight.pollFirst().join());
            }
            return;
        }
        Iterator<CompletableFuture<FileOutcome>> it = inFlight.iterator();
        while (it.hasNext()) {
            CompletableFuture<FileOutcome> future = it.next();
            if (future.isDone()) {
                assembler.accept(future.join());
                it.remove();
            }
        }
    }

    private void mergeRemaining(Deque<CompletableFuture<FileOutcome>> inFlight, GraphAssembler assembler) {
        while (!inFlight.isEmpty()) {
            if (config.isOrderedMerge()) {
                assembler.accept(inFlight.pollFirst().join());
            } else {
                CompletableFuture.anyOf(inFlight.toArray(new CompletableFuture<?>[0])).join();
                mergeFinished(inFlight, assembler);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

        private final int pool = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "codegraph-" + pool + "-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
