package org.dxworks.codegraph;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.dxworks.codegraph.analyzer.AnalyzerRegistry;
import org.dxworks.codegraph.analyzer.LanguageAnalyzer;
import org.dxworks.codegraph.analyzer.NodeIdStrategy;
import org.dxworks.codegraph.analyzer.PythonAnalyzer;
import org.dxworks.codegraph.analyzer.SourceDocument;
import org.dxworks.codegraph.model.AnalysisFailure;
import org.dxworks.codegraph.model.CodeDependency;
import org.dxworks.codegraph.model.CodeNode;
import org.dxworks.codegraph.model.DependencyGraph;
import org.dxworks.codegraph.model.DependencyKind;
import org.dxworks.codegraph.model.FailureKind;
import org.dxworks.codegraph.model.FileAnalysis;
import org.dxworks.codegraph.model.GraphMetadata;
import org.dxworks.codegraph.model.NodeKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link ProjectAnalyzer} over {@code @TempDir} projects.
 */
class ProjectAnalyzerTest {

    @TempDir
    Path tempDir;

    private ListAppender<ILoggingEvent> pythonLog;

    @BeforeEach
    void attachAppender() {
        pythonLog = new ListAppender<>();
        pythonLog.start();
        ((Logger) LoggerFactory.getLogger(PythonAnalyzer.class)).addAppender(pythonLog);
    }

    @AfterEach
    void detachAppender() {
        ((Logger) LoggerFactory.getLogger(PythonAnalyzer.class)).detachAppender(pythonLog);
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static List<String> nodeNames(DependencyGraph graph) {
        return graph.nodes().stream().map(CodeNode::name).collect(Collectors.toList());
    }

    private static CodegraphConfig config(int concurrency, boolean orderedMerge) {
        return CodegraphConfig.builder().concurrency(concurrency).orderedMerge(orderedMerge).build();
    }

    /** Emits one function node named after the file stem, after running {@code hook}. */
    private static final class StemAnalyzer implements LanguageAnalyzer {
        private final Function<SourceDocument, Long> delayMillis;
        private final Runnable hook;

        StemAnalyzer(Function<SourceDocument, Long> delayMillis, Runnable hook) {
            this.delayMillis = delayMillis;
            this.hook = hook;
        }

        @Override
        public String getLanguage() {
            return "python";
        }

        @Override
        public FileAnalysis analyze(SourceDocument document) {
            hook.run();
            try {
                Thread.sleep(delayMillis.apply(document));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            CodeNode node = new CodeNode(document.nodeId(document.moduleId()), document.moduleId(),
                    NodeKind.FUNCTION, "python", document.path(), 1, 1.0, 1);
            return new FileAnalysis(document.path(), "python", List.of(node), List.of());
        }
    }

    @Test
    @DisplayName("analyzes a mixed-language project")
    void mixedProject() throws IOException {
        write("app.py", "import os\n\n\nclass Greeter:\n    def greet(self):\n        return os.getcwd()\n");
        write("web/web.js", "import React from 'react';\nfunction render() {}\n");
        write("web/svc.ts", "export class Service {}\n");
        write("legacy/Main.java", "class Main {}\n");
        write("docs/notes.md", "# notes\n");

        DependencyGraph graph = new ProjectAnalyzer(CodegraphConfig.defaults()).analyzeProject(tempDir);

        assertEquals(List.of("Greeter", "greet", "Service", "render"), nodeNames(graph));
        GraphMetadata metadata = graph.metadata();
        assertEquals(4, metadata.totalFiles());
        assertEquals(4, metadata.totalNodes());
        assertEquals(2, metadata.totalDependencies());
        assertEquals(List.of("javascript", "python", "typescript"), metadata.languages());
        assertFalse(metadata.partial());
        assertEquals(0, metadata.filesWithErrors());

        CodeNode service = graph.nodes().stream().filter(n -> n.name().equals("Service")).findFirst().orElseThrow();
        assertEquals("typescript", service.language());
        assertEquals(List.of("os", "react"),
                graph.edges().stream().map(CodeDependency::target).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("merges results in catalog order regardless of completion order")
    void orderedMerge() throws IOException {
        for (int i = 0; i < 8; i++) {
            write("f" + i + ".py", "x = " + i + "\n");
        }
        // earlier files take longer, so they finish last
        StemAnalyzer slowFirst = new StemAnalyzer(
                doc -> (long) (8 - Integer.parseInt(doc.moduleId().substring(1))) * 25, () -> { });
        ProjectAnalyzer analyzer = new ProjectAnalyzer(config(4, true), AnalyzerRegistry.of(slowFirst));

        DependencyGraph graph = analyzer.analyzeProject(tempDir);

        assertEquals(List.of("f0", "f1", "f2", "f3", "f4", "f5", "f6", "f7"), nodeNames(graph));
    }

    @Test
    @DisplayName("completion-order merge yields the same set of nodes")
    void unorderedMerge() throws IOException {
        for (int i = 0; i < 8; i++) {
            write("f" + i + ".py", "x = " + i + "\n");
        }
        StemAnalyzer slowFirst = new StemAnalyzer(
                doc -> (long) (8 - Integer.parseInt(doc.moduleId().substring(1))) * 10, () -> { });
        ProjectAnalyzer analyzer = new ProjectAnalyzer(config(4, false), AnalyzerRegistry.of(slowFirst));

        DependencyGraph graph = analyzer.analyzeProject(tempDir);

        List<String> sorted = nodeNames(graph).stream().sorted().collect(Collectors.toList());
        assertEquals(List.of("f0", "f1", "f2", "f3", "f4", "f5", "f6", "f7"), sorted);
        assertEquals(8, graph.metadata().totalFiles());
    }

    @Test
    @DisplayName("sequential and parallel runs produce the same graph")
    void concurrencyDoesNotChangeResult() throws IOException {
        for (int i = 0; i < 20; i++) {
            write("pkg" + (i % 3) + "/mod" + i + ".py",
                    "import json\n\ndef run_" + i + "():\n    if True:\n        return " + i + "\n");
        }

        DependencyGraph sequential = new ProjectAnalyzer(config(1, true)).analyzeProject(tempDir);
        DependencyGraph parallel = new ProjectAnalyzer(config(6, true)).analyzeProject(tempDir);

        assertEquals(sequential.nodes(), parallel.nodes());
        assertEquals(sequential.edges(), parallel.edges());
        assertEquals(sequential.metadata(), parallel.metadata());
    }

    @Test
    @DisplayName("one broken file among a hundred costs only that file")
    void brokenFileAmongHundred() throws IOException {
        for (int i = 0; i < 100; i++) {
            String name = String.format("f%03d.py", i);
            write(name, i == 42 ? ")))(((\n" : "def f_" + i + "():\n    return " + i + "\n");
        }

        DependencyGraph graph = new ProjectAnalyzer(config(4, true)).analyzeProject(tempDir);

        GraphMetadata metadata = graph.metadata();
        assertEquals(100, metadata.totalFiles());
        assertEquals(99, metadata.totalNodes());
        assertEquals(1, metadata.filesWithErrors());
        assertFalse(metadata.partial());
        assertEquals(1, graph.failures().size());
        assertEquals(FailureKind.PARSE_FAILURE, graph.failures().get(0).kind());
        assertTrue(graph.failures().get(0).path().endsWith("f042.py"));

        List<ILoggingEvent> warnings = pythonLog.list.stream()
                .filter(e -> e.getLevel() == Level.WARN)
                .collect(Collectors.toList());
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getFormattedMessage().contains("f042.py"));
    }

    @Test
    @DisplayName("counts languages without a registered analyzer as skipped")
    void unregisteredLanguageSkipped() throws IOException {
        write("Main.kt", "fun main() {}\n");
        write("main.py", "def main():\n    pass\n");
        CodegraphConfig config = CodegraphConfig.builder()
                .languageTable(LanguageTable.of(Map.of("kt", "kotlin", "py", "python")))
                .build();

        DependencyGraph graph = new ProjectAnalyzer(config).analyzeProject(tempDir);

        assertEquals(1, graph.metadata().totalFiles());
        assertEquals(1, graph.metadata().skippedFiles());
        assertEquals(0, graph.metadata().filesWithErrors());
        assertEquals(List.of("main"), nodeNames(graph));
    }

    @Test
    @DisplayName("disabled analyzers leave their files unanalyzed")
    void disabledAnalyzer() throws IOException {
        write("main.py", "def main():\n    pass\n");
        write("app.js", "function app() {}\n");
        CodegraphConfig config = CodegraphConfig.builder()
                .disabledAnalyzers(Set.of("javascript"))
                .build();

        DependencyGraph graph = new ProjectAnalyzer(config).analyzeProject(tempDir);

        assertEquals(List.of("main"), nodeNames(graph));
        assertEquals(1, graph.metadata().skippedFiles());
    }

    @Test
    @DisplayName("an analyzer crash becomes a recorded failure")
    void analyzerCrash() throws IOException {
        write("a.py", "x = 1\n");
        write("b.py", "x = 2\n");
        LanguageAnalyzer crashing = new LanguageAnalyzer() {
            @Override
            public String getLanguage() {
                return "python";
            }

            @Override
            public FileAnalysis analyze(SourceDocument document) {
                if (document.moduleId().equals("a")) {
                    throw new IllegalStateException("boom");
                }
                return FileAnalysis.empty(document.path(), "python");
            }
        };

        DependencyGraph graph = new ProjectAnalyzer(config(2, true), AnalyzerRegistry.of(crashing))
                .analyzeProject(tempDir);

        assertEquals(1, graph.metadata().totalFiles());
        assertEquals(1, graph.metadata().filesWithErrors());
        AnalysisFailure failure = graph.failures().get(0);
        assertEquals(FailureKind.ANALYZER_FAILURE, failure.kind());
        assertEquals("boom", failure.message());
    }

    @Test
    @DisplayName("an error thrown by an analyzer is recorded instead of escaping")
    void analyzerLinkageError() throws IOException {
        write("a.py", "x = 1\n");
        write("b.py", "def b():\n    pass\n");
        LanguageAnalyzer unloadable = new LanguageAnalyzer() {
            @Override
            public String getLanguage() {
                return "python";
            }

            @Override
            public FileAnalysis analyze(SourceDocument document) {
                if (document.moduleId().equals("a")) {
                    throw new NoClassDefFoundError("org/treesitter/TSParser");
                }
                return new PythonAnalyzer().analyze(document);
            }
        };
        ProjectAnalyzer analyzer = new ProjectAnalyzer(config(2, true), AnalyzerRegistry.of(unloadable));

        DependencyGraph graph = analyzer.analyzeProject(tempDir);

        assertEquals(List.of("b"), nodeNames(graph));
        assertEquals(1, graph.metadata().filesWithErrors());
        assertEquals(FailureKind.ANALYZER_FAILURE, graph.failures().get(0).kind());
        assertEquals("org/treesitter/TSParser", graph.failures().get(0).message());

        FileAnalysis single = analyzer.analyzeFile(tempDir.resolve("a.py"));
        assertTrue(single.isEmpty());
        assertEquals("python", single.language());
    }

    @Test
    @DisplayName("cancellation stops dispatch and marks the graph partial")
    void cancellation() throws IOException {
        write("a.py", "x = 1\n");
        write("b.py", "x = 2\n");
        write("c.py", "x = 3\n");
        AnalysisCancellation cancellation = new AnalysisCancellation();
        StemAnalyzer cancelling = new StemAnalyzer(doc -> 0L, cancellation::cancel);
        ProjectAnalyzer analyzer = new ProjectAnalyzer(config(1, true), AnalyzerRegistry.of(cancelling));

        DependencyGraph graph = analyzer.analyzeProject(tempDir, cancellation);

        assertTrue(graph.isPartial());
        assertEquals(1, graph.metadata().totalFiles());
        assertEquals(List.of("a"), nodeNames(graph));
    }

    @Test
    @DisplayName("running twice over an unchanged tree gives equal graphs")
    void idempotent() throws IOException {
        write("one.py", "import os\n\nclass One(Base):\n    pass\n");
        write("two.js", "const x = require('lodash');\nfunction two() {}\n");
        ProjectAnalyzer analyzer = new ProjectAnalyzer(CodegraphConfig.defaults());

        assertEquals(analyzer.analyzeProject(tempDir), analyzer.analyzeProject(tempDir));
    }

    @Test
    @DisplayName("an empty directory yields an empty graph")
    void emptyDirectory() {
        DependencyGraph graph = new ProjectAnalyzer(CodegraphConfig.defaults()).analyzeProject(tempDir);

        assertTrue(graph.nodes().isEmpty());
        assertEquals(0, graph.metadata().totalFiles());
        assertEquals(List.of(), graph.metadata().languages());
    }

    @Test
    @DisplayName("fails fast when the root does not exist")
    void missingRoot() {
        ProjectAnalyzer analyzer = new ProjectAnalyzer(CodegraphConfig.defaults());

        assertThrows(RootNotFoundException.class, () -> analyzer.analyzeProject(tempDir.resolve("absent")));
    }

    @Test
    @DisplayName("PATH ids keep same-stem files apart")
    void pathIds() throws IOException {
        write("a/util.py", "def helper():\n    pass\n");
        write("b/util.py", "def helper():\n    pass\n");

        DependencyGraph stem = new ProjectAnalyzer(CodegraphConfig.defaults()).analyzeProject(tempDir);
        DependencyGraph path = new ProjectAnalyzer(
                CodegraphConfig.builder().nodeIdStrategy(NodeIdStrategy.PATH).build()).analyzeProject(tempDir);

        assertEquals(List.of("util.helper", "util.helper"),
                stem.nodes().stream().map(CodeNode::id).collect(Collectors.toList()));
        assertEquals(List.of("a/util.py::helper", "b/util.py::helper"),
                path.nodes().stream().map(CodeNode::id).collect(Collectors.toList()));
    }

    @Test
    @DisplayName("call edges are emitted only when enabled")
    void callEdges() throws IOException {
        write("calls.py", "def run():\n    print('hi')\n");

        DependencyGraph off = new ProjectAnalyzer(CodegraphConfig.defaults()).analyzeProject(tempDir);
        DependencyGraph on = new ProjectAnalyzer(
                CodegraphConfig.builder().callEdges(true).build()).analyzeProject(tempDir);

        assertTrue(off.edges().isEmpty());
        assertEquals(1, on.edges().size());
        CodeDependency call = on.edges().get(0);
        assertEquals(DependencyKind.CALLS, call.kind());
        assertEquals("calls.run", call.source());
        assertEquals("print", call.target());
        assertEquals(Integer.valueOf(2), call.line());
    }

    @Test
    @DisplayName("analyzeFile handles a single supported file")
    void analyzeSingleFile() throws IOException {
        write("single.py", "class Solo:\n    pass\n");

        FileAnalysis analysis = new ProjectAnalyzer(CodegraphConfig.defaults())
                .analyzeFile(tempDir.resolve("single.py"));

        assertEquals("python", analysis.language());
        assertEquals(1, analysis.nodes().size());
        assertEquals("single.Solo", analysis.nodes().get(0).id());
    }

    @Test
    @DisplayName("analyzeFile returns an empty result for unknown extensions")
    void analyzeUnknownExtension() throws IOException {
        write("notes.txt", "def nothing(): pass\n");

        FileAnalysis analysis = new ProjectAnalyzer(CodegraphConfig.defaults())
                .analyzeFile(tempDir.resolve("notes.txt"));

        assertTrue(analysis.isEmpty());
        assertEquals("unknown", analysis.language());
    }

    @Test
    @DisplayName("analyzeFile returns an empty result for a missing file")
    void analyzeMissingFile() {
        FileAnalysis analysis = new ProjectAnalyzer(CodegraphConfig.defaults())
                .analyzeFile(tempDir.resolve("missing.py"));

        assertTrue(analysis.isEmpty());
        assertEquals("python", analysis.language());
    }
}
