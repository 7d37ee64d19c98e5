package org.dxworks.codegraph.analyzer;

import org.dxworks.codegraph.model.AnalysisFailure;
import org.dxworks.codegraph.model.CodeDependency;
import org.dxworks.codegraph.model.CodeNode;
import org.dxworks.codegraph.model.DependencyKind;
import org.dxworks.codegraph.model.FailureKind;
import org.dxworks.codegraph.model.FileAnalysis;
import org.dxworks.codegraph.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.dxworks.codegraph.analyzer.TreeSitterHelper.*;

/**
 * Python analyzer using Tree-sitter.
 * <p>
 * Emits a {@code class} node per class definition with one {@code inherits} edge per
 * simple-name base, a {@code function} node per function definition (methods, nested and
 * async functions included) and one {@code imports} edge per imported name of every
 * module-level import. Optionally emits {@code calls} edges from each function to the simple
 * names it calls.
 * <p>
 * Top-level statements are processed in source order. The first one that contains a syntax
 * error stops the analysis; everything found before it is returned as a partial result.
 */
public class PythonAnalyzer implements LanguageAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PythonAnalyzer.class);

    public static final String LANGUAGE = "python";

    private static final TSLanguage TREE_SITTER_PYTHON = new TreeSitterPython();

    private static final String CLASS_DEFINITION = "class_definition";
    private static final String FUNCTION_DEFINITION = "function_definition";
    private static final String IMPORT_STATEMENT = "import_statement";
    private static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    private static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";

    private final boolean callEdges;

    public PythonAnalyzer() {
        this(false);
    }

    public PythonAnalyzer(boolean callEdges) {
        this.callEdges = callEdges;
    }

    @Override
    public String getLanguage() {
        return LANGUAGE;
    }

    @Override
    public FileAnalysis analyze(SourceDocument document) {
        Extraction out = new Extraction(document);
        AnalysisFailure failure = null;

        try {
            TSParser parser = new TSParser();
            parser.setLanguage(TREE_SITTER_PYTHON);
            TSTree tree = parser.parseString(null, document.text());
            TSNode rootNode = tree.getRootNode();

            for (TSNode statement : namedChildren(rootNode)) {
                if (statement.hasError()) {
                    failure = new AnalysisFailure(document.path(), FailureKind.PARSE_FAILURE,
                            "invalid syntax at line " + startLine(statement));
                    break;
                }
                visitTopLevel(statement, out);
            }
            if (failure == null && rootNode.hasError()) {
                failure = new AnalysisFailure(document.path(), FailureKind.PARSE_FAILURE, "invalid syntax");
            }
        } catch (RuntimeException e) {
            failure = AnalysisFailure.of(document.path(), FailureKind.PARSE_FAILURE, e);
        }

        if (failure != null) {
            log.warn("Syntax error in Python file {}: {} (kept {} nodes, {} edges)",
                    document.path(), failure.message(), out.nodes.size(), out.edges.size());
            return new FileAnalysis(document.path(), LANGUAGE, out.nodes, out.edges, Optional.of(failure));
        }
        return new FileAnalysis(document.path(), LANGUAGE, out.nodes, out.edges);
    }

    /**
     * Source-ordered pre-order walk of one top-level statement. Imports are only collected
     * outside class and function bodies.
     */
    private void visitTopLevel(TSNode statement, Extraction out) {
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(statement, false));

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            TSNode node = frame.node;
            boolean insideDefinition = frame.insideDefinition;

            switch (node.getType()) {
                case IMPORT_STATEMENT:
                    if (!insideDefinition) extractImport(node, out);
                    continue;
                case IMPORT_FROM_STATEMENT:
                case FUTURE_IMPORT_STATEMENT:
                    if (!insideDefinition) extractFromImport(node, out);
                    continue;
                case CLASS_DEFINITION:
                    extractClass(node, out);
                    insideDefinition = true;
                    break;
                case FUNCTION_DEFINITION:
                    extractFunction(node, out);
                    insideDefinition = true;
                    break;
                default:
                    break;
            }

            List<TSNode> children = namedChildren(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(new Frame(children.get(i), insideDefinition));
            }
        }
    }

    private void extractImport(TSNode importNode, Extraction out) {
        // import a.b, c as d
        for (TSNode imported : findAllChildrenOfTypes(importNode, "dotted_name", "aliased_import")) {
            String target = importedName(imported, out.sourceBytes);
            if (target != null) {
                out.importEdge(target, startLine(importNode));
            }
        }
    }

    private void extractFromImport(TSNode importNode, Extraction out) {
        // from x.y import a, b as c  /  from . import z  /  from __future__ import annotations
        String module;
        TSNode moduleNode = null;
        if (FUTURE_IMPORT_STATEMENT.equals(importNode.getType())) {
            module = "__future__";
        } else {
            moduleNode = getChildByFieldName(importNode, "module_name");
            module = moduleName(moduleNode, out.sourceBytes);
        }

        for (TSNode child : namedChildren(importNode)) {
            if (sameNode(child, moduleNode)) continue;
            String name;
            if ("wildcard_import".equals(child.getType())) {
                name = "*";
            } else if (isNodeTypeOneOf(child, "dotted_name", "aliased_import")) {
                name = importedName(child, out.sourceBytes);
            } else {
                continue;
            }
            if (name != null) {
                out.importEdge(module + "." + name, startLine(importNode));
            }
        }
    }

    /** Relative module prefixes are dropped: {@code from .pkg import a} yields {@code pkg.a}. */
    private static String moduleName(TSNode moduleNode, byte[] sourceBytes) {
        if (moduleNode == null || moduleNode.isNull()) return "";
        if ("relative_import".equals(moduleNode.getType())) {
            TSNode dotted = findAllChildrenOfTypes(moduleNode, "dotted_name").stream().findFirst().orElse(null);
            return dotted != null ? getNodeText(sourceBytes, dotted) : "";
        }
        return getNodeText(sourceBytes, moduleNode);
    }

    /** Aliases are ignored; the bound module name is the target. */
    private static String importedName(TSNode imported, byte[] sourceBytes) {
        if ("aliased_import".equals(imported.getType())) {
            TSNode name = getChildByFieldName(imported, "name");
            return name != null && !name.isNull() ? getNodeText(sourceBytes, name) : null;
        }
        return getNodeText(sourceBytes, imported);
    }

    private void extractClass(TSNode classDef, Extraction out) {
        String name = getNodeText(out.sourceBytes, getChildByFieldName(classDef, "name"));
        if (name == null || name.isEmpty()) return;

        String id = out.document.nodeId(name);
        int line = startLine(classDef);

        List<String> bases = new ArrayList<>();
        TSNode superclasses = getChildByFieldName(classDef, "superclasses");
        // Only simple names; attribute bases (abc.ABC) and keyword arguments are skipped
        for (TSNode base : findAllChildrenOfTypes(superclasses, "identifier")) {
            bases.add(getNodeText(out.sourceBytes, base));
        }

        out.nodes.add(new CodeNode(id, name, NodeKind.CLASS, LANGUAGE, out.document.path(), line,
                ComplexityEstimator.estimate(classDef), ComplexityEstimator.linesOfCode(classDef),
                new ArrayList<>(new LinkedHashSet<>(bases))));
        for (String base : bases) {
            out.edges.add(new CodeDependency(id, base, DependencyKind.INHERITS, line));
        }
    }

    private void extractFunction(TSNode functionDef, Extraction out) {
        String name = getNodeText(out.sourceBytes, getChildByFieldName(functionDef, "name"));
        if (name == null || name.isEmpty()) return;

        String id = out.document.nodeId(name);
        List<CodeDependency> calls = callEdges ? extractCalls(id, functionDef, out.sourceBytes) : List.of();

        Set<String> refs = new LinkedHashSet<>();
        calls.forEach(call -> refs.add(call.target()));

        out.nodes.add(new CodeNode(id, name, NodeKind.FUNCTION, LANGUAGE, out.document.path(),
                startLine(functionDef), ComplexityEstimator.estimate(functionDef),
                ComplexityEstimator.linesOfCode(functionDef), new ArrayList<>(refs)));
        out.edges.addAll(calls);
    }

    /**
     * {@code foo()} targets {@code foo}; {@code obj.bar()} targets {@code bar}. Calls in nested
     * functions are attributed to the enclosing function as well.
     */
    private static List<CodeDependency> extractCalls(String functionId, TSNode functionDef, byte[] sourceBytes) {
        List<CodeDependency> calls = new ArrayList<>();
        TSNode body = getChildByFieldName(functionDef, "body");
        for (TSNode call : findAllDescendantsOfTypes(body, "call")) {
            TSNode callee = getChildByFieldName(call, "function");
            String target = null;
            if (isNodeTypeOneOf(callee, "identifier")) {
                target = getNodeText(sourceBytes, callee);
            } else if (isNodeTypeOneOf(callee, "attribute")) {
                target = getNodeText(sourceBytes, getChildByFieldName(callee, "attribute"));
            }
            if (target != null && !target.isEmpty()) {
                calls.add(new CodeDependency(functionId, target, DependencyKind.CALLS, startLine(call)));
            }
        }
        return calls;
    }

    private static final class Frame {
        final TSNode node;
        final boolean insideDefinition;

        Frame(TSNode node, boolean insideDefinition) {
            this.node = node;
            this.insideDefinition = insideDefinition;
        }
    }

    private static final class Extraction {
        final SourceDocument document;
        final byte[] sourceBytes;
        final List<CodeNode> nodes = new ArrayList<>();
        final List<CodeDependency> edges = new ArrayList<>();

        Extraction(SourceDocument document) {
            this.document = document;
            this.sourceBytes = document.text().getBytes(StandardCharsets.UTF_8);
        }

        void importEdge(String target, int line) {
            edges.add(new CodeDependency(document.moduleId(), target, DependencyKind.IMPORTS, line));
        }
    }
}
