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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based analyzer for JavaScript-family sources (JS, JSX, TS, TSX).
 * <p>
 * Extracts {@code import ... from "..."} and {@code require("...")} targets, named function
 * declarations and class declarations. Line numbers are not recovered, complexity is fixed at
 * 1.0 and lines of code at 0. Missed constructs are acceptable; matches inside comments and
 * strings are not filtered out.
 */
public class PatternAnalyzer implements LanguageAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PatternAnalyzer.class);

    static final double DEFAULT_COMPLEXITY = 1.0;

    private static final String QUOTED_MODULE = "['\"`]([^'\"`]+)['\"`]";

    // import X from "m" | import {a, b} from "m" | import * as ns from "m" | import X, {a} from "m"
    private static final Pattern IMPORT_PATTERN = Pattern.compile(
        "\\bimport\\s+(?:[\\w$]+\\s*,\\s*)?(?:\\{[^}]*\\}|\\*\\s+as\\s+[\\w$]+|[\\w$]+)\\s+from\\s+" + QUOTED_MODULE);

    private static final Pattern REQUIRE_PATTERN = Pattern.compile(
        "\\brequire\\s*\\(\\s*" + QUOTED_MODULE);

    private static final Pattern FUNCTION_PATTERN = Pattern.compile(
        "\\bfunction\\s+([\\w$]+)\\s*\\(");

    private static final Pattern CLASS_PATTERN = Pattern.compile(
        "\\bclass\\s+([\\w$]+)");

    private final String language;

    public PatternAnalyzer(String language) {
        this.language = language;
    }

    @Override
    public String getLanguage() {
        return language;
    }

    @Override
    public FileAnalysis analyze(SourceDocument document) {
        List<CodeNode> nodes = new ArrayList<>();
        List<CodeDependency> edges = new ArrayList<>();

        try {
            String source = document.text();

            for (String functionName : findAll(FUNCTION_PATTERN, source)) {
                nodes.add(patternNode(document, functionName, NodeKind.FUNCTION));
            }
            for (String className : findAll(CLASS_PATTERN, source)) {
                nodes.add(patternNode(document, className, NodeKind.CLASS));
            }

            List<String> moduleTargets = new ArrayList<>(findAll(IMPORT_PATTERN, source));
            moduleTargets.addAll(findAll(REQUIRE_PATTERN, source));
            for (String target : moduleTargets) {
                edges.add(new CodeDependency(document.moduleId(), target, DependencyKind.IMPORTS));
            }
        } catch (RuntimeException e) {
            log.warn("Pattern extraction failed for {}: {}", document.path(), e.getMessage());
            return new FileAnalysis(document.path(), language, nodes, edges,
                    Optional.of(AnalysisFailure.of(document.path(), FailureKind.PARSE_FAILURE, e)));
        }

        return new FileAnalysis(document.path(), language, nodes, edges);
    }

    private CodeNode patternNode(SourceDocument document, String name, NodeKind kind) {
        return new CodeNode(document.nodeId(name), name, kind, language, document.path(),
                0, DEFAULT_COMPLEXITY, 0);
    }

    private static List<String> findAll(Pattern pattern, String source) {
        List<String> matches = new ArrayList<>();
        Matcher matcher = pattern.matcher(source);
        while (matcher.find()) {
            matches.add(matcher.group(1));
        }
        return matches;
    }
}
