package org.dxworks.codegraph;

import org.dxworks.codegraph.analyzer.AnalyzerRegistry;
import org.dxworks.codegraph.analyzer.LanguageAnalyzer;
import org.dxworks.codegraph.analyzer.NullAnalyzer;
import org.dxworks.codegraph.analyzer.PatternAnalyzer;
import org.dxworks.codegraph.analyzer.PythonAnalyzer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the analyzer registry for the built-in languages. Adding a language means adding a
 * {@link Language} constant and one case here.
 */
public class LanguageRegistry {

    public static AnalyzerRegistry buildAnalyzers(CodegraphConfig config) {
        Map<String, LanguageAnalyzer> analyzers = new LinkedHashMap<>();

        for (Language lang : Language.values()) {
            if (config.isAnalyzerEnabled(lang.getName())) {
                analyzers.put(lang.getName(), createAnalyzer(lang, config));
            }
        }

        return AnalyzerRegistry.of(analyzers);
    }

    private static LanguageAnalyzer createAnalyzer(Language lang, CodegraphConfig config) {
        return switch (lang) {
            case PYTHON -> new PythonAnalyzer(config.isCallEdges());
            case JAVASCRIPT, TYPESCRIPT -> new PatternAnalyzer(lang.getName());
            case JAVA, CPP, C, CSHARP, PHP, RUBY, GO, RUST -> new NullAnalyzer(lang.getName());
        };
    }
}
