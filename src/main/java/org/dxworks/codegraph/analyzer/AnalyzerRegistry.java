package org.dxworks.codegraph.analyzer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from language identifier to analyzer. A language without an entry is
 * unsupported; a language mapped to a {@link NullAnalyzer} is recognized but not analyzed.
 */
public final class AnalyzerRegistry {

    private final Map<String, LanguageAnalyzer> analyzers;

    private AnalyzerRegistry(Map<String, LanguageAnalyzer> analyzers) {
        this.analyzers = Collections.unmodifiableMap(new LinkedHashMap<>(analyzers));
    }

    public static AnalyzerRegistry of(Map<String, LanguageAnalyzer> analyzers) {
        return new AnalyzerRegistry(analyzers);
    }

    public static AnalyzerRegistry of(LanguageAnalyzer... analyzers) {
        Map<String, LanguageAnalyzer> byLanguage = new LinkedHashMap<>();
        for (LanguageAnalyzer analyzer : analyzers) {
            byLanguage.put(analyzer.getLanguage(), analyzer);
        }
        return new AnalyzerRegistry(byLanguage);
    }

    public Optional<LanguageAnalyzer> analyzerFor(String language) {
        return Optional.ofNullable(analyzers.get(language));
    }

    public Set<String> languages() {
        return analyzers.keySet();
    }
}
