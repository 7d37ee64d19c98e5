package org.dxworks.codegraph.analyzer;

import org.dxworks.codegraph.model.FileAnalysis;

/**
 * Placeholder for a recognized language that is not analyzed yet. Files still count
 * towards the project's file total.
 */
public class NullAnalyzer implements LanguageAnalyzer {

    private final String language;

    public NullAnalyzer(String language) {
        this.language = language;
    }

    @Override
    public String getLanguage() {
        return language;
    }

    @Override
    public FileAnalysis analyze(SourceDocument document) {
        return FileAnalysis.empty(document.path(), language);
    }
}
