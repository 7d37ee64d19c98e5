package org.dxworks.codegraph.analyzer;

import org.dxworks.codegraph.model.FileAnalysis;

/**
 * Turns the text of one file into nodes and edges.
 * <p>
 * Implementations must be total: a parse failure yields a partial or empty
 * {@link FileAnalysis} carrying the failure, never an exception. Implementations are shared
 * across worker threads and must not keep per-file state in fields.
 */
public interface LanguageAnalyzer {

    String getLanguage();

    FileAnalysis analyze(SourceDocument document);
}
