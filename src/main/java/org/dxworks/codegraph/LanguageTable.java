package org.dxworks.codegraph;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps file extensions to language identifiers. Extensions are matched case-insensitively
 * and include the leading dot.
 */
public final class LanguageTable {

    private final Map<String, String> languagesByExtension;

    private LanguageTable(Map<String, String> languagesByExtension) {
        this.languagesByExtension = Collections.unmodifiableMap(languagesByExtension);
    }

    public static LanguageTable defaults() {
        Map<String, String> table = new LinkedHashMap<>();
        for (Language lang : Language.values()) {
            for (String ext : lang.getExtensions()) {
                table.put(ext, lang.getName());
            }
        }
        return new LanguageTable(table);
    }

    public static LanguageTable of(Map<String, String> languagesByExtension) {
        Map<String, String> table = new LinkedHashMap<>();
        languagesByExtension.forEach((ext, lang) -> table.put(normalizeExtension(ext), lang));
        return new LanguageTable(table);
    }

    public Optional<String> detectLanguage(Path filePath) {
        Path fileName = filePath.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        return extensionOf(fileName.toString()).map(languagesByExtension::get);
    }

    static Optional<String> extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        // ".gitignore" has no extension
        if (dot <= 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(fileName.substring(dot).toLowerCase(Locale.ROOT));
    }

    private static String normalizeExtension(String ext) {
        String lower = ext.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }
}
