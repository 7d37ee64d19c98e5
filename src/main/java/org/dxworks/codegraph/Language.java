package org.dxworks.codegraph;

import java.util.List;

/**
 * Languages with a built-in analyzer. The extension lists seed the default {@link LanguageTable}.
 */
public enum Language {
    PYTHON("python", ".py"),
    JAVASCRIPT("javascript", ".js", ".jsx"),
    TYPESCRIPT("typescript", ".ts", ".tsx"),
    JAVA("java", ".java"),
    CPP("cpp", ".cpp"),
    C("c", ".c"),
    CSHARP("csharp", ".cs"),
    PHP("php", ".php"),
    RUBY("ruby", ".rb"),
    GO("go", ".go"),
    RUST("rust", ".rs");

    private final String name;
    private final List<String> extensions;

    Language(String name, String... extensions) {
        this.name = name;
        this.extensions = List.of(extensions);
    }

    public String getName() {
        return name;
    }

    public List<String> getExtensions() {
        return extensions;
    }
}
