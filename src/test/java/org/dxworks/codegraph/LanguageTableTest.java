package org.dxworks.codegraph;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LanguageTableTest {

    private final LanguageTable table = LanguageTable.defaults();

    @Test
    void detectsByLowercasedExtension() {
        assertEquals(Optional.of("python"), table.detectLanguage(Paths.get("src/app.py")));
        assertEquals(Optional.of("python"), table.detectLanguage(Paths.get("src/APP.PY")));
        assertEquals(Optional.of("javascript"), table.detectLanguage(Paths.get("view.jsx")));
        assertEquals(Optional.of("typescript"), table.detectLanguage(Paths.get("view.tsx")));
        assertEquals(Optional.of("csharp"), table.detectLanguage(Paths.get("Program.cs")));
    }

    @Test
    void usesOnlyTheLastExtension() {
        assertEquals(Optional.of("javascript"), table.detectLanguage(Paths.get("bundle.min.js")));
        assertEquals(Optional.empty(), table.detectLanguage(Paths.get("archive.py.bak")));
    }

    @Test
    void noExtensionMeansNoLanguage() {
        assertEquals(Optional.empty(), table.detectLanguage(Paths.get("Makefile")));
        assertEquals(Optional.empty(), table.detectLanguage(Paths.get(".gitignore")));
        assertEquals(Optional.empty(), table.detectLanguage(Paths.get("trailing.")));
    }

    @Test
    void customTableNormalizesExtensions() {
        LanguageTable custom = LanguageTable.of(Map.of("KT", "kotlin", ".scala", "scala"));

        assertEquals(Optional.of("kotlin"), custom.detectLanguage(Paths.get("Main.kt")));
        assertEquals(Optional.of("scala"), custom.detectLanguage(Paths.get("Main.scala")));
        assertEquals(Optional.empty(), custom.detectLanguage(Paths.get("main.py")));
    }
}
