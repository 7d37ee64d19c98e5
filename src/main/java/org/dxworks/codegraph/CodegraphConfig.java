package org.dxworks.codegraph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.codegraph.analyzer.NodeIdStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public class CodegraphConfig {

    private static final Logger log = LoggerFactory.getLogger(CodegraphConfig.class);

    private static final String CONFIG_FILE_NAME = "codegraph-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final boolean DEFAULT_ORDERED_MERGE = true;
    private static final boolean DEFAULT_CALL_EDGES = false;
    private static final Charset DEFAULT_FALLBACK_ENCODING = StandardCharsets.ISO_8859_1;
    private static final Set<String> DEFAULT_IGNORED_DIRECTORIES = Set.of(
            ".git", "node_modules", "__pycache__", ".venv", "venv",
            "target", "build", "dist", ".idea", ".vscode"
    );

    private final LanguageTable languageTable;
    private final int concurrency;
    private final boolean orderedMerge;
    private final Charset fallbackEncoding;
    private final int maxFileLines;
    private final Set<String> ignoredDirectories;
    private final Set<String> disabledAnalyzers;
    private final NodeIdStrategy nodeIdStrategy;
    private final boolean callEdges;

    private CodegraphConfig(Builder builder) {
        this.languageTable = builder.languageTable;
        this.concurrency = builder.concurrency > 0 ? builder.concurrency : defaultConcurrency();
        this.orderedMerge = builder.orderedMerge;
        this.fallbackEncoding = builder.fallbackEncoding;
        this.maxFileLines = builder.maxFileLines > 0 ? builder.maxFileLines : DEFAULT_MAX_FILE_LINES;
        this.ignoredDirectories = Set.copyOf(builder.ignoredDirectories);
        this.disabledAnalyzers = Set.copyOf(builder.disabledAnalyzers);
        this.nodeIdStrategy = builder.nodeIdStrategy;
        this.callEdges = builder.callEdges;
    }

    public LanguageTable getLanguageTable() {
        return languageTable;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public boolean isOrderedMerge() {
        return orderedMerge;
    }

    public Charset getFallbackEncoding() {
        return fallbackEncoding;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public Set<String> getIgnoredDirectories() {
        return ignoredDirectories;
    }

    public NodeIdStrategy getNodeIdStrategy() {
        return nodeIdStrategy;
    }

    public boolean isCallEdges() {
        return callEdges;
    }

    public boolean isAnalyzerEnabled(String language) {
        return !disabledAnalyzers.contains(language);
    }

    public static CodegraphConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads {@value #CONFIG_FILE_NAME} from the working directory, or the defaults when absent.
     */
    public static CodegraphConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodegraphConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException | IllegalArgumentException e) {
            log.warn("Ignoring unreadable config {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    private static CodegraphConfig fromYaml(YamlConfig yaml) {
        Builder builder = builder();
        if (yaml.languages != null && !yaml.languages.isEmpty()) {
            builder.languageTable(LanguageTable.of(yaml.languages));
        }
        if (yaml.concurrency != null) {
            builder.concurrency(yaml.concurrency);
        }
        if (yaml.orderedMerge != null) {
            builder.orderedMerge(yaml.orderedMerge);
        }
        if (yaml.fallbackEncoding != null) {
            builder.fallbackEncoding(Charset.forName(yaml.fallbackEncoding));
        }
        if (yaml.maxFileLines != null) {
            builder.maxFileLines(yaml.maxFileLines);
        }
        if (yaml.ignoredDirectories != null) {
            builder.ignoredDirectories(new HashSet<>(yaml.ignoredDirectories));
        }
        if (yaml.disabledAnalyzers != null) {
            builder.disabledAnalyzers(new HashSet<>(yaml.disabledAnalyzers));
        }
        if (yaml.nodeIds != null) {
            builder.nodeIdStrategy(NodeIdStrategy.valueOf(yaml.nodeIds.trim().toUpperCase(Locale.ROOT)));
        }
        if (yaml.callEdges != null) {
            builder.callEdges(yaml.callEdges);
        }
        return builder.build();
    }

    private static int defaultConcurrency() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public static final class Builder {
        private LanguageTable languageTable = LanguageTable.defaults();
        private int concurrency = 0;
        private boolean orderedMerge = DEFAULT_ORDERED_MERGE;
        private Charset fallbackEncoding = DEFAULT_FALLBACK_ENCODING;
        private int maxFileLines = DEFAULT_MAX_FILE_LINES;
        private Set<String> ignoredDirectories = DEFAULT_IGNORED_DIRECTORIES;
        private Set<String> disabledAnalyzers = Set.of();
        private NodeIdStrategy nodeIdStrategy = NodeIdStrategy.STEM;
        private boolean callEdges = DEFAULT_CALL_EDGES;

        private Builder() {
        }

        public Builder languageTable(LanguageTable languageTable) {
            this.languageTable = languageTable;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder orderedMerge(boolean orderedMerge) {
            this.orderedMerge = orderedMerge;
            return this;
        }

        public Builder fallbackEncoding(Charset fallbackEncoding) {
            this.fallbackEncoding = fallbackEncoding;
            return this;
        }

        public Builder maxFileLines(int maxFileLines) {
            this.maxFileLines = maxFileLines;
            return this;
        }

        public Builder ignoredDirectories(Set<String> ignoredDirectories) {
            this.ignoredDirectories = ignoredDirectories;
            return this;
        }

        public Builder disabledAnalyzers(Set<String> disabledAnalyzers) {
            this.disabledAnalyzers = disabledAnalyzers;
            return this;
        }

        public Builder nodeIdStrategy(NodeIdStrategy nodeIdStrategy) {
            this.nodeIdStrategy = nodeIdStrategy;
            return this;
        }

        public Builder callEdges(boolean callEdges) {
            this.callEdges = callEdges;
            return this;
        }

        public CodegraphConfig build() {
            return new CodegraphConfig(this);
        }
    }

    private static class YamlConfig {
        public Map<String, String> languages;
        public Integer concurrency;
        public Boolean orderedMerge;
        public String fallbackEncoding;
        public Integer maxFileLines;
        public List<String> ignoredDirectories;
        public List<String> disabledAnalyzers;
        public String nodeIds;
        public Boolean callEdges;
    }
}
