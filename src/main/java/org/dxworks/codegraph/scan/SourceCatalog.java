package org.dxworks.codegraph.scan;

import org.dxworks.codegraph.CodegraphConfig;
import org.dxworks.codegraph.LanguageTable;
import org.dxworks.codegraph.RootNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a project tree and yields the files whose extension is in the language table.
 * <p>
 * The walk is lazy and depth-first. Each directory is listed in file-name order, so two scans
 * of an unchanged tree yield the same sequence. Ignored directories are pruned, symbolic links
 * to directories are not followed, and unreadable, binary (a NUL byte in the first 8 KiB) or
 * oversized files are dropped silently, as are files with an unmapped extension.
 */
public class SourceCatalog {

    private static final Logger log = LoggerFactory.getLogger(SourceCatalog.class);

    private static final int BINARY_PROBE_BYTES = 8192;
    private static final int BUFFER_SIZE = 8192;

    private final LanguageTable languageTable;
    private final Set<String> ignoredDirectories;
    private final int maxFileLines;

    public SourceCatalog(LanguageTable languageTable, Set<String> ignoredDirectories, int maxFileLines) {
        this.languageTable = languageTable;
        this.ignoredDirectories = Set.copyOf(ignoredDirectories);
        this.maxFileLines = maxFileLines;
    }

    public SourceCatalog(CodegraphConfig config) {
        this(config.getLanguageTable(), config.getIgnoredDirectories(), config.getMaxFileLines());
    }

    /**
     * Returns the candidates under {@code root}. The stream can be consumed once.
     *
     * @throws RootNotFoundException if {@code root} does not exist
     */
    public Stream<SourceFile> scan(Path root) {
        if (!Files.exists(root)) {
            throw new RootNotFoundException(root);
        }
        Iterator<Path> files = Files.isDirectory(root)
                ? new DirectoryWalker(root)
                : List.of(root).iterator();
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(files, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .map(this::toCandidate)
                .flatMap(Optional::stream);
    }

    private Optional<SourceFile> toCandidate(Path file) {
        Optional<String> language = languageTable.detectLanguage(file);
        if (language.isEmpty()) {
            return Optional.empty();
        }
        if (!Files.isReadable(file)) {
            log.debug("Skipping unreadable file {}", file);
            return Optional.empty();
        }
        try {
            FileProbe probe = probe(file);
            if (probe.binary) {
                log.debug("Skipping binary file {}", file);
                return Optional.empty();
            }
            if (probe.lines > maxFileLines) {
                log.debug("Skipping {}: more than {} lines", file, maxFileLines);
                return Optional.empty();
            }
        } catch (IOException e) {
            log.debug("Skipping unreadable file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(new SourceFile(file, language.get()));
    }

    /**
     * Scans for a NUL byte in the leading bytes and counts lines, stopping once the count
     * exceeds {@link #maxFileLines}.
     */
    private FileProbe probe(Path file) throws IOException {
        long position = 0;
        int newlines = 0;
        boolean trailingPartialLine = false;
        byte[] buffer = new byte[BUFFER_SIZE];

        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                for (int i = 0; i < read; i++, position++) {
                    byte b = buffer[i];
                    if (b == 0 && position < BINARY_PROBE_BYTES) {
                        return new FileProbe(true, 0);
                    }
                    if (b == '\n') {
                        newlines++;
                        trailingPartialLine = false;
                    } else {
                        trailingPartialLine = true;
                    }
                }
                if (newlines > maxFileLines && position >= BINARY_PROBE_BYTES) {
                    return new FileProbe(false, newlines);
                }
            }
        }
        return new FileProbe(false, newlines + (trailingPartialLine ? 1 : 0));
    }

    private static final class FileProbe {
        final boolean binary;
        final int lines;

        FileProbe(boolean binary, int lines) {
            this.binary = binary;
            this.lines = lines;
        }
    }

    private final class DirectoryWalker implements Iterator<Path> {
        private final Deque<Path> pending = new ArrayDeque<>();
        private Path next;

        DirectoryWalker(Path root) {
            pushChildren(root);
        }

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public Path next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            Path result = next;
            next = null;
            return result;
        }

        private Path advance() {
            while (!pending.isEmpty()) {
                Path entry = pending.pop();
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    if (!isIgnored(entry)) {
                        pushChildren(entry);
                    }
                } else if (Files.isRegularFile(entry)) {
                    return entry;
                }
            }
            return null;
        }

        private boolean isIgnored(Path directory) {
            Path name = directory.getFileName();
            return name != null && ignoredDirectories.contains(name.toString());
        }

        private void pushChildren(Path directory) {
            List<Path> children;
            try (Stream<Path> listing = Files.list(directory)) {
                children = listing
                        .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                        .collect(Collectors.toList());
            } catch (IOException | UncheckedIOException e) {
                log.warn("Cannot list directory {}: {}", directory, e.getMessage());
                return;
            }
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }
}
