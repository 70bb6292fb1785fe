package com.dailyresearch.pipeline.corpus;

import com.dailyresearch.pipeline.exception.CorpusUnavailableException;
import com.dailyresearch.pipeline.exception.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Corpus backed by a directory of Markdown notes (an Obsidian-style vault).
 *
 * <p>Line rewrites go through a temp file and an atomic move, so a note is
 * either fully rewritten or untouched.
 */
public class FileSystemCorpusStore implements CorpusStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemCorpusStore.class);

    private final Path root;

    public FileSystemCorpusStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public boolean isAvailable() {
        return Files.isDirectory(root) && Files.isReadable(root);
    }

    @Override
    public List<NoteHandle> listNotes(String pathPrefix) {
        if (!isAvailable()) {
            throw new CorpusUnavailableException("Corpus root is not a readable directory: " + root);
        }
        Path dir = resolve(pathPrefix == null ? "" : pathPrefix);
        if (!Files.isDirectory(dir)) {
            log.debug("Corpus folder {} does not exist, nothing to list", dir);
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".md"))
                    .map(p -> new NoteHandle(root.relativize(p).toString()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new CorpusUnavailableException(PipelineStage.HISTORY_INDEX,
                    "Failed to list corpus folder " + dir, e);
        }
    }

    @Override
    public String read(NoteHandle note) throws IOException {
        return Files.readString(resolve(note.getPath()), StandardCharsets.UTF_8);
    }

    @Override
    public synchronized boolean rewriteLine(NoteHandle note, int lineNumber, String expected, String replacement) {
        Path file = resolve(note.getPath());
        try {
            String text = Files.readString(file, StandardCharsets.UTF_8);
            String separator = text.contains("\r\n") ? "\r\n" : "\n";
            boolean trailingNewline = text.endsWith(separator);
            List<String> lines = new ArrayList<>(List.of(text.split("\\r?\\n", -1)));
            if (trailingNewline) {
                lines.remove(lines.size() - 1);
            }
            if (lineNumber < 0 || lineNumber >= lines.size()) {
                log.warn("Rewrite of {} line {} refused: note has {} lines", note, lineNumber, lines.size());
                return false;
            }
            if (expected != null && !expected.equals(lines.get(lineNumber))) {
                log.warn("Rewrite of {} line {} refused: line changed since it was parsed", note, lineNumber);
                return false;
            }
            lines.set(lineNumber, replacement);
            String out = String.join(separator, lines) + (trailingNewline ? separator : "");
            writeAtomically(file, out);
            return true;
        } catch (IOException e) {
            log.warn("Rewrite of {} line {} failed: {}", note, lineNumber, e.toString());
            return false;
        }
    }

    @Override
    public synchronized boolean create(String path, String content) {
        Path file = resolve(path);
        if (Files.exists(file)) {
            return false;
        }
        try {
            Path parent = file.getParent();
            if (parent != null) Files.createDirectories(parent);
            writeAtomically(file, content);
            return true;
        } catch (IOException e) {
            log.warn("Failed to create note {}: {}", path, e.toString());
            return false;
        }
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    private Path resolve(String relative) {
        Path p = root.resolve(relative.replace('\\', '/')).normalize();
        if (!p.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the corpus root: " + relative);
        }
        return p;
    }

    private static void writeAtomically(Path file, String content) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
