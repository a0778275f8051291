package org.calista.flowsight.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.*;
import java.util.stream.Collectors;

/**
 * FileIO — single I/O entry point of the corpus builder.
 *
 * <p>
 * Covers what the pipeline needs at its boundaries:
 * - strict text reads for mined sources (malformed input is reported, never replaced)
 * - JSONL reads (trim + skip empty, undecodable lines skipped) for previously written partitions
 * - atomic writer handles (tmp sibling + move) for the exported corpus files
 * - deterministic source-tree listing (sorted, extension filter, file cap)
 * </p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = false;

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists", e);
        }
    }

    // ----------------------------
    // Base dir / paths
    // ----------------------------

    public Path baseDir() {
        return baseDir;
    }

    private void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /** External paths (source trees, config files) are only normalized. */
    public Path resolveExternal(Path anyPath) {
        Objects.requireNonNull(anyPath, "anyPath");
        return anyPath.toAbsolutePath().normalize();
    }

    private void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.exists(file);
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, opt.charset);
    }

    /**
     * Reads the whole file with a decoder that reports malformed or unmappable input.
     *
     * @throws java.nio.charset.CharacterCodingException when the bytes are not valid in the configured charset
     */
    public String readStringStrict(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        byte[] bytes = Files.readAllBytes(file);
        CharsetDecoder decoder = opt.charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder.decode(ByteBuffer.wrap(bytes)).toString();
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            Files.writeString(file, content, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return;
        }

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // JSONL helpers
    // ----------------------------

    /**
     * JSONL records of a small file (trim + skip empty).
     * Each line is decoded on its own; a line that is not valid in the charset is logged and skipped.
     */
    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        byte[] bytes = Files.readAllBytes(file);

        List<String> out = new ArrayList<>();
        int start = 0;
        int lineNo = 0;
        while (start <= bytes.length) {
            int end = start;
            while (end < bytes.length && bytes[end] != '\n') end++;
            lineNo++;

            String line = decodeLine(bytes, start, end);
            if (line == null) {
                log.warn("readJsonl: skipping line {} of {}: not valid {}", lineNo, file, opt.charset);
            } else {
                line = line.trim();
                if (!line.isEmpty()) out.add(line);
            }
            start = end + 1;
        }
        log.debug("readJsonl: {} ({} records)", file, out.size());
        return out;
    }

    private String decodeLine(byte[] bytes, int from, int to) {
        CharsetDecoder decoder = opt.charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, from, to - from)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    // ----------------------------
    // Safe Writer API
    // ----------------------------

    /**
     * Opens a BufferedWriter.
     * atomicWrites=true: writes into a tmp sibling, published by commit(handle).
     * atomicWrites=false: writes straight into the target.
     */
    public WriterHandle openWriter(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            BufferedWriter w = Files.newBufferedWriter(file, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            return new WriterHandle(file, null, w);
        }

        Path tmp = tempSibling(file);
        BufferedWriter w = Files.newBufferedWriter(tmp, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        return new WriterHandle(file, tmp, w);
    }

    public void commit(WriterHandle h) throws IOException {
        Objects.requireNonNull(h, "handle");
        try {
            h.writer.close();
        } catch (IOException e) {
            log.error("commit: failed to close writer for {}", h.targetFile, e);
            throw e;
        }
        if (h.tmpFile != null) atomicCommit(h.tmpFile, h.targetFile);
    }

    public void rollback(WriterHandle h) {
        if (h == null) return;
        try {
            h.writer.close();
        } catch (IOException e) {
            log.debug("rollback: close failed for {}: {}", h.targetFile, e.toString());
        }
        if (h.tmpFile != null) {
            try {
                Files.deleteIfExists(h.tmpFile);
            } catch (IOException e) {
                log.warn("rollback: failed to delete tmp {}", h.tmpFile, e);
            }
        }
    }

    public static final class WriterHandle {
        public final Path targetFile;
        public final Path tmpFile; // null when atomicWrites is off
        public final BufferedWriter writer;

        private WriterHandle(Path targetFile, Path tmpFile, BufferedWriter writer) {
            this.targetFile = targetFile;
            this.tmpFile = tmpFile;
            this.writer = writer;
        }
    }

    // ----------------------------
    // Listing
    // ----------------------------

    /**
     * Recursive listing of regular files whose name ends with one of the extensions,
     * sorted by path and capped at maxFiles.
     * Directories that cannot be opened are logged and skipped.
     */
    public List<Path> walk(Path root, Collection<String> extensions, int maxFiles) throws IOException {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(extensions, "extensions");
        if (!Files.isDirectory(root)) return List.of();

        List<String> ext = extensions.stream()
                .filter(Objects::nonNull)
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());

        List<Path> found = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (Files.isRegularFile(file) && hasExtension(file, ext)) found.add(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException e) {
                log.warn("walk: skipping {}: {}", file, e.toString());
                return FileVisitResult.CONTINUE;
            }
        });

        return found.stream()
                .sorted()
                .limit(Math.max(0, maxFiles))
                .collect(Collectors.toList());
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static boolean hasExtension(Path p, List<String> ext) {
        if (ext.isEmpty()) return true;
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String e : ext) {
            if (name.endsWith(e)) return true;
        }
        return false;
    }

    private Path tempSibling(Path target) {
        String name = target.getFileName().toString();
        return target.resolveSibling(name + ".tmp");
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        if (opt.fsyncOnCommit) fsyncFile(tmp);

        try {
            Files.move(tmp, target,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private void fsyncFile(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsyncFile ignored for {}: {}", file, e.toString());
        }
    }
}
