package org.calista.flowsight.train.mine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.flowsight.io.FileIO;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * SourceTreeMiner — file boundary of the structural miner.
 *
 * <p>
 * Lists source files below {@code root/subdir} (sorted, extension filter, capped), reads
 * each one strictly as UTF-8 and mines it. A file that cannot be read or decoded is
 * logged and skipped; the scan goes on.
 * With parallelism &gt; 1 files are mined on a fixed pool and the results are joined in
 * file order, so the output equals the sequential run.
 * </p>
 */
public final class SourceTreeMiner {
    private static final Logger log = LogManager.getLogger(SourceTreeMiner.class);

    public static final class Config {
        /** Directory below the root that is scanned; blank = the root itself. */
        public String subdir = "drivers";
        public int maxFiles = 100;
        public List<String> extensions = List.of(".c");
        /** 0 or 1 = sequential. */
        public int parallelism = 0;
        public String threadNamePrefix = "miner-";
    }

    /** Outcome of one scan. */
    public static final class Report {
        public final Path dir;
        public final int filesScanned;
        public final int filesFailed;
        public final List<Binding> bindings;

        Report(Path dir, int filesScanned, int filesFailed, List<Binding> bindings) {
            this.dir = dir;
            this.filesScanned = filesScanned;
            this.filesFailed = filesFailed;
            this.bindings = List.copyOf(bindings);
        }

        static Report empty(Path dir) {
            return new Report(dir, 0, 0, List.of());
        }
    }

    private final FileIO io;
    private final StructuralSourceMiner miner;
    private final Config cfg;

    public SourceTreeMiner(FileIO io, StructuralSourceMiner miner, Config cfg) {
        this.io = Objects.requireNonNull(io, "io");
        this.miner = Objects.requireNonNull(miner, "miner");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
    }

    /**
     * Mines every matching file below {@code root/subdir}.
     * A missing directory yields an empty report and a warning.
     *
     * @throws IOException when the directory cannot be listed
     */
    public Report scan(Path root) throws IOException {
        Objects.requireNonNull(root, "root");
        Path dir = io.resolveExternal(cfg.subdir == null || cfg.subdir.isBlank() ? root : root.resolve(cfg.subdir));
        if (!Files.isDirectory(dir)) {
            log.warn("Source directory not found: {}", dir);
            return Report.empty(dir);
        }

        List<Path> files = io.walk(dir, cfg.extensions, cfg.maxFiles);
        log.info("Mining {} files under {} (maxFiles={}, parallelism={})",
                files.size(), dir, cfg.maxFiles, cfg.parallelism);

        List<FileResult> results = cfg.parallelism > 1 ? mineParallel(files) : mineSequential(files);

        List<Binding> bindings = new ArrayList<>();
        int failed = 0;
        for (FileResult r : results) {
            if (r.failed) failed++;
            bindings.addAll(r.bindings);
        }
        log.info("Mined {} bindings from {} files ({} skipped)", bindings.size(), files.size(), failed);
        return new Report(dir, files.size(), failed, bindings);
    }

    // ---------------------------------------------------------------------
    // Per file
    // ---------------------------------------------------------------------

    private static final class FileResult {
        final List<Binding> bindings;
        final boolean failed;

        FileResult(List<Binding> bindings, boolean failed) {
            this.bindings = bindings;
            this.failed = failed;
        }
    }

    private FileResult mineFile(Path file) {
        String text;
        try {
            text = io.readStringStrict(file);
        } catch (CharacterCodingException e) {
            log.warn("Skipping {}: not valid UTF-8 ({})", file, e.toString());
            return new FileResult(List.of(), true);
        } catch (IOException e) {
            log.warn("Skipping {}: {}", file, e.toString());
            return new FileResult(List.of(), true);
        }

        List<Binding> found = miner.mine(text, file.toString());
        log.debug("{}: {} bindings", file, found.size());
        return new FileResult(found, false);
    }

    private List<FileResult> mineSequential(List<Path> files) {
        List<FileResult> out = new ArrayList<>(files.size());
        for (Path f : files) out.add(mineFile(f));
        return out;
    }

    @SuppressWarnings("unchecked")
    private List<FileResult> mineParallel(List<Path> files) {
        ExecutorService pool = createPool(cfg);
        try {
            CompletableFuture<FileResult>[] fut = new CompletableFuture[files.size()];
            for (int i = 0; i < fut.length; i++) {
                Path f = files.get(i);
                fut[i] = CompletableFuture.supplyAsync(() -> mineFile(f), pool);
            }
            List<FileResult> out = new ArrayList<>(fut.length);
            for (CompletableFuture<FileResult> f : fut) out.add(f.join());
            return out;
        } finally {
            shutdown(pool);
        }
    }

    private static ExecutorService createPool(Config cfg) {
        final AtomicLong tid = new AtomicLong(1);
        final int par = Math.max(1, cfg.parallelism);

        ThreadFactory tf = r -> {
            Thread t = new Thread(r, cfg.threadNamePrefix + tid.getAndIncrement());
            t.setDaemon(true);
            return t;
        };

        return new ThreadPoolExecutor(
                par,
                par,
                30L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                tf
        );
    }

    private static void shutdown(ExecutorService es) {
        es.shutdown();
        try {
            if (!es.awaitTermination(5, TimeUnit.SECONDS)) es.shutdownNow();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            es.shutdownNow();
        }
    }
}
