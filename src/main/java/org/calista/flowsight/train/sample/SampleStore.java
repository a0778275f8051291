package org.calista.flowsight.train.sample;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.flowsight.io.FileIO;
import org.calista.flowsight.train.format.SummaryFmt;

import java.io.IOException;
import java.nio.file.Path;
import java.util.*;

/**
 * SampleStore — accumulates records and writes them out as JSONL.
 *
 * <p>
 * Files (inside the output directory):
 * - merged file (default train.jsonl): every record, insertion order, no task key
 * - one {@code <task>.jsonl} per task present: that task's records, with the task key
 * </p>
 *
 * <p>
 * Writes go through {@link FileIO#openWriter(Path)} and are published on commit only.
 * Reading partitions back skips broken lines with a warning.
 * </p>
 */
public final class SampleStore {
    private static final Logger log = LogManager.getLogger(SampleStore.class);

    private final FileIO io;
    private final RecordCodec codec;
    private final Path outputDir;
    private final List<TrainingRecord> records = new ArrayList<>();

    public SampleStore(FileIO io, RecordCodec codec, Path outputDir) {
        this.io = Objects.requireNonNull(io, "io");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
    }

    public Path outputDir() {
        return outputDir;
    }

    // ---------------------------------------------------------------------
    // Accumulate
    // ---------------------------------------------------------------------

    public void add(Collection<TrainingRecord> batch) {
        Objects.requireNonNull(batch, "batch");
        for (TrainingRecord r : batch) records.add(Objects.requireNonNull(r, "record"));
        log.info("Added {} samples, total: {}", batch.size(), records.size());
    }

    public List<TrainingRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    /** Counts per task tag, sorted by tag. */
    public Map<String, Integer> countsByTask() {
        TreeMap<String, Integer> out = new TreeMap<>();
        for (TrainingRecord r : records) out.merge(r.task.tag, 1, Integer::sum);
        return out;
    }

    /** Counts per value of one metadata key, sorted by value; records without the key are not counted. */
    public Map<String, Integer> countsBy(String metadataKey) {
        Objects.requireNonNull(metadataKey, "metadataKey");
        TreeMap<String, Integer> out = new TreeMap<>();
        for (TrainingRecord r : records) {
            Object v = r.metadata.get(metadataKey);
            if (v == null) continue;
            out.merge(String.valueOf(v), 1, Integer::sum);
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Persist
    // ---------------------------------------------------------------------

    /** Writes every record into one file; returns its path. */
    public Path save(String fileName) throws IOException {
        Path file = outputDir.resolve(fileName);
        write(file, records, false);
        log.info("Saved {} samples to {}", records.size(), file);
        return file;
    }

    /** Writes one partition file per task present; returns the written paths by task. */
    public Map<TaskKind, Path> saveByTask() throws IOException {
        EnumMap<TaskKind, List<TrainingRecord>> byTask = new EnumMap<>(TaskKind.class);
        for (TrainingRecord r : records) byTask.computeIfAbsent(r.task, k -> new ArrayList<>()).add(r);

        EnumMap<TaskKind, Path> out = new EnumMap<>(TaskKind.class);
        for (Map.Entry<TaskKind, List<TrainingRecord>> e : byTask.entrySet()) {
            Path file = outputDir.resolve(e.getKey().fileName());
            write(file, e.getValue(), true);
            out.put(e.getKey(), file);
            log.info("  {}: {} samples -> {}", e.getKey().tag, e.getValue().size(), file);
        }
        return out;
    }

    /**
     * Folds the records of existing partition files in the output directory into this store.
     * Bad lines and unreadable files are logged and skipped.
     *
     * @return number of records loaded
     */
    public int loadPartitions() throws IOException {
        int loaded = 0;
        int bad = 0;
        List<TrainingRecord> batch = new ArrayList<>();
        for (TaskKind task : TaskKind.values()) {
            Path file = outputDir.resolve(task.fileName());
            if (!io.exists(file)) continue;

            List<String> lines;
            try {
                lines = io.readJsonl(file);
            } catch (IOException e) {
                log.warn("Skipping unreadable partition {}: {}", file, e.toString());
                continue;
            }
            for (String line : lines) {
                try {
                    batch.add(codec.decode(line, task));
                    loaded++;
                } catch (IOException | IllegalArgumentException e) {
                    bad++;
                    log.warn("Skipping bad record in {}: {}", file, e.toString());
                }
            }
        }
        if (!batch.isEmpty()) add(batch);
        log.info("Merged {} existing samples from {} (bad={})", loaded, outputDir, bad);
        return loaded;
    }

    // ---------------------------------------------------------------------
    // Report
    // ---------------------------------------------------------------------

    public String summary() {
        Map<String, Integer> categories = countsBy(MetadataKeys.CATEGORY);
        Map<String, Integer> difficulties = countsBy(MetadataKeys.DIFFICULTY);
        return SummaryFmt.box("Training data statistics", b -> {
            b.kv("total", records.size());
            b.sep();
            b.line("by task:");
            b.counts(countsByTask());
            if (!categories.isEmpty()) {
                b.sep();
                b.line("by category:");
                b.counts(categories);
            }
            if (!difficulties.isEmpty()) {
                b.sep();
                b.line("by difficulty:");
                b.counts(difficulties);
            }
        });
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void write(Path file, List<TrainingRecord> batch, boolean withTask) throws IOException {
        FileIO.WriterHandle h = io.openWriter(file);
        try {
            for (TrainingRecord r : batch) {
                h.writer.write(withTask ? codec.encodeWithTask(r) : codec.encode(r));
                h.writer.newLine();
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            io.rollback(h);
            throw e;
        }
    }
}
