package org.calista.flowsight.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileIOTest {

    @TempDir
    Path tmp;

    @Test
    void strictReadRejectsInvalidUtf8() throws Exception {
        FileIO io = new FileIO(tmp);
        Path bad = tmp.resolve("bad.c");
        Files.write(bad, new byte[]{'o', 'k', (byte) 0xFF});
        Path good = tmp.resolve("good.c");
        Files.writeString(good, "中文", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> io.readStringStrict(bad)).isInstanceOf(CharacterCodingException.class);
        assertThat(io.readStringStrict(good)).isEqualTo("中文");
    }

    @Test
    void committedWriterPublishesAndRollbackLeavesNothing() throws Exception {
        FileIO io = new FileIO(tmp);
        Path target = tmp.resolve("out/data.jsonl");

        FileIO.WriterHandle h = io.openWriter(target);
        h.writer.write("{\"a\":1}");
        h.writer.newLine();
        assertThat(target).doesNotExist();
        io.commit(h);
        assertThat(io.readJsonl(target)).containsExactly("{\"a\":1}");

        FileIO.WriterHandle r = io.openWriter(target);
        r.writer.write("partial");
        io.rollback(r);
        assertThat(io.readJsonl(target)).containsExactly("{\"a\":1}");
        assertThat(r.tmpFile).doesNotExist();
    }

    @Test
    void nonAtomicWritesGoStraightToTheTarget() throws Exception {
        FileIO io = new FileIO(tmp, FileIO.Options.builder().atomicWrites(false).build());
        Path target = tmp.resolve("direct.txt");
        FileIO.WriterHandle h = io.openWriter(target);
        assertThat(h.tmpFile).isNull();
        h.writer.write("x");
        io.commit(h);
        assertThat(io.readString(target)).isEqualTo("x");
    }

    @Test
    void jsonlSkipsBlankLines() throws Exception {
        FileIO io = new FileIO(tmp);
        Path f = tmp.resolve("x.jsonl");
        io.writeString(f, "{}\n\n   \n{\"b\":2}  \n");
        assertThat(io.readJsonl(f)).containsExactly("{}", "{\"b\":2}");
    }

    @Test
    void jsonlSkipsUndecodableLinesOnly() throws Exception {
        FileIO io = new FileIO(tmp);
        Path f = tmp.resolve("mixed.jsonl");
        byte[] good = "{\"k\":\"中文\"}\n".getBytes(StandardCharsets.UTF_8);
        byte[] bad = {'{', '"', 'k', '"', ':', '"', (byte) 0xC3, (byte) 0x28, '"', '}', '\r', '\n'};
        byte[] tail = "{\"k\":2}".getBytes(StandardCharsets.UTF_8);
        byte[] all = new byte[good.length + bad.length + tail.length];
        System.arraycopy(good, 0, all, 0, good.length);
        System.arraycopy(bad, 0, all, good.length, bad.length);
        System.arraycopy(tail, 0, all, good.length + bad.length, tail.length);
        Files.write(f, all);

        assertThat(io.readJsonl(f)).containsExactly("{\"k\":\"中文\"}", "{\"k\":2}");
    }

    @Test
    void walkFiltersSortsAndCaps() throws Exception {
        FileIO io = new FileIO(tmp);
        Path root = tmp.resolve("src");
        for (String name : List.of("b/z.c", "a/y.C", "a/x.h", "c.c")) {
            Path p = root.resolve(name);
            Files.createDirectories(p.getParent());
            Files.writeString(p, "");
        }

        assertThat(io.walk(root, List.of(".c"), 10)).extracting(p -> root.relativize(p).toString().replace('\\', '/'))
                .containsExactly("a/y.C", "b/z.c", "c.c");
        assertThat(io.walk(root, List.of(".c"), 1)).hasSize(1);
        assertThat(io.walk(tmp.resolve("missing"), List.of(".c"), 10)).isEmpty();
    }
}
