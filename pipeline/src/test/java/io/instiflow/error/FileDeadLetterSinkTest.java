package io.instiflow.error;

import io.instiflow.core.Record;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileDeadLetterSinkTest {
    @Test
    void appendsOneJsonLinePerFailure() throws Exception {
        Path tmp = Files.createTempDirectory("dlq-test");
        try {
            Path file = tmp.resolve("nested").resolve("failures.jsonl");
            FileDeadLetterSink<String> dlq = new FileDeadLetterSink<>(file);
            dlq.acceptFailure("transform", new Record<>(3, 0, "2024-01-02"), new IllegalStateException("bad \"quote\""));
            dlq.acceptFailure("sink", new Record<>(4, 1, "2330"), new java.io.IOException("disk\nfull"));

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            assertEquals(2, lines.size());
            assertTrue(lines.get(0).contains("\"stage\":\"transform\""));
            assertTrue(lines.get(0).contains("\"seq\":3"));
            assertTrue(lines.get(0).contains("\"payload\":\"2024-01-02\""));
            assertTrue(lines.get(0).contains("bad 'quote'"));
            assertTrue(lines.get(1).contains("\"subSeq\":1"));
            assertTrue(lines.get(1).contains("disk full"));
        } finally {
            try (var s = Files.walk(tmp)) { s.sorted(java.util.Comparator.reverseOrder()).forEach(p -> { try { Files.deleteIfExists(p); } catch (Exception ignore) {} }); }
        }
    }
}
