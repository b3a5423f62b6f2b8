package io.instiflow.error;

import io.instiflow.core.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Appends one JSON line per failure: timestamp, stage, seq, payload description and error.
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);

    // instances may share a file
    private static final Object APPEND_LOCK = new Object();

    private final Path file;

    public FileDeadLetterSink(Path file) throws IOException {
        this.file = file;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public void acceptFailure(String stage, Record<T> record, Exception e) {
        String json = String.format(
                "{\"ts\":\"%s\",\"stage\":\"%s\",\"seq\":%d,\"subSeq\":%d,\"payload\":\"%s\",\"error\":\"%s\"}%n",
                Instant.now(), safe(stage), record == null ? -1 : record.seq(), record == null ? -1 : record.subSeq(),
                record == null ? "" : safe(String.valueOf(record.payload())), safe(e.toString()));
        synchronized (APPEND_LOCK) {
            try {
                Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
            } catch (IOException io) {
                log.error("Could not append failure to {}: {}", file, io.getMessage());
            }
        }
    }

    private static String safe(String s) {
        return s.replace("\\", "\\\\").replace("\"", "'").replace("\n", " ").replace("\r", " ");
    }
}
