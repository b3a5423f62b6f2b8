package io.instiflow.institutional.store;

import io.instiflow.institutional.Market;
import io.instiflow.institutional.parse.CanonicalFields;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps one history file per security: one row per date, ascending, the latest write for a date
 * replacing the earlier one. Callers for the same file are serialized.
 */
public class HistoryAccumulator {
    private static final Logger log = LoggerFactory.getLogger(HistoryAccumulator.class);

    private final StorageLayout layout;
    private final Map<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    public HistoryAccumulator(StorageLayout layout) {
        this.layout = layout;
    }

    /**
     * Merges {@code newRows} into the security's history.
     *
     * @return number of rows in the history afterwards
     * @throws IOException if the file cannot be read or written, or holds a row without a valid date
     */
    public int accumulate(Market market, String securityId, CsvTable newRows) throws IOException {
        Path file = layout.historyFile(market, securityId);
        ReentrantLock lock = locks.computeIfAbsent(file.toAbsolutePath().normalize(), p -> new ReentrantLock());
        lock.lock();
        try {
            CsvTable merged = Files.exists(file) ? merge(CsvFiles.read(file), newRows, file) : merge(null, newRows, file);
            CsvFiles.replace(file, merged);
            log.info("Updated history for {} ({} rows)", securityId, merged.size());
            return merged.size();
        } finally {
            lock.unlock();
        }
    }

    /** The security's history, an empty table when none was written yet. */
    public CsvTable read(Market market, String securityId) throws IOException {
        Path file = layout.historyFile(market, securityId);
        if (!Files.exists(file)) return new CsvTable(List.of(), List.of());
        return CsvFiles.read(file);
    }

    static CsvTable merge(CsvTable existing, CsvTable incoming, Path file) throws IOException {
        LinkedHashSet<String> header = new LinkedHashSet<>();
        if (existing != null) header.addAll(existing.header());
        header.addAll(incoming.header());
        if (!header.contains(CanonicalFields.DATE)) {
            throw new IOException(file + ": rows carry no " + CanonicalFields.DATE + " column");
        }

        TreeMap<LocalDate, Map<String, String>> byDate = new TreeMap<>();
        if (existing != null) putAll(byDate, existing, file);
        putAll(byDate, incoming, file);
        return new CsvTable(new ArrayList<>(header), new ArrayList<>(byDate.values()));
    }

    private static void putAll(TreeMap<LocalDate, Map<String, String>> byDate, CsvTable table, Path file)
            throws IOException {
        for (Map<String, String> row : table.rows()) {
            byDate.put(dateOf(row, file), row);
        }
    }

    private static LocalDate dateOf(Map<String, String> row, Path file) throws IOException {
        String raw = row.getOrDefault(CanonicalFields.DATE, "").trim();
        try {
            // tolerate a time part such as "2024-01-02 00:00:00"
            return LocalDate.parse(raw.length() > 10 ? raw.substring(0, 10) : raw);
        } catch (DateTimeParseException e) {
            throw new IOException(file + ": row has no valid " + CanonicalFields.DATE + ": '" + raw + "'", e);
        }
    }
}
