package io.instiflow.institutional.store;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the persisted CSV files: UTF-8 with a byte-order mark, one header row, '\n' line
 * ends. Writes go to a temporary file in the target directory first, so readers never see a partial file.
 */
final class CsvFiles {
    private static final char BOM = '\uFEFF';
    private static final CSVFormat WRITE_FORMAT = CSVFormat.DEFAULT.builder()
            .setRecordSeparator('\n')
            .build();
    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    private CsvFiles() {}

    static CsvTable read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            reader.mark(1);
            if (reader.read() != BOM) reader.reset();
            try (CSVParser parser = new CSVParser(reader, READ_FORMAT)) {
                List<String> header = parser.getHeaderNames();
                List<Map<String, String>> rows = new ArrayList<>();
                for (CSVRecord r : parser) {
                    Map<String, String> row = new LinkedHashMap<>();
                    for (String h : header) row.put(h, r.isSet(h) ? r.get(h) : "");
                    rows.add(row);
                }
                return new CsvTable(header, rows);
            }
        }
    }

    /** Writes {@code table} to {@code target}, replacing any existing file. */
    static void replace(Path target, CsvTable table) throws IOException {
        Path tmp = writeTemp(target, table);
        try {
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Writes {@code table} to {@code target} only if no such file exists yet.
     *
     * @throws java.nio.file.FileAlreadyExistsException if it does
     */
    static void create(Path target, CsvTable table) throws IOException {
        Path tmp = writeTemp(target, table);
        try {
            Files.move(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private static Path writeTemp(Path target, CsvTable table) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try (BufferedWriter out = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(out, WRITE_FORMAT)) {
            out.write(BOM);
            printer.printRecord(table.header());
            for (Map<String, String> row : table.rows()) {
                List<String> cells = new ArrayList<>(table.header().size());
                for (String h : table.header()) cells.add(row.getOrDefault(h, ""));
                printer.printRecord(cells);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tmp);
            throw e;
        }
        return tmp;
    }
}
