package io.instiflow.institutional.parse;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Line-level helpers for the publishers' CSV exports: title lines, notes and header rows share one
 * document, so lines are handled one at a time.
 */
final class CsvText {
    private static final CSVFormat LINE_FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreSurroundingSpaces(false)
            .build();

    private CsvText() {}

    static List<String> nonBlankLines(String text) {
        List<String> out = new ArrayList<>();
        if (text == null) return out;
        text.strip().lines().filter(l -> !l.isBlank()).forEach(out::add);
        return out;
    }

    /** Index of the first line containing both labels, or -1. */
    static int findHeader(List<String> lines, String idLabel, String nameLabel) {
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.contains(idLabel) && line.contains(nameLabel)) return i;
        }
        return -1;
    }

    /** Splits one CSV line into cleaned cells. */
    static List<String> cells(String line) {
        try (CSVParser parser = CSVParser.parse(line, LINE_FORMAT)) {
            List<CSVRecord> records = parser.getRecords();
            List<String> out = new ArrayList<>();
            if (records.isEmpty()) return out;
            for (String value : records.get(0)) out.add(clean(value));
            return out;
        } catch (IOException e) {
            throw new UncheckedIOException("Unreadable CSV line: " + line, e);
        }
    }

    /** Trims and removes the {@code ="..."} wrapping the exchange uses to keep leading zeros. */
    static String clean(String cell) {
        if (cell == null) return "";
        String s = cell.trim();
        if (s.startsWith("=")) s = s.substring(1).trim();
        if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) s = s.substring(1, s.length() - 1);
        return s.replace("\"", "").trim();
    }

    static String cell(List<String> cells, int index) {
        return index >= 0 && index < cells.size() ? cells.get(index) : "";
    }
}
