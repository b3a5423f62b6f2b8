package io.instiflow.institutional;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the tracked-security list. The file may carry free text above the header; the header is the
 * first line naming both the code column and the market-membership column.
 */
public class SecurityListLoader {
    private static final Logger log = LoggerFactory.getLogger(SecurityListLoader.class);

    public static final String CODE_COLUMN = "stock_code";
    public static final String MARKET_COLUMN = "上市上櫃";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            .build();

    public List<TrackedSecurity> load(Path file) throws ConfigurationException {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Security list not found: " + file);
        }
        List<String> lines;
        try {
            lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read security list " + file, e);
        }
        if (!lines.isEmpty() && lines.get(0).startsWith("\uFEFF")) {
            lines.set(0, lines.get(0).substring(1));
        }

        int header = -1;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.contains(CODE_COLUMN) && line.contains(MARKET_COLUMN)) {
                header = i;
                break;
            }
        }
        if (header < 0) {
            throw new ConfigurationException("No header with " + CODE_COLUMN + " and " + MARKET_COLUMN + " in " + file);
        }
        log.debug("Security list header found on line {} of {}", header + 1, file);

        Map<String, TrackedSecurity> byId = new LinkedHashMap<>();
        String table = String.join("\n", lines.subList(header, lines.size()));
        try (CSVParser parser = CSVParser.parse(table, FORMAT)) {
            for (CSVRecord record : parser) {
                String code = value(record, CODE_COLUMN);
                String label = value(record, MARKET_COLUMN);
                if (code.isEmpty() && label.isEmpty()) continue;
                if (code.isEmpty()) {
                    log.warn("Security list line {} has no {}, skipped", header + record.getRecordNumber() + 1, CODE_COLUMN);
                    continue;
                }
                Market market = Market.fromLabel(label).orElseThrow(() -> new ConfigurationException(
                        "Unknown market label '" + label + "' for " + code + " in " + file));
                byId.put(code, new TrackedSecurity(code, market));
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new ConfigurationException("Malformed security list " + file + ": " + e.getMessage(), e);
        }

        if (byId.isEmpty()) {
            throw new ConfigurationException("Security list " + file + " has no securities");
        }
        log.info("Tracking {} securities from {}", byId.size(), file);
        return List.copyOf(byId.values());
    }

    private static String value(CSVRecord record, String column) {
        return record.isSet(column) ? record.get(column).trim() : "";
    }
}
