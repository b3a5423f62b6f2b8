package io.instiflow.institutional.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses exports whose header spans two lines: a group line where a blank label continues the group to
 * its left, and a sub-label line beneath it. Share columns are picked by explicit (group, sub) pairs;
 * everything else is dropped.
 */
public class TwoLevelHeaderParser implements SourceParser {
    private static final Logger log = LoggerFactory.getLogger(TwoLevelHeaderParser.class);

    private final ColumnMapping mapping;

    public TwoLevelHeaderParser(ColumnMapping mapping) {
        this.mapping = mapping;
    }

    @Override
    public CanonicalTable parse(String text, String source) {
        try {
            List<String> lines = CsvText.nonBlankLines(text);
            if (lines.size() < 2) return CanonicalTable.unkeyed(source);
            int header = CsvText.findHeader(lines, mapping.idLabel(), mapping.nameLabel());
            if (header < 0) return CanonicalTable.unkeyed(source);
            if (header + 1 >= lines.size()) {
                log.warn("{}: header line {} has no sub-label line", source, header);
                return CanonicalTable.unkeyed(source);
            }

            List<String> groups = forwardFill(CsvText.cells(lines.get(header)));
            List<String> subs = CsvText.cells(lines.get(header + 1));
            Map<HeaderKey, Integer> columns = new HashMap<>();
            for (int i = 0; i < groups.size(); i++) {
                columns.putIfAbsent(new HeaderKey(groups.get(i), CsvText.cell(subs, i)), i);
            }

            int idColumn = labelColumn(groups, subs, mapping.idLabel());
            int nameColumn = labelColumn(groups, subs, mapping.nameLabel());
            if (idColumn < 0) {
                log.warn("{}: no {} column under the two-level header", source, mapping.idLabel());
                return CanonicalTable.unkeyed(source);
            }

            Map<String, Integer> selected = new LinkedHashMap<>();
            for (FieldMapping f : mapping.fields()) {
                Integer idx = columns.get(new HeaderKey(f.group(), f.column()));
                if (idx == null) {
                    log.warn("{}: column ({}, {}) not found, {} left out", source, f.group(), f.column(), f.field());
                    continue;
                }
                selected.put(f.field(), idx);
            }

            RowCollector collector = new RowCollector(source, new ArrayList<>(selected.keySet()));
            for (String line : lines.subList(header + 2, lines.size())) {
                List<String> cells = CsvText.cells(line);
                Map<String, String> values = new HashMap<>();
                selected.forEach((field, idx) -> values.put(field, CsvText.cell(cells, idx)));
                collector.add(CsvText.cell(cells, idColumn), CsvText.cell(cells, nameColumn), values);
            }
            return collector.toTable();
        } catch (RuntimeException e) {
            log.error("Failed to parse {} CSV", source, e);
            return CanonicalTable.unkeyed(source);
        }
    }

    /** Blank group labels take the nearest non-blank label to their left. */
    static List<String> forwardFill(List<String> groups) {
        List<String> out = new ArrayList<>(groups.size());
        String current = "";
        for (String g : groups) {
            if (!g.isBlank()) current = g.trim();
            out.add(current);
        }
        return out;
    }

    private static int labelColumn(List<String> groups, List<String> subs, String label) {
        for (int i = 0; i < groups.size(); i++) {
            if (label.equals(groups.get(i)) || label.equals(CsvText.cell(subs, i))) return i;
        }
        return -1;
    }

    private record HeaderKey(String group, String sub) {}
}
