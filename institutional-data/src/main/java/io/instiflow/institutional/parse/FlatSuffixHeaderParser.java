package io.instiflow.institutional.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses exports with a single header line in which a share column may carry a unit suffix
 * ({@code 投信買進股數} or {@code 投信買進股數(股)}). Either spelling is accepted and the bare name kept.
 */
public class FlatSuffixHeaderParser implements SourceParser {
    private static final Logger log = LoggerFactory.getLogger(FlatSuffixHeaderParser.class);

    private final ColumnMapping mapping;
    private final String unitSuffix;

    public FlatSuffixHeaderParser(ColumnMapping mapping, String unitSuffix) {
        this.mapping = mapping;
        this.unitSuffix = unitSuffix;
    }

    @Override
    public CanonicalTable parse(String text, String source) {
        try {
            List<String> lines = CsvText.nonBlankLines(text);
            if (lines.size() < 2) return CanonicalTable.unkeyed(source);
            int header = CsvText.findHeader(lines, mapping.idLabel(), mapping.nameLabel());
            if (header < 0) return CanonicalTable.unkeyed(source);

            Map<String, Integer> columns = indexOf(CsvText.cells(lines.get(header)));
            Integer idColumn = columns.get(mapping.idLabel());
            Integer nameColumn = columns.get(mapping.nameLabel());
            if (idColumn == null) {
                log.warn("{}: header line has no exact {} column", source, mapping.idLabel());
                return CanonicalTable.unkeyed(source);
            }

            Map<String, Integer> selected = new LinkedHashMap<>();
            for (FieldMapping f : mapping.fields()) {
                Integer idx = columns.get(f.column());
                if (idx == null) idx = columns.get(f.column() + unitSuffix);
                if (idx != null) selected.put(f.field(), idx);
            }

            RowCollector collector = new RowCollector(source, new ArrayList<>(selected.keySet()));
            for (String line : lines.subList(header + 1, lines.size())) {
                List<String> cells = CsvText.cells(line);
                Map<String, String> values = new HashMap<>();
                selected.forEach((field, idx) -> values.put(field, CsvText.cell(cells, idx)));
                String name = nameColumn == null ? "" : CsvText.cell(cells, nameColumn);
                collector.add(CsvText.cell(cells, idColumn), name, values);
            }
            return collector.toTable();
        } catch (RuntimeException e) {
            log.error("Failed to parse {} CSV", source, e);
            return CanonicalTable.unkeyed(source);
        }
    }

    private static Map<String, Integer> indexOf(List<String> header) {
        Map<String, Integer> out = new HashMap<>();
        for (int i = 0; i < header.size(); i++) out.putIfAbsent(header.get(i), i);
        return out;
    }
}
