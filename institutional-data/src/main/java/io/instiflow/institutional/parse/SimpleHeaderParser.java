package io.instiflow.institutional.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses exports with one plain header line; mapped columns are renamed to their canonical fields.
 */
public class SimpleHeaderParser implements SourceParser {
    private static final Logger log = LoggerFactory.getLogger(SimpleHeaderParser.class);

    private final ColumnMapping mapping;

    public SimpleHeaderParser(ColumnMapping mapping) {
        this.mapping = mapping;
    }

    @Override
    public CanonicalTable parse(String text, String source) {
        try {
            List<String> lines = CsvText.nonBlankLines(text);
            if (lines.size() < 2) return CanonicalTable.unkeyed(source);
            int header = CsvText.findHeader(lines, mapping.idLabel(), mapping.nameLabel());
            if (header < 0) return CanonicalTable.unkeyed(source);

            List<String> names = CsvText.cells(lines.get(header));
            int idColumn = names.indexOf(mapping.idLabel());
            int nameColumn = names.indexOf(mapping.nameLabel());
            if (idColumn < 0) {
                log.warn("{}: header line has no exact {} column", source, mapping.idLabel());
                return CanonicalTable.unkeyed(source);
            }
            Map<String, Integer> selected = new LinkedHashMap<>();
            for (FieldMapping f : mapping.fields()) {
                int idx = names.indexOf(f.column());
                if (idx >= 0) selected.put(f.field(), idx);
            }

            RowCollector collector = new RowCollector(source, new ArrayList<>(selected.keySet()));
            for (String line : lines.subList(header + 1, lines.size())) {
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
}
