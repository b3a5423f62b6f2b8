package io.instiflow.institutional.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the row rules every parser shares: trimmed identifiers, no blank or aggregate identifiers,
 * numeric share counts. A repeated identifier replaces the earlier row and is logged.
 */
final class RowCollector {
    private static final Logger log = LoggerFactory.getLogger(RowCollector.class);

    private final String source;
    private final List<String> fields;
    private final Map<String, CanonicalRow> rows = new LinkedHashMap<>();

    RowCollector(String source, List<String> fields) {
        this.source = source;
        this.fields = List.copyOf(fields);
    }

    void add(String rawId, String rawName, Map<String, String> rawValues) {
        String id = rawId == null ? "" : rawId.trim();
        if (id.isEmpty() || id.contains(CanonicalFields.AGGREGATE_MARKER)) return;
        Map<String, Long> shares = new LinkedHashMap<>();
        for (String field : fields) {
            shares.put(field, ShareCounts.parse(rawValues.get(field)));
        }
        CanonicalRow row = new CanonicalRow(id, rawName == null ? "" : rawName.trim(), shares);
        if (rows.put(id, row) != null) {
            log.warn("{}: identifier {} appears more than once, keeping the last row", source, id);
        }
    }

    CanonicalTable toTable() {
        return new CanonicalTable(source, true, fields, new ArrayList<>(rows.values()));
    }
}
