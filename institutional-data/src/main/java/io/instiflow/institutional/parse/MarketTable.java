package io.instiflow.institutional.parse;

import java.util.List;

/**
 * All sources of one market and date joined on (identifier, name). Every row carries every field and
 * no count is null.
 */
public record MarketTable(List<String> fields, List<CanonicalRow> rows) {
    public MarketTable {
        fields = List.copyOf(fields);
        rows = List.copyOf(rows);
    }

    public static MarketTable empty() {
        return new MarketTable(List.of(), List.of());
    }

    public boolean isEmpty() { return rows.isEmpty(); }

    public List<CanonicalRow> rowsFor(String securityId) {
        return rows.stream().filter(r -> r.securityId().equals(securityId)).toList();
    }
}
