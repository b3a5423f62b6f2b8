package io.instiflow.institutional.parse;

import java.util.List;
import java.util.Optional;

/**
 * Rows parsed from one source document. {@code keyed} is false when no header could be located, in which
 * case the table has neither fields nor rows and takes no part in merging.
 */
public record CanonicalTable(String source, boolean keyed, List<String> fields, List<CanonicalRow> rows) {
    public CanonicalTable {
        fields = List.copyOf(fields);
        rows = List.copyOf(rows);
    }

    public static CanonicalTable unkeyed(String source) {
        return new CanonicalTable(source, false, List.of(), List.of());
    }

    public boolean isEmpty() { return rows.isEmpty(); }

    public Optional<CanonicalRow> row(String securityId) {
        return rows.stream().filter(r -> r.securityId().equals(securityId)).findFirst();
    }
}
