package io.instiflow.institutional.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Full outer join of canonical tables on (identifier, name). Fields are the union of the inputs' fields
 * in first-seen order; a security a source did not report gets 0 for that source's fields.
 */
public class TableMerger {

    public MarketTable merge(List<CanonicalTable> tables) {
        List<CanonicalTable> keyed = tables.stream().filter(CanonicalTable::keyed).toList();
        if (keyed.isEmpty()) return MarketTable.empty();

        Set<String> fields = new LinkedHashSet<>();
        Map<JoinKey, Map<String, Long>> joined = new LinkedHashMap<>();
        for (CanonicalTable table : keyed) {
            fields.addAll(table.fields());
            for (CanonicalRow row : table.rows()) {
                Map<String, Long> target = joined.computeIfAbsent(
                        new JoinKey(row.securityId(), row.securityName()), k -> new LinkedHashMap<>());
                row.shares().forEach((field, value) -> {
                    if (value != null || !target.containsKey(field)) target.put(field, value);
                });
            }
        }

        List<CanonicalRow> rows = new ArrayList<>(joined.size());
        joined.forEach((key, values) -> {
            Map<String, Long> filled = new LinkedHashMap<>();
            for (String field : fields) {
                Long v = values.get(field);
                filled.put(field, v == null ? 0L : v);
            }
            rows.add(new CanonicalRow(key.securityId(), key.securityName(), filled));
        });
        return new MarketTable(new ArrayList<>(fields), rows);
    }

    private record JoinKey(String securityId, String securityName) {}
}
