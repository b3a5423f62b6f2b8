package io.instiflow.institutional.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record CsvTable(List<String> header, List<Map<String, String>> rows) {
    public CsvTable {
        header = List.copyOf(header);
        rows = rows.stream()
                .map(r -> Collections.unmodifiableMap(new LinkedHashMap<>(r)))
                .toList();
    }

    public int size() { return rows.size(); }
}
