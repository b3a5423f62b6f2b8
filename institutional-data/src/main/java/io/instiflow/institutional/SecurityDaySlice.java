package io.instiflow.institutional;

import io.instiflow.institutional.parse.CanonicalFields;
import io.instiflow.institutional.parse.CanonicalRow;
import io.instiflow.institutional.store.CsvTable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SecurityDaySlice(TrackedSecurity security, LocalDate date, List<String> fields, List<CanonicalRow> rows) {
    public SecurityDaySlice {
        fields = List.copyOf(fields);
        rows = List.copyOf(rows);
    }

    /** Identifier, name, the share fields, then the date, as written to disk. */
    public CsvTable toCsvTable() {
        List<String> header = new ArrayList<>();
        header.add(CanonicalFields.SECURITY_ID);
        header.add(CanonicalFields.SECURITY_NAME);
        header.addAll(fields);
        header.add(CanonicalFields.DATE);

        List<Map<String, String>> out = new ArrayList<>(rows.size());
        for (CanonicalRow row : rows) {
            Map<String, String> cells = new LinkedHashMap<>();
            cells.put(CanonicalFields.SECURITY_ID, row.securityId());
            cells.put(CanonicalFields.SECURITY_NAME, row.securityName());
            for (String f : fields) {
                Long v = row.share(f);
                cells.put(f, v == null ? "0" : Long.toString(v));
            }
            cells.put(CanonicalFields.DATE, date.toString());
            out.add(cells);
        }
        return new CsvTable(header, out);
    }

    @Override
    public String toString() {
        return security.securityId() + "@" + date;
    }
}
