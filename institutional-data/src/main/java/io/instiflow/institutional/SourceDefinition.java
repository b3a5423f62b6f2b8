package io.instiflow.institutional;

import io.instiflow.institutional.fetch.DateStyle;
import io.instiflow.institutional.parse.ColumnMapping;
import io.instiflow.institutional.parse.SourceKind;
import io.instiflow.institutional.parse.SourceParser;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One downloadable export: where it lives, how its date is passed and how its header is laid out.
 */
public record SourceDefinition(
        String name,
        Market market,
        String publisher,
        String url,
        String dateParam,
        DateStyle dateStyle,
        Map<String, String> fixedParams,
        SourceKind kind,
        ColumnMapping mapping
) {
    public SourceDefinition {
        fixedParams = Map.copyOf(fixedParams);
    }

    /** Query string parameters for one trading date, date first. */
    public Map<String, String> queryFor(LocalDate date) {
        Map<String, String> q = new LinkedHashMap<>();
        q.put(dateParam, dateStyle.format(date));
        fixedParams.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> q.put(e.getKey(), e.getValue()));
        return q;
    }

    public SourceParser parser() {
        return kind.parser(mapping);
    }

    public String describe(LocalDate date) {
        return publisher + " " + name + " " + date;
    }
}
