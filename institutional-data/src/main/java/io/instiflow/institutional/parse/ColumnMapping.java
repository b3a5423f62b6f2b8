package io.instiflow.institutional.parse;

import java.util.List;

/**
 * How one source labels its identifier and name columns, and which share columns to keep.
 * The two labels double as the markers used to find the header line.
 */
public record ColumnMapping(String idLabel, String nameLabel, List<FieldMapping> fields) {
    public ColumnMapping {
        fields = List.copyOf(fields);
        for (FieldMapping f : fields) {
            if (!CanonicalFields.isShareCount(f.field())) {
                throw new IllegalArgumentException("Not a share-count field: " + f.field());
            }
        }
    }
}
