package io.instiflow.institutional.parse;

/**
 * Selects one source column and names the canonical field it becomes. {@code group} is only used by
 * two-level headers and is null otherwise.
 */
public record FieldMapping(String group, String column, String field) {
    public static FieldMapping of(String column, String field) {
        return new FieldMapping(null, column, field);
    }

    public static FieldMapping grouped(String group, String column, String field) {
        return new FieldMapping(group, column, field);
    }

    /** Column kept under its own name. */
    public static FieldMapping same(String column) {
        return new FieldMapping(null, column, column);
    }
}
