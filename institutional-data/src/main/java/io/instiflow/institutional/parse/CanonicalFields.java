package io.instiflow.institutional.parse;

/**
 * Column labels shared by every source once normalized, as written to the persisted files.
 */
public final class CanonicalFields {
    public static final String SECURITY_ID = "證券代號";
    public static final String SECURITY_NAME = "證券名稱";
    public static final String DATE = "日期";

    /** Substring that marks a share-count column. */
    public static final String SHARE_COUNT_MARKER = "股數";
    /** Substring that marks a total/subtotal row in the identifier column. */
    public static final String AGGREGATE_MARKER = "計";
    /** Unit suffix some exports append to share-count headers. */
    public static final String SHARE_UNIT_SUFFIX = "(股)";

    private CanonicalFields() {}

    public static boolean isShareCount(String field) {
        return field != null && field.contains(SHARE_COUNT_MARKER);
    }
}
