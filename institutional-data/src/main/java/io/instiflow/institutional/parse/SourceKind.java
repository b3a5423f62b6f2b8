package io.instiflow.institutional.parse;

/**
 * Header layouts found in the publishers' exports.
 */
public enum SourceKind {
    /** Group labels on one line, forward filled, sub labels on the next. */
    TWO_LEVEL_HEADER,
    /** Single header line, share columns with or without a unit suffix. */
    FLAT_WITH_SUFFIX,
    /** Single header line renamed one to one. */
    SIMPLE;

    public SourceParser parser(ColumnMapping mapping) {
        return switch (this) {
            case TWO_LEVEL_HEADER -> new TwoLevelHeaderParser(mapping);
            case FLAT_WITH_SUFFIX -> new FlatSuffixHeaderParser(mapping, CanonicalFields.SHARE_UNIT_SUFFIX);
            case SIMPLE -> new SimpleHeaderParser(mapping);
        };
    }
}
