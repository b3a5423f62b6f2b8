package io.instiflow.institutional.parse;

/**
 * Turns one decoded source document into a canonical table. Never throws: a document without a usable
 * header gives an unkeyed table, and so does a document that fails to parse (the failure is logged).
 */
public interface SourceParser {
    CanonicalTable parse(String text, String source);
}
