package org.gdump.parser;

/**
 * Diagnostic for a part of the dump that was skipped while parsing.
 *
 * @param kind       what was skipped
 * @param lineNumber 1-based line the problem was detected on
 * @param message    human readable description
 */
public record ParseIssue(Kind kind, int lineNumber, String message) {

    public enum Kind {
        /** Header could not be decoded; the whole block was dropped. */
        MALFORMED_HEADER,
        /** Position line could not be decoded; one frame was dropped. */
        MALFORMED_FRAME,
        /** Input ended, or the block ended, where a position line was expected. */
        TRUNCATED_INPUT
    }
}
