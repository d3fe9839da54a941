package org.gdump.parser;

/**
 * Signals a header or position line that does not follow the dump grammar.
 */
class DumpFormatException extends Exception {

    private final ParseIssue.Kind kind;

    DumpFormatException(ParseIssue.Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    DumpFormatException(ParseIssue.Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    ParseIssue.Kind getKind() {
        return kind;
    }
}
