package org.gdump.parser;

import java.util.List;

/**
 * Goroutines extracted from one dump together with the diagnostics for everything that was skipped.
 */
public record ParsedDump(List<Goroutine> goroutines, List<ParseIssue> issues) {

    public ParsedDump {
        goroutines = List.copyOf(goroutines);
        issues = List.copyOf(issues);
    }
}
