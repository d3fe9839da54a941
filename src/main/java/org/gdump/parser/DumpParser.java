package org.gdump.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for goroutine stack dumps as written by the Go runtime.
 *
 * <p>A dump is a sequence of blocks separated by blank lines. Every block starts with a header
 * such as "goroutine 18 [chan receive, 3 minutes, locked to thread]:" followed by pairs of lines:
 * the function name and its indented position ("/src/net/http/server.go:2969 +0x970"). The last
 * pair may be introduced by "created by " and names the function that spawned the goroutine.</p>
 *
 * <p>Malformed blocks and frames are skipped and reported as {@link ParseIssue}s; only a failure
 * of the underlying reader aborts the parse. The parser holds no state between calls.</p>
 */
public final class DumpParser {

    private static final Logger LOG = LoggerFactory.getLogger(DumpParser.class);

    private static final String HEADER_KEYWORD = "goroutine";
    private static final String HEADER_PREFIX = HEADER_KEYWORD + " ";
    private static final String CREATED_BY_PREFIX = "created by ";
    private static final String FRAMES_ELIDED = "...additional frames elided...";
    private static final String LOCKED_TO_THREAD = "locked to thread";
    private static final String POSITION_PREFIX = "+0x";

    private static final Pattern WAIT_QUALIFIER = Pattern.compile("(\\d+) minutes");
    private static final Pattern CREATOR_SUFFIX = Pattern.compile("(.+) in goroutine (\\d{1,18})");

    /**
     * Parses the provided dump file, read as UTF-8.
     *
     * @param path path to the dump file
     * @return goroutines in the order they appear in the file
     * @throws IOException if reading the file fails
     */
    public List<Goroutine> parse(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path)) {
            return parse(reader);
        }
    }

    /**
     * Parses dump data from the provided reader. The reader is not closed.
     *
     * @param reader reader with dump data
     * @return goroutines in the order they appear in the dump
     * @throws IOException if reading from the reader fails
     */
    public List<Goroutine> parse(Reader reader) throws IOException {
        return parseDump(reader).goroutines();
    }

    /**
     * Parses dump data and keeps the diagnostics for every skipped block and frame.
     * The reader is not closed.
     *
     * @param reader reader with dump data
     * @return goroutines and issues found while parsing
     * @throws IOException if reading from the reader fails; no goroutines are returned in that case
     */
    public ParsedDump parseDump(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader");

        LineCursor cursor = new LineCursor(reader instanceof BufferedReader br ? br : new BufferedReader(reader));
        List<Goroutine> goroutines = new ArrayList<>();
        List<ParseIssue> issues = new ArrayList<>();
        boolean skippingBlock = false;

        String line;
        while ((line = cursor.next()) != null) {
            if (line.isBlank()) {
                skippingBlock = false;
                continue;
            }

            // lines of a dropped block are noise until the next blank line
            if (skippingBlock && !line.startsWith(HEADER_PREFIX)) {
                continue;
            }

            GoroutineBuilder builder;
            try {
                builder = parseHeader(line.strip());
            } catch (DumpFormatException ex) {
                report(issues, ex.getKind(), cursor.lineNumber(), ex.getMessage());
                skippingBlock = true;
                continue;
            }

            skippingBlock = false;
            readFrames(cursor, builder, issues);
            goroutines.add(builder.build());
        }

        LOG.debug("Parsed {} goroutines, skipped {} blocks or frames", goroutines.size(), issues.size());
        return new ParsedDump(goroutines, issues);
    }

    private static void readFrames(LineCursor cursor, GoroutineBuilder builder, List<ParseIssue> issues)
            throws IOException {
        String line;
        while ((line = cursor.next()) != null) {
            if (line.isBlank()) {
                return;
            }

            String functionLine = line.strip();
            if (functionLine.equals(FRAMES_ELIDED)) {
                builder.framesElided = true;
                continue;
            }

            boolean createdBy = functionLine.startsWith(CREATED_BY_PREFIX);
            int functionLineNumber = cursor.lineNumber();

            String positionLine = cursor.next();
            if (positionLine == null) {
                report(issues, ParseIssue.Kind.TRUNCATED_INPUT, functionLineNumber,
                        "Unexpected end of input after '" + functionLine + "' in goroutine " + builder.id);
                return;
            }
            if (positionLine.isBlank()) {
                report(issues, ParseIssue.Kind.TRUNCATED_INPUT, cursor.lineNumber(),
                        "Unexpected empty line after '" + functionLine + "' in goroutine " + builder.id);
                return;
            }

            FramePosition position;
            try {
                position = parsePosition(positionLine);
            } catch (DumpFormatException ex) {
                report(issues, ex.getKind(), cursor.lineNumber(), ex.getMessage());
                continue;
            }

            if (createdBy) {
                String functionName = functionLine.substring(CREATED_BY_PREFIX.length());
                Matcher creator = CREATOR_SUFFIX.matcher(functionName);
                builder.creatorId = null;
                if (creator.matches()) {
                    functionName = creator.group(1);
                    builder.creatorId = Long.parseLong(creator.group(2));
                }
                builder.createdBy = position.toFrame(functionName);
            } else {
                builder.stackTrace.add(position.toFrame(functionLine));
            }
        }
    }

    // See runtime/traceback.go, goroutineheader()
    static GoroutineBuilder parseHeader(String header) throws DumpFormatException {
        String[] tokens = header.split(" ");
        if (tokens.length < 3) {
            throw new DumpFormatException(ParseIssue.Kind.MALFORMED_HEADER,
                    "Expected header with at least 3 tokens, but got: " + header);
        }
        if (!HEADER_KEYWORD.equals(tokens[0])) {
            throw new DumpFormatException(ParseIssue.Kind.MALFORMED_HEADER,
                    "Expected goroutine header, but got: " + header);
        }

        GoroutineBuilder builder = new GoroutineBuilder();
        try {
            builder.id = Long.parseLong(tokens[1]);
        } catch (NumberFormatException ex) {
            throw new DumpFormatException(ParseIssue.Kind.MALFORMED_HEADER,
                    "Could not parse goroutine id '" + tokens[1] + "' in header: " + header, ex);
        }

        int clauseStart = header.indexOf('[');
        int clauseEnd = header.lastIndexOf(']');
        if (clauseStart < 0 || clauseEnd < clauseStart) {
            throw new DumpFormatException(ParseIssue.Kind.MALFORMED_HEADER,
                    "Missing status clause in header: " + header);
        }

        String[] parts = header.substring(clauseStart + 1, clauseEnd).split(",");
        builder.status = parts[0].strip();
        for (int i = 1; i < parts.length; i++) {
            String qualifier = parts[i].strip();
            Matcher wait = WAIT_QUALIFIER.matcher(qualifier);
            if (qualifier.equals(LOCKED_TO_THREAD)) {
                builder.lockedToThread = true;
            } else if (wait.matches()) {
                try {
                    builder.waitSinceMinutes = Long.parseLong(wait.group(1));
                } catch (NumberFormatException ex) {
                    LOG.debug("Ignoring out of range wait '{}' of goroutine {}", qualifier, builder.id);
                }
            } else {
                LOG.debug("Ignoring qualifier '{}' of goroutine {}", qualifier, builder.id);
            }
        }
        return builder;
    }

    // For example /usr/local/go/src/net/http/server.go:2969 +0x970
    static FramePosition parsePosition(String text) throws DumpFormatException {
        String trimmed = text.strip();

        // paths may contain colons themselves (C:/...), the last one separates the line number
        int fileLineSeparator = trimmed.lastIndexOf(':');
        if (fileLineSeparator < 0) {
            throw new DumpFormatException(ParseIssue.Kind.MALFORMED_FRAME,
                    "Missing line number in position: " + trimmed);
        }

        String file = trimmed.substring(0, fileLineSeparator);
        String[] tokens = trimmed.substring(fileLineSeparator + 1).split(" ");

        int line;
        try {
            line = Integer.parseInt(unsigned(tokens[0]));
        } catch (NumberFormatException ex) {
            throw new DumpFormatException(ParseIssue.Kind.MALFORMED_FRAME,
                    "Could not parse line number '" + tokens[0] + "' in position: " + trimmed, ex);
        }

        Long position = null;
        for (int i = 1; i < tokens.length; i++) {
            if (tokens[i].startsWith(POSITION_PREFIX)) {
                try {
                    position = Long.parseLong(unsigned(tokens[i].substring(POSITION_PREFIX.length())), 16);
                } catch (NumberFormatException ex) {
                    throw new DumpFormatException(ParseIssue.Kind.MALFORMED_FRAME,
                            "Could not parse offset '" + tokens[i] + "' in position: " + trimmed, ex);
                }
                break;
            }
        }

        return new FramePosition(file, line, position);
    }

    // parseInt/parseLong accept a sign, line numbers and offsets never carry one
    private static String unsigned(String number) {
        if (number.startsWith("+") || number.startsWith("-")) {
            throw new NumberFormatException("Signed value: " + number);
        }
        return number;
    }

    private static void report(List<ParseIssue> issues, ParseIssue.Kind kind, int lineNumber, String message) {
        LOG.warn("Skipping {} at line {}: {}", kind, lineNumber, message);
        issues.add(new ParseIssue(kind, lineNumber, message));
    }

    record FramePosition(String file, int line, Long position) {

        StackFrame toFrame(String functionName) {
            return new StackFrame(functionName, file, line, position);
        }
    }

    static final class GoroutineBuilder {
        long id;
        String status = "";
        long waitSinceMinutes;
        boolean lockedToThread;
        final List<StackFrame> stackTrace = new ArrayList<>();
        StackFrame createdBy;
        Long creatorId;
        boolean framesElided;

        Goroutine build() {
            return new Goroutine(id, status, waitSinceMinutes, lockedToThread, stackTrace,
                    createdBy, creatorId, framesElided);
        }
    }

    private static final class LineCursor {
        private final BufferedReader reader;
        private int lineNumber;

        LineCursor(BufferedReader reader) {
            this.reader = reader;
        }

        String next() throws IOException {
            String line = reader.readLine();
            if (line != null) {
                lineNumber++;
            }
            return line;
        }

        int lineNumber() {
            return lineNumber;
        }
    }
}
