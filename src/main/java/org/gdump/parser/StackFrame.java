package org.gdump.parser;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * A single call-stack entry: the active function and its source location.
 */
public final class StackFrame {

    private final String functionName;
    private final String file;
    private final int line;
    private final Long position;

    public StackFrame(String functionName, String file, int line, Long position) {
        this.functionName = Objects.requireNonNull(functionName, "functionName");
        this.file = Objects.requireNonNull(file, "file");
        this.line = line;
        this.position = position;
    }

    public String getFunctionName() {
        return functionName;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    /**
     * Relative program-counter offset reported as {@code +0x<hex>}, if the dump contains one.
     */
    public OptionalLong getPosition() {
        return position == null ? OptionalLong.empty() : OptionalLong.of(position);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StackFrame other)) {
            return false;
        }
        return line == other.line
                && functionName.equals(other.functionName)
                && file.equals(other.file)
                && Objects.equals(position, other.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(functionName, file, line, position);
    }

    /**
     * Renders the frame for display, e.g. {@code main.foo\n   file:///a/b.go#10 +0x1a}.
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(functionName).append('\n');
        builder.append("   file://").append(file).append('#').append(line);
        if (position != null) {
            builder.append(" +0x").append(Long.toHexString(position));
        }
        return builder.toString();
    }
}
