package org.gdump.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * One goroutine as described by a block of the stack dump.
 *
 * <p>The status is kept as free text because every runtime release adds new scheduling states.
 * {@code waitSinceMinutes} is zero both when the dump reports no wait and when the wait is
 * shorter than a minute.</p>
 */
public final class Goroutine {

    private final long id;
    private final String status;
    private final long waitSinceMinutes;
    private final boolean lockedToThread;
    private final List<StackFrame> stackTrace;
    private final StackFrame createdBy;
    private final Long creatorId;
    private final boolean framesElided;

    public Goroutine(long id,
                     String status,
                     long waitSinceMinutes,
                     boolean lockedToThread,
                     List<StackFrame> stackTrace,
                     StackFrame createdBy,
                     Long creatorId,
                     boolean framesElided) {
        this.id = id;
        this.status = Objects.requireNonNull(status, "status");
        this.waitSinceMinutes = waitSinceMinutes;
        this.lockedToThread = lockedToThread;
        this.stackTrace = List.copyOf(stackTrace);
        this.createdBy = createdBy;
        this.creatorId = creatorId;
        this.framesElided = framesElided;
    }

    public long getId() {
        return id;
    }

    public String getStatus() {
        return status;
    }

    public long getWaitSinceMinutes() {
        return waitSinceMinutes;
    }

    public boolean isLockedToThread() {
        return lockedToThread;
    }

    public List<StackFrame> getStackTrace() {
        return stackTrace;
    }

    public Optional<StackFrame> getCreatedBy() {
        return Optional.ofNullable(createdBy);
    }

    /**
     * Id of the goroutine that spawned this one, written by newer runtimes as
     * {@code created by pkg.fn in goroutine 7}.
     */
    public OptionalLong getCreatorId() {
        return creatorId == null ? OptionalLong.empty() : OptionalLong.of(creatorId);
    }

    /**
     * Whether the runtime truncated the trace with an {@code ...additional frames elided...} line.
     */
    public boolean isFramesElided() {
        return framesElided;
    }

    /**
     * Stack trace followed by the {@code created by} frame, if any.
     */
    public List<StackFrame> fullStack() {
        if (createdBy == null) {
            return stackTrace;
        }
        List<StackFrame> frames = new ArrayList<>(stackTrace.size() + 1);
        frames.addAll(stackTrace);
        frames.add(createdBy);
        return List.copyOf(frames);
    }

    public boolean stackContains(String text) {
        return stackContains(fullStack(), text);
    }

    /**
     * Checks whether the rendered form of any frame contains the given text, ignoring case.
     *
     * @param frames frames to search
     * @param text   text to look for
     * @return {@code true} if at least one frame matches
     */
    public static boolean stackContains(List<StackFrame> frames, String text) {
        Objects.requireNonNull(frames, "frames");
        Objects.requireNonNull(text, "text");
        String needle = text.toLowerCase(Locale.ROOT);
        for (StackFrame frame : frames) {
            if (frame.toString().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("goroutine ").append(id).append(" [").append(status);
        if (waitSinceMinutes > 0) {
            builder.append(", ").append(waitSinceMinutes).append(" minutes");
        }
        if (lockedToThread) {
            builder.append(", locked to thread");
        }
        builder.append("], frames: ").append(stackTrace.size());
        return builder.toString();
    }
}
