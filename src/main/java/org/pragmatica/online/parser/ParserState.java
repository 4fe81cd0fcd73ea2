package org.pragmatica.online.parser;

import io.vavr.control.Option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Resumable parse state: a stack of rule frames plus indentation bookkeeping.
 *
 * <p>The state holds no reference to the stream or lexer, so hosts can {@link #copy()} it at any
 * line boundary and resume parsing from the copy later. Between tokens the stack always holds
 * the root frame.
 */
public final class ParserState {
    private final List<Frame> frames;
    private final List<Integer> levels;
    private int indentLevel;
    private boolean needsAdvance;

    private ParserState(List<Frame> frames, List<Integer> levels, int indentLevel, boolean needsAdvance) {
        this.frames = frames;
        this.levels = levels;
        this.indentLevel = indentLevel;
        this.needsAdvance = needsAdvance;
    }

    static ParserState empty() {
        return new ParserState(new ArrayList<>(), new ArrayList<>(), 0, false);
    }

    // === Frame Stack ===

    /**
     * Innermost frame.
     */
    public Frame frame() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("Parser state has no active rule");
        }
        return frames.get(frames.size() - 1);
    }

    /**
     * Enclosing frame of the innermost one.
     */
    public Option<Frame> prevState() {
        return frames.size() < 2
               ? Option.none()
               : Option.some(frames.get(frames.size() - 2));
    }

    public String kind() {
        return frame().kind();
    }

    public int step() {
        return frame().step();
    }

    public Option<String> name() {
        return frame().name();
    }

    public Option<String> type() {
        return frame().type();
    }

    public int depth() {
        return frames.size();
    }

    boolean hasRule() {
        return !frames.isEmpty();
    }

    /**
     * Visit frames from the root to the innermost one, so enclosing context is seen first.
     */
    public void forEachState(Consumer<Frame> visitor) {
        for (var frame : frames) {
            visitor.accept(frame);
        }
    }

    void push(Frame frame) {
        frames.add(frame);
    }

    void pop() {
        frames.remove(frames.size() - 1);
    }

    // === Deferred Advance ===

    public boolean needsAdvance() {
        return needsAdvance;
    }

    void setNeedsAdvance(boolean needsAdvance) {
        this.needsAdvance = needsAdvance;
    }

    // === Indentation ===

    public List<Integer> levels() {
        return Collections.unmodifiableList(levels);
    }

    public int indentLevel() {
        return indentLevel;
    }

    void setIndentLevel(int indentLevel) {
        this.indentLevel = indentLevel;
    }

    void pushLevel(int level) {
        levels.add(level);
    }

    void popLevel() {
        if (!levels.isEmpty()) {
            levels.remove(levels.size() - 1);
        }
    }

    // === Copying ===

    /**
     * Independent copy; later changes to either state do not affect the other.
     */
    public ParserState copy() {
        var copiedFrames = new ArrayList<Frame>(frames.size());
        for (var frame : frames) {
            copiedFrames.add(frame.copy());
        }
        return new ParserState(copiedFrames, new ArrayList<>(levels), indentLevel, needsAdvance);
    }

    /**
     * Overwrite this state with a copy of another.
     */
    void copyFrom(ParserState other) {
        frames.clear();
        for (var frame : other.frames) {
            frames.add(frame.copy());
        }
        levels.clear();
        levels.addAll(other.levels);
        indentLevel = other.indentLevel;
        needsAdvance = other.needsAdvance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParserState other)) {
            return false;
        }
        return indentLevel == other.indentLevel
               && needsAdvance == other.needsAdvance
               && frames.equals(other.frames)
               && levels.equals(other.levels);
    }

    @Override
    public int hashCode() {
        return 31 * frames.hashCode() + levels.hashCode();
    }

    @Override
    public String toString() {
        return "ParserState" + frames + (needsAdvance ? "+" : "") + " levels=" + levels + " indent=" + indentLevel;
    }
}
