package org.pragmatica.online.lexer;

import io.vavr.control.Option;

import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * {@link CharStream} over a single line of text.
 */
public final class LineStream implements CharStream {
    private final String line;
    private final int tabSize;
    private int pos;
    private int start;

    private LineStream(String line, int tabSize) {
        this.line = line;
        this.tabSize = tabSize;
    }

    public static LineStream of(String line, int tabSize) {
        if (tabSize <= 0) {
            throw new IllegalArgumentException("tabSize must be positive: " + tabSize);
        }
        return new LineStream(line, tabSize);
    }

    @Override
    public boolean sol() {
        return pos == 0;
    }

    @Override
    public boolean eol() {
        return pos >= line.length();
    }

    @Override
    public int pos() {
        return pos;
    }

    @Override
    public int start() {
        return start;
    }

    @Override
    public void markStart() {
        start = pos;
    }

    @Override
    public int indentation() {
        int column = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\t') {
                column += tabSize - (column % tabSize);
            } else if (c == ' ') {
                column++;
            } else {
                break;
            }
        }
        return column;
    }

    @Override
    public Option<String> match(Pattern pattern) {
        if (eol()) {
            return Option.none();
        }
        var matcher = pattern.matcher(line).region(pos, line.length());
        // Empty matches would never advance the stream
        if (!matcher.lookingAt() || matcher.end() == pos) {
            return Option.none();
        }
        pos = matcher.end();
        return Option.some(matcher.group());
    }

    @Override
    public boolean match(String literal) {
        if (!literal.isEmpty() && line.startsWith(literal, pos)) {
            pos += literal.length();
            return true;
        }
        return false;
    }

    @Override
    public boolean eatWhile(IntPredicate predicate) {
        int from = pos;
        while (pos < line.length() && predicate.test(line.charAt(pos))) {
            pos++;
        }
        return pos > from;
    }

    @Override
    public void skipToEnd() {
        pos = line.length();
    }

    @Override
    public String current() {
        return line.substring(start, pos);
    }
}
