package org.pragmatica.online.parser;

import org.pragmatica.online.grammar.Token;

import java.util.regex.Pattern;

/**
 * Bracket-depth bookkeeping for editor auto-indent. Independent of rule matching and never fails.
 */
public final class IndentationTracker {
    private static final Pattern OPENING = Pattern.compile("^[{(\\[]");
    private static final Pattern CLOSING = Pattern.compile("^[})\\]]");

    private IndentationTracker() {}

    /**
     * Recompute the indent level at the start of a line.
     */
    public static void startLine(ParserState state, int indentation, int tabSize) {
        state.setIndentLevel(indentation / tabSize);
    }

    /**
     * Update the levels stack for an opening or closing bracket.
     */
    public static void track(ParserState state, Token token) {
        if (!token.isPunctuation()) {
            return;
        }
        if (OPENING.matcher(token.value()).find()) {
            state.pushLevel(state.indentLevel() + 1);
        } else if (CLOSING.matcher(token.value()).find()) {
            state.popLevel();
            var levels = state.levels();
            if (!levels.isEmpty() && levels.get(levels.size() - 1) < state.indentLevel()) {
                state.setIndentLevel(levels.get(levels.size() - 1));
            }
        }
    }

    /**
     * Suggested indentation in columns for a line starting with {@code textAfter}.
     */
    public static int indentFor(ParserState state, String textAfter, int indentUnit) {
        var levels = state.levels();
        int level = levels.isEmpty()
                    ? state.indentLevel()
                    : levels.get(levels.size() - 1) - (CLOSING.matcher(textAfter.stripLeading()).find() ? 1 : 0);
        return Math.max(level, 0) * indentUnit;
    }
}
