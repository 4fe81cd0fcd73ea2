package org.pragmatica.online.highlight;

import io.vavr.control.Option;
import org.pragmatica.online.lexer.LineStream;
import org.pragmatica.online.parser.IndentationTracker;
import org.pragmatica.online.parser.ParserState;
import org.pragmatica.online.parser.RuleStackMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Incremental highlighter for a multi-line document.
 *
 * <p>The parser state at the start of every line is kept, so an edit only re-lexes from the first
 * changed line until a following line starts in the same state as before.
 */
public final class DocumentHighlighter {
    private static final Logger log = LoggerFactory.getLogger(DocumentHighlighter.class);

    private final RuleStackMachine machine;
    private final List<String> lines = new ArrayList<>();
    private final List<List<StyledToken>> styles = new ArrayList<>();
    // Start state of each line, plus the state at the end of the document
    private List<ParserState> startStates = new ArrayList<>();

    private DocumentHighlighter(RuleStackMachine machine) {
        this.machine = machine;
        startStates.add(machine.startState());
    }

    public static DocumentHighlighter create(RuleStackMachine machine) {
        return new DocumentHighlighter(machine);
    }

    /**
     * Replace the whole document and style every line.
     */
    public List<List<StyledToken>> highlight(List<String> text) {
        lines.clear();
        lines.addAll(text);
        styles.clear();
        startStates = new ArrayList<>(Collections.nCopies(lines.size() + 1, null));
        for (int i = 0; i < lines.size(); i++) {
            styles.add(List.of());
        }
        relex(0, lines.size(), machine.startState());
        return lineStyles();
    }

    /**
     * Replace {@code count} lines starting at {@code from} with {@code newLines}.
     *
     * @return number of lines that were re-lexed
     */
    public int replaceLines(int from, int count, List<String> newLines) {
        if (from < 0 || count < 0 || from + count > lines.size()) {
            throw new IndexOutOfBoundsException("Invalid line range " + from + "+" + count + " of " + lines.size());
        }
        var start = startStates.get(from).copy();
        var head = startStates.subList(0, from);
        var tail = startStates.subList(from + count, startStates.size());

        var rebuilt = new ArrayList<ParserState>(head);
        rebuilt.addAll(Collections.nCopies(newLines.size(), null));
        rebuilt.addAll(tail);
        startStates = rebuilt;

        for (int i = 0; i < count; i++) {
            lines.remove(from);
            styles.remove(from);
        }
        lines.addAll(from, newLines);
        styles.addAll(from, Collections.nCopies(newLines.size(), List.of()));

        int relexed = relex(from, from + newLines.size(), start);
        log.debug("Replaced {} lines at {} with {}, re-lexed {}", count, from, newLines.size(), relexed);
        return relexed;
    }

    public int lineCount() {
        return lines.size();
    }

    public List<StyledToken> lineTokens(int line) {
        return styles.get(line);
    }

    public List<List<StyledToken>> lineStyles() {
        return Collections.unmodifiableList(styles);
    }

    /**
     * Copy of the parser state at the start of a line. {@code lineCount()} gives the end state.
     */
    public ParserState stateAt(int line) {
        return startStates.get(line).copy();
    }

    /**
     * Suggested indentation in columns for a line starting with {@code textAfter}, using the
     * configured indent unit.
     */
    public int indentFor(int line, String textAfter) {
        return IndentationTracker.indentFor(startStates.get(line), textAfter, machine.config().indentUnit());
    }

    /**
     * Token ending at or after the column, with the state right after it.
     */
    public Option<TokenAtCursor> tokenAt(int line, int column) {
        var state = startStates.get(line).copy();
        var stream = LineStream.of(lines.get(line), machine.config().tabSize());
        Option<TokenAtCursor> found = Option.none();

        while (!stream.eol()) {
            var style = machine.token(stream, state);
            var token = new StyledToken(stream.start(), stream.pos(), stream.current(), style);
            found = Option.some(new TokenAtCursor(line, token, state.copy()));
            if (stream.pos() >= column) {
                break;
            }
        }
        return found;
    }

    private int relex(int from, int dirtyUntil, ParserState state) {
        int relexed = 0;
        for (int i = from; i <= lines.size(); i++) {
            if (i >= dirtyUntil && state.equals(startStates.get(i))) {
                break;
            }
            startStates.set(i, state.copy());
            if (i == lines.size()) {
                break;
            }
            styles.set(i, runLine(lines.get(i), state));
            relexed++;
        }
        return relexed;
    }

    private List<StyledToken> runLine(String text, ParserState state) {
        var stream = LineStream.of(text, machine.config().tabSize());
        var tokens = new ArrayList<StyledToken>();
        while (!stream.eol()) {
            var style = machine.token(stream, state);
            tokens.add(new StyledToken(stream.start(), stream.pos(), stream.current(), style));
        }
        return List.copyOf(tokens);
    }
}
