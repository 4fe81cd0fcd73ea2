package org.pragmatica.online.parser;

import io.vavr.control.Option;
import org.pragmatica.online.grammar.Grammar;
import org.pragmatica.online.grammar.RuleDefinition;
import org.pragmatica.online.grammar.RuleItem;
import org.pragmatica.online.grammar.Token;
import org.pragmatica.online.lexer.CharStream;
import org.pragmatica.online.lexer.Lexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Online parsing engine - interprets a Grammar one token at a time against a resumable {@link ParserState}.
 *
 * <p>Each call to {@link #token(CharStream, ParserState)} consumes one token from the stream, mutates the
 * state and returns the style of the token. Instances keep a one-slot rollback buffer and must not be
 * shared between threads.
 */
public final class RuleStackMachine {
    private static final Logger log = LoggerFactory.getLogger(RuleStackMachine.class);

    private static final Pattern NON_WHITESPACE = Pattern.compile("\\S+");
    private static final Pattern ANY_CHAR = Pattern.compile("(?s).");

    private final Grammar grammar;
    private final ParserConfig config;
    private final Lexer lexer;
    private final SnapshotCache snapshot;
    private boolean depthLimitReported;
    // Frames at or above this stack index were pushed during the current token and matched nothing yet
    private int unmatchedFrom;

    private RuleStackMachine(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
        this.lexer = Lexer.create(grammar.lexRules());
        this.snapshot = new SnapshotCache();
    }

    /**
     * Create a machine for an already validated grammar.
     */
    public static RuleStackMachine create(Grammar grammar, ParserConfig config) {
        log.debug("Creating online parser with root rule '{}' and {} rules", grammar.rootRule(), grammar.rules().size());
        return new RuleStackMachine(grammar, config);
    }

    public Grammar grammar() {
        return grammar;
    }

    public ParserConfig config() {
        return config;
    }

    /**
     * Fresh state with the root rule pushed.
     */
    public ParserState startState() {
        var state = ParserState.empty();
        pushRule(state, grammar.rootRule(), grammar.rule(grammar.rootRule()).get());
        return state;
    }

    /**
     * Consume one token from the stream and return its style.
     */
    public String token(CharStream stream, ParserState state) {
        if (state.needsAdvance()) {
            state.setNeedsAdvance(false);
            advanceRule(state, true);
        }

        if (stream.sol()) {
            IndentationTracker.startLine(state, stream.indentation(), config.tabSize());
        }

        stream.markStart();

        if (config.whitespace().test(stream)) {
            return Styles.WHITESPACE;
        }

        if (config.lineComment().isDefined() && stream.match(config.lineComment().get())) {
            stream.skipToEnd();
            return Styles.COMMENT;
        }

        var lexed = lexer.lex(stream);
        if (lexed.isEmpty()) {
            skipInvalid(stream);
            return Styles.INVALID;
        }
        var token = lexed.get();

        snapshot.save(state);
        IndentationTracker.track(state, token);
        unmatchedFrom = state.depth();

        while (state.hasRule()) {
            var expected = expectedItem(state.frame(), token);

            if (expected.isDefined()) {
                var item = expected.get().unwrap();

                if (item instanceof RuleItem.NonTerminal ref && tryPush(state, ref)) {
                    continue;
                }

                if (item instanceof RuleItem.Terminal terminal && terminal.matches(token)) {
                    var captures = state.frame().captures();
                    terminal.update().forEach(update -> update.apply(captures, token));

                    // Non-punctuation stays current until the next token, so a partially typed
                    // name keeps its state for completion.
                    if (token.isPunctuation()) {
                        advanceRule(state, true);
                    } else {
                        state.setNeedsAdvance(true);
                    }
                    return terminal.style();
                }
            }

            unsuccessful(state);
        }

        snapshot.restore(state);
        log.trace("Token {} not expected here, state rolled back", token);
        return Styles.INVALID;
    }

    // === Rule Stack ===

    private Option<RuleItem> expectedItem(Frame frame, Token token) {
        Option<RuleItem> expected;
        if (frame.rule() instanceof RuleDefinition.Fork fork) {
            expected = frame.step() == 0
                       ? fork.choose(token)
                       : Option.none();
        } else {
            expected = frame.currentItem();
        }

        if (frame.needsSeparator()) {
            return expected.flatMap(RuleStackMachine::separatorOf);
        }
        return expected;
    }

    private static Option<RuleItem> separatorOf(RuleItem item) {
        if (item instanceof RuleItem.ListOf list && list.hasSeparator()) {
            return Option.some(list.separator().get());
        }
        return Option.none();
    }

    private boolean tryPush(ParserState state, RuleItem.NonTerminal ref) {
        var definition = grammar.rule(ref.ruleName());
        if (definition.isEmpty()) {
            log.debug("Rule '{}' chosen by '{}' is not defined", ref.ruleName(), state.kind());
            return false;
        }
        if (state.depth() >= config.maxStackDepth()) {
            if (!depthLimitReported) {
                depthLimitReported = true;
                log.warn("Rule stack depth limit {} reached pushing '{}', grammar may be cyclic",
                         config.maxStackDepth(), ref.ruleName());
            }
            return false;
        }
        pushRule(state, ref.ruleName(), definition.get());
        return true;
    }

    private static void pushRule(ParserState state, String kind, RuleDefinition rule) {
        state.push(Frame.enter(kind, rule));
    }

    /**
     * Advance the current rule. Completed rules are popped and their parents advanced in turn.
     * A completed root rule stays on the stack, expecting nothing further.
     */
    private void advanceRule(ParserState state, boolean successful) {
        var frame = state.frame();

        // A successful list element or separator leaves the list open for repetition
        if (successful) {
            var list = frame.currentList();
            if (list.isDefined()) {
                if (list.get().hasSeparator()) {
                    frame.toggleSeparator();
                }
                return;
            }
        }

        frame.setNeedsSeparator(false);
        frame.advance();

        while (frame.isExhausted() && state.depth() > 1) {
            // An element that matched nothing in this token is not repeated, the list ends instead
            var emptyElement = !successful && state.depth() - 1 >= unmatchedFrom;
            popFrame(state);
            frame = state.frame();

            var list = frame.currentList();
            if (list.isDefined() && !emptyElement) {
                if (list.get().hasSeparator()) {
                    frame.toggleSeparator();
                }
            } else {
                frame.setNeedsSeparator(false);
                frame.advance();
            }
        }
    }

    /**
     * Unwind after a failed match: drop frames until one tolerates failure at its current step,
     * then move that frame past the optional or list item.
     */
    private void unsuccessful(ParserState state) {
        while (state.hasRule() && !isTolerant(state.frame())) {
            popFrame(state);
        }

        if (state.hasRule()) {
            advanceRule(state, false);
        }
    }

    private void popFrame(ParserState state) {
        state.pop();
        unmatchedFrom = Math.min(unmatchedFrom, state.depth());
    }

    private static boolean isTolerant(Frame frame) {
        return frame.currentItem()
                    .map(RuleItem::isTolerant)
                    .getOrElse(false);
    }

    private static void skipInvalid(CharStream stream) {
        if (stream.match(NON_WHITESPACE).isEmpty()) {
            stream.match(ANY_CHAR);
        }
    }
}
