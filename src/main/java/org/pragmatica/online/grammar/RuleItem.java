package org.pragmatica.online.grammar;

import io.vavr.control.Option;

import java.util.function.Predicate;

/**
 * Items a sequence rule is composed of.
 */
public sealed interface RuleItem {

    /**
     * The item actually matched against a token, with optional/list wrappers removed.
     */
    Matchable unwrap();

    /**
     * Whether failing to match this item is tolerated by the enclosing frame.
     */
    default boolean isTolerant() {
        return false;
    }

    /**
     * Items that can be matched directly: a terminal or a rule reference.
     */
    sealed interface Matchable extends RuleItem {
        @Override
        default Matchable unwrap() {
            return this;
        }
    }

    // === Matchables ===

    /**
     * Matches a single token by predicate. The optional update runs on the current frame after a match.
     */
    record Terminal(String style, Predicate<Token> matcher, Option<FrameUpdate> update) implements Matchable {
        public boolean matches(Token token) {
            return matcher.test(token);
        }

        public Terminal withUpdate(FrameUpdate frameUpdate) {
            return new Terminal(style, matcher, Option.some(frameUpdate));
        }
    }

    /**
     * Reference to another rule by name: rule
     */
    record NonTerminal(String ruleName) implements Matchable {}

    // === Wrappers ===

    /**
     * Zero or one occurrence: rule?
     */
    record Optional(Matchable inner) implements RuleItem {
        @Override
        public Matchable unwrap() {
            return inner;
        }

        @Override
        public boolean isTolerant() {
            return true;
        }
    }

    /**
     * Zero or more occurrences, optionally delimited: (rule (sep rule)*)?
     */
    record ListOf(Matchable inner, Option<Terminal> separator) implements RuleItem {
        @Override
        public Matchable unwrap() {
            return inner;
        }

        @Override
        public boolean isTolerant() {
            return true;
        }

        public boolean hasSeparator() {
            return separator.isDefined();
        }
    }
}
