package org.pragmatica.online.grammar;

import io.vavr.control.Option;

import java.util.List;
import java.util.function.Function;

/**
 * Definition bound to a rule name: an ordered sequence of items or a fork on the first token.
 */
public sealed interface RuleDefinition {

    /**
     * Whether a frame at the given step has nothing left to match.
     */
    boolean isExhausted(int step);

    /**
     * Ordered sequence: e1 e2 e3
     */
    record Sequence(List<RuleItem> items) implements RuleDefinition {
        public Sequence {
            items = List.copyOf(items);
        }

        public RuleItem item(int step) {
            return items.get(step);
        }

        public int size() {
            return items.size();
        }

        @Override
        public boolean isExhausted(int step) {
            return step >= items.size();
        }
    }

    /**
     * Lookahead dispatch: picks the item to expect from the current token, only at step 0.
     */
    record Fork(Function<Token, Option<RuleItem>> chooser) implements RuleDefinition {
        public Option<RuleItem> choose(Token token) {
            return chooser.apply(token);
        }

        @Override
        public boolean isExhausted(int step) {
            return step > 0;
        }
    }
}
