package org.pragmatica.online.grammar;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.online.error.GrammarError;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A complete grammar - rule table, lex table and the root rule name.
 */
public record Grammar(
 Map<String, RuleDefinition> rules,
 LexRules lexRules,
 String rootRule) {
    public static final String DEFAULT_ROOT = "Document";

    public Grammar {
        rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    public static Builder builder(LexRules lexRules) {
        return new Builder(lexRules);
    }

    /**
     * Get rule definition by name.
     */
    public Option<RuleDefinition> rule(String name) {
        return Option.of(rules.get(name));
    }

    /**
     * Validate the grammar: root rule, punctuation kind, non-empty sequences and defined references.
     */
    public Either<GrammarError, Grammar> validate() {
        if (!rules.containsKey(rootRule)) {
            return Either.left(new GrammarError.MissingRootRule(rootRule));
        }
        if (!lexRules.hasPunctuation()) {
            return Either.left(new GrammarError.MissingPunctuation(LexRules.PUNCTUATION));
        }
        for (var entry : rules.entrySet()) {
            if (entry.getValue() instanceof RuleDefinition.Sequence sequence) {
                if (sequence.size() == 0) {
                    return Either.left(new GrammarError.EmptyRule(entry.getKey()));
                }
                var undefined = findUndefinedReference(sequence, rules.keySet());
                if (undefined.isDefined()) {
                    return Either.left(new GrammarError.UndefinedRule(entry.getKey(), undefined.get()));
                }
            }
        }
        return Either.right(this);
    }

    /**
     * Find the first rule reference of a sequence that names no rule. Fork targets are only known per token.
     */
    private static Option<String> findUndefinedReference(RuleDefinition.Sequence sequence, Set<String> ruleNames) {
        for (var item : sequence.items()) {
            var matchable = item.unwrap();
            if (matchable instanceof RuleItem.NonTerminal ref && !ruleNames.contains(ref.ruleName())) {
                return Option.some(ref.ruleName());
            }
        }
        return Option.none();
    }

    public static final class Builder {
        private final LexRules lexRules;
        private final Map<String, RuleDefinition> rules = new LinkedHashMap<>();
        private String rootRule = DEFAULT_ROOT;
        private Option<String> duplicate = Option.none();

        private Builder(LexRules lexRules) {
            this.lexRules = lexRules;
        }

        public Builder root(String name) {
            this.rootRule = name;
            return this;
        }

        public Builder rule(String name, RuleDefinition definition) {
            if (rules.putIfAbsent(name, definition) != null && duplicate.isEmpty()) {
                duplicate = Option.some(name);
            }
            return this;
        }

        public Builder rule(String name, RuleItem... items) {
            return rule(name, Rules.seq(items));
        }

        public Either<GrammarError, Grammar> build() {
            if (duplicate.isDefined()) {
                return Either.left(new GrammarError.DuplicateDefinition(duplicate.get()));
            }
            return new Grammar(rules, lexRules, rootRule).validate();
        }
    }
}
