package org.pragmatica.online.grammar;

import io.vavr.control.Option;

import java.util.List;
import java.util.function.Function;

/**
 * Builders used by grammar authors.
 *
 * <p>Example:
 * <pre>{@code
 * var numbers = Grammar.builder(lexRules)
 *     .rule("Document", p("["), list(t("Number", "number"), p(",")), p("]"))
 *     .build();
 * }</pre>
 */
public final class Rules {
    public static final String PUNCTUATION_STYLE = "punctuation";

    private Rules() {}

    /**
     * Token of a kind.
     */
    public static RuleItem.Terminal t(String kind, String style) {
        return new RuleItem.Terminal(style, token -> token.kind().equals(kind), Option.none());
    }

    /**
     * Punctuator with the default punctuation style.
     */
    public static RuleItem.Terminal p(String value) {
        return p(value, PUNCTUATION_STYLE);
    }

    /**
     * Punctuator.
     */
    public static RuleItem.Terminal p(String value, String style) {
        return new RuleItem.Terminal(style,
                                     token -> token.isPunctuation() && token.value().equals(value),
                                     Option.none());
    }

    /**
     * Terminal that also rejects any token accepted by one of the exclusions.
     */
    public static RuleItem.Terminal butNot(RuleItem.Terminal rule, RuleItem.Terminal... exclusions) {
        var excluded = List.of(exclusions);
        var matcher = rule.matcher();
        return new RuleItem.Terminal(rule.style(),
                                     token -> matcher.test(token)
                                              && excluded.stream().noneMatch(exclusion -> exclusion.matches(token)),
                                     rule.update());
    }

    /**
     * Reference to a rule by name.
     */
    public static RuleItem.NonTerminal ref(String ruleName) {
        return new RuleItem.NonTerminal(ruleName);
    }

    public static RuleItem.Optional opt(RuleItem.Matchable item) {
        return new RuleItem.Optional(item);
    }

    public static RuleItem.Optional opt(String ruleName) {
        return opt(ref(ruleName));
    }

    public static RuleItem.ListOf list(RuleItem.Matchable item) {
        return new RuleItem.ListOf(item, Option.none());
    }

    public static RuleItem.ListOf list(String ruleName) {
        return list(ref(ruleName));
    }

    public static RuleItem.ListOf list(RuleItem.Matchable item, RuleItem.Terminal separator) {
        return new RuleItem.ListOf(item, Option.some(separator));
    }

    public static RuleItem.ListOf list(String ruleName, RuleItem.Terminal separator) {
        return list(ref(ruleName), separator);
    }

    public static RuleDefinition.Sequence seq(RuleItem... items) {
        return new RuleDefinition.Sequence(List.of(items));
    }

    public static RuleDefinition.Fork fork(Function<Token, Option<RuleItem>> chooser) {
        return new RuleDefinition.Fork(chooser);
    }
}
