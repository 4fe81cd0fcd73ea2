package org.pragmatica.online.error;

/**
 * Grammar authoring error, reported once when a grammar or lex table is built.
 */
public sealed interface GrammarError {
    String message();

    /**
     * The designated root rule has no definition.
     */
    record MissingRootRule(String rootRule) implements GrammarError {
        @Override
        public String message() {
            return "Root rule '" + rootRule + "' is not defined";
        }
    }

    /**
     * A rule references a rule name absent from the table.
     */
    record UndefinedRule(String rule, String reference) implements GrammarError {
        @Override
        public String message() {
            return "Undefined rule reference: '" + reference + "' in rule '" + rule + "'";
        }
    }

    /**
     * A sequence rule with no items.
     */
    record EmptyRule(String rule) implements GrammarError {
        @Override
        public String message() {
            return "Rule '" + rule + "' has no items";
        }
    }

    /**
     * The lex table has no punctuation kind.
     */
    record MissingPunctuation(String kind) implements GrammarError {
        @Override
        public String message() {
            return "Lex rules must define the '" + kind + "' kind";
        }
    }

    /**
     * A lex rule pattern that does not compile.
     */
    record InvalidPattern(String kind, String pattern, String reason) implements GrammarError {
        @Override
        public String message() {
            return "Invalid pattern for token kind '" + kind + "': " + pattern + " (" + reason + ")";
        }
    }

    /**
     * The same rule or token kind is defined twice.
     */
    record DuplicateDefinition(String name) implements GrammarError {
        @Override
        public String message() {
            return "Duplicate definition: '" + name + "'";
        }
    }
}
