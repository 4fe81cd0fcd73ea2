package org.pragmatica.online;

import io.vavr.control.Either;
import io.vavr.control.Option;
import org.pragmatica.online.error.GrammarError;
import org.pragmatica.online.grammar.Grammar;
import org.pragmatica.online.lexer.CharStream;
import org.pragmatica.online.parser.ParserConfig;
import org.pragmatica.online.parser.RuleStackMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * Entry point for creating online parsers.
 *
 * <p>Example usage:
 * <pre>{@code
 * var machine = OnlineParser.builder(grammar)
 *     .lineComment("#")
 *     .build()
 *     .get();
 *
 * var state = machine.startState();
 * var stream = LineStream.of("{ name }", 2);
 * while (!stream.eol()) {
 *     var style = machine.token(stream, state);
 * }
 * }</pre>
 */
public final class OnlineParser {
    private static final Logger log = LoggerFactory.getLogger(OnlineParser.class);

    private OnlineParser() {}

    /**
     * Create a parser for a grammar with the default configuration.
     */
    public static Either<GrammarError, RuleStackMachine> fromGrammar(Grammar grammar) {
        return fromGrammar(grammar, ParserConfig.DEFAULT);
    }

    /**
     * Create a parser for a grammar with custom configuration.
     */
    public static Either<GrammarError, RuleStackMachine> fromGrammar(Grammar grammar, ParserConfig config) {
        var validated = grammar.validate();
        if (validated.isLeft()) {
            log.debug("Rejected grammar: {}", validated.getLeft().message());
        }
        return validated.map(valid -> RuleStackMachine.create(valid, config));
    }

    /**
     * Create a builder for more complex parser configuration.
     */
    public static Builder builder(Grammar grammar) {
        return new Builder(grammar);
    }

    public static final class Builder {
        private final Grammar grammar;
        private int tabSize = ParserConfig.DEFAULT.tabSize();
        private int indentUnit = ParserConfig.DEFAULT.indentUnit();
        private Option<String> lineComment = ParserConfig.DEFAULT.lineComment();
        private Predicate<CharStream> whitespace = ParserConfig.DEFAULT.whitespace();
        private int maxStackDepth = ParserConfig.DEFAULT.maxStackDepth();

        private Builder(Grammar grammar) {
            this.grammar = grammar;
        }

        public Builder tabSize(int tabSize) {
            this.tabSize = tabSize;
            return this;
        }

        public Builder indentUnit(int indentUnit) {
            this.indentUnit = indentUnit;
            return this;
        }

        public Builder lineComment(String prefix) {
            this.lineComment = Option.some(prefix);
            return this;
        }

        public Builder whitespace(Predicate<CharStream> whitespace) {
            this.whitespace = whitespace;
            return this;
        }

        public Builder maxStackDepth(int maxStackDepth) {
            this.maxStackDepth = maxStackDepth;
            return this;
        }

        public Either<GrammarError, RuleStackMachine> build() {
            var config = new ParserConfig(tabSize, indentUnit, lineComment, whitespace, maxStackDepth);
            return fromGrammar(grammar, config);
        }
    }
}
