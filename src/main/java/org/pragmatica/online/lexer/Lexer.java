package org.pragmatica.online.lexer;

import io.vavr.control.Option;
import org.pragmatica.online.grammar.LexRules;
import org.pragmatica.online.grammar.Token;

/**
 * Lexes one token at the stream position. The first kind whose pattern matches wins.
 */
public final class Lexer {
    private final LexRules lexRules;

    private Lexer(LexRules lexRules) {
        this.lexRules = lexRules;
    }

    public static Lexer create(LexRules lexRules) {
        return new Lexer(lexRules);
    }

    public Option<Token> lex(CharStream stream) {
        for (var entry : lexRules.patterns().entrySet()) {
            var match = stream.match(entry.getValue());
            if (match.isDefined()) {
                return Option.some(Token.of(entry.getKey(), match.get()));
            }
        }
        return Option.none();
    }
}
