package org.pragmatica.online.grammar;

/**
 * A lexical token: the kind of the lex rule that matched and the matched text.
 */
public record Token(String kind, String value) {
    public static Token of(String kind, String value) {
        return new Token(kind, value);
    }

    public boolean isPunctuation() {
        return LexRules.PUNCTUATION.equals(kind);
    }
}
