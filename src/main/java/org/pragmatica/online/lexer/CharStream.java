package org.pragmatica.online.lexer;

import io.vavr.control.Option;

import java.util.function.IntPredicate;
import java.util.regex.Pattern;

/**
 * Host text stream the machine reads tokens from. The machine never owns it.
 */
public interface CharStream {

    /**
     * Whether the stream is at the start of its line.
     */
    boolean sol();

    /**
     * Whether the stream is at the end of its line.
     */
    boolean eol();

    /**
     * Current column (0-based offset into the line).
     */
    int pos();

    /**
     * Offset where the last token started.
     */
    int start();

    /**
     * Mark the current position as the start of the next token.
     */
    void markStart();

    /**
     * Indentation of the current line in columns, with tabs expanded.
     */
    int indentation();

    /**
     * Match a pattern anchored at the current position, consuming it on success.
     */
    Option<String> match(Pattern pattern);

    /**
     * Match a literal at the current position, consuming it on success.
     */
    boolean match(String literal);

    /**
     * Consume characters while the predicate holds. Returns whether anything was consumed.
     */
    boolean eatWhile(IntPredicate predicate);

    /**
     * Consume the rest of the line.
     */
    void skipToEnd();

    /**
     * Text between the token start and the current position.
     */
    String current();
}
