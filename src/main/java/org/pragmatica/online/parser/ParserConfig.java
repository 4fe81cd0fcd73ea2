package org.pragmatica.online.parser;

import io.vavr.control.Option;
import org.pragmatica.online.lexer.CharStream;

import java.util.function.Predicate;

/**
 * Parser configuration options.
 *
 * @param tabSize       columns per indent level when measuring line indentation
 * @param indentUnit    columns per level when suggesting indentation
 * @param lineComment   prefix starting a comment that runs to the end of the line
 * @param whitespace    consumes ignored characters, returns whether anything was consumed
 * @param maxStackDepth maximum number of frames; deeper rule pushes are treated as a non-match
 */
public record ParserConfig(
    int tabSize,
    int indentUnit,
    Option<String> lineComment,
    Predicate<CharStream> whitespace,
    int maxStackDepth
) {
    public static final Predicate<CharStream> JAVA_WHITESPACE = stream -> stream.eatWhile(Character::isWhitespace);

    public static final ParserConfig DEFAULT = new ParserConfig(
        2,
        2,
        Option.none(),
        JAVA_WHITESPACE,
        256
    );

    public ParserConfig {
        if (tabSize <= 0) {
            throw new IllegalArgumentException("tabSize must be positive: " + tabSize);
        }
        if (indentUnit < 0) {
            throw new IllegalArgumentException("indentUnit must not be negative: " + indentUnit);
        }
        if (maxStackDepth <= 0) {
            throw new IllegalArgumentException("maxStackDepth must be positive: " + maxStackDepth);
        }
    }
}
