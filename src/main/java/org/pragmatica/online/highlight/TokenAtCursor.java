package org.pragmatica.online.highlight;

import org.pragmatica.online.parser.ParserState;

/**
 * Token under a cursor and the parser state right after it.
 */
public record TokenAtCursor(int line, StyledToken token, ParserState state) {}
