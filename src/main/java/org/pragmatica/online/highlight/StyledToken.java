package org.pragmatica.online.highlight;

/**
 * A styled span of one line: [start, end) columns, the text and its style.
 */
public record StyledToken(int start, int end, String text, String style) {}
