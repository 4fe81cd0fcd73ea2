package org.pragmatica.online.parser;

/**
 * Reserved style tags reported by the machine.
 */
public final class Styles {
    public static final String WHITESPACE = "ws";
    public static final String COMMENT = "comment";
    public static final String INVALID = "invalidchar";

    private Styles() {}
}
