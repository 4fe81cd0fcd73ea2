package org.pragmatica.online.grammar;

/**
 * Side effect run on the active frame when a terminal matches, e.g. to capture a name.
 */
@FunctionalInterface
public interface FrameUpdate {
    void apply(Captures frame, Token token);
}
