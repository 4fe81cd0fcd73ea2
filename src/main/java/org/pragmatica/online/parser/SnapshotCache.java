package org.pragmatica.online.parser;

/**
 * Single-slot rollback buffer, one per machine.
 */
final class SnapshotCache {
    private ParserState saved = ParserState.empty();

    void save(ParserState state) {
        saved.copyFrom(state);
    }

    void restore(ParserState state) {
        state.copyFrom(saved);
    }
}
