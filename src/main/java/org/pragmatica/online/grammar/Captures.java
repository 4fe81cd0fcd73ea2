package org.pragmatica.online.grammar;

/**
 * Writable scratch fields of the active rule frame, handed to a {@link FrameUpdate}.
 */
public interface Captures {
    void setName(String name);

    void setType(String type);
}
