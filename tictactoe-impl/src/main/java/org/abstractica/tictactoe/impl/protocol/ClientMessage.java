package org.abstractica.tictactoe.impl.protocol;

import java.util.Objects;

/**
 * Messages a connected client can send once its handshake is done.
 */
public sealed interface ClientMessage permits
        ClientMessage.Move,
        ClientMessage.Chat,
        ClientMessage.Other
{
    /**
     * A move request {@code <row>,<col>}. Coordinates are not range-checked here.
     *
     * @param row    0-based row
     * @param column 0-based column
     */
    record Move(int row, int column) implements ClientMessage
    {
    }

    /**
     * A chat line {@code CHAT:<text>}.
     *
     * @param text the message text, trimmed
     */
    record Chat(String text) implements ClientMessage
    {
        public Chat
        {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * Anything else. Ignored by the server.
     *
     * @param raw the received text
     */
    record Other(String raw) implements ClientMessage
    {
        public Other
        {
            Objects.requireNonNull(raw, "raw");
        }
    }
}
