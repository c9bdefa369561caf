package org.abstractica.tictactoe.impl.protocol;

import java.util.Locale;
import java.util.Objects;

/**
 * First message of every connection: {@code <VERB> <CODE>}.
 *
 * @param verb     whether the client wants to play or watch
 * @param roomCode the room code, normalized to upper case
 */
public record Handshake(Verb verb, String roomCode)
{
    public Handshake
    {
        Objects.requireNonNull(verb, "verb");
        Objects.requireNonNull(roomCode, "roomCode");
        if (roomCode.isBlank())
        {
            throw new IllegalArgumentException("roomCode must not be blank");
        }
        roomCode = normalizeCode(roomCode);
    }

    /**
     * Normalizes a room code so that lookups are case-insensitive.
     *
     * @param code the code as typed by a client
     * @return trimmed, upper-case code
     */
    public static String normalizeCode(String code)
    {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Handshake verbs.
     */
    public enum Verb
    {
        /**
         * Join or create a room as a player.
         */
        ROOM(Tokens.ROOM),

        /**
         * Join or create a room as a spectator.
         */
        SPECTATE(Tokens.SPECTATE);

        private final String token;

        Verb(String token)
        {
            this.token = token;
        }

        public String getToken()
        {
            return token;
        }
    }
}
