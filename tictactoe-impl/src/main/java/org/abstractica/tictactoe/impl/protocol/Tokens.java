package org.abstractica.tictactoe.impl.protocol;

/**
 * Fixed text tokens of the wire protocol.
 *
 * <p>The protocol has no delimiter: each token is written as its own message
 * and the client treats every read as one message. A sentinel token
 * ({@link #MATRIX}, {@link #OVER}) announces that the next message is its
 * payload.</p>
 */
public final class Tokens
{
    private Tokens() {}

    // ========== Client to server ==========

    public static final String ROOM = "ROOM";
    public static final String SPECTATE = "SPECTATE";
    public static final String CHAT_PREFIX = "CHAT:";

    // ========== Server to client ==========

    public static final String YOU_ARE_PLAYER_ONE = "<<< You are player 1 >>>";
    public static final String YOU_ARE_PLAYER_TWO = "<<< You are player 2 >>>";
    public static final String YOU_ARE_SPECTATOR = "<<< You are spectator >>>";

    public static final String ROOM_FULL = "Room Full";
    public static final String PROTOCOL_ERROR = "Protocol Error";
    public static final String SERVER_FULL = "Server Full";
    public static final String ROOM_EXPIRED = "Room Expired";

    public static final String PLAYER_ONE_TURN = "Player One's Turn";
    public static final String PLAYER_TWO_TURN = "Player Two's Turn";
    public static final String INPUT = "Input";
    public static final String MATRIX = "Matrix";
    public static final String OVER = "Over";
}
