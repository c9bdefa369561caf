package org.abstractica.tictactoe.impl.protocol;

import org.abstractica.tictactoe.Mark;
import org.abstractica.tictactoe.Role;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Decodes client text messages and encodes the composed server messages.
 */
public final class MessageCodec
{
    private MessageCodec() {}

    // ========== Decoding ==========

    /**
     * Decodes a handshake line.
     *
     * @param text the first message received on a connection
     * @return the handshake, or empty if the verb is unknown or the code missing
     */
    public static Optional<Handshake> decodeHandshake(String text)
    {
        Objects.requireNonNull(text, "text");
        String trimmed = text.strip();
        int space = trimmed.indexOf(' ');
        if (space < 0)
        {
            return Optional.empty();
        }

        String verbText = trimmed.substring(0, space).toUpperCase(Locale.ROOT);
        String code = trimmed.substring(space + 1).strip();
        if (code.isEmpty())
        {
            return Optional.empty();
        }

        for (Handshake.Verb verb : Handshake.Verb.values())
        {
            if (verb.getToken().equals(verbText))
            {
                return Optional.of(new Handshake(verb, code));
            }
        }
        return Optional.empty();
    }

    /**
     * Decodes a message received after the handshake.
     *
     * <p>Text made of exactly two integers separated by one comma is a move;
     * text starting with {@code CHAT:} is chat; anything else is
     * {@link ClientMessage.Other}.</p>
     *
     * @param text the received text
     * @return the decoded message
     */
    public static ClientMessage decode(String text)
    {
        Objects.requireNonNull(text, "text");
        String trimmed = text.strip();

        Optional<ClientMessage.Move> move = decodeMove(trimmed);
        if (move.isPresent())
        {
            return move.get();
        }

        if (trimmed.startsWith(Tokens.CHAT_PREFIX))
        {
            return new ClientMessage.Chat(trimmed.substring(Tokens.CHAT_PREFIX.length()).strip());
        }

        return new ClientMessage.Other(trimmed);
    }

    private static Optional<ClientMessage.Move> decodeMove(String text)
    {
        int comma = text.indexOf(',');
        if (comma < 0 || comma != text.lastIndexOf(','))
        {
            return Optional.empty();
        }

        try
        {
            int row = Integer.parseInt(text.substring(0, comma).strip());
            int column = Integer.parseInt(text.substring(comma + 1).strip());
            return Optional.of(new ClientMessage.Move(row, column));
        }
        catch (NumberFormatException e)
        {
            return Optional.empty();
        }
    }

    // ========== Encoding ==========

    /**
     * Encodes a relayed chat line.
     *
     * @param sender the sender's role at the time of relay
     * @param text   the chat text
     * @return {@code CHAT:<label>:<text>}
     */
    public static String encodeChat(Role sender, String text)
    {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(text, "text");
        return Tokens.CHAT_PREFIX + sender.label() + ":" + text;
    }

    /**
     * Returns the turn announcement for the player placing the given mark.
     *
     * @param mover PLAYER_ONE or PLAYER_TWO
     * @return the announcement token
     */
    public static String turnAnnouncement(Mark mover)
    {
        return switch (mover)
        {
            case PLAYER_ONE -> Tokens.PLAYER_ONE_TURN;
            case PLAYER_TWO -> Tokens.PLAYER_TWO_TURN;
            case EMPTY -> throw new IllegalArgumentException("EMPTY never moves");
        };
    }
}
