package org.abstractica.tictactoe.impl.relay;

import org.abstractica.tictactoe.Role;
import org.abstractica.tictactoe.impl.protocol.MessageCodec;
import org.abstractica.tictactoe.impl.room.Room;
import org.abstractica.tictactoe.impl.transport.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;

/**
 * Fan-out send primitives for a room.
 *
 * <p>Every fan-out is best effort: a failed write to one connection is logged
 * and the remaining connections still receive the message. After each fan-out
 * the relay pauses for the message gap so that consecutive tokens reach
 * clients as separate reads.</p>
 *
 * <p>Fan-outs are made under the room's delivery lock and reach only the
 * room's audience, so a spectator still being synced sees none of them.</p>
 */
public class Relay
{
    private static final Logger LOG = LoggerFactory.getLogger(Relay.class);

    private final Duration messageGap;

    /**
     * Creates a relay.
     *
     * @param messageGap pause after each fan-out, may be zero
     */
    public Relay(Duration messageGap)
    {
        Objects.requireNonNull(messageGap, "messageGap");
        if (messageGap.isNegative())
        {
            throw new IllegalArgumentException("messageGap must not be negative");
        }
        this.messageGap = messageGap;
    }

    /**
     * Sends a message to every player and synced spectator of the room.
     *
     * @param room the room
     * @param text the message
     * @return number of connections the message was written to
     */
    public int sendToAll(Room room, String text)
    {
        Lock delivery = room.getDeliveryLock();
        delivery.lock();
        try
        {
            return fanOut(room, room.getAudience(), text);
        }
        finally
        {
            delivery.unlock();
        }
    }

    /**
     * Sends a message to the room's players only.
     *
     * @param room the room
     * @param text the message
     * @return number of players the message was written to
     */
    public int sendToPlayers(Room room, String text)
    {
        Lock delivery = room.getDeliveryLock();
        delivery.lock();
        try
        {
            return fanOut(room, room.getPlayers(), text);
        }
        finally
        {
            delivery.unlock();
        }
    }

    /**
     * Sends a sentinel token followed by its payload to the audience, with
     * no other room traffic in between.
     *
     * @param room     the room
     * @param sentinel the token announcing the payload
     * @param payload  the payload
     */
    public void sendPairToAll(Room room, String sentinel, String payload)
    {
        Lock delivery = room.getDeliveryLock();
        delivery.lock();
        try
        {
            sendToAll(room, sentinel);
            sendToAll(room, payload);
        }
        finally
        {
            delivery.unlock();
        }
    }

    /**
     * Sends several messages to one connection, pausing after each so they
     * arrive as separate reads.
     *
     * @param connection the target
     * @param messages   the messages, in order
     * @throws IOException if any write fails; later messages are not sent
     */
    public void sendInOrder(Connection connection, String... messages) throws IOException
    {
        Objects.requireNonNull(connection, "connection");
        for (String message : messages)
        {
            connection.send(message);
            pause();
        }
    }

    /**
     * Relays a chat line to the whole room, sender included, labeled with
     * the sender's current role.
     *
     * @param room   the room
     * @param origin the connection that sent the chat
     * @param text   the chat text
     */
    public void broadcastChat(Room room, Connection origin, String text)
    {
        Role sender = room.roleOf(origin);
        LOG.info("[{}] [Chat] {}: {}", room.getCode(), sender.label(), text);
        sendToAll(room, MessageCodec.encodeChat(sender, text));
    }

    private int fanOut(Room room, List<Connection> targets, String text)
    {
        Objects.requireNonNull(text, "text");
        int delivered = 0;
        for (Connection connection : targets)
        {
            if (connection.trySend(text))
            {
                delivered++;
            }
            else
            {
                LOG.debug("[{}] Could not deliver '{}' to {}", room.getCode(), text, connection);
            }
        }
        pause();
        return delivered;
    }

    private void pause()
    {
        if (messageGap.isZero())
        {
            return;
        }
        try
        {
            Thread.sleep(messageGap.toMillis());
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }
    }
}
