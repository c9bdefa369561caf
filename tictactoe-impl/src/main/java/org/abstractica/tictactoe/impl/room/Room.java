package org.abstractica.tictactoe.impl.room;

import org.abstractica.tictactoe.Mark;
import org.abstractica.tictactoe.Role;
import org.abstractica.tictactoe.impl.board.Board;
import org.abstractica.tictactoe.impl.transport.Connection;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One game session: up to two players, any number of spectators, one board.
 *
 * <p>Membership is changed only by {@link RoomDirectory} under its lock.
 * Readers on other threads see consistent snapshots of the member lists.
 * Once the game starts the room's engine is the only writer of the board,
 * and it learns about spectator changes through the room's inbox.</p>
 *
 * <p>A new spectator is a member at once but joins the audience only after
 * its board sync was written. Every write to the audience happens under the
 * room's delivery lock, so nothing can land between a {@code Matrix} token
 * and its board.</p>
 */
public class Room
{
    public static final int MAX_PLAYERS = 2;

    private final String code;
    private final Board board;
    private final List<Connection> players;
    private final List<Connection> spectators;
    private final Set<Connection> awaitingSync;
    private final BlockingQueue<RoomEvent> inbox;
    private final CountDownLatch playerGreetings;
    private final ReentrantLock deliveryLock;

    private volatile RoomState state;
    private volatile long lastActivityMs;
    private volatile Runnable wakeup;

    Room(String code, long nowMs)
    {
        this.code = Objects.requireNonNull(code, "code");
        this.board = new Board();
        this.players = new CopyOnWriteArrayList<>();
        this.spectators = new CopyOnWriteArrayList<>();
        this.awaitingSync = ConcurrentHashMap.newKeySet();
        this.inbox = new LinkedBlockingQueue<>();
        this.playerGreetings = new CountDownLatch(MAX_PLAYERS);
        this.deliveryLock = new ReentrantLock(true);
        this.lastActivityMs = nowMs;
        this.state = RoomState.PENDING;
        this.wakeup = () -> {};
    }

    // ========== Accessors ==========

    public String getCode()
    {
        return code;
    }

    public Board getBoard()
    {
        return board;
    }

    public RoomState getState()
    {
        return state;
    }

    public long getLastActivityMs()
    {
        return lastActivityMs;
    }

    /**
     * Returns the players in join order.
     *
     * @return unmodifiable snapshot, index 0 is player one
     */
    public List<Connection> getPlayers()
    {
        return List.copyOf(players);
    }

    /**
     * Returns the spectators in join order.
     *
     * @return unmodifiable snapshot
     */
    public List<Connection> getSpectators()
    {
        return List.copyOf(spectators);
    }

    /**
     * Returns every connection of the room, players first, including
     * spectators whose board sync is still being written.
     *
     * @return unmodifiable snapshot
     */
    public List<Connection> getAllConnections()
    {
        List<Connection> all = new ArrayList<>(players);
        all.addAll(spectators);
        return Collections.unmodifiableList(all);
    }

    /**
     * Returns the connections that receive room broadcasts: the players and
     * every spectator that has been synced.
     *
     * @return unmodifiable snapshot, players first
     */
    public List<Connection> getAudience()
    {
        List<Connection> audience = new ArrayList<>(players);
        for (Connection spectator : spectators)
        {
            if (!awaitingSync.contains(spectator))
            {
                audience.add(spectator);
            }
        }
        return Collections.unmodifiableList(audience);
    }

    /**
     * Returns the lock every write to the audience is made under.
     *
     * <p>Hold it across a multi-message sequence that must reach clients
     * without other room traffic in between.</p>
     *
     * @return the room's delivery lock
     */
    public Lock getDeliveryLock()
    {
        return deliveryLock;
    }

    /**
     * Returns the connection playing the given mark.
     *
     * @param mark PLAYER_ONE or PLAYER_TWO
     * @return the player's connection, or empty if that seat is not taken
     */
    public Optional<Connection> getPlayer(Mark mark)
    {
        int index = switch (mark)
        {
            case PLAYER_ONE -> 0;
            case PLAYER_TWO -> 1;
            case EMPTY -> throw new IllegalArgumentException("EMPTY is not a player");
        };
        List<Connection> snapshot = getPlayers();
        return index < snapshot.size() ? Optional.of(snapshot.get(index)) : Optional.empty();
    }

    /**
     * Derives a connection's role from current membership.
     *
     * @param connection the connection
     * @return its role; {@link Role.Unknown} if it is not a member
     */
    public Role roleOf(Connection connection)
    {
        int playerIndex = players.indexOf(connection);
        if (playerIndex == 0)
        {
            return new Role.PlayerOne();
        }
        if (playerIndex == 1)
        {
            return new Role.PlayerTwo();
        }

        int spectatorIndex = spectators.indexOf(connection);
        if (spectatorIndex >= 0)
        {
            return new Role.Spectator(spectatorIndex + 1);
        }
        return new Role.Unknown();
    }

    /**
     * Returns the mark a connection plays with.
     *
     * @param connection the connection
     * @return its mark, or empty if it is not a player
     */
    public Optional<Mark> markOf(Connection connection)
    {
        int index = players.indexOf(connection);
        if (index < 0)
        {
            return Optional.empty();
        }
        return Optional.of(index == 0 ? Mark.PLAYER_ONE : Mark.PLAYER_TWO);
    }

    // ========== Engine Inbox ==========

    /**
     * Installs the action that interrupts the engine's wait so it drains the inbox.
     *
     * @param wakeup typically {@code selector::wakeup}
     */
    public void setWakeup(Runnable wakeup)
    {
        this.wakeup = Objects.requireNonNull(wakeup, "wakeup");
    }

    /**
     * Returns the next pending membership event without blocking.
     *
     * @return the event, or null if the inbox is empty
     */
    public RoomEvent pollEvent()
    {
        return inbox.poll();
    }

    void post(RoomEvent event)
    {
        inbox.add(event);
        wakeup.run();
    }

    // ========== Role Greetings ==========

    /**
     * Records that a player's role reply was sent (or failed to send).
     */
    public void playerGreeted()
    {
        playerGreetings.countDown();
    }

    /**
     * Waits until both players' role replies are out, so the first turn
     * announcement never overtakes a role reply.
     *
     * @param timeout longest time to wait
     * @return true if both greetings were recorded in time
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitPlayerGreetings(Duration timeout) throws InterruptedException
    {
        return playerGreetings.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    // ========== Directory Mutations ==========

    void addPlayer(Connection connection, long nowMs)
    {
        if (players.size() >= MAX_PLAYERS)
        {
            throw new IllegalStateException("Room " + code + " already has " + MAX_PLAYERS + " players");
        }
        players.add(connection);
        lastActivityMs = nowMs;
    }

    void addSpectator(Connection connection, long nowMs)
    {
        awaitingSync.add(connection);
        spectators.add(connection);
        lastActivityMs = nowMs;
    }

    boolean markSynced(Connection connection)
    {
        return spectators.contains(connection) && awaitingSync.remove(connection);
    }

    boolean removeSpectator(Connection connection)
    {
        awaitingSync.remove(connection);
        return spectators.remove(connection);
    }

    int playerCount()
    {
        return players.size();
    }

    void setState(RoomState state)
    {
        this.state = state;
    }

    @Override
    public String toString()
    {
        return "Room[" + code + " " + state + ", players=" + players.size()
                + ", spectators=" + spectators.size() + "]";
    }
}
