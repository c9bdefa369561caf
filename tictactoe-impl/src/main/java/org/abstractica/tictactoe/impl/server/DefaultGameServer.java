package org.abstractica.tictactoe.impl.server;

import org.abstractica.tictactoe.GameOutcome;
import org.abstractica.tictactoe.GameServer;
import org.abstractica.tictactoe.ServerStats;
import org.abstractica.tictactoe.handlers.ErrorHandler;
import org.abstractica.tictactoe.handlers.GameFinishedHandler;
import org.abstractica.tictactoe.impl.engine.EngineCallback;
import org.abstractica.tictactoe.impl.engine.EngineSettings;
import org.abstractica.tictactoe.impl.engine.TurnEngine;
import org.abstractica.tictactoe.impl.protocol.Tokens;
import org.abstractica.tictactoe.impl.relay.Relay;
import org.abstractica.tictactoe.impl.room.Room;
import org.abstractica.tictactoe.impl.room.RoomDirectory;
import org.abstractica.tictactoe.impl.transport.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Default implementation of the GameServer interface.
 *
 * <p>One acceptor thread accepts sockets and hands each to the handshake
 * pool, so a slow client never blocks the accept loop. Each room that gets
 * its second player runs its own engine thread. A scheduled task reaps rooms
 * that never started.</p>
 */
public class DefaultGameServer implements GameServer, EngineCallback
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultGameServer.class);

    private final InetSocketAddress bindAddress;
    private final int maxConnections;
    private final Duration writeTimeout;
    private final Duration idleRoomTimeout;
    private final Duration reapInterval;
    private final EngineSettings engineSettings;

    private final RoomDirectory directory;
    private final Relay relay;
    private final ConnectionIntake intake;
    private final DefaultServerStats stats;
    private final Set<Connection> openConnections;
    private final Map<String, Thread> engineThreads;

    private final List<Consumer<String>> gameStartedCallbacks;
    private final List<GameFinishedHandler> gameFinishedCallbacks;
    private ErrorHandler errorHandler;

    private ServerSocketChannel serverChannel;
    private Thread acceptThread;
    private ExecutorService handshakePool;
    private ScheduledExecutorService reaper;
    private volatile boolean running;
    private volatile boolean acceptingConnections;

    /**
     * Creates a new server.
     *
     * <p>Use {@link DefaultGameServerFactory} to create instances.</p>
     */
    DefaultGameServer(
            InetSocketAddress bindAddress,
            int maxConnections,
            Duration messageGap,
            Duration handshakeTimeout,
            Duration writeTimeout,
            Duration idleRoomTimeout,
            Duration reapInterval,
            EngineSettings engineSettings
    )
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.maxConnections = maxConnections;
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
        this.idleRoomTimeout = Objects.requireNonNull(idleRoomTimeout, "idleRoomTimeout");
        this.reapInterval = Objects.requireNonNull(reapInterval, "reapInterval");
        this.engineSettings = Objects.requireNonNull(engineSettings, "engineSettings");

        this.directory = new RoomDirectory();
        this.relay = new Relay(messageGap);
        this.openConnections = ConcurrentHashMap.newKeySet();
        this.engineThreads = new ConcurrentHashMap<>();
        this.stats = new DefaultServerStats(directory, openConnections::size);
        this.intake = new ConnectionIntake(
                directory,
                relay,
                handshakeTimeout,
                this::startGame,
                stats::recordRejectedConnection
        );

        this.gameStartedCallbacks = new CopyOnWriteArrayList<>();
        this.gameFinishedCallbacks = new CopyOnWriteArrayList<>();

        this.running = false;
        this.acceptingConnections = false;
    }

    // ========== GameServer Interface ==========

    @Override
    public void start()
    {
        if (running)
        {
            throw new IllegalStateException("Server already started");
        }

        LOG.info("Starting server");

        try
        {
            serverChannel = ServerSocketChannel.open();
            serverChannel.bind(bindAddress);
        }
        catch (IOException e)
        {
            closeServerChannel();
            throw new UncheckedIOException("Failed to bind " + bindAddress, e);
        }

        running = true;
        acceptingConnections = true;

        handshakePool = Executors.newCachedThreadPool(daemonThreads("handshake"));
        reaper = Executors.newSingleThreadScheduledExecutor(daemonThreads("room-reaper"));
        reaper.scheduleAtFixedRate(
                new IdleRoomReaper(directory, idleRoomTimeout),
                reapInterval.toMillis(),
                reapInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );

        acceptThread = new Thread(this::acceptLoop, "game-acceptor");
        acceptThread.setDaemon(true);
        acceptThread.start();

        LOG.info("Tic Tac Toe server started, listening on {}", getLocalAddress());
    }

    @Override
    public void stop()
    {
        LOG.info("Stopping server (no new connections)");
        acceptingConnections = false;
    }

    @Override
    public void close()
    {
        if (!running)
        {
            return;
        }

        LOG.info("Closing server");

        running = false;
        acceptingConnections = false;

        closeServerChannel();
        if (acceptThread != null)
        {
            try
            {
                acceptThread.join(1000);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
            }
        }

        handshakePool.shutdownNow();
        reaper.shutdownNow();

        for (Thread engine : engineThreads.values())
        {
            engine.interrupt();
        }

        for (Room room : directory.retireAll())
        {
            for (Connection connection : room.getAllConnections())
            {
                connection.close();
            }
        }

        for (Connection connection : new ArrayList<>(openConnections))
        {
            connection.close();
        }

        LOG.info("Server closed");
    }

    @Override
    public void onGameStarted(Consumer<String> handler)
    {
        Objects.requireNonNull(handler, "handler");
        gameStartedCallbacks.add(handler);
    }

    @Override
    public void onGameFinished(GameFinishedHandler handler)
    {
        Objects.requireNonNull(handler, "handler");
        gameFinishedCallbacks.add(handler);
    }

    @Override
    public void onError(ErrorHandler handler)
    {
        this.errorHandler = handler;
    }

    @Override
    public Collection<String> getRoomCodes()
    {
        List<String> codes = new ArrayList<>();
        for (Room room : directory.snapshot())
        {
            codes.add(room.getCode());
        }
        return List.copyOf(codes);
    }

    @Override
    public InetSocketAddress getLocalAddress()
    {
        if (serverChannel == null || !serverChannel.isOpen())
        {
            return null;
        }
        try
        {
            return (InetSocketAddress) serverChannel.getLocalAddress();
        }
        catch (IOException e)
        {
            return null;
        }
    }

    @Override
    public ServerStats getStats()
    {
        return stats;
    }

    // ========== EngineCallback Interface ==========

    @Override
    public void onGameFinished(Room room, GameOutcome outcome)
    {
        engineThreads.remove(room.getCode(), Thread.currentThread());
        stats.recordGameCompleted();

        for (GameFinishedHandler callback : gameFinishedCallbacks)
        {
            try
            {
                callback.handle(room.getCode(), outcome);
            }
            catch (Exception e)
            {
                LOG.error("Game finished callback error", e);
            }
        }
    }

    @Override
    public void onEngineError(Room room, Exception exception)
    {
        ErrorHandler handler = errorHandler;
        if (handler == null)
        {
            return;
        }
        try
        {
            handler.handle(room.getCode(), exception);
        }
        catch (Exception e)
        {
            LOG.error("Error handler failed", e);
        }
    }

    // ========== Accept Loop ==========

    private void acceptLoop()
    {
        LOG.debug("Accept loop started");

        while (running)
        {
            SocketChannel channel;
            try
            {
                channel = serverChannel.accept();
            }
            catch (ClosedChannelException e)
            {
                break;
            }
            catch (IOException e)
            {
                if (running)
                {
                    LOG.error("Error accepting connection", e);
                }
                continue;
            }

            try
            {
                admit(channel);
            }
            catch (Exception e)
            {
                LOG.warn("Could not admit connection: {}", e.getMessage());
                closeChannel(channel);
            }
        }

        LOG.debug("Accept loop exited");
    }

    private void admit(SocketChannel channel) throws IOException
    {
        if (!acceptingConnections)
        {
            closeChannel(channel);
            return;
        }

        Connection connection = new Connection(channel, writeTimeout, openConnections::remove);
        LOG.info("New connection from {}", connection.getRemoteAddress());

        if (maxConnections > 0 && openConnections.size() >= maxConnections)
        {
            LOG.warn("Server is full, rejecting {}", connection.getRemoteAddress());
            stats.recordRejectedConnection();
            connection.trySend(Tokens.SERVER_FULL);
            connection.close();
            return;
        }
        openConnections.add(connection);

        try
        {
            handshakePool.execute(() -> intake.handle(connection));
        }
        catch (RejectedExecutionException e)
        {
            connection.close();
        }
    }

    // ========== Game Start ==========

    private void startGame(Room room)
    {
        TurnEngine engine = new TurnEngine(room, directory, relay, engineSettings, this);
        Thread thread = new Thread(engine, "room-" + room.getCode());
        thread.setDaemon(true);
        engineThreads.put(room.getCode(), thread);
        thread.start();

        for (Consumer<String> callback : gameStartedCallbacks)
        {
            try
            {
                callback.accept(room.getCode());
            }
            catch (Exception e)
            {
                LOG.error("Game started callback error", e);
            }
        }
    }

    // ========== Helpers ==========

    private void closeServerChannel()
    {
        if (serverChannel == null)
        {
            return;
        }
        try
        {
            serverChannel.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing server channel", e);
        }
    }

    private static void closeChannel(SocketChannel channel)
    {
        try
        {
            channel.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing rejected channel: {}", e.getMessage());
        }
    }

    private static ThreadFactory daemonThreads(String prefix)
    {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable ->
        {
            Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
