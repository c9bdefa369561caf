package org.abstractica.tictactoe.impl.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * One client's TCP stream.
 *
 * <p>The channel is kept in non-blocking mode so a room's engine can
 * multiplex it with a {@link Selector}. Each call to {@link #receive()} performs
 * a single read and returns what it got as one message; the protocol has no
 * delimiter, so message boundaries are read boundaries.</p>
 *
 * <p>Sending is thread-safe: writes are serialized and a full send buffer is
 * waited out for at most the write timeout. A write that fails or times out
 * may have left part of a message on the stream, so it closes the
 * connection.</p>
 */
public class Connection implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(Connection.class);
    private static final AtomicLong NEXT_ID = new AtomicLong(1);

    public static final int MAX_MESSAGE_SIZE = 20480;
    public static final Duration DEFAULT_WRITE_TIMEOUT = Duration.ofSeconds(5);

    private final long id;
    private final SocketChannel channel;
    private final SocketAddress remoteAddress;
    private final Duration writeTimeout;
    private final Consumer<Connection> closeListener;
    private final ByteBuffer readBuffer;
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Selector readSelector;
    private Selector writeSelector;

    /**
     * Wraps an accepted channel.
     *
     * @param channel       the accepted socket channel
     * @param writeTimeout  longest time a single send may wait for buffer space
     * @param closeListener called once when the connection closes, may be null
     * @throws IOException if the channel cannot be switched to non-blocking mode
     */
    public Connection(SocketChannel channel, Duration writeTimeout, Consumer<Connection> closeListener)
            throws IOException
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
        this.closeListener = closeListener != null ? closeListener : c -> {};
        this.id = NEXT_ID.getAndIncrement();
        this.readBuffer = ByteBuffer.allocate(MAX_MESSAGE_SIZE);

        channel.configureBlocking(false);
        this.remoteAddress = channel.getRemoteAddress();
    }

    public long getId()
    {
        return id;
    }

    public SocketAddress getRemoteAddress()
    {
        return remoteAddress;
    }

    public boolean isOpen()
    {
        return !closed.get() && channel.isOpen();
    }

    // ========== Sending ==========

    /**
     * Writes one message.
     *
     * @param text the message
     * @throws IOException if the connection is closed, the write fails or it
     *                     makes no progress within the write timeout; in the
     *                     last two cases the connection is closed
     */
    public void send(String text) throws IOException
    {
        Objects.requireNonNull(text, "text");
        ByteBuffer data = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));

        synchronized (writeLock)
        {
            if (!isOpen())
            {
                throw new ClosedChannelException();
            }

            try
            {
                while (data.hasRemaining())
                {
                    if (channel.write(data) == 0)
                    {
                        awaitWritable();
                    }
                }
            }
            catch (IOException e)
            {
                LOG.info("Closing connection {} ({}) after failed write: {}", id, remoteAddress, e.getMessage());
                close();
                throw e;
            }
        }
    }

    /**
     * Writes one message, logging instead of throwing on failure.
     *
     * @param text the message
     * @return true if the message was written
     */
    public boolean trySend(String text)
    {
        try
        {
            send(text);
            return true;
        }
        catch (IOException e)
        {
            LOG.debug("Send to connection {} ({}) failed: {}", id, remoteAddress, e.getMessage());
            return false;
        }
    }

    private void awaitWritable() throws IOException
    {
        if (writeSelector == null)
        {
            writeSelector = Selector.open();
            channel.register(writeSelector, SelectionKey.OP_WRITE);
        }

        if (writeSelector.select(writeTimeout.toMillis()) == 0)
        {
            throw new SocketTimeoutException("Write timed out after " + writeTimeout.toMillis() + " ms");
        }
        writeSelector.selectedKeys().clear();
    }

    // ========== Receiving ==========

    /**
     * Performs one read of whatever is available.
     *
     * @return the received text, empty if nothing was available
     * @throws EOFException if the peer closed the stream
     * @throws IOException  on read failure
     */
    public String receive() throws IOException
    {
        readBuffer.clear();
        int read = channel.read(readBuffer);
        if (read < 0)
        {
            throw new EOFException("Connection " + id + " closed by peer");
        }
        readBuffer.flip();
        return StandardCharsets.UTF_8.decode(readBuffer).toString();
    }

    /**
     * Waits for data and performs one read.
     *
     * @param timeout how long to wait for data
     * @return the received text
     * @throws SocketTimeoutException if nothing arrives in time
     * @throws EOFException           if the peer closed the stream
     * @throws IOException            on read failure
     */
    public String receive(Duration timeout) throws IOException
    {
        Objects.requireNonNull(timeout, "timeout");
        if (readSelector == null)
        {
            readSelector = Selector.open();
            channel.register(readSelector, SelectionKey.OP_READ);
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        while (true)
        {
            long remainingMs = Duration.ofNanos(deadline - System.nanoTime()).toMillis();
            if (remainingMs <= 0)
            {
                throw new SocketTimeoutException("No data within " + timeout.toMillis() + " ms");
            }
            if (Thread.currentThread().isInterrupted())
            {
                throw new InterruptedIOException("Interrupted while waiting for data");
            }

            if (readSelector.select(remainingMs) > 0)
            {
                readSelector.selectedKeys().clear();
                String text = receive();
                if (!text.isEmpty())
                {
                    return text;
                }
            }
        }
    }

    /**
     * Registers this connection for reads with a multiplexing selector.
     *
     * <p>The returned key carries this connection as its attachment.</p>
     *
     * @param selector the selector to register with
     * @return the selection key
     * @throws ClosedChannelException if the connection is closed
     */
    public SelectionKey register(Selector selector) throws ClosedChannelException
    {
        return channel.register(selector, SelectionKey.OP_READ, this);
    }

    /**
     * Returns this connection's key in the given selector.
     *
     * @param selector the selector
     * @return the key, or null if not registered
     */
    public SelectionKey keyFor(Selector selector)
    {
        return channel.keyFor(selector);
    }

    // ========== Lifecycle ==========

    /**
     * Closes the connection. Safe to call more than once.
     */
    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }

        closeQuietly(readSelector);
        closeQuietly(writeSelector);
        try
        {
            channel.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing connection {}", id, e);
        }

        LOG.debug("Connection {} ({}) closed", id, remoteAddress);
        closeListener.accept(this);
    }

    private void closeQuietly(Selector selector)
    {
        if (selector == null)
        {
            return;
        }
        try
        {
            selector.close();
        }
        catch (IOException e)
        {
            LOG.warn("Error closing selector of connection {}", id, e);
        }
    }

    @Override
    public String toString()
    {
        return "Connection[" + id + " " + remoteAddress + "]";
    }
}
