package org.abstractica.tictactoe;

import java.net.InetAddress;
import java.time.Duration;

/**
 * Factory for creating GameServer instances.
 *
 * <p>Use the builder to configure the server before creation:</p>
 * <pre>{@code
 * GameServerFactory factory = new DefaultGameServerFactory();
 * GameServer server = factory.builder()
 *     .port(9999)
 *     .idleRoomTimeout(Duration.ofMinutes(10))
 *     .build();
 * }</pre>
 */
public interface GameServerFactory
{
    /**
     * Creates a new server builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a GameServer.
     */
    interface Builder
    {
        /**
         * Sets the port to listen on.
         *
         * <p>Port 0 binds an ephemeral port; see {@link GameServer#getLocalAddress()}.</p>
         *
         * @param port the port number
         * @return this builder
         */
        Builder port(int port);

        /**
         * Sets the address to bind to.
         *
         * <p>Optional. Defaults to all interfaces.</p>
         *
         * @param address the bind address
         * @return this builder
         */
        Builder bindAddress(InetAddress address);

        /**
         * Sets the maximum number of open connections.
         *
         * <p>Optional. Defaults to unlimited.</p>
         *
         * @param maxConnections maximum connections, 0 for unlimited
         * @return this builder
         */
        Builder maxConnections(int maxConnections);

        /**
         * Sets how long a room's wait loop blocks before re-checking its connection set.
         *
         * <p>Optional. Defaults to 500 milliseconds.</p>
         *
         * @param interval the poll interval
         * @return this builder
         */
        Builder pollInterval(Duration interval);

        /**
         * Sets the pause after each fan-out so consecutive tokens reach
         * clients as separate reads.
         *
         * <p>Optional. Defaults to 20 milliseconds.</p>
         *
         * @param gap the pause, may be zero
         * @return this builder
         */
        Builder messageGap(Duration gap);

        /**
         * Sets the pause between announcing the result and closing connections.
         *
         * <p>Optional. Defaults to 1 second.</p>
         *
         * @param delay the pause, may be zero
         * @return this builder
         */
        Builder drainDelay(Duration delay);

        /**
         * Sets how long a new connection has to send its handshake.
         *
         * <p>Optional. Defaults to 10 seconds.</p>
         *
         * @param timeout the handshake timeout
         * @return this builder
         */
        Builder handshakeTimeout(Duration timeout);

        /**
         * Sets how long a single write may wait for a slow client to make
         * room in its send buffer. A client that does not read for longer is
         * disconnected.
         *
         * <p>Optional. Defaults to 5 seconds.</p>
         *
         * @param timeout the write timeout
         * @return this builder
         */
        Builder writeTimeout(Duration timeout);

        /**
         * Sets how long a room that never started a game may stay idle before
         * it is reaped.
         *
         * <p>Optional. Defaults to 30 minutes.</p>
         *
         * @param timeout the idle timeout
         * @return this builder
         */
        Builder idleRoomTimeout(Duration timeout);

        /**
         * Sets how often idle rooms are looked for.
         *
         * <p>Optional. Defaults to 1 minute.</p>
         *
         * @param interval the reap interval
         * @return this builder
         */
        Builder reapInterval(Duration interval);

        /**
         * Sets what happens when a player disconnects during a game.
         *
         * <p>Optional. Defaults to {@link DisconnectPolicy#FORFEIT}.</p>
         *
         * @param policy the disconnect policy
         * @return this builder
         */
        Builder disconnectPolicy(DisconnectPolicy policy);

        /**
         * Builds the server.
         *
         * @return the configured server, not yet started
         */
        GameServer build();
    }
}
