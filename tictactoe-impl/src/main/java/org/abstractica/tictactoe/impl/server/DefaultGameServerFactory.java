package org.abstractica.tictactoe.impl.server;

import org.abstractica.tictactoe.DisconnectPolicy;
import org.abstractica.tictactoe.GameServer;
import org.abstractica.tictactoe.GameServerFactory;
import org.abstractica.tictactoe.impl.engine.EngineSettings;
import org.abstractica.tictactoe.impl.transport.Connection;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of GameServerFactory.
 *
 * <p>Creates DefaultGameServer instances using a builder pattern.</p>
 */
public class DefaultGameServerFactory implements GameServerFactory
{
    public static final int DEFAULT_PORT = 9999;

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private int port = DEFAULT_PORT;
        private InetAddress bindAddress;
        private int maxConnections = 0; // 0 = unlimited
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration messageGap = Duration.ofMillis(20);
        private Duration drainDelay = Duration.ofSeconds(1);
        private Duration handshakeTimeout = Duration.ofSeconds(10);
        private Duration writeTimeout = Connection.DEFAULT_WRITE_TIMEOUT;
        private Duration idleRoomTimeout = Duration.ofMinutes(30);
        private Duration reapInterval = Duration.ofMinutes(1);
        private DisconnectPolicy disconnectPolicy = DisconnectPolicy.FORFEIT;

        @Override
        public Builder port(int port)
        {
            if (port < 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 0-65535: " + port);
            }
            this.port = port;
            return this;
        }

        @Override
        public Builder bindAddress(InetAddress address)
        {
            this.bindAddress = address;
            return this;
        }

        @Override
        public Builder maxConnections(int maxConnections)
        {
            if (maxConnections < 0)
            {
                throw new IllegalArgumentException("maxConnections must be >= 0: " + maxConnections);
            }
            this.maxConnections = maxConnections;
            return this;
        }

        @Override
        public Builder pollInterval(Duration interval)
        {
            this.pollInterval = requirePositive(interval, "Poll interval");
            return this;
        }

        @Override
        public Builder messageGap(Duration gap)
        {
            this.messageGap = requireNotNegative(gap, "Message gap");
            return this;
        }

        @Override
        public Builder drainDelay(Duration delay)
        {
            this.drainDelay = requireNotNegative(delay, "Drain delay");
            return this;
        }

        @Override
        public Builder handshakeTimeout(Duration timeout)
        {
            this.handshakeTimeout = requirePositive(timeout, "Handshake timeout");
            return this;
        }

        @Override
        public Builder writeTimeout(Duration timeout)
        {
            this.writeTimeout = requirePositive(timeout, "Write timeout");
            return this;
        }

        @Override
        public Builder idleRoomTimeout(Duration timeout)
        {
            this.idleRoomTimeout = requirePositive(timeout, "Idle room timeout");
            return this;
        }

        @Override
        public Builder reapInterval(Duration interval)
        {
            this.reapInterval = requirePositive(interval, "Reap interval");
            return this;
        }

        @Override
        public Builder disconnectPolicy(DisconnectPolicy policy)
        {
            this.disconnectPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        @Override
        public GameServer build()
        {
            InetSocketAddress socketAddress;
            if (bindAddress != null)
            {
                socketAddress = new InetSocketAddress(bindAddress, port);
            }
            else
            {
                socketAddress = new InetSocketAddress(port);
            }

            EngineSettings settings = new EngineSettings(
                    pollInterval,
                    drainDelay,
                    handshakeTimeout,
                    disconnectPolicy
            );

            return new DefaultGameServer(
                    socketAddress,
                    maxConnections,
                    messageGap,
                    handshakeTimeout,
                    writeTimeout,
                    idleRoomTimeout,
                    reapInterval,
                    settings
            );
        }

        private static Duration requirePositive(Duration value, String name)
        {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero())
            {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static Duration requireNotNegative(Duration value, String name)
        {
            Objects.requireNonNull(value, name);
            if (value.isNegative())
            {
                throw new IllegalArgumentException(name + " must not be negative");
            }
            return value;
        }
    }
}
