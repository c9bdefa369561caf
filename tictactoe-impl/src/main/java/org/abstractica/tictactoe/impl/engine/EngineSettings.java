package org.abstractica.tictactoe.impl.engine;

import org.abstractica.tictactoe.DisconnectPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing and policy settings shared by every room's engine.
 *
 * @param pollInterval     bound on each wait for readable connections
 * @param drainDelay       pause between the result line and closing connections
 * @param greetingTimeout  longest wait for both players' role replies before the first turn
 * @param disconnectPolicy outcome when a player leaves mid-game
 */
public record EngineSettings(
        Duration pollInterval,
        Duration drainDelay,
        Duration greetingTimeout,
        DisconnectPolicy disconnectPolicy
)
{
    public EngineSettings
    {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(drainDelay, "drainDelay");
        Objects.requireNonNull(greetingTimeout, "greetingTimeout");
        Objects.requireNonNull(disconnectPolicy, "disconnectPolicy");
        if (pollInterval.isNegative() || pollInterval.isZero())
        {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        if (drainDelay.isNegative())
        {
            throw new IllegalArgumentException("drainDelay must not be negative");
        }
    }
}
