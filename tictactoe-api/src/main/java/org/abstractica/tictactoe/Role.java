package org.abstractica.tictactoe;

/**
 * Role of a connection within its room.
 *
 * <p>Roles are derived from current room membership and never stored on the
 * connection. The {@link #label()} is the sender label used in chat relay.</p>
 */
public sealed interface Role
{
    /**
     * Returns the chat label for this role.
     *
     * @return label such as {@code Player1} or {@code spec_2}
     */
    String label();

    /**
     * First player to join; moves on even plies.
     */
    record PlayerOne() implements Role
    {
        @Override
        public String label()
        {
            return "Player1";
        }
    }

    /**
     * Second player to join; moves on odd plies.
     */
    record PlayerTwo() implements Role
    {
        @Override
        public String label()
        {
            return "Player2";
        }
    }

    /**
     * Read-only observer.
     *
     * @param position 1-based position among the room's current spectators
     */
    record Spectator(int position) implements Role
    {
        public Spectator
        {
            if (position < 1)
            {
                throw new IllegalArgumentException("position must be >= 1: " + position);
            }
        }

        @Override
        public String label()
        {
            return "spec_" + position;
        }
    }

    /**
     * Connection is not (or no longer) a member of the room.
     */
    record Unknown() implements Role
    {
        @Override
        public String label()
        {
            return "Unknown";
        }
    }
}
