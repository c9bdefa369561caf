package org.abstractica.tictactoe.impl.integration;

import org.abstractica.tictactoe.DisconnectPolicy;
import org.abstractica.tictactoe.GameOutcome;
import org.abstractica.tictactoe.GameServer;
import org.abstractica.tictactoe.GameServerFactory;
import org.abstractica.tictactoe.Mark;
import org.abstractica.tictactoe.impl.server.DefaultGameServerFactory;
import org.abstractica.tictactoe.impl.transport.LoopbackClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: real clients playing through a running server.
 */
class EndToEndTest
{
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private static final String P1_ROLE = "<<< You are player 1 >>>";
    private static final String P2_ROLE = "<<< You are player 2 >>>";
    private static final String SPECTATOR_ROLE = "<<< You are spectator >>>";

    private GameServer server;
    private final List<LoopbackClient> clients = new ArrayList<>();

    @AfterEach
    void tearDown()
    {
        for (LoopbackClient client : clients)
        {
            client.close();
        }
        if (server != null)
        {
            server.close();
        }
    }

    // ========== Full Games ==========

    @Test
    void playerTwoWinsOnMainDiagonal() throws Exception
    {
        // Arrange
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<GameOutcome> outcome = new AtomicReference<>();
        server = startServer(defaults());
        server.onGameFinished((code, result) ->
        {
            outcome.set(result);
            finished.countDown();
        });

        LoopbackClient p1 = join("ROOM abc", P1_ROLE);
        LoopbackClient p2 = join("ROOM abc", P2_ROLE);

        // Act
        play(p1, "0,1", "[[0, 1, 0], [0, 0, 0], [0, 0, 0]]", p2);
        play(p2, "0,0", "[[2, 1, 0], [0, 0, 0], [0, 0, 0]]", p1);
        play(p1, "0,2", "[[2, 1, 1], [0, 0, 0], [0, 0, 0]]", p2);
        play(p2, "1,1", "[[2, 1, 1], [0, 2, 0], [0, 0, 0]]", p1);
        play(p1, "2,0", "[[2, 1, 1], [0, 2, 0], [1, 0, 0]]", p2);
        play(p2, "2,2", "[[2, 1, 1], [0, 2, 0], [1, 0, 2]]", p1);

        // Assert
        for (LoopbackClient client : List.of(p1, p2))
        {
            assertTrue(client.expect("Over"));
            assertTrue(client.expect("Player Two is the winner!!"));
            assertTrue(client.awaitClosed(TIMEOUT), "Server should close the connection after the game");
        }
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertEquals(new GameOutcome.Winner(Mark.PLAYER_TWO), outcome.get());
        assertEquals(1, server.getStats().getGamesCompleted());
        assertTrue(awaitNoRooms(), "Finished room should be retired");
    }

    @Test
    void fullBoardWithoutLine_isDraw() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient p1 = join("ROOM draw", P1_ROLE);
        LoopbackClient p2 = join("ROOM draw", P2_ROLE);

        String[] moves = {"0,0", "0,1", "0,2", "1,1", "1,0", "1,2", "2,1", "2,0", "2,2"};
        for (int i = 0; i < moves.length; i++)
        {
            LoopbackClient mover = i % 2 == 0 ? p1 : p2;
            LoopbackClient other = i % 2 == 0 ? p2 : p1;
            assertTrue(mover.expect(i % 2 == 0 ? "Player One's Turn" : "Player Two's Turn"));
            assertTrue(mover.expect("Input"), "Move " + i + " should be prompted");
            mover.send(moves[i]);
            assertTrue(other.expect("Matrix"));
        }

        assertTrue(p1.expect("[[1, 2, 1], [1, 2, 2], [2, 1, 1]]"));
        assertTrue(p1.expect("Over"));
        assertTrue(p1.expect("Draw game!! Try again later!"));
        assertTrue(p2.expect("Draw game!! Try again later!"));
    }

    @Test
    void turnAnnouncementsAndPromptsAlternate() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient p1 = join("ROOM turns", P1_ROLE);
        LoopbackClient p2 = join("ROOM turns", P2_ROLE);

        assertTrue(p2.expect("Player One's Turn"));
        assertTrue(p1.expect("Player One's Turn"));
        assertTrue(p1.expect("Input"));
        p1.send("1,1");

        assertTrue(p2.expect("Player Two's Turn"));
        assertTrue(p2.expect("Input"));
        assertFalse(p1.unread().contains("Input"), "Only the mover is prompted");
    }

    // ========== Move Validation ==========

    @Test
    void invalidAndOutOfTurnMoves_areIgnored() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient p1 = join("ROOM strict", P1_ROLE);
        LoopbackClient p2 = join("ROOM strict", P2_ROLE);

        assertTrue(p1.expect("Input"));
        p2.send("2,2");
        p1.send("9,9");
        p1.send("hello");
        p1.send("0,0");
        assertTrue(p1.expect("Matrix"));
        assertTrue(p1.expect("[[1, 0, 0], [0, 0, 0], [0, 0, 0]]"));

        assertTrue(p2.expect("Input"));
        p2.send("0,0");
        p2.send("1,1");
        assertTrue(p2.expect("[[1, 0, 0], [0, 2, 0], [0, 0, 0]]"));
        assertTrue(p1.expect("Player One's Turn"));
    }

    // ========== Spectators and Chat ==========

    @Test
    void spectatorJoiningMidGame_receivesBoardAndUpdates() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient p1 = join("ROOM watch", P1_ROLE);
        LoopbackClient p2 = join("ROOM watch", P2_ROLE);
        play(p1, "1,1", "[[0, 0, 0], [0, 1, 0], [0, 0, 0]]", p2);

        LoopbackClient spectator = join("SPECTATE watch", SPECTATOR_ROLE);
        assertTrue(spectator.expect("Matrix"));
        assertTrue(spectator.expect("[[0, 0, 0], [0, 1, 0], [0, 0, 0]]"));

        play(p2, "0,0", "[[2, 0, 0], [0, 1, 0], [0, 0, 0]]", p1);
        assertTrue(spectator.expect("[[2, 0, 0], [0, 1, 0], [0, 0, 0]]"));
        assertTrue(spectator.expect("Player One's Turn"));
        assertFalse(spectator.transcript().contains("Input"), "Spectators are never prompted");
    }

    @Test
    void chat_isRelayedToEveryoneWithRoleLabel() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient p1 = join("ROOM talk", P1_ROLE);
        LoopbackClient p2 = join("ROOM talk", P2_ROLE);
        LoopbackClient spectator = join("SPECTATE talk", SPECTATOR_ROLE);
        assertTrue(p1.expect("Input"));

        spectator.send("CHAT:hello");
        for (LoopbackClient client : List.of(p1, p2, spectator))
        {
            assertTrue(client.expect("CHAT:spec_1:hello"));
        }

        p2.send("CHAT: gg ");
        for (LoopbackClient client : List.of(p1, p2, spectator))
        {
            assertTrue(client.expect("CHAT:Player2:gg"));
        }

        // Chat does not consume the turn
        p1.send("2,2");
        assertTrue(p2.expect("[[0, 0, 0], [0, 0, 0], [0, 0, 1]]"));
    }

    @Test
    void spectatorBeforePlayers_roomStillSeatsPlayerOne() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient spectator = join("SPECTATE early", SPECTATOR_ROLE);
        assertTrue(spectator.expect("[[0, 0, 0], [0, 0, 0], [0, 0, 0]]"));

        join("ROOM early", P1_ROLE);
        join("ROOM early", P2_ROLE);

        assertTrue(spectator.expect("Player One's Turn"));
    }

    @Test
    void spectatorSync_isNeverSplitByRoomChat() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient p1 = join("ROOM race", P1_ROLE);
        LoopbackClient p2 = join("ROOM race", P2_ROLE);
        assertTrue(p1.expect("Input"));

        AtomicBoolean chatting = new AtomicBoolean(true);
        Thread chatter = new Thread(() ->
        {
            try
            {
                while (chatting.get())
                {
                    p2.send("CHAT:x", Duration.ofMillis(7));
                }
            }
            catch (IOException e)
            {
                chatting.set(false);
            }
        }, "chatter");
        chatter.setDaemon(true);
        chatter.start();

        try
        {
            for (int i = 0; i < 10; i++)
            {
                LoopbackClient spectator = join("SPECTATE race", SPECTATOR_ROLE);
                assertTrue(spectator.expect("]]"));
                assertTrue(spectator.transcript().startsWith(
                                SPECTATOR_ROLE + "Matrix" + "[[0, 0, 0], [0, 0, 0], [0, 0, 0]]"),
                        "Board must directly follow Matrix: " + spectator.transcript());
                assertTrue(spectator.expect("CHAT:Player2:x"), "Synced spectator receives chat");
            }
        }
        finally
        {
            chatting.set(false);
            chatter.join(1000);
        }
    }

    @Test
    void spectatorThatStopsReading_isDroppedWithoutStallingRoom() throws Exception
    {
        server = startServer(defaults().writeTimeout(Duration.ofMillis(500)));
        LoopbackClient p1 = join("ROOM slow", P1_ROLE);
        LoopbackClient p2 = join("ROOM slow", P2_ROLE);
        assertTrue(p1.expect("Input"));

        try (Socket stalled = new Socket())
        {
            stalled.setReceiveBufferSize(4096);
            stalled.connect(new InetSocketAddress("127.0.0.1", server.getLocalAddress().getPort()), 2000);
            OutputStream out = stalled.getOutputStream();
            out.write("SPECTATE slow".getBytes(StandardCharsets.UTF_8));
            out.flush();
            Thread.sleep(500);
            assertEquals(3, server.getStats().getOpenConnections());

            String filler = "CHAT:" + "x".repeat(16 * 1024);
            long deadline = System.nanoTime() + Duration.ofSeconds(30).toNanos();
            while (server.getStats().getOpenConnections() > 2 && System.nanoTime() < deadline)
            {
                p1.send(filler, Duration.ofMillis(15));
            }
            assertEquals(2, server.getStats().getOpenConnections(), "Stalled spectator should be disconnected");

            p1.send("CHAT:done");
            assertTrue(p2.expect("CHAT:Player1:done", Duration.ofSeconds(10)));
            p1.send("1,1");
            assertTrue(p2.expect("[[0, 0, 0], [0, 1, 0], [0, 0, 0]]"), "Moves still reach the opponent");
            assertTrue(p2.expect("Input"));
        }
    }

    @Test
    void spectatorLeaving_doesNotEndGame() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient p1 = join("ROOM leave", P1_ROLE);
        LoopbackClient p2 = join("ROOM leave", P2_ROLE);
        LoopbackClient spectator = join("SPECTATE leave", SPECTATOR_ROLE);
        assertTrue(p1.expect("Input"));

        spectator.close();
        Thread.sleep(200);

        play(p1, "0,0", "[[1, 0, 0], [0, 0, 0], [0, 0, 0]]", p2);
        assertTrue(p2.expect("Input"));
    }

    // ========== Rejections ==========

    @Test
    void thirdPlayer_getsRoomFull() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient p1 = join("ROOM crowd", P1_ROLE);
        join("ROOM crowd", P2_ROLE);

        LoopbackClient third = join("ROOM crowd", "Room Full");

        assertTrue(third.awaitClosed(TIMEOUT));
        assertTrue(p1.expect("Input"), "The game is unaffected");
        assertEquals(1, server.getStats().getRejectedConnections());
    }

    @Test
    void malformedHandshake_getsProtocolError() throws Exception
    {
        server = startServer(defaults());

        LoopbackClient client = join("HELLO there", "Protocol Error");
        assertTrue(client.awaitClosed(TIMEOUT));

        LoopbackClient noCode = join("ROOM", "Protocol Error");
        assertTrue(noCode.awaitClosed(TIMEOUT));
        assertTrue(server.getRoomCodes().isEmpty());
    }

    @Test
    void silentClient_getsProtocolErrorAfterHandshakeTimeout() throws Exception
    {
        server = startServer(defaults().handshakeTimeout(Duration.ofMillis(300)));

        LoopbackClient client = connect();

        assertTrue(client.expect("Protocol Error"));
        assertTrue(client.awaitClosed(TIMEOUT));
    }

    @Test
    void maxConnectionsReached_getsServerFull() throws Exception
    {
        server = startServer(defaults().maxConnections(1));
        join("ROOM solo", P1_ROLE);

        LoopbackClient extra = connect();

        assertTrue(extra.expect("Server Full"));
        assertTrue(extra.awaitClosed(TIMEOUT));
    }

    // ========== Disconnects ==========

    @Test
    void playerDisconnect_forfeitsToOpponent() throws Exception
    {
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<GameOutcome> outcome = new AtomicReference<>();
        server = startServer(defaults());
        server.onGameFinished((code, result) ->
        {
            outcome.set(result);
            finished.countDown();
        });

        LoopbackClient p1 = join("ROOM quit", P1_ROLE);
        LoopbackClient p2 = join("ROOM quit", P2_ROLE);
        assertTrue(p1.expect("Input"));

        p1.close();

        assertTrue(p2.expect("Over"));
        assertTrue(p2.expect("Player Two is the winner!!"));
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertEquals(new GameOutcome.Winner(Mark.PLAYER_TWO), outcome.get());
    }

    @Test
    void playerDisconnect_withDrawPolicy_endsInDraw() throws Exception
    {
        server = startServer(defaults().disconnectPolicy(DisconnectPolicy.DRAW));
        LoopbackClient p1 = join("ROOM tie", P1_ROLE);
        LoopbackClient p2 = join("ROOM tie", P2_ROLE);
        play(p1, "0,0", "[[1, 0, 0], [0, 0, 0], [0, 0, 0]]", p2);
        assertTrue(p2.expect("Input"));

        p2.close();

        assertTrue(p1.expect("Over"));
        assertTrue(p1.expect("Draw game!! Try again later!"));
    }

    @Test
    void playerOneGoneBeforeFirstTurn_abandonsGame() throws Exception
    {
        CountDownLatch finished = new CountDownLatch(1);
        AtomicReference<GameOutcome> outcome = new AtomicReference<>();
        server = startServer(defaults());
        server.onGameFinished((code, result) ->
        {
            outcome.set(result);
            finished.countDown();
        });

        LoopbackClient p1 = join("ROOM ghost", P1_ROLE);
        p1.abort();
        LoopbackClient p2 = join("ROOM ghost", P2_ROLE);

        assertTrue(p2.expect("Over"));
        assertTrue(p2.expect("Game abandoned!!"));
        assertTrue(p2.awaitClosed(TIMEOUT));
        assertTrue(finished.await(5, TimeUnit.SECONDS));
        assertInstanceOf(GameOutcome.Abandoned.class, outcome.get());
        assertFalse(p2.transcript().contains("Input"), "Player two never moves in an abandoned game");
    }

    // ========== Room Lifecycle ==========

    @Test
    void finishedRoomCode_canBeReused() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient p1 = join("ROOM reuse", P1_ROLE);
        join("ROOM reuse", P2_ROLE);
        assertTrue(p1.expect("Input"));
        p1.close();
        assertTrue(awaitNoRooms());

        join("ROOM reuse", P1_ROLE);
        assertTrue(server.getRoomCodes().contains("REUSE"));
    }

    @Test
    void idlePendingRoom_isReaped() throws Exception
    {
        server = startServer(defaults()
                .idleRoomTimeout(Duration.ofMillis(200))
                .reapInterval(Duration.ofMillis(100)));

        LoopbackClient lonely = join("ROOM lonely", P1_ROLE);

        assertTrue(lonely.expect("Room Expired"));
        assertTrue(lonely.awaitClosed(TIMEOUT));
        assertTrue(awaitNoRooms());
    }

    @Test
    void separateRooms_playIndependently() throws Exception
    {
        server = startServer(defaults());
        LoopbackClient a1 = join("ROOM alpha", P1_ROLE);
        LoopbackClient a2 = join("ROOM alpha", P2_ROLE);
        LoopbackClient b1 = join("ROOM beta", P1_ROLE);
        LoopbackClient b2 = join("ROOM beta", P2_ROLE);

        play(a1, "0,0", "[[1, 0, 0], [0, 0, 0], [0, 0, 0]]", a2);
        play(b1, "2,2", "[[0, 0, 0], [0, 0, 0], [0, 0, 1]]", b2);

        assertFalse(a2.transcript().contains("[[0, 0, 0], [0, 0, 0], [0, 0, 1]]"));
        assertEquals(2, server.getStats().getGamesInProgress());
    }

    // ========== Helpers ==========

    private static GameServerFactory.Builder defaults()
    {
        return new DefaultGameServerFactory().builder()
                .port(0)
                .pollInterval(Duration.ofMillis(50))
                .messageGap(Duration.ofMillis(10))
                .drainDelay(Duration.ofMillis(100))
                .handshakeTimeout(Duration.ofSeconds(2));
    }

    private static GameServer startServer(GameServerFactory.Builder builder)
    {
        GameServer started = builder.build();
        started.start();
        return started;
    }

    private LoopbackClient connect() throws IOException
    {
        LoopbackClient client = LoopbackClient.connect(server.getLocalAddress());
        clients.add(client);
        return client;
    }

    private LoopbackClient join(String handshake, String expectedReply) throws Exception
    {
        LoopbackClient client = connect();
        client.send(handshake);
        assertTrue(client.expect(expectedReply), "Expected '" + expectedReply + "' after '" + handshake + "'");
        return client;
    }

    private static void play(LoopbackClient mover, String move, String expectedBoard, LoopbackClient opponent)
            throws Exception
    {
        assertTrue(mover.expect("Input"), "Mover should be prompted before " + move);
        mover.send(move);
        assertTrue(mover.expect(expectedBoard), "Mover should see " + expectedBoard);
        assertTrue(opponent.expect(expectedBoard), "Opponent should see " + expectedBoard);
    }

    private boolean awaitNoRooms() throws InterruptedException
    {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (System.nanoTime() < deadline)
        {
            if (server.getRoomCodes().isEmpty())
            {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }
}
