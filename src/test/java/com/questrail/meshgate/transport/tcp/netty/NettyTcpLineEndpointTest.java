package com.questrail.meshgate.transport.tcp.netty;

import com.questrail.meshgate.transport.ClientConnection;
import com.questrail.meshgate.transport.LineEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpLineEndpointTest
 * -----------------------------------------------------------------------------
 * Loopback tests against a real listener on an ephemeral port.
 */
class NettyTcpLineEndpointTest {

    private final BlockingQueue<String> events = new LinkedBlockingQueue<>();
    private final BlockingQueue<ClientConnection> opened = new LinkedBlockingQueue<>();

    private NettyTcpLineEndpoint endpoint;

    @BeforeEach
    void setUp() {
        endpoint = new NettyTcpLineEndpoint(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 1);
        endpoint.setListener(new LineEndpointListener() {
            @Override
            public void onConnectionOpened(ClientConnection connection) {
                opened.add(connection);
                events.add("open");
            }

            @Override
            public void onLine(ClientConnection connection, String line) {
                events.add("line:" + line);
            }

            @Override
            public void onConnectionClosed(ClientConnection connection, Throwable cause) {
                events.add("closed");
            }
        });
        endpoint.start();
    }

    @AfterEach
    void tearDown() {
        endpoint.stop();
    }

    private int port() {
        return ((InetSocketAddress) endpoint.boundAddress().orElseThrow()).getPort();
    }

    private String nextEvent() throws InterruptedException {
        String event = events.poll(5, TimeUnit.SECONDS);
        assertNotNull(event, "no event within 5 s");
        return event;
    }

    @Test
    void linesAreSplitOnCrLfAndLf() throws Exception {
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), port())) {
            OutputStream out = socket.getOutputStream();
            out.write("NICK alice\r\nUSER alice 0 * :Alice\nPING x\r\n".getBytes(StandardCharsets.UTF_8));
            out.flush();

            assertEquals("open", nextEvent());
            assertEquals("line:NICK alice", nextEvent());
            assertEquals("line:USER alice 0 * :Alice", nextEvent());
            assertEquals("line:PING x", nextEvent());
        }
        assertEquals("closed", nextEvent());
    }

    @Test
    void sentLinesAreCrLfTerminated() throws Exception {
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), port())) {
            assertEquals("open", nextEvent());
            ClientConnection connection = opened.poll(5, TimeUnit.SECONDS);
            assertNotNull(connection);

            connection.sendLine(":meshgate.gw NOTICE alice :hello");

            byte[] expected = ":meshgate.gw NOTICE alice :hello\r\n".getBytes(StandardCharsets.UTF_8);
            byte[] actual = socket.getInputStream().readNBytes(expected.length);
            assertArrayEquals(expected, actual);
        }
    }

    @Test
    void closingTheConnectionEndsTheClientStream() throws Exception {
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), port())) {
            socket.setSoTimeout(5_000);
            assertEquals("open", nextEvent());
            ClientConnection connection = opened.poll(5, TimeUnit.SECONDS);
            assertNotNull(connection);

            connection.close();

            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            assertNull(reader.readLine());
            assertEquals("closed", nextEvent());
        }
    }

    @Test
    void overLongLineIsDroppedAndConnectionSurvives() throws Exception {
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), port())) {
            OutputStream out = socket.getOutputStream();
            String tooLong = "PRIVMSG #room :" + "x".repeat(NettyTcpLineEndpoint.MAX_LINE_BYTES + 10);
            out.write((tooLong + "\r\nPING ok\r\n").getBytes(StandardCharsets.UTF_8));
            out.flush();

            assertEquals("open", nextEvent());
            assertEquals("line:PING ok", nextEvent());
        }
    }

    @Test
    void bindingAnOccupiedPortFails() {
        NettyTcpLineEndpoint second = new NettyTcpLineEndpoint(
                new InetSocketAddress(InetAddress.getLoopbackAddress(), port()), 1);
        second.setListener(new LineEndpointListener() {
            @Override
            public void onConnectionOpened(ClientConnection connection) {
            }

            @Override
            public void onLine(ClientConnection connection, String line) {
            }

            @Override
            public void onConnectionClosed(ClientConnection connection, Throwable cause) {
            }
        });

        assertThrows(IllegalStateException.class, second::start);
    }
}
