package io.github.minikv.kv;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import io.github.minikv.resp.Connection;
import io.github.minikv.resp.RespBulkString;
import io.github.minikv.resp.RespData;
import io.github.minikv.resp.RespError;
import io.github.minikv.resp.RespSimpleString;
import io.github.minikv.resp.ScriptedChannel;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class KeyValueServerTest {
    private static KeyValueServer server;
    private static InetSocketAddress address;

    @BeforeAll
    static void beforeAll() throws Exception {
        KeyValueEngine engine = new KeyValueEngine(ShardedStore.create(5));
        server = KeyValueServer.builder()
                .socketAddress(new InetSocketAddress("127.0.0.1", 0))
                .keyValueEngine(engine)
                .executorService(Executors.newFixedThreadPool(20))
                .build();
        server.start();
        address = server.getLocalAddress();
    }

    @AfterAll
    static void afterAll() throws IOException {
        server.shutdown();
    }

    @Test
    void getBeforeSetThenSetAndGet() throws IOException {
        try (SocketChannel client = SocketChannel.open(address)) {
            Connection connection = new Connection(client);

            send(client, "*2\r\n$3\r\nGET\r\n$7\r\nnothing\r\n");
            assertEquals(RespBulkString.nullBulkString(), connection.readFrame().orElseThrow());

            send(client, "*3\r\n$3\r\nSET\r\n$5\r\nhello\r\n$5\r\nworld\r\n");
            assertEquals(RespSimpleString.withUTF8("OK"), connection.readFrame().orElseThrow());

            send(client, "*2\r\n$3\r\nGET\r\n$5\r\nhello\r\n");
            assertEquals(RespBulkString.withUTF8("world"), connection.readFrame().orElseThrow());
        }
    }

    @Test
    void rawReplyBytes() throws IOException {
        try (SocketChannel client = SocketChannel.open(address)) {
            send(client, "*2\r\n$3\r\nGET\r\n$9\r\nraw-reply\r\n");
            assertEquals("$-1\r\n", receive(client, 5));

            send(client, "*3\r\n$3\r\nSET\r\n$9\r\nraw-reply\r\n$5\r\nworld\r\n*2\r\n$3\r\nGET\r\n$9\r\nraw-reply\r\n");
            assertEquals("+OK\r\n$5\r\nworld\r\n", receive(client, 16));
        }
    }

    @Test
    void sharedStoreAcrossClients() throws Exception {
        ExecutorService clients = Executors.newFixedThreadPool(8);
        try {
            List<Future<RespData>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                String key = "client" + i;
                Callable<RespData> task = () -> {
                    try (SocketChannel client = SocketChannel.open(address)) {
                        Connection connection = new Connection(client);
                        send(client, command("SET", key, "value-" + key));
                        connection.readFrame();
                        send(client, command("GET", key));
                        return connection.readFrame().orElseThrow();
                    }
                };
                futures.add(clients.submit(task));
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(RespBulkString.withUTF8("value-client" + i), futures.get(i).get(10, TimeUnit.SECONDS));
            }

            try (SocketChannel other = SocketChannel.open(address)) {
                send(other, command("GET", "client7"));
                assertEquals(RespBulkString.withUTF8("value-client7"), new Connection(other).readFrame().orElseThrow());
            }
        } finally {
            clients.shutdownNow();
        }
    }

    @Test
    void protocolErrorClosesOnlyThatClient() throws IOException {
        try (SocketChannel bad = SocketChannel.open(address);
             SocketChannel good = SocketChannel.open(address)) {
            Connection badConnection = new Connection(bad);
            send(bad, "$5\r\nabc\r\n:1\r\n");
            RespData reply = badConnection.readFrame().orElseThrow();
            assertTrue(reply instanceof RespError, reply.toString());
            assertEquals(Optional.empty(), badConnection.readFrame());

            send(good, command("SET", "still", "alive"));
            assertEquals(RespSimpleString.withUTF8("OK"), new Connection(good).readFrame().orElseThrow());
        }
    }

    @Test
    void shutdownClosesQueuedClients() throws IOException {
        ScriptedChannel queued = ScriptedChannel.of(command("GET", "k"));
        KeyValueEngine engine = new KeyValueEngine(ShardedStore.create(1));
        ExecutorService executorService = mock(ExecutorService.class);
        when(executorService.shutdownNow()).thenReturn(List.of(new ClientHandler(new Connection(queued), "queued", engine)));

        KeyValueServer other = KeyValueServer.builder()
                .socketAddress(new InetSocketAddress("127.0.0.1", 0))
                .keyValueEngine(engine)
                .executorService(executorService)
                .build();
        other.start();
        other.shutdown();

        assertFalse(queued.isOpen());
        assertEquals("", queued.writtenString());
        assertEquals(0, queued.getReads());
    }

    @Test
    void startTwice() {
        assertThrows(IllegalStateException.class, server::start);
    }

    private static String command(String... args) {
        StringBuilder sb = new StringBuilder("*").append(args.length).append("\r\n");
        for (String arg : args) {
            sb.append('$').append(arg.getBytes(StandardCharsets.UTF_8).length).append("\r\n").append(arg).append("\r\n");
        }
        return sb.toString();
    }

    private static void send(SocketChannel client, String s) throws IOException {
        ByteBuffer buf = ByteBuffer.wrap(s.getBytes(StandardCharsets.UTF_8));
        while (buf.hasRemaining()) {
            client.write(buf);
        }
    }

    private static String receive(SocketChannel client, int n) throws IOException {
        ByteBuffer dst = ByteBuffer.allocate(n);
        while (dst.hasRemaining()) {
            if (client.read(dst) == -1) {
                throw new IllegalStateException("server closed connection");
            }
        }
        return new String(dst.array(), StandardCharsets.UTF_8);
    }
}
