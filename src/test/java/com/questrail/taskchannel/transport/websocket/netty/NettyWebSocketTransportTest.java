package com.questrail.taskchannel.transport.websocket.netty;

import com.questrail.taskchannel.transport.ChannelTransportListener;
import com.questrail.taskchannel.transport.TransportConnection;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyWebSocketTransportTest
 * -----------------------------------------------------------------------------
 * Exercises the Netty adapter against an in-process Netty WebSocket echo server
 * on the loopback interface.
 */
class NettyWebSocketTransportTest {

    private static final String CLOSE_COMMAND = "close-me";
    private static final int SERVER_CLOSE_CODE = 4001;

    private EventLoopGroup serverGroup;
    private Channel serverChannel;
    private NettyWebSocketTransport transport;

    @BeforeEach
    void setUp() throws InterruptedException {
        serverGroup = new NioEventLoopGroup(1);
        serverChannel = new ServerBootstrap()
                .group(serverGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new HttpServerCodec());
                        ch.pipeline().addLast(new HttpObjectAggregator(65536));
                        ch.pipeline().addLast(new WebSocketServerProtocolHandler("/ws"));
                        ch.pipeline().addLast(new EchoHandler());
                    }
                })
                .bind(new InetSocketAddress("127.0.0.1", 0))
                .sync()
                .channel();

        transport = new NettyWebSocketTransport();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        transport.shutdown();
        serverChannel.close().sync();
        serverGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).sync();
    }

    private URI serverUri() {
        int port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        return URI.create("ws://127.0.0.1:" + port + "/ws");
    }

    @Test
    void opensSendsAndReceivesText() throws InterruptedException {
        RecordingListener listener = new RecordingListener();

        TransportConnection connection = transport.open(serverUri(), listener);

        assertTrue(listener.opened.await(5, TimeUnit.SECONDS), "handshake should complete");
        assertTrue(connection.send("{\"type\":\"heartbeat\"}"));
        assertEquals("{\"type\":\"heartbeat\"}", listener.messages.poll(5, TimeUnit.SECONDS));

        connection.close(TransportConnection.NORMAL_CLOSURE, "Client disconnect");
        assertTrue(listener.closed.await(5, TimeUnit.SECONDS), "close should be reported");
        assertFalse(connection.send("late"));
    }

    @Test
    void serverCloseCodeIsReported() throws InterruptedException {
        RecordingListener listener = new RecordingListener();

        TransportConnection connection = transport.open(serverUri(), listener);
        assertTrue(listener.opened.await(5, TimeUnit.SECONDS));

        connection.send(CLOSE_COMMAND);

        assertTrue(listener.closed.await(5, TimeUnit.SECONDS));
        assertEquals(SERVER_CLOSE_CODE, listener.closeCode.get());
        assertEquals(1, listener.closeCount());
    }

    @Test
    void refusedConnectionIsReportedAsAbnormalClose() throws Exception {
        int unusedPort;
        try (ServerSocket probe = new ServerSocket(0)) {
            unusedPort = probe.getLocalPort();
        }
        RecordingListener listener = new RecordingListener();

        transport.open(URI.create("ws://127.0.0.1:" + unusedPort + "/ws"), listener);

        assertTrue(listener.closed.await(5, TimeUnit.SECONDS));
        assertEquals(TransportConnection.ABNORMAL_CLOSURE, listener.closeCode.get());
        assertNotNull(listener.cause.get());
        assertEquals(1, listener.opened.getCount(), "open must not be reported");
    }

    @Test
    void sendBeforeHandshakeIsRefused() {
        RecordingListener listener = new RecordingListener();

        TransportConnection connection = transport.open(serverUri(), listener);

        // The handshake cannot have completed before open() returns on this thread.
        if (listener.opened.getCount() == 1) {
            assertFalse(connection.send("too early"));
        }
        connection.close(TransportConnection.NORMAL_CLOSURE, "abandon");
    }

    @Test
    void rejectsNonWebSocketScheme() {
        assertThrows(IllegalArgumentException.class,
                () -> transport.open(URI.create("http://127.0.0.1/ws"), new RecordingListener()));
    }

    private static final class EchoHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
            String text = frame.text();
            if (CLOSE_COMMAND.equals(text)) {
                ctx.writeAndFlush(new CloseWebSocketFrame(SERVER_CLOSE_CODE, "bye"))
                        .addListener(ChannelFutureListener.CLOSE);
                return;
            }
            ctx.writeAndFlush(new TextWebSocketFrame(text));
        }
    }

    private static final class RecordingListener implements ChannelTransportListener {
        private final CountDownLatch opened = new CountDownLatch(1);
        private final CountDownLatch closed = new CountDownLatch(1);
        private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
        private final AtomicReference<Integer> closeCode = new AtomicReference<>();
        private final AtomicReference<Throwable> cause = new AtomicReference<>();
        private volatile int closeCount;

        @Override
        public void onOpen(TransportConnection connection) {
            opened.countDown();
        }

        @Override
        public void onMessage(String payload) {
            messages.add(payload);
        }

        @Override
        public synchronized void onClose(int code, String reason, Throwable failure) {
            closeCount++;
            closeCode.set(code);
            cause.set(failure);
            closed.countDown();
        }

        synchronized int closeCount() {
            return closeCount;
        }
    }
}
