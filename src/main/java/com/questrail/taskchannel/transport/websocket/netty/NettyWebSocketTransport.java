package com.questrail.taskchannel.transport.websocket.netty;

import com.questrail.taskchannel.transport.ChannelTransport;
import com.questrail.taskchannel.transport.ChannelTransportListener;
import com.questrail.taskchannel.transport.TransportConnection;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketTransport
 * =============================================================================
 * Netty-backed implementation of the {@link ChannelTransport} port for {@code ws://}
 * and {@code wss://} endpoints.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT parse JSON,
 * interpret frame types, reconnect, or schedule heartbeats.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code WebSocketFrame})
 * MUST NOT escape this package. Inbound text frames are surfaced as {@code String}
 * and reference-counted frames are released by {@link SimpleChannelInboundHandler}.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #open} connects asynchronously and reports {@code onOpen} once the
 *       WebSocket handshake completes.</li>
 *   <li>Connect failures, handshake failures and socket loss are all reported through
 *       a single {@code onClose} per connection.</li>
 *   <li>{@link #shutdown()} releases the event loop group.</li>
 * </ul>
 */
public final class NettyWebSocketTransport implements ChannelTransport
{
    private static final int MAX_FRAME_PAYLOAD = 1 << 20;
    private static final int MAX_HANDSHAKE_RESPONSE = 8192;

    private final EventLoopGroup group;
    private final Duration connectTimeout;

    /**
     * Construct a transport with its own single-threaded event loop group.
     *
     * <p>One I/O thread is enough: a channel holds at most one connection at a time.</p>
     */
    public NettyWebSocketTransport(Duration connectTimeout)
    {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        this.group = new NioEventLoopGroup(1);
    }

    public NettyWebSocketTransport()
    {
        this(Duration.ofSeconds(10));
    }

    @Override
    public TransportConnection open(URI uri, ChannelTransportListener listener)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(listener, "listener");

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        boolean secure = "wss".equals(scheme);
        if (!secure && !"ws".equals(scheme)) {
            throw new IllegalArgumentException("Unsupported WebSocket scheme: " + uri.getScheme());
        }

        String host = uri.getHost();
        if (host == null) {
            throw new IllegalArgumentException("WebSocket URI has no host: " + uri);
        }
        int port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
        SslContext sslContext = secure ? clientSslContext() : null;

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                uri, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), MAX_FRAME_PAYLOAD);

        NettyConnection connection = new NettyConnection(listener);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_RESPONSE));
                        // handleCloseFrames=false so the close code reaches FrameHandler.
                        p.addLast(new WebSocketClientProtocolHandler(handshaker, false));
                        p.addLast(connection.new FrameHandler());
                    }
                });

        connection.attach(bootstrap.connect(host, port));
        return connection;
    }

    /**
     * Release the event loop group. Open connections are closed abruptly.
     */
    public void shutdown()
    {
        group.shutdownGracefully();
    }

    private static SslContext clientSslContext()
    {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to initialise TLS for wss transport", e);
        }
    }

    /**
     * One WebSocket connection. All state changes after {@link #attach} happen on the
     * channel's event loop, except the caller-driven {@link #send} and {@link #close}.
     */
    private static final class NettyConnection implements TransportConnection
    {
        private final ChannelTransportListener listener;
        private final AtomicBoolean closeReported = new AtomicBoolean(false);

        private volatile Channel channel;
        private volatile boolean handshakeComplete;
        private volatile boolean closeRequested;
        private volatile int closeCode = ABNORMAL_CLOSURE;
        private volatile String closeReason = "";
        private volatile Throwable failure;

        private NettyConnection(ChannelTransportListener listener)
        {
            this.listener = listener;
        }

        private void attach(ChannelFuture connectFuture)
        {
            channel = connectFuture.channel();
            connectFuture.addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    reportClosed(ABNORMAL_CLOSURE, "Connect failed", future.cause());
                }
                else if (closeRequested) {
                    future.channel().close();
                }
            });
        }

        @Override
        public boolean send(String payload)
        {
            Objects.requireNonNull(payload, "payload");

            Channel ch = channel;
            if (!handshakeComplete || closeRequested || ch == null || !ch.isActive()) {
                return false;
            }
            // A failed write surfaces through exceptionCaught and closes the channel.
            ch.writeAndFlush(new TextWebSocketFrame(payload))
                    .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
            return true;
        }

        @Override
        public void close(int code, String reason)
        {
            if (closeRequested) {
                return;
            }
            closeRequested = true;

            Channel ch = channel;
            if (ch == null) {
                return;
            }
            if (handshakeComplete && ch.isActive()) {
                ch.writeAndFlush(new CloseWebSocketFrame(code, reason == null ? "" : reason))
                        .addListener(ChannelFutureListener.CLOSE);
            }
            else {
                ch.close();
            }
        }

        private void reportClosed(int code, String reason, Throwable cause)
        {
            if (closeReported.compareAndSet(false, true)) {
                listener.onClose(code, reason, cause);
            }
        }

        /**
         * Receives decoded WebSocket frames and handshake events, forwarding text payloads
         * to the port listener.
         */
        private final class FrameHandler extends SimpleChannelInboundHandler<WebSocketFrame>
        {
            @Override
            public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
            {
                if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                    handshakeComplete = true;
                    if (closeRequested) {
                        ctx.close();
                    }
                    else {
                        listener.onOpen(NettyConnection.this);
                    }
                    return;
                }
                if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                    failure = new TimeoutException("WebSocket handshake timed out");
                    ctx.close();
                    return;
                }
                super.userEventTriggered(ctx, evt);
            }

            @Override
            protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
            {
                if (frame instanceof TextWebSocketFrame text) {
                    if (!closeRequested) {
                        listener.onMessage(text.text());
                    }
                }
                else if (frame instanceof CloseWebSocketFrame close) {
                    closeCode = close.statusCode() == -1 ? NORMAL_CLOSURE : close.statusCode();
                    closeReason = close.reasonText();
                    ctx.close();
                }
                // Binary and continuation frames carry nothing this protocol uses.
            }

            @Override
            public void channelInactive(ChannelHandlerContext ctx) throws Exception
            {
                reportClosed(closeCode, closeReason, failure);
                super.channelInactive(ctx);
            }

            @Override
            public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
            {
                failure = cause;
                ctx.close();
            }
        }
    }
}
