package com.questrail.phoenix.transport.netty;

import com.questrail.phoenix.transport.SocketTransport;
import com.questrail.phoenix.transport.SocketTransportListener;
import com.questrail.phoenix.transport.TransportState;

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
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketCloseStatus;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.util.concurrent.ScheduledFuture;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * NettyWebSocketTransport
 * =============================================================================
 * Netty-backed implementation of the {@link SocketTransport} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT decode
 * envelopes, send heartbeats, or reconnect.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, frames) MUST NOT
 * escape this package. Inbound text frames are surfaced as {@code String}.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   CLOSED --open()--> CONNECTING --handshake--> OPEN --close()--> CLOSING --> CLOSED
 *                          |                      |
 *                          +------ failure -------+--> CLOSED (didError or didClose)
 * </pre>
 * Each instance connects at most once at a time. The listener hears exactly one
 * loss notification per connection: {@code didError} for failures,
 * {@code didClose} for orderly or remote closes.
 */
public final class NettyWebSocketTransport implements SocketTransport
{
    private static final int MAX_HANDSHAKE_RESPONSE_BYTES = 8192;

    private final EventLoopGroup group;
    private final Duration connectTimeout;
    private final int maxFramePayloadLength;

    private final AtomicReference<TransportState> state = new AtomicReference<>(TransportState.CLOSED);
    private final AtomicBoolean lossReported = new AtomicBoolean(false);

    private volatile SocketTransportListener listener;
    private volatile URI url;
    private volatile Channel channel;

    private volatile int closeCode = -1;
    private volatile String closeReason = "";
    private volatile boolean closeFrameReceived;

    /**
     * @param group                 event loop shared with other transports; not owned
     * @param connectTimeout        limit for the TCP connect and, separately, for the upgrade handshake
     * @param maxFramePayloadLength largest inbound (aggregated) text message accepted
     */
    public NettyWebSocketTransport(EventLoopGroup group, Duration connectTimeout, int maxFramePayloadLength)
    {
        this.group = Objects.requireNonNull(group, "group");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (maxFramePayloadLength <= 0) {
            throw new IllegalArgumentException("maxFramePayloadLength must be > 0");
        }
        this.maxFramePayloadLength = maxFramePayloadLength;
    }

    @Override
    public void setListener(SocketTransportListener listener)
    {
        this.listener = listener;
    }

    @Override
    public void setUrl(URI url)
    {
        this.url = Objects.requireNonNull(url, "url");
    }

    @Override
    public TransportState state()
    {
        return state.get();
    }

    @Override
    public void open()
    {
        URI target = url;
        if (target == null) {
            throw new IllegalStateException("URL must be set before open()");
        }
        if (!state.compareAndSet(TransportState.CLOSED, TransportState.CONNECTING)) {
            throw new IllegalStateException("Transport is already " + state.get());
        }

        lossReported.set(false);
        closeCode = -1;
        closeReason = "";
        closeFrameReceived = false;

        String scheme = target.getScheme() == null ? "" : target.getScheme().toLowerCase();
        boolean secure = scheme.equals("wss");
        if (!secure && !scheme.equals("ws")) {
            reportError("Unsupported URL scheme: " + target);
            return;
        }

        final SslContext sslContext;
        try {
            sslContext = secure ? SslContextBuilder.forClient().build() : null;
        } catch (SSLException e) {
            reportError("TLS setup failed: " + describe(e));
            return;
        }

        String host = target.getHost();
        int port = target.getPort() != -1 ? target.getPort() : (secure ? 443 : 80);

        WebSocketClientHandshaker handshaker = WebSocketClientHandshakerFactory.newHandshaker(
                target, WebSocketVersion.V13, null, true, new DefaultHttpHeaders(), maxFramePayloadLength);

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_HANDSHAKE_RESPONSE_BYTES));
                        p.addLast(new WebSocketFrameAggregator(maxFramePayloadLength));
                        p.addLast(new InboundHandler(handshaker));
                    }
                });

        ChannelFuture connect = bootstrap.connect(host, port);
        channel = connect.channel();
        connect.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                reportError("Connect to " + host + ":" + port + " failed: " + describe(future.cause()));
            }
        });
    }

    @Override
    public void close()
    {
        Channel ch = channel;
        TransportState current = state.get();
        if (ch == null || current == TransportState.CLOSED) {
            state.set(TransportState.CLOSED);
            return;
        }

        state.set(TransportState.CLOSING);
        if (current == TransportState.OPEN && ch.isActive()) {
            ch.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                    .addListener(ChannelFutureListener.CLOSE);
        } else {
            ch.close();
        }
    }

    @Override
    public void send(String text)
    {
        Objects.requireNonNull(text, "text");

        Channel ch = channel;
        TransportState current = state.get();
        if (ch == null || current != TransportState.OPEN) {
            throw new IllegalStateException("Transport is not open (state=" + current + ")");
        }

        // Write failures surface through exceptionCaught and end the connection.
        ch.writeAndFlush(new TextWebSocketFrame(text))
                .addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    private void reportError(String message)
    {
        state.set(TransportState.CLOSED);
        if (!lossReported.compareAndSet(false, true)) {
            return;
        }
        SocketTransportListener l = listener;
        if (l != null) {
            l.didError(message);
        }
    }

    private void reportClose()
    {
        state.set(TransportState.CLOSED);
        if (!lossReported.compareAndSet(false, true)) {
            return;
        }
        SocketTransportListener l = listener;
        if (l != null) {
            l.didClose(closeCode, closeReason, closeFrameReceived);
        }
    }

    private static String describe(Throwable cause)
    {
        if (cause == null) {
            return "unknown";
        }
        String message = cause.getMessage();
        return message == null || message.isEmpty() ? cause.getClass().getSimpleName() : message;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Completes the opening handshake, then forwards text frames to the port
     * listener and answers pings and close frames.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<Object>
    {
        private final WebSocketClientHandshaker handshaker;
        private ScheduledFuture<?> handshakeTimeout;

        private InboundHandler(WebSocketClientHandshaker handshaker)
        {
            this.handshaker = handshaker;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx)
        {
            handshaker.handshake(ctx.channel());
            // CONNECT_TIMEOUT_MILLIS covers TCP only; the upgrade reply gets the same budget.
            handshakeTimeout = ctx.executor().schedule(() -> {
                if (!handshaker.isHandshakeComplete()) {
                    reportError("Handshake timed out after " + connectTimeout.toMillis() + " ms");
                    ctx.close();
                }
            }, connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg)
        {
            if (!handshaker.isHandshakeComplete()) {
                try {
                    handshaker.finishHandshake(ctx.channel(), (FullHttpResponse) msg);
                } catch (WebSocketHandshakeException e) {
                    reportError("Handshake rejected: " + describe(e));
                    ctx.close();
                    return;
                }
                cancelHandshakeTimeout();
                if (state.compareAndSet(TransportState.CONNECTING, TransportState.OPEN)) {
                    SocketTransportListener l = listener;
                    if (l != null) {
                        l.didOpen();
                    }
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                throw new IllegalStateException("Unexpected HTTP response after handshake (status=" + response.status() + ")");
            }

            if (msg instanceof TextWebSocketFrame text) {
                SocketTransportListener l = listener;
                if (l != null) {
                    l.didReceive(text.text());
                }
            } else if (msg instanceof PingWebSocketFrame ping) {
                ctx.writeAndFlush(new PongWebSocketFrame(ping.content().retain()));
            } else if (msg instanceof CloseWebSocketFrame close) {
                closeFrameReceived = true;
                closeCode = close.statusCode();
                closeReason = close.reasonText() == null ? "" : close.reasonText();
                if (state.get() == TransportState.CLOSING) {
                    // We initiated; this is the server's echo.
                    ctx.close();
                } else {
                    state.set(TransportState.CLOSING);
                    ctx.writeAndFlush(new CloseWebSocketFrame(WebSocketCloseStatus.NORMAL_CLOSURE))
                            .addListener(ChannelFutureListener.CLOSE);
                }
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            cancelHandshakeTimeout();
            reportClose();
        }

        private void cancelHandshakeTimeout()
        {
            if (handshakeTimeout != null) {
                handshakeTimeout.cancel(false);
                handshakeTimeout = null;
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            reportError(describe(cause));
            ctx.close();
        }
    }
}
