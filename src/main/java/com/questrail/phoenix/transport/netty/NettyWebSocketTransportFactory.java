package com.questrail.phoenix.transport.netty;

import com.questrail.phoenix.config.PhoenixSocketConfig;
import com.questrail.phoenix.transport.SocketTransport;
import com.questrail.phoenix.transport.SocketTransportFactory;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Default {@link SocketTransportFactory}: every transport it creates shares one
 * Netty event loop owned by the factory.
 *
 * <p>One IO thread is enough for a single socket; the socket keeps at most one
 * live transport. Call {@link #close()} to release the event loop.</p>
 */
public final class NettyWebSocketTransportFactory implements SocketTransportFactory, AutoCloseable
{
    private final EventLoopGroup group;
    private final Duration connectTimeout;
    private final int maxFramePayloadLength;

    public NettyWebSocketTransportFactory()
    {
        this(PhoenixSocketConfig.DEFAULT_CONNECT_TIMEOUT, PhoenixSocketConfig.DEFAULT_MAX_FRAME_PAYLOAD_LENGTH);
    }

    public NettyWebSocketTransportFactory(Duration connectTimeout, int maxFramePayloadLength)
    {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.maxFramePayloadLength = maxFramePayloadLength;
        this.group = new NioEventLoopGroup(1, r -> {
            Thread t = new Thread(r, "phoenix-netty-io");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public SocketTransport create()
    {
        return new NettyWebSocketTransport(group, connectTimeout, maxFramePayloadLength);
    }

    @Override
    public void close()
    {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }
}
